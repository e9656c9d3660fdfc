/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.pointsampler.spatial;

import static com.amazon.pointsampler.CommonUtils.checkNotNull;

import java.util.List;

import com.amazon.pointsampler.EmptyInputException;
import com.amazon.pointsampler.Point;

/**
 * Computes the XY extent of a point list in a single pass.
 */
public class BoundingBoxComputer {

    private BoundingBoxComputer() {
    }

    public static BoundingBox2D compute(List<Point> points) {
        checkNotNull(points, "points must not be null");
        if (points.isEmpty()) {
            throw new EmptyInputException();
        }
        double minX = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY;
        double minY = Double.POSITIVE_INFINITY;
        double maxY = Double.NEGATIVE_INFINITY;
        for (Point point : points) {
            minX = Math.min(minX, point.getX());
            maxX = Math.max(maxX, point.getX());
            minY = Math.min(minY, point.getY());
            maxY = Math.max(maxY, point.getY());
        }
        return new BoundingBox2D(minX, maxX, minY, maxY);
    }
}
