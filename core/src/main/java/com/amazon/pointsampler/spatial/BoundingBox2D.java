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

import static com.amazon.pointsampler.CommonUtils.checkArgument;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * The axis-aligned extent of a point set in the XY plane. A box may be
 * degenerate: a single point, or points sharing an X or Y coordinate, give a
 * zero range on that axis.
 */
@Getter
@EqualsAndHashCode
@ToString
public class BoundingBox2D {

    private final double minX;

    private final double maxX;

    private final double minY;

    private final double maxY;

    public BoundingBox2D(double minX, double maxX, double minY, double maxY) {
        checkArgument(minX <= maxX, "minX must not exceed maxX");
        checkArgument(minY <= maxY, "minY must not exceed maxY");
        this.minX = minX;
        this.maxX = maxX;
        this.minY = minY;
        this.maxY = maxY;
    }

    public double getRangeX() {
        return maxX - minX;
    }

    public double getRangeY() {
        return maxY - minY;
    }

    public double getMaxRange() {
        return Math.max(getRangeX(), getRangeY());
    }

    public double getArea() {
        return getRangeX() * getRangeY();
    }

    public boolean isDegenerate() {
        return getArea() <= 0;
    }

    public boolean contains(double x, double y) {
        return x >= minX && x <= maxX && y >= minY && y <= maxY;
    }

    /**
     * @param paddingX amount added on both sides in X
     * @param paddingY amount added on both sides in Y
     * @return a new box grown by the given amounts
     */
    public BoundingBox2D expand(double paddingX, double paddingY) {
        checkArgument(paddingX >= 0 && paddingY >= 0, "padding must be non-negative");
        return new BoundingBox2D(minX - paddingX, maxX + paddingX, minY - paddingY, maxY + paddingY);
    }
}
