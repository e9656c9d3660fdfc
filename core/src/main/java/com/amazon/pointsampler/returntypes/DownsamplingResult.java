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

package com.amazon.pointsampler.returntypes;

import java.util.List;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import com.amazon.pointsampler.Point;
import com.amazon.pointsampler.config.SamplingStrategy;

/**
 * The points prepared for display together with a summary of what the
 * downsampling step did.
 */
@Getter
@Builder
@ToString(exclude = "points")
public class DownsamplingResult {

    /**
     * The points to display; the original list when nothing was removed.
     */
    private final List<Point> points;

    private final int totalPoints;

    private final boolean downsamplingApplied;

    /**
     * The strategy used, or the configured one if downsampling was not needed.
     */
    private final SamplingStrategy strategy;

    private final long elapsedMillis;

    public int getDisplayedPoints() {
        return points.size();
    }

    public int getRemovedPoints() {
        return totalPoints - points.size();
    }

    /**
     * @return the fraction of the input that is displayed, in [0, 1]
     */
    public double getRetainedFraction() {
        return (totalPoints == 0) ? 1.0 : points.size() / (double) totalPoints;
    }
}
