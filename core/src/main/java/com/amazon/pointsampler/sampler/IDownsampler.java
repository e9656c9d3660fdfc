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

package com.amazon.pointsampler.sampler;

import java.util.List;

import com.amazon.pointsampler.Point;
import com.amazon.pointsampler.config.SamplingStrategy;
import com.amazon.pointsampler.executor.SamplingContext;

/**
 * A strategy that reduces a point list to a representative subset.
 * Implementations keep no state between calls.
 */
public interface IDownsampler {

    /**
     * Selects at most {@code targetCount} points of the input. Every returned
     * point is an element of {@code points}; no input element is returned twice.
     * If the input already has at most {@code targetCount} points it is returned
     * as is. A strategy may return fewer points than requested.
     *
     * @param points      a non-empty point list
     * @param targetCount the desired number of points, positive
     * @param context     the random number generator and deadline of this call
     * @return the selected points
     */
    List<Point> sample(List<Point> points, int targetCount, SamplingContext context);

    /**
     * @return the strategy this sampler implements
     */
    SamplingStrategy getStrategy();
}
