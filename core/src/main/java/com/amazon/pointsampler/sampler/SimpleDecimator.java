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

import static com.amazon.pointsampler.CommonUtils.checkSamplingArguments;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.pointsampler.Point;
import com.amazon.pointsampler.config.SamplingStrategy;
import com.amazon.pointsampler.executor.SamplingContext;

/**
 * Keeps the points at indices {@code 0, stride, 2 * stride, ...} where
 * {@code stride = ceil(n / targetCount)}. The result preserves input order and
 * does not depend on the random generator.
 */
public class SimpleDecimator implements IDownsampler {

    private static final Logger LOGGER = LoggerFactory.getLogger(SimpleDecimator.class);

    public static int stride(int size, int targetCount) {
        return (int) (((long) size + targetCount - 1) / targetCount);
    }

    @Override
    public List<Point> sample(List<Point> points, int targetCount, SamplingContext context) {
        checkSamplingArguments(points, targetCount);
        if (points.size() <= targetCount) {
            return points;
        }
        int stride = stride(points.size(), targetCount);
        LOGGER.debug("Decimating {} points to {} with stride {}", points.size(), targetCount, stride);
        List<Point> result = new ArrayList<>(points.size() / stride + 1);
        for (int i = 0; i < points.size(); i += stride) {
            result.add(points.get(i));
        }
        LOGGER.debug("Decimation kept {} points", result.size());
        return result;
    }

    @Override
    public SamplingStrategy getStrategy() {
        return SamplingStrategy.SIMPLE;
    }
}
