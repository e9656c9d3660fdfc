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

package com.amazon.pointsampler;

import static com.amazon.pointsampler.CommonUtils.checkNotNull;
import static com.amazon.pointsampler.CommonUtils.checkSamplingArguments;

import java.util.ArrayList;
import java.util.List;
import java.util.RandomAccess;

import com.amazon.pointsampler.config.SamplingOptions;
import com.amazon.pointsampler.config.SamplingStrategy;
import com.amazon.pointsampler.executor.SamplingContext;
import com.amazon.pointsampler.sampler.IDownsampler;
import com.amazon.pointsampler.sampler.ImportanceSampler;
import com.amazon.pointsampler.sampler.PoissonDiskSampler;
import com.amazon.pointsampler.sampler.SimpleDecimator;

/**
 * Entry point of the downsampling engine. Validates the request, returns the
 * input unchanged when it is already small enough, and otherwise hands it to
 * the sampler of the requested strategy.
 *
 * <pre>
 * List&lt;Point&gt; display = SamplingOrchestrator.sample(points, 100_000, SamplingStrategy.POISSON,
 *         SamplingOptions.builder().randomSeed(42).build());
 * </pre>
 *
 * Every call builds and discards its own indexes, so concurrent calls need no
 * coordination. Calls are CPU bound and may take seconds on large inputs; see
 * {@link com.amazon.pointsampler.executor.AsyncDownsampler} for running them
 * off a request thread.
 */
public class SamplingOrchestrator {

    private SamplingOrchestrator() {
    }

    /**
     * Samples with a context derived from the options' seed and timeout.
     *
     * @param points      a non-empty point list
     * @param targetCount the desired number of points, positive
     * @param strategy    the strategy to apply
     * @param options     strategy parameters
     * @return the input itself when {@code points.size() <= targetCount},
     *         otherwise at most {@code targetCount} elements of the input
     * @throws EmptyInputException         if points is empty
     * @throws InvalidTargetCountException if targetCount is not positive
     * @throws SamplingCancelledException  if the timeout elapses or the thread is
     *                                     interrupted
     */
    public static List<Point> sample(List<Point> points, int targetCount, SamplingStrategy strategy,
            SamplingOptions options) {
        checkNotNull(options, "options must not be null");
        return sample(points, targetCount, strategy, options, SamplingContext.from(options));
    }

    /**
     * Samples with an explicit context, which decides the random generator and
     * deadline; the options' seed and timeout are ignored.
     */
    public static List<Point> sample(List<Point> points, int targetCount, SamplingStrategy strategy,
            SamplingOptions options, SamplingContext context) {
        checkSamplingArguments(points, targetCount);
        checkNotNull(strategy, "strategy must not be null");
        checkNotNull(options, "options must not be null");
        checkNotNull(context, "context must not be null");

        if (points.size() <= targetCount) {
            return points;
        }
        List<Point> input = (points instanceof RandomAccess) ? points : new ArrayList<>(points);
        return downsampler(strategy, options).sample(input, targetCount, context);
    }

    /**
     * @return a new sampler implementing the strategy with the given options
     */
    public static IDownsampler downsampler(SamplingStrategy strategy, SamplingOptions options) {
        checkNotNull(strategy, "strategy must not be null");
        switch (strategy) {
        case IMPORTANCE:
            return new ImportanceSampler(options);
        case POISSON:
            return new PoissonDiskSampler(options);
        case SIMPLE:
        default:
            return new SimpleDecimator();
        }
    }
}
