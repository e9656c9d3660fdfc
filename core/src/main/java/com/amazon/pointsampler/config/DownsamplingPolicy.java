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

package com.amazon.pointsampler.config;

import static com.amazon.pointsampler.CommonUtils.checkArgument;
import static com.amazon.pointsampler.CommonUtils.checkNotNull;

import java.util.List;
import java.util.Locale;

import lombok.Getter;
import lombok.ToString;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.pointsampler.EmptyInputException;
import com.amazon.pointsampler.Point;
import com.amazon.pointsampler.SamplingOrchestrator;
import com.amazon.pointsampler.executor.SamplingContext;
import com.amazon.pointsampler.returntypes.DownsamplingResult;

/**
 * Decides whether a freshly loaded point cloud is reduced before display, and
 * how. Downsampling happens only when it is enabled and the cloud has more than
 * {@code maxDisplayPoints} points; the cloud is then sampled down to
 * {@code maxDisplayPoints} with the configured strategy.
 */
@Getter
@ToString
public class DownsamplingPolicy {

    private static final Logger LOGGER = LoggerFactory.getLogger(DownsamplingPolicy.class);

    public static final boolean DEFAULT_ENABLED = false;

    public static final int DEFAULT_MAX_DISPLAY_POINTS = 2_500_000;

    public static final SamplingStrategy DEFAULT_STRATEGY = SamplingStrategy.SIMPLE;

    private final boolean enabled;

    private final int maxDisplayPoints;

    private final SamplingStrategy strategy;

    private final SamplingOptions options;

    protected DownsamplingPolicy(Builder<?> builder) {
        checkArgument(builder.maxDisplayPoints > 0, "maxDisplayPoints must be greater than 0");
        checkNotNull(builder.strategy, "strategy must not be null");
        checkNotNull(builder.options, "options must not be null");
        enabled = builder.enabled;
        maxDisplayPoints = builder.maxDisplayPoints;
        strategy = builder.strategy;
        options = builder.options;
    }

    public static Builder<?> builder() {
        return new Builder<>();
    }

    public DownsamplingResult apply(List<Point> points) {
        return apply(points, SamplingContext.from(options));
    }

    /**
     * @param points  a non-empty point cloud
     * @param context random generator and deadline used if sampling is needed
     * @return the points to display and a summary
     */
    public DownsamplingResult apply(List<Point> points, SamplingContext context) {
        checkNotNull(points, "points must not be null");
        checkNotNull(context, "context must not be null");
        if (points.isEmpty()) {
            throw new EmptyInputException();
        }

        if (!enabled || points.size() <= maxDisplayPoints) {
            LOGGER.info("No downsampling applied, keeping all {} points", points.size());
            return DownsamplingResult.builder().points(points).totalPoints(points.size())
                    .downsamplingApplied(false).strategy(strategy).elapsedMillis(0).build();
        }

        long start = System.currentTimeMillis();
        List<Point> sampled = SamplingOrchestrator.sample(points, maxDisplayPoints, strategy, options, context);
        DownsamplingResult result = DownsamplingResult.builder().points(sampled).totalPoints(points.size())
                .downsamplingApplied(true).strategy(strategy).elapsedMillis(System.currentTimeMillis() - start)
                .build();
        LOGGER.info("{} downsampling kept {} of {} points ({}% retained, {} removed) in {} ms", strategy,
                result.getDisplayedPoints(), result.getTotalPoints(),
                String.format(Locale.ROOT, "%.1f", 100 * result.getRetainedFraction()), result.getRemovedPoints(),
                result.getElapsedMillis());
        return result;
    }

    public static class Builder<T extends Builder<T>> {

        private boolean enabled = DEFAULT_ENABLED;
        private int maxDisplayPoints = DEFAULT_MAX_DISPLAY_POINTS;
        private SamplingStrategy strategy = DEFAULT_STRATEGY;
        private SamplingOptions options = SamplingOptions.defaults();

        public T enabled(boolean enabled) {
            this.enabled = enabled;
            return (T) this;
        }

        public T maxDisplayPoints(int maxDisplayPoints) {
            this.maxDisplayPoints = maxDisplayPoints;
            return (T) this;
        }

        public T strategy(SamplingStrategy strategy) {
            this.strategy = strategy;
            return (T) this;
        }

        /**
         * Selects the strategy by name, see {@link SamplingStrategy#fromName}.
         */
        public T strategyName(String name) {
            this.strategy = SamplingStrategy.fromName(name);
            return (T) this;
        }

        public T options(SamplingOptions options) {
            this.options = options;
            return (T) this;
        }

        public DownsamplingPolicy build() {
            return new DownsamplingPolicy(this);
        }
    }
}
