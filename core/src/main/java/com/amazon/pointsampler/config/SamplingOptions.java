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

import java.time.Duration;
import java.util.Optional;

import lombok.Getter;
import lombok.ToString;

/**
 * Tuning parameters for the sampling strategies. Each strategy reads only the
 * fields that concern it; the rest are ignored. Instances are immutable and
 * can be shared between concurrent calls.
 */
@Getter
@ToString
public class SamplingOptions {

    /**
     * Default number of nearest neighbors used to measure local roughness.
     */
    public static final int DEFAULT_K = 12;

    /**
     * Default number of grid cells per axis of the importance neighbor index.
     */
    public static final int DEFAULT_GRID_RESOLUTION = 50;

    /**
     * Default exponent applied to importance weights; larger values favor rough
     * areas more strongly.
     */
    public static final double DEFAULT_IMPORTANCE_EXPONENT = 2.0;

    /**
     * Default offset added to every importance score so that flat areas keep a
     * nonzero chance of being drawn.
     */
    public static final double DEFAULT_EPSILON = 0.001;

    /**
     * Default number of candidates tried around an active Poisson sample before
     * it is retired.
     */
    public static final int DEFAULT_MAX_ATTEMPTS_PER_ACTIVE_POINT = 30;

    /**
     * Default scale applied to the Poisson minimum distance.
     */
    public static final double DEFAULT_DISTANCE_MULTIPLIER = 1.0;

    private static final SamplingOptions DEFAULTS = builder().build();

    private final int k;

    private final int gridResolution;

    private final double importanceExponent;

    private final double epsilon;

    private final int maxAttemptsPerActivePoint;

    private final double distanceMultiplier;

    private final Optional<Long> randomSeed;

    private final Optional<Duration> timeout;

    protected SamplingOptions(Builder<?> builder) {
        checkArgument(builder.k > 0, "k must be greater than 0");
        checkArgument(builder.gridResolution > 0, "gridResolution must be greater than 0");
        checkArgument(builder.importanceExponent >= 0 && Double.isFinite(builder.importanceExponent),
                "importanceExponent must be finite and non-negative");
        checkArgument(builder.epsilon > 0 && Double.isFinite(builder.epsilon), "epsilon must be finite and positive");
        checkArgument(builder.maxAttemptsPerActivePoint > 0, "maxAttemptsPerActivePoint must be greater than 0");
        checkArgument(builder.distanceMultiplier > 0 && Double.isFinite(builder.distanceMultiplier),
                "distanceMultiplier must be finite and positive");
        builder.timeout.ifPresent(
                t -> checkArgument(!t.isNegative() && !t.isZero(), "timeout must be a positive duration"));

        k = builder.k;
        gridResolution = builder.gridResolution;
        importanceExponent = builder.importanceExponent;
        epsilon = builder.epsilon;
        maxAttemptsPerActivePoint = builder.maxAttemptsPerActivePoint;
        distanceMultiplier = builder.distanceMultiplier;
        randomSeed = builder.randomSeed;
        timeout = builder.timeout;
    }

    /**
     * @return a new SamplingOptions builder.
     */
    public static Builder<?> builder() {
        return new Builder<>();
    }

    /**
     * @return options with every field at its default value
     */
    public static SamplingOptions defaults() {
        return DEFAULTS;
    }

    /**
     * @return a builder initialized from this instance
     */
    public Builder<?> toBuilder() {
        Builder<?> builder = builder().k(k).gridResolution(gridResolution).importanceExponent(importanceExponent)
                .epsilon(epsilon).maxAttemptsPerActivePoint(maxAttemptsPerActivePoint)
                .distanceMultiplier(distanceMultiplier);
        randomSeed.ifPresent(builder::randomSeed);
        timeout.ifPresent(builder::timeout);
        return builder;
    }

    public static class Builder<T extends Builder<T>> {

        private int k = DEFAULT_K;
        private int gridResolution = DEFAULT_GRID_RESOLUTION;
        private double importanceExponent = DEFAULT_IMPORTANCE_EXPONENT;
        private double epsilon = DEFAULT_EPSILON;
        private int maxAttemptsPerActivePoint = DEFAULT_MAX_ATTEMPTS_PER_ACTIVE_POINT;
        private double distanceMultiplier = DEFAULT_DISTANCE_MULTIPLIER;
        private Optional<Long> randomSeed = Optional.empty();
        private Optional<Duration> timeout = Optional.empty();

        public T k(int k) {
            this.k = k;
            return (T) this;
        }

        public T gridResolution(int gridResolution) {
            this.gridResolution = gridResolution;
            return (T) this;
        }

        public T importanceExponent(double importanceExponent) {
            this.importanceExponent = importanceExponent;
            return (T) this;
        }

        public T epsilon(double epsilon) {
            this.epsilon = epsilon;
            return (T) this;
        }

        public T maxAttemptsPerActivePoint(int maxAttemptsPerActivePoint) {
            this.maxAttemptsPerActivePoint = maxAttemptsPerActivePoint;
            return (T) this;
        }

        public T distanceMultiplier(double distanceMultiplier) {
            this.distanceMultiplier = distanceMultiplier;
            return (T) this;
        }

        public T randomSeed(long randomSeed) {
            this.randomSeed = Optional.of(randomSeed);
            return (T) this;
        }

        public T timeout(Duration timeout) {
            this.timeout = Optional.of(checkNotNull(timeout, "timeout must not be null"));
            return (T) this;
        }

        public SamplingOptions build() {
            return new SamplingOptions(this);
        }
    }
}
