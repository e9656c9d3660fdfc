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

import static com.amazon.pointsampler.CommonUtils.checkArgument;
import static com.amazon.pointsampler.CommonUtils.checkNotNull;

import java.util.Arrays;
import java.util.Random;

import lombok.Getter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.pointsampler.executor.SamplingContext;
import com.amazon.pointsampler.util.ArrayUtils;

/**
 * <p>
 * Draws a duplicate-free subset of indices with probability proportional to a
 * weight {@code (score + epsilon)^exponent}. Weights are computed as
 * {@code ((score + epsilon) / (1 + epsilon))^exponent}, the same proportions
 * scaled so that the heaviest possible weight is 1 and no exponent overflows.
 * A weight that underflows is raised to {@link #MIN_WEIGHT}, so the total stays
 * positive and every index keeps a place in the ranking.
 * </p>
 * <p>
 * Draws invert the cumulative distribution of the normalized weights with a
 * binary search. An index drawn twice is rejected, so the draw is repeated at
 * most {@code targetCount * ATTEMPTS_MULTIPLIER} times; if that budget runs out
 * the remaining slots are filled with the heaviest indices not yet chosen. When
 * the target is at least {@code GREEDY_FRACTION} of the input, rejections would
 * dominate, and the heaviest {@code targetCount} indices are returned directly.
 * </p>
 */
public class WeightedSampler {

    private static final Logger LOGGER = LoggerFactory.getLogger(WeightedSampler.class);

    /**
     * Targets at or above this fraction of the input skip random drawing.
     */
    public static final double GREEDY_FRACTION = 0.8;

    /**
     * Number of draws allowed per requested index.
     */
    public static final int ATTEMPTS_MULTIPLIER = 20;

    /**
     * Smallest weight handed out.
     */
    public static final double MIN_WEIGHT = Double.MIN_NORMAL;

    @Getter
    private final double exponent;

    @Getter
    private final double epsilon;

    public WeightedSampler(double exponent, double epsilon) {
        checkArgument(exponent >= 0 && Double.isFinite(exponent), "exponent must be finite and non-negative");
        checkArgument(epsilon > 0 && Double.isFinite(epsilon), "epsilon must be finite and positive");
        this.exponent = exponent;
        this.epsilon = epsilon;
    }

    /**
     * @param scores scores in [0, 1]
     * @return the selection weight of every score, each in
     *         {@code [MIN_WEIGHT, 1]}
     */
    public double[] weights(double[] scores) {
        checkNotNull(scores, "scores must not be null");
        double[] weights = new double[scores.length];
        double scale = 1 + epsilon;
        for (int i = 0; i < scores.length; i++) {
            weights[i] = Math.max(MIN_WEIGHT, Math.pow((scores[i] + epsilon) / scale, exponent));
        }
        return weights;
    }

    /**
     * Selects {@code min(targetCount, weights.length)} distinct indices.
     *
     * @param weights     positive weights, one per candidate
     * @param targetCount the number of indices wanted
     * @param context     supplies the random generator, checked once per draw
     * @return the chosen indices in the order they were chosen
     */
    public int[] select(double[] weights, int targetCount, SamplingContext context) {
        checkNotNull(weights, "weights must not be null");
        checkNotNull(context, "context must not be null");
        checkArgument(targetCount > 0, "targetCount must be greater than 0");
        int n = weights.length;
        int wanted = Math.min(targetCount, n);
        if (wanted == 0) {
            return new int[0];
        }

        if (targetCount >= n * GREEDY_FRACTION) {
            LOGGER.debug("Target {} is close to input size {}, keeping the heaviest points", targetCount, n);
            return Arrays.copyOf(rankByWeight(weights), wanted);
        }

        double[] cumulative = ArrayUtils.cumulativeDistribution(weights);
        Random random = context.getRandom();
        boolean[] chosen = new boolean[n];
        int[] result = new int[wanted];
        int count = 0;
        long maxAttempts = (long) targetCount * ATTEMPTS_MULTIPLIER;
        for (long attempt = 0; attempt < maxAttempts && count < wanted; attempt++) {
            context.checkpoint();
            int index = ArrayUtils.firstAtLeast(cumulative, random.nextDouble());
            if (!chosen[index]) {
                chosen[index] = true;
                result[count++] = index;
            }
        }

        if (count < wanted) {
            LOGGER.debug("Draw budget exhausted with {} of {} points, filling with the heaviest", count, wanted);
            int[] ranked = rankByWeight(weights);
            for (int i = 0; i < ranked.length && count < wanted; i++) {
                if (!chosen[ranked[i]]) {
                    chosen[ranked[i]] = true;
                    result[count++] = ranked[i];
                }
            }
        }
        return result;
    }

    /**
     * @return all indices ordered by decreasing weight, equal weights by
     *         increasing index
     */
    public static int[] rankByWeight(double[] weights) {
        return ArrayUtils.rankDescending(weights);
    }
}
