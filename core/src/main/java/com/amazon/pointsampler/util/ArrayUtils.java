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

package com.amazon.pointsampler.util;

import static com.amazon.pointsampler.CommonUtils.checkArgument;
import static com.amazon.pointsampler.CommonUtils.checkNotNull;

/**
 * A utility class for data arrays. Reductions are explicit loops so that arrays
 * with millions of entries never go through varargs or boxed streams.
 */
public class ArrayUtils {

    private ArrayUtils() {
    }

    public static double min(double[] values) {
        checkNotNull(values, "values must not be null");
        checkArgument(values.length > 0, "cannot reduce an empty array");
        double result = values[0];
        for (int i = 1; i < values.length; i++) {
            if (values[i] < result) {
                result = values[i];
            }
        }
        return result;
    }

    public static double max(double[] values) {
        checkNotNull(values, "values must not be null");
        checkArgument(values.length > 0, "cannot reduce an empty array");
        double result = values[0];
        for (int i = 1; i < values.length; i++) {
            if (values[i] > result) {
                result = values[i];
            }
        }
        return result;
    }

    public static double sum(double[] values) {
        checkNotNull(values, "values must not be null");
        double result = 0;
        for (double value : values) {
            result += value;
        }
        return result;
    }

    /**
     * Rescales the values in place to [0, 1] using the global minimum and
     * maximum. If every value is the same, every value becomes 0.
     *
     * @param values the array to rescale
     * @return the same array
     */
    public static double[] normalizeInPlace(double[] values) {
        if (values.length == 0) {
            return values;
        }
        double low = min(values);
        double range = max(values) - low;
        for (int i = 0; i < values.length; i++) {
            values[i] = (range > 0) ? (values[i] - low) / range : 0.0;
        }
        return values;
    }

    /**
     * Builds the running sum of {@code weights / sum(weights)}, so that entry
     * {@code i} is the probability of drawing an index {@code <= i}. Rounding
     * may leave the final entry slightly below 1.
     *
     * @param weights non-negative weights with a positive total
     * @return the cumulative distribution
     */
    public static double[] cumulativeDistribution(double[] weights) {
        double total = sum(weights);
        checkArgument(total > 0 && Double.isFinite(total), "weights must have a positive, finite total");
        double[] cumulative = new double[weights.length];
        double running = 0;
        for (int i = 0; i < weights.length; i++) {
            running += weights[i] / total;
            cumulative[i] = running;
        }
        return cumulative;
    }

    /**
     * Orders the indices of {@code values} by decreasing value, breaking ties by
     * increasing index. A bottom-up merge sort over primitive index arrays.
     *
     * @param values the values to rank, none of them NaN
     * @return every index of {@code values}, heaviest first
     */
    public static int[] rankDescending(double[] values) {
        checkNotNull(values, "values must not be null");
        int n = values.length;
        int[] order = new int[n];
        for (int i = 0; i < n; i++) {
            order[i] = i;
        }
        int[] buffer = new int[n];
        for (int width = 1; width < n; width *= 2) {
            for (int left = 0; left < n - width; left += 2 * width) {
                int middle = left + width;
                int right = Math.min(left + 2 * width, n);
                merge(values, order, buffer, left, middle, right);
            }
        }
        return order;
    }

    private static void merge(double[] values, int[] order, int[] buffer, int left, int middle, int right) {
        System.arraycopy(order, left, buffer, left, right - left);
        int i = left;
        int j = middle;
        for (int k = left; k < right; k++) {
            if (j >= right || (i < middle && comesFirst(values, buffer[i], buffer[j]))) {
                order[k] = buffer[i++];
            } else {
                order[k] = buffer[j++];
            }
        }
    }

    private static boolean comesFirst(double[] values, int a, int b) {
        return values[a] > values[b] || (values[a] == values[b] && a < b);
    }

    /**
     * Binary search for the first index whose cumulative value is at least
     * {@code target}. Returns the last index when no entry reaches the target.
     *
     * @param cumulative a non-decreasing, non-empty array
     * @param target     the value to invert
     * @return the selected index
     */
    public static int firstAtLeast(double[] cumulative, double target) {
        checkArgument(cumulative.length > 0, "cannot search an empty distribution");
        int left = 0;
        int right = cumulative.length - 1;
        while (left < right) {
            int mid = (left + right) >>> 1;
            if (cumulative[mid] < target) {
                left = mid + 1;
            } else {
                right = mid;
            }
        }
        return left;
    }
}
