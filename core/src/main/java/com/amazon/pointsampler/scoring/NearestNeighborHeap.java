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

package com.amazon.pointsampler.scoring;

import static com.amazon.pointsampler.CommonUtils.checkArgument;

/**
 * <p>
 * Keeps the {@code capacity} closest of a stream of candidates together with
 * their elevations. The candidates are held in a max-heap keyed by distance, so
 * the head is the farthest kept candidate and is the one evicted when a closer
 * candidate arrives.
 * </p>
 * <p>
 * Ties are broken by arrival order: among candidates at the same distance the
 * earlier ones are kept, which is the set a stable ascending sort followed by a
 * truncation to {@code capacity} would keep.
 * </p>
 */
public class NearestNeighborHeap {

    private final double[] distance;

    private final double[] elevation;

    private final int[] arrival;

    private int size;

    private int arrivals;

    public NearestNeighborHeap(int capacity) {
        checkArgument(capacity > 0, "capacity must be greater than 0");
        distance = new double[capacity];
        elevation = new double[capacity];
        arrival = new int[capacity];
    }

    public void clear() {
        size = 0;
        arrivals = 0;
    }

    public int size() {
        return size;
    }

    public void offer(double candidateDistance, double candidateElevation) {
        int order = arrivals++;
        if (size < distance.length) {
            distance[size] = candidateDistance;
            elevation[size] = candidateElevation;
            arrival[size] = order;
            swapUp(size++);
        } else if (candidateDistance < distance[0]) {
            distance[0] = candidateDistance;
            elevation[0] = candidateElevation;
            arrival[0] = order;
            swapDown(0);
        }
    }

    /**
     * @return the population standard deviation of the kept elevations, or 0 if
     *         fewer than two candidates are kept
     */
    public double elevationStandardDeviation() {
        if (size < 2) {
            return 0.0;
        }
        double mean = 0;
        for (int i = 0; i < size; i++) {
            mean += elevation[i];
        }
        mean /= size;
        double variance = 0;
        for (int i = 0; i < size; i++) {
            double delta = elevation[i] - mean;
            variance += delta * delta;
        }
        return Math.sqrt(variance / size);
    }

    private boolean above(int first, int second) {
        return distance[first] > distance[second]
                || (distance[first] == distance[second] && arrival[first] > arrival[second]);
    }

    private void swapUp(int startIndex) {
        int current = startIndex;
        while (current > 0) {
            int parent = (current - 1) / 2;
            if (above(current, parent)) {
                swap(current, parent);
                current = parent;
            } else {
                break;
            }
        }
    }

    private void swapDown(int startIndex) {
        int current = startIndex;
        while (2 * current + 1 < size) {
            int maxIndex = 2 * current + 1;
            if (2 * current + 2 < size && above(2 * current + 2, maxIndex)) {
                maxIndex = 2 * current + 2;
            }
            if (above(maxIndex, current)) {
                swap(current, maxIndex);
                current = maxIndex;
            } else {
                break;
            }
        }
    }

    private void swap(int a, int b) {
        double tmpDistance = distance[a];
        distance[a] = distance[b];
        distance[b] = tmpDistance;
        double tmpElevation = elevation[a];
        elevation[a] = elevation[b];
        elevation[b] = tmpElevation;
        int tmpArrival = arrival[a];
        arrival[a] = arrival[b];
        arrival[b] = tmpArrival;
    }
}
