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
import static com.amazon.pointsampler.CommonUtils.checkNotNull;
import static com.amazon.pointsampler.CommonUtils.checkState;
import static com.amazon.pointsampler.CommonUtils.planarDistance;

import java.util.Arrays;

import lombok.Getter;

/**
 * The grid of already accepted samples used to enforce a minimum planar
 * distance. Each cell holds a chain of accepted samples: {@code head[cell]} is
 * the most recent one and {@code next[sample]} links to the previous sample in
 * the same cell, so no accepted sample is ever lost to a cell collision.
 */
public class AcceptanceGrid {

    private static final int EMPTY = -1;

    @Getter
    private final GridGeometry geometry;

    private final double minDistance;

    /**
     * Cells searched on each side of the queried cell, enough to cover
     * {@code minDistance}. Cells of side {@code minDistance / sqrt(2)} give 2.
     */
    @Getter
    private final int searchRadius;

    private final int[] head;

    private final int[] next;

    private final double[] sampleX;

    private final double[] sampleY;

    @Getter
    private int size;

    public AcceptanceGrid(GridGeometry geometry, double minDistance, int capacity) {
        this.geometry = checkNotNull(geometry, "geometry must not be null");
        checkArgument(minDistance > 0, "minDistance must be positive");
        checkArgument(capacity > 0, "capacity must be positive");
        this.minDistance = minDistance;
        double smallestSide = Math.min(geometry.getCellSizeX(), geometry.getCellSizeY());
        int widest = Math.max(geometry.getColumns(), geometry.getRows());
        searchRadius = (int) Math.min(widest, Math.max(1, Math.ceil(minDistance / smallestSide)));
        head = new int[geometry.getCellCount()];
        Arrays.fill(head, EMPTY);
        next = new int[capacity];
        sampleX = new double[capacity];
        sampleY = new double[capacity];
        size = 0;
    }

    /**
     * @return true if no accepted sample lies closer than the minimum distance
     *         to {@code (x, y)}
     */
    public boolean isFarEnough(double x, double y) {
        int centerX = geometry.cellX(x);
        int centerY = geometry.cellY(y);
        for (int dy = -searchRadius; dy <= searchRadius; dy++) {
            for (int dx = -searchRadius; dx <= searchRadius; dx++) {
                int cell = geometry.cellIndex(centerX + dx, centerY + dy);
                if (cell < 0) {
                    continue;
                }
                for (int sample = head[cell]; sample != EMPTY; sample = next[sample]) {
                    if (planarDistance(x, y, sampleX[sample], sampleY[sample]) < minDistance) {
                        return false;
                    }
                }
            }
        }
        return true;
    }

    /**
     * Records an accepted sample. Samples are numbered in acceptance order.
     *
     * @return the number assigned to the sample
     */
    public int add(double x, double y) {
        checkState(size < next.length, "acceptance grid is full");
        int cell = geometry.cellIndexOf(x, y);
        int sample = size++;
        sampleX[sample] = x;
        sampleY[sample] = y;
        next[sample] = head[cell];
        head[cell] = sample;
        return sample;
    }
}
