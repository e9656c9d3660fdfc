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

import java.util.List;
import java.util.function.IntConsumer;

import lombok.Getter;

import com.amazon.pointsampler.Point;

/**
 * <p>
 * A uniform grid index over the XY extent of a point list. Every point index is
 * stored in the bucket of the cell that contains it.
 * </p>
 * <p>
 * Buckets are kept in compressed form: {@code pointIndex} holds all point
 * indices ordered by cell, and the bucket of cell {@code c} is the slice
 * {@code [cellStart[c], cellStart[c + 1])}. Within a bucket indices keep the
 * order of the input list. The grid is immutable once built.
 * </p>
 */
public class SpatialGrid {

    @Getter
    private final GridGeometry geometry;

    private final int[] cellStart;

    private final int[] pointIndex;

    protected SpatialGrid(GridGeometry geometry, List<Point> points) {
        this.geometry = checkNotNull(geometry, "geometry must not be null");
        checkNotNull(points, "points must not be null");
        int cellCount = geometry.getCellCount();
        int[] cellOf = new int[points.size()];
        cellStart = new int[cellCount + 1];
        for (int i = 0; i < points.size(); i++) {
            Point point = points.get(i);
            cellOf[i] = geometry.cellIndexOf(point.getX(), point.getY());
            ++cellStart[cellOf[i] + 1];
        }
        for (int c = 0; c < cellCount; c++) {
            cellStart[c + 1] += cellStart[c];
        }
        int[] next = new int[cellCount];
        System.arraycopy(cellStart, 0, next, 0, cellCount);
        pointIndex = new int[points.size()];
        for (int i = 0; i < cellOf.length; i++) {
            pointIndex[next[cellOf[i]]++] = i;
        }
    }

    /**
     * Builds a {@code resolution x resolution} grid over the given extent.
     */
    public static SpatialGrid withResolution(List<Point> points, BoundingBox2D box, int resolution) {
        return new SpatialGrid(GridGeometry.forResolution(box, resolution), points);
    }

    /**
     * Builds a grid of square cells of the given size over the given extent.
     */
    public static SpatialGrid withCellSize(List<Point> points, BoundingBox2D box, double cellSize) {
        return new SpatialGrid(GridGeometry.forCellSize(box, cellSize), points);
    }

    public int getPointCount() {
        return pointIndex.length;
    }

    /**
     * @return the number of cells holding at least one point
     */
    public int getOccupiedCells() {
        int occupied = 0;
        for (int c = 0; c < geometry.getCellCount(); c++) {
            if (cellStart[c + 1] > cellStart[c]) {
                ++occupied;
            }
        }
        return occupied;
    }

    public int bucketSize(int cellX, int cellY) {
        int cell = geometry.cellIndex(cellX, cellY);
        return (cell < 0) ? 0 : cellStart[cell + 1] - cellStart[cell];
    }

    /**
     * Visits every point index stored in the square window of cells centered on
     * {@code (centerX, centerY)} with the given radius in cells. Columns are
     * visited in the outer loop and rows in the inner loop; cells outside the
     * grid are skipped.
     *
     * @param centerX the column of the center cell
     * @param centerY the row of the center cell
     * @param radius  0 visits one cell, 1 a 3x3 window, 2 a 5x5 window
     * @param visitor receives each point index
     */
    public void forEachInWindow(int centerX, int centerY, int radius, IntConsumer visitor) {
        checkArgument(radius >= 0, "radius must be non-negative");
        for (int dx = -radius; dx <= radius; dx++) {
            for (int dy = -radius; dy <= radius; dy++) {
                int cell = geometry.cellIndex(centerX + dx, centerY + dy);
                if (cell >= 0) {
                    for (int j = cellStart[cell]; j < cellStart[cell + 1]; j++) {
                        visitor.accept(pointIndex[j]);
                    }
                }
            }
        }
    }

    /**
     * @return the point indices of the window as a new array, in the order of
     *         {@link #forEachInWindow(int, int, int, IntConsumer)}
     */
    public int[] windowIndices(int centerX, int centerY, int radius) {
        checkArgument(radius >= 0, "radius must be non-negative");
        int count = 0;
        for (int dx = -radius; dx <= radius; dx++) {
            for (int dy = -radius; dy <= radius; dy++) {
                count += bucketSize(centerX + dx, centerY + dy);
            }
        }
        int[] result = new int[count];
        int position = 0;
        for (int dx = -radius; dx <= radius; dx++) {
            for (int dy = -radius; dy <= radius; dy++) {
                int cell = geometry.cellIndex(centerX + dx, centerY + dy);
                if (cell >= 0) {
                    int length = cellStart[cell + 1] - cellStart[cell];
                    System.arraycopy(pointIndex, cellStart[cell], result, position, length);
                    position += length;
                }
            }
        }
        return result;
    }
}
