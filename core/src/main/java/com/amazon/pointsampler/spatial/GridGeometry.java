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

import lombok.Getter;

/**
 * Maps planar coordinates to the cells of a uniform grid laid over a bounding
 * box. Cell coordinates are clamped to the grid, so a point on the maximum edge
 * of the box (or a query slightly outside it) falls in the nearest border cell.
 */
@Getter
public class GridGeometry {

    /**
     * Upper bound on the number of cells of a single grid.
     */
    public static final long MAX_CELLS = 1L << 28;

    /**
     * Cell size used on an axis whose range is zero.
     */
    public static final double DEGENERATE_CELL_SIZE = 1.0;

    private final double minX;

    private final double minY;

    private final double cellSizeX;

    private final double cellSizeY;

    private final int columns;

    private final int rows;

    GridGeometry(double minX, double minY, double cellSizeX, double cellSizeY, int columns, int rows) {
        checkArgument(cellSizeX > 0 && cellSizeY > 0, "cell sizes must be positive");
        checkArgument(columns > 0 && rows > 0, "a grid needs at least one cell");
        checkArgument((long) columns * rows <= MAX_CELLS, "grid would have too many cells");
        this.minX = minX;
        this.minY = minY;
        this.cellSizeX = cellSizeX;
        this.cellSizeY = cellSizeY;
        this.columns = columns;
        this.rows = rows;
    }

    /**
     * A {@code resolution x resolution} grid whose cells split each range evenly.
     *
     * @param box        the extent to cover
     * @param resolution number of cells per axis
     * @return the grid geometry
     */
    public static GridGeometry forResolution(BoundingBox2D box, int resolution) {
        checkNotNull(box, "box must not be null");
        checkArgument(resolution > 0, "resolution must be greater than 0");
        double cellSizeX = (box.getRangeX() > 0) ? box.getRangeX() / resolution : DEGENERATE_CELL_SIZE;
        double cellSizeY = (box.getRangeY() > 0) ? box.getRangeY() / resolution : DEGENERATE_CELL_SIZE;
        return new GridGeometry(box.getMinX(), box.getMinY(), cellSizeX, cellSizeY, resolution, resolution);
    }

    /**
     * A grid of square cells of the given size, with as many columns and rows as
     * are needed to cover the box (at least one of each).
     *
     * @param box      the extent to cover
     * @param cellSize the side of each cell
     * @return the grid geometry
     */
    public static GridGeometry forCellSize(BoundingBox2D box, double cellSize) {
        checkNotNull(box, "box must not be null");
        checkArgument(cellSize > 0 && Double.isFinite(cellSize), "cellSize must be positive and finite");
        checkArgument(cellCount(box, cellSize) <= MAX_CELLS,
                "cell size " + cellSize + " is too small for the extent " + box);
        int columns = (int) axisCells(box.getRangeX(), cellSize);
        int rows = (int) axisCells(box.getRangeY(), cellSize);
        return new GridGeometry(box.getMinX(), box.getMinY(), cellSize, cellSize, columns, rows);
    }

    /**
     * The smallest cell size, no smaller than {@code cellSize}, for which the
     * grid built by {@link #forCellSize} has at most {@code maxCells} cells.
     *
     * @param box      the extent to cover
     * @param cellSize the preferred side of each cell
     * @param maxCells the cell budget, at most {@link #MAX_CELLS}
     * @return {@code cellSize} itself if it fits, otherwise a coarser size
     */
    public static double fitCellSize(BoundingBox2D box, double cellSize, long maxCells) {
        checkNotNull(box, "box must not be null");
        checkArgument(cellSize > 0 && Double.isFinite(cellSize), "cellSize must be positive and finite");
        checkArgument(maxCells > 0 && maxCells <= MAX_CELLS, "maxCells must be in (0, MAX_CELLS]");
        if (cellCount(box, cellSize) <= maxCells) {
            return cellSize;
        }
        // start from the area bound, rounding up to whole cells may still overflow it
        double fitted = Math.max(cellSize,
                Math.max(Math.sqrt(box.getArea() / maxCells), box.getMaxRange() / maxCells));
        while (cellCount(box, fitted) > maxCells) {
            fitted *= 1.0625;
        }
        return fitted;
    }

    /**
     * @return the number of cells {@link #forCellSize} would lay over the box
     */
    public static double cellCount(BoundingBox2D box, double cellSize) {
        return axisCells(box.getRangeX(), cellSize) * axisCells(box.getRangeY(), cellSize);
    }

    private static double axisCells(double range, double cellSize) {
        return Math.max(1, Math.ceil(range / cellSize));
    }

    public int cellX(double x) {
        return clamp((int) Math.floor((x - minX) / cellSizeX), columns);
    }

    public int cellY(double y) {
        return clamp((int) Math.floor((y - minY) / cellSizeY), rows);
    }

    /**
     * @return the row-major index of the cell, or -1 if it lies outside the grid
     */
    public int cellIndex(int cellX, int cellY) {
        if (cellX < 0 || cellX >= columns || cellY < 0 || cellY >= rows) {
            return -1;
        }
        return cellY * columns + cellX;
    }

    public int cellIndexOf(double x, double y) {
        return cellIndex(cellX(x), cellY(y));
    }

    public int getCellCount() {
        return columns * rows;
    }

    private static int clamp(int cell, int limit) {
        if (cell < 0) {
            return 0;
        }
        return Math.min(cell, limit - 1);
    }
}
