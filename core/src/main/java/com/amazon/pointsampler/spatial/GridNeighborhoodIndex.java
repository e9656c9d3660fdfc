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

import lombok.Getter;

import com.amazon.pointsampler.Point;

/**
 * Neighbor search that returns everything in the 3x3 block of grid cells around
 * the query. Under strongly non-uniform density a point's true nearest
 * neighbors can lie outside the block and are then missed; scores computed
 * from this index depend on that behavior, so it is kept as is.
 */
public class GridNeighborhoodIndex implements INeighborhoodIndex {

    public static final int DEFAULT_WINDOW_RADIUS = 1;

    @Getter
    private final SpatialGrid grid;

    private final int windowRadius;

    public GridNeighborhoodIndex(SpatialGrid grid) {
        this(grid, DEFAULT_WINDOW_RADIUS);
    }

    public GridNeighborhoodIndex(SpatialGrid grid, int windowRadius) {
        checkArgument(windowRadius >= 0, "windowRadius must be non-negative");
        this.grid = checkNotNull(grid, "grid must not be null");
        this.windowRadius = windowRadius;
    }

    /**
     * Indexes the points in a {@code resolution x resolution} grid over their
     * own bounding box.
     */
    public static GridNeighborhoodIndex build(List<Point> points, BoundingBox2D box, int resolution) {
        return new GridNeighborhoodIndex(SpatialGrid.withResolution(points, box, resolution));
    }

    @Override
    public int[] queryNeighbors(Point point) {
        GridGeometry geometry = grid.getGeometry();
        return grid.windowIndices(geometry.cellX(point.getX()), geometry.cellY(point.getY()), windowRadius);
    }
}
