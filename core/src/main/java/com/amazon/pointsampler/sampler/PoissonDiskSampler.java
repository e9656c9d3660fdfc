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
import static com.amazon.pointsampler.CommonUtils.checkSamplingArguments;
import static com.amazon.pointsampler.CommonUtils.planarDistance;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import lombok.Getter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.pointsampler.Point;
import com.amazon.pointsampler.config.SamplingOptions;
import com.amazon.pointsampler.config.SamplingStrategy;
import com.amazon.pointsampler.executor.SamplingContext;
import com.amazon.pointsampler.spatial.AcceptanceGrid;
import com.amazon.pointsampler.spatial.BoundingBox2D;
import com.amazon.pointsampler.spatial.BoundingBoxComputer;
import com.amazon.pointsampler.spatial.GridGeometry;
import com.amazon.pointsampler.spatial.SpatialGrid;

/**
 * <p>
 * Poisson-disk selection of existing points, following Bridson's active-list
 * construction. The minimum distance is derived from the target density,
 * {@code sqrt(area / (targetCount * PI)) * distanceMultiplier}, and is measured
 * in the XY plane only.
 * </p>
 * <p>
 * Starting from one random input point, the sampler repeatedly picks an active
 * sample and proposes positions at a distance between one and two minimum
 * distances from it. A proposal that is clear of every accepted sample is
 * replaced by the nearest input point, which is accepted if it is clear as
 * well. An active sample that yields nothing after
 * {@code maxAttemptsPerActivePoint} proposals is retired. The loop ends when no
 * sample is active or the target is reached, so the output never exceeds the
 * target and may fall short of it.
 * </p>
 */
public class PoissonDiskSampler implements IDownsampler {

    private static final Logger LOGGER = LoggerFactory.getLogger(PoissonDiskSampler.class);

    /**
     * Minimum distance used when every input point shares the same position.
     */
    public static final double MIN_DISTANCE_FLOOR = 1e-9;

    /**
     * Cells allowed per input point before the grids are coarsened. A dense
     * target spends about {@code 2 * PI} cells per selected point.
     */
    public static final int CELLS_PER_POINT = 8;

    /**
     * Cells always allowed, whatever the input size.
     */
    public static final long MIN_CELL_BUDGET = 1L << 16;

    @Getter
    private final SamplingOptions options;

    public PoissonDiskSampler(SamplingOptions options) {
        this.options = checkNotNull(options, "options must not be null");
    }

    /**
     * The spacing enforced between selected points. The area of a box that is
     * much thinner than it is long is raised to {@code maxRange^2 / targetCount},
     * which spaces the points as along a segment of length {@code maxRange}.
     *
     * @param box         the extent of the input
     * @param targetCount the number of points wanted
     * @param multiplier  scale applied to the density-derived distance
     * @return a positive distance
     */
    public static double minimumDistance(BoundingBox2D box, int targetCount, double multiplier) {
        checkNotNull(box, "box must not be null");
        checkArgument(targetCount > 0, "targetCount must be greater than 0");
        double maxRange = box.getMaxRange();
        double area = Math.max(box.getArea(), maxRange * maxRange / targetCount);
        double distance = Math.sqrt(area / (targetCount * Math.PI)) * multiplier;
        return (distance > 0) ? distance : MIN_DISTANCE_FLOOR;
    }

    @Override
    public List<Point> sample(List<Point> points, int targetCount, SamplingContext context) {
        checkSamplingArguments(points, targetCount);
        checkNotNull(context, "context must not be null");
        LOGGER.debug("Poisson disk sampling {} points to {}", points.size(), targetCount);
        if (points.size() <= targetCount) {
            return points;
        }
        long start = System.currentTimeMillis();

        BoundingBox2D box = BoundingBoxComputer.compute(points);
        double minDistance = minimumDistance(box, targetCount, options.getDistanceMultiplier());
        double cellSize = GridGeometry.fitCellSize(box, minDistance / Math.sqrt(2), cellBudget(points.size()));
        if (box.isDegenerate()) {
            LOGGER.debug("Extent {} has no area, spacing derived from its longest side", box);
        }

        GridGeometry geometry = GridGeometry.forCellSize(box, cellSize);
        AcceptanceGrid accepted = new AcceptanceGrid(geometry, minDistance, targetCount);
        LOGGER.debug("Min distance {}, cell size {}, search radius {}", minDistance, cellSize,
                accepted.getSearchRadius());
        NearestPointLookup lookup = new NearestPointLookup(points, box, cellSize, accepted.getSearchRadius());
        BoundingBox2D proposalBounds = box.expand(box.getRangeX() < minDistance ? minDistance : 0,
                box.getRangeY() < minDistance ? minDistance : 0);

        Random random = context.getRandom();
        List<Point> result = new ArrayList<>(targetCount);
        int[] active = new int[targetCount];
        int activeCount = 0;

        Point seed = points.get(random.nextInt(points.size()));
        result.add(seed);
        active[activeCount++] = accepted.add(seed.getX(), seed.getY());

        int maxAttempts = options.getMaxAttemptsPerActivePoint();
        while (activeCount > 0 && result.size() < targetCount) {
            context.checkpoint();
            int slot = random.nextInt(activeCount);
            Point center = result.get(active[slot]);
            boolean found = false;

            for (int attempt = 0; attempt < maxAttempts; attempt++) {
                double angle = random.nextDouble() * 2 * Math.PI;
                double radius = minDistance * (1 + random.nextDouble());
                double x = center.getX() + radius * Math.cos(angle);
                double y = center.getY() + radius * Math.sin(angle);
                if (!proposalBounds.contains(x, y) || !accepted.isFarEnough(x, y)) {
                    continue;
                }
                int nearest = lookup.nearest(x, y);
                if (nearest >= 0) {
                    Point candidate = points.get(nearest);
                    if (accepted.isFarEnough(candidate.getX(), candidate.getY())) {
                        result.add(candidate);
                        active[activeCount++] = accepted.add(candidate.getX(), candidate.getY());
                        found = true;
                        break;
                    }
                }
            }

            if (!found) {
                active[slot] = active[--activeCount];
            }
        }

        LOGGER.debug("Poisson disk sampling kept {} points in {} ms", result.size(),
                System.currentTimeMillis() - start);
        return result;
    }

    /**
     * @return the largest number of cells either grid of a call may use
     */
    static long cellBudget(int pointCount) {
        return Math.min(GridGeometry.MAX_CELLS, Math.max(MIN_CELL_BUDGET, (long) CELLS_PER_POINT * pointCount));
    }

    @Override
    public SamplingStrategy getStrategy() {
        return SamplingStrategy.POISSON;
    }

    /**
     * Finds the input point closest to a proposed position. The grid over all
     * input points is only built when the first proposal survives the acceptance
     * check, and lives no longer than the call that created it.
     */
    static class NearestPointLookup {

        private final List<Point> points;

        private final BoundingBox2D box;

        private final double cellSize;

        private final int searchRadius;

        private SpatialGrid grid;

        private int best;

        private double bestDistance;

        NearestPointLookup(List<Point> points, BoundingBox2D box, double cellSize, int searchRadius) {
            this.points = points;
            this.box = box;
            this.cellSize = cellSize;
            this.searchRadius = searchRadius;
        }

        boolean isBuilt() {
            return grid != null;
        }

        /**
         * @return the index of the nearest input point within the search window,
         *         or -1 if the window holds no point
         */
        int nearest(double x, double y) {
            if (grid == null) {
                grid = SpatialGrid.withCellSize(points, box, cellSize);
            }
            GridGeometry geometry = grid.getGeometry();
            best = -1;
            bestDistance = Double.POSITIVE_INFINITY;
            grid.forEachInWindow(geometry.cellX(x), geometry.cellY(y), searchRadius, index -> {
                Point point = points.get(index);
                double distance = planarDistance(point.getX(), point.getY(), x, y);
                if (distance < bestDistance) {
                    bestDistance = distance;
                    best = index;
                }
            });
            return best;
        }
    }
}
