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
import static com.amazon.pointsampler.CommonUtils.checkNotNull;
import static com.amazon.pointsampler.CommonUtils.distance;

import java.util.List;

import lombok.Getter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.pointsampler.Point;
import com.amazon.pointsampler.executor.SamplingContext;
import com.amazon.pointsampler.spatial.INeighborhoodIndex;
import com.amazon.pointsampler.util.ArrayUtils;

/**
 * <p>
 * Scores every point by the roughness of the surface around it. The raw score
 * of a point is the standard deviation of the elevation of its {@code k}
 * nearest neighbors (3D distance, the point itself excluded), or 0 when fewer
 * than two neighbors are found. Raw scores are then rescaled to [0, 1] with the
 * global minimum and maximum.
 * </p>
 * <p>
 * Neighbors come from an {@link INeighborhoodIndex}, so they are only as good
 * as the index's candidate set. The cost is roughly {@code n * c * log k} for
 * an average of {@code c} candidates per query; when many points crowd into few
 * grid cells {@code c} approaches {@code n} and the scorer becomes quadratic.
 * </p>
 */
public class ImportanceScorer {

    private static final Logger LOGGER = LoggerFactory.getLogger(ImportanceScorer.class);

    @Getter
    private final int k;

    public ImportanceScorer(int k) {
        checkArgument(k > 0, "k must be greater than 0");
        this.k = k;
    }

    /**
     * @param points  the points to score
     * @param index   a neighbor index built over the same list
     * @param context checked once per point
     * @return normalized scores, one per point, in input order
     */
    public double[] score(List<Point> points, INeighborhoodIndex index, SamplingContext context) {
        double[] scores = rawScores(points, index, context);
        if (LOGGER.isDebugEnabled() && scores.length > 0) {
            LOGGER.debug("Raw importance scores range from {} to {}", ArrayUtils.min(scores), ArrayUtils.max(scores));
        }
        return ArrayUtils.normalizeInPlace(scores);
    }

    /**
     * @return the un-normalized roughness of every point
     */
    public double[] rawScores(List<Point> points, INeighborhoodIndex index, SamplingContext context) {
        checkNotNull(points, "points must not be null");
        checkNotNull(index, "index must not be null");
        checkNotNull(context, "context must not be null");

        double[] scores = new double[points.size()];
        NearestNeighborHeap nearest = new NearestNeighborHeap(k);
        for (int i = 0; i < points.size(); i++) {
            context.checkpoint();
            Point point = points.get(i);
            nearest.clear();
            for (int candidate : index.queryNeighbors(point)) {
                if (candidate != i) {
                    Point neighbor = points.get(candidate);
                    nearest.offer(distance(point, neighbor), neighbor.getZ());
                }
            }
            scores[i] = nearest.elevationStandardDeviation();
        }
        return scores;
    }
}
