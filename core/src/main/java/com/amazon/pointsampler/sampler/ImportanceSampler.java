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

import static com.amazon.pointsampler.CommonUtils.checkNotNull;
import static com.amazon.pointsampler.CommonUtils.checkSamplingArguments;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.pointsampler.Point;
import com.amazon.pointsampler.config.SamplingOptions;
import com.amazon.pointsampler.config.SamplingStrategy;
import com.amazon.pointsampler.executor.SamplingContext;
import com.amazon.pointsampler.scoring.ImportanceScorer;
import com.amazon.pointsampler.spatial.BoundingBox2D;
import com.amazon.pointsampler.spatial.BoundingBoxComputer;
import com.amazon.pointsampler.spatial.GridNeighborhoodIndex;

/**
 * Importance sampling: points whose neighborhood shows a large spread in
 * elevation are more likely to be kept. Scoring is done by
 * {@link ImportanceScorer} over a {@link GridNeighborhoodIndex}, selection by
 * {@link WeightedSampler}.
 */
public class ImportanceSampler implements IDownsampler {

    private static final Logger LOGGER = LoggerFactory.getLogger(ImportanceSampler.class);

    @Getter
    private final SamplingOptions options;

    private final ImportanceScorer scorer;

    private final WeightedSampler weightedSampler;

    public ImportanceSampler(SamplingOptions options) {
        this.options = checkNotNull(options, "options must not be null");
        this.scorer = new ImportanceScorer(options.getK());
        this.weightedSampler = new WeightedSampler(options.getImportanceExponent(), options.getEpsilon());
    }

    @Override
    public List<Point> sample(List<Point> points, int targetCount, SamplingContext context) {
        checkSamplingArguments(points, targetCount);
        checkNotNull(context, "context must not be null");
        LOGGER.debug("Importance sampling {} points to {}", points.size(), targetCount);
        if (points.size() <= targetCount) {
            return points;
        }
        long start = System.currentTimeMillis();

        BoundingBox2D box = BoundingBoxComputer.compute(points);
        GridNeighborhoodIndex index = GridNeighborhoodIndex.build(points, box, options.getGridResolution());
        LOGGER.debug("Neighbor grid has {} occupied cells out of {}", index.getGrid().getOccupiedCells(),
                index.getGrid().getGeometry().getCellCount());

        double[] scores = scorer.score(points, index, context);
        double[] weights = weightedSampler.weights(scores);
        int[] selected = weightedSampler.select(weights, targetCount, context);

        List<Point> result = new ArrayList<>(selected.length);
        for (int i : selected) {
            result.add(points.get(i));
        }
        LOGGER.debug("Importance sampling kept {} points in {} ms", result.size(),
                System.currentTimeMillis() - start);
        return result;
    }

    @Override
    public SamplingStrategy getStrategy() {
        return SamplingStrategy.IMPORTANCE;
    }
}
