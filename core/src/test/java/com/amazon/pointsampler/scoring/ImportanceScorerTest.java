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

import static com.amazon.pointsampler.TestUtils.EPSILON;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.atomic.AtomicLong;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.amazon.pointsampler.Point;
import com.amazon.pointsampler.SamplingCancelledException;
import com.amazon.pointsampler.executor.SamplingContext;
import com.amazon.pointsampler.spatial.BoundingBoxComputer;
import com.amazon.pointsampler.spatial.GridNeighborhoodIndex;
import com.amazon.pointsampler.spatial.INeighborhoodIndex;

@ExtendWith(MockitoExtension.class)
public class ImportanceScorerTest {

    @Mock
    private INeighborhoodIndex index;

    private final SamplingContext context = new SamplingContext(new Random(0));

    private final List<Point> points = Arrays.asList(new Point(0, 0, 0), new Point(1, 0, 2), new Point(2, 0, 4));

    @Test
    public void testRawScoresExcludeSelf() {
        when(index.queryNeighbors(any())).thenReturn(new int[] { 0, 1, 2 });
        ImportanceScorer scorer = new ImportanceScorer(2);

        double[] raw = scorer.rawScores(points, index, context);
        assertArrayEquals(new double[] { 1.0, 2.0, 1.0 }, raw, EPSILON);
        verify(index, times(3)).queryNeighbors(any());
    }

    @Test
    public void testScoresAreNormalized() {
        when(index.queryNeighbors(any())).thenReturn(new int[] { 0, 1, 2 });
        double[] scores = new ImportanceScorer(2).score(points, index, context);
        assertArrayEquals(new double[] { 0.0, 1.0, 0.0 }, scores, EPSILON);
    }

    @Test
    public void testKLimitsNeighbors() {
        // with k = 1 each point only sees one neighbor, so every spread is 0
        when(index.queryNeighbors(any())).thenReturn(new int[] { 0, 1, 2 });
        assertArrayEquals(new double[] { 0.0, 0.0, 0.0 }, new ImportanceScorer(1).rawScores(points, index, context));
    }

    @Test
    public void testIsolatedPoints() {
        when(index.queryNeighbors(any())).thenReturn(new int[0]);
        assertArrayEquals(new double[] { 0.0, 0.0, 0.0 }, new ImportanceScorer(12).score(points, index, context));
    }

    @Test
    public void testRoughPointsScoreHigher() {
        List<Point> terrain = Arrays.asList(new Point(0, 0, 0.00), new Point(0.25, 0, 0.01),
                new Point(0.5, 0, 0.02), new Point(0.75, 0, 0.03), new Point(1, 0, 0.04), new Point(9, 0, 5),
                new Point(9.25, 0, -5), new Point(9.5, 0, 5), new Point(9.75, 0, -5), new Point(10, 0, 5));
        GridNeighborhoodIndex grid = GridNeighborhoodIndex.build(terrain, BoundingBoxComputer.compute(terrain), 4);
        double[] scores = new ImportanceScorer(12).score(terrain, grid, context);
        for (int flat = 0; flat < 5; flat++) {
            for (int rough = 5; rough < 10; rough++) {
                assertTrue(scores[rough] > scores[flat]);
            }
        }
        assertEquals(1.0, scores[5], EPSILON);
    }

    @Test
    public void testDeadlineIsChecked() {
        when(index.queryNeighbors(any())).thenReturn(new int[] { 0, 1, 2 });
        AtomicLong now = new AtomicLong();
        SamplingContext expiring = new SamplingContext(new Random(0), Optional.of(Duration.ofNanos(10)),
                () -> now.getAndAdd(6));
        SamplingCancelledException exception = assertThrows(SamplingCancelledException.class,
                () -> new ImportanceScorer(2).rawScores(points, index, expiring));
        assertEquals(SamplingCancelledException.Reason.DEADLINE_EXCEEDED, exception.getReason());
    }

    @Test
    public void testInvalidK() {
        assertThrows(IllegalArgumentException.class, () -> new ImportanceScorer(0));
    }
}
