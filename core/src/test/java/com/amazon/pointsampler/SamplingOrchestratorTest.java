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

package com.amazon.pointsampler;

import static com.amazon.pointsampler.TestUtils.assertDistinctSubset;
import static com.amazon.pointsampler.TestUtils.toPoints;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedList;
import java.util.List;
import java.util.Random;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.MethodSource;

import com.amazon.pointsampler.config.SamplingOptions;
import com.amazon.pointsampler.config.SamplingStrategy;
import com.amazon.pointsampler.executor.SamplingContext;
import com.amazon.pointsampler.sampler.ImportanceSampler;
import com.amazon.pointsampler.sampler.PoissonDiskSampler;
import com.amazon.pointsampler.sampler.SimpleDecimator;
import com.amazon.pointsampler.testutils.PointCloudTestData;

public class SamplingOrchestratorTest {

    private final SamplingOptions seeded = SamplingOptions.builder().randomSeed(2024L).build();

    @ParameterizedTest
    @EnumSource(SamplingStrategy.class)
    public void testSmallInputIsReturnedUnchanged(SamplingStrategy strategy) {
        List<Point> points = toPoints(PointCloudTestData.lattice(4, 5));
        assertThat(SamplingOrchestrator.sample(points, 20, strategy, seeded), is(sameInstance(points)));
        assertThat(SamplingOrchestrator.sample(points, 1000, strategy, seeded), is(sameInstance(points)));
    }

    @ParameterizedTest
    @EnumSource(SamplingStrategy.class)
    public void testOutputIsBoundedSubset(SamplingStrategy strategy) {
        List<Point> points = toPoints(PointCloudTestData.splitTerrain(2000, 20, 0.05, 2.0, 31L));
        List<Point> sample = SamplingOrchestrator.sample(points, 100, strategy, seeded);
        assertThat(sample.size(), lessThanOrEqualTo(100));
        assertFalse(sample.isEmpty());
        assertDistinctSubset(sample, points);
    }

    @ParameterizedTest
    @EnumSource(SamplingStrategy.class)
    public void testSameSeedSameOutput(SamplingStrategy strategy) {
        List<Point> points = toPoints(PointCloudTestData.uniformSquare(1500, 30, 30, 13L));
        assertEquals(SamplingOrchestrator.sample(points, 120, strategy, seeded),
                SamplingOrchestrator.sample(points, 120, strategy, seeded));
        assertEquals(SamplingOrchestrator.sample(points, 120, strategy, seeded, new SamplingContext(new Random(1))),
                SamplingOrchestrator.sample(points, 120, strategy, seeded, new SamplingContext(new Random(1))));
    }

    @Test
    public void testSimpleStride() {
        List<Point> points = toPoints(PointCloudTestData.lattice(10, 1));
        assertThat(SamplingOrchestrator.sample(points, 3, SamplingStrategy.SIMPLE, SamplingOptions.defaults()),
                contains(points.get(0), points.get(4), points.get(8)));
    }

    @Test
    public void testSequentialAccessInput() {
        List<Point> points = new LinkedList<>(toPoints(PointCloudTestData.uniformSquare(500, 5, 5, 3L)));
        for (SamplingStrategy strategy : SamplingStrategy.values()) {
            List<Point> sample = SamplingOrchestrator.sample(points, 40, strategy, seeded);
            assertThat(sample.size(), lessThanOrEqualTo(40));
            assertDistinctSubset(sample, points);
        }
    }

    @ParameterizedTest
    @EnumSource(SamplingStrategy.class)
    public void testInvalidRequests(SamplingStrategy strategy) {
        List<Point> points = toPoints(PointCloudTestData.lattice(3, 3));
        assertThrows(EmptyInputException.class,
                () -> SamplingOrchestrator.sample(Collections.emptyList(), 5, strategy, seeded));
        InvalidTargetCountException exception = assertThrows(InvalidTargetCountException.class,
                () -> SamplingOrchestrator.sample(points, -5, strategy, seeded));
        assertEquals(-5, exception.getTargetCount());
        assertThrows(InvalidTargetCountException.class, () -> SamplingOrchestrator.sample(points, 0, strategy, seeded));
        assertThrows(NullPointerException.class, () -> SamplingOrchestrator.sample(null, 5, strategy, seeded));
        assertThrows(NullPointerException.class,
                () -> SamplingOrchestrator.sample(Arrays.asList(new Point(0, 0, 0), null), 1, strategy, seeded));
        assertThrows(NullPointerException.class, () -> SamplingOrchestrator.sample(points, 5, strategy, null));
    }

    static Stream<Arguments> degenerateClouds() {
        double[][] stack = new double[200][];
        for (int i = 0; i < stack.length; i++) {
            stack[i] = new double[] { 4, -2, i % 7 };
        }
        List<double[][]> clouds = Arrays.asList(stack, PointCloudTestData.line(400, 25, 8L),
                PointCloudTestData.lattice(1, 300));
        return Stream.of(SamplingStrategy.values())
                .flatMap(strategy -> clouds.stream().map(cloud -> Arguments.of(strategy, cloud)));
    }

    @ParameterizedTest
    @MethodSource("degenerateClouds")
    public void testDegenerateExtents(SamplingStrategy strategy, double[][] cloud) {
        List<Point> points = toPoints(cloud);
        List<Point> sample = SamplingOrchestrator.sample(points, 20, strategy, seeded);
        assertThat(sample.size(), lessThanOrEqualTo(20));
        assertFalse(sample.isEmpty());
        assertDistinctSubset(sample, points);
    }

    @Test
    public void testNullStrategy() {
        List<Point> points = toPoints(PointCloudTestData.lattice(3, 3));
        assertThrows(NullPointerException.class, () -> SamplingOrchestrator.sample(points, 5, null, seeded));
    }

    @ParameterizedTest
    @EnumSource(SamplingStrategy.class)
    public void testDownsamplerFactory(SamplingStrategy strategy) {
        assertEquals(strategy, SamplingOrchestrator.downsampler(strategy, seeded).getStrategy());
    }

    @Test
    public void testDownsamplerTypes() {
        assertThat(SamplingOrchestrator.downsampler(SamplingStrategy.SIMPLE, seeded), instanceOf(SimpleDecimator.class));
        assertThat(SamplingOrchestrator.downsampler(SamplingStrategy.IMPORTANCE, seeded),
                instanceOf(ImportanceSampler.class));
        assertThat(SamplingOrchestrator.downsampler(SamplingStrategy.POISSON, seeded),
                instanceOf(PoissonDiskSampler.class));
    }
}
