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

package com.amazon.pointsampler.config;

import static com.amazon.pointsampler.TestUtils.assertDistinctSubset;
import static com.amazon.pointsampler.TestUtils.toPoints;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import com.amazon.pointsampler.EmptyInputException;
import com.amazon.pointsampler.Point;
import com.amazon.pointsampler.returntypes.DownsamplingResult;
import com.amazon.pointsampler.testutils.PointCloudTestData;

public class DownsamplingPolicyTest {

    private final List<Point> points = toPoints(PointCloudTestData.uniformSquare(1000, 10, 10, 6L));

    @Test
    public void testDefaults() {
        DownsamplingPolicy policy = DownsamplingPolicy.builder().build();
        assertFalse(policy.isEnabled());
        assertEquals(2_500_000, policy.getMaxDisplayPoints());
        assertEquals(SamplingStrategy.SIMPLE, policy.getStrategy());
        assertSame(SamplingOptions.defaults(), policy.getOptions());
    }

    @Test
    public void testDisabledKeepsEverything() {
        DownsamplingPolicy policy = DownsamplingPolicy.builder().maxDisplayPoints(10).build();
        DownsamplingResult result = policy.apply(points);
        assertFalse(result.isDownsamplingApplied());
        assertThat(result.getPoints(), is(sameInstance(points)));
        assertEquals(1000, result.getTotalPoints());
        assertEquals(0, result.getRemovedPoints());
        assertEquals(0, result.getElapsedMillis());
    }

    @Test
    public void testSmallCloudIsNotSampled() {
        DownsamplingPolicy policy = DownsamplingPolicy.builder().enabled(true).maxDisplayPoints(1000).build();
        DownsamplingResult result = policy.apply(points);
        assertFalse(result.isDownsamplingApplied());
        assertThat(result.getPoints(), is(sameInstance(points)));
    }

    @ParameterizedTest
    @EnumSource(SamplingStrategy.class)
    public void testLargeCloudIsSampled(SamplingStrategy strategy) {
        DownsamplingPolicy policy = DownsamplingPolicy.builder().enabled(true).maxDisplayPoints(100)
                .strategy(strategy).options(SamplingOptions.builder().randomSeed(3L).build()).build();
        DownsamplingResult result = policy.apply(points);
        assertTrue(result.isDownsamplingApplied());
        assertEquals(strategy, result.getStrategy());
        assertEquals(1000, result.getTotalPoints());
        assertThat(result.getDisplayedPoints(), lessThanOrEqualTo(100));
        assertEquals(1000 - result.getDisplayedPoints(), result.getRemovedPoints());
        assertDistinctSubset(result.getPoints(), points);
    }

    @Test
    public void testStrategyName() {
        assertEquals(SamplingStrategy.POISSON, DownsamplingPolicy.builder().strategyName("Poisson").build()
                .getStrategy());
        assertEquals(SamplingStrategy.SIMPLE, DownsamplingPolicy.builder().strategyName("fancy").build()
                .getStrategy());
    }

    @Test
    public void testInvalidConfiguration() {
        assertThrows(IllegalArgumentException.class, () -> DownsamplingPolicy.builder().maxDisplayPoints(0).build());
        assertThrows(NullPointerException.class, () -> DownsamplingPolicy.builder().strategy(null).build());
        assertThrows(NullPointerException.class, () -> DownsamplingPolicy.builder().options(null).build());
        DownsamplingPolicy policy = DownsamplingPolicy.builder().enabled(true).build();
        assertThrows(EmptyInputException.class, () -> policy.apply(Collections.emptyList()));
        assertThrows(NullPointerException.class, () -> policy.apply(null));
    }
}
