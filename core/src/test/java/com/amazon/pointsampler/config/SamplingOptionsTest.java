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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import java.util.Optional;

import org.junit.jupiter.api.Test;

public class SamplingOptionsTest {

    @Test
    public void testDefaults() {
        SamplingOptions options = SamplingOptions.defaults();
        assertEquals(12, options.getK());
        assertEquals(50, options.getGridResolution());
        assertEquals(2.0, options.getImportanceExponent());
        assertEquals(0.001, options.getEpsilon());
        assertEquals(30, options.getMaxAttemptsPerActivePoint());
        assertEquals(1.0, options.getDistanceMultiplier());
        assertFalse(options.getRandomSeed().isPresent());
        assertFalse(options.getTimeout().isPresent());
        assertSame(options, SamplingOptions.defaults());
    }

    @Test
    public void testBuilder() {
        SamplingOptions options = SamplingOptions.builder().k(8).gridResolution(100).importanceExponent(1.5)
                .epsilon(0.01).maxAttemptsPerActivePoint(10).distanceMultiplier(0.5).randomSeed(7L)
                .timeout(Duration.ofSeconds(3)).build();
        assertEquals(8, options.getK());
        assertEquals(100, options.getGridResolution());
        assertEquals(1.5, options.getImportanceExponent());
        assertEquals(0.01, options.getEpsilon());
        assertEquals(10, options.getMaxAttemptsPerActivePoint());
        assertEquals(0.5, options.getDistanceMultiplier());
        assertEquals(Optional.of(7L), options.getRandomSeed());
        assertEquals(Optional.of(Duration.ofSeconds(3)), options.getTimeout());
    }

    @Test
    public void testToBuilderCopiesEverything() {
        SamplingOptions original = SamplingOptions.builder().k(3).importanceExponent(0).randomSeed(1L)
                .timeout(Duration.ofMillis(250)).build();
        SamplingOptions copy = original.toBuilder().build();
        assertEquals(original.toString(), copy.toString());

        SamplingOptions changed = original.toBuilder().k(5).build();
        assertEquals(5, changed.getK());
        assertEquals(Optional.of(1L), changed.getRandomSeed());
    }

    @Test
    public void testInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> SamplingOptions.builder().k(0).build());
        assertThrows(IllegalArgumentException.class, () -> SamplingOptions.builder().gridResolution(0).build());
        assertThrows(IllegalArgumentException.class, () -> SamplingOptions.builder().importanceExponent(-1).build());
        assertThrows(IllegalArgumentException.class,
                () -> SamplingOptions.builder().importanceExponent(Double.POSITIVE_INFINITY).build());
        assertThrows(IllegalArgumentException.class, () -> SamplingOptions.builder().epsilon(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> SamplingOptions.builder().maxAttemptsPerActivePoint(0).build());
        assertThrows(IllegalArgumentException.class, () -> SamplingOptions.builder().distanceMultiplier(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> SamplingOptions.builder().distanceMultiplier(Double.NaN).build());
        assertThrows(IllegalArgumentException.class, () -> SamplingOptions.builder().timeout(Duration.ZERO).build());
        assertThrows(IllegalArgumentException.class,
                () -> SamplingOptions.builder().timeout(Duration.ofSeconds(-1)).build());
        assertThrows(NullPointerException.class, () -> SamplingOptions.builder().timeout(null));
    }
}
