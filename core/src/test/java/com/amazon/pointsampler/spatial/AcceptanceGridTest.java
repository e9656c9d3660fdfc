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

import static com.amazon.pointsampler.CommonUtils.planarDistance;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

public class AcceptanceGridTest {

    private static final double MIN_DISTANCE = 1.0;

    private final BoundingBox2D box = new BoundingBox2D(0, 10, 0, 10);

    private final GridGeometry geometry = GridGeometry.forCellSize(box, MIN_DISTANCE / Math.sqrt(2));

    @Test
    public void testIsFarEnough() {
        AcceptanceGrid grid = new AcceptanceGrid(geometry, MIN_DISTANCE, 10);
        assertTrue(grid.isFarEnough(5, 5));
        assertEquals(0, grid.add(5, 5));
        assertEquals(1, grid.getSize());

        assertFalse(grid.isFarEnough(5, 5));
        assertFalse(grid.isFarEnough(5.5, 5));
        assertFalse(grid.isFarEnough(5.7, 5.7));
        // exactly the minimum distance is far enough
        assertTrue(grid.isFarEnough(6, 5));
        assertTrue(grid.isFarEnough(5.9, 5.5));
        assertTrue(grid.isFarEnough(0, 0));
    }

    @Test
    public void testCapacity() {
        AcceptanceGrid grid = new AcceptanceGrid(geometry, MIN_DISTANCE, 1);
        grid.add(1, 1);
        assertThrows(IllegalStateException.class, () -> grid.add(8, 8));
        assertThrows(IllegalArgumentException.class, () -> new AcceptanceGrid(geometry, 0, 1));
        assertThrows(IllegalArgumentException.class, () -> new AcceptanceGrid(geometry, 1, 0));
    }

    @ParameterizedTest
    @CsvSource({ "0.25,4", "0.7071067811865475,2", "1.0,1", "3.0,1", "20.0,1" })
    public void testSearchRadiusCoversMinDistance(double cellSize, int expectedRadius) {
        AcceptanceGrid grid = new AcceptanceGrid(GridGeometry.forCellSize(box, cellSize), MIN_DISTANCE, 10);
        assertEquals(expectedRadius, grid.getSearchRadius());
    }

    @ParameterizedTest
    @ValueSource(doubles = { 0.25, 0.7071067811865475, 3.0 })
    public void testAgreesWithExhaustiveSearch(double cellSize) {
        Random random = new Random(17);
        AcceptanceGrid grid = new AcceptanceGrid(GridGeometry.forCellSize(box, cellSize), MIN_DISTANCE, 1000);
        List<double[]> accepted = new ArrayList<>();

        for (int i = 0; i < 2000; i++) {
            double x = 10 * random.nextDouble();
            double y = 10 * random.nextDouble();
            boolean expected = true;
            for (double[] sample : accepted) {
                if (planarDistance(x, y, sample[0], sample[1]) < MIN_DISTANCE) {
                    expected = false;
                    break;
                }
            }
            assertEquals(expected, grid.isFarEnough(x, y));
            if (expected) {
                grid.add(x, y);
                accepted.add(new double[] { x, y });
            }
        }
        assertEquals(accepted.size(), grid.getSize());
    }
}
