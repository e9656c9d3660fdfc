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

package com.amazon.pointsampler.testutils;

import java.util.Random;

/**
 * Synthetic point clouds for tests and benchmarks. Every generator returns rows
 * of {@code {x, y, z}} and is reproducible for a given seed.
 */
public class PointCloudTestData {

    private PointCloudTestData() {
    }

    /**
     * Points spread uniformly over {@code [0, width] x [0, height]} with a
     * constant elevation.
     */
    public static double[][] uniformSquare(int size, double width, double height, long seed) {
        Random rng = new Random(seed);
        double[][] data = new double[size][3];
        for (int i = 0; i < size; i++) {
            data[i][0] = width * rng.nextDouble();
            data[i][1] = height * rng.nextDouble();
            data[i][2] = 0.0;
        }
        return data;
    }

    /**
     * A terrain over {@code [0, side] x [0, side]}: the left half is nearly flat
     * (elevation noise {@code flatSigma}), the right half is rough (elevation
     * noise {@code roughSigma}).
     */
    public static double[][] splitTerrain(int size, double side, double flatSigma, double roughSigma, long seed) {
        Random rng = new Random(seed);
        NormalDistribution noise = new NormalDistribution(new Random(seed + 1));
        double[][] data = new double[size][3];
        for (int i = 0; i < size; i++) {
            double x = side * rng.nextDouble();
            double y = side * rng.nextDouble();
            data[i][0] = x;
            data[i][1] = y;
            data[i][2] = noise.nextDouble(0.0, (x < side / 2) ? flatSigma : roughSigma);
        }
        return data;
    }

    /**
     * A regular {@code columns x rows} lattice with unit spacing whose elevation
     * is a gentle slope.
     */
    public static double[][] lattice(int columns, int rows) {
        double[][] data = new double[columns * rows][3];
        int i = 0;
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < columns; c++) {
                data[i][0] = c;
                data[i][1] = r;
                data[i][2] = 0.01 * (c + r);
                ++i;
            }
        }
        return data;
    }

    /**
     * Points on the segment {@code y = 0, 0 <= x <= length}.
     */
    public static double[][] line(int size, double length, long seed) {
        Random rng = new Random(seed);
        double[][] data = new double[size][3];
        for (int i = 0; i < size; i++) {
            data[i][0] = length * rng.nextDouble();
            data[i][1] = 0.0;
            data[i][2] = rng.nextDouble();
        }
        return data;
    }

    static class NormalDistribution {
        private final Random rng;
        private final double[] buffer;
        private int index;

        NormalDistribution(Random rng) {
            this.rng = rng;
            buffer = new double[2];
            index = 0;
        }

        double nextDouble() {
            if (index == 0) {
                // Box-Muller, two variates per pair of uniforms
                double u = 1.0 - rng.nextDouble();
                double v = rng.nextDouble();
                double r = Math.sqrt(-2 * Math.log(u));
                buffer[0] = r * Math.cos(2 * Math.PI * v);
                buffer[1] = r * Math.sin(2 * Math.PI * v);
            }

            double result = buffer[index];
            index = (index + 1) % 2;

            return result;
        }

        double nextDouble(double mu, double sigma) {
            return mu + sigma * nextDouble();
        }
    }
}
