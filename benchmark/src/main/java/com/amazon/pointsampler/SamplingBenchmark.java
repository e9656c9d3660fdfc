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

import java.util.ArrayList;
import java.util.List;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;

import com.amazon.pointsampler.config.SamplingOptions;
import com.amazon.pointsampler.config.SamplingStrategy;
import com.amazon.pointsampler.testutils.PointCloudTestData;

@Warmup(iterations = 3)
@Measurement(iterations = 5)
@Fork(value = 1)
@State(Scope.Thread)
public class SamplingBenchmark {

    public final static int DATA_SIZE = 500_000;

    @State(Scope.Benchmark)
    public static class BenchmarkState {
        @Param({ "SIMPLE", "IMPORTANCE", "POISSON" })
        SamplingStrategy strategy;

        @Param({ "5000", "50000", "400000" })
        int targetCount;

        List<Point> points;
        SamplingOptions options;

        @Setup(Level.Trial)
        public void setUpData() {
            double[][] data = PointCloudTestData.splitTerrain(DATA_SIZE, 1000, 0.05, 5.0, 17L);
            points = new ArrayList<>(data.length);
            for (double[] row : data) {
                points.add(new Point(row[0], row[1], row[2]));
            }
            options = SamplingOptions.builder().randomSeed(99L).build();
        }
    }

    @Benchmark
    public List<Point> sample(BenchmarkState state) {
        return SamplingOrchestrator.sample(state.points, state.targetCount, state.strategy, state.options);
    }
}
