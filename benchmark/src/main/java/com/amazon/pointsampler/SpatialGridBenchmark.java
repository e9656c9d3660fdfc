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
import org.openjdk.jmh.annotations.OperationsPerInvocation;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import com.amazon.pointsampler.spatial.BoundingBox2D;
import com.amazon.pointsampler.spatial.BoundingBoxComputer;
import com.amazon.pointsampler.spatial.GridNeighborhoodIndex;
import com.amazon.pointsampler.testutils.PointCloudTestData;

@Warmup(iterations = 3)
@Measurement(iterations = 5)
@Fork(value = 1)
@State(Scope.Thread)
public class SpatialGridBenchmark {

    public final static int DATA_SIZE = 200_000;

    @State(Scope.Benchmark)
    public static class BenchmarkState {
        @Param({ "25", "50", "200" })
        int gridResolution;

        List<Point> points;
        BoundingBox2D box;
        GridNeighborhoodIndex index;

        @Setup(Level.Trial)
        public void setUpData() {
            double[][] data = PointCloudTestData.uniformSquare(DATA_SIZE, 500, 500, 23L);
            points = new ArrayList<>(data.length);
            for (double[] row : data) {
                points.add(new Point(row[0], row[1], row[2]));
            }
            box = BoundingBoxComputer.compute(points);
            index = GridNeighborhoodIndex.build(points, box, gridResolution);
        }
    }

    @Benchmark
    public GridNeighborhoodIndex build(BenchmarkState state) {
        return GridNeighborhoodIndex.build(state.points, state.box, state.gridResolution);
    }

    @Benchmark
    @OperationsPerInvocation(DATA_SIZE)
    public void queryAll(BenchmarkState state, Blackhole blackhole) {
        for (Point point : state.points) {
            blackhole.consume(state.index.queryNeighbors(point));
        }
    }
}
