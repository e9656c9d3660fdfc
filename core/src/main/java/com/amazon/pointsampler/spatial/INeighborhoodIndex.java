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

import com.amazon.pointsampler.Point;

/**
 * An approximate neighbor search over a fixed point list. Implementations
 * return a candidate set that is expected, not guaranteed, to contain the true
 * nearest neighbors of the query; callers rank the candidates themselves.
 */
public interface INeighborhoodIndex {

    /**
     * Returns the indices, into the indexed point list, of the candidate
     * neighbors of the given location. If the query is itself an indexed point,
     * its own index is among the results.
     *
     * @param point the query location
     * @return candidate indices, possibly empty, never null
     */
    int[] queryNeighbors(Point point);
}
