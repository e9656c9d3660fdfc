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

import lombok.Data;

/**
 * An immutable sample of a surface: a planar position and an elevation. Points
 * are compared by value; a sampler identifies a point by its position in the
 * input list.
 */
@Data
public class Point {

    private final double x;

    private final double y;

    /**
     * The elevation. Spacing decisions ignore it, roughness scoring uses it.
     */
    private final double z;
}
