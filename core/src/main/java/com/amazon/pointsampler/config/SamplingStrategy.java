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

import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The available downsampling strategies.
 */
public enum SamplingStrategy {

    /**
     * keeps every N-th point of the input, preserving input order; deterministic
     */
    SIMPLE,
    /**
     * draws points with probability increasing with the local spread of
     * elevation among their nearest neighbors, so rough terrain keeps more detail
     * than flat terrain
     */
    IMPORTANCE,
    /**
     * picks an evenly spaced subset in which no two points are closer (in the XY
     * plane) than a distance derived from the target density
     */
    POISSON;

    private static final Logger LOGGER = LoggerFactory.getLogger(SamplingStrategy.class);

    /**
     * Resolves a user supplied strategy name, ignoring case and surrounding
     * blanks. Missing or unrecognized names select {@link #SIMPLE}.
     *
     * @param name a strategy name such as "poisson", may be null
     * @return the matching strategy
     */
    public static SamplingStrategy fromName(String name) {
        if (name == null || name.isBlank()) {
            return SIMPLE;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            LOGGER.warn("Unknown sampling strategy '{}', using {}", name, SIMPLE);
            return SIMPLE;
        }
    }
}
