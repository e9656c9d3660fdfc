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

package com.amazon.pointsampler.executor;

import static com.amazon.pointsampler.CommonUtils.checkNotNull;

import java.time.Duration;
import java.util.Optional;
import java.util.Random;
import java.util.function.LongSupplier;

import lombok.Getter;

import com.amazon.pointsampler.SamplingCancelledException;
import com.amazon.pointsampler.config.SamplingOptions;

/**
 * Per-call state handed to a sampler: the random number generator it must use
 * and an optional deadline. A context belongs to a single call and is not
 * thread-safe.
 */
public class SamplingContext {

    private static final long NO_DEADLINE = Long.MAX_VALUE;

    @Getter
    private final Random random;

    private final LongSupplier clock;

    private final long deadline;

    /**
     * A context without a deadline.
     *
     * @param random the generator used for every random decision of the call
     */
    public SamplingContext(Random random) {
        this(random, Optional.empty(), System::nanoTime);
    }

    /**
     * @param random  the generator used for every random decision of the call
     * @param timeout how long the call may run, measured from now
     * @param clock   a nanosecond clock such as {@code System::nanoTime}
     */
    public SamplingContext(Random random, Optional<Duration> timeout, LongSupplier clock) {
        this.random = checkNotNull(random, "random must not be null");
        this.clock = checkNotNull(clock, "clock must not be null");
        checkNotNull(timeout, "timeout must not be null");
        this.deadline = timeout.map(t -> clock.getAsLong() + t.toNanos()).orElse(NO_DEADLINE);
    }

    /**
     * Creates a context from the seed and timeout of the options. Without a seed
     * the generator is seeded arbitrarily.
     */
    public static SamplingContext from(SamplingOptions options) {
        checkNotNull(options, "options must not be null");
        Random random = options.getRandomSeed().map(Random::new).orElseGet(Random::new);
        return new SamplingContext(random, options.getTimeout(), System::nanoTime);
    }

    public boolean hasDeadline() {
        return deadline != NO_DEADLINE;
    }

    /**
     * Called by samplers once per outer iteration.
     *
     * @throws SamplingCancelledException if the running thread has been
     *                                    interrupted or the deadline has passed
     */
    public void checkpoint() {
        if (Thread.currentThread().isInterrupted()) {
            throw new SamplingCancelledException(SamplingCancelledException.Reason.INTERRUPTED,
                    "sampling interrupted");
        }
        if (deadline != NO_DEADLINE && clock.getAsLong() - deadline > 0) {
            throw new SamplingCancelledException(SamplingCancelledException.Reason.DEADLINE_EXCEEDED,
                    "sampling deadline exceeded");
        }
    }
}
