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

import java.util.concurrent.CancellationException;

import lombok.Getter;

/**
 * Thrown from inside a sampling loop when the call's deadline has passed or the
 * worker thread was interrupted. No partial result is returned.
 */
@Getter
public class SamplingCancelledException extends CancellationException {

    private static final long serialVersionUID = 1L;

    public enum Reason {
        DEADLINE_EXCEEDED, INTERRUPTED
    }

    private final Reason reason;

    public SamplingCancelledException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }
}
