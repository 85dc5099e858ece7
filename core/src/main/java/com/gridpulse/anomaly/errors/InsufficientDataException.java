/*
 * Copyright 2026 GridPulse contributors. All Rights Reserved.
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

package com.gridpulse.anomaly.errors;

import java.util.Map;

/**
 * Raised when a series is empty or shorter than an operation requires.
 */
public class InsufficientDataException extends SeasonalAnomalyException {

    private static final long serialVersionUID = 1L;

    public InsufficientDataException(String message, Map<String, Object> context) {
        super(ErrorKind.INSUFFICIENT_DATA, message, context);
    }

    public InsufficientDataException(String message) {
        this(message, null);
    }

    public static InsufficientDataException shorterThan(String what, int actual, int required) {
        return new InsufficientDataException(
                String.format("%s has %d points, at least %d are required", what, actual, required),
                context("actual", actual, "required", required));
    }
}
