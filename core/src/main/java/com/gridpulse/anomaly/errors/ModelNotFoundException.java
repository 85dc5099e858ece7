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

/**
 * Raised when no trained model exists for a month and the fallback policy does
 * not allow another one to be used.
 */
public class ModelNotFoundException extends SeasonalAnomalyException {

    private static final long serialVersionUID = 1L;

    private final int month;

    public ModelNotFoundException(int month, String message) {
        super(ErrorKind.MODEL_NOT_FOUND, message, context("month", month));
        this.month = month;
    }

    public ModelNotFoundException(int month) {
        this(month, month == 0 ? "no generic model is available"
                : String.format("no model is available for month %d", month));
    }

    public int getMonth() {
        return month;
    }
}
