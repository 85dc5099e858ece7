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
 * Raised when engineered features, a scaler and a scorer disagree about the
 * columns or the number of dimensions.
 */
public class SchemaMismatchException extends SeasonalAnomalyException {

    private static final long serialVersionUID = 1L;

    public SchemaMismatchException(String message, Map<String, Object> context) {
        super(ErrorKind.SCHEMA_MISMATCH, message, context);
    }

    public static SchemaMismatchException missingColumn(String column) {
        return new SchemaMismatchException("unknown feature column " + column, context("column", column));
    }

    public static SchemaMismatchException dimensions(int expected, int actual) {
        return new SchemaMismatchException(String.format("expected %d dimensions, found %d", expected, actual),
                context("expected", expected, "actual", actual));
    }
}
