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
 * The categories of domain failure a caller may want to render differently.
 */
public enum ErrorKind {
    /** Not enough points to engineer features, train or predict. */
    INSUFFICIENT_DATA,
    /** No model is available for the requested month. */
    MODEL_NOT_FOUND,
    /** The features at hand do not match what the model was trained on. */
    SCHEMA_MISMATCH,
    /** Timestamps are out of order, overlap or leave a gap. */
    TIMESTAMP_ALIGNMENT
}
