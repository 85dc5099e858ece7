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

import java.time.ZonedDateTime;

/**
 * Raised when a historical tail and a forecast cannot be stitched together, or
 * when either is not in strictly ascending order.
 */
public class TimestampAlignmentException extends SeasonalAnomalyException {

    private static final long serialVersionUID = 1L;

    public TimestampAlignmentException(String message, ZonedDateTime previous, ZonedDateTime next) {
        super(ErrorKind.TIMESTAMP_ALIGNMENT, message, context("previous", previous, "next", next));
    }
}
