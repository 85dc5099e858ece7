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

package com.gridpulse.anomaly;

import static com.gridpulse.anomaly.CommonUtils.checkArgument;
import static com.gridpulse.anomaly.CommonUtils.checkNotNull;

import java.time.ZonedDateTime;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A single timestamped observation of a series, for example the demand in MW at
 * the start of an hour.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class TimeSeriesPoint {

    private final ZonedDateTime timestamp;
    private final double value;

    public TimeSeriesPoint(ZonedDateTime timestamp, double value) {
        checkNotNull(timestamp, "timestamp must not be null");
        checkArgument(!Double.isNaN(value), "value must be a number");
        this.timestamp = timestamp;
        this.value = value;
    }

    public TimeSeriesPoint withValue(double newValue) {
        return new TimeSeriesPoint(timestamp, newValue);
    }
}
