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

package com.gridpulse.anomaly.services.state;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * Timestamps are kept in states as ISO-8601 strings with their zone, zones as
 * their ids. States written before zones were recorded read back as UTC.
 */
public final class TimestampStates {

    private TimestampStates() {
    }

    public static String toState(ZonedDateTime timestamp) {
        return timestamp == null ? null : timestamp.toString();
    }

    public static ZonedDateTime toModel(String timestamp) {
        return timestamp == null ? null : ZonedDateTime.parse(timestamp);
    }

    public static ZoneId toZone(String zone) {
        return zone == null ? ZoneOffset.UTC : ZoneId.of(zone);
    }
}
