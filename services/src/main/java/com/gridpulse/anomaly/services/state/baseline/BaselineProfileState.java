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

package com.gridpulse.anomaly.services.state.baseline;

import static com.gridpulse.anomaly.services.state.Version.CURRENT;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

import lombok.Data;

/**
 * Hour keys are 0 to 23 and day-of-week keys 0 (Monday) to 6 (Sunday).
 */
@Data
public class BaselineProfileState implements Serializable {
    private static final long serialVersionUID = 1L;

    private String version = CURRENT;
    private int month;
    private String zone;
    private Map<Integer, HourlyStatisticsState> hourly;
    private Map<Integer, HourlyStatisticsState> dayOfWeek;
    private HourlyStatisticsState weekday;
    private HourlyStatisticsState weekend;
    private HourlyStatisticsState overall;
    private List<Integer> peakHours;
    private String dataStart;
    private String dataEnd;
    private String generatedAt;
}
