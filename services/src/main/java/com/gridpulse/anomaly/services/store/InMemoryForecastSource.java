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

package com.gridpulse.anomaly.services.store;

import static com.gridpulse.anomaly.CommonUtils.checkArgument;
import static com.gridpulse.anomaly.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.gridpulse.anomaly.TimeSeriesPoint;

/**
 * A {@link ForecastSource} serving a fixed list of hourly points.
 */
public class InMemoryForecastSource implements ForecastSource {

    private final List<TimeSeriesPoint> forecast;

    public InMemoryForecastSource(List<TimeSeriesPoint> forecast) {
        checkNotNull(forecast, "forecast must not be null");
        this.forecast = Collections.unmodifiableList(new ArrayList<>(forecast));
    }

    @Override
    public List<TimeSeriesPoint> queryForecast(int hoursAhead) {
        checkArgument(hoursAhead > 0, "hoursAhead must be positive");
        return new ArrayList<>(forecast.subList(0, Math.min(hoursAhead, forecast.size())));
    }
}
