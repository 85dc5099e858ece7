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

import java.util.List;

import com.gridpulse.anomaly.TimeSeriesPoint;

/**
 * Supplies the forecast to be judged, for example the output of a demand
 * forecasting job.
 */
public interface ForecastSource {

    /**
     * @param hoursAhead how far the forecast should reach
     * @return the forecast points, ascending
     */
    List<TimeSeriesPoint> queryForecast(int hoursAhead);
}
