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

import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

import com.gridpulse.anomaly.testutils.DemandSeriesWithKey;

public class TestUtils {
    public static final double EPSILON = 1e-6;

    public static final ZonedDateTime START = ZonedDateTime.of(2024, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC);

    public static List<TimeSeriesPoint> toPoints(DemandSeriesWithKey data) {
        List<TimeSeriesPoint> points = new ArrayList<>(data.size());
        for (int i = 0; i < data.size(); i++) {
            points.add(new TimeSeriesPoint(data.timestamps[i], data.values[i]));
        }
        return points;
    }

    public static List<TimeSeriesPoint> hourly(ZonedDateTime start, double... values) {
        List<TimeSeriesPoint> points = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            points.add(new TimeSeriesPoint(start.plusHours(i), values[i]));
        }
        return points;
    }
}
