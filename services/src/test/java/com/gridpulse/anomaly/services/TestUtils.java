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

package com.gridpulse.anomaly.services;

import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

import com.gridpulse.anomaly.TimeSeriesPoint;
import com.gridpulse.anomaly.testutils.DemandSeriesWithKey;
import com.gridpulse.anomaly.testutils.SyntheticDemandData;

public class TestUtils {
    public static final double EPSILON = 1e-9;

    public static final ZonedDateTime NOVEMBER_2023 = ZonedDateTime.of(2023, 11, 1, 0, 0, 0, 0, ZoneOffset.UTC);

    public static final ZonedDateTime NOVEMBER_2024 = ZonedDateTime.of(2024, 11, 1, 0, 0, 0, 0, ZoneOffset.UTC);

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

    /**
     * Thirty days of hourly November demand in 2023 and in 2024.
     */
    public static List<TimeSeriesPoint> twoNovembers() {
        List<TimeSeriesPoint> points = new ArrayList<>(toPoints(new SyntheticDemandData(1).generate(NOVEMBER_2023,
                720)));
        points.addAll(toPoints(new SyntheticDemandData(2).generate(NOVEMBER_2024, 720)));
        return points;
    }

    /**
     * Noise-free demand with a small deterministic wiggle, within 3% of the
     * expected value.
     */
    public static List<TimeSeriesPoint> wiggle(ZonedDateTime start, int hours) {
        SyntheticDemandData data = new SyntheticDemandData();
        List<TimeSeriesPoint> points = new ArrayList<>(hours);
        for (int i = 0; i < hours; i++) {
            ZonedDateTime timestamp = start.plusHours(i);
            points.add(new TimeSeriesPoint(timestamp, data.expected(timestamp) * (1 + 0.03 * Math.sin(i))));
        }
        return points;
    }
}
