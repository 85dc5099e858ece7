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

package com.gridpulse.anomaly.baseline;

import static com.gridpulse.anomaly.CommonUtils.checkArgument;
import static com.gridpulse.anomaly.CommonUtils.checkNotNull;

import java.time.Clock;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

import lombok.extern.slf4j.Slf4j;

import com.gridpulse.anomaly.TimeSeriesPoint;
import com.gridpulse.anomaly.errors.InsufficientDataException;

/**
 * Computes a {@link BaselineProfile} from a series. Hours and days are read in
 * the zone given to {@link #build(List, int, ZoneId)}, UTC otherwise.
 */
@Slf4j
public class BaselineProfileBuilder {

    public static final int DEFAULT_PEAK_HOUR_COUNT = 5;

    private final Clock clock;

    private final int peakHourCount;

    public BaselineProfileBuilder() {
        this(Clock.systemUTC(), DEFAULT_PEAK_HOUR_COUNT);
    }

    public BaselineProfileBuilder(Clock clock, int peakHourCount) {
        this.clock = checkNotNull(clock, "clock must not be null");
        checkArgument(peakHourCount > 0, "peakHourCount must be positive");
        this.peakHourCount = peakHourCount;
    }

    public BaselineProfile build(List<TimeSeriesPoint> series) {
        return build(series, 0);
    }

    public BaselineProfile build(List<TimeSeriesPoint> series, int month) {
        return build(series, month, ZoneOffset.UTC);
    }

    /**
     * @param series the points, in any order
     * @param month  the calendar month the series was selected for, 0 for all
     *               history
     * @param zone   the zone in which hours and days are read
     * @return the profile
     * @throws InsufficientDataException if the series is empty
     */
    public BaselineProfile build(List<TimeSeriesPoint> series, int month, ZoneId zone) {
        checkNotNull(series, "series must not be null");
        checkNotNull(zone, "zone must not be null");
        if (series.isEmpty()) {
            throw new InsufficientDataException("cannot build a baseline of an empty series");
        }
        Map<Integer, List<Double>> byHour = new TreeMap<>();
        Map<Integer, List<Double>> byDay = new TreeMap<>();
        List<Double> weekdays = new ArrayList<>();
        List<Double> weekends = new ArrayList<>();
        List<Double> all = new ArrayList<>(series.size());
        ZonedDateTime start = null;
        ZonedDateTime end = null;
        for (TimeSeriesPoint point : series) {
            ZonedDateTime timestamp = point.getTimestamp();
            ZonedDateTime local = timestamp.withZoneSameInstant(zone);
            int day = local.getDayOfWeek().getValue() - 1;
            byHour.computeIfAbsent(local.getHour(), k -> new ArrayList<>()).add(point.getValue());
            byDay.computeIfAbsent(day, k -> new ArrayList<>()).add(point.getValue());
            (day >= 5 ? weekends : weekdays).add(point.getValue());
            all.add(point.getValue());
            if (start == null || timestamp.isBefore(start)) {
                start = timestamp;
            }
            if (end == null || timestamp.isAfter(end)) {
                end = timestamp;
            }
        }

        Map<Integer, HourlyStatistics> hourly = summarize(byHour);
        List<Integer> peakHours = hourly.entrySet().stream()
                .sorted(Comparator.comparingDouble((Map.Entry<Integer, HourlyStatistics> e) -> e.getValue().getMean())
                        .reversed())
                .limit(peakHourCount).map(Map.Entry::getKey).collect(Collectors.toList());

        BaselineProfile profile = BaselineProfile.builder().month(month).zone(zone).hourly(hourly).dayOfWeek(summarize(byDay))
                .weekday(weekdays.isEmpty() ? null : HourlyStatistics.of(toArray(weekdays)))
                .weekend(weekends.isEmpty() ? null : HourlyStatistics.of(toArray(weekends)))
                .overall(HourlyStatistics.of(toArray(all))).peakHours(peakHours).dataStart(start).dataEnd(end)
                .generatedAt(ZonedDateTime.now(clock)).build();
        log.info("built baseline for month {} from {} points, peak hours {}", month, series.size(), peakHours);
        return profile;
    }

    private static Map<Integer, HourlyStatistics> summarize(Map<Integer, List<Double>> groups) {
        Map<Integer, HourlyStatistics> result = new TreeMap<>();
        for (Map.Entry<Integer, List<Double>> entry : groups.entrySet()) {
            result.put(entry.getKey(), HourlyStatistics.of(toArray(entry.getValue())));
        }
        return result;
    }

    private static double[] toArray(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).toArray();
    }
}
