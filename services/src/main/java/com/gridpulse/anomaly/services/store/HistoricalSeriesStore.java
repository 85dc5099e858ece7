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

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

import com.gridpulse.anomaly.TimeSeriesPoint;

/**
 * Read access to recorded series, for example hourly demand kept in a
 * database. Implementations return points sorted ascending by timestamp.
 */
public interface HistoricalSeriesStore {

    /**
     * @param series the series name, e.g. "demand"
     * @param start  inclusive
     * @param end    exclusive
     * @return the points in [start, end), ascending
     */
    List<TimeSeriesPoint> query(String series, ZonedDateTime start, ZonedDateTime end);

    /**
     * @return every point of the series, ascending
     */
    List<TimeSeriesPoint> queryAll(String series);

    /**
     * The points of every year whose calendar month, read in {@code zone}, is
     * {@code month}.
     */
    default List<TimeSeriesPoint> queryCalendarMonth(String series, int month, ZoneId zone) {
        checkArgument(month >= 1 && month <= 12, "month must be between 1 and 12");
        return queryAll(series).stream()
                .filter(p -> p.getTimestamp().withZoneSameInstant(zone).getMonthValue() == month)
                .sorted(Comparator.comparing(p -> p.getTimestamp().toInstant())).collect(Collectors.toList());
    }

    /**
     * Up to {@code count} points strictly before {@code before}, ascending.
     */
    default List<TimeSeriesPoint> tail(String series, ZonedDateTime before, int count) {
        checkArgument(count >= 0, "count must not be negative");
        List<TimeSeriesPoint> earlier = queryAll(series).stream()
                .filter(p -> p.getTimestamp().toInstant().isBefore(before.toInstant())).collect(Collectors.toList());
        return new ArrayList<>(earlier.subList(Math.max(0, earlier.size() - count), earlier.size()));
    }
}
