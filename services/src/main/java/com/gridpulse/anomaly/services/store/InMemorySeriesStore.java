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

import static com.gridpulse.anomaly.CommonUtils.checkNotNull;

import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import com.gridpulse.anomaly.TimeSeriesPoint;

/**
 * A {@link HistoricalSeriesStore} backed by lists held in memory.
 */
public class InMemorySeriesStore implements HistoricalSeriesStore {

    private final Map<String, List<TimeSeriesPoint>> series = new ConcurrentHashMap<>();

    public InMemorySeriesStore put(String name, List<TimeSeriesPoint> points) {
        checkNotNull(name, "name must not be null");
        checkNotNull(points, "points must not be null");
        List<TimeSeriesPoint> sorted = new ArrayList<>(points);
        sorted.sort(Comparator.comparing(p -> p.getTimestamp().toInstant()));
        series.put(name, Collections.unmodifiableList(sorted));
        return this;
    }

    @Override
    public List<TimeSeriesPoint> query(String name, ZonedDateTime start, ZonedDateTime end) {
        return queryAll(name).stream()
                .filter(p -> !p.getTimestamp().toInstant().isBefore(start.toInstant())
                        && p.getTimestamp().toInstant().isBefore(end.toInstant()))
                .collect(Collectors.toList());
    }

    @Override
    public List<TimeSeriesPoint> queryAll(String name) {
        return series.getOrDefault(name, Collections.emptyList());
    }
}
