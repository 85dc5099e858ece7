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

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import lombok.Builder;
import lombok.Getter;

import com.gridpulse.anomaly.returntypes.DeviationClassification;
import com.gridpulse.anomaly.returntypes.Severity;

/**
 * What normal looks like for a series: statistics per hour of the day, per day
 * of the week and for weekdays against weekends, plus an overall group every
 * lookup falls back to. Hours and days are those of the profile's zone. A
 * profile is immutable.
 */
@Getter
public class BaselineProfile {

    public static final double DEFAULT_THRESHOLD_STD = 2.5;

    public static final double CRITICAL_STD = 3.0;

    public static final double HIGH_STD = 2.5;

    public static final double MEDIUM_STD = 2.0;

    /** the width of the expected range in standard deviations on each side */
    public static final double EXPECTED_RANGE_STD = 2.0;

    /** 1 to 12 for a profile of one calendar month, 0 for all history */
    private final int month;

    private final ZoneId zone;

    private final Map<Integer, HourlyStatistics> hourly;

    private final Map<Integer, HourlyStatistics> dayOfWeek;

    /** null when the data has no weekday */
    private final HourlyStatistics weekday;

    /** null when the data has no weekend day */
    private final HourlyStatistics weekend;

    private final HourlyStatistics overall;

    /** hours with the highest mean, highest first */
    private final List<Integer> peakHours;

    private final ZonedDateTime dataStart;

    private final ZonedDateTime dataEnd;

    private final ZonedDateTime generatedAt;

    @Builder
    public BaselineProfile(int month, ZoneId zone, Map<Integer, HourlyStatistics> hourly, Map<Integer, HourlyStatistics> dayOfWeek,
            HourlyStatistics weekday, HourlyStatistics weekend, HourlyStatistics overall, List<Integer> peakHours,
            ZonedDateTime dataStart, ZonedDateTime dataEnd, ZonedDateTime generatedAt) {
        checkArgument(month >= 0 && month <= 12, "month must be between 0 and 12");
        this.overall = checkNotNull(overall, "overall statistics are required");
        this.month = month;
        this.zone = (zone == null) ? ZoneOffset.UTC : zone;
        this.hourly = Collections.unmodifiableMap(new TreeMap<>(hourly == null ? Map.of() : hourly));
        this.dayOfWeek = Collections.unmodifiableMap(new TreeMap<>(dayOfWeek == null ? Map.of() : dayOfWeek));
        this.weekday = weekday;
        this.weekend = weekend;
        this.peakHours = Collections.unmodifiableList(new ArrayList<>(peakHours == null ? List.of() : peakHours));
        this.dataStart = dataStart;
        this.dataEnd = dataEnd;
        this.generatedAt = generatedAt;
    }

    /**
     * @param timestamp an instant, in any zone
     * @return the statistics of its hour read in this profile's zone
     */
    public HourlyStatistics lookup(ZonedDateTime timestamp) {
        checkNotNull(timestamp, "timestamp must not be null");
        return lookup(timestamp.withZoneSameInstant(zone).getHour());
    }

    /**
     * @param hour the hour of the day, 0 to 23
     * @return the statistics of that hour, or {@link #getOverall()} when the hour
     *         has no data
     */
    public HourlyStatistics lookup(int hour) {
        checkArgument(hour >= 0 && hour <= 23, "hour must be between 0 and 23");
        return hourly.getOrDefault(hour, overall);
    }

    /**
     * @param hour      the hour of the day, 0 to 23
     * @param dayOfWeek 0 for Monday to 6 for Sunday
     * @return the statistics of the day of the week when present, else those of
     *         the hour
     */
    public HourlyStatistics lookup(int hour, int dayOfWeek) {
        checkArgument(dayOfWeek >= 0 && dayOfWeek <= 6, "dayOfWeek must be between 0 and 6");
        HourlyStatistics statistics = this.dayOfWeek.get(dayOfWeek);
        return (statistics != null) ? statistics : lookup(hour);
    }

    public DeviationClassification classifyDeviation(double value, int hour) {
        return classifyDeviation(value, hour, DEFAULT_THRESHOLD_STD);
    }

    /**
     * Compares a value with the statistics of its hour.
     *
     * @param value        the observed value
     * @param hour         the hour of the day of the observation
     * @param thresholdStd deviations beyond this many standard deviations are
     *                     anomalous
     * @return the classification
     */
    public DeviationClassification classifyDeviation(double value, int hour, double thresholdStd) {
        checkArgument(thresholdStd > 0, "thresholdStd must be positive");
        HourlyStatistics statistics = lookup(hour);
        double mean = statistics.getMean();
        double std = statistics.getStd();
        double deviation = (std > 0) ? (value - mean) / std : 0;
        double magnitude = Math.abs(deviation);
        Severity severity;
        if (magnitude > CRITICAL_STD) {
            severity = Severity.CRITICAL;
        } else if (magnitude > HIGH_STD) {
            severity = Severity.HIGH;
        } else if (magnitude > MEDIUM_STD) {
            severity = Severity.MEDIUM;
        } else {
            severity = Severity.NORMAL;
        }
        return new DeviationClassification(magnitude > thresholdStd, deviation, severity, mean,
                mean - EXPECTED_RANGE_STD * std, mean + EXPECTED_RANGE_STD * std, value);
    }
}
