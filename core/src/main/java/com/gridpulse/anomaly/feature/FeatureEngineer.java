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

package com.gridpulse.anomaly.feature;

import static com.gridpulse.anomaly.CommonUtils.checkArgument;
import static com.gridpulse.anomaly.CommonUtils.checkNotNull;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.IsoFields;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

import lombok.extern.slf4j.Slf4j;

import com.gridpulse.anomaly.TimeSeriesPoint;

/**
 * Turns an ordered series into a {@link FeatureTable}: calendar encodings read
 * in one zone, trailing rolling statistics and first differences. The same
 * instants give the same features whatever offset they are stamped with.
 *
 * <p>
 * Rolling statistics use a trailing window that includes the current row and
 * needs a single observation to produce a value, so the features of a row only
 * depend on that row and the {@code window - 1} rows before it. Values that
 * remain undefined (the standard deviation of a single point, the first
 * difference, the percent change after a zero) are filled forward from the last
 * defined row; leading gaps are then filled backward, and a column with no
 * defined value at all becomes 0. A row therefore only takes a later row's
 * value when nothing precedes it.
 */
@Slf4j
public final class FeatureEngineer {

    /** window used for hourly demand */
    public static final int DEFAULT_DEMAND_WINDOW = 24;

    /** window used for 5 minute price series */
    public static final int DEFAULT_PRICE_WINDOW = 288;

    public static final String DEFAULT_TARGET_NAME = "demand";

    /** added to the rolling standard deviation before dividing */
    public static final double ZSCORE_EPSILON = 1e-8;

    public static final ZoneId DEFAULT_ZONE = ZoneOffset.UTC;

    private FeatureEngineer() {
    }

    public static FeatureTable engineer(List<TimeSeriesPoint> series) {
        return engineer(series, DEFAULT_TARGET_NAME, DEFAULT_DEMAND_WINDOW);
    }

    /**
     * @param series     points sorted ascending by timestamp, never re-sorted here
     * @param targetName the name of the series, kept as table metadata
     * @param window     the number of trailing rows used by rolling statistics
     * @return one row per input point
     */
    public static FeatureTable engineer(List<TimeSeriesPoint> series, String targetName, int window) {
        return engineer(series, targetName, window, DEFAULT_ZONE);
    }

    /**
     * @param series     points sorted ascending by timestamp, never re-sorted here
     * @param targetName the name of the series, kept as table metadata
     * @param window     the number of trailing rows used by rolling statistics
     * @param zone       the zone in which hours, days and months are read
     * @return one row per input point
     */
    public static FeatureTable engineer(List<TimeSeriesPoint> series, String targetName, int window, ZoneId zone) {
        checkNotNull(series, "series must not be null");
        checkArgument(!series.isEmpty(), "cannot engineer features of an empty series");
        checkArgument(window > 0, "window must be positive");
        checkNotNull(zone, "zone must not be null");
        int n = series.size();
        List<ZonedDateTime> timestamps = new ArrayList<>(n);
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            TimeSeriesPoint point = series.get(i);
            if (i > 0) {
                checkArgument(!point.getTimestamp().toInstant().isBefore(series.get(i - 1).getTimestamp().toInstant()),
                        "series must be sorted by timestamp, found " + point.getTimestamp() + " after "
                                + series.get(i - 1).getTimestamp());
            }
            timestamps.add(point.getTimestamp());
            values[i] = point.getValue();
        }

        LinkedHashMap<String, double[]> columns = new LinkedHashMap<>();
        for (String name : FeatureColumns.ALL) {
            columns.put(name, new double[n]);
        }
        for (int i = 0; i < n; i++) {
            fillCalendar(columns, i, timestamps.get(i).withZoneSameInstant(zone));
        }
        fillRolling(columns, values, window);
        fillDifferences(columns, values);

        double[] mean = columns.get(FeatureColumns.ROLLING_MEAN);
        double[] std = columns.get(FeatureColumns.ROLLING_STD);
        double[] zscore = columns.get(FeatureColumns.ZSCORE);
        for (int i = 0; i < n; i++) {
            zscore[i] = (values[i] - mean[i]) / (std[i] + ZSCORE_EPSILON);
        }

        for (double[] column : columns.values()) {
            fillGaps(column);
        }
        log.debug("engineered {} rows of {} with window {} in {}", n, targetName, window, zone);
        return new FeatureTable(targetName, window, timestamps, columns);
    }

    private static void fillCalendar(LinkedHashMap<String, double[]> columns, int row, ZonedDateTime timestamp) {
        int hour = timestamp.getHour();
        int dayOfWeek = timestamp.getDayOfWeek().getValue() - 1;
        int month = timestamp.getMonthValue();
        columns.get(FeatureColumns.HOUR)[row] = hour;
        columns.get(FeatureColumns.DAY_OF_WEEK)[row] = dayOfWeek;
        columns.get(FeatureColumns.DAY_OF_MONTH)[row] = timestamp.getDayOfMonth();
        columns.get(FeatureColumns.HOUR_SIN)[row] = Math.sin(2 * Math.PI * hour / 24);
        columns.get(FeatureColumns.HOUR_COS)[row] = Math.cos(2 * Math.PI * hour / 24);
        columns.get(FeatureColumns.DOW_SIN)[row] = Math.sin(2 * Math.PI * dayOfWeek / 7);
        columns.get(FeatureColumns.DOW_COS)[row] = Math.cos(2 * Math.PI * dayOfWeek / 7);
        columns.get(FeatureColumns.IS_WEEKEND)[row] = (dayOfWeek >= 5) ? 1 : 0;
        columns.get(FeatureColumns.MONTH)[row] = month;
        columns.get(FeatureColumns.WEEK_OF_YEAR)[row] = timestamp.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR);
        columns.get(FeatureColumns.IS_SUMMER)[row] = (month >= 6 && month <= 9) ? 1 : 0;
        columns.get(FeatureColumns.IS_WINTER)[row] = (month == 12 || month <= 2) ? 1 : 0;
    }

    private static void fillRolling(LinkedHashMap<String, double[]> columns, double[] values, int window) {
        double[] value = columns.get(FeatureColumns.VALUE);
        double[] mean = columns.get(FeatureColumns.ROLLING_MEAN);
        double[] std = columns.get(FeatureColumns.ROLLING_STD);
        double[] min = columns.get(FeatureColumns.ROLLING_MIN);
        double[] max = columns.get(FeatureColumns.ROLLING_MAX);
        for (int i = 0; i < values.length; i++) {
            value[i] = values[i];
            int start = Math.max(0, i - window + 1);
            int count = i - start + 1;
            double sum = 0;
            double low = Double.POSITIVE_INFINITY;
            double high = Double.NEGATIVE_INFINITY;
            for (int j = start; j <= i; j++) {
                sum += values[j];
                low = Math.min(low, values[j]);
                high = Math.max(high, values[j]);
            }
            double average = sum / count;
            mean[i] = average;
            min[i] = low;
            max[i] = high;
            if (count < 2) {
                std[i] = Double.NaN;
            } else {
                double squares = 0;
                for (int j = start; j <= i; j++) {
                    squares += (values[j] - average) * (values[j] - average);
                }
                std[i] = Math.sqrt(squares / (count - 1));
            }
        }
    }

    private static void fillDifferences(LinkedHashMap<String, double[]> columns, double[] values) {
        double[] diff = columns.get(FeatureColumns.DIFF);
        double[] pctChange = columns.get(FeatureColumns.PCT_CHANGE);
        diff[0] = Double.NaN;
        pctChange[0] = Double.NaN;
        for (int i = 1; i < values.length; i++) {
            diff[i] = values[i] - values[i - 1];
            pctChange[i] = (values[i - 1] == 0) ? Double.NaN : diff[i] / values[i - 1];
        }
    }

    /**
     * Forward fill, then backward fill the leading gap; all-undefined becomes 0.
     */
    static void fillGaps(double[] column) {
        double previous = Double.NaN;
        for (int i = 0; i < column.length; i++) {
            if (Double.isNaN(column[i])) {
                column[i] = previous;
            } else {
                previous = column[i];
            }
        }
        double next = Double.NaN;
        for (int i = column.length - 1; i >= 0; i--) {
            if (Double.isNaN(column[i])) {
                column[i] = next;
            } else {
                next = column[i];
            }
        }
        for (int i = 0; i < column.length; i++) {
            if (Double.isNaN(column[i])) {
                column[i] = 0;
            }
        }
    }
}
