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

import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.Getter;

import com.gridpulse.anomaly.errors.SchemaMismatchException;

/**
 * Column-oriented table of engineered features. Row {@code i} corresponds to
 * the {@code i}-th input point; the table is immutable and every slice is a
 * copy.
 */
public class FeatureTable {

    /** the name of the series the table was engineered from, e.g. "demand" */
    @Getter
    private final String targetName;

    /** the rolling window the table was engineered with */
    @Getter
    private final int window;

    private final List<ZonedDateTime> timestamps;

    private final LinkedHashMap<String, double[]> columns;

    public FeatureTable(String targetName, int window, List<ZonedDateTime> timestamps,
            Map<String, double[]> columns) {
        checkNotNull(timestamps, "timestamps must not be null");
        checkNotNull(columns, "columns must not be null");
        this.targetName = targetName;
        this.window = window;
        this.timestamps = Collections.unmodifiableList(new ArrayList<>(timestamps));
        this.columns = new LinkedHashMap<>();
        for (Map.Entry<String, double[]> entry : columns.entrySet()) {
            checkArgument(entry.getValue().length == timestamps.size(),
                    "column " + entry.getKey() + " has the wrong number of rows");
            this.columns.put(entry.getKey(), entry.getValue());
        }
    }

    public int size() {
        return timestamps.size();
    }

    public List<ZonedDateTime> getTimestamps() {
        return timestamps;
    }

    public List<String> getColumnNames() {
        return Collections.unmodifiableList(new ArrayList<>(columns.keySet()));
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    /**
     * @param name the column
     * @return a copy of the column values
     * @throws SchemaMismatchException if the column does not exist
     */
    public double[] column(String name) {
        return Arrays.copyOf(require(name), size());
    }

    public double get(int row, String name) {
        checkArgument(row >= 0 && row < size(), "row out of range");
        return require(name)[row];
    }

    /**
     * Rows {@code from} (inclusive) to {@code to} (exclusive).
     */
    public FeatureTable slice(int from, int to) {
        checkArgument(from >= 0 && from <= to && to <= size(), "incorrect slice bounds");
        LinkedHashMap<String, double[]> sliced = new LinkedHashMap<>();
        for (Map.Entry<String, double[]> entry : columns.entrySet()) {
            sliced.put(entry.getKey(), Arrays.copyOfRange(entry.getValue(), from, to));
        }
        return new FeatureTable(targetName, window, timestamps.subList(from, to), sliced);
    }

    /**
     * The rows whose timestamp is at or after the given instant.
     */
    public FeatureTable sliceFrom(ZonedDateTime start) {
        checkNotNull(start, "start must not be null");
        int from = 0;
        while (from < size() && timestamps.get(from).toInstant().isBefore(start.toInstant())) {
            ++from;
        }
        return slice(from, size());
    }

    /**
     * Selected columns as a row-major matrix, in the order requested.
     *
     * @param names the columns to select
     * @return an array of {@link #size()} rows of {@code names.size()} values
     * @throws SchemaMismatchException if a column does not exist
     */
    public double[][] matrix(List<String> names) {
        checkNotNull(names, "names must not be null");
        double[][] selected = new double[names.size()][];
        for (int j = 0; j < names.size(); j++) {
            selected[j] = require(names.get(j));
        }
        double[][] result = new double[size()][names.size()];
        for (int i = 0; i < size(); i++) {
            for (int j = 0; j < names.size(); j++) {
                result[i][j] = selected[j][i];
            }
        }
        return result;
    }

    /**
     * Appends tables with identical columns, in the given order.
     */
    public static FeatureTable concatenate(List<FeatureTable> tables) {
        checkArgument(tables != null && !tables.isEmpty(), "nothing to concatenate");
        FeatureTable first = tables.get(0);
        List<String> names = first.getColumnNames();
        int total = tables.stream().mapToInt(FeatureTable::size).sum();
        List<ZonedDateTime> allTimestamps = new ArrayList<>(total);
        LinkedHashMap<String, double[]> merged = new LinkedHashMap<>();
        for (String name : names) {
            merged.put(name, new double[total]);
        }
        int offset = 0;
        for (FeatureTable table : tables) {
            checkArgument(table.getColumnNames().equals(names), "tables have different columns");
            for (String name : names) {
                System.arraycopy(table.columns.get(name), 0, merged.get(name), offset, table.size());
            }
            allTimestamps.addAll(table.timestamps);
            offset += table.size();
        }
        return new FeatureTable(first.targetName, first.window, allTimestamps, merged);
    }

    private double[] require(String name) {
        double[] values = columns.get(name);
        if (values == null) {
            throw SchemaMismatchException.missingColumn(name);
        }
        return values;
    }
}
