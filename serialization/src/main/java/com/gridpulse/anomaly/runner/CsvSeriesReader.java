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

package com.gridpulse.anomaly.runner;

import static com.gridpulse.anomaly.CommonUtils.checkNotNull;

import java.io.BufferedReader;
import java.io.IOException;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

import lombok.extern.slf4j.Slf4j;

import com.gridpulse.anomaly.TimeSeriesPoint;

/**
 * Reads {@code timestamp,value} rows with ISO-8601 offset timestamps, e.g.
 * {@code 2025-11-03T18:00:00-08:00,3850.0}. Blank lines are skipped.
 */
@Slf4j
public class CsvSeriesReader {

    private final String delimiter;

    private final boolean headerRow;

    public CsvSeriesReader(String delimiter, boolean headerRow) {
        this.delimiter = checkNotNull(delimiter, "delimiter must not be null");
        this.headerRow = headerRow;
    }

    public List<TimeSeriesPoint> read(BufferedReader in) throws IOException {
        List<TimeSeriesPoint> points = new ArrayList<>();
        String line;
        int lineNumber = 0;
        while ((line = in.readLine()) != null) {
            lineNumber++;
            if ((lineNumber == 1 && headerRow) || line.trim().isEmpty()) {
                continue;
            }
            String[] values = line.split(delimiter);
            if (values.length != 2) {
                throw new IllegalArgumentException(String.format(
                        "Wrong number of values on line %d. Expected 2 but found %d.", lineNumber, values.length));
            }
            try {
                points.add(new TimeSeriesPoint(OffsetDateTime.parse(values[0].trim()).toZonedDateTime(),
                        Double.parseDouble(values[1].trim())));
            } catch (DateTimeParseException | NumberFormatException e) {
                throw new IllegalArgumentException(String.format("Cannot parse line %d: %s", lineNumber, line), e);
            }
        }
        log.debug("read {} points", points.size());
        return points;
    }
}
