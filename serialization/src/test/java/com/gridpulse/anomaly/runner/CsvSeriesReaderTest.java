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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.time.ZonedDateTime;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.gridpulse.anomaly.TimeSeriesPoint;

public class CsvSeriesReaderTest {

    private static BufferedReader reader(String text) {
        return new BufferedReader(new StringReader(text));
    }

    @Test
    public void testRead() throws IOException {
        List<TimeSeriesPoint> points = new CsvSeriesReader(",", true)
                .read(reader("timestamp,demand_mw\n2025-11-03T18:00:00-08:00,3850.0\n\n2025-11-03T19:00-08:00, 2600\n"));
        assertThat(points.size(), is(2));
        assertTrue(points.get(0).getTimestamp().isEqual(ZonedDateTime.parse("2025-11-04T02:00:00Z")));
        assertEquals(3850.0, points.get(0).getValue());
        assertEquals(2600.0, points.get(1).getValue());
        assertThat(points.get(1).getTimestamp().getHour(), is(19));
    }

    @Test
    public void testDelimiter() throws IOException {
        List<TimeSeriesPoint> points = new CsvSeriesReader(";", false).read(reader("2025-11-03T18:00:00Z;1.5"));
        assertEquals(1.5, points.get(0).getValue());
    }

    @Test
    public void testMalformedRows() {
        CsvSeriesReader csv = new CsvSeriesReader(",", false);
        assertThrows(IllegalArgumentException.class, () -> csv.read(reader("2025-11-03T18:00:00Z,1,2")));
        assertThrows(IllegalArgumentException.class, () -> csv.read(reader("yesterday,1")));
        assertThrows(IllegalArgumentException.class, () -> csv.read(reader("2025-11-03T18:00:00Z,lots")));
        assertThrows(IllegalArgumentException.class, () -> csv.read(reader("2025-11-03T18:00:00Z,NaN")));
    }
}
