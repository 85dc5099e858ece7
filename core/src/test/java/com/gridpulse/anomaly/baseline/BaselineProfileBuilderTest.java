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

import static com.gridpulse.anomaly.TestUtils.EPSILON;
import static com.gridpulse.anomaly.TestUtils.hourly;
import static com.gridpulse.anomaly.TestUtils.toPoints;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.gridpulse.anomaly.TimeSeriesPoint;
import com.gridpulse.anomaly.errors.InsufficientDataException;
import com.gridpulse.anomaly.returntypes.DeviationClassification;
import com.gridpulse.anomaly.returntypes.Severity;
import com.gridpulse.anomaly.testutils.SyntheticDemandData;

public class BaselineProfileBuilderTest {

    private static final ZonedDateTime MONDAY = ZonedDateTime.of(2024, 11, 4, 0, 0, 0, 0, ZoneOffset.UTC);

    private BaselineProfileBuilder builder;

    @BeforeEach
    public void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-12-01T00:00:00Z"), ZoneOffset.UTC);
        builder = new BaselineProfileBuilder(clock, BaselineProfileBuilder.DEFAULT_PEAK_HOUR_COUNT);
    }

    @Test
    public void testHourlyStatistics() {
        // hours 10 and 11 on three consecutive Mondays
        List<TimeSeriesPoint> series = new ArrayList<>();
        double[] values = { 100, 200, 300 };
        for (int week = 0; week < 3; week++) {
            series.add(new TimeSeriesPoint(MONDAY.plusWeeks(week).plusHours(10), values[week]));
            series.add(new TimeSeriesPoint(MONDAY.plusWeeks(week).plusHours(11), 50));
        }
        BaselineProfile profile = builder.build(series, 11);

        HourlyStatistics ten = profile.lookup(10);
        assertThat(ten.getCount(), is(3));
        assertThat(ten.getMean(), closeTo(200, EPSILON));
        assertThat(ten.getStd(), closeTo(100, EPSILON));
        assertThat(ten.getMedian(), closeTo(200, EPSILON));
        assertThat(ten.getP25(), closeTo(150, EPSILON));
        assertThat(ten.getP95(), closeTo(290, EPSILON));
        assertThat(profile.lookup(11).getStd(), is(0.0));

        assertThat(profile.getMonth(), is(11));
        assertThat(profile.getOverall().getCount(), is(6));
        assertThat(profile.getDayOfWeek().size(), is(1));
        assertNull(profile.getWeekend());
        assertThat(profile.getWeekday().getCount(), is(6));
        assertEquals(Arrays.asList(10, 11), profile.getPeakHours());
        assertThat(profile.getDataStart(), is(MONDAY.plusHours(10)));
        assertThat(profile.getDataEnd(), is(MONDAY.plusWeeks(2).plusHours(11)));
        assertThat(profile.getGeneratedAt().toInstant(), is(Instant.parse("2024-12-01T00:00:00Z")));
    }

    @Test
    public void testMissingHourFallsBackToOverall() {
        BaselineProfile profile = builder.build(hourly(MONDAY, 10, 20, 30));
        assertThat(profile.lookup(23), sameInstance(profile.getOverall()));
        assertThat(profile.lookup(1).getMean(), is(20.0));
        for (int hour = 0; hour < 24; hour++) {
            assertTrue(profile.lookup(hour) != null);
        }
        assertThrows(IllegalArgumentException.class, () -> profile.lookup(24));
        assertThrows(IllegalArgumentException.class, () -> profile.lookup(-1));
        // Monday statistics are preferred over the hour
        assertThat(profile.lookup(2, 0), sameInstance(profile.getDayOfWeek().get(0)));
        assertThat(profile.lookup(2, 3), sameInstance(profile.lookup(2)));
    }

    @Test
    public void testHoursAreReadInTheProfileZone() {
        ZoneId losAngeles = ZoneId.of("America/Los_Angeles");
        List<TimeSeriesPoint> utc = toPoints(new SyntheticDemandData(1).generate(MONDAY, 24 * 14));
        List<TimeSeriesPoint> shifted = utc.stream()
                .map(p -> new TimeSeriesPoint(p.getTimestamp().withZoneSameInstant(losAngeles), p.getValue()))
                .collect(Collectors.toList());

        BaselineProfile fromUtc = builder.build(utc, 11, ZoneOffset.UTC);
        BaselineProfile fromShifted = builder.build(shifted, 11, ZoneOffset.UTC);
        assertThat(fromShifted.getZone(), is(ZoneOffset.UTC));
        assertEquals(fromUtc.getHourly(), fromShifted.getHourly());
        assertEquals(fromUtc.getDayOfWeek(), fromShifted.getDayOfWeek());

        // 18:00 UTC is 10:00 in Los Angeles in November
        BaselineProfile local = builder.build(utc, 11, losAngeles);
        assertThat(local.getZone(), is(losAngeles));
        assertEquals(fromUtc.getHourly().get(18), local.getHourly().get(10));
        ZonedDateTime sixPm = MONDAY.plusWeeks(3).plusHours(18);
        assertThat(local.lookup(sixPm), sameInstance(local.lookup(10)));
        assertThat(fromUtc.lookup(sixPm.withZoneSameInstant(losAngeles)), sameInstance(fromUtc.lookup(18)));
    }

    @Test
    public void testPeakHours() {
        List<TimeSeriesPoint> series = toPoints(new SyntheticDemandData(1).generate(MONDAY, 24 * 28));
        BaselineProfile profile = builder.build(series, 11);
        assertThat(profile.getPeakHours().size(), is(5));
        assertThat(profile.getPeakHours().get(0), is(18));
        assertThat(profile.getHourly().size(), is(24));
        assertThat(profile.getWeekend().getMean() < profile.getWeekday().getMean(), is(true));
        assertThat(profile.lookup(18).getMean(), closeTo(2600 * (20 + 8 * 0.92) / 28, 40));
    }

    @ParameterizedTest
    @CsvSource({ "200, NORMAL, false", "420, MEDIUM, false", "455, HIGH, true", "501, CRITICAL, true",
            "-101, CRITICAL, true" })
    public void testClassifyDeviation(double value, Severity severity, boolean anomalous) {
        // hour 10 has mean 200 and standard deviation 100
        List<TimeSeriesPoint> series = new ArrayList<>();
        series.add(new TimeSeriesPoint(MONDAY.plusHours(10), 100));
        series.add(new TimeSeriesPoint(MONDAY.plusDays(1).plusHours(10), 200));
        series.add(new TimeSeriesPoint(MONDAY.plusDays(2).plusHours(10), 300));
        BaselineProfile profile = builder.build(series);

        DeviationClassification classification = profile.classifyDeviation(value, 10);
        assertThat(classification.getSeverity(), is(severity));
        assertThat(classification.isAnomalous(), is(anomalous));
        assertThat(classification.getDeviationStd(), closeTo((value - 200) / 100, EPSILON));
        assertThat(classification.getExpectedLow(), closeTo(0, EPSILON));
        assertThat(classification.getExpectedHigh(), closeTo(400, EPSILON));
        assertThat(classification.getActualValue(), is(value));
    }

    @Test
    public void testZeroDeviationNeverAnomalous() {
        BaselineProfile profile = builder.build(hourly(MONDAY, 500));
        DeviationClassification classification = profile.classifyDeviation(10000, 0, 1.0);
        assertThat(classification.getDeviationStd(), is(0.0));
        assertFalse(classification.isAnomalous());
        assertThat(classification.getSeverity(), is(Severity.NORMAL));
    }

    @Test
    public void testEmptySeries() {
        assertThrows(InsufficientDataException.class, () -> builder.build(new ArrayList<>()));
        assertThrows(IllegalArgumentException.class, () -> new BaselineProfileBuilder(Clock.systemUTC(), 0));
    }
}
