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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.gridpulse.anomaly.returntypes.Severity;

public class ForecastBatchTest {

    private static final ZonedDateTime START = ZonedDateTime.of(2025, 11, 3, 0, 0, 0, 0, ZoneOffset.UTC);

    private PredictionPoint critical;

    private PredictionPoint medium;

    private ForecastBatch batch;

    @BeforeEach
    public void setUp() {
        critical = new PredictionPoint(START.plusHours(1), 3850, true, 1.2, 100, Severity.CRITICAL);
        medium = new PredictionPoint(START.plusHours(2), 2900, true, 0.55, 55, Severity.MEDIUM);
        batch = new ForecastBatch(List.of(new PredictionPoint(START, 2000, false, 0.3, 30, Severity.NORMAL),
                critical, medium, new PredictionPoint(START.plusHours(3), 2100, false, 0.2, 20, Severity.NORMAL)),
                11, ModelType.MONTH_SPECIFIC, START);
    }

    @Test
    public void testSummary() {
        assertThat(batch.getTotalPoints(), is(4));
        assertThat(batch.getAnomaliesDetected(), is(2));
        assertEquals(50.0, batch.getAnomalyRate());
        assertThat(batch.getForecastStart(), is(START));
        assertThat(batch.getForecastEnd(), is(START.plusHours(3)));
        assertThat(batch.getForecastPeriod(), is(START + " to " + START.plusHours(3)));
        assertThat(batch.alerts(), contains(critical, medium));
    }

    @Test
    public void testSeverityBreakdownHasEveryTier() {
        Map<Severity, Integer> breakdown = batch.severityBreakdown();
        assertThat(breakdown.get(Severity.NORMAL), is(2));
        assertThat(breakdown.get(Severity.MEDIUM), is(1));
        assertThat(breakdown.get(Severity.HIGH), is(0));
        assertThat(breakdown.get(Severity.CRITICAL), is(1));
        assertThat(breakdown.values().stream().mapToInt(Integer::intValue).sum(), is(batch.getTotalPoints()));
    }

    @Test
    public void testAnomalyRateIsRounded() {
        ForecastBatch third = new ForecastBatch(List.of(critical, batch.getPoints().get(0), batch.getPoints().get(3)),
                11, ModelType.MONTH_SPECIFIC, START);
        assertEquals(33.33, third.getAnomalyRate());
    }

    @Test
    public void testInvalidPoints() {
        assertThrows(IllegalArgumentException.class,
                () -> new ForecastBatch(Collections.emptyList(), 11, ModelType.MONTH_SPECIFIC, START));
        assertThrows(IllegalArgumentException.class,
                () -> new PredictionPoint(START, 1, false, 0.9, 90, Severity.CRITICAL));
        assertThrows(IllegalArgumentException.class,
                () -> new PredictionPoint(START, 1, true, 1.5, 150, Severity.CRITICAL));
    }
}
