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

import static com.gridpulse.anomaly.services.TestUtils.hourly;
import static com.gridpulse.anomaly.services.TestUtils.twoNovembers;
import static com.gridpulse.anomaly.services.TestUtils.wiggle;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.oneOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.gridpulse.anomaly.TimeSeriesPoint;
import com.gridpulse.anomaly.baseline.BaselineProfile;
import com.gridpulse.anomaly.baseline.BaselineProfileBuilder;
import com.gridpulse.anomaly.errors.InsufficientDataException;
import com.gridpulse.anomaly.errors.ModelNotFoundException;
import com.gridpulse.anomaly.errors.SchemaMismatchException;
import com.gridpulse.anomaly.errors.TimestampAlignmentException;
import com.gridpulse.anomaly.returntypes.Severity;
import com.gridpulse.anomaly.services.config.FallbackPolicy;
import com.gridpulse.anomaly.services.store.InMemoryModelRepository;
import com.gridpulse.anomaly.services.store.InMemorySeriesStore;

public class FutureAnomalyPredictorTest {

    private static final ZonedDateTime FORECAST_START = ZonedDateTime.of(2025, 11, 3, 0, 0, 0, 0, ZoneOffset.UTC);

    private static final int SPIKE_INDEX = 18;

    private static final double SPIKE = 3850;

    private InMemoryModelRepository repository;

    private InMemorySeriesStore store;

    private MonthlyModelTrainer trainer;

    private BaselineProfile baseline;

    private List<TimeSeriesPoint> tail;

    private List<TimeSeriesPoint> forecast;

    @BeforeEach
    public void setUp() {
        List<TimeSeriesPoint> history = twoNovembers();
        store = new InMemorySeriesStore().put("demand", history);
        trainer = MonthlyModelTrainer.builder().numberOfTrees(50).sampleSize(256).randomSeed(5).build();
        repository = new InMemoryModelRepository();
        repository.saveModel(trainer.train(11, store));
        baseline = new BaselineProfileBuilder().build(history, 11);

        tail = wiggle(FORECAST_START.minusHours(48), 48);
        forecast = new ArrayList<>(wiggle(FORECAST_START, 48));
        forecast.set(SPIKE_INDEX, forecast.get(SPIKE_INDEX).withValue(SPIKE));
    }

    private FutureAnomalyPredictor predictor(FallbackPolicy policy) {
        return FutureAnomalyPredictor.builder().repository(repository).fallbackPolicy(policy).build();
    }

    @Test
    public void testNovemberSpikeIsTheOnlyAnomaly() {
        ForecastBatch batch = predictor(FallbackPolicy.FAIL).predict(forecast, tail, 11, baseline);

        assertThat(batch.getTotalPoints(), is(48));
        assertThat(batch.getModelMonth(), is(11));
        assertThat(batch.getModelType(), is(ModelType.MONTH_SPECIFIC));
        assertThat(batch.getAnomaliesDetected(), is(1));
        PredictionPoint spike = batch.getPoints().get(SPIKE_INDEX);
        assertTrue(spike.isAnomaly());
        assertEquals(SPIKE, spike.getValue());
        assertThat(spike.getSeverity(), oneOf(Severity.HIGH, Severity.CRITICAL));
        assertThat(batch.severityBreakdown().get(Severity.NORMAL), is(47));
        assertEquals(1.0 / 48 * 100, batch.getAnomalyRate(), 0.01);
    }

    @Test
    public void testZoneShiftedInputScoresIdentically() {
        ZoneId losAngeles = ZoneId.of("America/Los_Angeles");
        ForecastBatch utc = predictor(FallbackPolicy.FAIL).predict(forecast, tail, 11, baseline);
        ForecastBatch local = predictor(FallbackPolicy.FAIL).predict(inZone(forecast, losAngeles),
                inZone(tail, losAngeles), 11, baseline);

        for (int i = 0; i < forecast.size(); i++) {
            PredictionPoint expected = utc.getPoints().get(i);
            PredictionPoint actual = local.getPoints().get(i);
            assertEquals(expected.getAnomalyScore(), actual.getAnomalyScore(), "point " + i);
            assertThat(actual.isAnomaly(), is(expected.isAnomaly()));
            assertThat(actual.getSeverity(), is(expected.getSeverity()));
        }
        assertThat(local.getAnomaliesDetected(), is(1));
        assertTrue(local.getPoints().get(SPIKE_INDEX).isAnomaly());

        ForecastBatch unsuppressed = predictor(FallbackPolicy.FAIL).predict(forecast, tail, 11);
        ForecastBatch unsuppressedLocal = predictor(FallbackPolicy.FAIL).predict(inZone(forecast, losAngeles),
                inZone(tail, losAngeles), 11);
        assertThat(unsuppressedLocal.getAnomaliesDetected(), is(unsuppressed.getAnomaliesDetected()));
    }

    private static List<TimeSeriesPoint> inZone(List<TimeSeriesPoint> points, ZoneId zone) {
        return points.stream().map(p -> new TimeSeriesPoint(p.getTimestamp().withZoneSameInstant(zone), p.getValue()))
                .collect(Collectors.toList());
    }

    @Test
    public void testUnknownPersistedColumnIsSchemaMismatch() {
        MonthlyModel trained = repository.findModel(11).get();
        List<String> columns = new ArrayList<>(trained.getFeatureColumns());
        columns.set(columns.size() - 1, "solar_output");
        MonthlyModel renamed = MonthlyModel.builder().month(11).modelType(ModelType.MONTH_SPECIFIC)
                .scorer(trained.getScorer()).scaler(trained.getScaler()).featureColumns(columns)
                .window(trained.getWindow()).contamination(trained.getContamination()).build();
        InMemoryModelRepository renamedRepository = new InMemoryModelRepository();
        renamedRepository.saveModel(renamed);
        FutureAnomalyPredictor predictor = FutureAnomalyPredictor.builder().repository(renamedRepository).build();

        SchemaMismatchException e = assertThrows(SchemaMismatchException.class,
                () -> predictor.predict(forecast, tail, 11, baseline));
        assertEquals("solar_output", e.getContext().get("column"));
    }

    @Test
    public void testScoresDoNotDependOnSuppression() {
        ForecastBatch raw = predictor(FallbackPolicy.FAIL).predict(forecast, tail, 11);
        ForecastBatch filtered = predictor(FallbackPolicy.FAIL).predict(forecast, tail, 11, baseline);
        for (int i = 0; i < forecast.size(); i++) {
            PredictionPoint before = raw.getPoints().get(i);
            PredictionPoint after = filtered.getPoints().get(i);
            assertEquals(before.getAnomalyScore(), after.getAnomalyScore());
            // suppression only ever clears flags
            assertTrue(before.isAnomaly() || !after.isAnomaly());
        }
        assertTrue(raw.getAnomaliesDetected() >= filtered.getAnomaliesDetected());
    }

    @Test
    public void testSeverityFollowsConfidence() {
        ForecastBatch batch = predictor(FallbackPolicy.FAIL).predict(forecast, tail, 11);
        for (PredictionPoint point : batch.getPoints()) {
            assertThat(point.getSeverity(), is(SeverityClassifier.classify(point.isAnomaly(), point.getConfidence())));
            assertTrue(point.getConfidence() >= 0 && point.getConfidence() <= 100);
        }
    }

    @Test
    public void testMissingModelFails() {
        assertThrows(ModelNotFoundException.class, () -> predictor(FallbackPolicy.FAIL).predict(
                wiggle(FORECAST_START.minusMonths(1), 24), wiggle(FORECAST_START.minusMonths(1).minusHours(48), 48),
                10));
        assertThrows(ModelNotFoundException.class, () -> predictor(FallbackPolicy.GENERIC).resolveModel(10));
    }

    @Test
    public void testGenericFallback() {
        repository.saveModel(trainer.trainGeneric(store));
        FutureAnomalyPredictor predictor = predictor(FallbackPolicy.GENERIC);
        assertThat(predictor.resolveModel(10).getModelType(), is(ModelType.GENERIC));
        assertThat(predictor.resolveModel(11).getModelType(), is(ModelType.MONTH_SPECIFIC));
        assertThrows(ModelNotFoundException.class, () -> predictor(FallbackPolicy.FAIL).resolveModel(10));
    }

    @Test
    public void testEmptyForecast() {
        assertThrows(InsufficientDataException.class,
                () -> predictor(FallbackPolicy.FAIL).predict(Collections.emptyList(), tail, 11));
    }

    @Test
    public void testTailShorterThanWindow() {
        List<TimeSeriesPoint> shortTail = tail.subList(tail.size() - 10, tail.size());
        assertThrows(InsufficientDataException.class,
                () -> predictor(FallbackPolicy.FAIL).predict(forecast, shortTail, 11));
    }

    @Test
    public void testForecastOverlappingTail() {
        List<TimeSeriesPoint> overlapping = wiggle(FORECAST_START.minusHours(1), 48);
        assertThrows(TimestampAlignmentException.class,
                () -> predictor(FallbackPolicy.FAIL).predict(overlapping, tail, 11));
    }

    @Test
    public void testForecastTooFarAfterTail() {
        List<TimeSeriesPoint> late = wiggle(FORECAST_START.plusDays(3), 48);
        assertThrows(TimestampAlignmentException.class,
                () -> predictor(FallbackPolicy.FAIL).predict(late, tail, 11));
    }

    @Test
    public void testUnorderedForecast() {
        List<TimeSeriesPoint> unordered = new ArrayList<>(forecast);
        Collections.swap(unordered, 3, 4);
        assertThrows(TimestampAlignmentException.class,
                () -> predictor(FallbackPolicy.FAIL).predict(unordered, tail, 11));
    }

    @Test
    public void testInvalidMonth() {
        assertThrows(IllegalArgumentException.class,
                () -> predictor(FallbackPolicy.FAIL).predict(forecast, tail, 13));
    }

    @Test
    public void testMedianSpacing() {
        List<TimeSeriesPoint> points = new ArrayList<>(hourly(FORECAST_START, 1, 2, 3));
        points.add(new TimeSeriesPoint(FORECAST_START.plusHours(10), 4));
        assertThat(FutureAnomalyPredictor.medianSpacing(points), is(Duration.ofHours(1)));
        assertFalse(FutureAnomalyPredictor.medianSpacing(points).isNegative());
    }
}
