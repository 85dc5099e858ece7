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

import static com.gridpulse.anomaly.CommonUtils.checkArgument;
import static com.gridpulse.anomaly.CommonUtils.checkNotNull;

import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.gridpulse.anomaly.TimeSeriesPoint;
import com.gridpulse.anomaly.baseline.BaselineProfile;
import com.gridpulse.anomaly.errors.InsufficientDataException;
import com.gridpulse.anomaly.errors.ModelNotFoundException;
import com.gridpulse.anomaly.errors.TimestampAlignmentException;
import com.gridpulse.anomaly.feature.FeatureEngineer;
import com.gridpulse.anomaly.feature.FeatureTable;
import com.gridpulse.anomaly.returntypes.Severity;
import com.gridpulse.anomaly.services.config.FallbackPolicy;
import com.gridpulse.anomaly.services.store.MonthlyModelRepository;

/**
 * Judges a forecast horizon against the model of a calendar month.
 *
 * <p>
 * The forecast is appended to the most recent history and features are
 * engineered once over the whole, so the rolling statistics of the first
 * forecast hours are computed from real history. Only the forecast rows are
 * scored. Calendar features are read in the zone the model was trained in,
 * whatever offset the input carries. Flags on points that stay close to the
 * baseline of their hour are then cleared by a
 * {@link BaselineSuppressionFilter}.
 */
@Slf4j
@Getter
public class FutureAnomalyPredictor {

    private final MonthlyModelRepository repository;

    private final FallbackPolicy fallbackPolicy;

    private final BaselineSuppressionFilter suppressionFilter;

    private final Clock clock;

    protected FutureAnomalyPredictor(Builder<?> builder) {
        repository = checkNotNull(builder.repository, "repository must not be null");
        fallbackPolicy = checkNotNull(builder.fallbackPolicy, "fallbackPolicy must not be null");
        suppressionFilter = new BaselineSuppressionFilter(
                checkNotNull(builder.suppressionThresholds, "suppressionThresholds must not be null"));
        clock = checkNotNull(builder.clock, "clock must not be null");
    }

    public ForecastBatch predict(List<TimeSeriesPoint> forecast, List<TimeSeriesPoint> historicalTail,
            int targetMonth) {
        return predict(forecast, historicalTail, targetMonth, null);
    }

    /**
     * @param forecast       the horizon to judge, strictly ascending
     * @param historicalTail the history immediately preceding the forecast,
     *                       strictly ascending and at least one feature window
     *                       long
     * @param targetMonth    the calendar month whose model judges the forecast
     * @param baseline       the profile used to suppress flags, or null to keep
     *                       every flag
     * @return the judged points
     */
    public ForecastBatch predict(List<TimeSeriesPoint> forecast, List<TimeSeriesPoint> historicalTail,
            int targetMonth, BaselineProfile baseline) {
        checkNotNull(forecast, "forecast must not be null");
        checkNotNull(historicalTail, "historicalTail must not be null");
        checkArgument(targetMonth >= 1 && targetMonth <= 12, "targetMonth must be between 1 and 12");
        if (forecast.isEmpty()) {
            throw new InsufficientDataException("the forecast is empty");
        }
        checkStrictlyAscending(historicalTail);
        checkStrictlyAscending(forecast);

        MonthlyModel model = resolveModel(targetMonth);
        int window = model.getWindow();
        if (historicalTail.size() < window) {
            throw InsufficientDataException.shorterThan("the historical tail", historicalTail.size(), window);
        }
        checkAlignment(historicalTail, forecast.get(0), window);

        List<TimeSeriesPoint> combined = new ArrayList<>(historicalTail.size() + forecast.size());
        combined.addAll(historicalTail);
        combined.addAll(forecast);
        FeatureTable features = FeatureEngineer
                .engineer(combined, FeatureEngineer.DEFAULT_TARGET_NAME, window, model.getZone())
                .slice(historicalTail.size(), combined.size());
        double[][] scaled = model.getScaler().transform(features.matrix(model.getFeatureColumns()));

        List<PredictionPoint> points = new ArrayList<>(forecast.size());
        for (int i = 0; i < forecast.size(); i++) {
            double rawScore = model.getScorer().score(scaled[i]);
            boolean anomaly = model.getScorer().isAnomaly(rawScore);
            double anomalyScore = model.normalizedScore(rawScore);
            double confidence = SeverityClassifier.confidence(anomalyScore);
            points.add(new PredictionPoint(forecast.get(i).getTimestamp(), forecast.get(i).getValue(), anomaly,
                    anomalyScore, confidence, SeverityClassifier.classify(anomaly, confidence)));
        }

        if (baseline != null) {
            points = suppressionFilter.apply(points, baseline);
        }
        ForecastBatch batch = new ForecastBatch(points, model.getMonth(), model.getModelType(),
                ZonedDateTime.now(clock));
        log.info("judged {} points from {} with the {} model: {} anomalies ({}%), breakdown {}",
                batch.getTotalPoints(), batch.getForecastStart(), model.getMonthName(), batch.getAnomaliesDetected(),
                batch.getAnomalyRate(), batch.severityBreakdown());
        for (PredictionPoint alert : batch.alerts()) {
            if (alert.getSeverity() == Severity.CRITICAL || alert.getSeverity() == Severity.HIGH) {
                log.info("{} anomaly at {}: {} (confidence {})", alert.getSeverity().label(), alert.getTimestamp(),
                        alert.getValue(), String.format("%.1f", alert.getConfidence()));
            }
        }
        return batch;
    }

    MonthlyModel resolveModel(int targetMonth) {
        Optional<MonthlyModel> model = repository.findModel(targetMonth);
        if (model.isPresent()) {
            return model.get();
        }
        if (fallbackPolicy == FallbackPolicy.GENERIC) {
            log.warn("no model for {}, falling back to the generic model", MonthlyModel.monthName(targetMonth));
            return repository.findGenericModel()
                    .orElseThrow(() -> new ModelNotFoundException(MonthlyModel.GENERIC_MONTH));
        }
        throw new ModelNotFoundException(targetMonth);
    }

    private static void checkStrictlyAscending(List<TimeSeriesPoint> points) {
        for (int i = 1; i < points.size(); i++) {
            ZonedDateTime previous = points.get(i - 1).getTimestamp();
            ZonedDateTime next = points.get(i).getTimestamp();
            if (!previous.toInstant().isBefore(next.toInstant())) {
                throw new TimestampAlignmentException("timestamps must be strictly ascending", previous, next);
            }
        }
    }

    /**
     * The forecast has to start after the tail ends, and not later than one
     * window of the tail's usual spacing.
     */
    private static void checkAlignment(List<TimeSeriesPoint> tail, TimeSeriesPoint first, int window) {
        ZonedDateTime last = tail.get(tail.size() - 1).getTimestamp();
        if (!last.toInstant().isBefore(first.getTimestamp().toInstant())) {
            throw new TimestampAlignmentException("the forecast overlaps the historical tail", last,
                    first.getTimestamp());
        }
        if (tail.size() < 2) {
            return;
        }
        Duration gap = Duration.between(last, first.getTimestamp());
        if (gap.compareTo(medianSpacing(tail).multipliedBy(window)) > 0) {
            throw new TimestampAlignmentException("the forecast starts " + gap + " after the historical tail", last,
                    first.getTimestamp());
        }
    }

    static Duration medianSpacing(List<TimeSeriesPoint> points) {
        List<Duration> spacings = new ArrayList<>(points.size() - 1);
        for (int i = 1; i < points.size(); i++) {
            spacings.add(Duration.between(points.get(i - 1).getTimestamp(), points.get(i).getTimestamp()));
        }
        spacings.sort(null);
        return spacings.get(spacings.size() / 2);
    }

    public static Builder<?> builder() {
        return new Builder<>();
    }

    public static class Builder<T extends Builder<T>> {

        private MonthlyModelRepository repository;
        private FallbackPolicy fallbackPolicy = FallbackPolicy.FAIL;
        private SuppressionThresholds suppressionThresholds = SuppressionThresholds.DEFAULT;
        private Clock clock = Clock.systemUTC();

        public T repository(MonthlyModelRepository repository) {
            this.repository = repository;
            return (T) this;
        }

        public T fallbackPolicy(FallbackPolicy fallbackPolicy) {
            this.fallbackPolicy = fallbackPolicy;
            return (T) this;
        }

        public T suppressionThresholds(SuppressionThresholds suppressionThresholds) {
            this.suppressionThresholds = suppressionThresholds;
            return (T) this;
        }

        public T clock(Clock clock) {
            this.clock = clock;
            return (T) this;
        }

        public FutureAnomalyPredictor build() {
            return new FutureAnomalyPredictor(this);
        }
    }
}
