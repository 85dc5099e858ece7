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

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.gridpulse.anomaly.TimeSeriesPoint;
import com.gridpulse.anomaly.baseline.BaselineProfile;
import com.gridpulse.anomaly.baseline.BaselineProfileBuilder;
import com.gridpulse.anomaly.errors.InsufficientDataException;
import com.gridpulse.anomaly.errors.SeasonalAnomalyException;
import com.gridpulse.anomaly.services.store.ForecastSource;
import com.gridpulse.anomaly.services.store.HistoricalSeriesStore;
import com.gridpulse.anomaly.services.store.MonthlyModelRepository;

/**
 * The entry points used by the rest of the system: train every month from the
 * history, judge the upcoming forecast with the model of its month, or with the
 * model of every month so a report is ready whichever month is selected.
 */
@Slf4j
@Getter
public class SeasonalAnomalyService {

    public static final int DEFAULT_TAIL_LENGTH = 48;

    private final HistoricalSeriesStore store;

    private final ForecastSource forecastSource;

    private final MonthlyModelRepository repository;

    private final MonthlyModelTrainer trainer;

    private final FutureAnomalyPredictor predictor;

    private final BaselineProfileBuilder baselineBuilder;

    private final int tailLength;

    private final boolean genericModelEnabled;

    protected SeasonalAnomalyService(Builder<?> builder) {
        store = checkNotNull(builder.store, "store must not be null");
        forecastSource = checkNotNull(builder.forecastSource, "forecastSource must not be null");
        repository = checkNotNull(builder.repository, "repository must not be null");
        trainer = (builder.trainer != null) ? builder.trainer : MonthlyModelTrainer.builder().build();
        predictor = (builder.predictor != null) ? builder.predictor
                : FutureAnomalyPredictor.builder().repository(repository).build();
        baselineBuilder = (builder.baselineBuilder != null) ? builder.baselineBuilder : new BaselineProfileBuilder();
        checkArgument(builder.tailLength > 0, "tailLength must be positive");
        tailLength = builder.tailLength;
        genericModelEnabled = builder.genericModelEnabled;
    }

    /**
     * Trains the twelve monthly models and their baselines and saves those that
     * succeed, together with an all-history baseline and, when enabled, the
     * generic model.
     *
     * @return the result of each month, January first
     */
    public Map<Integer, TrainingResult> trainAllMonths() {
        String series = trainer.getSeriesName();
        ZoneId zone = trainer.getZone();
        Map<Integer, TrainingResult> results = trainer.trainAll(store);
        for (TrainingResult result : results.values()) {
            result.getModel().ifPresent(model -> {
                repository.saveModel(model);
                List<TimeSeriesPoint> points = store.queryCalendarMonth(series, model.getMonth(), zone);
                repository.saveBaseline(baselineBuilder.build(points, model.getMonth(), zone));
            });
        }
        List<TimeSeriesPoint> all = store.queryAll(series);
        if (!all.isEmpty()) {
            repository.saveBaseline(baselineBuilder.build(all, 0, zone));
        }
        if (genericModelEnabled) {
            try {
                repository.saveModel(trainer.trainGeneric(store));
            } catch (SeasonalAnomalyException e) {
                log.warn("generic model not trained: {}", e.getMessage());
            }
        }
        log.info("training finished: {}", results.values().stream()
                .collect(Collectors.groupingBy(TrainingResult::getStatus, Collectors.counting())));
        return results;
    }

    /**
     * Judges the forecast of the next {@code hoursAhead} hours with the model of
     * the month {@code asOf} falls in.
     *
     * @param hoursAhead how far ahead to look
     * @param asOf       the current time; only forecast points after it are judged
     * @return the judged forecast
     */
    public ForecastBatch predictFuture(int hoursAhead, ZonedDateTime asOf) {
        checkArgument(hoursAhead > 0, "hoursAhead must be positive");
        checkNotNull(asOf, "asOf must not be null");
        List<TimeSeriesPoint> forecast = forecastSource.queryForecast(hoursAhead).stream()
                .filter(p -> p.getTimestamp().toInstant().isAfter(asOf.toInstant())).collect(Collectors.toList());
        if (forecast.isEmpty()) {
            throw new InsufficientDataException("no forecast points after " + asOf);
        }
        int month = asOf.withZoneSameInstant(trainer.getZone()).getMonthValue();
        return predict(forecast, month);
    }

    /**
     * Judges forecast points with the model of {@code month}, using the history
     * preceding the first point as context and the month's baseline, or the
     * all-history baseline, for suppression.
     *
     * @param forecast the points to judge, ascending
     * @param month    1 to 12
     * @return the judged forecast
     */
    public ForecastBatch predict(List<TimeSeriesPoint> forecast, int month) {
        checkNotNull(forecast, "forecast must not be null");
        if (forecast.isEmpty()) {
            throw new InsufficientDataException("the forecast is empty");
        }
        return predict(forecast, historicalTail(forecast), month);
    }

    /**
     * Judges the same forecast with the model of each month that has one. A
     * month without a model, or whose prediction fails, is reported and the
     * remaining months still run.
     *
     * @param forecast the points to judge, ascending
     * @return the outcome of each month, January first
     */
    public Map<Integer, MonthlyPrediction> predictAllMonths(List<TimeSeriesPoint> forecast) {
        checkNotNull(forecast, "forecast must not be null");
        if (forecast.isEmpty()) {
            throw new InsufficientDataException("the forecast is empty");
        }
        List<TimeSeriesPoint> tail = historicalTail(forecast);
        Map<Integer, MonthlyPrediction> results = new LinkedHashMap<>();
        for (int month = 1; month <= 12; month++) {
            String name = MonthlyModel.monthName(month);
            if (!repository.findModel(month).isPresent()) {
                log.warn("no model for {}", name);
                results.put(month, MonthlyPrediction.modelNotFound(month));
                continue;
            }
            try {
                results.put(month, MonthlyPrediction.success(month, predict(forecast, tail, month)));
            } catch (RuntimeException e) {
                log.error("predicting with the {} model failed", name, e);
                results.put(month, MonthlyPrediction.error(month,
                        e.getMessage() == null ? e.getClass().getName() : e.getMessage()));
            }
        }
        log.info("predictions generated: {} of 12", results.values().stream().filter(MonthlyPrediction::isSuccess)
                .count());
        return results;
    }

    private List<TimeSeriesPoint> historicalTail(List<TimeSeriesPoint> forecast) {
        return store.tail(trainer.getSeriesName(), forecast.get(0).getTimestamp(), tailLength);
    }

    private ForecastBatch predict(List<TimeSeriesPoint> forecast, List<TimeSeriesPoint> tail, int month) {
        Optional<BaselineProfile> baseline = repository.findBaseline(month);
        if (!baseline.isPresent()) {
            baseline = repository.findBaseline(0);
        }
        if (!baseline.isPresent()) {
            log.warn("no baseline for {}, anomalies are not suppressed", MonthlyModel.monthName(month));
        }
        log.info("judging {} forecast points from {} with {} points of history", forecast.size(),
                forecast.get(0).getTimestamp(), tail.size());
        return predictor.predict(forecast, tail, month, baseline.orElse(null));
    }

    public static Builder<?> builder() {
        return new Builder<>();
    }

    public static class Builder<T extends Builder<T>> {

        private HistoricalSeriesStore store;
        private ForecastSource forecastSource;
        private MonthlyModelRepository repository;
        private MonthlyModelTrainer trainer;
        private FutureAnomalyPredictor predictor;
        private BaselineProfileBuilder baselineBuilder;
        private int tailLength = DEFAULT_TAIL_LENGTH;
        private boolean genericModelEnabled = false;

        public T store(HistoricalSeriesStore store) {
            this.store = store;
            return (T) this;
        }

        public T forecastSource(ForecastSource forecastSource) {
            this.forecastSource = forecastSource;
            return (T) this;
        }

        public T repository(MonthlyModelRepository repository) {
            this.repository = repository;
            return (T) this;
        }

        public T trainer(MonthlyModelTrainer trainer) {
            this.trainer = trainer;
            return (T) this;
        }

        public T predictor(FutureAnomalyPredictor predictor) {
            this.predictor = predictor;
            return (T) this;
        }

        public T baselineBuilder(BaselineProfileBuilder baselineBuilder) {
            this.baselineBuilder = baselineBuilder;
            return (T) this;
        }

        public T tailLength(int tailLength) {
            this.tailLength = tailLength;
            return (T) this;
        }

        public T genericModelEnabled(boolean genericModelEnabled) {
            this.genericModelEnabled = genericModelEnabled;
            return (T) this;
        }

        public SeasonalAnomalyService build() {
            return new SeasonalAnomalyService(this);
        }
    }
}
