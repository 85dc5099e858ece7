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
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ForkJoinPool;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.gridpulse.anomaly.TimeSeriesPoint;
import com.gridpulse.anomaly.errors.InsufficientTrainingDataException;
import com.gridpulse.anomaly.feature.FeatureColumns;
import com.gridpulse.anomaly.feature.FeatureEngineer;
import com.gridpulse.anomaly.feature.FeatureTable;
import com.gridpulse.anomaly.forest.RandomCutForestScorer;
import com.gridpulse.anomaly.preprocessor.StandardScaler;
import com.gridpulse.anomaly.services.store.HistoricalSeriesStore;
import com.gridpulse.anomaly.statistics.SampleStatistics;

/**
 * Trains one outlier scorer per calendar month from every year of history, so
 * that a forecast for November is judged against what November usually looks
 * like. A generic model over all history can be trained as well; it is only
 * used when a fallback to it is explicitly configured.
 *
 * <p>
 * Features are engineered separately for each calendar year so that rolling
 * windows and differences never bridge the gap between, say, November 2023 and
 * November 2024.
 */
@Slf4j
@Getter
public class MonthlyModelTrainer {

    public static final int DEFAULT_MINIMUM_SAMPLES = 100;

    public static final double DEFAULT_MONTHLY_CONTAMINATION = 0.02;

    public static final double DEFAULT_GENERIC_CONTAMINATION = 0.20;

    public static final String DEFAULT_SERIES_NAME = "demand";

    private final String seriesName;

    private final ZoneId zone;

    private final int minimumSamples;

    private final double contamination;

    private final Map<Integer, Double> monthlyContamination;

    private final double genericContamination;

    private final List<String> featureColumns;

    private final int window;

    private final int numberOfTrees;

    private final int sampleSize;

    private final Optional<Long> randomSeed;

    private final int threadPoolSize;

    private final Clock clock;

    protected MonthlyModelTrainer(Builder<?> builder) {
        checkArgument(builder.minimumSamples > 0, "minimumSamples must be positive");
        checkContamination(builder.contamination);
        checkContamination(builder.genericContamination);
        builder.monthlyContamination.forEach((month, value) -> {
            checkArgument(month >= 1 && month <= 12, "month must be between 1 and 12");
            checkContamination(value);
        });
        checkArgument(!builder.featureColumns.isEmpty(), "featureColumns must not be empty");
        for (String column : builder.featureColumns) {
            checkArgument(FeatureColumns.ALL.contains(column), "unknown feature column " + column);
        }
        checkArgument(builder.window > 0, "window must be positive");
        checkArgument(builder.threadPoolSize.orElse(1) > 0, "threadPoolSize must be positive");
        seriesName = checkNotNull(builder.seriesName, "seriesName must not be null");
        zone = checkNotNull(builder.zone, "zone must not be null");
        clock = checkNotNull(builder.clock, "clock must not be null");
        minimumSamples = builder.minimumSamples;
        contamination = builder.contamination;
        monthlyContamination = Collections.unmodifiableMap(new HashMap<>(builder.monthlyContamination));
        genericContamination = builder.genericContamination;
        featureColumns = Collections.unmodifiableList(new ArrayList<>(builder.featureColumns));
        window = builder.window;
        numberOfTrees = builder.numberOfTrees;
        sampleSize = builder.sampleSize;
        randomSeed = builder.randomSeed;
        threadPoolSize = builder.threadPoolSize.orElse(Runtime.getRuntime().availableProcessors());
    }

    private static void checkContamination(double value) {
        checkArgument(value > 0 && value < 1, "contamination must be in (0, 1)");
    }

    public double contaminationFor(int month) {
        return monthlyContamination.getOrDefault(month, contamination);
    }

    /**
     * Trains the model of one calendar month.
     *
     * @param month 1 to 12
     * @param store the history
     * @return the trained model
     * @throws InsufficientTrainingDataException if the month has fewer than
     *                                           {@link #getMinimumSamples()}
     *                                           points
     */
    public MonthlyModel train(int month, HistoricalSeriesStore store) {
        checkArgument(month >= 1 && month <= 12, "month must be between 1 and 12");
        checkNotNull(store, "store must not be null");
        List<TimeSeriesPoint> points = store.queryCalendarMonth(seriesName, month, zone);
        log.info("training {} model on {} points", MonthlyModel.monthName(month), points.size());
        return fit(month, ModelType.MONTH_SPECIFIC, points, contaminationFor(month));
    }

    /**
     * Trains the all-history model used by the generic fallback.
     */
    public MonthlyModel trainGeneric(HistoricalSeriesStore store) {
        checkNotNull(store, "store must not be null");
        List<TimeSeriesPoint> points = store.queryAll(seriesName);
        log.info("training generic model on {} points", points.size());
        return fit(MonthlyModel.GENERIC_MONTH, ModelType.GENERIC, points, genericContamination);
    }

    /**
     * Trains the twelve months in parallel, one task per month.
     *
     * @param store the history
     * @return the result of each month, January first
     */
    public Map<Integer, TrainingResult> trainAll(HistoricalSeriesStore store) {
        checkNotNull(store, "store must not be null");
        ForkJoinPool forkJoinPool = new ForkJoinPool(threadPoolSize);
        try {
            List<TrainingResult> results = forkJoinPool.submit(() -> IntStream.rangeClosed(1, 12).parallel()
                    .mapToObj(month -> trainQuietly(month, store)).collect(Collectors.toList())).join();
            // the parallel stream keeps encounter order
            Map<Integer, TrainingResult> byMonth = new LinkedHashMap<>();
            results.forEach(result -> byMonth.put(result.getMonth(), result));
            long successes = byMonth.values().stream().filter(TrainingResult::isSuccess).count();
            log.info("trained {} of 12 monthly models", successes);
            return byMonth;
        } finally {
            forkJoinPool.shutdown();
        }
    }

    private TrainingResult trainQuietly(int month, HistoricalSeriesStore store) {
        try {
            return TrainingResult.success(train(month, store));
        } catch (InsufficientTrainingDataException e) {
            log.warn("skipping {}: {}", MonthlyModel.monthName(month), e.getMessage());
            return TrainingResult.insufficientData(month, e.getMessage());
        } catch (RuntimeException e) {
            log.error("training {} failed", MonthlyModel.monthName(month), e);
            return TrainingResult.error(month, e.getMessage() == null ? e.getClass().getName() : e.getMessage());
        }
    }

    MonthlyModel fit(int month, ModelType modelType, List<TimeSeriesPoint> points, double contaminationRate) {
        if (points.size() < minimumSamples) {
            throw new InsufficientTrainingDataException(month, points.size(), minimumSamples);
        }
        FeatureTable table = engineerByYear(points);
        double[][] matrix = table.matrix(featureColumns);
        StandardScaler scaler = StandardScaler.fit(matrix);

        RandomCutForestScorer.Builder<?> scorerBuilder = RandomCutForestScorer.builder().numberOfTrees(numberOfTrees)
                .sampleSize(sampleSize).contamination(contaminationRate).trainingData(scaler.transform(matrix));
        randomSeed.ifPresent(seed -> scorerBuilder.randomSeed(seed + month));
        RandomCutForestScorer scorer = scorerBuilder.build();

        double[] values = points.stream().mapToDouble(TimeSeriesPoint::getValue).toArray();
        MonthlyModel model = MonthlyModel.builder().month(month).modelType(modelType).scorer(scorer).scaler(scaler)
                .featureColumns(featureColumns).window(window).zone(zone).contamination(contaminationRate)
                .trainedAt(ZonedDateTime.now(clock)).trainingStart(points.get(0).getTimestamp())
                .trainingEnd(points.get(points.size() - 1).getTimestamp()).samples(points.size())
                .anomaliesDetected(scorer.getAnomaliesInTraining()).averageValue(SampleStatistics.mean(values))
                .stdValue(SampleStatistics.sampleStd(values)).minValue(SampleStatistics.min(values))
                .maxValue(SampleStatistics.max(values)).build();
        log.info("trained {} model: {} samples, {} anomalies ({}%), mean {} std {} range [{}, {}]",
                model.getMonthName(), model.getSamples(), model.getAnomaliesDetected(),
                String.format("%.2f", 100.0 * model.getAnomaliesDetected() / model.getSamples()),
                String.format("%.1f", model.getAverageValue()), String.format("%.1f", model.getStdValue()),
                String.format("%.1f", model.getMinValue()), String.format("%.1f", model.getMaxValue()));
        return model;
    }

    /**
     * Engineers features for each calendar year (read in the configured zone)
     * separately and appends the results in order.
     */
    FeatureTable engineerByYear(List<TimeSeriesPoint> points) {
        Map<Integer, List<TimeSeriesPoint>> byYear = new TreeMap<>();
        for (TimeSeriesPoint point : points) {
            byYear.computeIfAbsent(point.getTimestamp().withZoneSameInstant(zone).getYear(), k -> new ArrayList<>())
                    .add(point);
        }
        List<FeatureTable> tables = new ArrayList<>();
        for (List<TimeSeriesPoint> segment : byYear.values()) {
            tables.add(FeatureEngineer.engineer(segment, seriesName, window, zone));
        }
        return FeatureTable.concatenate(tables);
    }

    public static Builder<?> builder() {
        return new Builder<>();
    }

    public static class Builder<T extends Builder<T>> {

        private String seriesName = DEFAULT_SERIES_NAME;
        private ZoneId zone = ZoneOffset.UTC;
        private int minimumSamples = DEFAULT_MINIMUM_SAMPLES;
        private double contamination = DEFAULT_MONTHLY_CONTAMINATION;
        private final Map<Integer, Double> monthlyContamination = new HashMap<>();
        private double genericContamination = DEFAULT_GENERIC_CONTAMINATION;
        private List<String> featureColumns = FeatureColumns.DEFAULT_MONTHLY;
        private int window = FeatureEngineer.DEFAULT_DEMAND_WINDOW;
        private int numberOfTrees = RandomCutForestScorer.DEFAULT_NUMBER_OF_TREES;
        private int sampleSize = RandomCutForestScorer.DEFAULT_SAMPLE_SIZE;
        private Optional<Long> randomSeed = Optional.empty();
        private Optional<Integer> threadPoolSize = Optional.empty();
        private Clock clock = Clock.systemUTC();

        public T seriesName(String seriesName) {
            this.seriesName = seriesName;
            return (T) this;
        }

        public T zone(ZoneId zone) {
            this.zone = zone;
            return (T) this;
        }

        public T minimumSamples(int minimumSamples) {
            this.minimumSamples = minimumSamples;
            return (T) this;
        }

        public T contamination(double contamination) {
            this.contamination = contamination;
            return (T) this;
        }

        /**
         * Overrides the contamination of a single month.
         */
        public T contamination(int month, double contamination) {
            this.monthlyContamination.put(month, contamination);
            return (T) this;
        }

        public T genericContamination(double genericContamination) {
            this.genericContamination = genericContamination;
            return (T) this;
        }

        public T featureColumns(List<String> featureColumns) {
            this.featureColumns = checkNotNull(featureColumns, "featureColumns must not be null");
            return (T) this;
        }

        public T window(int window) {
            this.window = window;
            return (T) this;
        }

        public T numberOfTrees(int numberOfTrees) {
            this.numberOfTrees = numberOfTrees;
            return (T) this;
        }

        public T sampleSize(int sampleSize) {
            this.sampleSize = sampleSize;
            return (T) this;
        }

        public T randomSeed(long randomSeed) {
            this.randomSeed = Optional.of(randomSeed);
            return (T) this;
        }

        public T threadPoolSize(int threadPoolSize) {
            this.threadPoolSize = Optional.of(threadPoolSize);
            return (T) this;
        }

        public T clock(Clock clock) {
            this.clock = clock;
            return (T) this;
        }

        public MonthlyModelTrainer build() {
            return new MonthlyModelTrainer(this);
        }
    }
}
