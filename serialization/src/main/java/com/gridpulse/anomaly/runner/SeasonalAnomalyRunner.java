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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import lombok.extern.slf4j.Slf4j;

import com.gridpulse.anomaly.TimeSeriesPoint;
import com.gridpulse.anomaly.serialization.FileSystemModelRepository;
import com.gridpulse.anomaly.serialization.PredictionReportWriter;
import com.gridpulse.anomaly.services.ForecastBatch;
import com.gridpulse.anomaly.services.FutureAnomalyPredictor;
import com.gridpulse.anomaly.services.MonthlyModel;
import com.gridpulse.anomaly.services.MonthlyModelTrainer;
import com.gridpulse.anomaly.services.MonthlyPrediction;
import com.gridpulse.anomaly.services.PredictionPoint;
import com.gridpulse.anomaly.services.SeasonalAnomalyService;
import com.gridpulse.anomaly.services.TrainingResult;
import com.gridpulse.anomaly.services.config.FallbackPolicy;
import com.gridpulse.anomaly.services.store.InMemoryForecastSource;
import com.gridpulse.anomaly.services.store.InMemorySeriesStore;

/**
 * Trains monthly models from a CSV history and judges a CSV forecast with them,
 * either with the model of the forecast's month or with every monthly model.
 * Artifacts and reports are written under the artifacts directory; a summary
 * is written to the output.
 */
@Slf4j
public class SeasonalAnomalyRunner {

    public static final String SERIES_NAME = "demand";

    public static final String PREDICTIONS_DIRECTORY = "predictions";

    private final SeasonalAnomalyArgumentParser argumentParser;

    public SeasonalAnomalyRunner() {
        this(new SeasonalAnomalyArgumentParser(SeasonalAnomalyRunner.class.getName(),
                "Train one anomaly model per calendar month from a demand history and judge a forecast with the "
                        + "model of its month."));
    }

    public SeasonalAnomalyRunner(SeasonalAnomalyArgumentParser argumentParser) {
        this.argumentParser = argumentParser;
    }

    public static void main(String... args) throws IOException {
        SeasonalAnomalyRunner runner = new SeasonalAnomalyRunner();
        runner.parse(args);
        runner.run(new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8)));
    }

    public void parse(String... arguments) {
        argumentParser.parse(arguments);
    }

    public void run(PrintWriter out) throws IOException {
        SeasonalAnomalyArgumentParser.Mode mode = argumentParser.getMode();
        Path artifacts = argumentParser.getArtifacts();
        List<TimeSeriesPoint> history = readSeries(argumentParser.getHistory(), "--history");
        List<TimeSeriesPoint> forecast = mode.readsForecast() ? readSeries(argumentParser.getForecast(), "--forecast")
                : Collections.emptyList();

        FileSystemModelRepository repository = new FileSystemModelRepository(artifacts);
        SeasonalAnomalyService service = SeasonalAnomalyService.builder()
                .store(new InMemorySeriesStore().put(SERIES_NAME, history))
                .forecastSource(new InMemoryForecastSource(forecast)).repository(repository)
                .trainer(MonthlyModelTrainer.builder().seriesName(SERIES_NAME).zone(argumentParser.getZone())
                        .contamination(argumentParser.getContamination()).window(argumentParser.getWindow())
                        .numberOfTrees(argumentParser.getNumberOfTrees()).sampleSize(argumentParser.getSampleSize())
                        .randomSeed(argumentParser.getRandomSeed()).build())
                .predictor(FutureAnomalyPredictor.builder().repository(repository)
                        .fallbackPolicy(argumentParser.getFallbackPolicy())
                        .suppressionThresholds(argumentParser.getSuppressionThresholds()).build())
                .tailLength(argumentParser.getTailLength())
                .genericModelEnabled(argumentParser.getFallbackPolicy() == FallbackPolicy.GENERIC).build();

        if (mode.trains()) {
            Map<Integer, TrainingResult> results = service.trainAllMonths();
            for (TrainingResult result : results.values()) {
                out.println(String.format("%-10s %s%s", MonthlyModel.monthName(result.getMonth()),
                        result.getStatus(), result.getReason() == null ? "" : " (" + result.getReason() + ")"));
            }
        }

        if (mode.predicts()) {
            if (forecast.isEmpty()) {
                throw new IllegalArgumentException("the forecast file has no points");
            }
            int month = argumentParser.getMonth() > 0 ? argumentParser.getMonth()
                    : forecast.get(0).getTimestamp().withZoneSameInstant(argumentParser.getZone()).getMonthValue();
            ForecastBatch batch = service.predict(forecast, month);
            Path report = new PredictionReportWriter(artifacts.resolve(PREDICTIONS_DIRECTORY)).write(batch);
            out.println(String.format("judged %d points (%s) with the %s model: %d anomalies (%.2f%%)",
                    batch.getTotalPoints(), batch.getForecastPeriod(), batch.getModelType().label(),
                    batch.getAnomaliesDetected(), batch.getAnomalyRate()));
            for (PredictionPoint alert : batch.alerts()) {
                out.println(String.format("%s %s %.1f confidence %.1f", alert.getSeverity().label(),
                        alert.getTimestamp(), alert.getValue(), alert.getConfidence()));
            }
            out.println("report: " + report);
        }

        if (mode.predictsAllMonths()) {
            if (forecast.isEmpty()) {
                throw new IllegalArgumentException("the forecast file has no points");
            }
            PredictionReportWriter writer = new PredictionReportWriter(artifacts.resolve(PREDICTIONS_DIRECTORY));
            Map<Integer, MonthlyPrediction> results = service.predictAllMonths(forecast);
            long successes = 0;
            for (MonthlyPrediction result : results.values()) {
                String name = MonthlyModel.monthName(result.getMonth());
                if (result.isSuccess()) {
                    ForecastBatch batch = result.getBatch().get();
                    Path report = writer.writeMonth(batch);
                    ++successes;
                    out.println(String.format("%-10s %s %d anomalies (%.2f%%) %s", name, result.getStatus(),
                            batch.getAnomaliesDetected(), batch.getAnomalyRate(), report.getFileName()));
                } else {
                    out.println(String.format("%-10s %s (%s)", name, result.getStatus(), result.getReason()));
                }
            }
            out.println(String.format("predictions generated: %d/12", successes));
        }
        out.flush();
    }

    private List<TimeSeriesPoint> readSeries(Path path, String flag) throws IOException {
        if (path == null) {
            throw new IllegalArgumentException(flag + " is required");
        }
        try (BufferedReader in = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            List<TimeSeriesPoint> points = new CsvSeriesReader(argumentParser.getDelimiter(),
                    argumentParser.getHeaderRow()).read(in);
            log.info("read {} points from {}", points.size(), path);
            return points;
        }
    }
}
