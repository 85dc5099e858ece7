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

import static com.gridpulse.anomaly.CommonUtils.checkArgument;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.ZoneId;
import java.util.Locale;

import com.gridpulse.anomaly.feature.FeatureEngineer;
import com.gridpulse.anomaly.services.MonthlyModelTrainer;
import com.gridpulse.anomaly.services.SeasonalAnomalyService;
import com.gridpulse.anomaly.services.SuppressionThresholds;
import com.gridpulse.anomaly.services.config.FallbackPolicy;

/**
 * The options of {@link SeasonalAnomalyRunner}.
 */
public class SeasonalAnomalyArgumentParser extends ArgumentParser {

    public enum Mode {
        TRAIN, PREDICT, BOTH, ALL_MONTHS;

        public boolean trains() {
            return this == TRAIN || this == BOTH;
        }

        public boolean predicts() {
            return this == PREDICT || this == BOTH;
        }

        /**
         * @return true when the forecast is judged by every monthly model
         */
        public boolean predictsAllMonths() {
            return this == ALL_MONTHS;
        }

        public boolean readsForecast() {
            return predicts() || predictsAllMonths();
        }
    }

    private final StringArgument history;
    private final StringArgument forecast;
    private final StringArgument artifacts;
    private final StringArgument mode;
    private final IntegerArgument month;
    private final DoubleArgument contamination;
    private final IntegerArgument window;
    private final IntegerArgument tailLength;
    private final DoubleArgument relativeThreshold;
    private final DoubleArgument absoluteThreshold;
    private final StringArgument fallback;
    private final StringArgument zone;

    public SeasonalAnomalyArgumentParser(String runnerClass, String runnerDescription) {
        super(runnerClass, runnerDescription);

        history = new StringArgument(null, "--history", "CSV file of historical timestamp,value rows.", null);
        addArgument(history);

        forecast = new StringArgument(null, "--forecast", "CSV file of forecast timestamp,value rows to judge.",
                null);
        addArgument(forecast);

        artifacts = new StringArgument("-a", "--artifacts", "Directory of the model, baseline and report files.",
                "artifacts");
        addArgument(artifacts);

        mode = new StringArgument("-m", "--mode",
                "One of 'train', 'predict', 'both' or 'all-months' (judge the forecast with every monthly model).",
                "both", s -> parseMode(s));
        addArgument(mode);

        month = new IntegerArgument(null, "--month",
                "Month whose model judges the forecast, or 0 for the month of the first forecast point.", 0,
                n -> checkArgument(n >= 0 && n <= 12, "month should be between 0 and 12"));
        addArgument(month);

        contamination = new DoubleArgument("-c", "--contamination",
                "Expected fraction of anomalies in the training data of each month.",
                MonthlyModelTrainer.DEFAULT_MONTHLY_CONTAMINATION,
                x -> checkArgument(x > 0 && x < 1, "contamination should be in (0, 1)"));
        addArgument(contamination);

        window = new IntegerArgument("-w", "--window", "Rolling window of the engineered features.",
                FeatureEngineer.DEFAULT_DEMAND_WINDOW, n -> checkArgument(n > 0, "window should be greater than 0"));
        addArgument(window);

        tailLength = new IntegerArgument(null, "--tail-length",
                "Number of historical points preceding the forecast used as context.",
                SeasonalAnomalyService.DEFAULT_TAIL_LENGTH,
                n -> checkArgument(n > 0, "tail length should be greater than 0"));
        addArgument(tailLength);

        relativeThreshold = new DoubleArgument(null, "--relative-threshold",
                "Minimum relative distance from the hourly baseline mean for a flag to stand.",
                SuppressionThresholds.DEFAULT_RELATIVE_THRESHOLD,
                x -> checkArgument(x >= 0, "relative threshold should not be negative"));
        addArgument(relativeThreshold);

        absoluteThreshold = new DoubleArgument(null, "--absolute-threshold",
                "Minimum absolute distance from the hourly baseline mean for a flag to stand.",
                SuppressionThresholds.DEFAULT_ABSOLUTE_THRESHOLD,
                x -> checkArgument(x >= 0, "absolute threshold should not be negative"));
        addArgument(absoluteThreshold);

        fallback = new StringArgument("-f", "--fallback",
                "What to do when a month has no model: 'fail' or 'generic'.", "fail", s -> parseFallback(s));
        addArgument(fallback);

        zone = new StringArgument("-z", "--zone", "Time zone in which calendar months and hours are read.", "UTC",
                s -> ZoneId.of(s));
        addArgument(zone);
    }

    private static Mode parseMode(String value) {
        return Mode.valueOf(value.toUpperCase(Locale.ROOT).replace('-', '_'));
    }

    private static FallbackPolicy parseFallback(String value) {
        return FallbackPolicy.valueOf(value.toUpperCase(Locale.ROOT));
    }

    public Path getHistory() {
        return history.getValue() == null ? null : Paths.get(history.getValue());
    }

    public Path getForecast() {
        return forecast.getValue() == null ? null : Paths.get(forecast.getValue());
    }

    public Path getArtifacts() {
        return Paths.get(artifacts.getValue());
    }

    public Mode getMode() {
        return parseMode(mode.getValue());
    }

    /**
     * @return 1 to 12, or 0 to use the month of the first forecast point
     */
    public int getMonth() {
        return month.getValue();
    }

    public double getContamination() {
        return contamination.getValue();
    }

    public int getWindow() {
        return window.getValue();
    }

    public int getTailLength() {
        return tailLength.getValue();
    }

    public SuppressionThresholds getSuppressionThresholds() {
        return new SuppressionThresholds(relativeThreshold.getValue(), absoluteThreshold.getValue());
    }

    public FallbackPolicy getFallbackPolicy() {
        return parseFallback(fallback.getValue());
    }

    public ZoneId getZone() {
        return ZoneId.of(zone.getValue());
    }
}
