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

import java.time.Month;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import lombok.Builder;
import lombok.Getter;

import com.gridpulse.anomaly.errors.SchemaMismatchException;
import com.gridpulse.anomaly.forest.RandomCutForestScorer;
import com.gridpulse.anomaly.preprocessor.StandardScaler;

/**
 * A trained outlier scorer for one calendar month (or for all history) with
 * everything needed to score new points the way the training points were
 * scored: the ordered feature columns, the feature window, the zone calendar
 * features are read in and the scaler. Immutable.
 */
@Getter
public class MonthlyModel {

    /** the month number of the generic model */
    public static final int GENERIC_MONTH = 0;

    /** 1 to 12, or {@link #GENERIC_MONTH} */
    private final int month;

    private final ModelType modelType;

    private final RandomCutForestScorer scorer;

    private final StandardScaler scaler;

    private final List<String> featureColumns;

    /** the rolling window the features were engineered with */
    private final int window;

    /** hours, days and months of the training features were read in this zone */
    private final ZoneId zone;

    private final double contamination;

    private final ZonedDateTime trainedAt;

    private final ZonedDateTime trainingStart;

    private final ZonedDateTime trainingEnd;

    private final int samples;

    private final int anomaliesDetected;

    private final double averageValue;

    private final double stdValue;

    private final double minValue;

    private final double maxValue;

    @Builder
    public MonthlyModel(int month, ModelType modelType, RandomCutForestScorer scorer, StandardScaler scaler,
            List<String> featureColumns, int window, ZoneId zone, double contamination, ZonedDateTime trainedAt,
            ZonedDateTime trainingStart, ZonedDateTime trainingEnd, int samples, int anomaliesDetected,
            double averageValue, double stdValue, double minValue, double maxValue) {
        checkNotNull(modelType, "modelType must not be null");
        checkNotNull(scorer, "scorer must not be null");
        checkNotNull(scaler, "scaler must not be null");
        checkNotNull(featureColumns, "featureColumns must not be null");
        checkArgument(!featureColumns.isEmpty(), "featureColumns must not be empty");
        if (modelType == ModelType.GENERIC) {
            checkArgument(month == GENERIC_MONTH, "a generic model has month 0");
        } else {
            checkArgument(month >= 1 && month <= 12, "month must be between 1 and 12");
        }
        checkArgument(window > 0, "window must be positive");
        checkArgument(contamination > 0 && contamination < 1, "contamination must be in (0, 1)");
        if (scaler.getDimensions() != featureColumns.size()) {
            throw SchemaMismatchException.dimensions(featureColumns.size(), scaler.getDimensions());
        }
        if (scorer.getDimensions() != featureColumns.size()) {
            throw SchemaMismatchException.dimensions(featureColumns.size(), scorer.getDimensions());
        }
        this.month = month;
        this.modelType = modelType;
        this.scorer = scorer;
        this.scaler = scaler;
        this.featureColumns = Collections.unmodifiableList(new ArrayList<>(featureColumns));
        this.window = window;
        this.zone = (zone == null) ? ZoneOffset.UTC : zone;
        this.contamination = contamination;
        this.trainedAt = trainedAt;
        this.trainingStart = trainingStart;
        this.trainingEnd = trainingEnd;
        this.samples = samples;
        this.anomaliesDetected = anomaliesDetected;
        this.averageValue = averageValue;
        this.stdValue = stdValue;
        this.minValue = minValue;
        this.maxValue = maxValue;
    }

    /**
     * @return "january" to "december", or "generic"
     */
    public String getMonthName() {
        return monthName(month);
    }

    public static String monthName(int month) {
        if (month == GENERIC_MONTH) {
            return "generic";
        }
        return Month.of(month).getDisplayName(TextStyle.FULL, Locale.ENGLISH).toLowerCase(Locale.ENGLISH);
    }

    /**
     * @return "first to last" training timestamp
     */
    public String getTrainingPeriod() {
        return trainingStart + " to " + trainingEnd;
    }

    /**
     * The normalized score of a raw score: 0.5 at the decision threshold.
     */
    public double normalizedScore(double rawScore) {
        return scorer.normalizedScore(rawScore);
    }
}
