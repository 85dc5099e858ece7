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

package com.gridpulse.anomaly.serialization;

import java.time.ZonedDateTime;
import java.util.List;
import java.util.stream.Collectors;

import lombok.Data;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gridpulse.anomaly.services.ForecastBatch;
import com.gridpulse.anomaly.services.PredictionPoint;

/**
 * The JSON document of a judged forecast, as read by dashboards.
 */
@Data
public class PredictionReport {
    private ZonedDateTime generatedAt;
    private String modelType;
    private int modelMonth;
    private String forecastPeriod;
    private int totalPoints;
    private int anomaliesDetected;
    private double anomalyRate;
    private List<PredictionRecord> predictions;

    @Data
    public static class PredictionRecord {
        private ZonedDateTime timestamp;
        private double demandMw;
        @JsonProperty("is_anomaly")
        private boolean anomaly;
        private double anomalyScore;
        private String severity;
        private double confidence;

        static PredictionRecord of(PredictionPoint point) {
            PredictionRecord record = new PredictionRecord();
            record.setTimestamp(point.getTimestamp());
            record.setDemandMw(point.getValue());
            record.setAnomaly(point.isAnomaly());
            record.setAnomalyScore(point.getAnomalyScore());
            record.setSeverity(point.getSeverity().label());
            record.setConfidence(point.getConfidence());
            return record;
        }
    }

    public static PredictionReport of(ForecastBatch batch) {
        PredictionReport report = new PredictionReport();
        report.setGeneratedAt(batch.getGeneratedAt());
        report.setModelType(batch.getModelType().label());
        report.setModelMonth(batch.getModelMonth());
        report.setForecastPeriod(batch.getForecastPeriod());
        report.setTotalPoints(batch.getTotalPoints());
        report.setAnomaliesDetected(batch.getAnomaliesDetected());
        report.setAnomalyRate(batch.getAnomalyRate());
        report.setPredictions(batch.getPoints().stream().map(PredictionRecord::of).collect(Collectors.toList()));
        return report;
    }
}
