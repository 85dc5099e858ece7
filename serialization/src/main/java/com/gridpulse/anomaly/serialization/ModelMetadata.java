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
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import lombok.Data;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gridpulse.anomaly.errors.SchemaMismatchException;
import com.gridpulse.anomaly.services.MonthlyModel;

/**
 * The human-readable description written next to each model blob.
 */
@Data
public class ModelMetadata {
    /** the month name, e.g. "november", or "generic" */
    private String month;
    private int monthNumber;
    private List<String> featureColumns;
    private ZonedDateTime trainedAt;
    @JsonProperty("n_samples")
    private int samples;
    private double contamination;
    @JsonProperty("n_anomalies_detected")
    private int anomaliesDetected;
    private String trainingPeriod;
    private double avgDemand;
    private double stdDemand;
    private double minDemand;
    private double maxDemand;
    private String modelType;

    public static ModelMetadata of(MonthlyModel model) {
        ModelMetadata metadata = new ModelMetadata();
        metadata.setMonth(model.getMonthName());
        metadata.setMonthNumber(model.getMonth());
        metadata.setFeatureColumns(new ArrayList<>(model.getFeatureColumns()));
        metadata.setTrainedAt(model.getTrainedAt());
        metadata.setSamples(model.getSamples());
        metadata.setContamination(model.getContamination());
        metadata.setAnomaliesDetected(model.getAnomaliesDetected());
        metadata.setTrainingPeriod(model.getTrainingPeriod());
        metadata.setAvgDemand(model.getAverageValue());
        metadata.setStdDemand(model.getStdValue());
        metadata.setMinDemand(model.getMinValue());
        metadata.setMaxDemand(model.getMaxValue());
        metadata.setModelType(model.getModelType().label());
        return metadata;
    }

    /**
     * @throws SchemaMismatchException if the model was not the one described
     */
    public void checkDescribes(MonthlyModel model) {
        if (monthNumber != model.getMonth() || !model.getModelType().label().equals(modelType)) {
            throw new SchemaMismatchException(
                    String.format("metadata describes %s model %d, the blob holds %s model %d", modelType,
                            monthNumber, model.getModelType().label(), model.getMonth()),
                    Map.of("expected", monthNumber, "actual", model.getMonth()));
        }
        if (!model.getFeatureColumns().equals(featureColumns)) {
            throw new SchemaMismatchException(
                    String.format("metadata lists features %s, the blob uses %s", featureColumns,
                            model.getFeatureColumns()),
                    Map.of("expected", String.valueOf(featureColumns), "actual",
                            String.valueOf(model.getFeatureColumns())));
        }
    }
}
