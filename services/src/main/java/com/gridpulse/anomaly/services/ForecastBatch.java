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

import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import lombok.Getter;

import com.gridpulse.anomaly.CommonUtils;
import com.gridpulse.anomaly.returntypes.Severity;

/**
 * The judged forecast horizon.
 */
@Getter
public class ForecastBatch {

    private final List<PredictionPoint> points;

    private final int modelMonth;

    private final ModelType modelType;

    private final ZonedDateTime generatedAt;

    public ForecastBatch(List<PredictionPoint> points, int modelMonth, ModelType modelType,
            ZonedDateTime generatedAt) {
        checkNotNull(points, "points must not be null");
        checkArgument(!points.isEmpty(), "a batch has at least one point");
        this.points = Collections.unmodifiableList(new ArrayList<>(points));
        this.modelMonth = modelMonth;
        this.modelType = checkNotNull(modelType, "modelType must not be null");
        this.generatedAt = generatedAt;
    }

    public int getTotalPoints() {
        return points.size();
    }

    public int getAnomaliesDetected() {
        return (int) points.stream().filter(PredictionPoint::isAnomaly).count();
    }

    /**
     * @return the share of anomalous points in percent, rounded to 2 decimals
     */
    public double getAnomalyRate() {
        return CommonUtils.round(100.0 * getAnomaliesDetected() / getTotalPoints(), 2);
    }

    public ZonedDateTime getForecastStart() {
        return points.get(0).getTimestamp();
    }

    public ZonedDateTime getForecastEnd() {
        return points.get(points.size() - 1).getTimestamp();
    }

    public String getForecastPeriod() {
        return getForecastStart() + " to " + getForecastEnd();
    }

    /**
     * @return the number of points of every severity, zero counts included
     */
    public Map<Severity, Integer> severityBreakdown() {
        Map<Severity, Integer> breakdown = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            breakdown.put(severity, 0);
        }
        for (PredictionPoint point : points) {
            breakdown.merge(point.getSeverity(), 1, Integer::sum);
        }
        return breakdown;
    }

    /**
     * @return the anomalous points in time order
     */
    public List<PredictionPoint> alerts() {
        return points.stream().filter(PredictionPoint::isAnomaly).collect(Collectors.toList());
    }
}
