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

import java.util.Optional;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * The outcome of judging a forecast with the model of one month.
 */
@Getter
@ToString(exclude = "batch")
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class MonthlyPrediction {

    private final int month;

    private final PredictionStatus status;

    /** why no batch was produced, null on success */
    private final String reason;

    private final ForecastBatch batch;

    public static MonthlyPrediction success(int month, ForecastBatch batch) {
        return new MonthlyPrediction(month, PredictionStatus.SUCCESS, null, batch);
    }

    public static MonthlyPrediction modelNotFound(int month) {
        return new MonthlyPrediction(month, PredictionStatus.MODEL_NOT_FOUND, "no model for "
                + MonthlyModel.monthName(month), null);
    }

    public static MonthlyPrediction error(int month, String reason) {
        return new MonthlyPrediction(month, PredictionStatus.ERROR, reason, null);
    }

    public boolean isSuccess() {
        return status == PredictionStatus.SUCCESS;
    }

    public Optional<ForecastBatch> getBatch() {
        return Optional.ofNullable(batch);
    }
}
