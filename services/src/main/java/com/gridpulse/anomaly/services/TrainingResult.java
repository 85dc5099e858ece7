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
 * The outcome of training one month.
 */
@Getter
@ToString(exclude = "model")
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TrainingResult {

    private final int month;

    private final TrainingStatus status;

    /** why training did not succeed, null on success */
    private final String reason;

    private final MonthlyModel model;

    public static TrainingResult success(MonthlyModel model) {
        return new TrainingResult(model.getMonth(), TrainingStatus.SUCCESS, null, model);
    }

    public static TrainingResult insufficientData(int month, String reason) {
        return new TrainingResult(month, TrainingStatus.INSUFFICIENT_DATA, reason, null);
    }

    public static TrainingResult error(int month, String reason) {
        return new TrainingResult(month, TrainingStatus.ERROR, reason, null);
    }

    public boolean isSuccess() {
        return status == TrainingStatus.SUCCESS;
    }

    public Optional<MonthlyModel> getModel() {
        return Optional.ofNullable(model);
    }
}
