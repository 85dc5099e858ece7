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

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import com.gridpulse.anomaly.returntypes.Severity;

/**
 * The judgment of one forecast point.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class PredictionPoint {

    private final ZonedDateTime timestamp;

    private final double value;

    private final boolean anomaly;

    /** the scorer's score relative to its threshold, 0.5 at the boundary */
    private final double anomalyScore;

    /** between 0 and 100 */
    private final double confidence;

    private final Severity severity;

    public PredictionPoint(ZonedDateTime timestamp, double value, boolean anomaly, double anomalyScore,
            double confidence, Severity severity) {
        this.timestamp = checkNotNull(timestamp, "timestamp must not be null");
        this.severity = checkNotNull(severity, "severity must not be null");
        checkArgument(confidence >= 0 && confidence <= 100, "confidence must be between 0 and 100");
        checkArgument(anomaly || severity == Severity.NORMAL, "a normal point has severity NORMAL");
        this.value = value;
        this.anomaly = anomaly;
        this.anomalyScore = anomalyScore;
        this.confidence = confidence;
    }

    /**
     * @return a copy marked normal with zero confidence; the anomaly score is kept
     */
    public PredictionPoint suppressed() {
        return new PredictionPoint(timestamp, value, false, anomalyScore, 0, Severity.NORMAL);
    }
}
