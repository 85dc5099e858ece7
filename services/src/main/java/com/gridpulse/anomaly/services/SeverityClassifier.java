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

import com.gridpulse.anomaly.returntypes.Severity;

/**
 * Maps the scorer's decision and confidence to a severity tier.
 */
public final class SeverityClassifier {

    public static final double CRITICAL_CONFIDENCE = 80;

    public static final double HIGH_CONFIDENCE = 60;

    private SeverityClassifier() {
    }

    public static Severity classify(boolean anomaly, double confidence) {
        if (!anomaly) {
            return Severity.NORMAL;
        }
        if (confidence > CRITICAL_CONFIDENCE) {
            return Severity.CRITICAL;
        }
        if (confidence > HIGH_CONFIDENCE) {
            return Severity.HIGH;
        }
        return Severity.MEDIUM;
    }

    /**
     * The confidence of a normalized score, clipped to [0, 100].
     */
    public static double confidence(double normalizedScore) {
        return Math.max(0, Math.min(100, Math.abs(normalizedScore) * 100));
    }
}
