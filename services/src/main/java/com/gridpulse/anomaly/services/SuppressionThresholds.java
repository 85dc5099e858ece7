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

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * How far from the baseline mean of its hour a flagged point has to be to stay
 * flagged. Both thresholds have to be met.
 */
@Getter
@ToString
@EqualsAndHashCode
public class SuppressionThresholds {

    public static final double DEFAULT_RELATIVE_THRESHOLD = 0.30;

    public static final double DEFAULT_ABSOLUTE_THRESHOLD = 800.0;

    public static final SuppressionThresholds DEFAULT = new SuppressionThresholds(DEFAULT_RELATIVE_THRESHOLD,
            DEFAULT_ABSOLUTE_THRESHOLD);

    /** minimum |value - mean| / mean */
    private final double relativeThreshold;

    /** minimum |value - mean|, in the unit of the series */
    private final double absoluteThreshold;

    public SuppressionThresholds(double relativeThreshold, double absoluteThreshold) {
        checkArgument(relativeThreshold >= 0, "relativeThreshold must not be negative");
        checkArgument(absoluteThreshold >= 0, "absoluteThreshold must not be negative");
        this.relativeThreshold = relativeThreshold;
        this.absoluteThreshold = absoluteThreshold;
    }

    public boolean exceeded(double value, double mean) {
        double deviation = Math.abs(value - mean);
        return deviation / mean > relativeThreshold && deviation > absoluteThreshold;
    }
}
