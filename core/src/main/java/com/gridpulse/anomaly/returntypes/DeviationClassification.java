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

package com.gridpulse.anomaly.returntypes;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * The result of comparing one value with the baseline statistics of its hour.
 */
@Getter
@ToString
@AllArgsConstructor
public class DeviationClassification {

    private final boolean anomalous;

    /** the deviation from the expected mean in standard deviations */
    private final double deviationStd;

    private final Severity severity;

    private final double expectedMean;

    private final double expectedLow;

    private final double expectedHigh;

    private final double actualValue;
}
