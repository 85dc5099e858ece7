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

package com.gridpulse.anomaly.testutils;

import java.time.ZonedDateTime;

/**
 * A generated series together with the positions where anomalies were
 * injected.
 */
public class DemandSeriesWithKey {
    public ZonedDateTime[] timestamps;
    public double[] values;
    public int[] spikeIndices;

    public DemandSeriesWithKey(ZonedDateTime[] timestamps, double[] values, int[] spikeIndices) {
        this.timestamps = timestamps;
        this.values = values;
        this.spikeIndices = spikeIndices;
    }

    public int size() {
        return values.length;
    }
}
