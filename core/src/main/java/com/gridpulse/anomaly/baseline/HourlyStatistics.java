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

package com.gridpulse.anomaly.baseline;

import static com.gridpulse.anomaly.CommonUtils.checkArgument;
import static com.gridpulse.anomaly.CommonUtils.checkNotNull;

import java.util.Arrays;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import com.gridpulse.anomaly.CommonUtils;
import com.gridpulse.anomaly.statistics.SampleStatistics;

/**
 * Summary statistics of a group of values (one hour of the day, one day of the
 * week, ...). The standard deviation is the sample deviation and is 0 for a
 * group of one value.
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public class HourlyStatistics {

    private final int count;
    private final double mean;
    private final double std;
    private final double min;
    private final double max;
    private final double median;
    private final double p25;
    private final double p75;
    private final double p95;

    public static HourlyStatistics of(double[] values) {
        checkNotNull(values, "values must not be null");
        checkArgument(values.length > 0, "cannot summarize no values");
        double[] sorted = Arrays.copyOf(values, values.length);
        Arrays.sort(sorted);
        double std = SampleStatistics.sampleStd(sorted);
        return new HourlyStatistics(sorted.length, SampleStatistics.mean(sorted), Double.isNaN(std) ? 0 : std,
                sorted[0], sorted[sorted.length - 1], CommonUtils.sortedQuantile(sorted, 0.5),
                CommonUtils.sortedQuantile(sorted, 0.25), CommonUtils.sortedQuantile(sorted, 0.75),
                CommonUtils.sortedQuantile(sorted, 0.95));
    }
}
