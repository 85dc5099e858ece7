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

package com.gridpulse.anomaly.statistics;

import static com.gridpulse.anomaly.CommonUtils.checkArgument;

/**
 * Descriptive statistics of a finite sample.
 */
public final class SampleStatistics {

    private SampleStatistics() {
    }

    public static double mean(double[] values) {
        checkArgument(values.length > 0, "cannot compute the mean of no values");
        double sum = 0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.length;
    }

    /**
     * Sample standard deviation (divides by n - 1); NaN for a single value.
     */
    public static double sampleStd(double[] values) {
        checkArgument(values.length > 0, "cannot compute the deviation of no values");
        if (values.length < 2) {
            return Double.NaN;
        }
        double mean = mean(values);
        double squares = 0;
        for (double value : values) {
            squares += (value - mean) * (value - mean);
        }
        return Math.sqrt(squares / (values.length - 1));
    }

    public static double min(double[] values) {
        checkArgument(values.length > 0, "cannot compute the minimum of no values");
        double answer = Double.POSITIVE_INFINITY;
        for (double value : values) {
            answer = Math.min(answer, value);
        }
        return answer;
    }

    public static double max(double[] values) {
        checkArgument(values.length > 0, "cannot compute the maximum of no values");
        double answer = Double.NEGATIVE_INFINITY;
        for (double value : values) {
            answer = Math.max(answer, value);
        }
        return answer;
    }
}
