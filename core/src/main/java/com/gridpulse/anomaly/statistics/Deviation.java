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
 * Running mean and (population) standard deviation of a stream of values.
 */
public class Deviation {

    protected double weight = 0;

    protected double sumSquared = 0;

    protected double sum = 0;

    public Deviation() {
    }

    public Deviation(double weight, double sum, double sumSquared) {
        this.weight = weight;
        this.sum = sum;
        this.sumSquared = sumSquared;
    }

    public double getMean() {
        checkArgument(weight > 0, "incorrect invocation for mean");
        return sum / weight;
    }

    public void update(double value) {
        sum += value;
        sumSquared += value * value;
        weight += 1.0;
    }

    public double getDeviation() {
        checkArgument(weight > 0, "incorrect invocation for standard deviation");
        double temp = sum / weight;
        double answer = sumSquared / weight - temp * temp;
        return (answer > 0) ? Math.sqrt(answer) : 0;
    }

    public boolean isEmpty() {
        return weight == 0;
    }

    public double getWeight() {
        return weight;
    }
}
