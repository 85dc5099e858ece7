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

import java.time.DayOfWeek;
import java.time.ZonedDateTime;
import java.util.Arrays;
import java.util.Random;

/**
 * Generates hourly electricity demand with a daily shape, a weekend dip and a
 * monthly level, plus normally distributed noise proportional to the expected
 * value. Optionally, spikes are injected at random hours.
 *
 * <p>
 * With the default parameters a November weekday peaks at about 2600 MW at
 * 18:00.
 */
public class SyntheticDemandData {

    /** multiplier of the monthly level for each hour of the day */
    public static final double[] DAILY_SHAPE = { 0.80, 0.77, 0.75, 0.74, 0.75, 0.80, 0.90, 1.00, 1.05, 1.07, 1.08,
            1.08, 1.07, 1.06, 1.05, 1.06, 1.12, 1.22, 1.30, 1.25, 1.15, 1.03, 0.93, 0.86 };

    /** level in MW for January to December */
    public static final double[] MONTHLY_LEVEL = { 2300, 2200, 1900, 1700, 1750, 2100, 2400, 2350, 2000, 1800,
            2000, 2250 };

    private final double noiseFraction;
    private final double weekendFactor;
    private final long seed;

    public SyntheticDemandData(double noiseFraction, double weekendFactor, long seed) {
        this.noiseFraction = noiseFraction;
        this.weekendFactor = weekendFactor;
        this.seed = seed;
    }

    public SyntheticDemandData(long seed) {
        this(0.02, 0.92, seed);
    }

    public SyntheticDemandData() {
        this(0.02, 0.92, 42);
    }

    /**
     * The noiseless demand at a timestamp.
     */
    public double expected(ZonedDateTime timestamp) {
        double value = MONTHLY_LEVEL[timestamp.getMonthValue() - 1] * DAILY_SHAPE[timestamp.getHour()];
        DayOfWeek day = timestamp.getDayOfWeek();
        if (day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY) {
            value *= weekendFactor;
        }
        return value;
    }

    public DemandSeriesWithKey generate(ZonedDateTime start, int hours) {
        return generate(start, hours, 0, 1);
    }

    /**
     * @param start            the first timestamp
     * @param hours            the number of hourly points
     * @param spikeProbability the chance that a point is multiplied by
     *                         {@code spikeFactor}
     * @param spikeFactor      the multiplier of a spike
     * @return the series and the indices of the spikes
     */
    public DemandSeriesWithKey generate(ZonedDateTime start, int hours, double spikeProbability, double spikeFactor) {
        ZonedDateTime[] timestamps = new ZonedDateTime[hours];
        double[] values = new double[hours];
        int[] spikes = new int[hours];
        int numberOfSpikes = 0;
        NormalDistribution dist = new NormalDistribution(new Random(seed));
        Random spikeRandom = new Random(seed + 1);
        for (int i = 0; i < hours; i++) {
            timestamps[i] = start.plusHours(i);
            double mu = expected(timestamps[i]);
            values[i] = dist.nextDouble(mu, noiseFraction * mu);
            if (spikeRandom.nextDouble() < spikeProbability) {
                values[i] *= spikeFactor;
                spikes[numberOfSpikes++] = i;
            }
        }
        return new DemandSeriesWithKey(timestamps, values, Arrays.copyOf(spikes, numberOfSpikes));
    }

    static class NormalDistribution {
        private final Random rng;
        private final double[] buffer;
        private int index;

        NormalDistribution(Random rng) {
            this.rng = rng;
            buffer = new double[2];
            index = 0;
        }

        double nextDouble() {
            if (index == 0) {
                // apply the Box-Muller transform to produce Normal variates
                double u = rng.nextDouble();
                double v = rng.nextDouble();
                double r = Math.sqrt(-2 * Math.log(u));
                buffer[0] = r * Math.cos(2 * Math.PI * v);
                buffer[1] = r * Math.sin(2 * Math.PI * v);
            }

            double result = buffer[index];
            index = (index + 1) % 2;

            return result;
        }

        double nextDouble(double mu, double sigma) {
            return mu + sigma * nextDouble();
        }
    }
}
