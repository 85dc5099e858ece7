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

package com.gridpulse.anomaly.preprocessor;

import static com.gridpulse.anomaly.CommonUtils.checkArgument;
import static com.gridpulse.anomaly.CommonUtils.checkNotNull;

import java.util.Arrays;

import com.gridpulse.anomaly.errors.SchemaMismatchException;
import com.gridpulse.anomaly.statistics.Deviation;

/**
 * Standardizes each column to zero mean and unit variance using the statistics
 * of the data it was fitted on. A column that was constant during fitting keeps
 * a scale of 1 so that it is only centered.
 */
public class StandardScaler {

    /** relative spread below which a column is treated as constant */
    public static final double CONSTANT_TOLERANCE = 1e-9;

    private final double[] means;

    private final double[] scales;

    public StandardScaler(double[] means, double[] scales) {
        checkNotNull(means, "means must not be null");
        checkNotNull(scales, "scales must not be null");
        checkArgument(means.length == scales.length, "means and scales have different lengths");
        for (double scale : scales) {
            checkArgument(scale > 0, "scales must be positive");
        }
        this.means = Arrays.copyOf(means, means.length);
        this.scales = Arrays.copyOf(scales, scales.length);
    }

    public static StandardScaler fit(double[][] data) {
        checkNotNull(data, "data must not be null");
        checkArgument(data.length > 0, "cannot fit a scaler to no rows");
        int dimensions = data[0].length;
        Deviation[] deviations = new Deviation[dimensions];
        for (int j = 0; j < dimensions; j++) {
            deviations[j] = new Deviation();
        }
        for (double[] row : data) {
            checkArgument(row.length == dimensions, "rows have different lengths");
            for (int j = 0; j < dimensions; j++) {
                deviations[j].update(row[j]);
            }
        }
        double[] means = new double[dimensions];
        double[] scales = new double[dimensions];
        for (int j = 0; j < dimensions; j++) {
            means[j] = deviations[j].getMean();
            double std = deviations[j].getDeviation();
            scales[j] = (std <= CONSTANT_TOLERANCE * Math.max(1.0, Math.abs(means[j]))) ? 1.0 : std;
        }
        return new StandardScaler(means, scales);
    }

    public double[] transform(double[] point) {
        if (point.length != means.length) {
            throw SchemaMismatchException.dimensions(means.length, point.length);
        }
        double[] result = new double[point.length];
        for (int j = 0; j < point.length; j++) {
            result[j] = (point[j] - means[j]) / scales[j];
        }
        return result;
    }

    public double[][] transform(double[][] data) {
        double[][] result = new double[data.length][];
        for (int i = 0; i < data.length; i++) {
            result[i] = transform(data[i]);
        }
        return result;
    }

    public int getDimensions() {
        return means.length;
    }

    public double[] getMeans() {
        return Arrays.copyOf(means, means.length);
    }

    public double[] getScales() {
        return Arrays.copyOf(scales, scales.length);
    }
}
