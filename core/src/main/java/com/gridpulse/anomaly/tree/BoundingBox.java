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

package com.gridpulse.anomaly.tree;

import static com.gridpulse.anomaly.CommonUtils.checkArgument;

import java.util.Arrays;

/**
 * The smallest axis-aligned box containing a set of points.
 */
public class BoundingBox {

    /**
     * An array containing the minimum value corresponding to each dimension.
     */
    protected final double[] minValues;

    /**
     * An array containing the maximum value corresponding to each dimension.
     */
    protected final double[] maxValues;

    /**
     * The sum of side lengths defined by this bounding box.
     */
    protected double rangeSum;

    public BoundingBox(double[] point) {
        minValues = Arrays.copyOf(point, point.length);
        maxValues = Arrays.copyOf(point, point.length);
        rangeSum = 0.0;
    }

    public BoundingBox(final double[] minValues, final double[] maxValues) {
        checkArgument(minValues.length == maxValues.length, "incorrect lengths in box");
        this.minValues = minValues;
        this.maxValues = maxValues;
        rangeSum = 0;
        for (int i = 0; i < minValues.length; ++i) {
            checkArgument(minValues[i] <= maxValues[i], "incorrect box");
            rangeSum += maxValues[i] - minValues[i];
        }
    }

    public BoundingBox getMergedBox(BoundingBox otherBox) {
        checkArgument(otherBox.getDimensions() == getDimensions(), "incorrect lengths in box");
        double[] minValuesMerged = new double[minValues.length];
        double[] maxValuesMerged = new double[minValues.length];
        for (int i = 0; i < minValues.length; ++i) {
            minValuesMerged[i] = Math.min(minValues[i], otherBox.minValues[i]);
            maxValuesMerged[i] = Math.max(maxValues[i], otherBox.maxValues[i]);
        }
        return new BoundingBox(minValuesMerged, maxValuesMerged);
    }

    public BoundingBox addPoint(double[] point) {
        checkArgument(minValues.length == point.length, "incorrect length");
        rangeSum = 0;
        for (int i = 0; i < point.length; ++i) {
            minValues[i] = Math.min(minValues[i], point[i]);
            maxValues[i] = Math.max(maxValues[i], point[i]);
            rangeSum += maxValues[i] - minValues[i];
        }
        return this;
    }

    public int getDimensions() {
        return minValues.length;
    }

    /**
     * @return the sum of side lengths for this BoundingBox.
     */
    public double getRangeSum() {
        return rangeSum;
    }

    public double getMaxValue(final int dimension) {
        return maxValues[dimension];
    }

    public double getMinValue(final int dimension) {
        return minValues[dimension];
    }

    public double getRange(final int dimension) {
        return maxValues[dimension] - minValues[dimension];
    }

    /**
     * Returns true if the given point is contained in this bounding box.
     */
    public boolean contains(double[] point) {
        checkArgument(point.length == minValues.length, "incorrect lengths");
        for (int i = 0; i < minValues.length; i++) {
            if (minValues[i] > point[i] || maxValues[i] < point[i]) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return String.format("BoundingBox(%s, %s)", Arrays.toString(minValues), Arrays.toString(maxValues));
    }
}
