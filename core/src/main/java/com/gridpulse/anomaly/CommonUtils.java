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

package com.gridpulse.anomaly;

import java.util.Arrays;
import java.util.Objects;

import com.gridpulse.anomaly.tree.BoundingBox;

/** A collection of common utility functions. */
public class CommonUtils {

    private CommonUtils() {
    }

    /**
     * Throws an {@link IllegalArgumentException} with the specified message if the
     * specified input is false.
     *
     * @param condition A condition to test.
     * @param message   The error message to include in the
     *                  {@code IllegalArgumentException} if {@code condition} is
     *                  false.
     * @throws IllegalArgumentException if {@code condition} is false.
     */
    public static void checkArgument(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    /**
     * Throws an {@link IllegalStateException} with the specified message if the
     * specified input is false.
     *
     * @param condition A condition to test.
     * @param message   The error message to include in the
     *                  {@code IllegalStateException} if {@code condition} is false.
     * @throws IllegalStateException if {@code condition} is false.
     */
    public static void checkState(boolean condition, String message) {
        if (!condition) {
            throw new IllegalStateException(message);
        }
    }

    /**
     * Throws a {@link NullPointerException} with the specified message if the
     * specified input is null.
     *
     * @param <T>     An arbitrary type.
     * @param object  An object reference to test for nullity.
     * @param message The error message to include in the
     *                {@code NullPointerException} if {@code object} is null.
     * @return {@code object} if not null.
     * @throws NullPointerException if the supplied object is null.
     */
    public static <T> T checkNotNull(T object, String message) {
        Objects.requireNonNull(object, message);
        return object;
    }

    /**
     * Compute the probability of separation for a bounding box and a point. This
     * method considers the bounding box created by merging the query point into the
     * existing bounding box, and computes the probability that a random cut would
     * separate the query point from the merged bounding box.
     *
     * @param boundingBox is the bounding box of a node in a RandomCutTree
     * @param queryPoint  is the multidimensional point
     * @return the probability of separation choosing a random cut
     */
    public static double getProbabilityOfSeparation(final BoundingBox boundingBox, double[] queryPoint) {
        double sumOfNewRange = 0d;
        double sumOfDifferenceInRange = 0d;

        for (int i = 0; i < queryPoint.length; ++i) {
            double maxVal = boundingBox.getMaxValue(i);
            double minVal = boundingBox.getMinValue(i);
            double oldRange = maxVal - minVal;

            if (maxVal < queryPoint[i]) {
                maxVal = queryPoint[i];
            } else if (minVal > queryPoint[i]) {
                minVal = queryPoint[i];
            } else {
                sumOfNewRange += oldRange;
                continue;
            }

            double newRange = maxVal - minVal;
            sumOfNewRange += newRange;
            sumOfDifferenceInRange += (newRange - oldRange);
        }

        if (sumOfNewRange <= 0) {
            return 0;
        } else
            return sumOfDifferenceInRange / sumOfNewRange;
    }

    /**
     * The default anomaly scoring function for points that are contained in a
     * tree.
     *
     * @param depth The depth of the leaf node where this method is invoked
     * @param mass  The number of times the point has been seen before
     * @return The score contribution from this previously-seen point
     */
    public static double defaultScoreSeenFunction(double depth, double mass) {
        return 1.0 / (depth + Math.log(mass + 1.0) / Math.log(2.0));
    }

    /**
     * The default anomaly scoring function for points not already contained in a
     * tree.
     *
     * @param depth The depth of the leaf node where this method is invoked
     * @param mass  The number of times the point has been seen before
     * @return The score contribution from this point
     */
    public static double defaultScoreUnseenFunction(double depth, double mass) {
        return 1.0 / (depth + 1);
    }

    public static double defaultDampFunction(double leafMass, double treeMass) {
        return 1.0 - leafMass / (2 * treeMass);
    }

    /**
     * Scores produced by a tree are scaled by the tree mass so that trees built
     * from samples of different sizes remain comparable.
     *
     * @param scalarValue The value being scaled
     * @param mass        The mass of the tree where this method is invoked
     * @return The original value scaled appropriately for this tree
     */
    public static double defaultScalarNormalizerFunction(double scalarValue, double mass) {
        return scalarValue * Math.log(mass + 1) / Math.log(2.0);
    }

    /**
     * Linear-interpolated quantile of the supplied values, the same convention
     * used for percentiles throughout the library. The input is not modified.
     *
     * @param values   the values, need not be sorted
     * @param fraction a number in [0, 1]
     * @return the quantile
     */
    public static double quantile(double[] values, double fraction) {
        checkArgument(values.length > 0, "cannot compute a quantile of no values");
        checkArgument(fraction >= 0 && fraction <= 1, "fraction must be in [0, 1]");
        double[] sorted = Arrays.copyOf(values, values.length);
        Arrays.sort(sorted);
        return sortedQuantile(sorted, fraction);
    }

    /**
     * Same as {@link #quantile(double[], double)} for an already sorted array.
     */
    public static double sortedQuantile(double[] sorted, double fraction) {
        double position = fraction * (sorted.length - 1);
        int lower = (int) Math.floor(position);
        int upper = (int) Math.ceil(position);
        if (lower == upper) {
            return sorted[lower];
        }
        return sorted[lower] + (position - lower) * (sorted[upper] - sorted[lower]);
    }

    public static double round(double value, int decimals) {
        double factor = Math.pow(10, decimals);
        return Math.round(value * factor) / factor;
    }
}
