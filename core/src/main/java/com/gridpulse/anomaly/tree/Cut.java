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

/**
 * A Cut represents a division of space into two half-spaces. Cuts define the
 * structure of a {@link RandomCutTree} and the path a point takes through it.
 */
public class Cut {

    private final int dimension;
    private final double value;

    /**
     * @param dimension The 0-based index of the dimension that the cut is made in.
     * @param value     The spatial value of the cut.
     */
    public Cut(int dimension, double value) {
        this.dimension = dimension;
        this.value = value;
    }

    /**
     * Returns true when the point's coordinate in the cut dimension is less than
     * or equal to the cut value, that is, when the point belongs to the left
     * subtree.
     *
     * @param point A point that we are testing in relation to the cut
     * @param cut   A Cut instance.
     * @return true if the point goes left
     */
    public static boolean isLeftOf(double[] point, Cut cut) {
        return point[cut.getDimension()] <= cut.getValue();
    }

    public int getDimension() {
        return dimension;
    }

    public double getValue() {
        return value;
    }

    @Override
    public String toString() {
        return String.format("Cut(%d, %f)", dimension, value);
    }
}
