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
import static com.gridpulse.anomaly.CommonUtils.checkNotNull;

import java.util.Arrays;

import lombok.Getter;

/**
 * A node of a {@link RandomCutTree}. An internal node holds a cut and two
 * children, a leaf holds a point and the number of sample copies of it.
 */
@Getter
public class Node implements INodeView {

    private final Cut cut;

    private final Node leftChild;

    private final Node rightChild;

    private final double[] leafPoint;

    private final int mass;

    private final BoundingBox boundingBox;

    private Node(Cut cut, Node leftChild, Node rightChild, double[] leafPoint, int mass,
            BoundingBox boundingBox) {
        this.cut = cut;
        this.leftChild = leftChild;
        this.rightChild = rightChild;
        this.leafPoint = leafPoint;
        this.mass = mass;
        this.boundingBox = boundingBox;
    }

    public static Node leaf(double[] point, int mass) {
        checkNotNull(point, "point must not be null");
        checkArgument(mass > 0, "a leaf must have positive mass");
        double[] copy = Arrays.copyOf(point, point.length);
        return new Node(null, null, null, copy, mass, new BoundingBox(copy));
    }

    public static Node internal(Cut cut, Node leftChild, Node rightChild) {
        checkNotNull(cut, "cut must not be null");
        checkNotNull(leftChild, "left child must not be null");
        checkNotNull(rightChild, "right child must not be null");
        return new Node(cut, leftChild, rightChild, null, leftChild.getMass() + rightChild.getMass(),
                leftChild.getBoundingBox().getMergedBox(rightChild.getBoundingBox()));
    }

    @Override
    public boolean isLeaf() {
        return leafPoint != null;
    }

    @Override
    public boolean leafPointEquals(double[] point) {
        return isLeaf() && Arrays.equals(leafPoint, point);
    }

    public double[] getLeafPoint() {
        return (leafPoint == null) ? null : Arrays.copyOf(leafPoint, leafPoint.length);
    }
}
