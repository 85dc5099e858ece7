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
import static com.gridpulse.anomaly.CommonUtils.checkState;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import com.gridpulse.anomaly.Visitor;

/**
 * A random cut tree built in one pass over a fixed sample. Every internal node
 * splits its points with a cut whose dimension is chosen with probability
 * proportional to the side length of the node's bounding box and whose value is
 * uniform along that side. Identical points share a leaf whose mass counts
 * them.
 */
public class RandomCutTree {

    private final Node root;

    private final int dimensions;

    public RandomCutTree(Node root) {
        this.root = checkNotNull(root, "root must not be null");
        this.dimensions = root.getBoundingBox().getDimensions();
    }

    /**
     * Builds a tree over the supplied sample.
     *
     * @param sample the points, all of the same length
     * @param random the source of randomness for the cuts
     * @return the tree
     */
    public static RandomCutTree build(List<double[]> sample, Random random) {
        checkArgument(sample != null && !sample.isEmpty(), "cannot build a tree of no points");
        checkNotNull(random, "random must not be null");
        int dimensions = sample.get(0).length;
        for (double[] point : sample) {
            checkArgument(point.length == dimensions, "points have different lengths");
        }
        return new RandomCutTree(buildNode(new ArrayList<>(sample), random));
    }

    private static Node buildNode(List<double[]> points, Random random) {
        BoundingBox box = new BoundingBox(points.get(0));
        for (int i = 1; i < points.size(); i++) {
            box.addPoint(points.get(i));
        }
        if (box.getRangeSum() <= 0) {
            return Node.leaf(points.get(0), points.size());
        }
        Cut cut = randomCut(random.nextDouble(), box);
        List<double[]> left = new ArrayList<>();
        List<double[]> right = new ArrayList<>();
        for (double[] point : points) {
            if (Cut.isLeftOf(point, cut)) {
                left.add(point);
            } else {
                right.add(point);
            }
        }
        checkState(!left.isEmpty() && !right.isEmpty(), "a cut must separate the box");
        return Node.internal(cut, buildNode(left, random), buildNode(right, random));
    }

    /**
     * Chooses a cut inside a box with positive range. The value lies in the
     * half-open interval [min, max) of the chosen dimension so that both sides
     * receive at least one point.
     */
    static Cut randomCut(double factor, BoundingBox box) {
        checkArgument(box.getRangeSum() > 0, "the box is a single point " + box);
        double breakPoint = factor * box.getRangeSum();
        int lastPositive = -1;
        for (int i = 0; i < box.getDimensions(); i++) {
            double gap = box.getRange(i);
            if (gap <= 0) {
                continue;
            }
            lastPositive = i;
            if (breakPoint < gap) {
                double cutValue = box.getMinValue(i) + breakPoint;
                if (cutValue >= box.getMaxValue(i)) {
                    cutValue = Math.nextAfter(box.getMaxValue(i), box.getMinValue(i));
                }
                return new Cut(i, cutValue);
            }
            breakPoint -= gap;
        }
        // rounding left the break point past the last side
        return new Cut(lastPositive, Math.nextAfter(box.getMaxValue(lastPositive), box.getMinValue(lastPositive)));
    }

    /**
     * Follows the path of {@code point} to a leaf, then calls
     * {@link Visitor#acceptLeaf} on the leaf and {@link Visitor#accept} on each
     * node from the leaf's parent up to the root.
     *
     * @param point   the query point
     * @param visitor the visitor invoked along the path
     * @param <R>     the result type of the visitor
     * @return the visitor's result
     */
    public <R> R traverse(double[] point, Visitor<R> visitor) {
        checkArgument(point.length == dimensions, "incorrect dimensions " + point.length);
        traversePathToLeafAndVisitNodes(point, visitor, root, 0);
        return visitor.getResult();
    }

    protected <R> void traversePathToLeafAndVisitNodes(double[] point, Visitor<R> visitor, Node node,
            int depthOfNode) {
        if (node.isLeaf()) {
            visitor.acceptLeaf(node, depthOfNode);
        } else {
            Node next = Cut.isLeftOf(point, node.getCut()) ? node.getLeftChild() : node.getRightChild();
            traversePathToLeafAndVisitNodes(point, visitor, next, depthOfNode + 1);
            visitor.accept(node, depthOfNode);
        }
    }

    public Node getRoot() {
        return root;
    }

    public int getMass() {
        return root.getMass();
    }

    public int getDimensions() {
        return dimensions;
    }

    /**
     * @return the distinct points held by the leaves, left to right
     */
    public List<double[]> getLeafPoints() {
        List<double[]> points = new ArrayList<>();
        collect(root, points);
        return points;
    }

    private static void collect(Node node, List<double[]> points) {
        if (node.isLeaf()) {
            points.add(node.getLeafPoint());
        } else {
            collect(node.getLeftChild(), points);
            collect(node.getRightChild(), points);
        }
    }

    @Override
    public String toString() {
        return String.format("RandomCutTree(mass=%d, dimensions=%d)", getMass(), dimensions);
    }
}
