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

package com.gridpulse.anomaly.anomalydetection;

import java.util.Arrays;

import com.gridpulse.anomaly.CommonUtils;
import com.gridpulse.anomaly.Visitor;
import com.gridpulse.anomaly.tree.BoundingBox;
import com.gridpulse.anomaly.tree.INodeView;

/**
 * Computes the anomaly score of a point in one tree. After following the
 * traversal path to a leaf a base score is computed at the leaf; then for each
 * node on the way back to the root the probability that a random cut would
 * separate the point from the node's box weighs the node's contribution
 * against the score accumulated so far.
 *
 * <p>
 * Once the point falls inside a node's bounding box no ancestor can separate it
 * either, and the remaining nodes are skipped.
 */
public class AnomalyScoreVisitor implements Visitor<Double> {

    /** The point whose anomaly score is being computed. */
    protected final double[] pointToScore;

    /** The mass of the tree being visited, used to normalize the result. */
    protected final int treeMass;

    protected boolean pointInsideBox;

    protected double score;

    public AnomalyScoreVisitor(double[] pointToScore, int treeMass) {
        this.pointToScore = Arrays.copyOf(pointToScore, pointToScore.length);
        this.treeMass = treeMass;
        pointInsideBox = false;
        score = 0.0;
    }

    @Override
    public Double getResult() {
        return CommonUtils.defaultScalarNormalizerFunction(score, treeMass);
    }

    @Override
    public void accept(INodeView node, int depthOfNode) {
        if (pointInsideBox) {
            return;
        }
        double probabilityOfSeparation = getProbabilityOfSeparation(node.getBoundingBox());
        if (probabilityOfSeparation <= 0) {
            pointInsideBox = true;
            return;
        }
        score = probabilityOfSeparation * scoreUnseen(depthOfNode, node.getMass())
                + (1 - probabilityOfSeparation) * score;
    }

    @Override
    public void acceptLeaf(INodeView leafNode, int depthOfNode) {
        if (leafNode.leafPointEquals(pointToScore)) {
            pointInsideBox = true;
            score = damp(leafNode.getMass(), treeMass) * scoreSeen(depthOfNode, leafNode.getMass());
        } else {
            score = scoreUnseen(depthOfNode, leafNode.getMass());
        }
    }

    protected double scoreSeen(int depth, int mass) {
        return CommonUtils.defaultScoreSeenFunction(depth, mass);
    }

    protected double scoreUnseen(int depth, int mass) {
        return CommonUtils.defaultScoreUnseenFunction(depth, mass);
    }

    protected double damp(int leafMass, int treeMass) {
        return CommonUtils.defaultDampFunction(leafMass, treeMass);
    }

    protected double getProbabilityOfSeparation(final BoundingBox boundingBox) {
        return CommonUtils.getProbabilityOfSeparation(boundingBox, pointToScore);
    }
}
