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

package com.gridpulse.anomaly.services.state.tree;

import static com.gridpulse.anomaly.CommonUtils.checkArgument;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import lombok.Getter;
import lombok.Setter;

import com.gridpulse.anomaly.services.state.IStateMapper;
import com.gridpulse.anomaly.tree.Cut;
import com.gridpulse.anomaly.tree.Node;
import com.gridpulse.anomaly.tree.RandomCutTree;

@Getter
@Setter
public class RandomCutTreeMapper implements IStateMapper<RandomCutTree, RandomCutTreeState> {

    @Override
    public RandomCutTree toModel(RandomCutTreeState state, long seed) {
        checkArgument(state.getCutDimension() != null && state.getCutDimension().length > 0, "empty tree state");
        return new RandomCutTree(toNode(state, 0));
    }

    private Node toNode(RandomCutTreeState state, int index) {
        if (state.getCutDimension()[index] < 0) {
            int dimensions = state.getDimensions();
            int offset = state.getPointIndex()[index] * dimensions;
            return Node.leaf(Arrays.copyOfRange(state.getLeafPoints(), offset, offset + dimensions),
                    state.getLeafMass()[index]);
        }
        Cut cut = new Cut(state.getCutDimension()[index], state.getCutValue()[index]);
        return Node.internal(cut, toNode(state, state.getLeftIndex()[index]),
                toNode(state, state.getRightIndex()[index]));
    }

    @Override
    public RandomCutTreeState toState(RandomCutTree model) {
        List<Node> nodes = new ArrayList<>();
        collect(model.getRoot(), nodes);
        int size = nodes.size();
        int dimensions = model.getDimensions();
        int[] cutDimension = new int[size];
        double[] cutValue = new double[size];
        int[] leftIndex = new int[size];
        int[] rightIndex = new int[size];
        int[] leafMass = new int[size];
        int[] pointIndex = new int[size];
        List<double[]> points = new ArrayList<>();

        // pre-order numbering: a node's left child follows it directly
        int[] next = { 0 };
        number(model.getRoot(), next, cutDimension, cutValue, leftIndex, rightIndex, leafMass, pointIndex, points);

        double[] leafPoints = new double[points.size() * dimensions];
        for (int i = 0; i < points.size(); i++) {
            System.arraycopy(points.get(i), 0, leafPoints, i * dimensions, dimensions);
        }
        RandomCutTreeState state = new RandomCutTreeState();
        state.setDimensions(dimensions);
        state.setCutDimension(cutDimension);
        state.setCutValue(cutValue);
        state.setLeftIndex(leftIndex);
        state.setRightIndex(rightIndex);
        state.setLeafMass(leafMass);
        state.setPointIndex(pointIndex);
        state.setLeafPoints(leafPoints);
        return state;
    }

    private static void collect(Node node, List<Node> nodes) {
        nodes.add(node);
        if (!node.isLeaf()) {
            collect(node.getLeftChild(), nodes);
            collect(node.getRightChild(), nodes);
        }
    }

    private static int number(Node node, int[] next, int[] cutDimension, double[] cutValue, int[] leftIndex,
            int[] rightIndex, int[] leafMass, int[] pointIndex, List<double[]> points) {
        int index = next[0]++;
        if (node.isLeaf()) {
            cutDimension[index] = -1;
            leftIndex[index] = -1;
            rightIndex[index] = -1;
            leafMass[index] = node.getMass();
            pointIndex[index] = points.size();
            points.add(node.getLeafPoint());
        } else {
            cutDimension[index] = node.getCut().getDimension();
            cutValue[index] = node.getCut().getValue();
            pointIndex[index] = -1;
            leftIndex[index] = number(node.getLeftChild(), next, cutDimension, cutValue, leftIndex, rightIndex,
                    leafMass, pointIndex, points);
            rightIndex[index] = number(node.getRightChild(), next, cutDimension, cutValue, leftIndex, rightIndex,
                    leafMass, pointIndex, points);
        }
        return index;
    }
}
