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

package com.gridpulse.anomaly.services.state.forest;

import static com.gridpulse.anomaly.CommonUtils.checkArgument;

import java.util.List;
import java.util.stream.Collectors;

import lombok.Getter;
import lombok.Setter;

import com.gridpulse.anomaly.errors.SchemaMismatchException;
import com.gridpulse.anomaly.forest.RandomCutForestScorer;
import com.gridpulse.anomaly.services.state.IStateMapper;
import com.gridpulse.anomaly.services.state.tree.RandomCutTreeMapper;
import com.gridpulse.anomaly.tree.RandomCutTree;

@Getter
@Setter
public class RandomCutForestScorerMapper implements IStateMapper<RandomCutForestScorer, RandomCutForestScorerState> {

    @Override
    public RandomCutForestScorer toModel(RandomCutForestScorerState state, long seed) {
        checkArgument(state.getTrees() != null && !state.getTrees().isEmpty(), "the scorer state has no trees");
        RandomCutTreeMapper treeMapper = new RandomCutTreeMapper();
        List<RandomCutTree> trees = state.getTrees().stream().map(treeMapper::toModel).collect(Collectors.toList());
        for (RandomCutTree tree : trees) {
            if (tree.getDimensions() != state.getDimensions()) {
                throw SchemaMismatchException.dimensions(state.getDimensions(), tree.getDimensions());
            }
        }
        return new RandomCutForestScorer(trees, state.getThreshold(), state.getContamination(), state.getSampleSize(),
                state.getRandomSeed(), state.getTrainingSize(), state.getAnomaliesInTraining());
    }

    @Override
    public RandomCutForestScorerState toState(RandomCutForestScorer model) {
        RandomCutTreeMapper treeMapper = new RandomCutTreeMapper();
        RandomCutForestScorerState state = new RandomCutForestScorerState();
        state.setDimensions(model.getDimensions());
        state.setSampleSize(model.getSampleSize());
        state.setContamination(model.getContamination());
        state.setRandomSeed(model.getRandomSeed());
        state.setThreshold(model.getThreshold());
        state.setTrainingSize(model.getTrainingSize());
        state.setAnomaliesInTraining(model.getAnomaliesInTraining());
        state.setTrees(model.getTrees().stream().map(treeMapper::toState).collect(Collectors.toList()));
        return state;
    }
}
