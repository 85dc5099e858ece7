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

package com.gridpulse.anomaly.services.state;

import static com.gridpulse.anomaly.CommonUtils.checkArgument;

import java.util.ArrayList;

import lombok.Getter;
import lombok.Setter;

import com.gridpulse.anomaly.services.ModelType;
import com.gridpulse.anomaly.services.MonthlyModel;
import com.gridpulse.anomaly.services.state.forest.RandomCutForestScorerMapper;
import com.gridpulse.anomaly.services.state.preprocessor.StandardScalerMapper;

@Getter
@Setter
public class MonthlyModelMapper implements IStateMapper<MonthlyModel, MonthlyModelState> {

    @Override
    public MonthlyModel toModel(MonthlyModelState state, long seed) {
        checkArgument(Version.V1_0.equals(state.getVersion()), "unsupported model state version " + state.getVersion());
        return MonthlyModel.builder().month(state.getMonth()).modelType(ModelType.fromLabel(state.getModelType()))
                .scorer(new RandomCutForestScorerMapper().toModel(state.getScorerState(), seed))
                .scaler(new StandardScalerMapper().toModel(state.getScalerState()))
                .featureColumns(state.getFeatureColumns()).window(state.getWindow())
                .zone(TimestampStates.toZone(state.getZone()))
                .contamination(state.getContamination()).trainedAt(TimestampStates.toModel(state.getTrainedAt()))
                .trainingStart(TimestampStates.toModel(state.getTrainingStart()))
                .trainingEnd(TimestampStates.toModel(state.getTrainingEnd())).samples(state.getSamples())
                .anomaliesDetected(state.getAnomaliesDetected()).averageValue(state.getAverageValue())
                .stdValue(state.getStdValue()).minValue(state.getMinValue()).maxValue(state.getMaxValue()).build();
    }

    @Override
    public MonthlyModelState toState(MonthlyModel model) {
        MonthlyModelState state = new MonthlyModelState();
        state.setMonth(model.getMonth());
        state.setModelType(model.getModelType().label());
        state.setScorerState(new RandomCutForestScorerMapper().toState(model.getScorer()));
        state.setScalerState(new StandardScalerMapper().toState(model.getScaler()));
        state.setFeatureColumns(new ArrayList<>(model.getFeatureColumns()));
        state.setWindow(model.getWindow());
        state.setZone(model.getZone().getId());
        state.setContamination(model.getContamination());
        state.setTrainedAt(TimestampStates.toState(model.getTrainedAt()));
        state.setTrainingStart(TimestampStates.toState(model.getTrainingStart()));
        state.setTrainingEnd(TimestampStates.toState(model.getTrainingEnd()));
        state.setSamples(model.getSamples());
        state.setAnomaliesDetected(model.getAnomaliesDetected());
        state.setAverageValue(model.getAverageValue());
        state.setStdValue(model.getStdValue());
        state.setMinValue(model.getMinValue());
        state.setMaxValue(model.getMaxValue());
        return state;
    }
}
