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

package com.gridpulse.anomaly.services.state.preprocessor;

import java.util.Arrays;

import lombok.Getter;
import lombok.Setter;

import com.gridpulse.anomaly.preprocessor.StandardScaler;
import com.gridpulse.anomaly.services.state.IStateMapper;

@Getter
@Setter
public class StandardScalerMapper implements IStateMapper<StandardScaler, StandardScalerState> {

    @Override
    public StandardScaler toModel(StandardScalerState state, long seed) {
        return new StandardScaler(state.getMeans(), state.getScales());
    }

    @Override
    public StandardScalerState toState(StandardScaler model) {
        StandardScalerState state = new StandardScalerState();
        state.setMeans(Arrays.copyOf(model.getMeans(), model.getDimensions()));
        state.setScales(Arrays.copyOf(model.getScales(), model.getDimensions()));
        return state;
    }
}
