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

import static com.gridpulse.anomaly.services.state.Version.CURRENT;

import java.io.Serializable;
import java.util.List;

import lombok.Data;

import com.gridpulse.anomaly.services.state.tree.RandomCutTreeState;

@Data
public class RandomCutForestScorerState implements Serializable {
    private static final long serialVersionUID = 1L;

    private String version = CURRENT;
    private int dimensions;
    private int sampleSize;
    private double contamination;
    private long randomSeed;
    private double threshold;
    private int trainingSize;
    private int anomaliesInTraining;
    private List<RandomCutTreeState> trees;
}
