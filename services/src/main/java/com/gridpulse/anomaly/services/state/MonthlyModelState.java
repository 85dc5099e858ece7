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

import static com.gridpulse.anomaly.services.state.Version.CURRENT;

import java.io.Serializable;
import java.util.List;

import lombok.Data;

import com.gridpulse.anomaly.services.state.forest.RandomCutForestScorerState;
import com.gridpulse.anomaly.services.state.preprocessor.StandardScalerState;

@Data
public class MonthlyModelState implements Serializable {
    private static final long serialVersionUID = 1L;

    private String version = CURRENT;
    private int month;
    private String modelType;
    private RandomCutForestScorerState scorerState;
    private StandardScalerState scalerState;
    private List<String> featureColumns;
    private int window;
    private String zone;
    private double contamination;
    private String trainedAt;
    private String trainingStart;
    private String trainingEnd;
    private int samples;
    private int anomaliesDetected;
    private double averageValue;
    private double stdValue;
    private double minValue;
    private double maxValue;
}
