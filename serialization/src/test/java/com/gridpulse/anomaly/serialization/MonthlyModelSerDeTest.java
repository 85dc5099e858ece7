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

package com.gridpulse.anomaly.serialization;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.gridpulse.anomaly.feature.FeatureEngineer;
import com.gridpulse.anomaly.services.MonthlyModel;

public class MonthlyModelSerDeTest {

    private MonthlyModel model;

    private MonthlyModelSerDe serDe;

    @BeforeEach
    public void setUp() {
        model = TestUtils.novemberModel();
        serDe = new MonthlyModelSerDe();
    }

    @Test
    public void testRoundTripScoresIdentically() {
        MonthlyModel restored = serDe.fromBytes(serDe.toBytes(model));

        double[][] rows = FeatureEngineer.engineer(TestUtils.november()).matrix(model.getFeatureColumns());
        assertArrayEquals(model.getScorer().score(model.getScaler().transform(rows)),
                restored.getScorer().score(restored.getScaler().transform(rows)));
        assertEquals(model.getScorer().getThreshold(), restored.getScorer().getThreshold());
        assertThat(restored.getFeatureColumns(), is(model.getFeatureColumns()));
        assertThat(restored.getWindow(), is(model.getWindow()));
        assertEquals(model.getTrainedAt(), restored.getTrainedAt());
    }

    @Test
    public void testEncodingIsStable() {
        assertArrayEquals(serDe.toBytes(model), serDe.toBytes(serDe.fromBytes(serDe.toBytes(model))));
    }
}
