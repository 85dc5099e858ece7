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

package com.gridpulse.anomaly.services;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.gridpulse.anomaly.returntypes.Severity;

public class SeverityClassifierTest {

    @ParameterizedTest
    @CsvSource({ "true,100,CRITICAL", "true,80.5,CRITICAL", "true,80,HIGH", "true,60.1,HIGH", "true,60,MEDIUM",
            "true,10,MEDIUM", "false,100,NORMAL", "false,0,NORMAL" })
    public void testClassify(boolean anomaly, double confidence, Severity expected) {
        assertThat(SeverityClassifier.classify(anomaly, confidence), is(expected));
    }

    @Test
    public void testConfidenceIsClipped() {
        assertEquals(100, SeverityClassifier.confidence(1.7));
        assertEquals(50, SeverityClassifier.confidence(0.5), 1e-9);
        assertEquals(30, SeverityClassifier.confidence(-0.3), 1e-9);
        assertEquals(0, SeverityClassifier.confidence(0));
    }

    @Test
    public void testSeverityIsMonotoneInConfidence() {
        Severity previous = Severity.MEDIUM;
        for (int confidence = 0; confidence <= 100; confidence++) {
            Severity severity = SeverityClassifier.classify(true, confidence);
            assertThat(severity.compareTo(previous) >= 0, is(true));
            previous = severity;
        }
    }
}
