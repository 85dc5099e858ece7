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

package com.gridpulse.anomaly.preprocessor;

import static com.gridpulse.anomaly.TestUtils.EPSILON;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import com.gridpulse.anomaly.errors.SchemaMismatchException;

public class StandardScalerTest {

    @Test
    public void testFitAndTransform() {
        double[][] data = { { 1.0, 11.0, 2000.0 }, { 3.0, 11.0, 2400.0 } };
        StandardScaler scaler = StandardScaler.fit(data);
        assertArrayEquals(new double[] { 2.0, 11.0, 2200.0 }, scaler.getMeans(), EPSILON);
        // the constant column keeps a unit scale
        assertArrayEquals(new double[] { 1.0, 1.0, 200.0 }, scaler.getScales(), EPSILON);
        assertArrayEquals(new double[] { -1.0, 0.0, -1.0 }, scaler.transform(data[0]), EPSILON);
        assertArrayEquals(new double[] { 2.0, 1.0, 3.0 }, scaler.transform(new double[] { 4.0, 12.0, 2800.0 }),
                EPSILON);
        assertThat(scaler.getDimensions(), is(3));
    }

    @Test
    public void testDimensionMismatch() {
        StandardScaler scaler = StandardScaler.fit(new double[][] { { 1.0, 2.0 }, { 2.0, 3.0 } });
        assertThrows(SchemaMismatchException.class, () -> scaler.transform(new double[] { 1.0 }));
        assertThrows(SchemaMismatchException.class, () -> scaler.transform(new double[][] { { 1.0, 2.0, 3.0 } }));
    }

    @Test
    public void testInvalidInput() {
        assertThrows(IllegalArgumentException.class, () -> StandardScaler.fit(new double[0][]));
        assertThrows(IllegalArgumentException.class,
                () -> StandardScaler.fit(new double[][] { { 1.0, 2.0 }, { 2.0 } }));
        assertThrows(IllegalArgumentException.class,
                () -> new StandardScaler(new double[] { 0.0 }, new double[] { 0.0 }));
    }
}
