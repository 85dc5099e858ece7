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

package com.gridpulse.anomaly;

import static com.gridpulse.anomaly.TestUtils.EPSILON;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import com.gridpulse.anomaly.tree.BoundingBox;

public class CommonUtilsTest {

    @Test
    public void testCheckArgument() {
        assertThrows(IllegalArgumentException.class, () -> CommonUtils.checkArgument(false, "test"));
        assertDoesNotThrow(() -> CommonUtils.checkArgument(true, "test"));
    }

    @Test
    public void testCheckState() {
        assertThrows(IllegalStateException.class, () -> CommonUtils.checkState(false, "test"));
        assertDoesNotThrow(() -> CommonUtils.checkState(true, "test"));
    }

    @Test
    public void testCheckNotNull() {
        assertThrows(NullPointerException.class, () -> CommonUtils.checkNotNull(null, "test"));
        assertEquals("value", CommonUtils.checkNotNull("value", "test"));
    }

    @Test
    public void testProbabilityOfSeparation() {
        BoundingBox box = new BoundingBox(new double[] { 0.0, 0.0 }, new double[] { 1.0, 1.0 });
        assertThat(CommonUtils.getProbabilityOfSeparation(box, new double[] { 0.5, 0.5 }), is(0.0));
        // the merged box has sides 3 and 1, of which 2 is new
        assertThat(CommonUtils.getProbabilityOfSeparation(box, new double[] { 3.0, 0.5 }), closeTo(0.5, EPSILON));
        BoundingBox point = new BoundingBox(new double[] { 1.0, 1.0 });
        assertThat(CommonUtils.getProbabilityOfSeparation(point, new double[] { 1.0, 1.0 }), is(0.0));
        assertThat(CommonUtils.getProbabilityOfSeparation(point, new double[] { 2.0, 1.0 }), is(1.0));
    }

    @Test
    public void testQuantile() {
        double[] values = { 4, 1, 3, 2, 5 };
        assertThat(CommonUtils.quantile(values, 0.0), is(1.0));
        assertThat(CommonUtils.quantile(values, 0.5), is(3.0));
        assertThat(CommonUtils.quantile(values, 1.0), is(5.0));
        assertThat(CommonUtils.quantile(values, 0.95), closeTo(4.8, EPSILON));
        // the input is left untouched
        assertThat(values[0], is(4.0));
        assertThrows(IllegalArgumentException.class, () -> CommonUtils.quantile(new double[0], 0.5));
        assertThrows(IllegalArgumentException.class, () -> CommonUtils.quantile(values, 1.5));
    }

    @Test
    public void testRound() {
        assertThat(CommonUtils.round(2.0833333, 2), is(2.08));
        assertThat(CommonUtils.round(12.5, 0), is(13.0));
    }
}
