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

package com.gridpulse.anomaly.tree;

import static com.gridpulse.anomaly.TestUtils.EPSILON;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class BoundingBoxTest {

    private double[] point1;
    private double[] point2;
    private BoundingBox box1;
    private BoundingBox box2;

    @BeforeEach
    public void setUp() {
        point1 = new double[] { 1.5, 2.7 };
        point2 = new double[] { 3.0, 1.2 };
        box1 = new BoundingBox(point1);
        box2 = new BoundingBox(point2);
    }

    @Test
    public void testNewFromSinglePoint() {
        assertThat(box1.getDimensions(), is(2));
        assertThat(box1.getMinValue(0), is(1.5));
        assertThat(box1.getMaxValue(0), is(1.5));
        assertThat(box1.getRange(1), is(0.0));
        assertThat(box1.getRangeSum(), is(0.0));

        // the box keeps its own copy of the point
        point1[0] = 100;
        assertThat(box1.getMinValue(0), is(1.5));
    }

    @Test
    public void testGetMergedBox() {
        BoundingBox mergedBox = box1.getMergedBox(box2);

        assertThat(mergedBox.getMinValue(0), is(1.5));
        assertThat(mergedBox.getMaxValue(0), is(3.0));
        assertThat(mergedBox.getMinValue(1), is(1.2));
        assertThat(mergedBox.getMaxValue(1), is(2.7));
        assertThat(mergedBox.getRangeSum(), closeTo((3.0 - 1.5) + (2.7 - 1.2), EPSILON));

        // check that box1 and box2 were not changed
        assertThat(box1.getRangeSum(), is(0.0));
        assertThat(box2.getRangeSum(), is(0.0));
    }

    @Test
    public void testAddPoint() {
        box1.addPoint(point2);
        assertThat(box1.getRange(0), closeTo(1.5, EPSILON));
        assertThat(box1.getRangeSum(), closeTo(3.0, EPSILON));
        assertThrows(IllegalArgumentException.class, () -> box1.addPoint(new double[] { 1.0 }));
    }

    @Test
    public void testContains() {
        BoundingBox mergedBox = box1.getMergedBox(box2);
        assertTrue(mergedBox.contains(point1));
        assertTrue(mergedBox.contains(new double[] { 2.0, 2.0 }));
        assertFalse(mergedBox.contains(new double[] { 0.0, 2.0 }));
        assertFalse(box1.contains(point2));
    }

    @Test
    public void testInvalidBox() {
        assertThrows(IllegalArgumentException.class,
                () -> new BoundingBox(new double[] { 1.0, 1.0 }, new double[] { 0.0, 2.0 }));
        assertThrows(IllegalArgumentException.class,
                () -> new BoundingBox(new double[] { 1.0 }, new double[] { 0.0, 2.0 }));
    }
}
