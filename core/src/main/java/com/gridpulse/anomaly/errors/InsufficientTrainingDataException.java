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

package com.gridpulse.anomaly.errors;

/**
 * Raised by training when a calendar month has fewer samples than the minimum.
 */
public class InsufficientTrainingDataException extends InsufficientDataException {

    private static final long serialVersionUID = 1L;

    private final int month;

    private final int samples;

    private final int minimumSamples;

    public InsufficientTrainingDataException(int month, int samples, int minimumSamples) {
        super(String.format("month %d has %d samples, at least %d are required for training", month, samples,
                minimumSamples), context("month", month, "samples", samples, "minimumSamples", minimumSamples));
        this.month = month;
        this.samples = samples;
        this.minimumSamples = minimumSamples;
    }

    public int getMonth() {
        return month;
    }

    public int getSamples() {
        return samples;
    }

    public int getMinimumSamples() {
        return minimumSamples;
    }
}
