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

package com.gridpulse.anomaly.returntypes;

/**
 * Severity tiers, from least to most severe.
 */
public enum Severity {
    NORMAL, MEDIUM, HIGH, CRITICAL;

    /**
     * The lower-case name used in reports.
     */
    public String label() {
        return name().toLowerCase();
    }
}
