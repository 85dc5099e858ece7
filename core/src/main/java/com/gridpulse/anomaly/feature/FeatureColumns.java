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

package com.gridpulse.anomaly.feature;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Names of the columns produced by {@link FeatureEngineer}, in the order they
 * appear in a {@link FeatureTable}.
 */
public final class FeatureColumns {

    public static final String HOUR = "hour";
    public static final String DAY_OF_WEEK = "day_of_week";
    public static final String DAY_OF_MONTH = "day_of_month";
    public static final String HOUR_SIN = "hour_sin";
    public static final String HOUR_COS = "hour_cos";
    public static final String DOW_SIN = "dow_sin";
    public static final String DOW_COS = "dow_cos";
    public static final String IS_WEEKEND = "is_weekend";
    public static final String MONTH = "month";
    public static final String WEEK_OF_YEAR = "week_of_year";
    public static final String IS_SUMMER = "is_summer";
    public static final String IS_WINTER = "is_winter";
    public static final String VALUE = "value";
    public static final String ROLLING_MEAN = "rolling_mean";
    public static final String ROLLING_STD = "rolling_std";
    public static final String ROLLING_MIN = "rolling_min";
    public static final String ROLLING_MAX = "rolling_max";
    public static final String DIFF = "diff";
    public static final String PCT_CHANGE = "pct_change";
    public static final String ZSCORE = "zscore";

    public static final List<String> ALL = Collections.unmodifiableList(Arrays.asList(HOUR, DAY_OF_WEEK,
            DAY_OF_MONTH, HOUR_SIN, HOUR_COS, DOW_SIN, DOW_COS, IS_WEEKEND, MONTH, WEEK_OF_YEAR, IS_SUMMER, IS_WINTER,
            VALUE, ROLLING_MEAN, ROLLING_STD, ROLLING_MIN, ROLLING_MAX, DIFF, PCT_CHANGE, ZSCORE));

    /**
     * The features a monthly model is trained on unless configured otherwise: the
     * cyclical and seasonal calendar encodings, the raw value and its first
     * differences.
     */
    public static final List<String> DEFAULT_MONTHLY = Collections.unmodifiableList(Arrays.asList(HOUR_SIN,
            HOUR_COS, DOW_SIN, DOW_COS, IS_WEEKEND, MONTH, WEEK_OF_YEAR, IS_SUMMER, IS_WINTER, VALUE, DIFF,
            PCT_CHANGE));

    private FeatureColumns() {
    }
}
