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

import static com.gridpulse.anomaly.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.gridpulse.anomaly.baseline.BaselineProfile;
import com.gridpulse.anomaly.baseline.HourlyStatistics;

/**
 * Clears anomaly flags on points that stay close to the baseline mean of their
 * hour, read in the baseline's zone. The filter only ever turns a flag off, so applying it twice gives the
 * same result as applying it once.
 */
@Slf4j
@Getter
public class BaselineSuppressionFilter {

    private final SuppressionThresholds thresholds;

    public BaselineSuppressionFilter(SuppressionThresholds thresholds) {
        this.thresholds = checkNotNull(thresholds, "thresholds must not be null");
    }

    public BaselineSuppressionFilter() {
        this(SuppressionThresholds.DEFAULT);
    }

    public List<PredictionPoint> apply(List<PredictionPoint> points, BaselineProfile baseline) {
        checkNotNull(points, "points must not be null");
        checkNotNull(baseline, "baseline must not be null");
        List<PredictionPoint> result = new ArrayList<>(points.size());
        int before = 0;
        int after = 0;
        for (PredictionPoint point : points) {
            if (!point.isAnomaly()) {
                result.add(point);
                continue;
            }
            ++before;
            HourlyStatistics expected = baseline.lookup(point.getTimestamp());
            double mean = expected.getMean();
            if (mean <= 0 || thresholds.exceeded(point.getValue(), mean)) {
                result.add(point);
                ++after;
            } else {
                log.debug("suppressing {} at {}: expected {}", point.getValue(), point.getTimestamp(), mean);
                result.add(point.suppressed());
            }
        }
        log.info("baseline suppression kept {} of {} anomalies ({} suppressed)", after, before, before - after);
        return result;
    }
}
