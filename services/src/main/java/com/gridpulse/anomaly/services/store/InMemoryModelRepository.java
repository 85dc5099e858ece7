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

package com.gridpulse.anomaly.services.store;

import static com.gridpulse.anomaly.CommonUtils.checkNotNull;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import com.gridpulse.anomaly.baseline.BaselineProfile;
import com.gridpulse.anomaly.services.MonthlyModel;

/**
 * A {@link MonthlyModelRepository} holding artifacts in memory.
 */
public class InMemoryModelRepository implements MonthlyModelRepository {

    private final Map<Integer, MonthlyModel> models = new ConcurrentHashMap<>();

    private final Map<Integer, BaselineProfile> baselines = new ConcurrentHashMap<>();

    @Override
    public Optional<MonthlyModel> findModel(int month) {
        return Optional.ofNullable(models.get(month));
    }

    @Override
    public void saveModel(MonthlyModel model) {
        checkNotNull(model, "model must not be null");
        models.put(model.getMonth(), model);
    }

    @Override
    public Optional<BaselineProfile> findBaseline(int month) {
        return Optional.ofNullable(baselines.get(month));
    }

    @Override
    public void saveBaseline(BaselineProfile profile) {
        checkNotNull(profile, "profile must not be null");
        baselines.put(profile.getMonth(), profile);
    }
}
