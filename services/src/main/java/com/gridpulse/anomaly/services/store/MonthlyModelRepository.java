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

import java.util.Optional;

import com.gridpulse.anomaly.baseline.BaselineProfile;
import com.gridpulse.anomaly.services.MonthlyModel;

/**
 * Trained artifacts keyed by month. Month 0 holds the generic model and the
 * all-history baseline.
 */
public interface MonthlyModelRepository {

    Optional<MonthlyModel> findModel(int month);

    default Optional<MonthlyModel> findGenericModel() {
        return findModel(MonthlyModel.GENERIC_MONTH);
    }

    void saveModel(MonthlyModel model);

    Optional<BaselineProfile> findBaseline(int month);

    void saveBaseline(BaselineProfile profile);
}
