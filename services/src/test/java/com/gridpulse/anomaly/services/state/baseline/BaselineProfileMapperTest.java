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

package com.gridpulse.anomaly.services.state.baseline;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import org.junit.jupiter.api.Test;

import com.gridpulse.anomaly.baseline.BaselineProfile;
import com.gridpulse.anomaly.baseline.BaselineProfileBuilder;
import com.gridpulse.anomaly.services.TestUtils;

public class BaselineProfileMapperTest {

    @Test
    public void testRoundTrip() {
        Clock clock = Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC);
        ZoneId chicago = ZoneId.of("America/Chicago");
        BaselineProfile profile = new BaselineProfileBuilder(clock, 5).build(TestUtils.twoNovembers(), 11, chicago);
        BaselineProfileMapper mapper = new BaselineProfileMapper();

        BaselineProfile restored = mapper.toModel(mapper.toState(profile));

        assertThat(restored.getMonth(), is(11));
        assertThat(restored.getZone(), is(chicago));
        assertThat(restored.getHourly(), is(profile.getHourly()));
        assertThat(restored.getDayOfWeek(), is(profile.getDayOfWeek()));
        assertThat(restored.getWeekday(), is(profile.getWeekday()));
        assertThat(restored.getWeekend(), is(profile.getWeekend()));
        assertThat(restored.getOverall(), is(profile.getOverall()));
        assertThat(restored.getPeakHours(), is(profile.getPeakHours()));
        assertThat(restored.getDataStart(), is(profile.getDataStart()));
        assertThat(restored.getDataEnd(), is(profile.getDataEnd()));
        assertThat(restored.getGeneratedAt(), is(profile.getGeneratedAt()));
    }
}
