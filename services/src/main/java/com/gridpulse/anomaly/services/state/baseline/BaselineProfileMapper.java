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

import java.util.ArrayList;
import java.util.Map;
import java.util.TreeMap;

import lombok.Getter;
import lombok.Setter;

import com.gridpulse.anomaly.baseline.BaselineProfile;
import com.gridpulse.anomaly.baseline.HourlyStatistics;
import com.gridpulse.anomaly.services.state.IStateMapper;
import com.gridpulse.anomaly.services.state.TimestampStates;

@Getter
@Setter
public class BaselineProfileMapper implements IStateMapper<BaselineProfile, BaselineProfileState> {

    @Override
    public BaselineProfile toModel(BaselineProfileState state, long seed) {
        return BaselineProfile.builder().month(state.getMonth()).zone(TimestampStates.toZone(state.getZone()))
                .hourly(toModels(state.getHourly()))
                .dayOfWeek(toModels(state.getDayOfWeek())).weekday(toModel(state.getWeekday()))
                .weekend(toModel(state.getWeekend())).overall(toModel(state.getOverall()))
                .peakHours(state.getPeakHours()).dataStart(TimestampStates.toModel(state.getDataStart()))
                .dataEnd(TimestampStates.toModel(state.getDataEnd()))
                .generatedAt(TimestampStates.toModel(state.getGeneratedAt())).build();
    }

    @Override
    public BaselineProfileState toState(BaselineProfile model) {
        BaselineProfileState state = new BaselineProfileState();
        state.setMonth(model.getMonth());
        state.setZone(model.getZone().getId());
        state.setHourly(toStates(model.getHourly()));
        state.setDayOfWeek(toStates(model.getDayOfWeek()));
        state.setWeekday(toState(model.getWeekday()));
        state.setWeekend(toState(model.getWeekend()));
        state.setOverall(toState(model.getOverall()));
        state.setPeakHours(new ArrayList<>(model.getPeakHours()));
        state.setDataStart(TimestampStates.toState(model.getDataStart()));
        state.setDataEnd(TimestampStates.toState(model.getDataEnd()));
        state.setGeneratedAt(TimestampStates.toState(model.getGeneratedAt()));
        return state;
    }

    static HourlyStatistics toModel(HourlyStatisticsState state) {
        if (state == null) {
            return null;
        }
        return new HourlyStatistics(state.getCount(), state.getMean(), state.getStd(), state.getMin(), state.getMax(),
                state.getMedian(), state.getP25(), state.getP75(), state.getP95());
    }

    static HourlyStatisticsState toState(HourlyStatistics model) {
        if (model == null) {
            return null;
        }
        HourlyStatisticsState state = new HourlyStatisticsState();
        state.setCount(model.getCount());
        state.setMean(model.getMean());
        state.setStd(model.getStd());
        state.setMin(model.getMin());
        state.setMax(model.getMax());
        state.setMedian(model.getMedian());
        state.setP25(model.getP25());
        state.setP75(model.getP75());
        state.setP95(model.getP95());
        return state;
    }

    private static Map<Integer, HourlyStatistics> toModels(Map<Integer, HourlyStatisticsState> states) {
        Map<Integer, HourlyStatistics> result = new TreeMap<>();
        if (states != null) {
            states.forEach((key, value) -> result.put(key, toModel(value)));
        }
        return result;
    }

    private static Map<Integer, HourlyStatisticsState> toStates(Map<Integer, HourlyStatistics> models) {
        Map<Integer, HourlyStatisticsState> result = new TreeMap<>();
        models.forEach((key, value) -> result.put(key, toState(value)));
        return result;
    }
}
