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

package com.gridpulse.anomaly.serialization;

import static com.gridpulse.anomaly.CommonUtils.checkNotNull;

import lombok.extern.slf4j.Slf4j;

import com.gridpulse.anomaly.services.MonthlyModel;
import com.gridpulse.anomaly.services.state.MonthlyModelMapper;
import com.gridpulse.anomaly.services.state.MonthlyModelState;

import io.protostuff.LinkedBuffer;
import io.protostuff.ProtostuffIOUtil;
import io.protostuff.Schema;
import io.protostuff.runtime.RuntimeSchema;

/**
 * Encodes a {@link MonthlyModel} as a
 * <a href="https://github.com/protostuff/protostuff">protostuff</a> blob of
 * its {@link MonthlyModelState}.
 */
@Slf4j
public class MonthlyModelSerDe {

    private static final int BUFFER_SIZE = 512;

    private final Schema<MonthlyModelState> schema = RuntimeSchema.getSchema(MonthlyModelState.class);

    private final MonthlyModelMapper mapper = new MonthlyModelMapper();

    public byte[] toBytes(MonthlyModel model) {
        checkNotNull(model, "model must not be null");
        LinkedBuffer buffer = LinkedBuffer.allocate(BUFFER_SIZE);
        byte[] bytes;
        try {
            bytes = ProtostuffIOUtil.toByteArray(mapper.toState(model), schema, buffer);
        } finally {
            buffer.clear();
        }
        log.debug("encoded {} model in {} bytes", model.getMonthName(), bytes.length);
        return bytes;
    }

    public MonthlyModel fromBytes(byte[] bytes) {
        checkNotNull(bytes, "bytes must not be null");
        MonthlyModelState state = schema.newMessage();
        ProtostuffIOUtil.mergeFrom(bytes, state, schema);
        return mapper.toModel(state);
    }
}
