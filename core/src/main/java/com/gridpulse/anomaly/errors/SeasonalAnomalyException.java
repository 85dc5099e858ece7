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

import static com.gridpulse.anomaly.CommonUtils.checkNotNull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import lombok.Getter;

/**
 * Root of the library's domain failures. Each failure carries an
 * {@link ErrorKind} and an immutable map of the values that triggered it (the
 * month, the number of samples, the offending timestamps, ...).
 */
@Getter
public class SeasonalAnomalyException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;

    private final Map<String, Object> context;

    public SeasonalAnomalyException(ErrorKind kind, String message, Map<String, Object> context) {
        super(message);
        this.kind = checkNotNull(kind, "kind must not be null");
        this.context = (context == null) ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public SeasonalAnomalyException(ErrorKind kind, String message) {
        this(kind, message, null);
    }

    /**
     * Convenience for building the context map inline.
     *
     * @param keysAndValues alternating keys and values
     * @return an insertion-ordered map
     */
    protected static Map<String, Object> context(Object... keysAndValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keysAndValues.length; i += 2) {
            map.put(String.valueOf(keysAndValues[i]), keysAndValues[i + 1]);
        }
        return map;
    }
}
