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

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gridpulse.anomaly.services.ForecastBatch;
import com.gridpulse.anomaly.services.MonthlyModel;

/**
 * Writes judged forecasts to {@code {monthname}_predictions.json} and
 * {@code latest_predictions.json}.
 */
@Slf4j
@Getter
public class PredictionReportWriter {

    public static final String LATEST_FILE_NAME = "latest_predictions.json";

    private final Path directory;

    private final ObjectMapper objectMapper;

    public PredictionReportWriter(Path directory) {
        this.directory = checkNotNull(directory, "directory must not be null");
        this.objectMapper = JsonMappers.createObjectMapper();
    }

    public static String fileName(int month) {
        return MonthlyModel.monthName(month) + "_predictions.json";
    }

    /**
     * Writes the month's report and replaces the latest report with it.
     *
     * @return the path of the month's report
     */
    public Path write(ForecastBatch batch) {
        return write(batch, true);
    }

    /**
     * Writes the month's report only; {@code latest_predictions.json} is left as
     * it is.
     *
     * @return the path of the month's report
     */
    public Path writeMonth(ForecastBatch batch) {
        return write(batch, false);
    }

    private Path write(ForecastBatch batch, boolean latest) {
        checkNotNull(batch, "batch must not be null");
        PredictionReport report = PredictionReport.of(batch);
        Path path = directory.resolve(fileName(batch.getModelMonth()));
        try {
            Files.createDirectories(directory);
            objectMapper.writeValue(path.toFile(), report);
            if (latest) {
                objectMapper.writeValue(directory.resolve(LATEST_FILE_NAME).toFile(), report);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("cannot write " + path, e);
        }
        log.info("predictions saved to {}", path);
        return path;
    }

    public PredictionReport read(Path path) {
        try {
            return objectMapper.readValue(path.toFile(), PredictionReport.class);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read " + path, e);
        }
    }
}
