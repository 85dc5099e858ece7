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

import static com.gridpulse.anomaly.CommonUtils.checkArgument;
import static com.gridpulse.anomaly.CommonUtils.checkNotNull;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gridpulse.anomaly.baseline.BaselineProfile;
import com.gridpulse.anomaly.errors.SchemaMismatchException;
import com.gridpulse.anomaly.services.MonthlyModel;
import com.gridpulse.anomaly.services.state.baseline.BaselineProfileMapper;
import com.gridpulse.anomaly.services.state.baseline.BaselineProfileState;
import com.gridpulse.anomaly.services.store.MonthlyModelRepository;

/**
 * Keeps the artifacts of each month as files in one directory:
 * <ul>
 * <li>{@code {monthname}_demand_anomaly_detector.bin}, the model blob</li>
 * <li>{@code {monthname}_model_info.json}, the model metadata</li>
 * <li>{@code {monthname}_baseline.json}, or {@code overall_baseline.json} for
 * month 0</li>
 * </ul>
 * Each artifact is read at most once; later lookups return the same instance.
 */
@Slf4j
@Getter
public class FileSystemModelRepository implements MonthlyModelRepository {

    public static final String OVERALL_BASELINE_FILE_NAME = "overall_baseline.json";

    private final Path directory;

    private final MonthlyModelSerDe serDe = new MonthlyModelSerDe();

    private final ObjectMapper objectMapper = JsonMappers.createObjectMapper();

    private final BaselineProfileMapper baselineMapper = new BaselineProfileMapper();

    private final Map<Integer, Optional<MonthlyModel>> models = new ConcurrentHashMap<>();

    private final Map<Integer, Optional<BaselineProfile>> baselines = new ConcurrentHashMap<>();

    public FileSystemModelRepository(Path directory) {
        this.directory = checkNotNull(directory, "directory must not be null");
    }

    public static String modelFileName(int month) {
        return MonthlyModel.monthName(month) + "_demand_anomaly_detector.bin";
    }

    public static String metadataFileName(int month) {
        return MonthlyModel.monthName(month) + "_model_info.json";
    }

    public static String baselineFileName(int month) {
        return month == 0 ? OVERALL_BASELINE_FILE_NAME : MonthlyModel.monthName(month) + "_baseline.json";
    }

    @Override
    public Optional<MonthlyModel> findModel(int month) {
        checkArgument(month >= 0 && month <= 12, "month must be between 0 and 12");
        return models.computeIfAbsent(month, this::loadModel);
    }

    private Optional<MonthlyModel> loadModel(int month) {
        Path blob = directory.resolve(modelFileName(month));
        if (!Files.exists(blob)) {
            log.debug("no model at {}", blob);
            return Optional.empty();
        }
        try {
            MonthlyModel model = serDe.fromBytes(Files.readAllBytes(blob));
            Path metadataPath = directory.resolve(metadataFileName(month));
            if (Files.exists(metadataPath)) {
                objectMapper.readValue(metadataPath.toFile(), ModelMetadata.class).checkDescribes(model);
            }
            if (model.getMonth() != month) {
                throw new SchemaMismatchException(blob + " holds the model of month " + model.getMonth(),
                        Map.of("expected", month, "actual", model.getMonth()));
            }
            log.info("loaded {} model from {}", model.getMonthName(), blob);
            return Optional.of(model);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read " + blob, e);
        }
    }

    @Override
    public void saveModel(MonthlyModel model) {
        checkNotNull(model, "model must not be null");
        Path blob = directory.resolve(modelFileName(model.getMonth()));
        try {
            Files.createDirectories(directory);
            Files.write(blob, serDe.toBytes(model));
            objectMapper.writeValue(directory.resolve(metadataFileName(model.getMonth())).toFile(),
                    ModelMetadata.of(model));
        } catch (IOException e) {
            throw new UncheckedIOException("cannot write " + blob, e);
        }
        models.put(model.getMonth(), Optional.of(model));
        log.info("saved {} model to {}", model.getMonthName(), blob);
    }

    /**
     * @param month 1 to 12, or 0 for the model's description
     * @return the metadata written with the model, if any
     */
    public Optional<ModelMetadata> findMetadata(int month) {
        Path path = directory.resolve(metadataFileName(month));
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(path.toFile(), ModelMetadata.class));
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read " + path, e);
        }
    }

    @Override
    public Optional<BaselineProfile> findBaseline(int month) {
        checkArgument(month >= 0 && month <= 12, "month must be between 0 and 12");
        return baselines.computeIfAbsent(month, this::loadBaseline);
    }

    private Optional<BaselineProfile> loadBaseline(int month) {
        Path path = directory.resolve(baselineFileName(month));
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            BaselineProfileState state = objectMapper.readValue(path.toFile(), BaselineProfileState.class);
            return Optional.of(baselineMapper.toModel(state));
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read " + path, e);
        }
    }

    @Override
    public void saveBaseline(BaselineProfile profile) {
        checkNotNull(profile, "profile must not be null");
        Path path = directory.resolve(baselineFileName(profile.getMonth()));
        try {
            Files.createDirectories(directory);
            objectMapper.writeValue(path.toFile(), baselineMapper.toState(profile));
        } catch (IOException e) {
            throw new UncheckedIOException("cannot write " + path, e);
        }
        baselines.put(profile.getMonth(), Optional.of(profile));
        log.info("saved month {} baseline to {}", profile.getMonth(), path);
    }
}
