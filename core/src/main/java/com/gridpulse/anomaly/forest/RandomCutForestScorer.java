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

package com.gridpulse.anomaly.forest;

import static com.gridpulse.anomaly.CommonUtils.checkArgument;
import static com.gridpulse.anomaly.CommonUtils.checkNotNull;
import static com.gridpulse.anomaly.CommonUtils.checkState;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Random;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.gridpulse.anomaly.CommonUtils;
import com.gridpulse.anomaly.anomalydetection.AnomalyScoreVisitor;
import com.gridpulse.anomaly.errors.SchemaMismatchException;
import com.gridpulse.anomaly.tree.RandomCutTree;

/**
 * An unsupervised outlier scorer: a collection of random cut trees, each built
 * over a random sample of the training rows, together with a decision threshold
 * chosen so that a {@code contamination} fraction of the training rows score
 * above it.
 *
 * <p>
 * The raw score of a point is the average over all trees of the score computed
 * by {@link AnomalyScoreVisitor}; points that are easy to isolate score high.
 * The scorer is immutable once built and can be shared between threads.
 */
@Slf4j
@Getter
public class RandomCutForestScorer {

    /**
     * Default number of trees.
     */
    public static final int DEFAULT_NUMBER_OF_TREES = 100;

    /**
     * Default number of training rows sampled for each tree. Smaller training
     * sets use every row.
     */
    public static final int DEFAULT_SAMPLE_SIZE = 256;

    /**
     * Default expected fraction of anomalies in the training data.
     */
    public static final double DEFAULT_CONTAMINATION = 0.02;

    private final int dimensions;

    private final int numberOfTrees;

    private final int sampleSize;

    private final double contamination;

    private final long randomSeed;

    /**
     * Raw scores above this value are anomalous.
     */
    private final double threshold;

    private final int trainingSize;

    private final int anomaliesInTraining;

    private final List<RandomCutTree> trees;

    protected RandomCutForestScorer(Builder<?> builder) {
        checkArgument(builder.numberOfTrees > 0, "numberOfTrees must be greater than 0");
        checkArgument(builder.sampleSize > 0, "sampleSize must be greater than 0");
        checkArgument(builder.contamination > 0 && builder.contamination < 1, "contamination must be in (0, 1)");
        checkNotNull(builder.trainingData, "trainingData must be set");
        checkArgument(builder.trainingData.length > 0, "trainingData must not be empty");
        double[][] data = builder.trainingData;
        dimensions = data[0].length;
        checkArgument(dimensions > 0, "dimensions must be greater than 0");
        for (double[] row : data) {
            if (row.length != dimensions) {
                throw SchemaMismatchException.dimensions(dimensions, row.length);
            }
        }
        numberOfTrees = builder.numberOfTrees;
        sampleSize = Math.min(builder.sampleSize, data.length);
        contamination = builder.contamination;
        randomSeed = builder.randomSeed.orElseGet(() -> new Random().nextLong());

        Random rng = new Random(randomSeed);
        List<RandomCutTree> built = new ArrayList<>(numberOfTrees);
        for (int i = 0; i < numberOfTrees; i++) {
            Random treeRandom = new Random(rng.nextLong());
            built.add(RandomCutTree.build(sample(data, sampleSize, treeRandom), treeRandom));
        }
        trees = Collections.unmodifiableList(built);

        double[] trainingScores = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            trainingScores[i] = score(data[i]);
        }
        threshold = CommonUtils.quantile(trainingScores, 1 - contamination);
        checkState(threshold > 0, "the decision threshold must be positive");
        trainingSize = data.length;
        int count = 0;
        for (double value : trainingScores) {
            if (value > threshold) {
                ++count;
            }
        }
        anomaliesInTraining = count;
        log.debug("built {} trees of {} samples over {} rows, threshold {}", numberOfTrees, sampleSize,
                trainingSize, threshold);
    }

    /**
     * Restores a scorer from previously built trees.
     */
    public RandomCutForestScorer(List<RandomCutTree> trees, double threshold, double contamination,
            int sampleSize, long randomSeed, int trainingSize, int anomaliesInTraining) {
        checkArgument(trees != null && !trees.isEmpty(), "at least one tree is required");
        checkArgument(threshold > 0, "threshold must be positive");
        checkArgument(contamination > 0 && contamination < 1, "contamination must be in (0, 1)");
        this.dimensions = trees.get(0).getDimensions();
        for (RandomCutTree tree : trees) {
            checkArgument(tree.getDimensions() == dimensions, "trees have different dimensions");
        }
        this.trees = Collections.unmodifiableList(new ArrayList<>(trees));
        this.numberOfTrees = trees.size();
        this.threshold = threshold;
        this.contamination = contamination;
        this.sampleSize = sampleSize;
        this.randomSeed = randomSeed;
        this.trainingSize = trainingSize;
        this.anomaliesInTraining = anomaliesInTraining;
    }

    /**
     * Draws {@code size} distinct rows by a partial Fisher-Yates shuffle.
     */
    static List<double[]> sample(double[][] data, int size, Random random) {
        int[] indices = new int[data.length];
        for (int i = 0; i < indices.length; i++) {
            indices[i] = i;
        }
        List<double[]> chosen = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(indices.length - i);
            int swap = indices[i];
            indices[i] = indices[j];
            indices[j] = swap;
            chosen.add(data[indices[i]]);
        }
        return chosen;
    }

    /**
     * @param point a point of {@link #getDimensions()} values
     * @return the raw anomaly score, averaged over the trees
     */
    public double score(double[] point) {
        checkNotNull(point, "point must not be null");
        if (point.length != dimensions) {
            throw SchemaMismatchException.dimensions(dimensions, point.length);
        }
        double sum = 0;
        for (RandomCutTree tree : trees) {
            sum += tree.traverse(point, new AnomalyScoreVisitor(point, tree.getMass()));
        }
        return sum / trees.size();
    }

    public double[] score(double[][] points) {
        double[] result = new double[points.length];
        for (int i = 0; i < points.length; i++) {
            result[i] = score(points[i]);
        }
        return result;
    }

    public boolean isAnomaly(double rawScore) {
        return rawScore > threshold;
    }

    /**
     * Expresses a raw score relative to the decision threshold so that 0.5 is the
     * boundary between normal and anomalous.
     */
    public double normalizedScore(double rawScore) {
        return rawScore / (2 * threshold);
    }

    public List<RandomCutTree> getTrees() {
        return trees;
    }

    public static Builder<?> builder() {
        return new Builder<>();
    }

    public static class Builder<T extends Builder<T>> {

        private int numberOfTrees = DEFAULT_NUMBER_OF_TREES;
        private int sampleSize = DEFAULT_SAMPLE_SIZE;
        private double contamination = DEFAULT_CONTAMINATION;
        private Optional<Long> randomSeed = Optional.empty();
        private double[][] trainingData;

        public T numberOfTrees(int numberOfTrees) {
            this.numberOfTrees = numberOfTrees;
            return (T) this;
        }

        public T sampleSize(int sampleSize) {
            this.sampleSize = sampleSize;
            return (T) this;
        }

        public T contamination(double contamination) {
            this.contamination = contamination;
            return (T) this;
        }

        public T randomSeed(long randomSeed) {
            this.randomSeed = Optional.of(randomSeed);
            return (T) this;
        }

        public T trainingData(double[][] trainingData) {
            this.trainingData = trainingData;
            return (T) this;
        }

        public RandomCutForestScorer build() {
            return new RandomCutForestScorer(this);
        }
    }
}
