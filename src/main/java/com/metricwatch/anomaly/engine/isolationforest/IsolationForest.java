package com.metricwatch.anomaly.engine.isolationforest;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Unsupervised outlier-scoring ensemble (Liu, Ting and Zhou, 2008).
 *
 * A forest is fitted once on a window and then scores the same window: points that are
 * isolated by few random splits are anomalous. Fitting is deterministic for a given seed.
 */
public final class IsolationForest {

    private final List<IsolationTree> trees;
    private final int sampleSize;
    private final int featureCount;

    private IsolationForest(List<IsolationTree> trees, int sampleSize, int featureCount) {
        this.trees = trees;
        this.sampleSize = sampleSize;
        this.featureCount = featureCount;
    }

    /**
     * Fit a forest.
     *
     * @param data       training rows, all of the same width
     * @param numTrees   number of trees
     * @param maxSamples sub-sample size per tree, capped at the number of rows
     * @param seed       random seed
     */
    public static IsolationForest fit(double[][] data, int numTrees, int maxSamples, long seed) {
        if (data.length == 0) {
            throw new IllegalArgumentException("Cannot fit an isolation forest on zero rows");
        }
        if (numTrees < 1) {
            throw new IllegalArgumentException("numTrees must be >= 1, got " + numTrees);
        }
        int sampleSize = Math.max(1, Math.min(maxSamples, data.length));
        int heightLimit = (int) Math.ceil(Math.log(Math.max(sampleSize, 2)) / Math.log(2));

        Random random = new Random(seed);
        List<IsolationTree> trees = new ArrayList<>(numTrees);
        for (int i = 0; i < numTrees; i++) {
            trees.add(IsolationTree.grow(subsample(data, sampleSize, random), heightLimit, random));
        }
        return new IsolationForest(Collections.unmodifiableList(trees), sampleSize, data[0].length);
    }

    /**
     * Anomaly score s(x, n) = 2^(-E(h(x)) / c(n)), in (0, 1].
     * Around 0.5 or below is normal; close to 1 is clearly anomalous.
     */
    public double score(double[] point) {
        if (point.length != featureCount) {
            throw new IllegalArgumentException("Point has " + point.length
                    + " features, forest was fitted on " + featureCount);
        }
        double avgPathLength = 0.0;
        for (IsolationTree tree : trees) {
            avgPathLength += tree.pathLength(point);
        }
        avgPathLength /= trees.size();

        double c = IsolationNode.averagePathLength(sampleSize);
        if (c <= 0) return 0.5;
        return Math.pow(2.0, -avgPathLength / c);
    }

    public double[] scoreAll(double[][] data) {
        double[] scores = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            scores[i] = score(data[i]);
        }
        return scores;
    }

    /**
     * How much each feature pushes {@code point} toward anomaly: the drop in score when that
     * feature alone is replaced by its mean. Never negative.
     */
    public double[] featureContributions(double[] point, double[] featureMeans) {
        double baseScore = score(point);
        double[] contributions = new double[point.length];
        for (int i = 0; i < point.length; i++) {
            double[] modified = Arrays.copyOf(point, point.length);
            modified[i] = featureMeans[i];
            contributions[i] = Math.max(0, baseScore - score(modified));
        }
        return contributions;
    }

    public int treeCount() {
        return trees.size();
    }

    public int sampleSize() {
        return sampleSize;
    }

    public int featureCount() {
        return featureCount;
    }

    private static double[][] subsample(double[][] data, int size, Random random) {
        if (data.length <= size) {
            return Arrays.copyOf(data, data.length);
        }
        // partial Fisher-Yates over row indices
        int[] indices = new int[data.length];
        for (int i = 0; i < data.length; i++) indices[i] = i;
        double[][] sample = new double[size][];
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(data.length - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
            sample[i] = data[indices[i]];
        }
        return sample;
    }
}
