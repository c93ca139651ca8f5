package com.metricwatch.anomaly.engine.isolationforest;

import java.util.Random;

final class IsolationTree {

    private final IsolationNode root;

    private IsolationTree(IsolationNode root) {
        this.root = root;
    }

    static IsolationTree grow(double[][] sample, int heightLimit, Random random) {
        return new IsolationTree(grow(sample, 0, heightLimit, random));
    }

    private static IsolationNode grow(double[][] data, int depth, int heightLimit, Random random) {
        int n = data.length;
        if (depth >= heightLimit || n <= 1) {
            return IsolationNode.leaf(n);
        }

        int feature = random.nextInt(data[0].length);
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double[] row : data) {
            min = Math.min(min, row[feature]);
            max = Math.max(max, row[feature]);
        }
        // constant along the chosen feature: nothing left to isolate here
        if (min >= max) {
            return IsolationNode.leaf(n);
        }

        double splitValue = min + random.nextDouble() * (max - min);
        int leftCount = 0;
        for (double[] row : data) {
            if (row[feature] < splitValue) leftCount++;
        }

        double[][] leftData = new double[leftCount][];
        double[][] rightData = new double[n - leftCount][];
        int li = 0;
        int ri = 0;
        for (double[] row : data) {
            if (row[feature] < splitValue) {
                leftData[li++] = row;
            } else {
                rightData[ri++] = row;
            }
        }

        return IsolationNode.split(feature, splitValue,
                grow(leftData, depth + 1, heightLimit, random),
                grow(rightData, depth + 1, heightLimit, random));
    }

    double pathLength(double[] point) {
        return root.pathLength(point, 0);
    }
}
