package com.grid.analytics.engine.isolationforest;

import java.util.Random;

public class IsolationTree {

    private IsolationNode root;

    public IsolationTree() {}

    IsolationTree(IsolationNode root) {
        this.root = root;
    }

    static IsolationTree build(double[][] sample, int heightLimit, Random random) {
        return new IsolationTree(split(sample, 0, heightLimit, random));
    }

    private static IsolationNode split(double[][] rows, int depth, int heightLimit, Random random) {
        int n = rows.length;
        if (depth >= heightLimit || n <= 1) {
            return IsolationNode.leaf(n);
        }

        // Only features that still vary inside this node can isolate anything.
        int featureCount = rows[0].length;
        double[] min = new double[featureCount];
        double[] max = new double[featureCount];
        int[] varying = new int[featureCount];
        int varyingCount = 0;
        for (int f = 0; f < featureCount; f++) {
            min[f] = Double.POSITIVE_INFINITY;
            max[f] = Double.NEGATIVE_INFINITY;
            for (double[] row : rows) {
                min[f] = Math.min(min[f], row[f]);
                max[f] = Math.max(max[f], row[f]);
            }
            if (max[f] > min[f]) {
                varying[varyingCount++] = f;
            }
        }
        if (varyingCount == 0) {
            return IsolationNode.leaf(n);
        }

        int feature = varying[random.nextInt(varyingCount)];
        double splitValue = min[feature] + random.nextDouble() * (max[feature] - min[feature]);

        int leftCount = 0;
        for (double[] row : rows) {
            if (row[feature] < splitValue) leftCount++;
        }
        double[][] left = new double[leftCount][];
        double[][] right = new double[n - leftCount][];
        int li = 0, ri = 0;
        for (double[] row : rows) {
            if (row[feature] < splitValue) {
                left[li++] = row;
            } else {
                right[ri++] = row;
            }
        }

        return IsolationNode.internal(feature, splitValue,
                split(left, depth + 1, heightLimit, random),
                split(right, depth + 1, heightLimit, random));
    }

    double pathLength(double[] point) {
        return root.pathLength(point);
    }

    public IsolationNode getRoot() { return root; }
    public void setRoot(IsolationNode root) { this.root = root; }
}
