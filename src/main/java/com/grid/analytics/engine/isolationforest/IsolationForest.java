package com.grid.analytics.engine.isolationforest;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * Isolation forest (Liu, Ting and Zhou, 2008). Anomalies are isolated by fewer random splits,
 * so their average path length is short and their score approaches 1.
 */
public class IsolationForest {

    private List<IsolationTree> trees;
    private int sampleSize;

    public IsolationForest() {
        this.trees = new ArrayList<>();
    }

    /**
     * @param data       rows to learn from
     * @param numTrees   number of trees (typically 100)
     * @param sampleSize rows drawn without replacement per tree (typically 256)
     * @param seed       random seed; the same data and seed give the same forest
     */
    public static IsolationForest fit(double[][] data, int numTrees, int sampleSize, long seed) {
        if (data.length == 0) {
            throw new IllegalArgumentException("Cannot fit an isolation forest on zero rows");
        }
        IsolationForest forest = new IsolationForest();
        forest.sampleSize = Math.min(sampleSize, data.length);
        int heightLimit = (int) Math.ceil(Math.log(Math.max(2, forest.sampleSize)) / Math.log(2));
        Random random = new Random(seed);
        for (int i = 0; i < numTrees; i++) {
            forest.trees.add(IsolationTree.build(subsample(data, forest.sampleSize, random), heightLimit, random));
        }
        return forest;
    }

    /**
     * s(x, n) = 2^(-E(h(x)) / c(n)); above 0.5 leans anomalous, well below 0.5 is normal.
     */
    public double score(double[] point) {
        if (trees.isEmpty()) return 0.0;
        double total = 0.0;
        for (IsolationTree tree : trees) {
            total += tree.pathLength(point);
        }
        double c = IsolationNode.averagePathLength(sampleSize);
        if (c <= 0) return 0.0;
        return Math.pow(2.0, -(total / trees.size()) / c);
    }

    public double[] scores(double[][] points) {
        double[] out = new double[points.length];
        for (int i = 0; i < points.length; i++) {
            out[i] = score(points[i]);
        }
        return out;
    }

    /**
     * How much the score drops when each feature alone is reset to its reference value.
     * Only positive drops count.
     */
    public double[] featureContributions(double[] point, double[] reference) {
        double base = score(point);
        double[] contributions = new double[point.length];
        for (int i = 0; i < point.length; i++) {
            double[] modified = Arrays.copyOf(point, point.length);
            modified[i] = reference[i];
            contributions[i] = Math.max(0, base - score(modified));
        }
        return contributions;
    }

    private static double[][] subsample(double[][] data, int size, Random random) {
        if (data.length <= size) {
            return Arrays.copyOf(data, data.length);
        }
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

    // Getters/setters for serialization
    public List<IsolationTree> getTrees() { return trees; }
    public void setTrees(List<IsolationTree> trees) { this.trees = trees; }
    public int getSampleSize() { return sampleSize; }
    public void setSampleSize(int sampleSize) { this.sampleSize = sampleSize; }
}
