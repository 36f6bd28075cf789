package com.grid.analytics.engine.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Bagged CART trees: each tree sees a bootstrap resample (expressed as per-row counts)
 * and a random share of the features at every split.
 */
public class RandomForestTrainer {

    private final int numTrees;
    private final int maxDepth;
    private final int minSamplesLeaf;
    private final double featureSampleRatio;

    public RandomForestTrainer(int numTrees, int maxDepth, int minSamplesLeaf, double featureSampleRatio) {
        this.numTrees = numTrees;
        this.maxDepth = maxDepth;
        this.minSamplesLeaf = minSamplesLeaf;
        this.featureSampleRatio = featureSampleRatio;
    }

    public TreeEnsemble fit(double[][] x, double[] y, long seed) {
        int n = x.length;
        Random random = new Random(seed);
        List<RegressionTree> trees = new ArrayList<>(numTrees);

        for (int t = 0; t < numTrees; t++) {
            double[] counts = new double[n];
            for (int i = 0; i < n; i++) {
                counts[random.nextInt(n)] += 1.0;
            }
            trees.add(RegressionTree.grow(x, y, counts, maxDepth, minSamplesLeaf, featureSampleRatio, random));
        }
        return new TreeEnsemble(0.0, 1.0 / numTrees, x[0].length, trees);
    }
}
