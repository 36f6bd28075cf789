package com.grid.analytics.engine.tree;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * Stochastic gradient boosting with squared loss: every round fits a shallow tree to the
 * current residuals on a row subsample and adds it with the learning rate as shrinkage.
 */
public class GradientBoostingTrainer {

    private final int numTrees;
    private final int maxDepth;
    private final int minSamplesLeaf;
    private final double learningRate;
    private final double subsampleRatio;

    public GradientBoostingTrainer(int numTrees, int maxDepth, int minSamplesLeaf,
                                   double learningRate, double subsampleRatio) {
        this.numTrees = numTrees;
        this.maxDepth = maxDepth;
        this.minSamplesLeaf = minSamplesLeaf;
        this.learningRate = learningRate;
        this.subsampleRatio = subsampleRatio;
    }

    /**
     * @throws ArithmeticException if the boosted predictions stop being finite
     */
    public TreeEnsemble fit(double[][] x, double[] y, long seed) {
        int n = x.length;
        Random random = new Random(seed);

        double base = 0.0;
        for (double v : y) base += v;
        base /= n;

        double[] current = new double[n];
        Arrays.fill(current, base);
        double[] residual = new double[n];
        int sampleSize = Math.max(1, (int) Math.round(subsampleRatio * n));
        int[] indices = new int[n];
        List<RegressionTree> trees = new ArrayList<>(numTrees);

        for (int m = 0; m < numTrees; m++) {
            for (int i = 0; i < n; i++) {
                residual[i] = y[i] - current[i];
            }

            double[] weights = new double[n];
            for (int i = 0; i < n; i++) indices[i] = i;
            for (int i = 0; i < sampleSize; i++) {
                int j = i + random.nextInt(n - i);
                int tmp = indices[i];
                indices[i] = indices[j];
                indices[j] = tmp;
                weights[indices[i]] = 1.0;
            }

            RegressionTree tree = RegressionTree.grow(x, residual, weights, maxDepth, minSamplesLeaf, 1.0, random);
            trees.add(tree);
            for (int i = 0; i < n; i++) {
                current[i] += learningRate * tree.predict(x[i]);
                if (!Double.isFinite(current[i])) {
                    throw new ArithmeticException("Boosting diverged at round " + (m + 1));
                }
            }
        }
        return new TreeEnsemble(base, learningRate, x[0].length, trees);
    }
}
