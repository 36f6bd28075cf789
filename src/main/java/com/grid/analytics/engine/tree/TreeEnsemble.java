package com.grid.analytics.engine.tree;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Additive tree ensemble: {@code prediction = baseValue + treeWeight * sum(tree(x))}.
 * A random forest is {@code baseValue = 0, treeWeight = 1/T}; gradient boosting is
 * {@code baseValue = mean(y), treeWeight = learningRate}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class TreeEnsemble {

    private double baseValue;
    private double treeWeight;
    private int featureCount;
    private List<RegressionTree> trees;

    public TreeEnsemble() {
        this.trees = new ArrayList<>();
    }

    public TreeEnsemble(double baseValue, double treeWeight, int featureCount, List<RegressionTree> trees) {
        this.baseValue = baseValue;
        this.treeWeight = treeWeight;
        this.featureCount = featureCount;
        this.trees = trees;
    }

    public double predict(double[] x) {
        if (x.length != featureCount) {
            throw new IllegalArgumentException("Expected " + featureCount + " features, got " + x.length);
        }
        double sum = 0.0;
        for (RegressionTree tree : trees) {
            sum += tree.predict(x);
        }
        return baseValue + treeWeight * sum;
    }

    public double[] predict(double[][] rows) {
        double[] out = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            out[i] = predict(rows[i]);
        }
        return out;
    }

    /** Split-gain importance per feature, normalized to sum to 1 (all zeros for stump-only ensembles). */
    public double[] gainImportance() {
        double[] importance = new double[featureCount];
        for (RegressionTree tree : trees) {
            tree.accumulateGain(importance);
        }
        double total = 0;
        for (double v : importance) total += v;
        if (total > 0) {
            for (int i = 0; i < importance.length; i++) importance[i] /= total;
        }
        return importance;
    }

    // Getters/setters for serialization
    public double getBaseValue() { return baseValue; }
    public void setBaseValue(double baseValue) { this.baseValue = baseValue; }
    public double getTreeWeight() { return treeWeight; }
    public void setTreeWeight(double treeWeight) { this.treeWeight = treeWeight; }
    public int getFeatureCount() { return featureCount; }
    public void setFeatureCount(int featureCount) { this.featureCount = featureCount; }
    public List<RegressionTree> getTrees() { return trees; }
    public void setTrees(List<RegressionTree> trees) { this.trees = trees; }
}
