package com.grid.analytics.engine.explain;

import com.grid.analytics.engine.tree.RegressionTree;
import com.grid.analytics.engine.tree.TreeEnsemble;
import com.grid.analytics.engine.tree.TreeNode;

/**
 * Exact path-dependent TreeSHAP (Lundberg et al., "Consistent Individualized Feature Attribution
 * for Tree Ensembles", algorithm 2). For every row, {@code expectedValue + sum(attributions)}
 * equals the ensemble prediction up to floating-point error.
 */
public final class TreeShap {

    private TreeShap() {}

    /** Cover-weighted mean prediction of the ensemble over its training data. */
    public static double expectedValue(TreeEnsemble ensemble) {
        double sum = 0;
        for (RegressionTree tree : ensemble.getTrees()) {
            sum += expectedValue(tree.getRoot());
        }
        return ensemble.getBaseValue() + ensemble.getTreeWeight() * sum;
    }

    static double expectedValue(TreeNode node) {
        if (node.isLeaf()) {
            return node.getValue();
        }
        double cover = node.getCover();
        return (node.getLeft().getCover() * expectedValue(node.getLeft())
                + node.getRight().getCover() * expectedValue(node.getRight())) / cover;
    }

    public static double[] attributions(TreeEnsemble ensemble, double[] x) {
        if (x.length != ensemble.getFeatureCount()) {
            throw new IllegalArgumentException("Expected " + ensemble.getFeatureCount() + " features, got " + x.length);
        }
        double[] phi = new double[x.length];
        for (RegressionTree tree : ensemble.getTrees()) {
            attributions(tree.getRoot(), x, phi);
        }
        for (int i = 0; i < phi.length; i++) {
            phi[i] *= ensemble.getTreeWeight();
        }
        return phi;
    }

    /** Adds the attributions of a single tree to {@code phi}. */
    static void attributions(TreeNode root, double[] x, double[] phi) {
        recurse(root, x, phi, new PathElement[0], 0, 1.0, 1.0, -1);
    }

    private static void recurse(TreeNode node, double[] x, double[] phi, PathElement[] parentPath,
                                int uniqueDepth, double zeroFraction, double oneFraction, int featureIndex) {
        PathElement[] path = new PathElement[uniqueDepth + 1];
        for (int i = 0; i < uniqueDepth; i++) {
            path[i] = parentPath[i].copy();
        }
        extend(path, uniqueDepth, zeroFraction, oneFraction, featureIndex);

        if (node.isLeaf()) {
            for (int i = 1; i <= uniqueDepth; i++) {
                double w = unwoundSum(path, uniqueDepth, i);
                PathElement el = path[i];
                phi[el.feature] += w * (el.oneFraction - el.zeroFraction) * node.getValue();
            }
            return;
        }

        TreeNode hot = node.goesLeft(x) ? node.getLeft() : node.getRight();
        TreeNode cold = hot == node.getLeft() ? node.getRight() : node.getLeft();
        double hotZero = hot.getCover() / node.getCover();
        double coldZero = cold.getCover() / node.getCover();

        double incomingZero = 1.0;
        double incomingOne = 1.0;
        int split = node.getSplitFeature();
        int pathIndex = 0;
        while (pathIndex <= uniqueDepth && path[pathIndex].feature != split) {
            pathIndex++;
        }
        // a feature seen higher up the path is unwound so it is only counted once
        if (pathIndex <= uniqueDepth) {
            incomingZero = path[pathIndex].zeroFraction;
            incomingOne = path[pathIndex].oneFraction;
            unwind(path, uniqueDepth, pathIndex);
            uniqueDepth--;
        }

        recurse(hot, x, phi, path, uniqueDepth + 1, hotZero * incomingZero, incomingOne, split);
        recurse(cold, x, phi, path, uniqueDepth + 1, coldZero * incomingZero, 0.0, split);
    }

    private static void extend(PathElement[] path, int uniqueDepth, double zeroFraction,
                               double oneFraction, int featureIndex) {
        path[uniqueDepth] = new PathElement(featureIndex, zeroFraction, oneFraction, uniqueDepth == 0 ? 1.0 : 0.0);
        for (int i = uniqueDepth - 1; i >= 0; i--) {
            path[i + 1].weight += oneFraction * path[i].weight * (i + 1) / (uniqueDepth + 1);
            path[i].weight = zeroFraction * path[i].weight * (uniqueDepth - i) / (uniqueDepth + 1);
        }
    }

    private static void unwind(PathElement[] path, int uniqueDepth, int pathIndex) {
        double oneFraction = path[pathIndex].oneFraction;
        double zeroFraction = path[pathIndex].zeroFraction;
        double nextOnePortion = path[uniqueDepth].weight;
        for (int i = uniqueDepth - 1; i >= 0; i--) {
            if (oneFraction != 0) {
                double tmp = path[i].weight;
                path[i].weight = nextOnePortion * (uniqueDepth + 1) / ((i + 1) * oneFraction);
                nextOnePortion = tmp - path[i].weight * zeroFraction * (uniqueDepth - i) / (uniqueDepth + 1);
            } else {
                path[i].weight = path[i].weight * (uniqueDepth + 1) / (zeroFraction * (uniqueDepth - i));
            }
        }
        for (int i = pathIndex; i < uniqueDepth; i++) {
            path[i].feature = path[i + 1].feature;
            path[i].zeroFraction = path[i + 1].zeroFraction;
            path[i].oneFraction = path[i + 1].oneFraction;
        }
    }

    private static double unwoundSum(PathElement[] path, int uniqueDepth, int pathIndex) {
        double oneFraction = path[pathIndex].oneFraction;
        double zeroFraction = path[pathIndex].zeroFraction;
        double nextOnePortion = path[uniqueDepth].weight;
        double total = 0;
        for (int i = uniqueDepth - 1; i >= 0; i--) {
            if (oneFraction != 0) {
                double tmp = nextOnePortion * (uniqueDepth + 1) / ((i + 1) * oneFraction);
                total += tmp;
                nextOnePortion = path[i].weight - tmp * zeroFraction * ((uniqueDepth - i) / (double) (uniqueDepth + 1));
            } else {
                total += (path[i].weight / zeroFraction) / ((uniqueDepth - i) / (double) (uniqueDepth + 1));
            }
        }
        return total;
    }

    private static final class PathElement {
        int feature;
        double zeroFraction;
        double oneFraction;
        double weight;

        PathElement(int feature, double zeroFraction, double oneFraction, double weight) {
            this.feature = feature;
            this.zeroFraction = zeroFraction;
            this.oneFraction = oneFraction;
            this.weight = weight;
        }

        PathElement copy() {
            return new PathElement(feature, zeroFraction, oneFraction, weight);
        }
    }
}
