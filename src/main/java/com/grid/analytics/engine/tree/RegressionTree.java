package com.grid.analytics.engine.tree;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

/**
 * CART regression tree with squared-error splits. Samples carry integer-like weights so
 * bootstrap resamples and row subsamples are expressed without copying the data.
 */
public class RegressionTree {

    private TreeNode root;

    public RegressionTree() {}

    public RegressionTree(TreeNode root) {
        this.root = root;
    }

    /**
     * @param x                  feature rows
     * @param y                  targets
     * @param weights            per-row weight; rows with weight 0 are not used
     * @param maxDepth           maximum depth (root = depth 0)
     * @param minSamplesLeaf     minimum weighted samples on each side of a split
     * @param featureSampleRatio share of features considered at each split (1.0 = all)
     * @param random             source for feature sampling
     */
    public static RegressionTree grow(double[][] x, double[] y, double[] weights, int maxDepth,
                                      int minSamplesLeaf, double featureSampleRatio, Random random) {
        List<Integer> members = new ArrayList<>();
        double sumW = 0, sumWY = 0;
        for (int i = 0; i < x.length; i++) {
            if (weights[i] > 0) {
                members.add(i);
                sumW += weights[i];
                sumWY += weights[i] * y[i];
            }
        }
        if (members.isEmpty()) {
            throw new IllegalArgumentException("Cannot grow a tree without weighted samples");
        }
        int featureCount = x[0].length;
        int perSplit = Math.max(1, (int) Math.round(featureSampleRatio * featureCount));
        Grower grower = new Grower(x, y, weights, maxDepth, minSamplesLeaf, Math.min(perSplit, featureCount), random);
        int[] idx = members.stream().mapToInt(Integer::intValue).toArray();
        return new RegressionTree(grower.build(idx, 0, sumW, sumWY));
    }

    public double predict(double[] x) {
        TreeNode node = root;
        while (!node.isLeaf()) {
            node = node.goesLeft(x) ? node.getLeft() : node.getRight();
        }
        return node.getValue();
    }

    /** Adds each split's gain to {@code importance[splitFeature]}. */
    public void accumulateGain(double[] importance) {
        accumulate(root, importance);
    }

    private static void accumulate(TreeNode node, double[] importance) {
        if (node.isLeaf()) return;
        importance[node.getSplitFeature()] += node.getGain();
        accumulate(node.getLeft(), importance);
        accumulate(node.getRight(), importance);
    }

    public int depth() {
        return depth(root);
    }

    private static int depth(TreeNode node) {
        return node.isLeaf() ? 0 : 1 + Math.max(depth(node.getLeft()), depth(node.getRight()));
    }

    public TreeNode getRoot() { return root; }
    public void setRoot(TreeNode root) { this.root = root; }

    private static final class Grower {
        private final double[][] x;
        private final double[] y;
        private final double[] w;
        private final int maxDepth;
        private final int minLeaf;
        private final int perSplit;
        private final Random random;

        Grower(double[][] x, double[] y, double[] w, int maxDepth, int minLeaf, int perSplit, Random random) {
            this.x = x;
            this.y = y;
            this.w = w;
            this.maxDepth = maxDepth;
            this.minLeaf = minLeaf;
            this.perSplit = perSplit;
            this.random = random;
        }

        TreeNode build(int[] members, int depth, double sumW, double sumWY) {
            double value = sumWY / sumW;
            if (depth >= maxDepth || sumW < 2.0 * minLeaf || members.length < 2) {
                return TreeNode.leaf(value, sumW);
            }

            int bestFeature = -1;
            double bestThreshold = 0, bestGain = 1e-12, bestLeftW = 0, bestLeftWY = 0;
            double parentScore = sumWY * sumWY / sumW;

            Integer[] order = new Integer[members.length];
            for (int f : candidateFeatures()) {
                for (int k = 0; k < members.length; k++) order[k] = members[k];
                final int feature = f;
                Arrays.sort(order, Comparator.comparingDouble(i -> x[i][feature]));

                double lw = 0, lwy = 0;
                for (int k = 0; k < order.length - 1; k++) {
                    int i = order[k];
                    lw += w[i];
                    lwy += w[i] * y[i];
                    double here = x[i][f];
                    double next = x[order[k + 1]][f];
                    if (next <= here) continue;
                    double rw = sumW - lw;
                    if (lw < minLeaf || rw < minLeaf) continue;
                    double gain = lwy * lwy / lw + (sumWY - lwy) * (sumWY - lwy) / rw - parentScore;
                    if (gain > bestGain) {
                        double mid = here + (next - here) / 2.0;
                        bestFeature = f;
                        bestThreshold = mid < next ? mid : here;
                        bestGain = gain;
                        bestLeftW = lw;
                        bestLeftWY = lwy;
                    }
                }
            }

            if (bestFeature < 0) {
                return TreeNode.leaf(value, sumW);
            }

            int leftCount = 0;
            for (int i : members) {
                if (x[i][bestFeature] <= bestThreshold) leftCount++;
            }
            int[] left = new int[leftCount];
            int[] right = new int[members.length - leftCount];
            int li = 0, ri = 0;
            for (int i : members) {
                if (x[i][bestFeature] <= bestThreshold) {
                    left[li++] = i;
                } else {
                    right[ri++] = i;
                }
            }

            TreeNode l = build(left, depth + 1, bestLeftW, bestLeftWY);
            TreeNode r = build(right, depth + 1, sumW - bestLeftW, sumWY - bestLeftWY);
            return TreeNode.split(bestFeature, bestThreshold, l, r, value, sumW, bestGain);
        }

        private int[] candidateFeatures() {
            int featureCount = x[0].length;
            int[] all = new int[featureCount];
            for (int i = 0; i < featureCount; i++) all[i] = i;
            if (perSplit >= featureCount) return all;
            // partial Fisher-Yates
            for (int i = 0; i < perSplit; i++) {
                int j = i + random.nextInt(featureCount - i);
                int tmp = all[i];
                all[i] = all[j];
                all[j] = tmp;
            }
            return Arrays.copyOf(all, perSplit);
        }
    }
}
