package com.grid.analytics.engine.tree;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public class TreeNode {

    @JsonProperty("f")
    private int splitFeature;

    @JsonProperty("t")
    private double threshold; // x[f] <= t goes left

    @JsonProperty("l")
    private TreeNode left;

    @JsonProperty("r")
    private TreeNode right;

    @JsonProperty("v")
    private double value; // weighted mean target of the samples that reached this node

    @JsonProperty("c")
    private double cover; // weighted sample count that reached this node

    @JsonProperty("g")
    private double gain; // squared-error reduction of this split

    @JsonProperty("e")
    private boolean leaf;

    public TreeNode() {}

    public static TreeNode split(int splitFeature, double threshold, TreeNode left, TreeNode right,
                                 double value, double cover, double gain) {
        TreeNode node = new TreeNode();
        node.splitFeature = splitFeature;
        node.threshold = threshold;
        node.left = left;
        node.right = right;
        node.value = value;
        node.cover = cover;
        node.gain = gain;
        node.leaf = false;
        return node;
    }

    public static TreeNode leaf(double value, double cover) {
        TreeNode node = new TreeNode();
        node.value = value;
        node.cover = cover;
        node.leaf = true;
        return node;
    }

    public boolean goesLeft(double[] x) {
        return x[splitFeature] <= threshold;
    }

    public int getSplitFeature() { return splitFeature; }
    public double getThreshold() { return threshold; }
    public TreeNode getLeft() { return left; }
    public TreeNode getRight() { return right; }
    public double getValue() { return value; }
    public double getCover() { return cover; }
    public double getGain() { return gain; }
    public boolean isLeaf() { return leaf; }
}
