package com.grid.analytics.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cleaned, encoded and scaled feature rows in ascending time order.
 * Instances are never modified after construction; accessors hand out copies.
 */
public final class FeatureMatrix {

    public static final String TARGET_FEATURE = "load_mw";

    private final List<String> featureNames;
    private final double[][] values;
    private final long[] timestamps;
    private final String[] regions;
    private final double[] target;
    private final FeatureSchema schema;
    private final FeatureBuildSummary summary;

    public FeatureMatrix(List<String> featureNames, double[][] values, long[] timestamps, String[] regions,
                         double[] target, FeatureSchema schema, FeatureBuildSummary summary) {
        if (values.length != timestamps.length || values.length != regions.length || values.length != target.length) {
            throw new IllegalArgumentException("Row-aligned arrays differ in length");
        }
        this.featureNames = List.copyOf(featureNames);
        this.values = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            if (values[i].length != featureNames.size()) {
                throw new IllegalArgumentException("Row " + i + " has " + values[i].length
                        + " values for " + featureNames.size() + " features");
            }
            this.values[i] = values[i].clone();
        }
        this.timestamps = timestamps.clone();
        this.regions = regions.clone();
        this.target = target.clone();
        this.schema = schema;
        this.summary = summary;
    }

    public int rowCount() {
        return values.length;
    }

    public List<String> getFeatureNames() {
        return featureNames;
    }

    public int indexOf(String feature) {
        return featureNames.indexOf(feature);
    }

    public double value(int row, int column) {
        return values[row][column];
    }

    /** Dense copy of all rows. */
    public double[][] values() {
        return select(featureNames);
    }

    /** Dense copy of the given columns, in the given order. */
    public double[][] select(List<String> columns) {
        int[] idx = new int[columns.size()];
        for (int c = 0; c < idx.length; c++) {
            idx[c] = featureNames.indexOf(columns.get(c));
            if (idx[c] < 0) {
                throw new IllegalArgumentException("Unknown feature: " + columns.get(c));
            }
        }
        double[][] out = new double[values.length][idx.length];
        for (int r = 0; r < values.length; r++) {
            for (int c = 0; c < idx.length; c++) {
                out[r][c] = values[r][idx[c]];
            }
        }
        return out;
    }

    public Map<String, Double> row(int row) {
        Map<String, Double> mapped = new LinkedHashMap<>();
        for (int c = 0; c < featureNames.size(); c++) {
            mapped.put(featureNames.get(c), values[row][c]);
        }
        return Collections.unmodifiableMap(mapped);
    }

    public long timestamp(int row) {
        return timestamps[row];
    }

    public String region(int row) {
        return regions[row];
    }

    public long[] getTimestamps() {
        return timestamps.clone();
    }

    public String[] getRegions() {
        return regions.clone();
    }

    /** Unscaled load in MW, the regression target. */
    public double[] getTarget() {
        return target.clone();
    }

    public FeatureSchema getSchema() {
        return schema;
    }

    public FeatureBuildSummary getSummary() {
        return summary;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FeatureMatrix other)) return false;
        return featureNames.equals(other.featureNames)
                && Arrays.deepEquals(values, other.values)
                && Arrays.equals(timestamps, other.timestamps)
                && Arrays.equals(regions, other.regions)
                && Arrays.equals(target, other.target)
                && schema.equals(other.schema);
    }

    @Override
    public int hashCode() {
        return 31 * featureNames.hashCode() + Arrays.deepHashCode(values);
    }
}
