package com.grid.analytics.engine.cluster;

import java.util.Random;

/**
 * Mean silhouette coefficient, in [-1, 1]. Quadratic in the number of rows, so above
 * {@code sampleSize} rows a seeded random sample is scored instead.
 */
public final class Silhouette {

    private Silhouette() {}

    public static double score(double[][] data, int[] labels, int k, int sampleSize, long seed) {
        int[] rows = sampleRows(data.length, sampleSize, seed);
        double total = 0;
        for (int i : rows) {
            total += coefficient(data, labels, k, rows, i);
        }
        return rows.length == 0 ? 0.0 : total / rows.length;
    }

    /** Number of rows {@link #score} actually evaluates. */
    public static int evaluatedRows(int rowCount, int sampleSize) {
        return Math.min(rowCount, sampleSize);
    }

    private static double coefficient(double[][] data, int[] labels, int k, int[] rows, int i) {
        double[] sum = new double[k];
        int[] count = new int[k];
        for (int j : rows) {
            if (j == i) continue;
            sum[labels[j]] += Math.sqrt(KMeans.squaredDistance(data[i], data[j]));
            count[labels[j]]++;
        }
        int own = labels[i];
        if (count[own] == 0) {
            return 0.0; // singleton cluster
        }
        double a = sum[own] / count[own];
        double b = Double.POSITIVE_INFINITY;
        for (int c = 0; c < k; c++) {
            if (c != own && count[c] > 0) {
                b = Math.min(b, sum[c] / count[c]);
            }
        }
        if (Double.isInfinite(b)) {
            return 0.0;
        }
        double denominator = Math.max(a, b);
        return denominator == 0 ? 0.0 : (b - a) / denominator;
    }

    private static int[] sampleRows(int n, int sampleSize, long seed) {
        int[] all = new int[n];
        for (int i = 0; i < n; i++) all[i] = i;
        if (n <= sampleSize) return all;
        Random random = new Random(seed);
        for (int i = 0; i < sampleSize; i++) {
            int j = i + random.nextInt(n - i);
            int tmp = all[i];
            all[i] = all[j];
            all[j] = tmp;
        }
        int[] sample = new int[sampleSize];
        System.arraycopy(all, 0, sample, 0, sampleSize);
        return sample;
    }
}
