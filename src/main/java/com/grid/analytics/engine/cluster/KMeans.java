package com.grid.analytics.engine.cluster;

import java.util.Arrays;
import java.util.Random;

/**
 * Lloyd's k-means with k-means++ seeding. The best of several seeded restarts (lowest inertia)
 * is kept, so the same data, k and seed always give the same partition.
 */
public class KMeans {

    private final int k;
    private final int restarts;
    private final int maxIterations;
    private final double tolerance;

    public KMeans(int k, int restarts, int maxIterations, double tolerance) {
        if (k < 1) throw new IllegalArgumentException("k must be at least 1, got " + k);
        if (restarts < 1) throw new IllegalArgumentException("restarts must be at least 1, got " + restarts);
        this.k = k;
        this.restarts = restarts;
        this.maxIterations = maxIterations;
        this.tolerance = tolerance;
    }

    public Result fit(double[][] data, long seed) {
        if (data.length < k) {
            throw new IllegalArgumentException("Cannot form " + k + " clusters from " + data.length + " rows");
        }
        Random random = new Random(seed);
        Result best = null;
        for (int attempt = 0; attempt < restarts; attempt++) {
            Result candidate = lloyd(data, seedCentroids(data, random), random);
            if (best == null || candidate.inertia < best.inertia) {
                best = candidate;
            }
        }
        return best;
    }

    private double[][] seedCentroids(double[][] data, Random random) {
        int n = data.length;
        double[][] centroids = new double[k][];
        centroids[0] = data[random.nextInt(n)].clone();
        double[] nearest = new double[n];
        Arrays.fill(nearest, Double.POSITIVE_INFINITY);
        for (int c = 1; c < k; c++) {
            double total = 0;
            for (int i = 0; i < n; i++) {
                nearest[i] = Math.min(nearest[i], squaredDistance(data[i], centroids[c - 1]));
                total += nearest[i];
            }
            int chosen;
            if (total <= 0) {
                chosen = random.nextInt(n);
            } else {
                double target = random.nextDouble() * total;
                chosen = n - 1;
                double cumulative = 0;
                for (int i = 0; i < n; i++) {
                    cumulative += nearest[i];
                    if (cumulative >= target) {
                        chosen = i;
                        break;
                    }
                }
            }
            centroids[c] = data[chosen].clone();
        }
        return centroids;
    }

    private Result lloyd(double[][] data, double[][] centroids, Random random) {
        int n = data.length;
        int dims = data[0].length;
        int[] labels = new int[n];
        int iterations = 0;
        for (int iter = 0; iter < maxIterations; iter++) {
            iterations = iter + 1;
            for (int i = 0; i < n; i++) {
                labels[i] = nearestCentroid(data[i], centroids);
            }

            double[][] sums = new double[k][dims];
            int[] counts = new int[k];
            for (int i = 0; i < n; i++) {
                counts[labels[i]]++;
                for (int d = 0; d < dims; d++) sums[labels[i]][d] += data[i][d];
            }

            double shift = 0;
            for (int c = 0; c < k; c++) {
                double[] next;
                if (counts[c] == 0) {
                    // empty cluster: restart it on the point farthest from its centroid
                    next = data[farthestPoint(data, labels, centroids)].clone();
                } else {
                    next = new double[dims];
                    for (int d = 0; d < dims; d++) next[d] = sums[c][d] / counts[c];
                }
                shift = Math.max(shift, squaredDistance(next, centroids[c]));
                centroids[c] = next;
            }
            if (shift <= tolerance * tolerance) {
                break;
            }
        }

        double inertia = 0;
        for (int i = 0; i < n; i++) {
            labels[i] = nearestCentroid(data[i], centroids);
            inertia += squaredDistance(data[i], centroids[labels[i]]);
        }
        return new Result(centroids, labels, inertia, iterations);
    }

    private static int farthestPoint(double[][] data, int[] labels, double[][] centroids) {
        int farthest = 0;
        double max = -1;
        for (int i = 0; i < data.length; i++) {
            double d = squaredDistance(data[i], centroids[labels[i]]);
            if (d > max) {
                max = d;
                farthest = i;
            }
        }
        return farthest;
    }

    static int nearestCentroid(double[] point, double[][] centroids) {
        int best = 0;
        double bestDistance = Double.POSITIVE_INFINITY;
        for (int c = 0; c < centroids.length; c++) {
            double d = squaredDistance(point, centroids[c]);
            if (d < bestDistance) {
                bestDistance = d;
                best = c;
            }
        }
        return best;
    }

    static double squaredDistance(double[] a, double[] b) {
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            double diff = a[i] - b[i];
            sum += diff * diff;
        }
        return sum;
    }

    public static final class Result {
        private final double[][] centroids;
        private final int[] labels;
        private final double inertia;
        private final int iterations;

        Result(double[][] centroids, int[] labels, double inertia, int iterations) {
            this.centroids = centroids;
            this.labels = labels;
            this.inertia = inertia;
            this.iterations = iterations;
        }

        public double[][] getCentroids() { return centroids; }
        public int[] getLabels() { return labels; }
        public double getInertia() { return inertia; }
        public int getIterations() { return iterations; }
    }
}
