package com.grid.analytics.engine.cluster;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class KMeansTest {

    private static final double[][] CENTRES = {{0, 0}, {10, 0}, {0, 10}, {10, 10}};

    @Test
    void fit_fourSeparatedBlobs_recoversThem() {
        double[][] data = blobs(50, 1L);

        KMeans.Result result = new KMeans(4, 5, 100, 1e-6).fit(data, 42L);

        // every blob maps to exactly one cluster, and no two blobs share one
        Map<Integer, Integer> blobToCluster = new HashMap<>();
        for (int i = 0; i < data.length; i++) {
            int blob = i % 4;
            int cluster = result.getLabels()[i];
            assertThat(blobToCluster.computeIfAbsent(blob, b -> cluster)).isEqualTo(cluster);
        }
        assertThat(new HashSet<>(blobToCluster.values())).hasSize(4);
    }

    @Test
    void fit_sameSeed_samePartition() {
        double[][] data = blobs(30, 2L);

        KMeans.Result a = new KMeans(4, 3, 100, 1e-6).fit(data, 9L);
        KMeans.Result b = new KMeans(4, 3, 100, 1e-6).fit(data, 9L);

        assertThat(b.getLabels()).containsExactly(a.getLabels());
        assertThat(b.getInertia()).isEqualTo(a.getInertia());
    }

    @Test
    void fit_everyRowAssignedToValidCluster() {
        double[][] data = blobs(20, 3L);

        KMeans.Result result = new KMeans(3, 2, 50, 1e-6).fit(data, 1L);

        Set<Integer> used = new HashSet<>();
        for (int label : result.getLabels()) {
            assertThat(label).isBetween(0, 2);
            used.add(label);
        }
        assertThat(used).hasSize(3);
        assertThat(result.getLabels()).hasSize(data.length);
    }

    @Test
    void fit_fewerRowsThanClusters_rejected() {
        assertThatThrownBy(() -> new KMeans(3, 1, 10, 1e-6).fit(new double[][]{{1}, {2}}, 1L))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void silhouette_separatedBlobs_closeToOne() {
        double[][] data = blobs(40, 4L);
        KMeans.Result result = new KMeans(4, 3, 100, 1e-6).fit(data, 5L);

        double score = Silhouette.score(data, result.getLabels(), 4, 10_000, 5L);

        assertThat(score).isGreaterThan(0.8).isLessThanOrEqualTo(1.0);
    }

    @Test
    void silhouette_sampledAboveLimit_stillInRange() {
        double[][] data = blobs(100, 6L);
        KMeans.Result result = new KMeans(4, 2, 100, 1e-6).fit(data, 5L);

        double sampled = Silhouette.score(data, result.getLabels(), 4, 120, 5L);
        double full = Silhouette.score(data, result.getLabels(), 4, 10_000, 5L);

        assertThat(Silhouette.evaluatedRows(data.length, 120)).isEqualTo(120);
        assertThat(sampled).isCloseTo(full, within(0.1));
    }

    private static double[][] blobs(int perBlob, long seed) {
        Random random = new Random(seed);
        double[][] data = new double[perBlob * CENTRES.length][];
        for (int i = 0; i < data.length; i++) {
            double[] c = CENTRES[i % CENTRES.length];
            data[i] = new double[]{c[0] + random.nextGaussian() * 0.5, c[1] + random.nextGaussian() * 0.5};
        }
        return data;
    }
}
