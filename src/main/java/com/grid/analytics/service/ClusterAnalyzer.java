package com.grid.analytics.service;

import com.grid.analytics.config.PipelineProperties;
import com.grid.analytics.engine.cluster.KMeans;
import com.grid.analytics.engine.cluster.Silhouette;
import com.grid.analytics.exception.ClusteringException;
import com.grid.analytics.model.ClusterAssignment;
import com.grid.analytics.model.ClusterMembership;
import com.grid.analytics.model.FeatureMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Service
public class ClusterAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ClusterAnalyzer.class);

    private final PipelineProperties.Clustering settings;

    public ClusterAnalyzer(PipelineProperties properties) {
        this.settings = properties.getClustering();
    }

    /**
     * Partition the rows into {@code k} consumption-pattern clusters.
     *
     * @throws ClusteringException if there are fewer rows or distinct points than clusters,
     *                             or the clustered features hold non-finite values
     */
    public ClusterAssignment cluster(FeatureMatrix matrix, int k, long seed) {
        List<String> features = clusteringFeatures(matrix);
        if (features.isEmpty()) {
            throw new ClusteringException("None of the clustering features " + settings.getFeatures()
                    + " are present in the feature matrix");
        }
        int n = matrix.rowCount();
        if (n < k) {
            throw new ClusteringException("Cannot form " + k + " clusters from " + n + " rows");
        }
        double[][] data = matrix.select(features);
        Set<List<Double>> distinct = new HashSet<>();
        for (double[] row : data) {
            for (double v : row) {
                if (!Double.isFinite(v)) {
                    throw new ClusteringException("Clustering features contain non-finite values");
                }
            }
            if (distinct.size() < k) {
                distinct.add(Arrays.stream(row).boxed().toList());
            }
        }
        if (distinct.size() < k) {
            throw new ClusteringException("Only " + distinct.size() + " distinct points for " + k + " clusters");
        }

        KMeans.Result result = new KMeans(k, settings.getRestarts(), settings.getMaxIterations(),
                settings.getTolerance()).fit(data, seed);
        int[] labels = result.getLabels();

        double[] load = matrix.getTarget();
        int[] sizes = new int[k];
        double[] loadSums = new double[k];
        List<ClusterMembership> assignments = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            sizes[labels[i]]++;
            loadSums[labels[i]] += load[i];
            assignments.add(ClusterMembership.builder()
                    .timestamp(matrix.timestamp(i))
                    .region(matrix.region(i))
                    .clusterId(labels[i])
                    .build());
        }

        List<List<Double>> centroids = new ArrayList<>(k);
        List<Integer> clusterSizes = new ArrayList<>(k);
        List<Double> meanLoad = new ArrayList<>(k);
        for (int c = 0; c < k; c++) {
            centroids.add(Arrays.stream(result.getCentroids()[c]).boxed().toList());
            clusterSizes.add(sizes[c]);
            meanLoad.add(sizes[c] == 0 ? 0.0 : loadSums[c] / sizes[c]);
        }

        int sampleSize = settings.getSilhouetteSampleSize();
        double silhouette = Silhouette.score(data, labels, k, sampleSize, seed);
        log.info("Clustered {} rows into {} clusters on {}: sizes={}, silhouette={}, inertia={}",
                n, k, features, clusterSizes, String.format("%.3f", silhouette),
                String.format("%.2f", result.getInertia()));

        return ClusterAssignment.builder()
                .generatedAt(System.currentTimeMillis())
                .k(k)
                .seed(seed)
                .features(features)
                .assignments(assignments)
                .centroids(centroids)
                .clusterSizes(clusterSizes)
                .meanLoadMw(meanLoad)
                .silhouetteScore(silhouette)
                .silhouetteSampleSize(Silhouette.evaluatedRows(n, sampleSize))
                .inertia(result.getInertia())
                .iterations(result.getIterations())
                .build();
    }

    private List<String> clusteringFeatures(FeatureMatrix matrix) {
        return settings.getFeatures().stream()
                .filter(f -> matrix.indexOf(f) >= 0)
                .toList();
    }
}
