package com.grid.analytics.service;

import com.grid.analytics.config.MetricsConfig;
import com.grid.analytics.config.PipelineProperties;
import com.grid.analytics.engine.isolationforest.IsolationForest;
import com.grid.analytics.exception.AnomalyDetectionException;
import com.grid.analytics.model.AnomalyFlag;
import com.grid.analytics.model.AnomalyReport;
import com.grid.analytics.model.FeatureMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class AnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetector.class);

    private final PipelineProperties.Anomaly settings;
    private final MetricsConfig metrics;

    public AnomalyDetector(PipelineProperties properties, MetricsConfig metrics) {
        this.settings = properties.getAnomaly();
        this.metrics = metrics;
    }

    /**
     * Score every row with an isolation forest and flag the {@code round(contaminationRate * n)}
     * highest-scoring rows.
     *
     * @throws AnomalyDetectionException on empty input or non-finite scores
     */
    public AnomalyReport detect(FeatureMatrix matrix, double contaminationRate, long seed) {
        int n = matrix.rowCount();
        if (n == 0) {
            throw new AnomalyDetectionException("No rows to score");
        }
        double[][] data = matrix.values();
        IsolationForest forest = IsolationForest.fit(data, settings.getNumTrees(), settings.getSampleSize(), seed);
        double[] scores = forest.scores(data);
        for (double s : scores) {
            if (!Double.isFinite(s)) {
                throw new AnomalyDetectionException("Isolation forest produced a non-finite score");
            }
        }

        // Stable ordering by descending score; ties keep row order.
        Integer[] order = new Integer[n];
        for (int i = 0; i < n; i++) order[i] = i;
        Arrays.sort(order, (a, b) -> Double.compare(scores[b], scores[a]));
        int flaggedCount = (int) Math.round(contaminationRate * n);
        boolean[] anomalous = new boolean[n];
        for (int i = 0; i < flaggedCount; i++) {
            anomalous[order[i]] = true;
        }
        double threshold = flaggedCount == 0 ? 1.0 : scores[order[flaggedCount - 1]];

        double[] columnMeans = columnMeans(data);
        List<String> featureNames = matrix.getFeatureNames();
        double[] load = matrix.getTarget();
        double anomalousLoad = 0, normalLoad = 0;
        List<AnomalyFlag> flags = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            Map<String, Double> factors = Map.of();
            if (anomalous[i]) {
                anomalousLoad += load[i];
                factors = topFactors(forest.featureContributions(data[i], columnMeans), featureNames);
            } else {
                normalLoad += load[i];
            }
            flags.add(AnomalyFlag.builder()
                    .rowIndex(i)
                    .timestamp(matrix.timestamp(i))
                    .region(matrix.region(i))
                    .score(scores[i])
                    .anomalous(anomalous[i])
                    .topFactors(factors)
                    .build());
        }

        double observed = (double) flaggedCount / n;
        Double meanAnomalous = flaggedCount == 0 ? null : anomalousLoad / flaggedCount;
        Double meanNormal = flaggedCount == n ? null : normalLoad / (n - flaggedCount);
        metrics.updateObservedContamination(observed);
        log.info("Flagged {} of {} rows as anomalous (configured {}, score threshold {})",
                flaggedCount, n, contaminationRate, String.format("%.4f", threshold));

        return AnomalyReport.builder()
                .generatedAt(System.currentTimeMillis())
                .configuredContamination(contaminationRate)
                .observedContamination(observed)
                .scoreThreshold(threshold)
                .flaggedCount(flaggedCount)
                .totalRows(n)
                .meanLoadAnomalous(meanAnomalous)
                .meanLoadNormal(meanNormal)
                .flags(flags)
                .summary(summary(flaggedCount, n, meanAnomalous, meanNormal))
                .build();
    }

    private Map<String, Double> topFactors(double[] contributions, List<String> featureNames) {
        Integer[] order = new Integer[contributions.length];
        for (int i = 0; i < order.length; i++) order[i] = i;
        Arrays.sort(order, (a, b) -> Double.compare(contributions[b], contributions[a]));
        Map<String, Double> top = new LinkedHashMap<>();
        for (int i = 0; i < Math.min(settings.getTopFactors(), order.length); i++) {
            top.put(featureNames.get(order[i]), contributions[order[i]]);
        }
        return top;
    }

    private static double[] columnMeans(double[][] data) {
        double[] means = new double[data[0].length];
        for (double[] row : data) {
            for (int c = 0; c < row.length; c++) means[c] += row[c];
        }
        for (int c = 0; c < means.length; c++) means[c] /= data.length;
        return means;
    }

    private static List<String> summary(int flagged, int total, Double meanAnomalous, Double meanNormal) {
        List<String> lines = new ArrayList<>();
        lines.add(String.format("%d of %d measurements (%.1f%%) were flagged as anomalous.",
                flagged, total, 100.0 * flagged / total));
        if (meanAnomalous != null && meanNormal != null) {
            lines.add(String.format("Mean load of anomalous measurements is %.1f MW against %.1f MW for normal ones.",
                    meanAnomalous, meanNormal));
        }
        return lines;
    }
}
