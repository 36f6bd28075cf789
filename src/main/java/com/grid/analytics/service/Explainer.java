package com.grid.analytics.service;

import com.grid.analytics.config.PipelineProperties;
import com.grid.analytics.engine.explain.TreeShap;
import com.grid.analytics.engine.tree.TreeEnsemble;
import com.grid.analytics.exception.ExplainabilityException;
import com.grid.analytics.model.ExplanationReport;
import com.grid.analytics.model.FeatureImportance;
import com.grid.analytics.model.FeatureMatrix;
import com.grid.analytics.model.RecordAttribution;
import com.grid.analytics.model.TrainedModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class Explainer {

    private static final Logger log = LoggerFactory.getLogger(Explainer.class);

    private static final double ADDITIVITY_TOLERANCE = 1e-6;

    private final PipelineProperties.Explain settings;

    public Explainer(PipelineProperties properties) {
        this.settings = properties.getExplain();
    }

    /**
     * Attribute the model's predictions for the most recent rows of {@code matrix} to its input
     * features with exact TreeSHAP.
     *
     * @throws ExplainabilityException if the model is missing, not tree-based, or was trained on a
     *                                 different feature layout
     */
    public ExplanationReport explain(TrainedModel model, FeatureMatrix matrix) {
        if (model == null) {
            throw new ExplainabilityException("No trained model to explain");
        }
        if (!model.getAlgorithm().isTreeBased()) {
            throw new ExplainabilityException(model.getAlgorithm().getId() + " does not support tree attributions");
        }
        if (!model.getFeatureSchema().getFeatureNames().equals(matrix.getFeatureNames())) {
            throw new ExplainabilityException("Model " + model.getModelId() + " was trained on "
                    + model.getFeatureSchema().getFeatureNames() + " but the matrix has " + matrix.getFeatureNames());
        }

        List<String> inputs = model.getInputFeatures();
        TreeEnsemble ensemble = model.getEnsemble();
        double[][] x = matrix.select(inputs);
        double expected = TreeShap.expectedValue(ensemble);

        int n = matrix.rowCount();
        int from = Math.max(0, n - settings.getMaxRows());
        double[] absSums = new double[inputs.size()];
        List<RecordAttribution> records = new ArrayList<>(n - from);
        for (int i = from; i < n; i++) {
            double[] phi = TreeShap.attributions(ensemble, x[i]);
            double prediction = ensemble.predict(x[i]);
            double total = expected;
            Map<String, Double> attributions = new LinkedHashMap<>();
            for (int f = 0; f < phi.length; f++) {
                total += phi[f];
                absSums[f] += Math.abs(phi[f]);
                attributions.put(inputs.get(f), phi[f]);
            }
            if (Math.abs(total - prediction) > ADDITIVITY_TOLERANCE * Math.max(1.0, Math.abs(prediction))) {
                throw new ExplainabilityException(String.format(
                        "Attributions for row %d sum to %.6f but the prediction is %.6f", i, total, prediction));
            }
            records.add(RecordAttribution.builder()
                    .rowIndex(i)
                    .timestamp(matrix.timestamp(i))
                    .region(matrix.region(i))
                    .prediction(prediction)
                    .attributions(attributions)
                    .build());
        }

        List<FeatureImportance> ranking = globalImportance(inputs, absSums, records.size());
        log.info("Explained {} rows of model {} (expected value {}), top feature {}",
                records.size(), model.getModelId(), String.format("%.2f", expected),
                ranking.isEmpty() ? "n/a" : ranking.get(0).getFeature());

        return ExplanationReport.builder()
                .generatedAt(System.currentTimeMillis())
                .modelId(model.getModelId())
                .algorithm(model.getAlgorithm())
                .modelTrainedAt(model.getTrainedAt())
                .expectedValue(expected)
                .explainedRows(records.size())
                .globalImportance(ranking)
                .records(records)
                .summary(summary(ranking))
                .build();
    }

    private static List<FeatureImportance> globalImportance(List<String> inputs, double[] absSums, int rows) {
        double total = 0;
        for (double s : absSums) total += s;
        List<FeatureImportance> ranking = new ArrayList<>(inputs.size());
        for (int f = 0; f < inputs.size(); f++) {
            double meanAbs = rows == 0 ? 0.0 : absSums[f] / rows;
            ranking.add(FeatureImportance.builder()
                    .feature(inputs.get(f))
                    .meanAbsAttribution(meanAbs)
                    .share(total == 0 ? 0.0 : absSums[f] / total)
                    .build());
        }
        ranking.sort(Comparator.comparingDouble(FeatureImportance::getMeanAbsAttribution).reversed());
        return ranking;
    }

    private static List<String> summary(List<FeatureImportance> ranking) {
        List<String> lines = new ArrayList<>();
        for (FeatureImportance importance : ranking.subList(0, Math.min(3, ranking.size()))) {
            lines.add(String.format("%s moves the predicted load by %.1f MW on average (%.0f%% of total attribution).",
                    importance.getFeature(), importance.getMeanAbsAttribution(), 100 * importance.getShare()));
        }
        return lines;
    }
}
