package com.grid.analytics.service;

import com.grid.analytics.config.MetricsConfig;
import com.grid.analytics.config.PipelineProperties;
import com.grid.analytics.engine.tree.GradientBoostingTrainer;
import com.grid.analytics.engine.tree.RandomForestTrainer;
import com.grid.analytics.engine.tree.TreeEnsemble;
import com.grid.analytics.exception.TrainingException;
import com.grid.analytics.model.EvaluationReport;
import com.grid.analytics.model.FeatureMatrix;
import com.grid.analytics.model.ModelAlgorithm;
import com.grid.analytics.model.ModelEvaluation;
import com.grid.analytics.model.PipelineConfig;
import com.grid.analytics.model.TrainedModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Trains every regression family on the older part of the feature matrix and evaluates it on the
 * newer part, against a per-region moving-average baseline.
 */
@Service
public class RegressionTrainer {

    private static final Logger log = LoggerFactory.getLogger(RegressionTrainer.class);

    private final PipelineProperties.Training training;
    private final Map<ModelAlgorithm, Map<String, Double>> hyperparameters = new EnumMap<>(ModelAlgorithm.class);
    private final MetricsConfig metrics;

    public RegressionTrainer(PipelineProperties properties, MetricsConfig metrics) {
        this.training = properties.getTraining();
        this.metrics = metrics;
        for (ModelAlgorithm algorithm : ModelAlgorithm.values()) {
            Map<String, Double> params = training.hyperparameters(algorithm);
            algorithm.validate(params);
            hyperparameters.put(algorithm, Map.copyOf(params));
        }
        if (training.getBaselineWindow() < 1) {
            throw new IllegalArgumentException("pipeline.training.baseline-window must be at least 1");
        }
    }

    /**
     * @throws TrainingException if the matrix cannot be split in time, or every family failed
     */
    public TrainingResult trainAndEvaluate(FeatureMatrix matrix, PipelineConfig config) {
        int n = matrix.rowCount();
        long[] timestamps = matrix.getTimestamps();
        int split = temporalSplit(timestamps, config.getTrainRatio());

        List<String> inputs = new ArrayList<>(matrix.getFeatureNames());
        inputs.remove(FeatureMatrix.TARGET_FEATURE);
        double[][] x = matrix.select(inputs);
        double[] y = matrix.getTarget();

        double[][] trainX = Arrays.copyOfRange(x, 0, split);
        double[] trainY = Arrays.copyOfRange(y, 0, split);
        double[][] evalX = Arrays.copyOfRange(x, split, n);
        double[] evalY = Arrays.copyOfRange(y, split, n);

        log.info("Training on {} rows, evaluating on {} rows (split at {})", split, n - split, timestamps[split]);

        double[] baseline = Arrays.copyOfRange(baselinePredictions(y, matrix.getRegions(), mean(trainY)), split, n);
        double baselineRmse = rmse(evalY, baseline);
        double baselineMae = mae(evalY, baseline);

        List<TrainedModel> models = new ArrayList<>();
        List<ModelEvaluation> evaluations = new ArrayList<>();
        Map<String, String> failed = new LinkedHashMap<>();
        long seed = config.getSeed();

        for (ModelAlgorithm algorithm : ModelAlgorithm.values()) {
            try {
                TreeEnsemble ensemble = fit(algorithm, trainX, trainY, seed);
                double[] trainPred = predictFinite(algorithm, ensemble, trainX);
                double[] evalPred = predictFinite(algorithm, ensemble, evalX);

                double evalRmse = rmse(evalY, evalPred);
                double trainRmse = rmse(trainY, trainPred);
                double gap = evalRmse > 0 ? (evalRmse - trainRmse) / evalRmse : 0.0;
                double[] cv = crossValidate(algorithm, trainX, trainY, timestamps, config.getCvFolds(), seed);

                TrainedModel model = TrainedModel.builder()
                        .modelId(algorithm.getId() + "-" + UUID.randomUUID().toString().substring(0, 8))
                        .algorithm(algorithm)
                        .hyperparameters(hyperparameters.get(algorithm))
                        .inputFeatures(List.copyOf(inputs))
                        .featureSchema(matrix.getSchema())
                        .trainedAt(System.currentTimeMillis())
                        .trainingRows(split)
                        .seed(seed)
                        .ensemble(ensemble)
                        .build();

                ModelEvaluation evaluation = ModelEvaluation.builder()
                        .algorithm(algorithm)
                        .modelId(model.getModelId())
                        .rmse(evalRmse)
                        .mae(mae(evalY, evalPred))
                        .r2(r2(evalY, evalPred))
                        .trainRmse(trainRmse)
                        .overfitGap(gap)
                        .overfitFlagged(gap > training.getOverfitThreshold())
                        .cvRmseMean(cv[0])
                        .cvRmseStd(cv[1])
                        .cvFolds(config.getCvFolds())
                        .beatsBaseline(evalRmse < baselineRmse)
                        .featureImportance(importance(inputs, ensemble))
                        .build();

                if (evaluation.isOverfitFlagged()) {
                    log.warn("{} overfit gap {} exceeds {}: train RMSE {}, eval RMSE {}",
                            algorithm.getId(), String.format("%.3f", gap), training.getOverfitThreshold(),
                            String.format("%.2f", trainRmse), String.format("%.2f", evalRmse));
                }
                log.info("{}: RMSE={} MAE={} R2={} (baseline RMSE={})", algorithm.getId(),
                        String.format("%.2f", evalRmse), String.format("%.2f", evaluation.getMae()),
                        String.format("%.4f", evaluation.getR2()), String.format("%.2f", baselineRmse));
                metrics.recordModelRmse(algorithm.getId(), evalRmse);

                models.add(model);
                evaluations.add(evaluation);
            } catch (RuntimeException e) {
                log.error("Training {} failed", algorithm.getId(), e);
                failed.put(algorithm.getId(), e.getMessage());
            }
        }

        if (models.isEmpty()) {
            throw new TrainingException("Every model family failed to train: " + failed);
        }

        ModelEvaluation best = evaluations.stream()
                .min(Comparator.comparingDouble(ModelEvaluation::getRmse))
                .orElseThrow();

        EvaluationReport report = EvaluationReport.builder()
                .generatedAt(System.currentTimeMillis())
                .target(FeatureMatrix.TARGET_FEATURE)
                .trainRows(split)
                .evaluationRows(n - split)
                .splitTimestamp(timestamps[split])
                .baselineWindow(training.getBaselineWindow())
                .baselineRmse(baselineRmse)
                .baselineMae(baselineMae)
                .overfitThreshold(training.getOverfitThreshold())
                .models(List.copyOf(evaluations))
                .bestAlgorithm(best.getAlgorithm())
                .bestModelId(best.getModelId())
                .failedAlgorithms(failed)
                .build();
        return new TrainingResult(List.copyOf(models), report);
    }

    public Map<String, Double> hyperparameters(ModelAlgorithm algorithm) {
        return hyperparameters.get(algorithm);
    }

    TreeEnsemble fit(ModelAlgorithm algorithm, double[][] x, double[] y, long seed) {
        Map<String, Double> p = hyperparameters.get(algorithm);
        return switch (algorithm) {
            case RANDOM_FOREST -> new RandomForestTrainer(
                    p.get("numTrees").intValue(),
                    p.get("maxDepth").intValue(),
                    p.get("minSamplesLeaf").intValue(),
                    p.get("featureSampleRatio")).fit(x, y, seed);
            case GRADIENT_BOOSTED_TREES -> new GradientBoostingTrainer(
                    p.get("numTrees").intValue(),
                    p.get("maxDepth").intValue(),
                    p.get("minSamplesLeaf").intValue(),
                    p.get("learningRate"),
                    p.get("subsampleRatio")).fit(x, y, seed);
        };
    }

    private static double[] predictFinite(ModelAlgorithm algorithm, TreeEnsemble ensemble, double[][] x) {
        double[] predictions = ensemble.predict(x);
        for (double p : predictions) {
            if (!Double.isFinite(p)) {
                throw new TrainingException(algorithm.getId() + " produced a non-finite prediction");
            }
        }
        return predictions;
    }

    /**
     * Index of the first evaluation row. Rows sharing a timestamp stay on the same side, so every
     * training timestamp is strictly earlier than every evaluation timestamp.
     */
    static int temporalSplit(long[] timestamps, double trainRatio) {
        int n = timestamps.length;
        int nominal = Math.min(n - 1, Math.max(1, (int) Math.floor(n * trainRatio)));
        int split = nominal;
        while (split < n && timestamps[split] == timestamps[split - 1]) {
            split++;
        }
        if (split >= n) {
            split = nominal;
            while (split > 0 && timestamps[split] == timestamps[split - 1]) {
                split--;
            }
        }
        if (split <= 0 || split >= n) {
            throw new TrainingException("Cannot split " + n + " rows into earlier training and later evaluation rows");
        }
        return split;
    }

    /**
     * Expanding-window validation inside the training partition: the partition is cut into
     * {@code folds + 1} consecutive blocks and fold i trains on blocks 0..i and scores block i+1.
     *
     * @return mean and standard deviation of the fold RMSEs
     */
    double[] crossValidate(ModelAlgorithm algorithm, double[][] x, double[] y, long[] timestamps,
                           int folds, long seed) {
        int n = x.length;
        int block = n / (folds + 1);
        if (block < 1) {
            throw new TrainingException("Training partition of " + n + " rows is too small for " + folds + " folds");
        }
        double[] scores = new double[folds];
        for (int fold = 0; fold < folds; fold++) {
            int trainEnd = advancePastTies(timestamps, (fold + 1) * block, n);
            int validEnd = fold == folds - 1 ? n : advancePastTies(timestamps, (fold + 2) * block, n);
            if (trainEnd >= validEnd) {
                throw new TrainingException("Fold " + fold + " has no validation rows");
            }
            TreeEnsemble ensemble = fit(algorithm, Arrays.copyOfRange(x, 0, trainEnd),
                    Arrays.copyOfRange(y, 0, trainEnd), seed + fold + 1);
            double[] predicted = predictFinite(algorithm, ensemble, Arrays.copyOfRange(x, trainEnd, validEnd));
            scores[fold] = rmse(Arrays.copyOfRange(y, trainEnd, validEnd), predicted);
        }
        double mean = mean(scores);
        double variance = 0;
        for (double s : scores) variance += (s - mean) * (s - mean);
        return new double[]{mean, Math.sqrt(variance / folds)};
    }

    private static int advancePastTies(long[] timestamps, int index, int limit) {
        int i = Math.min(index, limit);
        while (i > 0 && i < limit && timestamps[i] == timestamps[i - 1]) {
            i++;
        }
        return i;
    }

    /**
     * One-step-ahead moving average of the previous {@code baselineWindow} loads of the same
     * region; a row without history gets the training mean.
     */
    double[] baselinePredictions(double[] load, String[] regions, double fallback) {
        int window = training.getBaselineWindow();
        Map<String, Deque<Double>> history = new HashMap<>();
        Map<String, Double> sums = new HashMap<>();
        double[] predicted = new double[load.length];
        for (int i = 0; i < load.length; i++) {
            Deque<Double> past = history.computeIfAbsent(regions[i], r -> new ArrayDeque<>());
            double sum = sums.getOrDefault(regions[i], 0.0);
            predicted[i] = past.isEmpty() ? fallback : sum / past.size();
            past.addLast(load[i]);
            sum += load[i];
            if (past.size() > window) {
                sum -= past.removeFirst();
            }
            sums.put(regions[i], sum);
        }
        return predicted;
    }

    private static Map<String, Double> importance(List<String> inputs, TreeEnsemble ensemble) {
        double[] gains = ensemble.gainImportance();
        Integer[] order = new Integer[gains.length];
        for (int i = 0; i < order.length; i++) order[i] = i;
        Arrays.sort(order, (a, b) -> Double.compare(gains[b], gains[a]));
        Map<String, Double> ranked = new LinkedHashMap<>();
        for (int i : order) {
            ranked.put(inputs.get(i), gains[i]);
        }
        return ranked;
    }

    static double rmse(double[] actual, double[] predicted) {
        double sum = 0;
        for (int i = 0; i < actual.length; i++) {
            double d = actual[i] - predicted[i];
            sum += d * d;
        }
        return Math.sqrt(sum / actual.length);
    }

    static double mae(double[] actual, double[] predicted) {
        double sum = 0;
        for (int i = 0; i < actual.length; i++) {
            sum += Math.abs(actual[i] - predicted[i]);
        }
        return sum / actual.length;
    }

    /** Coefficient of determination; 0 when the actual values have no variance. */
    static double r2(double[] actual, double[] predicted) {
        double mean = mean(actual);
        double ssRes = 0, ssTot = 0;
        for (int i = 0; i < actual.length; i++) {
            ssRes += (actual[i] - predicted[i]) * (actual[i] - predicted[i]);
            ssTot += (actual[i] - mean) * (actual[i] - mean);
        }
        return ssTot == 0 ? 0.0 : 1.0 - ssRes / ssTot;
    }

    private static double mean(double[] values) {
        double sum = 0;
        for (double v : values) sum += v;
        return values.length == 0 ? 0.0 : sum / values.length;
    }
}
