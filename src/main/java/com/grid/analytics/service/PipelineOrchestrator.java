package com.grid.analytics.service;

import com.grid.analytics.config.MetricsConfig;
import com.grid.analytics.config.PipelineProperties;
import com.grid.analytics.exception.ExplainabilityException;
import com.grid.analytics.exception.PersistenceException;
import com.grid.analytics.exception.PipelineErrorCode;
import com.grid.analytics.exception.PipelineException;
import com.grid.analytics.feature.FeatureBuilder;
import com.grid.analytics.model.AnomalyReport;
import com.grid.analytics.model.ClusterAssignment;
import com.grid.analytics.model.EvaluationReport;
import com.grid.analytics.model.ExplanationReport;
import com.grid.analytics.model.FeatureMatrix;
import com.grid.analytics.model.PipelineConfig;
import com.grid.analytics.model.PipelineRun;
import com.grid.analytics.model.RawRecord;
import com.grid.analytics.model.RunStatus;
import com.grid.analytics.model.StageName;
import com.grid.analytics.model.StageState;
import com.grid.analytics.model.StageStatus;
import com.grid.analytics.model.TrainedModel;
import com.grid.analytics.repository.PipelineArtifactRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Runs the pipeline: feature build, then regression, clustering and anomaly detection in
 * parallel, then explanation of the best model, then publication of the bundle.
 * Holds no per-run state; every invocation returns a new immutable {@link PipelineRun}.
 */
@Service
public class PipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    private static final DateTimeFormatter RUN_ID_TIME =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'").withZone(ZoneOffset.UTC);

    private static final Set<StageName> ANALYTIC_STAGES = EnumSet.of(
            StageName.REGRESSION, StageName.CLUSTERING, StageName.ANOMALY_DETECTION, StageName.EXPLANATION);

    private final FeatureBuilder featureBuilder;
    private final RegressionTrainer regressionTrainer;
    private final ClusterAnalyzer clusterAnalyzer;
    private final AnomalyDetector anomalyDetector;
    private final Explainer explainer;
    private final PipelineArtifactRepository artifactRepository;
    private final PipelineProperties properties;
    private final MetricsConfig metrics;
    private final Executor executor;

    public PipelineOrchestrator(FeatureBuilder featureBuilder,
                                RegressionTrainer regressionTrainer,
                                ClusterAnalyzer clusterAnalyzer,
                                AnomalyDetector anomalyDetector,
                                Explainer explainer,
                                PipelineArtifactRepository artifactRepository,
                                PipelineProperties properties,
                                MetricsConfig metrics,
                                @Qualifier("pipelineExecutor") Executor executor) {
        this.featureBuilder = featureBuilder;
        this.regressionTrainer = regressionTrainer;
        this.clusterAnalyzer = clusterAnalyzer;
        this.anomalyDetector = anomalyDetector;
        this.explainer = explainer;
        this.artifactRepository = artifactRepository;
        this.properties = properties;
        this.metrics = metrics;
        this.executor = executor;
    }

    /**
     * Execute every stage over {@code records}. Stage failures are reported in the returned run,
     * never thrown.
     *
     * @throws IllegalArgumentException if {@code config} is invalid
     */
    @Observed(name = "pipeline.run", contextualName = "run-pipeline")
    public PipelineRun run(List<RawRecord> records, PipelineConfig config) {
        config.validate();
        long startedAt = System.currentTimeMillis();
        String runId = newRunId(startedAt);
        log.info("=== Starting pipeline run {} over {} records ===", runId, records.size());

        StageTracker tracker = new StageTracker();
        FeatureMatrix matrix = buildFeatures(runId, records, config, tracker);
        if (matrix == null) {
            return dataQualityFailure(runId, null, config, tracker, startedAt);
        }
        return execute(runId, matrix, config, tracker, ANALYTIC_STAGES, null, startedAt);
    }

    /**
     * Re-execute only the given analytic stages of an earlier run on freshly built features; the
     * other stages' results are carried over. Re-running regression also re-runs explanation.
     * The result is published as a new run.
     *
     * @throws IllegalArgumentException if no stage, or a non-analytic stage, is requested,
     *                                  or {@code config} is invalid
     */
    @Observed(name = "pipeline.rerun", contextualName = "rerun-pipeline-stages")
    public PipelineRun rerun(PipelineRun previous, Collection<StageName> stages,
                             List<RawRecord> records, PipelineConfig config) {
        if (stages == null || stages.isEmpty()) {
            throw new IllegalArgumentException("At least one stage must be selected for a re-run");
        }
        for (StageName stage : stages) {
            if (!stage.isRerunnable()) {
                throw new IllegalArgumentException("Stage " + stage.getId() + " cannot be re-run on its own");
            }
        }
        PipelineConfig effective = (config != null ? config : previous.getConfig()).validate();
        Set<StageName> selected = EnumSet.copyOf(stages);
        if (selected.contains(StageName.REGRESSION)) {
            selected.add(StageName.EXPLANATION);
        }

        long startedAt = System.currentTimeMillis();
        String runId = newRunId(startedAt);
        log.info("=== Re-running {} of run {} as {} ===", selected, previous.getRunId(), runId);

        StageTracker tracker = new StageTracker();
        FeatureMatrix matrix = buildFeatures(runId, records, effective, tracker);
        if (matrix == null) {
            return dataQualityFailure(runId, previous.getRunId(), effective, tracker, startedAt);
        }
        return execute(runId, matrix, effective, tracker, selected, previous, startedAt);
    }

    private FeatureMatrix buildFeatures(String runId, List<RawRecord> records, PipelineConfig config,
                                        StageTracker tracker) {
        int minimumRows = properties.getFeatures().getMinRowsPerFold() * config.getCvFolds();
        tracker.start(StageName.FEATURE_BUILD);
        try {
            FeatureMatrix matrix = featureBuilder.build(records, minimumRows);
            tracker.succeed(StageName.FEATURE_BUILD);
            return matrix;
        } catch (RuntimeException e) {
            log.error("Run {}: feature build failed", runId, e);
            tracker.fail(StageName.FEATURE_BUILD, PipelineErrorCode.DATA_QUALITY, e.getMessage());
            return null;
        }
    }

    private PipelineRun dataQualityFailure(String runId, String parentRunId, PipelineConfig config,
                                           StageTracker tracker, long startedAt) {
        tracker.skipPending(PipelineErrorCode.DATA_QUALITY.getLabel(), "Feature build failed");
        PipelineRun run = PipelineRun.builder()
                .runId(runId)
                .parentRunId(parentRunId)
                .createdAt(startedAt)
                .completedAt(System.currentTimeMillis())
                .status(RunStatus.FAILED)
                .failureReason(PipelineErrorCode.DATA_QUALITY.getLabel())
                .config(config)
                .stages(tracker.snapshot())
                .build();
        finish(run, startedAt);
        return run;
    }

    private PipelineRun execute(String runId, FeatureMatrix matrix, PipelineConfig config,
                                StageTracker tracker, Set<StageName> selected, PipelineRun previous,
                                long startedAt) {
        long seed = config.getSeed();

        CompletableFuture<TrainingResult> regression = selected.contains(StageName.REGRESSION)
                ? CompletableFuture.supplyAsync(() -> runStage(runId, tracker, StageName.REGRESSION,
                        PipelineErrorCode.TRAINING, () -> regressionTrainer.trainAndEvaluate(matrix, config)), executor)
                : CompletableFuture.completedFuture(null);
        CompletableFuture<ClusterAssignment> clustering = selected.contains(StageName.CLUSTERING)
                ? CompletableFuture.supplyAsync(() -> runStage(runId, tracker, StageName.CLUSTERING,
                        PipelineErrorCode.CLUSTERING,
                        () -> clusterAnalyzer.cluster(matrix, config.getClusterCount(), seed)), executor)
                : CompletableFuture.completedFuture(null);
        CompletableFuture<AnomalyReport> anomalies = selected.contains(StageName.ANOMALY_DETECTION)
                ? CompletableFuture.supplyAsync(() -> runStage(runId, tracker, StageName.ANOMALY_DETECTION,
                        PipelineErrorCode.ANOMALY_DETECTION,
                        () -> anomalyDetector.detect(matrix, config.getContaminationRate(), seed)), executor)
                : CompletableFuture.completedFuture(null);
        CompletableFuture.allOf(regression, clustering, anomalies).join();

        EvaluationReport evaluation;
        List<TrainedModel> models;
        if (selected.contains(StageName.REGRESSION)) {
            TrainingResult result = regression.join();
            evaluation = result == null ? null : result.report();
            models = result == null ? List.of() : result.models();
        } else {
            tracker.carryOver(StageName.REGRESSION, previous.stage(StageName.REGRESSION));
            evaluation = previous.getEvaluation();
            models = previous.getModels();
        }

        ClusterAssignment clusters = clustering.join();
        if (!selected.contains(StageName.CLUSTERING)) {
            tracker.carryOver(StageName.CLUSTERING, previous.stage(StageName.CLUSTERING));
            clusters = previous.getClusters();
        }
        AnomalyReport anomalyReport = anomalies.join();
        if (!selected.contains(StageName.ANOMALY_DETECTION)) {
            tracker.carryOver(StageName.ANOMALY_DETECTION, previous.stage(StageName.ANOMALY_DETECTION));
            anomalyReport = previous.getAnomalies();
        }

        ExplanationReport explanation;
        if (selected.contains(StageName.EXPLANATION)) {
            explanation = explain(runId, tracker, PipelineRun.bestModel(models, evaluation), matrix);
        } else {
            tracker.carryOver(StageName.EXPLANATION, previous.stage(StageName.EXPLANATION));
            explanation = previous.getExplanation();
        }

        tracker.start(StageName.PERSISTENCE);
        long completedAt = System.currentTimeMillis();
        RunStatus status = tracker.anyFailed() ? RunStatus.PARTIALLY_SUCCEEDED : RunStatus.SUCCEEDED;
        Map<String, StageStatus> stages = tracker.snapshot();
        StageStatus persisting = stages.get(StageName.PERSISTENCE.getId());
        stages.put(StageName.PERSISTENCE.getId(), persisting.toBuilder()
                .state(StageState.SUCCEEDED)
                .finishedAt(completedAt)
                .build());

        PipelineRun run = PipelineRun.builder()
                .runId(runId)
                .parentRunId(previous == null ? null : previous.getRunId())
                .createdAt(startedAt)
                .completedAt(completedAt)
                .status(status)
                .config(config)
                .stages(stages)
                .featureSummary(matrix.getSummary())
                .evaluation(evaluation)
                .clusters(clusters)
                .anomalies(anomalyReport)
                .explanation(explanation)
                .models(models)
                .build();

        try {
            artifactRepository.publish(run);
            tracker.succeed(StageName.PERSISTENCE);
        } catch (PersistenceException e) {
            log.error("Run {}: persistence failed", runId, e);
            tracker.fail(StageName.PERSISTENCE, PipelineErrorCode.PERSISTENCE, e.getMessage());
            run = run.toBuilder()
                    .status(RunStatus.FAILED)
                    .failureReason(PipelineErrorCode.PERSISTENCE.getLabel())
                    .stages(tracker.snapshot())
                    .build();
        }
        finish(run, startedAt);
        return run;
    }

    private ExplanationReport explain(String runId, StageTracker tracker, TrainedModel model, FeatureMatrix matrix) {
        if (model == null) {
            tracker.skip(StageName.EXPLANATION, "NoTrainedModel", "No trained model is available to explain");
            log.warn("Run {}: explanation skipped, no trained model", runId);
            return null;
        }
        tracker.start(StageName.EXPLANATION);
        try {
            ExplanationReport report = explainer.explain(model, matrix);
            tracker.succeed(StageName.EXPLANATION);
            return report;
        } catch (ExplainabilityException e) {
            log.warn("Run {}: explanation skipped: {}", runId, e.getMessage());
            tracker.skip(StageName.EXPLANATION, PipelineErrorCode.EXPLAINABILITY.getLabel(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Run {}: explanation failed unexpectedly", runId, e);
            tracker.skip(StageName.EXPLANATION, PipelineErrorCode.EXPLAINABILITY.getLabel(), e.getMessage());
        }
        return null;
    }

    private <T> T runStage(String runId, StageTracker tracker, StageName stage, PipelineErrorCode code,
                           Supplier<T> body) {
        tracker.start(stage);
        long start = System.currentTimeMillis();
        try {
            T result = body.get();
            tracker.succeed(stage);
            log.info("Run {}: stage {} succeeded in {} ms", runId, stage.getId(), System.currentTimeMillis() - start);
            return result;
        } catch (PipelineException e) {
            log.error("Run {}: stage {} failed with {}", runId, stage.getId(), e.getErrorCode().getLabel(), e);
            tracker.fail(stage, e.getErrorCode(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Run {}: stage {} failed unexpectedly", runId, stage.getId(), e);
            tracker.fail(stage, code, e.getMessage());
        }
        return null;
    }

    private void finish(PipelineRun run, long startedAt) {
        run.getStages().forEach((stage, status) -> metrics.recordStageOutcome(stage, status.getState().label()));
        metrics.recordRun(run.getStatus().label(), Duration.ofMillis(System.currentTimeMillis() - startedAt));
        log.info("=== Pipeline run {} finished: {} ===", run.getRunId(), run.getStatusLine());
    }

    static String newRunId(long epochMillis) {
        return RUN_ID_TIME.format(Instant.ofEpochMilli(epochMillis)) + "-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
