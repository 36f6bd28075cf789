package com.grid.analytics.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.grid.analytics.config.PipelineProperties;
import com.grid.analytics.engine.tree.RandomForestTrainer;
import com.grid.analytics.engine.tree.TreeEnsemble;
import com.grid.analytics.exception.PersistenceException;
import com.grid.analytics.model.EvaluationReport;
import com.grid.analytics.model.FeatureMatrix;
import com.grid.analytics.model.ModelAlgorithm;
import com.grid.analytics.model.PipelineRun;
import com.grid.analytics.model.RunStatus;
import com.grid.analytics.model.StageName;
import com.grid.analytics.model.StageState;
import com.grid.analytics.model.StageStatus;
import com.grid.analytics.model.TrainedModel;
import com.grid.analytics.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PipelineArtifactRepositoryTest {

    @TempDir
    Path baseDir;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private PipelineArtifactRepository repository;
    private FeatureMatrix matrix;
    private TrainedModel model;

    @BeforeEach
    void setUp() {
        PipelineProperties properties = TestDataFactory.properties();
        properties.getArtifacts().setBaseDir(baseDir.toString());
        repository = new PipelineArtifactRepository(properties);

        matrix = TestDataFactory.matrix(TestDataFactory.dailyCycle(200));
        List<String> inputs = matrix.getFeatureNames().stream()
                .filter(f -> !f.equals(FeatureMatrix.TARGET_FEATURE))
                .toList();
        TreeEnsemble ensemble = new RandomForestTrainer(5, 4, 2, 0.5).fit(matrix.select(inputs), matrix.getTarget(), 3L);
        model = TestDataFactory.trainedModel("random-forest-0a1b2c3d", ModelAlgorithm.RANDOM_FOREST, matrix, ensemble);
    }

    @Test
    void publish_thenLoad_predictionsIdentical() {
        repository.publish(run("20240101T000000Z-aaaaaaaa"));
        repository.clearCache();

        TrainedModel loaded = repository.loadModel("20240101T000000Z-aaaaaaaa", ModelAlgorithm.RANDOM_FOREST)
                .orElseThrow();

        assertThat(loaded.predict(matrix)).containsExactly(model.predict(matrix));
        assertThat(loaded.getFeatureSchema()).isEqualTo(model.getFeatureSchema());
        assertThat(loaded.getHyperparameters()).isEqualTo(model.getHyperparameters());
    }

    @Test
    void publish_thenLoadRun_restoresStagesAndModels() {
        repository.publish(run("20240101T000000Z-aaaaaaaa"));
        repository.clearCache();

        PipelineRun loaded = repository.loadRun("20240101T000000Z-aaaaaaaa").orElseThrow();

        assertThat(loaded.getStatus()).isEqualTo(RunStatus.SUCCEEDED);
        assertThat(loaded.stage(StageName.CLUSTERING).getStatus()).isEqualTo("skipped:NotSelected");
        assertThat(loaded.getBestModel().getModelId()).isEqualTo(model.getModelId());
        assertThat(loaded.getEvaluation().getBestModelId()).isEqualTo(model.getModelId());
    }

    @Test
    void publish_writesManifestListingEveryFile() throws IOException {
        repository.publish(run("20240101T000000Z-aaaaaaaa"));

        Path runDir = baseDir.resolve("runs").resolve("20240101T000000Z-aaaaaaaa");
        ArtifactManifest manifest = objectMapper.readValue(runDir.resolve("manifest.json").toFile(),
                ArtifactManifest.class);

        assertThat(manifest.getArtifactSchemaVersion()).isEqualTo(PipelineArtifactRepository.ARTIFACT_SCHEMA_VERSION);
        assertThat(manifest.getFiles()).containsExactly("run.json", "evaluation.json", "models/random-forest.json");
        for (String file : manifest.getFiles()) {
            assertThat(runDir.resolve(file)).exists();
        }
    }

    @Test
    void publish_pointsLatestAtNewestRun() {
        repository.publish(run("20240101T000000Z-aaaaaaaa"));
        repository.publish(run("20240101T010000Z-bbbbbbbb"));

        assertThat(repository.latestRunId()).contains("20240101T010000Z-bbbbbbbb");
        assertThat(repository.loadLatest()).map(PipelineRun::getRunId).contains("20240101T010000Z-bbbbbbbb");
        assertThat(repository.loadRun("20240101T000000Z-aaaaaaaa")).isPresent();
    }

    @Test
    void publish_sameRunIdTwice_rejectedAndOriginalKept() {
        repository.publish(run("20240101T000000Z-aaaaaaaa"));

        assertThatThrownBy(() -> repository.publish(run("20240101T000000Z-aaaaaaaa")))
                .isInstanceOf(PersistenceException.class)
                .hasMessageContaining("already published");
        assertThat(repository.latestRunId()).contains("20240101T000000Z-aaaaaaaa");
    }

    @Test
    void publish_leavesNoStagingDirectories() throws IOException {
        repository.publish(run("20240101T000000Z-aaaaaaaa"));

        try (Stream<Path> entries = Files.list(baseDir.resolve("runs"))) {
            assertThat(entries.map(p -> p.getFileName().toString()))
                    .containsExactly("20240101T000000Z-aaaaaaaa");
        }
    }

    @Test
    void publish_olderRunAfterNewer_latestKeepsNewer() {
        repository.publish(run("20240101T010000Z-bbbbbbbb", TestDataFactory.START + 3_600_000));
        repository.publish(run("20240101T000000Z-aaaaaaaa", TestDataFactory.START));

        assertThat(repository.latestRunId()).contains("20240101T010000Z-bbbbbbbb");
        assertThat(repository.loadRun("20240101T000000Z-aaaaaaaa")).isPresent();
    }

    @Test
    void publish_latestCannotBeReplaced_bundleWithdrawn() throws IOException {
        Path latest = Files.createDirectories(baseDir.resolve("LATEST"));
        Files.writeString(latest.resolve("blocker"), "x");

        assertThatThrownBy(() -> repository.publish(run("20240101T000000Z-aaaaaaaa")))
                .isInstanceOf(PersistenceException.class)
                .hasMessageContaining("20240101T000000Z-aaaaaaaa");
        repository.clearCache();

        assertThat(repository.loadRun("20240101T000000Z-aaaaaaaa")).isEmpty();
        try (Stream<Path> entries = Files.list(baseDir.resolve("runs"))) {
            assertThat(entries).isEmpty();
        }
    }

    @Test
    void loadRun_cacheStaysWithinConfiguredSize() {
        PipelineProperties properties = TestDataFactory.properties();
        properties.getArtifacts().setBaseDir(baseDir.toString());
        properties.getArtifacts().setCacheSize(2);
        PipelineArtifactRepository small = new PipelineArtifactRepository(properties);

        small.publish(run("20240101T000000Z-aaaaaaaa"));
        small.publish(run("20240101T010000Z-bbbbbbbb"));
        small.publish(run("20240101T020000Z-cccccccc"));

        assertThat(small.cachedRunCount()).isEqualTo(2);
        assertThat(small.loadRun("20240101T000000Z-aaaaaaaa")).map(PipelineRun::getRunId)
                .contains("20240101T000000Z-aaaaaaaa");
        assertThat(small.cachedRunCount()).isEqualTo(2);
    }

    @Test
    void repository_nonPositiveCacheSize_rejected() {
        PipelineProperties properties = TestDataFactory.properties();
        properties.getArtifacts().setBaseDir(baseDir.toString());
        properties.getArtifacts().setCacheSize(0);

        assertThatThrownBy(() -> new PipelineArtifactRepository(properties))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("cache-size");
    }

    @Test
    void loadRun_stagesCannotBeModified() {
        repository.publish(run("20240101T000000Z-aaaaaaaa"));
        repository.clearCache();

        PipelineRun loaded = repository.loadRun("20240101T000000Z-aaaaaaaa").orElseThrow();

        assertThatThrownBy(() -> loaded.getStages().remove(StageName.CLUSTERING.getId()))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void publish_invalidRunId_rejected() {
        assertThatThrownBy(() -> repository.publish(run("../escape")))
                .isInstanceOf(PersistenceException.class);
    }

    @Test
    void loadModel_newerArtifactVersion_rejected() throws IOException {
        repository.publish(run("20240101T000000Z-aaaaaaaa"));
        editModel("20240101T000000Z-aaaaaaaa", json -> json.put("artifactSchemaVersion", 99));

        assertThatThrownBy(() -> repository.loadModel("20240101T000000Z-aaaaaaaa", ModelAlgorithm.RANDOM_FOREST))
                .isInstanceOf(PersistenceException.class)
                .hasMessageContaining("schema version 99");
    }

    @Test
    void loadModel_incompatibleFeatureSchema_rejected() throws IOException {
        repository.publish(run("20240101T000000Z-aaaaaaaa"));
        editModel("20240101T000000Z-aaaaaaaa",
                json -> ((ObjectNode) json.get("featureSchema")).put("schemaVersion", 2));

        assertThatThrownBy(() -> repository.loadModel("20240101T000000Z-aaaaaaaa", ModelAlgorithm.RANDOM_FOREST))
                .isInstanceOf(PersistenceException.class)
                .hasMessageContaining("feature schema");
    }

    @Test
    void loadRun_unknownOrMalformedId_empty() {
        assertThat(repository.loadRun("20991231T000000Z-ffffffff")).isEmpty();
        assertThat(repository.loadRun("../../etc")).isEmpty();
        assertThat(repository.loadLatest()).isEmpty();
        assertThat(repository.loadModel("20991231T000000Z-ffffffff", ModelAlgorithm.GRADIENT_BOOSTED_TREES)).isEmpty();
    }

    @Test
    void getModelMetadata_marksBestModel() {
        repository.publish(run("20240101T000000Z-aaaaaaaa"));

        List<Map<String, Object>> metadata = repository.getModelMetadata("20240101T000000Z-aaaaaaaa");

        assertThat(metadata).hasSize(1);
        assertThat(metadata.get(0))
                .containsEntry("algorithm", "random-forest")
                .containsEntry("treeCount", 5)
                .containsEntry("best", true);
    }

    private void editModel(String runId, Consumer<ObjectNode> edit) throws IOException {
        Path file = baseDir.resolve("runs").resolve(runId)
                .resolve(PipelineArtifactRepository.modelFile(ModelAlgorithm.RANDOM_FOREST));
        ObjectNode json = (ObjectNode) objectMapper.readTree(file.toFile());
        edit.accept(json);
        objectMapper.writeValue(file.toFile(), json);
    }

    private PipelineRun run(String runId) {
        return run(runId, TestDataFactory.START);
    }

    private PipelineRun run(String runId, long createdAt) {
        Map<String, StageStatus> stages = new LinkedHashMap<>();
        for (StageName stage : StageName.values()) {
            StageStatus status = stage == StageName.CLUSTERING || stage == StageName.ANOMALY_DETECTION
                    || stage == StageName.EXPLANATION
                    ? StageStatus.builder().state(StageState.SKIPPED).reason("NotSelected").build()
                    : StageStatus.builder().state(StageState.SUCCEEDED).build();
            stages.put(stage.getId(), status);
        }
        EvaluationReport evaluation = EvaluationReport.builder()
                .target(FeatureMatrix.TARGET_FEATURE)
                .trainRows(matrix.rowCount())
                .models(List.of())
                .bestAlgorithm(ModelAlgorithm.RANDOM_FOREST)
                .bestModelId(model.getModelId())
                .failedAlgorithms(Map.of())
                .build();
        return PipelineRun.builder()
                .runId(runId)
                .createdAt(createdAt)
                .completedAt(createdAt + 1000)
                .status(RunStatus.SUCCEEDED)
                .config(TestDataFactory.config(4, 0.05))
                .stages(stages)
                .featureSummary(matrix.getSummary())
                .evaluation(evaluation)
                .model(model)
                .build();
    }
}
