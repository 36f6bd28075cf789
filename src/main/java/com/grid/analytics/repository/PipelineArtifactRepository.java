package com.grid.analytics.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.grid.analytics.config.PipelineProperties;
import com.grid.analytics.exception.PersistenceException;
import com.grid.analytics.feature.FeatureBuilder;
import com.grid.analytics.model.ModelAlgorithm;
import com.grid.analytics.model.PipelineRun;
import com.grid.analytics.model.TrainedModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * File-based store of published run bundles:
 * <pre>
 * &lt;baseDir&gt;/LATEST                       id of the most recently published run
 * &lt;baseDir&gt;/runs/&lt;runId&gt;/manifest.json
 *                          run.json, evaluation.json, clusters.json,
 *                          anomalies.json, explanation.json,
 *                          models/&lt;algorithm&gt;.json
 * </pre>
 * A bundle is assembled in a temporary directory and renamed into place in one atomic move,
 * so readers see either a complete bundle or none. Published bundles are never rewritten.
 */
@Repository
public class PipelineArtifactRepository {

    private static final Logger log = LoggerFactory.getLogger(PipelineArtifactRepository.class);

    public static final int ARTIFACT_SCHEMA_VERSION = 1;

    static final String RUNS_DIR = "runs";
    static final String LATEST_FILE = "LATEST";
    static final String MANIFEST_FILE = "manifest.json";
    static final String RUN_FILE = "run.json";
    static final String EVALUATION_FILE = "evaluation.json";
    static final String CLUSTERS_FILE = "clusters.json";
    static final String ANOMALIES_FILE = "anomalies.json";
    static final String EXPLANATION_FILE = "explanation.json";
    static final String MODELS_DIR = "models";

    private static final Pattern RUN_ID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9_-]*");

    private final Path baseDir;
    private final ObjectMapper objectMapper;

    // Least recently used runs are evicted first; evicted runs reload from disk.
    private final Map<String, PipelineRun> runCache;
    private final Object latestLock = new Object();

    public PipelineArtifactRepository(PipelineProperties properties) {
        this.baseDir = Path.of(properties.getArtifacts().getBaseDir()).toAbsolutePath();
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
        int cacheSize = properties.getArtifacts().getCacheSize();
        if (cacheSize < 1) {
            throw new IllegalArgumentException("pipeline.artifacts.cache-size must be at least 1, got " + cacheSize);
        }
        this.runCache = Collections.synchronizedMap(new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, PipelineRun> eldest) {
                return size() > cacheSize;
            }
        });
    }

    /**
     * Write the run's bundle and point {@code LATEST} at it, unless {@code LATEST} already names a
     * run created later. If {@code LATEST} cannot be written the bundle is withdrawn again.
     *
     * @throws PersistenceException if the bundle cannot be written or a run with the same id exists
     */
    public void publish(PipelineRun run) {
        String runId = requireValidId(run.getRunId());
        Path runsDir = baseDir.resolve(RUNS_DIR);
        Path target = runsDir.resolve(runId);
        Path staging = null;
        try {
            Files.createDirectories(runsDir);
            if (Files.exists(target)) {
                throw new PersistenceException("Run " + runId + " is already published");
            }
            staging = Files.createTempDirectory(runsDir, ".staging-" + runId + "-");

            List<String> files = new ArrayList<>();
            write(staging, RUN_FILE, run, files);
            writeIfPresent(staging, EVALUATION_FILE, run.getEvaluation(), files);
            writeIfPresent(staging, CLUSTERS_FILE, run.getClusters(), files);
            writeIfPresent(staging, ANOMALIES_FILE, run.getAnomalies(), files);
            writeIfPresent(staging, EXPLANATION_FILE, run.getExplanation(), files);
            for (TrainedModel model : run.getModels()) {
                write(staging, modelFile(model.getAlgorithm()),
                        ModelArtifact.of(model, ARTIFACT_SCHEMA_VERSION), files);
            }
            write(staging, MANIFEST_FILE, ArtifactManifest.builder()
                    .artifactSchemaVersion(ARTIFACT_SCHEMA_VERSION)
                    .featureSchemaVersion(FeatureBuilder.SCHEMA_VERSION)
                    .runId(runId)
                    .createdAt(run.getCreatedAt())
                    .files(List.copyOf(files))
                    .build(), new ArrayList<>());

            Files.move(staging, target, StandardCopyOption.ATOMIC_MOVE);
            try {
                updateLatest(runId, run.getCreatedAt());
            } catch (IOException e) {
                withdraw(target, staging);
                throw e;
            }
            staging = null;
            runCache.put(runId, run);
            log.info("Published run {} to {} ({} files)", runId, target, files.size() + 1);
        } catch (FileAlreadyExistsException e) {
            throw new PersistenceException("Run " + runId + " is already published", e);
        } catch (IOException e) {
            throw new PersistenceException("Failed to publish run " + runId + ": " + e.getMessage(), e);
        } finally {
            if (staging != null) {
                deleteQuietly(staging);
            }
        }
    }

    public Optional<String> latestRunId() {
        Path latest = baseDir.resolve(LATEST_FILE);
        try {
            return readLatest(latest);
        } catch (IOException e) {
            throw new PersistenceException("Failed to read " + latest, e);
        }
    }

    public Optional<PipelineRun> loadLatest() {
        return latestRunId().flatMap(this::loadRun);
    }

    /**
     * Load a published run, its models attached.
     *
     * @throws PersistenceException if the bundle is unreadable or was written by an incompatible version
     */
    public Optional<PipelineRun> loadRun(String runId) {
        if (runId == null || !RUN_ID.matcher(runId).matches()) {
            return Optional.empty();
        }
        PipelineRun cached = runCache.get(runId);
        if (cached != null) {
            return Optional.of(cached);
        }
        Path runDir = baseDir.resolve(RUNS_DIR).resolve(runId);
        if (!Files.isDirectory(runDir)) {
            return Optional.empty();
        }
        ArtifactManifest manifest = readManifest(runDir);
        PipelineRun stored = read(runDir.resolve(RUN_FILE), PipelineRun.class);
        PipelineRun.PipelineRunBuilder builder = stored.toBuilder().clearModels();
        for (String file : manifest.getFiles()) {
            if (file.startsWith(MODELS_DIR + "/")) {
                builder.model(toModel(read(runDir.resolve(file), ModelArtifact.class), runDir.resolve(file)));
            }
        }
        PipelineRun run = builder.build();
        runCache.put(runId, run);
        return Optional.of(run);
    }

    /**
     * Load one model of a published run.
     *
     * @throws PersistenceException if the artifact or its feature schema has an incompatible version
     */
    public Optional<TrainedModel> loadModel(String runId, ModelAlgorithm algorithm) {
        if (runId == null || !RUN_ID.matcher(runId).matches()) {
            return Optional.empty();
        }
        Path file = baseDir.resolve(RUNS_DIR).resolve(runId).resolve(modelFile(algorithm));
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        return Optional.of(toModel(read(file, ModelArtifact.class), file));
    }

    /** Summary of every model of a run, without the trees. */
    public List<Map<String, Object>> getModelMetadata(String runId) {
        return loadRun(runId).map(run -> run.getModels().stream()
                .map(model -> {
                    Map<String, Object> meta = new LinkedHashMap<>();
                    meta.put("runId", runId);
                    meta.put("modelId", model.getModelId());
                    meta.put("algorithm", model.getAlgorithm().getId());
                    meta.put("hyperparameters", model.getHyperparameters());
                    meta.put("treeCount", model.getEnsemble().getTrees().size());
                    meta.put("featureCount", model.getInputFeatures().size());
                    meta.put("trainingRows", model.getTrainingRows());
                    meta.put("trainedAt", model.getTrainedAt());
                    meta.put("best", model.getModelId().equals(run.getEvaluation().getBestModelId()));
                    return meta;
                })
                .toList())
                .orElse(List.of());
    }

    public void clearCache() {
        runCache.clear();
    }

    int cachedRunCount() {
        return runCache.size();
    }

    Path getBaseDir() {
        return baseDir;
    }

    static String modelFile(ModelAlgorithm algorithm) {
        return MODELS_DIR + "/" + algorithm.getId() + ".json";
    }

    private TrainedModel toModel(ModelArtifact artifact, Path file) {
        if (artifact.getArtifactSchemaVersion() != ARTIFACT_SCHEMA_VERSION) {
            throw new PersistenceException("Model artifact " + file + " has schema version "
                    + artifact.getArtifactSchemaVersion() + ", expected " + ARTIFACT_SCHEMA_VERSION);
        }
        if (artifact.getFeatureSchema() == null
                || artifact.getFeatureSchema().getSchemaVersion() != FeatureBuilder.SCHEMA_VERSION) {
            throw new PersistenceException("Model artifact " + file + " uses an incompatible feature schema version");
        }
        return artifact.toModel();
    }

    private ArtifactManifest readManifest(Path runDir) {
        ArtifactManifest manifest = read(runDir.resolve(MANIFEST_FILE), ArtifactManifest.class);
        if (manifest.getArtifactSchemaVersion() != ARTIFACT_SCHEMA_VERSION) {
            throw new PersistenceException("Run " + runDir.getFileName() + " has artifact schema version "
                    + manifest.getArtifactSchemaVersion() + ", expected " + ARTIFACT_SCHEMA_VERSION);
        }
        if (manifest.getFeatureSchemaVersion() != FeatureBuilder.SCHEMA_VERSION) {
            throw new PersistenceException("Run " + runDir.getFileName() + " has feature schema version "
                    + manifest.getFeatureSchemaVersion() + ", expected " + FeatureBuilder.SCHEMA_VERSION);
        }
        return manifest;
    }

    // LATEST never moves back to a run created earlier than the one it names; ties go to the later publish.
    private void updateLatest(String runId, long createdAt) throws IOException {
        Path latest = baseDir.resolve(LATEST_FILE);
        synchronized (latestLock) {
            Optional<String> current = readLatest(latest);
            if (current.isPresent() && createdAtOf(current.get()) > createdAt) {
                log.info("LATEST stays at {}, which was created after {}", current.get(), runId);
                return;
            }
            Path temp = Files.createTempFile(baseDir, ".latest-", ".tmp");
            try {
                Files.writeString(temp, runId, StandardCharsets.UTF_8);
                try {
                    Files.move(temp, latest, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
                } catch (AtomicMoveNotSupportedException e) {
                    log.warn("Atomic replace of {} not supported, falling back to a plain replace", latest);
                    Files.move(temp, latest, StandardCopyOption.REPLACE_EXISTING);
                }
            } finally {
                Files.deleteIfExists(temp);
            }
        }
    }

    private long createdAtOf(String runId) {
        Path manifest = baseDir.resolve(RUNS_DIR).resolve(runId).resolve(MANIFEST_FILE);
        try {
            return objectMapper.readValue(manifest.toFile(), ArtifactManifest.class).getCreatedAt();
        } catch (IOException e) {
            log.warn("LATEST names run {} whose manifest is unreadable, replacing it", runId, e);
            return Long.MIN_VALUE;
        }
    }

    private static Optional<String> readLatest(Path latest) throws IOException {
        try {
            String runId = Files.readString(latest, StandardCharsets.UTF_8).trim();
            return runId.isEmpty() ? Optional.empty() : Optional.of(runId);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        }
    }

    // Moves a published bundle back to its staging name so the caller's cleanup removes it.
    private static void withdraw(Path target, Path staging) {
        try {
            Files.move(target, staging, StandardCopyOption.ATOMIC_MOVE);
            log.warn("Withdrew bundle {} after LATEST could not be updated", target.getFileName());
        } catch (IOException e) {
            log.warn("Could not move {} back to staging, deleting it in place", target, e);
            deleteQuietly(target);
        }
    }

    private void write(Path dir, String relative, Object value, List<String> files) throws IOException {
        Path file = dir.resolve(relative);
        Files.createDirectories(file.getParent());
        objectMapper.writeValue(file.toFile(), value);
        files.add(relative);
    }

    private void writeIfPresent(Path dir, String relative, Object value, List<String> files) throws IOException {
        if (value != null) {
            write(dir, relative, value, files);
        }
    }

    private <T> T read(Path file, Class<T> type) {
        try {
            return objectMapper.readValue(file.toFile(), type);
        } catch (IOException e) {
            throw new PersistenceException("Failed to read " + file + ": " + e.getMessage(), e);
        }
    }

    private static String requireValidId(String runId) {
        if (runId == null || !RUN_ID.matcher(runId).matches()) {
            throw new PersistenceException("Invalid run id: " + runId);
        }
        return runId;
    }

    private static void deleteQuietly(Path dir) {
        try (Stream<Path> paths = Files.walk(dir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    log.warn("Could not remove staging file {}", path, e);
                }
            });
        } catch (IOException e) {
            log.warn("Could not clean up staging directory {}", dir, e);
        }
    }
}
