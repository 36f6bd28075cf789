package com.grid.analytics.config;

import com.grid.analytics.model.ModelAlgorithm;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Configuration
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {

    private Features features = new Features();

    private Training training = new Training();

    private Clustering clustering = new Clustering();

    private Anomaly anomaly = new Anomaly();

    private Explain explain = new Explain();

    private Artifacts artifacts = new Artifacts();

    private Executor executor = new Executor();

    @Data
    public static class Features {
        // Rows whose |z| exceeds this on any raw numeric column are dropped at build time.
        private double outlierZScore = 3.5;
        // Minimum rows after cleaning = minRowsPerFold * cvFolds.
        private int minRowsPerFold = 5;
        private List<Integer> lagSteps = List.of(1, 24);
        private int rollingWindow = 24;
        // Temporal features are derived in this zone.
        private String zoneId = "UTC";
    }

    @Data
    public static class Training {
        // Relative gap (evalRmse - trainRmse) / evalRmse above which a model is overfit-flagged.
        private double overfitThreshold = 0.10;
        private int baselineWindow = 24;
        private RandomForest randomForest = new RandomForest();
        private GradientBoosting gradientBoosting = new GradientBoosting();

        public Map<String, Double> hyperparameters(ModelAlgorithm algorithm) {
            Map<String, Double> params = new LinkedHashMap<>();
            switch (algorithm) {
                case RANDOM_FOREST -> {
                    params.put("numTrees", (double) randomForest.getNumTrees());
                    params.put("maxDepth", (double) randomForest.getMaxDepth());
                    params.put("minSamplesLeaf", (double) randomForest.getMinSamplesLeaf());
                    params.put("featureSampleRatio", randomForest.getFeatureSampleRatio());
                }
                case GRADIENT_BOOSTED_TREES -> {
                    params.put("numTrees", (double) gradientBoosting.getNumTrees());
                    params.put("maxDepth", (double) gradientBoosting.getMaxDepth());
                    params.put("minSamplesLeaf", (double) gradientBoosting.getMinSamplesLeaf());
                    params.put("learningRate", gradientBoosting.getLearningRate());
                    params.put("subsampleRatio", gradientBoosting.getSubsampleRatio());
                }
            }
            return params;
        }
    }

    @Data
    public static class RandomForest {
        private int numTrees = 60;
        private int maxDepth = 10;
        private int minSamplesLeaf = 2;
        private double featureSampleRatio = 0.5;
    }

    @Data
    public static class GradientBoosting {
        private int numTrees = 150;
        private int maxDepth = 4;
        private int minSamplesLeaf = 3;
        private double learningRate = 0.1;
        private double subsampleRatio = 0.8;
    }

    @Data
    public static class Clustering {
        // Consumption features clustered on; names absent from a matrix are ignored.
        private List<String> features = List.of("load_mw", "price_rs_mwh", "temperature_c");
        private int restarts = 10;
        private int maxIterations = 300;
        private double tolerance = 1e-6;
        // Silhouette is computed on a seeded sample above this many rows (it is O(n^2)).
        private int silhouetteSampleSize = 3000;
    }

    @Data
    public static class Anomaly {
        private int numTrees = 100;
        private int sampleSize = 256;
        private int topFactors = 3;
    }

    @Data
    public static class Explain {
        // Most recent rows attributed per run.
        private int maxRows = 200;
    }

    @Data
    public static class Artifacts {
        private String baseDir = "./artifacts";
        // Published runs kept in memory.
        private int cacheSize = 8;
    }

    @Data
    public static class Executor {
        private int corePoolSize = 3;
        private int maxPoolSize = 6;
        private int queueCapacity = 50;
    }
}
