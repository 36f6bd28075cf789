package com.grid.analytics.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Closed set of supported regression families. Each family declares the hyperparameters it
 * accepts; {@link #validate(Map)} rejects unknown, missing or out-of-range values.
 */
public enum ModelAlgorithm {

    RANDOM_FOREST("random-forest", List.of(
            new HyperparameterSpec("numTrees", 1, 1000, true),
            new HyperparameterSpec("maxDepth", 1, 32, true),
            new HyperparameterSpec("minSamplesLeaf", 1, 1000, true),
            new HyperparameterSpec("featureSampleRatio", 0.05, 1.0, false))),

    GRADIENT_BOOSTED_TREES("gradient-boosted-trees", List.of(
            new HyperparameterSpec("numTrees", 1, 5000, true),
            new HyperparameterSpec("maxDepth", 1, 16, true),
            new HyperparameterSpec("minSamplesLeaf", 1, 1000, true),
            new HyperparameterSpec("learningRate", 0.001, 1.0, false),
            new HyperparameterSpec("subsampleRatio", 0.1, 1.0, false)));

    private final String id;
    private final List<HyperparameterSpec> hyperparameters;

    ModelAlgorithm(String id, List<HyperparameterSpec> hyperparameters) {
        this.id = id;
        this.hyperparameters = hyperparameters;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    public List<HyperparameterSpec> getHyperparameters() {
        return hyperparameters;
    }

    /** Both families are tree ensembles, so both support structure-aware attribution. */
    public boolean isTreeBased() {
        return true;
    }

    @JsonCreator
    public static ModelAlgorithm fromId(String id) {
        for (ModelAlgorithm algorithm : values()) {
            if (algorithm.id.equalsIgnoreCase(id) || algorithm.name().equalsIgnoreCase(id)) {
                return algorithm;
            }
        }
        throw new IllegalArgumentException("Unknown model algorithm: " + id);
    }

    public void validate(Map<String, Double> values) {
        List<String> problems = new ArrayList<>();
        for (HyperparameterSpec spec : hyperparameters) {
            Double value = values.get(spec.name());
            if (value == null) {
                problems.add(spec.name() + " is missing");
            } else if (!spec.accepts(value)) {
                problems.add(String.format("%s=%s outside [%s, %s]%s", spec.name(), value,
                        spec.min(), spec.max(), spec.integral() ? " or not an integer" : ""));
            }
        }
        for (String name : values.keySet()) {
            if (hyperparameters.stream().noneMatch(spec -> spec.name().equals(name))) {
                problems.add(name + " is not a " + id + " hyperparameter");
            }
        }
        if (!problems.isEmpty()) {
            throw new IllegalArgumentException("Invalid " + id + " hyperparameters: " + String.join("; ", problems));
        }
    }

    public record HyperparameterSpec(String name, double min, double max, boolean integral) {

        boolean accepts(double value) {
            if (!Double.isFinite(value) || value < min || value > max) {
                return false;
            }
            return !integral || value == Math.rint(value);
        }
    }
}
