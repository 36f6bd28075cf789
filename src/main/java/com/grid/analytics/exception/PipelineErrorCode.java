package com.grid.analytics.exception;

/**
 * Error taxonomy of a pipeline run. Data-quality and persistence failures end the run in
 * {@code FAILED}; the others are contained at their stage boundary.
 */
public enum PipelineErrorCode {

    DATA_QUALITY("DataQualityError"),
    TRAINING("TrainingError"),
    CLUSTERING("ClusteringError"),
    ANOMALY_DETECTION("AnomalyDetectionError"),
    EXPLAINABILITY("ExplainabilityError"),
    PERSISTENCE("PersistenceError");

    private final String label;

    PipelineErrorCode(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
