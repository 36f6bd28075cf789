package com.grid.analytics.exception;

public class AnomalyDetectionException extends PipelineException {

    public AnomalyDetectionException(String message) {
        super(PipelineErrorCode.ANOMALY_DETECTION, message);
    }

    public AnomalyDetectionException(String message, Throwable cause) {
        super(PipelineErrorCode.ANOMALY_DETECTION, message, cause);
    }
}
