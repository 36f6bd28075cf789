package com.grid.analytics.exception;

public class TrainingException extends PipelineException {

    public TrainingException(String message) {
        super(PipelineErrorCode.TRAINING, message);
    }

    public TrainingException(String message, Throwable cause) {
        super(PipelineErrorCode.TRAINING, message, cause);
    }
}
