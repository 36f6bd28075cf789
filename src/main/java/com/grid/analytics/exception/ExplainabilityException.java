package com.grid.analytics.exception;

public class ExplainabilityException extends PipelineException {

    public ExplainabilityException(String message) {
        super(PipelineErrorCode.EXPLAINABILITY, message);
    }

    public ExplainabilityException(String message, Throwable cause) {
        super(PipelineErrorCode.EXPLAINABILITY, message, cause);
    }
}
