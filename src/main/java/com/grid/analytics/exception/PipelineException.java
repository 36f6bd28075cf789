package com.grid.analytics.exception;

public class PipelineException extends RuntimeException {

    private final PipelineErrorCode errorCode;

    public PipelineException(PipelineErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public PipelineException(PipelineErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public PipelineErrorCode getErrorCode() {
        return errorCode;
    }
}
