package com.grid.analytics.exception;

public class PersistenceException extends PipelineException {

    public PersistenceException(String message) {
        super(PipelineErrorCode.PERSISTENCE, message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(PipelineErrorCode.PERSISTENCE, message, cause);
    }
}
