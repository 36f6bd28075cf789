package com.grid.analytics.exception;

public class DataQualityException extends PipelineException {

    public DataQualityException(String message) {
        super(PipelineErrorCode.DATA_QUALITY, message);
    }

    public DataQualityException(String message, Throwable cause) {
        super(PipelineErrorCode.DATA_QUALITY, message, cause);
    }
}
