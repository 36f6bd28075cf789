package com.grid.analytics.exception;

public class ClusteringException extends PipelineException {

    public ClusteringException(String message) {
        super(PipelineErrorCode.CLUSTERING, message);
    }

    public ClusteringException(String message, Throwable cause) {
        super(PipelineErrorCode.CLUSTERING, message, cause);
    }
}
