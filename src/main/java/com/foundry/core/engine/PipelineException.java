package com.foundry.core.engine;

/**
 * Raised when a pipeline run ends in the FAILED state.
 */
public class PipelineException extends RuntimeException {

    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
