package com.dataops.loader.exception;

/**
 * Base class for errors that stop a pipeline run or prevent one from starting.
 * Per-row validation failures are data, not exceptions, and never extend this.
 */
public class PipelineException extends RuntimeException {

    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
