package com.dataops.loader.exception;

/**
 * The source file does not exist or is not in a state a run can start from.
 */
public class RunNotStartableException extends PipelineException {

    public RunNotStartableException(String message) {
        super(message);
    }
}
