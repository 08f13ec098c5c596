package com.dataops.loader.exception;

public class RunCancelledException extends PipelineException {

    public RunCancelledException(long sourceFileId) {
        super("Run cancelled for source file " + sourceFileId);
    }
}
