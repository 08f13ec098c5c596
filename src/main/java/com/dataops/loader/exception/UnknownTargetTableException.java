package com.dataops.loader.exception;

public class UnknownTargetTableException extends PipelineException {

    public UnknownTargetTableException(String message) {
        super(message);
    }
}
