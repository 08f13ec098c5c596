package com.dataops.loader.exception;

/**
 * The target store failed in a way no row-level recovery can handle.
 * Batches committed before the failure stay committed.
 */
public class FatalStoreException extends PipelineException {

    public FatalStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
