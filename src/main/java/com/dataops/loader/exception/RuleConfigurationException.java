package com.dataops.loader.exception;

/**
 * Malformed target or rule configuration, raised while the application starts.
 */
public class RuleConfigurationException extends PipelineException {

    public RuleConfigurationException(String message) {
        super(message);
    }

    public RuleConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
