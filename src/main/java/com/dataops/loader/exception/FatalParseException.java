package com.dataops.loader.exception;

/**
 * Malformed file framing: unterminated CSV quote, invalid JSON, non-array root.
 * The whole file is rejected and no rows are emitted.
 */
public class FatalParseException extends PipelineException {

    private final long line; // 0 when unknown

    public FatalParseException(String message) {
        this(message, 0L, null);
    }

    public FatalParseException(String message, long line) {
        this(message, line, null);
    }

    public FatalParseException(String message, long line, Throwable cause) {
        super(line > 0 ? message + " (line " + line + ")" : message, cause);
        this.line = line;
    }

    public long getLine() {
        return line;
    }
}
