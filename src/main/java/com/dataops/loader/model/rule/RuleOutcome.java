package com.dataops.loader.model.rule;

import com.dataops.loader.model.ErrorKind;
import com.dataops.loader.model.ValidationError;

/**
 * Result of evaluating one rule against one row: pass, or a failure that
 * lacks row number and source file until the caller attributes it.
 */
public final class RuleOutcome {

    private static final RuleOutcome PASS = new RuleOutcome(null, null, null, null);

    private final ErrorKind kind;
    private final String fieldName;
    private final String fieldValue;
    private final String message;

    private RuleOutcome(ErrorKind kind, String fieldName, String fieldValue, String message) {
        this.kind = kind;
        this.fieldName = fieldName;
        this.fieldValue = fieldValue;
        this.message = message;
    }

    public static RuleOutcome pass() {
        return PASS;
    }

    public static RuleOutcome fail(ErrorKind kind, String fieldName, String fieldValue, String message) {
        if (kind == null) {
            throw new IllegalArgumentException("A failed outcome needs an error kind");
        }
        return new RuleOutcome(kind, fieldName, fieldValue, message);
    }

    public boolean isPass() {
        return kind == null;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getFieldName() {
        return fieldName;
    }

    public String getFieldValue() {
        return fieldValue;
    }

    public String getMessage() {
        return message;
    }

    public ValidationError toError(long rowNumber) {
        if (isPass()) {
            throw new IllegalStateException("A passing outcome has no error");
        }
        return new ValidationError(rowNumber, kind, fieldName, fieldValue, message);
    }

    @Override
    public String toString() {
        return isPass() ? "PASS" : kind + "(" + fieldName + "): " + message;
    }
}
