package com.dataops.loader.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A failed check for one row. Immutable; the owning source file is attached
 * when the error is written to the ledger as a {@link DataError}.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class ValidationError {

    private final long rowNumber;
    private final ErrorKind kind;
    private final String fieldName; // null for row-scoped errors
    private final String fieldValue; // raw value for diagnosis, may be null
    private final String message;

    public ValidationError(long rowNumber, ErrorKind kind, String fieldName, String fieldValue, String message) {
        this.rowNumber = rowNumber;
        this.kind = kind;
        this.fieldName = fieldName;
        this.fieldValue = fieldValue;
        this.message = message;
    }
}
