package com.dataops.loader.model;

/**
 * Kinds of per-row validation errors recorded in the error ledger.
 */
public enum ErrorKind {
    REQUIRED, // Field missing or blank
    FORMAT, // Pattern, email, date or allowed-values mismatch
    RANGE, // Numeric value outside configured bounds
    LENGTH, // Value longer than configured maximum
    DUPLICATE, // Unique key already present in the target table
    UNKNOWN // Unexpected failure while evaluating or loading the row
}
