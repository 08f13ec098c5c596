package com.dataops.loader.model;

import java.util.Locale;

/**
 * Declared type of an uploaded source file.
 */
public enum FileType {
    CSV, JSON;

    /**
     * Resolve a declared type ("csv", "json", case-insensitive).
     *
     * @throws IllegalArgumentException for any other value
     */
    public static FileType fromValue(String value) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException("File type must not be empty");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "csv" -> CSV;
            case "json" -> JSON;
            default -> throw new IllegalArgumentException("Unsupported file type: " + value);
        };
    }
}
