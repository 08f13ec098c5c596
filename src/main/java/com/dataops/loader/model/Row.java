package com.dataops.loader.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One logical record of a source file.
 *
 * Field values are kept raw. A field that the record does not carry (a missing
 * trailing CSV column, an absent or null JSON property) is held as {@code null}
 * and reported as absent, which is distinct from an empty string.
 */
public class Row {

    private final long rowNumber;
    private final Map<String, String> values;

    public Row(long rowNumber, Map<String, String> values) {
        if (rowNumber < 1) {
            throw new IllegalArgumentException("Row numbers are 1-based, got " + rowNumber);
        }
        this.rowNumber = rowNumber;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public long getRowNumber() {
        return rowNumber;
    }

    /**
     * @return the raw value, or empty when the field is absent from this row
     */
    public Optional<String> getValue(String field) {
        return Optional.ofNullable(values.get(field));
    }

    public boolean isPresent(String field) {
        return values.get(field) != null;
    }

    /**
     * Field name to raw value, in source order. Absent fields map to {@code null}.
     */
    public Map<String, String> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return "Row{" + rowNumber + ", " + values + "}";
    }
}
