package com.dataops.loader.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

/**
 * Error ledger entry: a {@link ValidationError} attributed to its source file.
 * Entries are append-only and are only removed wholesale when a file is
 * reprocessed or its errors pass the retention period.
 */
@Entity
@Table(name = "data_errors", indexes = {
        @Index(name = "idx_errors_file", columnList = "source_file_id, row_number"),
        @Index(name = "idx_errors_type", columnList = "error_type")
})
@Getter
@Setter
public class DataError {

    static final int MAX_MESSAGE_LENGTH = 1000;
    static final int MAX_VALUE_LENGTH = 500;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "source_file_id", nullable = false)
    private Long sourceFileId;

    @Column(name = "row_number", nullable = false)
    private Long rowNumber;

    @Enumerated(EnumType.STRING)
    @Column(name = "error_type", nullable = false, length = 50)
    private ErrorKind errorType;

    @Column(name = "error_message", nullable = false, length = MAX_MESSAGE_LENGTH)
    private String errorMessage;

    @Column(name = "field_name", length = 100)
    private String fieldName;

    @Column(name = "field_value", length = MAX_VALUE_LENGTH)
    private String fieldValue;

    @Column(name = "raw_data", columnDefinition = "TEXT")
    private String rawData; // Row as JSON

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public static DataError of(long sourceFileId, ValidationError error, String rawData) {
        DataError entry = new DataError();
        entry.setSourceFileId(sourceFileId);
        entry.setRowNumber(error.getRowNumber());
        entry.setErrorType(error.getKind());
        entry.setErrorMessage(truncate(sanitize(error.getMessage()), MAX_MESSAGE_LENGTH));
        entry.setFieldName(error.getFieldName());
        entry.setFieldValue(truncate(sanitize(error.getFieldValue()), MAX_VALUE_LENGTH));
        entry.setRawData(sanitize(rawData));
        return entry;
    }

    /**
     * PostgreSQL text columns reject NUL bytes.
     */
    private static String sanitize(String input) {
        if (input == null) {
            return null;
        }
        return input.replace("\u0000", "*");
    }

    private static String truncate(String str, int maxLength) {
        if (str == null) {
            return null;
        }
        return str.length() <= maxLength ? str : str.substring(0, maxLength - 3) + "...";
    }
}
