package com.dataops.loader.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * One uploaded artifact and the lifecycle of its processing runs.
 * Maps to the source_files table.
 */
@Entity
@Table(name = "source_files", indexes = {
        @Index(name = "idx_source_files_status", columnList = "status")
})
@Getter
@Setter
public class SourceFile {

    public enum Status {
        UPLOADED, PROCESSING, COMPLETED, FAILED
    }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "original_name", nullable = false, length = 255)
    private String originalName;

    @Column(name = "stored_name", nullable = false, length = 255)
    private String storedName; // Key under the storage directory

    @Enumerated(EnumType.STRING)
    @Column(name = "file_type", nullable = false, length = 10)
    private FileType fileType;

    @Column(name = "file_size_bytes", nullable = false)
    private Long fileSizeBytes;

    @Column(name = "file_checksum", length = 64)
    private String fileChecksum;

    @Column(name = "target_name", length = 100)
    private String targetName; // Configured target; detected from headers when null

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private Status status;

    // Set once a run completes
    @Column(name = "row_count")
    private Long rowCount;

    // Progress counters, refreshed at batch boundaries
    @Column(name = "rows_loaded", nullable = false)
    private Long rowsLoaded;

    @Column(name = "rows_rejected", nullable = false)
    private Long rowsRejected;

    @Column(name = "warning_count", nullable = false)
    private Integer warningCount;

    @Column(name = "run_id", columnDefinition = "UUID")
    private UUID runId;

    @Column(name = "attempt_count", nullable = false)
    private Integer attemptCount;

    @CreationTimestamp
    @Column(name = "uploaded_at", nullable = false, updatable = false)
    private LocalDateTime uploadedAt;

    @Column(name = "started_at")
    private LocalDateTime startedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @Column(name = "processing_duration_ms")
    private Long processingDurationMs;

    @Column(name = "error_message", length = 1000)
    private String errorMessage;

    @Column(name = "error_details", columnDefinition = "TEXT")
    private String errorDetails;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public SourceFile() {
        this.status = Status.UPLOADED;
        this.rowsLoaded = 0L;
        this.rowsRejected = 0L;
        this.warningCount = 0;
        this.attemptCount = 0;
    }

    public SourceFile(String originalName, String storedName, FileType fileType, long fileSizeBytes) {
        this();
        this.originalName = originalName;
        this.storedName = storedName;
        this.fileType = fileType;
        this.fileSizeBytes = fileSizeBytes;
    }

    public void markAsCompleted(long rowCount, long rowsLoaded, long rowsRejected) {
        requireProcessing(Status.COMPLETED);
        this.status = Status.COMPLETED;
        this.rowCount = rowCount;
        this.rowsLoaded = rowsLoaded;
        this.rowsRejected = rowsRejected;
        this.errorMessage = null;
        this.errorDetails = null;
        stopClock();
    }

    public void markAsFailed(String errorMessage, String errorDetails) {
        requireProcessing(Status.FAILED);
        this.status = Status.FAILED;
        this.errorMessage = truncate(errorMessage, 1000);
        this.errorDetails = errorDetails;
        stopClock();
    }

    /**
     * A run may start from a fresh upload or restart after a failure.
     */
    public boolean isStartable() {
        return Status.UPLOADED.equals(this.status) || Status.FAILED.equals(this.status);
    }

    public boolean isProcessing() {
        return Status.PROCESSING.equals(this.status);
    }

    public boolean isCompleted() {
        return Status.COMPLETED.equals(this.status);
    }

    public boolean isFailed() {
        return Status.FAILED.equals(this.status);
    }

    private void requireProcessing(Status target) {
        if (!isProcessing()) {
            throw new IllegalStateException(
                    "Source file " + id + " cannot move from " + status + " to " + target);
        }
    }

    private void stopClock() {
        this.completedAt = LocalDateTime.now();
        if (this.startedAt != null) {
            this.processingDurationMs = Duration.between(startedAt, completedAt).toMillis();
        }
    }

    private static String truncate(String str, int maxLength) {
        if (str == null) {
            return null;
        }
        return str.length() <= maxLength ? str : str.substring(0, maxLength - 3) + "...";
    }
}
