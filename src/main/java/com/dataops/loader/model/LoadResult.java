package com.dataops.loader.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Summary of one processing run, written once when the run ends.
 * A file keeps only the result of its latest run.
 */
@Entity
@Table(name = "load_results", uniqueConstraints = {
        @UniqueConstraint(name = "uq_load_results_file", columnNames = "source_file_id")
})
@Getter
@Setter
public class LoadResult {

    public enum Status {
        COMPLETED, FAILED
    }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "source_file_id", nullable = false)
    private Long sourceFileId;

    @Column(name = "run_id", nullable = false, columnDefinition = "UUID")
    private UUID runId;

    @Column(name = "target_table", length = 128)
    private String targetTable;

    @Column(name = "rows_attempted", nullable = false)
    private Long rowsAttempted;

    @Column(name = "rows_loaded", nullable = false)
    private Long rowsLoaded;

    @Column(name = "rows_rejected", nullable = false)
    private Long rowsRejected;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private Status status;

    @Column(name = "failure_reason", length = 1000)
    private String failureReason;

    @Column(name = "completed_at", nullable = false)
    private LocalDateTime completedAt;

    /**
     * Build a terminal result. Rows attempted must equal rows loaded plus rows rejected.
     */
    public static LoadResult of(long sourceFileId, UUID runId, String targetTable,
                                long rowsLoaded, long rowsRejected,
                                Status status, String failureReason) {
        LoadResult result = new LoadResult();
        result.setSourceFileId(sourceFileId);
        result.setRunId(runId);
        result.setTargetTable(targetTable);
        result.setRowsAttempted(rowsLoaded + rowsRejected);
        result.setRowsLoaded(rowsLoaded);
        result.setRowsRejected(rowsRejected);
        result.setStatus(status);
        result.setFailureReason(failureReason);
        result.setCompletedAt(LocalDateTime.now());
        return result;
    }

    public boolean isBalanced() {
        return rowsAttempted != null && rowsLoaded != null && rowsRejected != null
                && rowsAttempted == rowsLoaded + rowsRejected;
    }
}
