package com.dataops.loader.service;

import java.time.LocalDateTime;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Live state of one run: counters readable from any thread while the run
 * progresses, and the cancellation flag polled at batch boundaries.
 */
public class RunProgress {

    public enum Stage {
        QUEUED, PARSING, LOADING, FINISHING, DONE
    }

    private final long sourceFileId;
    private final UUID runId;
    private final LocalDateTime createdAt = LocalDateTime.now();

    private volatile Stage stage = Stage.QUEUED;
    private volatile long totalRows = -1; // unknown until parsed
    private final AtomicLong rowsRead = new AtomicLong();
    private final AtomicLong rowsLoaded = new AtomicLong();
    private final AtomicLong rowsRejected = new AtomicLong();
    private final AtomicInteger warnings = new AtomicInteger();
    private final AtomicInteger batchesCommitted = new AtomicInteger();
    private final AtomicBoolean cancelRequested = new AtomicBoolean();

    public RunProgress(long sourceFileId, UUID runId) {
        this.sourceFileId = sourceFileId;
        this.runId = runId;
    }

    public long getSourceFileId() {
        return sourceFileId;
    }

    public UUID getRunId() {
        return runId;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public Stage getStage() {
        return stage;
    }

    public void setStage(Stage stage) {
        this.stage = stage;
    }

    public long getTotalRows() {
        return totalRows;
    }

    public void setTotalRows(long totalRows) {
        this.totalRows = totalRows;
    }

    public void setWarnings(int warnings) {
        this.warnings.set(warnings);
    }

    public int getWarnings() {
        return warnings.get();
    }

    public void recordRead() {
        rowsRead.incrementAndGet();
    }

    public void recordLoaded(long count) {
        rowsLoaded.addAndGet(count);
    }

    public void recordRejected(long count) {
        rowsRejected.addAndGet(count);
    }

    public void recordBatchCommitted() {
        batchesCommitted.incrementAndGet();
    }

    public long getRowsRead() {
        return rowsRead.get();
    }

    public long getRowsLoaded() {
        return rowsLoaded.get();
    }

    public long getRowsRejected() {
        return rowsRejected.get();
    }

    public int getBatchesCommitted() {
        return batchesCommitted.get();
    }

    public void requestCancel() {
        cancelRequested.set(true);
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }

    @Override
    public String toString() {
        return "RunProgress{file=" + sourceFileId + ", run=" + runId + ", stage=" + stage
                + ", read=" + getRowsRead() + ", loaded=" + getRowsLoaded() + ", rejected=" + getRowsRejected() + "}";
    }
}
