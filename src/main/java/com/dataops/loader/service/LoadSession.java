package com.dataops.loader.service;

import com.dataops.loader.exception.FatalStoreException;
import com.dataops.loader.model.ErrorKind;
import com.dataops.loader.model.Row;
import com.dataops.loader.model.TargetTable;
import com.dataops.loader.model.ValidationError;
import com.dataops.loader.model.rule.ValidationRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.transaction.TransactionException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Batches validated rows of one run into a single target table.
 *
 * A flush runs in one store transaction. When the store refuses a batch with
 * a constraint violation, the batch is split into halves and each half
 * retried, down to single rows, so that only the offending rows are rejected.
 * Every attempt is undone on its own when refused, so the rows that get in stay
 * pending until the whole batch commits. Splits per batch are capped; past the
 * cap the remainder is inserted in small chunks, each chunk falling back to one
 * row at a time. Any other store failure rolls the batch back and is fatal to
 * the run.
 */
public class LoadSession {

    private static final Logger logger = LoggerFactory.getLogger(LoadSession.class);

    private static final int MAX_CAUSE_LENGTH = 300;

    private final TargetStore store;
    private final TargetTable target;
    private final long sourceFileId;
    private final RunProgress progress;
    private final int rowByRowThreshold;
    private final int maxIsolationRetries;
    private final Optional<ValidationRule.Duplicate> uniqueKey;

    private final List<Row> buffer = new ArrayList<>();
    private long rowsLoaded;
    private long rowsRejected;
    private int batchNumber;

    // State of the batch being flushed, applied only once it commits
    private final List<ValidationError> inFlightRejections = new ArrayList<>();
    private int inFlightLoaded;
    private int splits;

    LoadSession(TargetStore store, TargetTable target, long sourceFileId, RunProgress progress,
                int rowByRowThreshold, int maxIsolationRetries) {
        this.store = store;
        this.target = target;
        this.sourceFileId = sourceFileId;
        this.progress = progress;
        this.rowByRowThreshold = rowByRowThreshold;
        this.maxIsolationRetries = maxIsolationRetries;
        this.uniqueKey = target.getUniqueKey();
    }

    public void offer(Row row) {
        buffer.add(row);
    }

    public boolean isFull() {
        return buffer.size() >= target.getBatchSize();
    }

    public int getPendingCount() {
        return buffer.size();
    }

    public long getRowsLoaded() {
        return rowsLoaded;
    }

    public long getRowsRejected() {
        return rowsRejected;
    }

    /**
     * Insert the buffered rows in one transaction. Rows rejected by the store
     * are returned as errors ordered by row number and are no longer buffered.
     *
     * @throws FatalStoreException if the store fails for a reason other than a
     *         constraint violation; the batch is rolled back and none of its
     *         rows count as loaded or rejected
     */
    public BatchOutcome flush() {
        if (buffer.isEmpty()) {
            return BatchOutcome.empty();
        }
        List<Row> batch = new ArrayList<>(buffer);
        buffer.clear();
        batchNumber++;
        inFlightRejections.clear();
        inFlightLoaded = 0;
        splits = 0;

        long startTime = System.currentTimeMillis();
        try {
            store.inTransaction(() -> insertSegment(batch));
        } catch (DataAccessException | TransactionException e) {
            discardInFlight();
            throw new FatalStoreException("Store failure while loading into " + target.getTable() + ": "
                    + e.getMessage(), e);
        } catch (RuntimeException e) {
            discardInFlight();
            throw e;
        }

        int loaded = inFlightLoaded;
        List<ValidationError> rejections = new ArrayList<>(inFlightRejections);
        rejections.sort(Comparator.comparingLong(ValidationError::getRowNumber));
        inFlightRejections.clear();
        inFlightLoaded = 0;

        rowsLoaded += loaded;
        rowsRejected += rejections.size();
        progress.recordLoaded(loaded);
        progress.recordRejected(rejections.size());
        progress.recordBatchCommitted();
        if (rejections.isEmpty()) {
            logger.info("Batch {} into {}: {} rows loaded in {} ms",
                    batchNumber, target.getTable(), loaded, System.currentTimeMillis() - startTime);
        } else {
            logger.warn("Batch {} into {}: {} rows loaded, {} rejected by the store after {} splits",
                    batchNumber, target.getTable(), loaded, rejections.size(), splits);
        }
        return new BatchOutcome(loaded, rejections);
    }

    private void discardInFlight() {
        logger.warn("Batch {} into {} rolled back: {} inserted and {} refused rows discarded",
                batchNumber, target.getTable(), inFlightLoaded, inFlightRejections.size());
        inFlightRejections.clear();
        inFlightLoaded = 0;
    }

    private void insertSegment(List<Row> segment) {
        try {
            insert(segment);
            return;
        } catch (DataIntegrityViolationException e) {
            if (segment.size() == 1) {
                reject(segment.get(0), e);
                return;
            }
            logger.debug("Segment of {} rows starting at row {} refused: {}",
                    segment.size(), segment.get(0).getRowNumber(), e.getMostSpecificCause().getMessage());
        }

        if (segment.size() <= rowByRowThreshold) {
            insertRowByRow(segment);
        } else if (splits < maxIsolationRetries) {
            splits++;
            int middle = segment.size() / 2;
            insertSegment(segment.subList(0, middle));
            insertSegment(segment.subList(middle, segment.size()));
        } else {
            logger.debug("Isolation split cap {} reached, inserting {} rows in chunks of {}",
                    maxIsolationRetries, segment.size(), rowByRowThreshold);
            for (int from = 0; from < segment.size(); from += rowByRowThreshold) {
                List<Row> chunk = segment.subList(from, Math.min(from + rowByRowThreshold, segment.size()));
                try {
                    insert(chunk);
                } catch (DataIntegrityViolationException e) {
                    insertRowByRow(chunk);
                }
            }
        }
    }

    private void insertRowByRow(List<Row> rows) {
        for (Row row : rows) {
            try {
                insert(Collections.singletonList(row));
            } catch (DataIntegrityViolationException e) {
                reject(row, e);
            }
        }
    }

    /**
     * One store call within the batch transaction. A refused call leaves nothing
     * behind; constraint violations propagate to the caller for isolation.
     */
    private void insert(List<Row> rows) {
        try {
            store.insertBatch(target, sourceFileId, rows);
        } catch (DataIntegrityViolationException e) {
            throw e;
        } catch (DataAccessException | TransactionException e) {
            throw new FatalStoreException("Store failure while loading into " + target.getTable() + ": "
                    + e.getMessage(), e);
        }
        inFlightLoaded += rows.size();
    }

    private void reject(Row row, DataIntegrityViolationException e) {
        ValidationError error = e instanceof DuplicateKeyException ? duplicateError(row) : unknownError(row, e);
        if (e instanceof DuplicateKeyException) {
            logger.warn("Row {} rejected as duplicate: {}", row.getRowNumber(), error.getMessage());
        } else {
            logger.warn("Row {} rejected by the store: {}", row.getRowNumber(), error.getMessage());
        }
        inFlightRejections.add(error);
    }

    private ValidationError duplicateError(Row row) {
        if (uniqueKey.isPresent()) {
            ValidationRule.Duplicate key = uniqueKey.get();
            String value = row.getValue(key.getField()).orElse(null);
            return new ValidationError(row.getRowNumber(), ErrorKind.DUPLICATE, key.getField(), value,
                    key.violationMessage(value));
        }
        return new ValidationError(row.getRowNumber(), ErrorKind.DUPLICATE, null, null,
                "Duplicate key in " + target.getTable());
    }

    private ValidationError unknownError(Row row, DataIntegrityViolationException e) {
        String cause = String.valueOf(e.getMostSpecificCause().getMessage());
        if (cause.length() > MAX_CAUSE_LENGTH) {
            cause = cause.substring(0, MAX_CAUSE_LENGTH) + "...";
        }
        return new ValidationError(row.getRowNumber(), ErrorKind.UNKNOWN, null, null,
                "Row refused by " + target.getTable() + ": " + cause);
    }
}
