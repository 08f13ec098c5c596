package com.dataops.loader.service;

import com.dataops.loader.model.Row;
import com.dataops.loader.model.TargetTable;

import java.util.List;

/**
 * Bulk insert into a target table.
 *
 * An insert call either keeps every row or none of them. Inside
 * {@link #inTransaction(Runnable)} a refused call is undone on its own while the
 * rows of earlier calls stay pending until the transaction commits. Failures
 * surface as Spring {@link org.springframework.dao.DataAccessException}s: a
 * {@link org.springframework.dao.DataIntegrityViolationException} means some row
 * was refused by a constraint, anything else means the store itself failed.
 */
public interface TargetStore {

    /**
     * Run the work in one store transaction. It commits when the work returns
     * and rolls back when the work throws.
     */
    void inTransaction(Runnable work);

    void insertBatch(TargetTable target, long sourceFileId, List<Row> rows);
}
