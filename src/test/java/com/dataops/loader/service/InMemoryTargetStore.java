package com.dataops.loader.service;

import com.dataops.loader.model.Row;
import com.dataops.loader.model.TargetTable;
import com.dataops.loader.model.rule.ValidationRule;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Test double for a relational target store. Enforces the target's unique key,
 * refuses configured "poison" values, and fails whole batches atomically.
 * Inserts made inside {@link #inTransaction(Runnable)} stay staged until the
 * work returns and are dropped when it throws.
 */
class InMemoryTargetStore implements TargetStore {

    private final Map<String, List<Row>> committed = new HashMap<>();
    private final Map<String, Set<String>> uniqueKeys = new HashMap<>();
    private final Map<String, Long> ownerFile = new HashMap<>();
    private final Set<String> poisonValues = new HashSet<>();
    private final List<Staged> staged = new ArrayList<>();
    private boolean inTransaction;
    private int insertCalls;
    private int failAfterCalls = -1;

    @Override
    public void inTransaction(Runnable work) {
        inTransaction = true;
        try {
            work.run();
            for (Staged insert : staged) {
                commit(insert.target, insert.sourceFileId, insert.rows);
            }
        } finally {
            staged.clear();
            inTransaction = false;
        }
    }

    @Override
    public void insertBatch(TargetTable target, long sourceFileId, List<Row> rows) {
        insertCalls++;
        if (failAfterCalls >= 0 && insertCalls > failAfterCalls) {
            throw new DataAccessResourceFailureException("Connection to store lost");
        }

        String keyField = target.getUniqueKey().map(ValidationRule::getField).orElse(null);
        Set<String> keys = new HashSet<>(uniqueKeys.computeIfAbsent(target.getTable(), t -> new HashSet<>()));
        for (Staged insert : staged) {
            if (insert.target.getTable().equals(target.getTable()) && keyField != null) {
                for (Row row : insert.rows) {
                    row.getValue(keyField).ifPresent(keys::add);
                }
            }
        }
        Set<String> batchKeys = new HashSet<>();
        for (Row row : rows) {
            for (String value : row.asMap().values()) {
                if (value != null && poisonValues.contains(value)) {
                    throw new DataIntegrityViolationException("invalid input syntax: \"" + value + "\"");
                }
            }
            if (keyField != null) {
                String key = row.getValue(keyField).orElse(null);
                if (key != null && (keys.contains(key) || !batchKeys.add(key))) {
                    throw new DuplicateKeyException("duplicate key value violates unique constraint: " + key);
                }
            }
        }

        if (inTransaction) {
            staged.add(new Staged(target, sourceFileId, new ArrayList<>(rows)));
        } else {
            commit(target, sourceFileId, rows);
        }
    }

    private void commit(TargetTable target, long sourceFileId, List<Row> rows) {
        String keyField = target.getUniqueKey().map(ValidationRule::getField).orElse(null);
        Set<String> keys = uniqueKeys.computeIfAbsent(target.getTable(), t -> new HashSet<>());
        List<Row> table = committed.computeIfAbsent(target.getTable(), t -> new ArrayList<>());
        for (Row row : rows) {
            table.add(row);
            if (keyField != null) {
                String key = row.getValue(keyField).orElse(null);
                if (key != null) {
                    keys.add(key);
                }
            }
            ownerFile.put(target.getTable() + "#" + row.getRowNumber(), sourceFileId);
        }
    }

    void seedKey(String table, String key) {
        uniqueKeys.computeIfAbsent(table, t -> new HashSet<>()).add(key);
    }

    void poison(String value) {
        poisonValues.add(value);
    }

    /**
     * Every insert call after the given number of calls fails as if the connection dropped.
     */
    void failAfter(int calls) {
        this.failAfterCalls = calls;
    }

    List<Row> rows(String table) {
        return committed.getOrDefault(table, List.of());
    }

    List<Long> rowNumbers(String table) {
        List<Long> numbers = new ArrayList<>();
        for (Row row : rows(table)) {
            numbers.add(row.getRowNumber());
        }
        return numbers;
    }

    Long ownerOf(String table, long rowNumber) {
        return ownerFile.get(table + "#" + rowNumber);
    }

    int getInsertCalls() {
        return insertCalls;
    }

    private static final class Staged {

        private final TargetTable target;
        private final long sourceFileId;
        private final List<Row> rows;

        private Staged(TargetTable target, long sourceFileId, List<Row> rows) {
            this.target = target;
            this.sourceFileId = sourceFileId;
            this.rows = rows;
        }
    }
}
