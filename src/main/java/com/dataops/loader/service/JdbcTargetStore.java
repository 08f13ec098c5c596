package com.dataops.loader.service;

import com.dataops.loader.model.Row;
import com.dataops.loader.model.TargetTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link TargetStore} backed by JDBC batch inserts.
 *
 * Each insert runs as a nested transaction: a savepoint inside an open batch
 * transaction, or a transaction of its own when none is open.
 *
 * Values are bound as untyped strings (the data source sets
 * {@code stringtype=unspecified}), so PostgreSQL casts them to the column types.
 * A value that cannot be cast fails the batch with a data integrity violation.
 */
@Component
public class JdbcTargetStore implements TargetStore {

    private static final Logger logger = LoggerFactory.getLogger(JdbcTargetStore.class);

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final TransactionTemplate savepointTemplate;
    private final Map<String, String> insertSqlCache = new ConcurrentHashMap<>();

    public JdbcTargetStore(JdbcTemplate jdbcTemplate,
                           @Qualifier("targetTransactionTemplate") TransactionTemplate transactionTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.savepointTemplate = new TransactionTemplate(transactionTemplate.getTransactionManager());
        this.savepointTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_NESTED);
    }

    @Override
    public void inTransaction(Runnable work) {
        transactionTemplate.executeWithoutResult(status -> work.run());
    }

    @Override
    public void insertBatch(TargetTable target, long sourceFileId, List<Row> rows) {
        if (rows.isEmpty()) {
            return;
        }
        String sql = insertSqlCache.computeIfAbsent(target.getName(), name -> buildInsertSql(target));
        List<String> fields = List.copyOf(target.getColumns().keySet());

        long startTime = System.currentTimeMillis();
        savepointTemplate.executeWithoutResult(status ->
                jdbcTemplate.batchUpdate(sql, rows, rows.size(),
                        (ps, row) -> bindRow(ps, fields, sourceFileId, row)));

        logger.debug("Inserted {} rows into {} in {} ms",
                rows.size(), target.getTable(), System.currentTimeMillis() - startTime);
    }

    static String buildInsertSql(TargetTable target) {
        StringJoiner columns = new StringJoiner(", ");
        StringJoiner placeholders = new StringJoiner(", ");
        for (String column : target.getColumns().values()) {
            columns.add(column);
            placeholders.add("?");
        }
        columns.add(TargetTable.SOURCE_FILE_ID_COLUMN);
        placeholders.add("?");
        return "INSERT INTO " + target.getTable() + " (" + columns + ") VALUES (" + placeholders + ")";
    }

    private static void bindRow(PreparedStatement ps, List<String> fields, long sourceFileId, Row row)
            throws SQLException {
        int index = 1;
        for (String field : fields) {
            String value = row.getValue(field).orElse(null);
            if (value == null) {
                ps.setNull(index++, Types.OTHER);
            } else {
                ps.setString(index++, value);
            }
        }
        ps.setLong(index, sourceFileId);
    }
}
