package com.dataops.loader.config;

import com.dataops.loader.model.TargetTable;
import com.dataops.loader.service.TargetTableRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Startup check of the store. Verifies the connection and that every
 * configured target table exposes its mapped columns plus source_file_id.
 * Ledger tables are created by schema.sql through Spring SQL init.
 */
@Component
public class DatabaseInitializer {

    private static final Logger logger = LoggerFactory.getLogger(DatabaseInitializer.class);

    // ANSI Color codes for console output
    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_RED = "\u001B[31m";
    private static final String ANSI_GREEN = "\u001B[32m";
    private static final String ANSI_BLUE = "\u001B[34m";
    private static final String ANSI_CYAN = "\u001B[36m";
    private static final String ANSI_BOLD = "\u001B[1m";

    @Autowired
    private DataSource dataSource;

    @Autowired
    private TargetTableRegistry targetTableRegistry;

    @Value("${spring.datasource.schema:}")
    private String schema;

    @Autowired
    private LoaderProperties loaderProperties;

    @EventListener(ApplicationReadyEvent.class)
    public void verifyDatabase() {
        if (!loaderProperties.getStartup().isVerifyTargets()) {
            logger.info("Target table verification disabled (loader.startup.verify-targets=false)");
            return;
        }
        logger.info(ANSI_CYAN + "========================================" + ANSI_RESET);
        logger.info(ANSI_CYAN + ANSI_BOLD + "DATABASE VERIFICATION - Starting" + ANSI_RESET);
        logger.info(ANSI_CYAN + "========================================" + ANSI_RESET);

        try (Connection connection = dataSource.getConnection()) {
            DatabaseMetaData metaData = connection.getMetaData();
            logger.info(ANSI_BLUE + "   Database: {} {}" + ANSI_RESET, metaData.getDatabaseProductName(),
                    metaData.getDatabaseProductVersion());
            logger.info(ANSI_BLUE + "   JDBC URL: {}" + ANSI_RESET, metaData.getURL());
            logger.info(ANSI_GREEN + ANSI_BOLD + "[SUCCESS] Database connection: OK" + ANSI_RESET);

            List<String> problems = new ArrayList<>();
            for (TargetTable target : targetTableRegistry.getAll()) {
                problems.addAll(verifyTarget(metaData, target));
            }

            if (!problems.isEmpty()) {
                for (String problem : problems) {
                    logger.error(ANSI_RED + "   {}" + ANSI_RESET, problem);
                }
                throw new IllegalStateException("Target table verification failed: " + problems);
            }
            logger.info(ANSI_GREEN + ANSI_BOLD + "[SUCCESS] {} target tables verified" + ANSI_RESET,
                    targetTableRegistry.getAll().size());
        } catch (SQLException e) {
            logger.error(ANSI_RED + ANSI_BOLD + "[CRITICAL] Cannot establish database connection!" + ANSI_RESET);
            throw new IllegalStateException("Database connection failed - Application cannot start", e);
        }
    }

    private List<String> verifyTarget(DatabaseMetaData metaData, TargetTable target) throws SQLException {
        String tableSchema = schema != null && !schema.isEmpty() ? schema.toLowerCase(Locale.ROOT) : null;
        String tableName = target.getTable().toLowerCase(Locale.ROOT);
        int dot = tableName.indexOf('.');
        if (dot > 0) {
            tableSchema = tableName.substring(0, dot);
            tableName = tableName.substring(dot + 1);
        }

        Set<String> columns = new HashSet<>();
        try (ResultSet resultSet = metaData.getColumns(null, tableSchema, tableName, null)) {
            while (resultSet.next()) {
                columns.add(resultSet.getString("COLUMN_NAME").toLowerCase(Locale.ROOT));
            }
        }

        List<String> problems = new ArrayList<>();
        if (columns.isEmpty()) {
            problems.add("Target " + target.getName() + ": table " + target.getTable() + " does not exist");
            return problems;
        }
        List<String> required = new ArrayList<>(target.getColumns().values());
        required.add(TargetTable.SOURCE_FILE_ID_COLUMN);
        for (String column : required) {
            if (!columns.contains(column.toLowerCase(Locale.ROOT))) {
                problems.add("Target " + target.getName() + ": column " + column + " missing from " + target.getTable());
            }
        }
        if (problems.isEmpty()) {
            logger.info(ANSI_GREEN + "[SUCCESS] Target {} -> {}: OK" + ANSI_RESET, target.getName(), target.getTable());
        }
        return problems;
    }
}
