package com.dataops.loader.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loader configuration bound from the {@code loader.*} properties.
 *
 * Target tables are declared under {@code loader.targets.<name>}. Their rule
 * definitions stay loosely typed here and are converted to typed rules by
 * {@link com.dataops.loader.service.TargetTableRegistry} at startup.
 */
@Configuration
@ConfigurationProperties(prefix = "loader")
@Data
public class LoaderProperties {

    // ========================================
    // STORAGE (loader.storage.*)
    // ========================================

    private Storage storage = new Storage();

    @Data
    public static class Storage {
        /** Directory holding uploaded files */
        private String directory = "./data/uploads";
    }

    // ========================================
    // CSV (loader.csv.*)
    // ========================================

    private Csv csv = new Csv();

    @Data
    public static class Csv {
        /** Field delimiter, a single character */
        private String delimiter = ",";

        public char getDelimiterChar() {
            if (delimiter == null || delimiter.length() != 1) {
                throw new IllegalStateException("loader.csv.delimiter must be a single character: '" + delimiter + "'");
            }
            return delimiter.charAt(0);
        }
    }

    // ========================================
    // BATCH LOADING (loader.batch.*)
    // ========================================

    private Batch batch = new Batch();

    @Data
    public static class Batch {
        /** Rows per bulk insert when a target does not set its own size */
        private int defaultSize = 1000;

        /** Maximum number of segment splits while isolating failing rows in one batch */
        private int maxIsolationRetries = 16;

        /** Segments at or below this size are inserted one row at a time */
        private int rowByRowThreshold = 8;

        /** Pending rejected-row errors that force a flush before the batch is full */
        private int errorFlushThreshold = 500;
    }

    // ========================================
    // WORKER POOL (loader.worker.*)
    // ========================================

    private Worker worker = new Worker();

    @Data
    public static class Worker {
        private int corePoolSize = 2;
        private int maxPoolSize = 4;
        private int queueCapacity = 50;
    }

    // ========================================
    // MAINTENANCE (loader.maintenance.*)
    // ========================================

    private Maintenance maintenance = new Maintenance();

    @Data
    public static class Maintenance {
        /** PROCESSING runs older than this and not active here are failed */
        private Duration staleRunTimeout = Duration.ofHours(2);

        /** Delay between stale-run checks */
        private Duration reaperInterval = Duration.ofMinutes(5);

        /** Errors of completed files are kept this many days; 0 disables cleanup */
        private int errorRetentionDays = 90;

        /** When the error retention cleanup runs */
        private String retentionCron = "0 30 3 * * *";
    }

    // ========================================
    // PREVIEW (loader.preview.*)
    // ========================================

    private Preview preview = new Preview();

    @Data
    public static class Preview {
        private int defaultSampleSize = 100;
        private int maxSampleSize = 1000;
    }

    // ========================================
    // STARTUP (loader.startup.*)
    // ========================================

    private Startup startup = new Startup();

    @Data
    public static class Startup {
        /** Check configured target tables against the database when the application is ready */
        private boolean verifyTargets = true;
    }

    // ========================================
    // TARGET TABLES (loader.targets.<name>.*)
    // ========================================

    private Map<String, Target> targets = new LinkedHashMap<>();

    @Data
    public static class Target {
        /** Table name, optionally schema-qualified */
        private String table;

        /** Row field name to column name, in insert order */
        private Map<String, String> columns = new LinkedHashMap<>();

        /** Overrides loader.batch.default-size when set */
        private Integer batchSize;

        /** Header keywords used to detect this target when a file names none */
        private List<String> indicators = new ArrayList<>();

        /** Ordered rule list */
        private List<RuleDefinition> rules = new ArrayList<>();
    }

    /**
     * One rule as written in configuration. Which parameters apply depends on the kind:
     * FORMAT takes exactly one of pattern, preset, date-format or allowed-values;
     * RANGE takes min and/or max; LENGTH takes max-length.
     */
    @Data
    public static class RuleDefinition {
        private String kind;
        private String field;
        private String pattern;
        private String preset;
        private String dateFormat;
        private List<String> allowedValues;
        private BigDecimal min;
        private BigDecimal max;
        private Integer maxLength;
        private String message;
    }
}
