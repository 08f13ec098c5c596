package com.dataops.loader.util;

import com.dataops.loader.config.LoaderProperties;
import com.dataops.loader.model.FileType;
import com.dataops.loader.model.Row;
import com.dataops.loader.model.SourceFile;
import com.dataops.loader.model.TargetTable;
import com.dataops.loader.model.rule.ValidationRule;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Utility class for creating test data: rows, targets, source files and file content.
 */
public class TestDataFactory {

    public static final String CUSTOMER_HEADER = "customer_code,name,email,credit_limit";

    /**
     * Customers target with REQUIRED customer_code, FORMAT email, RANGE credit_limit >= 0
     * and customer_code as unique key.
     */
    public static TargetTable customerTarget(int batchSize) {
        Map<String, String> columns = new LinkedHashMap<>();
        columns.put("customer_code", "customer_code");
        columns.put("name", "name");
        columns.put("email", "email");
        columns.put("credit_limit", "credit_limit");
        List<ValidationRule> rules = List.of(
                ValidationRule.required("customer_code", null),
                ValidationRule.email("email", null),
                ValidationRule.range("credit_limit", BigDecimal.ZERO, null, null),
                ValidationRule.duplicate("customer_code", null));
        return new TargetTable("customers", "customers", columns, batchSize,
                List.of("customer", "email", "credit_limit"), rules);
    }

    /**
     * Orders target without a unique key.
     */
    public static TargetTable orderTarget(int batchSize) {
        Map<String, String> columns = new LinkedHashMap<>();
        columns.put("order_number", "order_number");
        columns.put("total_amount", "total_amount");
        List<ValidationRule> rules = List.of(ValidationRule.required("order_number", null));
        return new TargetTable("orders", "orders", columns, batchSize, List.of("order", "amount"), rules);
    }

    /**
     * Row from alternating field names and values; a null value makes the field absent.
     */
    public static Row row(long rowNumber, String... fieldsAndValues) {
        Map<String, String> values = new LinkedHashMap<>();
        for (int i = 0; i < fieldsAndValues.length; i += 2) {
            values.put(fieldsAndValues[i], fieldsAndValues[i + 1]);
        }
        return new Row(rowNumber, values);
    }

    public static Row customer(long rowNumber, String code, String name, String email, String creditLimit) {
        return row(rowNumber, "customer_code", code, "name", name, "email", email, "credit_limit", creditLimit);
    }

    /**
     * A source file in PROCESSING under the given run, as returned by a successful claim.
     */
    public static SourceFile claimedFile(long id, FileType type, String storedName, UUID runId) {
        SourceFile sourceFile = new SourceFile("upload." + type.name().toLowerCase(), storedName, type, 100L);
        sourceFile.setId(id);
        sourceFile.setStatus(SourceFile.Status.PROCESSING);
        sourceFile.setRunId(runId);
        sourceFile.setAttemptCount(1);
        sourceFile.setStartedAt(LocalDateTime.now());
        return sourceFile;
    }

    public static SourceFile uploadedFile(long id, FileType type) {
        SourceFile sourceFile = new SourceFile("upload." + type.name().toLowerCase(), id + "_stored", type, 100L);
        sourceFile.setId(id);
        return sourceFile;
    }

    public static byte[] lines(String... lines) {
        return String.join("\n", lines).getBytes(StandardCharsets.UTF_8);
    }

    public static byte[] utf8(String content) {
        return content.getBytes(StandardCharsets.UTF_8);
    }

    public static LoaderProperties properties() {
        LoaderProperties properties = new LoaderProperties();
        properties.getBatch().setDefaultSize(1000);
        properties.getBatch().setRowByRowThreshold(2);
        properties.getBatch().setMaxIsolationRetries(16);
        properties.getBatch().setErrorFlushThreshold(500);
        return properties;
    }
}
