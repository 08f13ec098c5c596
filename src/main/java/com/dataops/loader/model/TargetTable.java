package com.dataops.loader.model;

import com.dataops.loader.model.rule.ValidationRule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Validated configuration of one load target: table, column mapping,
 * batch size and the ordered rule list.
 */
public class TargetTable {

    public static final String SOURCE_FILE_ID_COLUMN = "source_file_id";

    private final String name;
    private final String table;
    private final Map<String, String> columns; // field -> column, insert order
    private final int batchSize;
    private final List<String> indicators;
    private final List<ValidationRule> rules;

    public TargetTable(String name, String table, Map<String, String> columns, int batchSize,
                       List<String> indicators, List<ValidationRule> rules) {
        this.name = name;
        this.table = table;
        this.columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));
        this.batchSize = batchSize;
        this.indicators = List.copyOf(indicators);
        this.rules = Collections.unmodifiableList(new ArrayList<>(rules));
    }

    public String getName() {
        return name;
    }

    public String getTable() {
        return table;
    }

    public Map<String, String> getColumns() {
        return columns;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public List<String> getIndicators() {
        return indicators;
    }

    public List<ValidationRule> getRules() {
        return rules;
    }

    /**
     * The field whose uniqueness the store enforces, if a DUPLICATE rule is configured.
     */
    public Optional<ValidationRule.Duplicate> getUniqueKey() {
        for (ValidationRule rule : rules) {
            if (rule instanceof ValidationRule.Duplicate) {
                return Optional.of((ValidationRule.Duplicate) rule);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return name + " -> " + table;
    }
}
