package com.dataops.loader.service;

import com.dataops.loader.config.LoaderProperties;
import com.dataops.loader.exception.RuleConfigurationException;
import com.dataops.loader.exception.UnknownTargetTableException;
import com.dataops.loader.model.TargetTable;
import com.dataops.loader.model.rule.ValidationRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Typed view of the configured target tables, built once at startup.
 *
 * Construction fails with {@link RuleConfigurationException} on any malformed
 * target: bad identifiers, empty column mapping, non-positive batch size,
 * rules on unmapped fields, or rule definitions that cannot be converted.
 */
@Component
public class TargetTableRegistry {

    private static final Logger logger = LoggerFactory.getLogger(TargetTableRegistry.class);

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern QUALIFIED_IDENTIFIER =
            Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");

    private final Map<String, TargetTable> targets;

    public TargetTableRegistry(LoaderProperties properties) {
        Map<String, TargetTable> built = new LinkedHashMap<>();
        int defaultBatchSize = properties.getBatch().getDefaultSize();
        if (defaultBatchSize <= 0) {
            throw new RuleConfigurationException("loader.batch.default-size must be positive: " + defaultBatchSize);
        }
        for (Map.Entry<String, LoaderProperties.Target> entry : properties.getTargets().entrySet()) {
            TargetTable target = build(entry.getKey(), entry.getValue(), defaultBatchSize);
            built.put(target.getName(), target);
            logger.info("Registered target {} with {} columns and {} rules (batch size {})",
                    target, target.getColumns().size(), target.getRules().size(), target.getBatchSize());
        }
        this.targets = Collections.unmodifiableMap(built);
    }

    public TargetTable get(String name) {
        TargetTable target = targets.get(name);
        if (target == null) {
            throw new UnknownTargetTableException("No target table configured under name '" + name + "'");
        }
        return target;
    }

    public boolean contains(String name) {
        return targets.containsKey(name);
    }

    public Collection<TargetTable> getAll() {
        return targets.values();
    }

    private static TargetTable build(String name, LoaderProperties.Target config, int defaultBatchSize) {
        String prefix = "loader.targets." + name;
        if (config.getTable() == null || !QUALIFIED_IDENTIFIER.matcher(config.getTable()).matches()) {
            throw new RuleConfigurationException(prefix + ".table is not a valid table name: " + config.getTable());
        }
        if (config.getColumns() == null || config.getColumns().isEmpty()) {
            throw new RuleConfigurationException(prefix + ".columns must map at least one field");
        }
        for (Map.Entry<String, String> column : config.getColumns().entrySet()) {
            if (column.getValue() == null || !IDENTIFIER.matcher(column.getValue()).matches()) {
                throw new RuleConfigurationException(
                        prefix + ".columns." + column.getKey() + " is not a valid column name: " + column.getValue());
            }
            if (TargetTable.SOURCE_FILE_ID_COLUMN.equalsIgnoreCase(column.getValue())) {
                throw new RuleConfigurationException(
                        prefix + ".columns must not map " + TargetTable.SOURCE_FILE_ID_COLUMN);
            }
        }

        int batchSize = config.getBatchSize() != null ? config.getBatchSize() : defaultBatchSize;
        if (batchSize <= 0) {
            throw new RuleConfigurationException(prefix + ".batch-size must be positive: " + batchSize);
        }

        List<ValidationRule> rules = RuleFactory.createAll(name, config.getRules());
        int uniqueKeys = 0;
        for (ValidationRule rule : rules) {
            if (!config.getColumns().containsKey(rule.getField())) {
                throw new RuleConfigurationException(
                        prefix + ": rule " + rule + " references unmapped field '" + rule.getField() + "'");
            }
            if (rule instanceof ValidationRule.Duplicate) {
                uniqueKeys++;
            }
        }
        if (uniqueKeys > 1) {
            throw new RuleConfigurationException(prefix + " declares more than one DUPLICATE rule");
        }

        List<String> indicators = new ArrayList<>();
        if (config.getIndicators() != null) {
            for (String indicator : config.getIndicators()) {
                if (indicator != null && !indicator.trim().isEmpty()) {
                    indicators.add(indicator.trim().toLowerCase(Locale.ROOT));
                }
            }
        }

        return new TargetTable(name, config.getTable(), config.getColumns(), batchSize, indicators, rules);
    }
}
