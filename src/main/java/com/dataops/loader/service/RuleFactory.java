package com.dataops.loader.service;

import com.dataops.loader.config.LoaderProperties.RuleDefinition;
import com.dataops.loader.exception.RuleConfigurationException;
import com.dataops.loader.model.ErrorKind;
import com.dataops.loader.model.rule.ValidationRule;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.PatternSyntaxException;

/**
 * Converts configured rule definitions into typed {@link ValidationRule} instances.
 * Any definition that cannot be converted is reported with its target and position.
 */
public final class RuleFactory {

    private static final String EMAIL_PRESET = "email";

    private RuleFactory() {
    }

    public static List<ValidationRule> createAll(String targetName, List<RuleDefinition> definitions) {
        List<ValidationRule> rules = new ArrayList<>();
        if (definitions == null) {
            return rules;
        }
        for (int i = 0; i < definitions.size(); i++) {
            rules.add(create(targetName, i, definitions.get(i)));
        }
        return rules;
    }

    public static ValidationRule create(String targetName, int index, RuleDefinition definition) {
        String location = "loader.targets." + targetName + ".rules[" + index + "]";
        if (definition == null || definition.getKind() == null) {
            throw new RuleConfigurationException(location + ": rule kind is missing");
        }

        ErrorKind kind;
        try {
            kind = ErrorKind.valueOf(definition.getKind().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new RuleConfigurationException(location + ": unknown rule kind '" + definition.getKind() + "'");
        }

        try {
            return switch (kind) {
                case REQUIRED -> ValidationRule.required(definition.getField(), definition.getMessage());
                case FORMAT -> createFormat(definition);
                case RANGE -> ValidationRule.range(definition.getField(), definition.getMin(),
                        definition.getMax(), definition.getMessage());
                case LENGTH -> {
                    if (definition.getMaxLength() == null) {
                        throw new IllegalArgumentException("LENGTH rule needs max-length");
                    }
                    yield ValidationRule.length(definition.getField(), definition.getMaxLength(),
                            definition.getMessage());
                }
                case DUPLICATE -> ValidationRule.duplicate(definition.getField(), definition.getMessage());
                case UNKNOWN -> throw new IllegalArgumentException("UNKNOWN is not a configurable rule kind");
            };
        } catch (PatternSyntaxException e) {
            throw new RuleConfigurationException(location + ": invalid pattern: " + e.getDescription(), e);
        } catch (IllegalArgumentException e) {
            throw new RuleConfigurationException(location + ": " + e.getMessage(), e);
        }
    }

    private static ValidationRule createFormat(RuleDefinition definition) {
        int variants = 0;
        variants += definition.getPattern() != null ? 1 : 0;
        variants += definition.getPreset() != null ? 1 : 0;
        variants += definition.getDateFormat() != null ? 1 : 0;
        variants += definition.getAllowedValues() != null ? 1 : 0;
        if (variants != 1) {
            throw new IllegalArgumentException(
                    "FORMAT rule needs exactly one of pattern, preset, date-format, allowed-values");
        }

        if (definition.getPattern() != null) {
            return ValidationRule.format(definition.getField(), definition.getPattern(), definition.getMessage());
        }
        if (definition.getPreset() != null) {
            if (!EMAIL_PRESET.equalsIgnoreCase(definition.getPreset().trim())) {
                throw new IllegalArgumentException("unknown FORMAT preset '" + definition.getPreset() + "'");
            }
            return ValidationRule.email(definition.getField(), definition.getMessage());
        }
        if (definition.getDateFormat() != null) {
            return ValidationRule.dateFormat(definition.getField(), definition.getDateFormat(),
                    definition.getMessage());
        }
        return ValidationRule.allowedValues(definition.getField(), definition.getAllowedValues(),
                definition.getMessage());
    }
}
