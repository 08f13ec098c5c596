package com.dataops.loader.service;

import com.dataops.loader.model.ErrorKind;
import com.dataops.loader.model.Row;
import com.dataops.loader.model.rule.RuleOutcome;
import com.dataops.loader.model.rule.ValidationRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Evaluates one rule against one row.
 *
 * REQUIRED passes when the field is present and not blank. Every other kind
 * passes for an absent field. DUPLICATE always passes here because uniqueness
 * is enforced by the store at load time. Any exception thrown while checking a
 * value is reported as UNKNOWN.
 */
@Component
public class RuleEngine {

    private static final Logger logger = LoggerFactory.getLogger(RuleEngine.class);

    public RuleOutcome evaluate(ValidationRule rule, Row row) {
        String field = rule.getField();
        String value = row.getValue(field).orElse(null);

        try {
            switch (rule.getKind()) {
                case REQUIRED:
                    return rule.accepts(value)
                            ? RuleOutcome.pass()
                            : RuleOutcome.fail(ErrorKind.REQUIRED, field, value, rule.violationMessage(value));
                case DUPLICATE:
                    return RuleOutcome.pass();
                default:
                    if (value == null) {
                        return RuleOutcome.pass();
                    }
                    return rule.accepts(value)
                            ? RuleOutcome.pass()
                            : RuleOutcome.fail(rule.getKind(), field, value, rule.violationMessage(value));
            }
        } catch (RuntimeException e) {
            logger.debug("Rule {} could not evaluate row {}: {}", rule, row.getRowNumber(), e.toString());
            return RuleOutcome.fail(ErrorKind.UNKNOWN, field, value,
                    "Could not evaluate " + rule.getKind() + " rule on " + field + ": " + describe(e));
        }
    }

    private static String describe(RuntimeException e) {
        if (e instanceof NumberFormatException) {
            return "value is not a number";
        }
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
