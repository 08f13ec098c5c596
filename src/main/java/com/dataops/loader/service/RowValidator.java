package com.dataops.loader.service;

import com.dataops.loader.model.Row;
import com.dataops.loader.model.ValidationError;
import com.dataops.loader.model.rule.RuleOutcome;
import com.dataops.loader.model.rule.ValidationRule;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Applies a full rule list to a row. Every rule runs; errors come back in
 * rule declaration order, so the same row and rules always give the same list.
 */
@Component
public class RowValidator {

    private final RuleEngine ruleEngine;

    public RowValidator(RuleEngine ruleEngine) {
        this.ruleEngine = ruleEngine;
    }

    public List<ValidationError> validate(Row row, List<ValidationRule> rules) {
        List<ValidationError> errors = new ArrayList<>();
        for (ValidationRule rule : rules) {
            RuleOutcome outcome = ruleEngine.evaluate(rule, row);
            if (!outcome.isPass()) {
                errors.add(outcome.toError(row.getRowNumber()));
            }
        }
        return errors;
    }
}
