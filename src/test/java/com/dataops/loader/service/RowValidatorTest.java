package com.dataops.loader.service;

import com.dataops.loader.model.ErrorKind;
import com.dataops.loader.model.Row;
import com.dataops.loader.model.ValidationError;
import com.dataops.loader.model.rule.ValidationRule;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static com.dataops.loader.util.TestDataFactory.customer;
import static com.dataops.loader.util.TestDataFactory.customerTarget;
import static com.dataops.loader.util.TestDataFactory.row;
import static org.assertj.core.api.Assertions.assertThat;

class RowValidatorTest {

    private final RowValidator rowValidator = new RowValidator(new RuleEngine());
    private final List<ValidationRule> customerRules = customerTarget(10).getRules();

    @Test
    void testValidate_ValidRow_NoErrors() {
        List<ValidationError> errors = rowValidator.validate(customer(1, "CUST001", "John", "john@x.com", "1000"),
                customerRules);

        assertThat(errors).isEmpty();
    }

    @Test
    void testValidate_BadEmail_OneFormatError() {
        List<ValidationError> errors = rowValidator.validate(customer(2, "CUST002", "Jane", "bad-email", "2000"),
                customerRules);

        assertThat(errors).hasSize(1);
        assertThat(errors.get(0).getRowNumber()).isEqualTo(2);
        assertThat(errors.get(0).getKind()).isEqualTo(ErrorKind.FORMAT);
        assertThat(errors.get(0).getFieldName()).isEqualTo("email");
        assertThat(errors.get(0).getFieldValue()).isEqualTo("bad-email");
    }

    @Test
    void testValidate_EmptyCode_OneRequiredError() {
        List<ValidationError> errors = rowValidator.validate(customer(3, "", "NoCode", "x@y.com", "500"),
                customerRules);

        assertThat(errors).hasSize(1);
        assertThat(errors.get(0).getKind()).isEqualTo(ErrorKind.REQUIRED);
        assertThat(errors.get(0).getFieldName()).isEqualTo("customer_code");
    }

    @Test
    void testValidate_DoesNotShortCircuit_ErrorsInRuleOrder() {
        Row row = customer(7, null, "Bad", "nope", "-10");

        List<ValidationError> errors = rowValidator.validate(row, customerRules);

        assertThat(errors).extracting(ValidationError::getKind)
                .containsExactly(ErrorKind.REQUIRED, ErrorKind.FORMAT, ErrorKind.RANGE);
        assertThat(errors).allMatch(error -> error.getRowNumber() == 7);
    }

    @Test
    void testValidate_MultipleRulesOnOneField_AllApplied() {
        List<ValidationRule> rules = List.of(
                ValidationRule.length("code", 3, null),
                ValidationRule.format("code", "[a-z]+", null));

        List<ValidationError> errors = rowValidator.validate(row(1, "code", "ABCD"), rules);

        assertThat(errors).extracting(ValidationError::getKind)
                .containsExactly(ErrorKind.LENGTH, ErrorKind.FORMAT);
    }

    @Test
    void testValidate_Deterministic() {
        Row row = customer(4, "", "X", "bad", "abc");
        List<ValidationRule> rules = List.of(
                ValidationRule.required("customer_code", null),
                ValidationRule.email("email", null),
                ValidationRule.range("credit_limit", BigDecimal.ZERO, null, null));

        List<ValidationError> first = rowValidator.validate(row, rules);
        for (int i = 0; i < 20; i++) {
            assertThat(rowValidator.validate(row, rules)).isEqualTo(first);
        }
        assertThat(first).extracting(ValidationError::getKind)
                .containsExactly(ErrorKind.REQUIRED, ErrorKind.FORMAT, ErrorKind.UNKNOWN);
    }

    @Test
    void testValidate_NoRules_NoErrors() {
        assertThat(rowValidator.validate(row(1, "a", "b"), List.of())).isEmpty();
    }
}
