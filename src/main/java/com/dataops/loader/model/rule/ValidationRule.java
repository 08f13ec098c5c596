package com.dataops.loader.model.rule;

import com.dataops.loader.model.ErrorKind;

import java.math.BigDecimal;
import java.time.format.DateTimeFormatter;
import java.time.format.ResolverStyle;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * A configured check bound to one field of a row.
 *
 * The set of variants is closed: every rule is one of the nested subclasses,
 * each carrying the typed parameters of its kind. Parameters are checked when
 * the rule is constructed, so a malformed configuration fails at load time
 * rather than while rows are being evaluated.
 */
public abstract class ValidationRule {

    private final String field;
    private final String message; // Optional override of the default message

    private ValidationRule(String field, String message) {
        if (field == null || field.trim().isEmpty()) {
            throw new IllegalArgumentException("Rule field must not be empty");
        }
        this.field = field.trim();
        this.message = message;
    }

    public String getField() {
        return field;
    }

    public String getMessage() {
        return message;
    }

    public abstract ErrorKind getKind();

    /**
     * Test a present value. Absent values never reach this method.
     * May throw for values the rule cannot interpret.
     */
    public abstract boolean accepts(String value);

    /**
     * Default message for a value this rule rejected.
     */
    protected abstract String defaultMessage(String value);

    public String violationMessage(String value) {
        return message != null ? message : defaultMessage(value);
    }

    @Override
    public String toString() {
        return getKind() + "(" + field + ")";
    }

    // ===== Variants =====

    public static Required required(String field, String message) {
        return new Required(field, message);
    }

    public static Format format(String field, String pattern, String message) {
        return new Format(field, pattern, message);
    }

    public static Format email(String field, String message) {
        return new Format(field, Format.EMAIL_PATTERN,
                message != null ? message : field + " must be a valid email address");
    }

    public static DateFormat dateFormat(String field, String datePattern, String message) {
        return new DateFormat(field, datePattern, message);
    }

    public static AllowedValues allowedValues(String field, List<String> values, String message) {
        return new AllowedValues(field, values, message);
    }

    public static Range range(String field, BigDecimal min, BigDecimal max, String message) {
        return new Range(field, min, max, message);
    }

    public static Length length(String field, int maxLength, String message) {
        return new Length(field, maxLength, message);
    }

    public static Duplicate duplicate(String field, String message) {
        return new Duplicate(field, message);
    }

    /**
     * Field must be present and non-blank.
     */
    public static final class Required extends ValidationRule {

        private Required(String field, String message) {
            super(field, message);
        }

        @Override
        public ErrorKind getKind() {
            return ErrorKind.REQUIRED;
        }

        @Override
        public boolean accepts(String value) {
            return value != null && !value.trim().isEmpty();
        }

        @Override
        protected String defaultMessage(String value) {
            return getField() + " is required";
        }
    }

    /**
     * Whole-value regular expression match.
     */
    public static final class Format extends ValidationRule {

        static final String EMAIL_PATTERN = "[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}";

        private final Pattern pattern;

        private Format(String field, String pattern, String message) {
            super(field, message);
            if (pattern == null || pattern.isEmpty()) {
                throw new IllegalArgumentException("FORMAT rule on " + field + " needs a pattern");
            }
            this.pattern = Pattern.compile(pattern);
        }

        public Pattern getPattern() {
            return pattern;
        }

        @Override
        public ErrorKind getKind() {
            return ErrorKind.FORMAT;
        }

        @Override
        public boolean accepts(String value) {
            return pattern.matcher(value).matches();
        }

        @Override
        protected String defaultMessage(String value) {
            return getField() + " does not match expected pattern";
        }
    }

    /**
     * Strict calendar date in the given java.time pattern.
     */
    public static final class DateFormat extends ValidationRule {

        private final String datePattern;
        private final DateTimeFormatter formatter;

        private DateFormat(String field, String datePattern, String message) {
            super(field, message);
            if (datePattern == null || datePattern.isEmpty()) {
                throw new IllegalArgumentException("FORMAT rule on " + field + " needs a date pattern");
            }
            this.datePattern = datePattern;
            // 'uuuu' keeps STRICT resolution working for year fields
            this.formatter = DateTimeFormatter.ofPattern(datePattern.replace("yyyy", "uuuu"))
                    .withResolverStyle(ResolverStyle.STRICT);
        }

        public String getDatePattern() {
            return datePattern;
        }

        @Override
        public ErrorKind getKind() {
            return ErrorKind.FORMAT;
        }

        @Override
        public boolean accepts(String value) {
            try {
                formatter.parse(value);
                return true;
            } catch (java.time.format.DateTimeParseException e) {
                return false;
            }
        }

        @Override
        protected String defaultMessage(String value) {
            return getField() + " must be a valid date (" + datePattern + ")";
        }
    }

    /**
     * Value must be one of a fixed set.
     */
    public static final class AllowedValues extends ValidationRule {

        private final Set<String> values;

        private AllowedValues(String field, List<String> values, String message) {
            super(field, message);
            if (values == null || values.isEmpty()) {
                throw new IllegalArgumentException("FORMAT rule on " + field + " needs allowed values");
            }
            this.values = Collections.unmodifiableSet(new LinkedHashSet<>(values));
        }

        public Set<String> getValues() {
            return values;
        }

        @Override
        public ErrorKind getKind() {
            return ErrorKind.FORMAT;
        }

        @Override
        public boolean accepts(String value) {
            return values.contains(value);
        }

        @Override
        protected String defaultMessage(String value) {
            return getField() + " must be one of: " + String.join(", ", values);
        }
    }

    /**
     * Numeric value within inclusive bounds; either bound may be open.
     */
    public static final class Range extends ValidationRule {

        private final BigDecimal min;
        private final BigDecimal max;

        private Range(String field, BigDecimal min, BigDecimal max, String message) {
            super(field, message);
            if (min == null && max == null) {
                throw new IllegalArgumentException("RANGE rule on " + field + " needs min or max");
            }
            if (min != null && max != null && min.compareTo(max) > 0) {
                throw new IllegalArgumentException(
                        "RANGE rule on " + field + " has min " + min + " greater than max " + max);
            }
            this.min = min;
            this.max = max;
        }

        public BigDecimal getMin() {
            return min;
        }

        public BigDecimal getMax() {
            return max;
        }

        /**
         * @throws NumberFormatException when the value is not numeric
         */
        @Override
        public boolean accepts(String value) {
            BigDecimal number = new BigDecimal(value.trim());
            if (min != null && number.compareTo(min) < 0) {
                return false;
            }
            return max == null || number.compareTo(max) <= 0;
        }

        @Override
        public ErrorKind getKind() {
            return ErrorKind.RANGE;
        }

        @Override
        protected String defaultMessage(String value) {
            BigDecimal number = new BigDecimal(value.trim());
            if (min != null && number.compareTo(min) < 0) {
                return getField() + " must be at least " + min.toPlainString();
            }
            return getField() + " must be at most " + Objects.requireNonNull(max).toPlainString();
        }
    }

    /**
     * Character length no greater than the maximum.
     */
    public static final class Length extends ValidationRule {

        private final int maxLength;

        private Length(String field, int maxLength, String message) {
            super(field, message);
            if (maxLength < 0) {
                throw new IllegalArgumentException("LENGTH rule on " + field + " needs a non-negative max length");
            }
            this.maxLength = maxLength;
        }

        public int getMaxLength() {
            return maxLength;
        }

        @Override
        public ErrorKind getKind() {
            return ErrorKind.LENGTH;
        }

        @Override
        public boolean accepts(String value) {
            return value.codePointCount(0, value.length()) <= maxLength;
        }

        @Override
        protected String defaultMessage(String value) {
            return getField() + " must be at most " + maxLength + " characters";
        }
    }

    /**
     * Declares the unique key of the target table. Never fails during row
     * evaluation; violations are reported by the batch loader when the store
     * rejects the insert.
     */
    public static final class Duplicate extends ValidationRule {

        private Duplicate(String field, String message) {
            super(field, message);
        }

        @Override
        public ErrorKind getKind() {
            return ErrorKind.DUPLICATE;
        }

        @Override
        public boolean accepts(String value) {
            return true;
        }

        @Override
        protected String defaultMessage(String value) {
            return "Duplicate value for " + getField() + ": " + value;
        }
    }
}
