/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.segment.compiler;

import com.helios.crm.api.model.AttributeValue;
import com.helios.crm.api.model.RuleOperator;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;

/**
 * Applies a rule operator to a stored value.
 *
 * <p>Comparisons are two-valued: a missing stored value never equals, contains,
 * starts or ends with anything, so the negated operators match it. Ordering against a
 * missing stored value is false.
 */
public final class OperatorEvaluator {

    static final int INCOMPARABLE = Integer.MIN_VALUE;

    private OperatorEvaluator() {
    }

    /**
     * @param operator the operator
     * @param stored value read from the record; {@link AttributeValue#NULL} when absent
     * @param ruleValue raw value from the rule, may be null
     */
    public static boolean test(RuleOperator operator, AttributeValue stored, Object ruleValue) {
        Objects.requireNonNull(operator, "operator");
        return switch (operator) {
            case EQUALS -> isEqual(stored, ruleValue);
            case NOT_EQUALS -> !isEqual(stored, ruleValue);
            case CONTAINS -> textTest(stored, ruleValue, TextMatch.CONTAINS);
            case NOT_CONTAINS -> !textTest(stored, ruleValue, TextMatch.CONTAINS);
            case STARTS_WITH -> textTest(stored, ruleValue, TextMatch.STARTS_WITH);
            case ENDS_WITH -> textTest(stored, ruleValue, TextMatch.ENDS_WITH);
            case GREATER_THAN -> compare(stored, ruleValue) > 0;
            case LESS_THAN -> {
                int comparison = compare(stored, ruleValue);
                yield comparison != INCOMPARABLE && comparison < 0;
            }
            case IS_EMPTY -> stored.isEmpty();
            case IS_NOT_EMPTY -> !stored.isEmpty();
        };
    }

    static boolean isEqual(AttributeValue stored, Object ruleValue) {
        AttributeValue expected = AttributeValue.fromJava(ruleValue);
        if (expected.isNull() || stored.isNull()) {
            return expected.isNull() && stored.isNull();
        }

        switch (stored.type()) {
            case NUMBER -> {
                BigDecimal number = expected.numberValue();
                return number != null && stored.numberValue().compareTo(number) == 0;
            }
            case DATE -> {
                Instant instant = expected.dateValue();
                return stored.dateValue().equals(instant);
            }
            case BOOLEAN -> {
                return stored.booleanValue().equals(expected.booleanValue());
            }
            default -> {
                return stored.textValue().equals(expected.textValue());
            }
        }
    }

    private enum TextMatch { CONTAINS, STARTS_WITH, ENDS_WITH }

    private static boolean textTest(AttributeValue stored, Object ruleValue, TextMatch match) {
        String text = stored.textValue();
        if (text == null) {
            return false;
        }
        String haystack = text.toLowerCase(Locale.ROOT);
        String needle = (ruleValue == null ? "" : AttributeValue.fromJava(ruleValue).textValue()).toLowerCase(Locale.ROOT);
        return switch (match) {
            case CONTAINS -> haystack.contains(needle);
            case STARTS_WITH -> haystack.startsWith(needle);
            case ENDS_WITH -> haystack.endsWith(needle);
        };
    }

    /**
     * Orders the stored value against the rule value (0 when the rule value is absent).
     * Dates order by instant, everything else numerically.
     *
     * @return sign of the comparison, or {@link #INCOMPARABLE}
     */
    static int compare(AttributeValue stored, Object ruleValue) {
        if (stored.isNull()) {
            return INCOMPARABLE;
        }
        AttributeValue bound = ruleValue == null ? AttributeValue.number(BigDecimal.ZERO) : AttributeValue.fromJava(ruleValue);

        if (stored.type() == AttributeValue.ValueType.DATE) {
            Instant limit = bound.dateValue();
            return limit == null ? INCOMPARABLE : Integer.signum(stored.dateValue().compareTo(limit));
        }

        BigDecimal left = stored.numberValue();
        BigDecimal right = bound.numberValue();
        if (left == null || right == null) {
            return INCOMPARABLE;
        }
        return left.compareTo(right);
    }
}
