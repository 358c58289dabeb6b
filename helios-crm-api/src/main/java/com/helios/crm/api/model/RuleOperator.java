/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Comparison operators available to segment rules, with their wire names.
 */
public enum RuleOperator {
    EQUALS("equals"),
    NOT_EQUALS("not_equals"),
    CONTAINS("contains"),
    NOT_CONTAINS("not_contains"),
    STARTS_WITH("starts_with"),
    ENDS_WITH("ends_with"),
    GREATER_THAN("greater_than"),
    LESS_THAN("less_than"),
    IS_EMPTY("is_empty"),
    IS_NOT_EMPTY("is_not_empty");

    private final String wireName;

    RuleOperator(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Safely converts a wire name to an operator. Matching ignores case and accepts
     * {@code -} in place of {@code _} ("starts-with", "STARTS_WITH").
     *
     * @param text the operator string
     * @return the operator, or null if not recognized
     */
    public static RuleOperator fromString(String text) {
        if (text == null) return null;
        String normalized = text.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (RuleOperator operator : values()) {
            if (operator.wireName.equals(normalized)) {
                return operator;
            }
        }
        return null;
    }

    /**
     * Operators that ignore the rule value.
     */
    public boolean isUnary() {
        return this == IS_EMPTY || this == IS_NOT_EMPTY;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
