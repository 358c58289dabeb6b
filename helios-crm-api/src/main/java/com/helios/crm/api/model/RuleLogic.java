/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.api.model;

/**
 * How the conditions of a dynamic segment combine.
 */
public enum RuleLogic {
    /** Every condition must hold (intersection). */
    AND,
    /** At least one condition must hold (union). */
    OR;

    /**
     * Unknown or missing logic falls back to AND.
     */
    public static RuleLogic fromString(String text) {
        if (text != null && "OR".equalsIgnoreCase(text.trim())) {
            return OR;
        }
        return AND;
    }
}
