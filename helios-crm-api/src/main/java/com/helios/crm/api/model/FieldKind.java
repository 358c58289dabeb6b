/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.api.model;

/**
 * Declared value kind of a tenant-defined field.
 */
public enum FieldKind {
    TEXT,
    TEXTAREA,
    NUMBER,
    CURRENCY,
    PERCENT,
    DATE,
    BOOLEAN,
    SELECT,
    MULTISELECT,
    URL,
    EMAIL,
    PHONE,
    RELATIONSHIP;

    /**
     * Safely converts a catalog string to a kind.
     *
     * @param text the kind name, case-insensitive
     * @return the kind, or null if unknown
     */
    public static FieldKind fromString(String text) {
        if (text == null) return null;
        try {
            return FieldKind.valueOf(text.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    public boolean isNumeric() {
        return this == NUMBER || this == CURRENCY || this == PERCENT;
    }
}
