/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.relationship;

import java.util.regex.Pattern;

/**
 * Shape check for record identifiers, applied before any existence lookup.
 */
@FunctionalInterface
public interface IdentifierFormat {

    Pattern UUID_PATTERN = Pattern.compile(
        "^[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}$", Pattern.CASE_INSENSITIVE);

    boolean isWellFormed(String id);

    /**
     * Canonical 8-4-4-4-12 hex identifiers, case-insensitive.
     */
    static IdentifierFormat uuid() {
        return id -> id != null && UUID_PATTERN.matcher(id).matches();
    }
}
