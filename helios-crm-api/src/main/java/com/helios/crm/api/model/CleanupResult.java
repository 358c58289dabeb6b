/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Outcome of repairing references to a deleted record.
 *
 * <p>A non-empty {@code errors} list means some referencing fields could not be
 * cleaned; the fields that succeeded are still counted in {@code cleanedCount}.
 */
public record CleanupResult(
    @JsonProperty("cleaned") int cleanedCount,
    @JsonProperty("errors") List<String> errors
) implements Serializable {

    public CleanupResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
