/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregated outcome of checking every relationship field of a record payload.
 *
 * @param valid  true when no field failed
 * @param errors error message per failing field key, in field order
 */
public record RelationshipValidationResult(
    @JsonProperty("valid") boolean valid,
    @JsonProperty("errors") Map<String, String> errors
) implements Serializable {

    public RelationshipValidationResult {
        errors = errors == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(errors));
    }

    public static RelationshipValidationResult of(Map<String, String> errors) {
        return new RelationshipValidationResult(errors == null || errors.isEmpty(), errors);
    }
}
