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
 * Outcome of validating a custom-field payload against its field definitions.
 *
 * @param valid  true when every field passed type, required and relationship checks
 * @param data   the coerced payload (only meaningful when valid)
 * @param errors error message per failing field key
 */
public record FieldValidationResult(
    @JsonProperty("valid") boolean valid,
    @JsonProperty("data") AttributeBag data,
    @JsonProperty("errors") Map<String, String> errors
) implements Serializable {

    public FieldValidationResult {
        if (data == null) data = AttributeBag.empty();
        errors = errors == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(errors));
    }

    public static FieldValidationResult success(AttributeBag data) {
        return new FieldValidationResult(true, data, Map.of());
    }

    public static FieldValidationResult failure(Map<String, String> errors) {
        return new FieldValidationResult(false, AttributeBag.empty(), errors);
    }
}
