/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.api.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Outcome of checking one relationship value.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValidationResult(
    @JsonProperty("valid") boolean valid,
    @JsonProperty("error") String error
) implements Serializable {

    private static final ValidationResult VALID = new ValidationResult(true, null);

    public static ValidationResult ok() {
        return VALID;
    }

    public static ValidationResult invalid(String error) {
        return new ValidationResult(false, error);
    }
}
