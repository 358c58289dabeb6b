/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;

/**
 * One step of a relationship path: follow {@code fieldKey} on the current record
 * to a record of {@code targetEntityType}.
 */
public record RelationshipHop(
    @JsonProperty("field") String fieldKey,
    @JsonProperty("target_module") EntityType targetEntityType
) implements Serializable {

    public RelationshipHop {
        Objects.requireNonNull(fieldKey, "fieldKey cannot be null");
        Objects.requireNonNull(targetEntityType, "targetEntityType cannot be null");
    }

    public static RelationshipHop of(String fieldKey, String targetModule) {
        return new RelationshipHop(fieldKey, EntityType.of(targetModule));
    }
}
