/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;

/**
 * Metadata for one field of an entity type.
 *
 * <p>{@code relatedEntityType} is only meaningful for {@link FieldKind#RELATIONSHIP};
 * a relationship field without a target is ignored by relationship checks.
 */
public record FieldDefinition(
    @JsonProperty("id") String id,
    @JsonProperty("tenant_id") String tenantId,
    @JsonProperty("entity_type") EntityType entityType,
    @JsonProperty("field_key") String fieldKey,
    @JsonProperty("kind") FieldKind kind,
    @JsonProperty("required") boolean required,
    @JsonProperty("options") List<String> options,
    @JsonProperty("related_entity_type") EntityType relatedEntityType,
    @JsonProperty("active") boolean active
) implements Serializable {

    public FieldDefinition {
        Objects.requireNonNull(tenantId, "tenantId cannot be null");
        Objects.requireNonNull(entityType, "entityType cannot be null");
        Objects.requireNonNull(fieldKey, "fieldKey cannot be null");
        Objects.requireNonNull(kind, "kind cannot be null");
        options = options == null ? List.of() : List.copyOf(options);
    }

    public static FieldDefinition relationship(String id, String tenantId, EntityType owner,
                                               String fieldKey, EntityType target) {
        return new FieldDefinition(id, tenantId, owner, fieldKey, FieldKind.RELATIONSHIP,
            false, null, target, true);
    }

    public static FieldDefinition of(String id, String tenantId, EntityType owner,
                                     String fieldKey, FieldKind kind, boolean required) {
        return new FieldDefinition(id, tenantId, owner, fieldKey, kind, required, null, null, true);
    }

    /**
     * True for a relationship field that declares a target type.
     */
    public boolean isRelationship() {
        return kind == FieldKind.RELATIONSHIP && relatedEntityType != null;
    }

    public boolean references(EntityType target) {
        return isRelationship() && relatedEntityType.equals(target);
    }

    public FieldDefinition deactivated() {
        return new FieldDefinition(id, tenantId, entityType, fieldKey, kind, required, options, relatedEntityType, false);
    }
}
