/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;

/**
 * A stored record of any entity type.
 *
 * <p>For built-in types {@code core} holds the fixed columns (e.g. {@code firstName},
 * {@code email}, {@code accountId}) and {@code custom} is the extension bag. For custom
 * module records {@code core} is empty and {@code custom} carries the whole record.
 * Relationship values always live in {@code custom}.
 */
public record EntityRecord(
    @JsonProperty("id") String id,
    @JsonProperty("tenant_id") String tenantId,
    @JsonProperty("entity_type") EntityType entityType,
    @JsonProperty("core") AttributeBag core,
    @JsonProperty("custom") AttributeBag custom
) implements Serializable {

    public EntityRecord {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(tenantId, "tenantId cannot be null");
        Objects.requireNonNull(entityType, "entityType cannot be null");
        if (core == null) core = AttributeBag.empty();
        if (custom == null) custom = AttributeBag.empty();
    }

    public static EntityRecord builtIn(String id, String tenantId, EntityType type,
                                       AttributeBag core, AttributeBag custom) {
        return new EntityRecord(id, tenantId, type, core, custom);
    }

    public static EntityRecord custom(String id, String tenantId, String moduleSlug, AttributeBag data) {
        return new EntityRecord(id, tenantId, EntityType.custom(moduleSlug), AttributeBag.empty(), data);
    }

    public AttributeValue coreValue(String attribute) {
        return core.get(attribute);
    }

    public AttributeValue customValue(String fieldKey) {
        return custom.get(fieldKey);
    }

    public EntityRecord withCustom(AttributeBag newCustom) {
        return new EntityRecord(id, tenantId, entityType, core, newCustom);
    }

    /**
     * Human-readable label: "first last" for people, {@code name} otherwise, falling back to the id.
     */
    public String displayName() {
        String first = core.get("firstName").textValue();
        String last = core.get("lastName").textValue();
        if (first != null || last != null) {
            return ((first != null ? first : "") + " " + (last != null ? last : "")).trim();
        }
        String name = core.get("name").textValue();
        if (name == null) {
            name = custom.get("name").textValue();
        }
        return name != null ? name : id;
    }
}
