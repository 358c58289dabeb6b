/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;

/**
 * A tenant-defined entity type. Records of the module are addressed by its slug.
 */
public record CustomModule(
    @JsonProperty("id") String id,
    @JsonProperty("tenant_id") String tenantId,
    @JsonProperty("slug") String slug,
    @JsonProperty("name") String name
) implements Serializable {

    public CustomModule {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(tenantId, "tenantId cannot be null");
        Objects.requireNonNull(slug, "slug cannot be null");
        if (name == null) name = slug;
    }

    public EntityType entityType() {
        return EntityType.custom(slug);
    }
}
