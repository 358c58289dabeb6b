/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.api;

import com.helios.crm.api.model.EntityType;
import com.helios.crm.api.model.FieldDefinition;

import java.util.List;

/**
 * Cached, tenant-scoped view of the field-definition catalog.
 *
 * <p>Reads may be stale for up to the configured TTL unless the writer of a
 * definition calls {@link #invalidate(String, EntityType)}.
 */
public interface IFieldDefinitionRegistry {

    /**
     * Active field definitions of an entity type.
     */
    List<FieldDefinition> fieldsOfType(String tenantId, EntityType entityType);

    /**
     * Active relationship fields, across all entity types of the tenant, whose target is the given type.
     */
    List<FieldDefinition> fieldsReferencing(String tenantId, EntityType targetEntityType);

    default List<FieldDefinition> relationshipFieldsOf(String tenantId, EntityType entityType) {
        return fieldsOfType(tenantId, entityType).stream()
            .filter(FieldDefinition::isRelationship)
            .toList();
    }

    /**
     * Drops cached entries after a definition of the type changed.
     */
    void invalidate(String tenantId, EntityType entityType);

    void invalidateTenant(String tenantId);
}
