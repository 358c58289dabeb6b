/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.store.memory;

import com.helios.crm.api.model.EntityType;
import com.helios.crm.api.model.FieldDefinition;
import com.helios.crm.store.FieldDefinitionSource;

import java.util.List;

public class InMemoryFieldDefinitionSource implements FieldDefinitionSource {

    private final InMemoryCrmStore store;

    InMemoryFieldDefinitionSource(InMemoryCrmStore store) {
        this.store = store;
    }

    @Override
    public List<FieldDefinition> findActive(String tenantId, EntityType entityType) {
        return store.locked(() -> store.fieldDefinitions.values().stream()
            .filter(FieldDefinition::active)
            .filter(definition -> definition.tenantId().equals(tenantId))
            .filter(definition -> definition.entityType().equals(entityType))
            .toList());
    }

    @Override
    public List<FieldDefinition> findActiveRelationshipsTargeting(String tenantId, EntityType targetEntityType) {
        return store.locked(() -> store.fieldDefinitions.values().stream()
            .filter(FieldDefinition::active)
            .filter(definition -> definition.tenantId().equals(tenantId))
            .filter(definition -> definition.references(targetEntityType))
            .toList());
    }
}
