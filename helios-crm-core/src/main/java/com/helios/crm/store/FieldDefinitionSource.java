/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.store;

import com.helios.crm.api.model.EntityType;
import com.helios.crm.api.model.FieldDefinition;

import java.util.List;

/**
 * The authoritative field-definition catalog. Read through the registry cache.
 */
public interface FieldDefinitionSource {

    List<FieldDefinition> findActive(String tenantId, EntityType entityType);

    /**
     * Active relationship fields of any entity type in the tenant targeting {@code targetEntityType}.
     */
    List<FieldDefinition> findActiveRelationshipsTargeting(String tenantId, EntityType targetEntityType);
}
