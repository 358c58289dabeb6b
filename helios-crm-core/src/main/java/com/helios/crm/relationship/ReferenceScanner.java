/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.relationship;

import com.helios.crm.api.model.AttributeValue;
import com.helios.crm.api.model.EntityRecord;
import com.helios.crm.api.model.FieldDefinition;
import com.helios.crm.store.EntityRepository;
import com.helios.crm.store.EntityRepositoryRegistry;

import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Finds the records whose relationship field holds a given identifier.
 *
 * <p>Shared by orphan cleanup and reverse lookup. The search is an attribute-path query
 * on the owning type's repository; without native support that is a scan of every
 * record of the type.
 */
public class ReferenceScanner {

    private static final Logger logger = Logger.getLogger(ReferenceScanner.class.getName());

    private final EntityRepositoryRegistry repositories;

    public ReferenceScanner(EntityRepositoryRegistry repositories) {
        this.repositories = repositories;
    }

    /**
     * Repository of the type that owns the field, or empty if that type no longer resolves.
     */
    public Optional<EntityRepository> owningRepository(String tenantId, FieldDefinition field) {
        Optional<EntityRepository> repository = repositories.resolve(tenantId, field.entityType());
        if (repository.isEmpty()) {
            logger.fine("Skipping field " + field.fieldKey() + ": owning type " + field.entityType()
                + " is not resolvable in tenant " + tenantId);
        }
        return repository;
    }

    public List<EntityRecord> recordsReferencing(String tenantId, FieldDefinition field, String targetId) {
        return owningRepository(tenantId, field)
            .map(repository -> recordsReferencing(repository, tenantId, field, targetId))
            .orElse(List.of());
    }

    List<EntityRecord> recordsReferencing(EntityRepository repository, String tenantId,
                                          FieldDefinition field, String targetId) {
        return repository.findByCustomAttribute(tenantId, field.fieldKey(), AttributeValue.text(targetId));
    }
}
