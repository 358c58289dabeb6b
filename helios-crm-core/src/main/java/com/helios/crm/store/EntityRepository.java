/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.store;

import com.helios.crm.api.model.AttributeBag;
import com.helios.crm.api.model.AttributeValue;
import com.helios.crm.api.model.EntityRecord;
import com.helios.crm.api.model.EntityType;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Tenant-scoped access to the records of one entity type.
 *
 * <p>Implementations exist per built-in type and per custom module (see
 * {@link EntityRepositoryRegistry}). Failures are reported as
 * {@link com.helios.crm.api.exceptions.PersistenceException}.
 */
public interface EntityRepository {

    EntityType entityType();

    Optional<EntityRecord> findById(String tenantId, String id);

    default boolean exists(String tenantId, String id) {
        return findById(tenantId, id).isPresent();
    }

    /**
     * Loads the records with the given ids; unknown ids are skipped. Result order follows {@code ids}.
     */
    List<EntityRecord> findByIds(String tenantId, Collection<String> ids);

    List<EntityRecord> findAll(String tenantId);

    /**
     * Records whose custom bag holds {@code value} at {@code fieldKey}.
     *
     * <p>The default is a scan over {@link #findAll(String)}: O(records of the type).
     * Stores with native attribute-path queries should override it.
     */
    default List<EntityRecord> findByCustomAttribute(String tenantId, String fieldKey, AttributeValue value) {
        return findAll(tenantId).stream()
            .filter(record -> value.equals(record.customValue(fieldKey)))
            .toList();
    }

    /**
     * Replaces the custom bag of a record.
     *
     * @return true if the record existed and was updated
     */
    boolean updateCustomAttributes(String tenantId, String id, AttributeBag custom);
}
