/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.api;

import com.helios.crm.api.model.CleanupResult;
import com.helios.crm.api.model.EntityRecord;
import com.helios.crm.api.model.EntityType;
import com.helios.crm.api.model.FieldDefinition;
import com.helios.crm.api.model.RecordReference;
import com.helios.crm.api.model.RelationshipHop;
import com.helios.crm.api.model.RelationshipValidationResult;
import com.helios.crm.api.model.ValidationResult;

import java.util.List;
import java.util.Map;

/**
 * Contract for keeping relationship fields consistent across built-in and custom entity types.
 *
 * <p>Relationship values are plain identifiers without storage-level foreign keys.
 * This service checks them at write time, repairs them at delete time and
 * follows them for traversal.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * // before saving a lead
 * RelationshipValidationResult check = service.validateRelationships(tenant, leadFields, payload);
 *
 * // after deleting an account
 * CleanupResult cleanup = service.cleanupOrphanedRelationships(tenant, EntityType.ACCOUNT, accountId);
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>Implementations are thread-safe. Operations are scoped to exactly one tenant.
 */
public interface IRelationshipService {

    /**
     * Checks that an identifier names an existing record of the target type.
     *
     * <p>An empty or absent identifier is valid and triggers no lookup.
     *
     * @param targetEntityType the type the relationship points to
     * @param id the candidate identifier, may be null
     * @param tenantId the tenant scope
     * @return the outcome; failures never throw
     */
    ValidationResult validateRelationshipTarget(EntityType targetEntityType, String id, String tenantId);

    /**
     * Checks every relationship field of a payload without short-circuiting.
     *
     * @param tenantId the tenant scope
     * @param fieldDefinitions definitions of the payload's entity type
     * @param recordData field key to raw value
     * @return aggregate result with one error per failing field key
     */
    RelationshipValidationResult validateRelationships(String tenantId,
                                                       List<FieldDefinition> fieldDefinitions,
                                                       Map<String, ?> recordData);

    /**
     * Nulls out every relationship value that still points at a deleted record.
     *
     * <p>Call after the delete has been committed. Per-field failures are reported in
     * {@link CleanupResult#errors()} and do not stop the remaining fields.
     *
     * @return number of records updated plus any per-field errors
     */
    CleanupResult cleanupOrphanedRelationships(String tenantId, EntityType deletedEntityType, String deletedId);

    /**
     * Follows a chain of relationship fields from a start record.
     *
     * @param hops ordered hops; an empty list yields an empty result
     * @return distinct records reached at the end of the chain
     */
    List<EntityRecord> resolveRelationshipPath(String tenantId, EntityType startEntityType,
                                               String startId, List<RelationshipHop> hops);

    /**
     * Lists every record whose relationship field currently points at the target.
     */
    List<RecordReference> getReferencingRecords(String tenantId, EntityType targetEntityType, String targetId);
}
