/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.relationship;

import com.helios.crm.api.IFieldDefinitionRegistry;
import com.helios.crm.api.model.EntityRecord;
import com.helios.crm.api.model.EntityType;
import com.helios.crm.api.model.FieldDefinition;
import com.helios.crm.api.model.RecordReference;
import com.helios.crm.api.model.RelationshipHop;
import com.helios.crm.store.EntityRepository;
import com.helios.crm.store.EntityRepositoryRegistry;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Forward traversal along relationship fields, and the reverse lookup of referencing records.
 *
 * <p>Relationship fields are single-valued: each hop from one record yields at most one
 * record. Persistence failures propagate to the caller.
 */
public class RelationshipPathResolver {

    private final EntityRepositoryRegistry repositories;
    private final IFieldDefinitionRegistry registry;
    private final ReferenceScanner scanner;

    public RelationshipPathResolver(EntityRepositoryRegistry repositories, IFieldDefinitionRegistry registry,
                                    ReferenceScanner scanner) {
        this.repositories = repositories;
        this.registry = registry;
        this.scanner = scanner;
    }

    /**
     * Follows one relationship field from one record.
     *
     * @return the referenced record, or an empty list if the source, the value or the target is missing
     */
    public List<EntityRecord> relatedOf(String tenantId, EntityType entityType, String id,
                                        String fieldKey, EntityType targetEntityType) {
        Optional<EntityRecord> source = repositories.resolve(tenantId, entityType)
            .flatMap(repository -> repository.findById(tenantId, id));
        if (source.isEmpty()) {
            return List.of();
        }

        String referencedId = source.get().customValue(fieldKey).textValue();
        if (RelationshipValidator.isBlankReference(referencedId)) {
            return List.of();
        }

        return repositories.resolve(tenantId, targetEntityType)
            .flatMap(repository -> repository.findById(tenantId, referencedId))
            .map(List::of)
            .orElse(List.of());
    }

    /**
     * Traverses {@code hops} left to right from the start record.
     *
     * @return distinct records of the last hop's target type, in discovery order;
     *         empty for zero hops, a missing start id, or as soon as a hop yields no candidates
     */
    public List<EntityRecord> resolvePath(String tenantId, EntityType startEntityType, String startId,
                                          List<RelationshipHop> hops) {
        if (hops == null || hops.isEmpty() || startId == null) {
            return List.of();
        }

        Set<String> currentIds = new LinkedHashSet<>(List.of(startId));
        EntityType currentType = startEntityType;

        for (RelationshipHop hop : hops) {
            Set<String> nextIds = new LinkedHashSet<>();
            for (String id : currentIds) {
                for (EntityRecord related : relatedOf(tenantId, currentType, id, hop.fieldKey(), hop.targetEntityType())) {
                    nextIds.add(related.id());
                }
            }

            if (nextIds.isEmpty()) {
                return List.of();
            }
            currentIds = nextIds;
            currentType = hop.targetEntityType();
        }

        Optional<EntityRepository> finalRepository = repositories.resolve(tenantId, currentType);
        if (finalRepository.isEmpty()) {
            return List.of();
        }
        return finalRepository.get().findByIds(tenantId, currentIds);
    }

    /**
     * Every record, of any type, whose relationship field currently holds {@code targetId}.
     */
    public List<RecordReference> getReferencingRecords(String tenantId, EntityType targetEntityType, String targetId) {
        List<RecordReference> references = new ArrayList<>();
        for (FieldDefinition field : registry.fieldsReferencing(tenantId, targetEntityType)) {
            for (EntityRecord record : scanner.recordsReferencing(tenantId, field, targetId)) {
                references.add(new RecordReference(field.entityType(), record.id(), field.fieldKey()));
            }
        }
        return references;
    }
}
