/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.relationship;

import com.helios.crm.api.IFieldDefinitionRegistry;
import com.helios.crm.api.model.AttributeValue;
import com.helios.crm.api.model.CleanupResult;
import com.helios.crm.api.model.EntityRecord;
import com.helios.crm.api.model.EntityType;
import com.helios.crm.api.model.FieldDefinition;
import com.helios.crm.store.EntityRepository;
import com.helios.crm.store.TransactionManager;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Nulls out relationship values that point at a deleted record.
 *
 * <p>Every active relationship field targeting the deleted type is processed in its
 * own nested transaction inside one outer transaction. A failing field rolls back only
 * its own updates and is reported in {@link CleanupResult#errors()}; the remaining
 * fields are still cleaned. Failure to commit the outer transaction propagates.
 *
 * <p><b>Cost:</b> O(referencing fields &times; records of each owning type) when the
 * store has no native attribute-path query, since each field is resolved by a scan.
 */
public class ReferentialIntegrityCleaner {

    private static final Logger logger = Logger.getLogger(ReferentialIntegrityCleaner.class.getName());

    private final IFieldDefinitionRegistry registry;
    private final ReferenceScanner scanner;
    private final TransactionManager transactions;

    public ReferentialIntegrityCleaner(IFieldDefinitionRegistry registry, ReferenceScanner scanner,
                                       TransactionManager transactions) {
        this.registry = registry;
        this.scanner = scanner;
        this.transactions = transactions;
    }

    /**
     * Run after the delete of {@code deletedId} has been committed.
     */
    public CleanupResult cleanup(String tenantId, EntityType deletedEntityType, String deletedId) {
        List<FieldDefinition> referencingFields;
        try {
            referencingFields = registry.fieldsReferencing(tenantId, deletedEntityType);
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Error loading fields referencing " + deletedEntityType, e);
            return new CleanupResult(0, List.of("Fatal error: " + describe(e)));
        }

        if (referencingFields.isEmpty()) {
            return new CleanupResult(0, List.of());
        }

        return transactions.inTransaction(() -> {
            int cleaned = 0;
            List<String> errors = new ArrayList<>();

            for (FieldDefinition field : referencingFields) {
                try {
                    cleaned += transactions.inTransaction(() -> cleanField(tenantId, field, deletedId));
                } catch (RuntimeException e) {
                    logger.log(Level.WARNING, "Failed to clean field " + field.fieldKey()
                        + " on " + field.entityType() + " in tenant " + tenantId, e);
                    errors.add("Failed to clean field " + field.fieldKey() + ": " + describe(e));
                }
            }

            logger.info(String.format("Cleaned %d references to %s %s in tenant %s (%d field errors)",
                cleaned, deletedEntityType, deletedId, tenantId, errors.size()));
            return new CleanupResult(cleaned, errors);
        });
    }

    private int cleanField(String tenantId, FieldDefinition field, String deletedId) {
        Optional<EntityRepository> owner = scanner.owningRepository(tenantId, field);
        if (owner.isEmpty()) {
            return 0;
        }
        EntityRepository repository = owner.get();

        int cleaned = 0;
        for (EntityRecord record : scanner.recordsReferencing(repository, tenantId, field, deletedId)) {
            boolean updated = repository.updateCustomAttributes(tenantId, record.id(),
                record.custom().with(field.fieldKey(), AttributeValue.NULL));
            if (updated) {
                cleaned++;
            }
        }
        return cleaned;
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
