/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.service;

import com.helios.crm.api.IFieldDefinitionRegistry;
import com.helios.crm.api.IRelationshipService;
import com.helios.crm.api.model.CleanupResult;
import com.helios.crm.api.model.EntityRecord;
import com.helios.crm.api.model.EntityType;
import com.helios.crm.api.model.FieldDefinition;
import com.helios.crm.api.model.RecordReference;
import com.helios.crm.api.model.RelationshipHop;
import com.helios.crm.api.model.RelationshipValidationResult;
import com.helios.crm.api.model.ValidationResult;
import com.helios.crm.relationship.IdentifierFormat;
import com.helios.crm.relationship.ReferenceScanner;
import com.helios.crm.relationship.ReferentialIntegrityCleaner;
import com.helios.crm.relationship.RelationshipPathResolver;
import com.helios.crm.relationship.RelationshipValidator;
import com.helios.crm.store.EntityRepositoryRegistry;
import com.helios.crm.store.TransactionManager;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Entry point for relationship validation, orphan cleanup and traversal.
 *
 * <p>Wires the validator, scanner, cleaner and path resolver over one repository
 * registry and wraps every operation in a tracing span.
 */
public class RelationshipService implements IRelationshipService {

    private static final Logger logger = Logger.getLogger(RelationshipService.class.getName());

    private final RelationshipValidator validator;
    private final ReferentialIntegrityCleaner cleaner;
    private final RelationshipPathResolver pathResolver;
    private final Tracer tracer;

    public RelationshipService(EntityRepositoryRegistry repositories,
                               IFieldDefinitionRegistry registry,
                               TransactionManager transactions,
                               IdentifierFormat identifierFormat,
                               Tracer tracer) {
        ReferenceScanner scanner = new ReferenceScanner(repositories);
        this.validator = new RelationshipValidator(repositories, identifierFormat);
        this.cleaner = new ReferentialIntegrityCleaner(registry, scanner, transactions);
        this.pathResolver = new RelationshipPathResolver(repositories, registry, scanner);
        this.tracer = tracer;
    }

    @Override
    public ValidationResult validateRelationshipTarget(EntityType targetEntityType, String id, String tenantId) {
        Span span = tracer.spanBuilder("validate-relationship-target").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("tenantId", tenantId);
            span.setAttribute("targetEntityType", targetEntityType.key());

            ValidationResult result = validator.validate(targetEntityType, id, tenantId);
            span.setAttribute("valid", result.valid());
            return result;
        } finally {
            span.end();
        }
    }

    @Override
    public RelationshipValidationResult validateRelationships(String tenantId,
                                                              List<FieldDefinition> fieldDefinitions,
                                                              Map<String, ?> recordData) {
        Span span = tracer.spanBuilder("validate-relationships").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("tenantId", tenantId);
            span.setAttribute("fieldCount", fieldDefinitions.size());

            RelationshipValidationResult result = validator.validateAll(tenantId, fieldDefinitions, recordData);
            span.setAttribute("errorCount", result.errors().size());
            return result;
        } finally {
            span.end();
        }
    }

    @Override
    public CleanupResult cleanupOrphanedRelationships(String tenantId, EntityType deletedEntityType, String deletedId) {
        Span span = tracer.spanBuilder("cleanup-orphaned-relationships").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("tenantId", tenantId);
            span.setAttribute("deletedEntityType", deletedEntityType.key());
            span.setAttribute("deletedId", deletedId);

            CleanupResult result = cleaner.cleanup(tenantId, deletedEntityType, deletedId);
            span.setAttribute("cleaned", result.cleanedCount());
            if (result.hasErrors()) {
                span.addEvent("Cleanup finished with " + result.errors().size() + " error(s)");
            }
            return result;
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public List<EntityRecord> resolveRelationshipPath(String tenantId, EntityType startEntityType,
                                                      String startId, List<RelationshipHop> hops) {
        Span span = tracer.spanBuilder("resolve-relationship-path").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("tenantId", tenantId);
            span.setAttribute("startEntityType", startEntityType.key());
            span.setAttribute("hops", hops == null ? 0 : hops.size());

            List<EntityRecord> records = pathResolver.resolvePath(tenantId, startEntityType, startId, hops);
            span.setAttribute("resultCount", records.size());
            return records;
        } catch (RuntimeException e) {
            span.recordException(e);
            logger.warning("Failed to resolve relationship path from " + startEntityType + " " + startId
                + ": " + e.getMessage());
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public List<RecordReference> getReferencingRecords(String tenantId, EntityType targetEntityType, String targetId) {
        Span span = tracer.spanBuilder("get-referencing-records").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("tenantId", tenantId);
            span.setAttribute("targetEntityType", targetEntityType.key());

            List<RecordReference> references = pathResolver.getReferencingRecords(tenantId, targetEntityType, targetId);
            span.setAttribute("resultCount", references.size());
            return references;
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }
}
