/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.store.memory;

import com.helios.crm.api.model.CustomModule;
import com.helios.crm.api.model.EntityRecord;
import com.helios.crm.api.model.EntityType;
import com.helios.crm.api.model.FieldDefinition;
import com.helios.crm.api.model.Segment;
import com.helios.crm.store.EntityRepository;
import com.helios.crm.store.EntityRepositoryRegistry;
import com.helios.crm.store.TransactionManager;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * In-memory implementation of every persistence contract of the CRM core.
 *
 * <p>Data is lost on restart; intended for development and tests. For production
 * use the JDBC store.
 *
 * <p><b>Transactions:</b> a single reentrant lock serializes access, and each
 * (possibly nested) transaction takes a snapshot of the whole state on entry. A
 * failing unit restores its snapshot in place and rethrows, which gives savepoint
 * semantics for nested calls.
 *
 * <p><b>Thread Safety:</b> All operations are thread-safe.
 */
public class InMemoryCrmStore implements TransactionManager {

    private static final Logger logger = Logger.getLogger(InMemoryCrmStore.class.getName());

    private final ReentrantLock lock = new ReentrantLock();
    private final ThreadLocal<Deque<Snapshot>> openTransactions = ThreadLocal.withInitial(ArrayDeque::new);

    // entity type -> record id -> record
    final Map<EntityType, Map<String, EntityRecord>> records = new HashMap<>();
    // tenant:slug -> module
    final Map<String, CustomModule> modules = new LinkedHashMap<>();
    // definition id -> definition
    final Map<String, FieldDefinition> fieldDefinitions = new LinkedHashMap<>();
    final Map<String, Segment> segments = new LinkedHashMap<>();
    // segment id -> record id -> added at
    final Map<String, Map<String, Instant>> members = new HashMap<>();

    private final Map<EntityType, InMemoryEntityRepository> builtInRepositories = new LinkedHashMap<>();
    private final InMemoryCustomModuleCatalog moduleCatalog = new InMemoryCustomModuleCatalog(this);
    private final InMemoryCustomRecordStore customRecordStore = new InMemoryCustomRecordStore(this);
    private final InMemoryFieldDefinitionSource fieldDefinitionSource = new InMemoryFieldDefinitionSource(this);
    private final InMemorySegmentStore segmentStore = new InMemorySegmentStore(this);
    private final EntityRepositoryRegistry repositoryRegistry;

    public InMemoryCrmStore() {
        for (EntityType type : List.of(EntityType.ACCOUNT, EntityType.CONTACT, EntityType.LEAD, EntityType.OPPORTUNITY)) {
            builtInRepositories.put(type, new InMemoryEntityRepository(this, type));
        }
        this.repositoryRegistry = new EntityRepositoryRegistry(
            builtInRepositories.values(), moduleCatalog, customRecordStore);
    }

    // ========================================================================
    // TRANSACTIONS
    // ========================================================================

    @Override
    public <T> T inTransaction(Supplier<T> work) {
        lock.lock();
        Deque<Snapshot> stack = openTransactions.get();
        stack.push(snapshot());
        try {
            T result = work.get();
            stack.pop();
            return result;
        } catch (RuntimeException | Error e) {
            Snapshot savepoint = stack.pop();
            restore(savepoint);
            logger.fine("Rolled back in-memory transaction at depth " + (stack.size() + 1) + ": " + e);
            throw e;
        } finally {
            if (stack.isEmpty()) {
                openTransactions.remove();
            }
            lock.unlock();
        }
    }

    @Override
    public boolean isInTransaction() {
        return !openTransactions.get().isEmpty();
    }

    <T> T locked(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    void locked(Runnable action) {
        lock.lock();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }

    private Snapshot snapshot() {
        Map<EntityType, Map<String, EntityRecord>> recordsCopy = new HashMap<>();
        records.forEach((type, byId) -> recordsCopy.put(type, new LinkedHashMap<>(byId)));
        Map<String, Map<String, Instant>> membersCopy = new HashMap<>();
        members.forEach((segmentId, rows) -> membersCopy.put(segmentId, new LinkedHashMap<>(rows)));
        return new Snapshot(recordsCopy, new LinkedHashMap<>(modules), new LinkedHashMap<>(fieldDefinitions),
            new LinkedHashMap<>(segments), membersCopy);
    }

    private void restore(Snapshot snapshot) {
        records.clear();
        records.putAll(snapshot.records());
        modules.clear();
        modules.putAll(snapshot.modules());
        fieldDefinitions.clear();
        fieldDefinitions.putAll(snapshot.fieldDefinitions());
        segments.clear();
        segments.putAll(snapshot.segments());
        members.clear();
        members.putAll(snapshot.members());
    }

    private record Snapshot(
        Map<EntityType, Map<String, EntityRecord>> records,
        Map<String, CustomModule> modules,
        Map<String, FieldDefinition> fieldDefinitions,
        Map<String, Segment> segments,
        Map<String, Map<String, Instant>> members
    ) {
    }

    // ========================================================================
    // COLLABORATOR VIEWS
    // ========================================================================

    public EntityRepository repository(EntityType builtInType) {
        InMemoryEntityRepository repository = builtInRepositories.get(builtInType);
        if (repository == null) {
            throw new IllegalArgumentException("Not a built-in entity type: " + builtInType);
        }
        return repository;
    }

    public EntityRepositoryRegistry repositoryRegistry() {
        return repositoryRegistry;
    }

    public InMemoryCustomModuleCatalog modules() {
        return moduleCatalog;
    }

    public InMemoryCustomRecordStore customRecords() {
        return customRecordStore;
    }

    public InMemoryFieldDefinitionSource fieldDefinitions() {
        return fieldDefinitionSource;
    }

    public InMemorySegmentStore segments() {
        return segmentStore;
    }

    // ========================================================================
    // SEEDING / MUTATION
    // ========================================================================

    /**
     * Inserts or replaces a record of any type.
     */
    public EntityRecord save(EntityRecord record) {
        locked(() -> {
            records.computeIfAbsent(record.entityType(), type -> new LinkedHashMap<>()).put(record.id(), record);
        });
        return record;
    }

    /**
     * Deletes a record. Relationship values pointing at it are left untouched.
     */
    public boolean delete(EntityType entityType, String tenantId, String id) {
        return locked(() -> {
            Map<String, EntityRecord> byId = records.get(entityType);
            EntityRecord existing = byId == null ? null : byId.get(id);
            if (existing == null || !existing.tenantId().equals(tenantId)) {
                return false;
            }
            byId.remove(id);
            return true;
        });
    }

    public CustomModule saveModule(CustomModule module) {
        locked(() -> {
            modules.put(moduleKey(module.tenantId(), module.slug()), module);
        });
        return module;
    }

    public FieldDefinition saveField(FieldDefinition definition) {
        locked(() -> {
            fieldDefinitions.put(definition.id(), definition);
        });
        return definition;
    }

    public Segment saveSegment(Segment segment) {
        segmentStore.save(segment);
        return segment;
    }

    static String moduleKey(String tenantId, String slug) {
        return tenantId + ":" + slug;
    }
}
