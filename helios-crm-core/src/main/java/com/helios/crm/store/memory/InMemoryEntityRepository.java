/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.store.memory;

import com.helios.crm.api.model.AttributeBag;
import com.helios.crm.api.model.EntityRecord;
import com.helios.crm.api.model.EntityType;
import com.helios.crm.store.EntityRepository;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Repository over the records of one entity type held by an {@link InMemoryCrmStore}.
 */
public class InMemoryEntityRepository implements EntityRepository {

    private final InMemoryCrmStore store;
    private final EntityType entityType;

    InMemoryEntityRepository(InMemoryCrmStore store, EntityType entityType) {
        this.store = store;
        this.entityType = entityType;
    }

    @Override
    public EntityType entityType() {
        return entityType;
    }

    @Override
    public Optional<EntityRecord> findById(String tenantId, String id) {
        return store.locked(() -> Optional.ofNullable(byId().get(id))
            .filter(record -> record.tenantId().equals(tenantId)));
    }

    @Override
    public List<EntityRecord> findByIds(String tenantId, Collection<String> ids) {
        return store.locked(() -> {
            Map<String, EntityRecord> byId = byId();
            List<EntityRecord> found = new ArrayList<>(ids.size());
            for (String id : ids) {
                EntityRecord record = byId.get(id);
                if (record != null && record.tenantId().equals(tenantId)) {
                    found.add(record);
                }
            }
            return found;
        });
    }

    @Override
    public List<EntityRecord> findAll(String tenantId) {
        return store.locked(() -> byId().values().stream()
            .filter(record -> record.tenantId().equals(tenantId))
            .toList());
    }

    @Override
    public boolean updateCustomAttributes(String tenantId, String id, AttributeBag custom) {
        return store.locked(() -> {
            Map<String, EntityRecord> byId = byId();
            EntityRecord existing = byId.get(id);
            if (existing == null || !existing.tenantId().equals(tenantId)) {
                return false;
            }
            byId.put(id, existing.withCustom(custom));
            return true;
        });
    }

    private Map<String, EntityRecord> byId() {
        return store.records.computeIfAbsent(entityType, type -> new LinkedHashMap<>());
    }
}
