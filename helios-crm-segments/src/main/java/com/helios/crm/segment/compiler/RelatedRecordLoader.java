/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.segment.compiler;

import com.helios.crm.api.model.EntityRecord;
import com.helios.crm.api.model.EntityType;
import com.helios.crm.store.EntityRepository;
import com.helios.crm.store.EntityRepositoryRegistry;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Loads the one-hop related records a rule evaluation needs, memoized for one execution.
 *
 * <p>Not thread-safe; create one per query execution.
 */
public class RelatedRecordLoader {

    private final EntityRepositoryRegistry repositories;
    private final String tenantId;
    private final Map<EntityType, Map<String, Optional<EntityRecord>>> loaded = new HashMap<>();

    public RelatedRecordLoader(EntityRepositoryRegistry repositories, String tenantId) {
        this.repositories = repositories;
        this.tenantId = tenantId;
    }

    /**
     * Batch-loads ids not seen yet, so later {@link #find} calls hit memory.
     */
    public void prefetch(EntityType entityType, Collection<String> ids) {
        Map<String, Optional<EntityRecord>> byId = loaded.computeIfAbsent(entityType, type -> new HashMap<>());
        List<String> missing = new ArrayList<>();
        for (String id : ids) {
            if (id != null && !byId.containsKey(id)) {
                missing.add(id);
            }
        }
        if (missing.isEmpty()) {
            return;
        }

        Optional<EntityRepository> repository = repositories.resolve(tenantId, entityType);
        missing.forEach(id -> byId.put(id, Optional.empty()));
        repository.ifPresent(repo -> repo.findByIds(tenantId, missing)
            .forEach(record -> byId.put(record.id(), Optional.of(record))));
    }

    public Optional<EntityRecord> find(EntityType entityType, String id) {
        if (id == null || id.isEmpty()) {
            return Optional.empty();
        }
        Map<String, Optional<EntityRecord>> byId = loaded.computeIfAbsent(entityType, type -> new HashMap<>());
        if (!byId.containsKey(id)) {
            prefetch(entityType, List.of(id));
        }
        return byId.get(id);
    }
}
