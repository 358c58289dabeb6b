/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.store.memory;

import com.helios.crm.api.model.CustomModule;
import com.helios.crm.store.CustomModuleCatalog;

import java.util.List;
import java.util.Optional;

public class InMemoryCustomModuleCatalog implements CustomModuleCatalog {

    private final InMemoryCrmStore store;

    InMemoryCustomModuleCatalog(InMemoryCrmStore store) {
        this.store = store;
    }

    @Override
    public Optional<CustomModule> findBySlug(String tenantId, String slug) {
        return store.locked(() -> Optional.ofNullable(store.modules.get(InMemoryCrmStore.moduleKey(tenantId, slug))));
    }

    @Override
    public List<CustomModule> findAll(String tenantId) {
        return store.locked(() -> store.modules.values().stream()
            .filter(module -> module.tenantId().equals(tenantId))
            .toList());
    }
}
