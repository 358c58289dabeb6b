/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.store.memory;

import com.helios.crm.api.model.CustomModule;
import com.helios.crm.store.CustomRecordStore;
import com.helios.crm.store.EntityRepository;

/**
 * Custom module records share the store's record table, keyed by the module's entity type.
 */
public class InMemoryCustomRecordStore implements CustomRecordStore {

    private final InMemoryCrmStore store;

    InMemoryCustomRecordStore(InMemoryCrmStore store) {
        this.store = store;
    }

    @Override
    public EntityRepository forModule(CustomModule module) {
        return new InMemoryEntityRepository(store, module.entityType());
    }
}
