/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.store;

import com.helios.crm.api.model.CustomModule;
import com.helios.crm.api.model.EntityType;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Dispatch table from entity type to repository.
 *
 * <p>Built-in types map to their own repository. Custom types are resolved per
 * tenant: the slug is looked up in the {@link CustomModuleCatalog} and the generic
 * {@link CustomRecordStore} supplies a repository scoped to that module.
 */
public class EntityRepositoryRegistry {

    private final Map<EntityType, EntityRepository> builtIns;
    private final CustomModuleCatalog modules;
    private final CustomRecordStore customRecords;

    public EntityRepositoryRegistry(Collection<? extends EntityRepository> builtInRepositories,
                                    CustomModuleCatalog modules,
                                    CustomRecordStore customRecords) {
        this.builtIns = new LinkedHashMap<>();
        for (EntityRepository repository : builtInRepositories) {
            if (!repository.entityType().isBuiltIn()) {
                throw new IllegalArgumentException("Not a built-in entity type: " + repository.entityType());
            }
            builtIns.put(repository.entityType(), repository);
        }
        this.modules = Objects.requireNonNull(modules, "modules");
        this.customRecords = Objects.requireNonNull(customRecords, "customRecords");
    }

    public Optional<EntityRepository> builtIn(EntityType entityType) {
        return Optional.ofNullable(builtIns.get(entityType));
    }

    public Optional<CustomModule> customModule(String tenantId, String slug) {
        return modules.findBySlug(tenantId, slug);
    }

    public EntityRepository forModule(CustomModule module) {
        return customRecords.forModule(module);
    }

    /**
     * Repository for any entity type, or empty when the type is not registered
     * (unknown built-in) or the tenant has no module with that slug.
     */
    public Optional<EntityRepository> resolve(String tenantId, EntityType entityType) {
        if (entityType.isBuiltIn()) {
            return builtIn(entityType);
        }
        return customModule(tenantId, entityType.key()).map(customRecords::forModule);
    }
}
