/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.registry;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.helios.crm.api.IFieldDefinitionRegistry;
import com.helios.crm.api.model.EntityType;
import com.helios.crm.api.model.FieldDefinition;
import com.helios.crm.infra.config.CrmConfig;
import com.helios.crm.store.FieldDefinitionSource;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Caffeine-backed cache over the {@link FieldDefinitionSource}.
 *
 * <p>Two indexes are cached per tenant and entity type:
 * <ul>
 *   <li><b>by type</b>: active definitions owned by the type</li>
 *   <li><b>referencing</b>: active relationship fields of any type targeting it (the reverse index)</li>
 * </ul>
 *
 * <p>Entries expire after the configured TTL (5 minutes by default). A change to one
 * type can alter the reverse index of any other type, so {@link #invalidate} drops all
 * reverse entries of the tenant.
 *
 * <p><b>Thread Safety:</b> All operations are thread-safe. One instance per process.
 */
public class FieldDefinitionRegistry implements IFieldDefinitionRegistry {

    private static final Logger logger = Logger.getLogger(FieldDefinitionRegistry.class.getName());

    private final FieldDefinitionSource source;
    private final Cache<CacheKey, List<FieldDefinition>> byType;
    private final Cache<CacheKey, List<FieldDefinition>> referencing;

    public FieldDefinitionRegistry(FieldDefinitionSource source, CrmConfig config) {
        this(source, config, Ticker.systemTicker());
    }

    /**
     * @param ticker time source for expiry; tests pass a manually advanced ticker
     */
    public FieldDefinitionRegistry(FieldDefinitionSource source, CrmConfig config, Ticker ticker) {
        this.source = Objects.requireNonNull(source, "source");
        this.byType = buildCache(config, ticker);
        this.referencing = buildCache(config, ticker);

        logger.info(String.format("Field definition registry initialized: ttl=%s, maxSize=%d",
            config.getFieldCacheTtl(), config.getFieldCacheMaxSize()));
    }

    private static Cache<CacheKey, List<FieldDefinition>> buildCache(CrmConfig config, Ticker ticker) {
        Caffeine<Object, Object> builder = Caffeine.newBuilder()
            .maximumSize(config.getFieldCacheMaxSize())
            .expireAfterWrite(config.getFieldCacheTtl().toNanos(), TimeUnit.NANOSECONDS)
            .ticker(ticker);

        if (config.isFieldCacheRecordStats()) {
            builder.recordStats();
        }
        return builder.build();
    }

    @Override
    public List<FieldDefinition> fieldsOfType(String tenantId, EntityType entityType) {
        return byType.get(new CacheKey(tenantId, entityType), key -> {
            List<FieldDefinition> loaded = List.copyOf(source.findActive(key.tenantId(), key.entityType()));
            if (logger.isLoggable(Level.FINE)) {
                logger.fine(String.format("Loaded %d field definitions for %s/%s",
                    loaded.size(), key.tenantId(), key.entityType()));
            }
            return loaded;
        });
    }

    @Override
    public List<FieldDefinition> fieldsReferencing(String tenantId, EntityType targetEntityType) {
        return referencing.get(new CacheKey(tenantId, targetEntityType), key -> {
            List<FieldDefinition> loaded = List.copyOf(
                source.findActiveRelationshipsTargeting(key.tenantId(), key.entityType()));
            if (logger.isLoggable(Level.FINE)) {
                logger.fine(String.format("Loaded %d relationship fields referencing %s/%s",
                    loaded.size(), key.tenantId(), key.entityType()));
            }
            return loaded;
        });
    }

    @Override
    public void invalidate(String tenantId, EntityType entityType) {
        byType.invalidate(new CacheKey(tenantId, entityType));
        referencing.invalidateAll(keysOfTenant(referencing, tenantId));
        logger.fine("Invalidated field definitions for " + tenantId + "/" + entityType);
    }

    @Override
    public void invalidateTenant(String tenantId) {
        byType.invalidateAll(keysOfTenant(byType, tenantId));
        referencing.invalidateAll(keysOfTenant(referencing, tenantId));
        logger.fine("Invalidated all field definitions for tenant " + tenantId);
    }

    private static List<CacheKey> keysOfTenant(Cache<CacheKey, ?> cache, String tenantId) {
        return cache.asMap().keySet().stream()
            .filter(key -> key.tenantId().equals(tenantId))
            .toList();
    }

    /**
     * Statistics of the by-type index; all zero unless stats recording is enabled.
     */
    public CacheStats stats() {
        return byType.stats();
    }

    private record CacheKey(String tenantId, EntityType entityType) {
        CacheKey {
            Objects.requireNonNull(tenantId, "tenantId");
            Objects.requireNonNull(entityType, "entityType");
        }
    }
}
