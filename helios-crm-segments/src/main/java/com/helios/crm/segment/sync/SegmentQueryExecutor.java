/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.segment.sync;

import com.helios.crm.api.model.EntityRecord;
import com.helios.crm.api.model.EntityType;
import com.helios.crm.segment.compiler.CompiledCondition;
import com.helios.crm.segment.compiler.CompiledSegmentQuery;
import com.helios.crm.segment.compiler.RelatedRecordLoader;
import com.helios.crm.store.EntityRepository;
import com.helios.crm.store.EntityRepositoryRegistry;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Runs a compiled query against the tenant's target population.
 *
 * <p>Related records (e.g. a contact's account) are fetched in one batch per related
 * type before filtering.
 */
public class SegmentQueryExecutor {

    private final EntityRepositoryRegistry repositories;

    public SegmentQueryExecutor(EntityRepositoryRegistry repositories) {
        this.repositories = repositories;
    }

    /**
     * @return matching records in repository order
     */
    public List<EntityRecord> execute(CompiledSegmentQuery query) {
        EntityType targetType = query.targetEntity().entityType();
        EntityRepository repository = repositories.builtIn(targetType)
            .orElseThrow(() -> new IllegalStateException("No repository registered for " + targetType));

        List<EntityRecord> population = repository.findAll(query.tenantId());
        if (query.matchesEverything()) {
            return population;
        }

        RelatedRecordLoader related = new RelatedRecordLoader(repositories, query.tenantId());
        if (query.requiresRelatedRecords()) {
            prefetchRelated(query, population, related);
        }

        return population.stream()
            .filter(record -> query.matches(record, related))
            .toList();
    }

    private static void prefetchRelated(CompiledSegmentQuery query, List<EntityRecord> population,
                                        RelatedRecordLoader related) {
        for (CompiledCondition condition : query.conditions()) {
            if (!condition.path().isRelated()) {
                continue;
            }
            Set<String> ids = new LinkedHashSet<>();
            for (EntityRecord record : population) {
                String id = record.coreValue(condition.path().relationAttribute()).textValue();
                if (id != null && !id.isEmpty()) {
                    ids.add(id);
                }
            }
            related.prefetch(condition.path().relatedType(), ids);
        }
    }
}
