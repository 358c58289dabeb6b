/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.store.memory;

import com.helios.crm.api.model.Segment;
import com.helios.crm.store.SegmentStore;

import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public class InMemorySegmentStore implements SegmentStore {

    private final InMemoryCrmStore store;

    InMemorySegmentStore(InMemoryCrmStore store) {
        this.store = store;
    }

    @Override
    public Optional<Segment> findById(String tenantId, String segmentId) {
        return store.locked(() -> Optional.ofNullable(store.segments.get(segmentId))
            .filter(segment -> segment.tenantId().equals(tenantId)));
    }

    @Override
    public void save(Segment segment) {
        store.locked(() -> {
            store.segments.put(segment.id(), segment);
        });
    }

    @Override
    public Set<String> memberIds(String segmentId) {
        return store.locked(() -> {
            Map<String, Instant> rows = store.members.get(segmentId);
            return rows == null ? Set.<String>of() : Set.copyOf(rows.keySet());
        });
    }

    /**
     * Time a record joined the segment, or null if it is not a member.
     */
    public Instant addedAt(String segmentId, String recordId) {
        return store.locked(() -> {
            Map<String, Instant> rows = store.members.get(segmentId);
            return rows == null ? null : rows.get(recordId);
        });
    }

    @Override
    public void removeMembers(String segmentId, Collection<String> recordIds) {
        store.locked(() -> {
            Map<String, Instant> rows = store.members.get(segmentId);
            if (rows != null) {
                recordIds.forEach(rows::remove);
            }
        });
    }

    @Override
    public void addMembers(String segmentId, Collection<String> recordIds, Instant addedAt) {
        store.locked(() -> {
            Map<String, Instant> rows = store.members.computeIfAbsent(segmentId, id -> new LinkedHashMap<>());
            for (String recordId : recordIds) {
                rows.putIfAbsent(recordId, addedAt);
            }
        });
    }

    @Override
    public void updateCalculation(String segmentId, int memberCount, Instant calculatedAt) {
        store.locked(() -> {
            Segment segment = store.segments.get(segmentId);
            if (segment == null) {
                throw new IllegalStateException("Segment not found: " + segmentId);
            }
            store.segments.put(segmentId, segment.withCalculation(memberCount, calculatedAt));
        });
    }
}
