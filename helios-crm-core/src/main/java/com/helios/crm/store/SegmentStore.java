/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.store;

import com.helios.crm.api.model.Segment;

import java.time.Instant;
import java.util.Collection;
import java.util.Optional;
import java.util.Set;

/**
 * Persistence of segment definitions and their membership rows.
 *
 * <p>Membership is written only by the membership synchronizer, inside a transaction.
 */
public interface SegmentStore {

    Optional<Segment> findById(String tenantId, String segmentId);

    /**
     * Loads the segment and, where the store supports it, locks its row until the
     * enclosing transaction ends. Must be called inside a transaction.
     */
    default Optional<Segment> findForUpdate(String tenantId, String segmentId) {
        return findById(tenantId, segmentId);
    }

    void save(Segment segment);

    Set<String> memberIds(String segmentId);

    void removeMembers(String segmentId, Collection<String> recordIds);

    void addMembers(String segmentId, Collection<String> recordIds, Instant addedAt);

    void updateCalculation(String segmentId, int memberCount, Instant calculatedAt);
}
