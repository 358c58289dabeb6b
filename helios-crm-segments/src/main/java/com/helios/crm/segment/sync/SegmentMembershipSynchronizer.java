/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.segment.sync;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import com.google.common.util.concurrent.Striped;
import com.helios.crm.api.exceptions.SegmentNotFoundException;
import com.helios.crm.api.model.CalculationResult;
import com.helios.crm.api.model.EntityRecord;
import com.helios.crm.api.model.RuleLogic;
import com.helios.crm.api.model.Segment;
import com.helios.crm.api.model.SegmentPreview;
import com.helios.crm.api.model.SegmentRule;
import com.helios.crm.api.model.TargetEntity;
import com.helios.crm.infra.config.CrmConfig;
import com.helios.crm.segment.compiler.CompiledSegmentQuery;
import com.helios.crm.segment.compiler.RuleConditionCompiler;
import com.helios.crm.store.EntityRepository;
import com.helios.crm.store.EntityRepositoryRegistry;
import com.helios.crm.store.SegmentStore;
import com.helios.crm.store.TransactionManager;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.Lock;
import java.util.logging.Logger;

/**
 * Recomputes segment membership and applies the difference.
 *
 * <p><b>Atomicity:</b> the segment read, the membership diff, removals, additions and
 * the count/timestamp update all run in one transaction.
 *
 * <p><b>Concurrency:</b> a top-level recalculation takes a striped lock keyed by
 * tenant and segment before opening its transaction and holds it until commit.
 * Different segments only contend when they hash to the same stripe. A call made
 * inside an open transaction skips the stripe and relies on the store: the segment
 * row is read with {@link SegmentStore#findForUpdate}, which the JDBC store turns
 * into a row lock so instances sharing one database are serialized too.
 */
public class SegmentMembershipSynchronizer {

    private static final Logger logger = Logger.getLogger(SegmentMembershipSynchronizer.class.getName());

    private final SegmentStore segments;
    private final EntityRepositoryRegistry repositories;
    private final TransactionManager transactions;
    private final RuleConditionCompiler compiler;
    private final SegmentQueryExecutor executor;
    private final CrmConfig config;
    private final Clock clock;
    private final Striped<Lock> segmentLocks;

    public SegmentMembershipSynchronizer(SegmentStore segments,
                                         EntityRepositoryRegistry repositories,
                                         TransactionManager transactions,
                                         CrmConfig config,
                                         Clock clock) {
        this.segments = segments;
        this.repositories = repositories;
        this.transactions = transactions;
        this.compiler = new RuleConditionCompiler();
        this.executor = new SegmentQueryExecutor(repositories);
        this.config = config;
        this.clock = clock;
        this.segmentLocks = Striped.lazyWeakLock(config.getSegmentLockStripes());
    }

    /**
     * @throws SegmentNotFoundException if the tenant has no such segment
     */
    public CalculationResult recalculate(String tenantId, String segmentId) {
        if (transactions.isInTransaction()) {
            // lock order is stripe, then transaction: never wait on a stripe from inside one
            return transactions.inTransaction(() -> apply(tenantId, segmentId));
        }
        Lock lock = segmentLocks.get(tenantId + ":" + segmentId);
        lock.lock();
        try {
            return transactions.inTransaction(() -> apply(tenantId, segmentId));
        } finally {
            lock.unlock();
        }
    }

    private CalculationResult apply(String tenantId, String segmentId) {
        Segment segment = segments.findForUpdate(tenantId, segmentId)
            .orElseThrow(() -> new SegmentNotFoundException(segmentId, tenantId));

        Set<String> target = segment.isStatic()
            ? existingStaticMembers(segment)
            : matchingIds(segment);
        Set<String> current = segments.memberIds(segmentId);

        Set<String> toAdd = ImmutableSet.copyOf(Sets.difference(target, current));
        Set<String> toRemove = ImmutableSet.copyOf(Sets.difference(current, target));
        Instant calculatedAt = clock.instant();

        if (!toRemove.isEmpty()) {
            segments.removeMembers(segmentId, toRemove);
        }
        if (!toAdd.isEmpty()) {
            segments.addMembers(segmentId, toAdd, calculatedAt);
        }
        segments.updateCalculation(segmentId, target.size(), calculatedAt);

        logger.info(String.format("Recalculated %s segment %s in tenant %s: %d members (+%d/-%d)",
            segment.type(), segmentId, tenantId, target.size(), toAdd.size(), toRemove.size()));
        return new CalculationResult(target.size(), toAdd.size(), toRemove.size(), calculatedAt);
    }

    private Set<String> matchingIds(Segment segment) {
        CompiledSegmentQuery query = compiler.compile(segment.rules(), segment.ruleLogic(),
            segment.targetEntity(), segment.tenantId());
        if (!query.skippedRules().isEmpty()) {
            logger.warning(String.format("Segment %s evaluated without %d invalid rule(s)",
                segment.id(), query.skippedRules().size()));
        }
        return idsOf(executor.execute(query));
    }

    private Set<String> existingStaticMembers(Segment segment) {
        EntityRepository repository = repositories.builtIn(segment.targetEntity().entityType())
            .orElseThrow(() -> new IllegalStateException("No repository registered for " + segment.targetEntity()));
        Set<String> requested = new LinkedHashSet<>(segment.staticMemberIds());
        return idsOf(repository.findByIds(segment.tenantId(), requested));
    }

    private static Set<String> idsOf(List<EntityRecord> records) {
        Set<String> ids = new LinkedHashSet<>();
        records.forEach(record -> ids.add(record.id()));
        return ids;
    }

    /**
     * Evaluates rules without reading or writing stored membership.
     *
     * @param limit requested sample size, clamped to the configured range
     */
    public SegmentPreview preview(String tenantId, TargetEntity targetEntity, List<SegmentRule> rules,
                                  RuleLogic logic, int limit) {
        CompiledSegmentQuery query = compiler.compile(rules, logic, targetEntity, tenantId);
        List<EntityRecord> matches = executor.execute(query);
        int sampleSize = config.clampPreviewLimit(limit);

        List<SegmentPreview.PreviewMember> sample = matches.stream()
            .limit(sampleSize)
            .map(record -> new SegmentPreview.PreviewMember(
                record.id(), record.displayName(), record.coreValue("email").textValue()))
            .toList();
        return new SegmentPreview(matches.size(), sample);
    }
}
