/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.segment.service;

import com.helios.crm.api.ISegmentService;
import com.helios.crm.api.exceptions.SegmentNotFoundException;
import com.helios.crm.api.model.CalculationResult;
import com.helios.crm.api.model.RuleLogic;
import com.helios.crm.api.model.SegmentFieldOption;
import com.helios.crm.api.model.SegmentPreview;
import com.helios.crm.api.model.SegmentRule;
import com.helios.crm.api.model.TargetEntity;
import com.helios.crm.infra.config.CrmConfig;
import com.helios.crm.segment.compiler.SegmentFieldCatalog;
import com.helios.crm.segment.compiler.SegmentRuleValidator;
import com.helios.crm.segment.sync.SegmentMembershipSynchronizer;
import com.helios.crm.store.EntityRepositoryRegistry;
import com.helios.crm.store.SegmentStore;
import com.helios.crm.store.TransactionManager;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.time.Clock;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for segment recalculation and preview, invoked by users or a scheduler.
 */
public class SegmentService implements ISegmentService {

    private static final Logger logger = Logger.getLogger(SegmentService.class.getName());

    private final SegmentMembershipSynchronizer synchronizer;
    private final SegmentRuleValidator ruleValidator = new SegmentRuleValidator();
    private final Tracer tracer;

    public SegmentService(SegmentMembershipSynchronizer synchronizer, Tracer tracer) {
        this.synchronizer = synchronizer;
        this.tracer = tracer;
    }

    public SegmentService(SegmentStore segments, EntityRepositoryRegistry repositories,
                          TransactionManager transactions, CrmConfig config, Tracer tracer) {
        this(new SegmentMembershipSynchronizer(segments, repositories, transactions, config, Clock.systemUTC()),
            tracer);
    }

    @Override
    public CalculationResult calculateSegmentMembers(String tenantId, String segmentId) {
        Span span = tracer.spanBuilder("calculate-segment-members").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("tenantId", tenantId);
            span.setAttribute("segmentId", segmentId);

            CalculationResult result = synchronizer.recalculate(tenantId, segmentId);
            span.setAttribute("memberCount", result.memberCount());
            span.setAttribute("membersAdded", result.membersAdded());
            span.setAttribute("membersRemoved", result.membersRemoved());
            return result;

        } catch (SegmentNotFoundException e) {
            span.recordException(e);
            logger.warning(e.getMessage() + " (tenant " + tenantId + ")");
            throw e;
        } catch (RuntimeException e) {
            span.recordException(e);
            logger.log(Level.SEVERE, "Failed to recalculate segment " + segmentId, e);
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public SegmentPreview previewSegmentMembers(String tenantId, TargetEntity targetEntity,
                                                List<SegmentRule> rules, RuleLogic logic, int limit) {
        Span span = tracer.spanBuilder("preview-segment-members").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("tenantId", tenantId);
            span.setAttribute("targetEntity", targetEntity.name());
            span.setAttribute("ruleCount", rules == null ? 0 : rules.size());

            SegmentPreview preview = synchronizer.preview(tenantId, targetEntity, rules, logic, limit);
            span.setAttribute("count", preview.count());
            return preview;
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public List<SegmentFieldOption> availableFields(TargetEntity targetEntity) {
        return SegmentFieldCatalog.options(targetEntity);
    }

    @Override
    public List<String> validateRules(TargetEntity targetEntity, List<SegmentRule> rules) {
        return ruleValidator.validate(targetEntity, rules);
    }
}
