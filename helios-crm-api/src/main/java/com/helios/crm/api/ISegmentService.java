/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.api;

import com.helios.crm.api.model.CalculationResult;
import com.helios.crm.api.model.RuleLogic;
import com.helios.crm.api.model.SegmentFieldOption;
import com.helios.crm.api.model.SegmentPreview;
import com.helios.crm.api.model.SegmentRule;
import com.helios.crm.api.model.TargetEntity;

import java.util.List;

/**
 * Contract for evaluating segment rules and maintaining segment membership.
 *
 * <h2>Thread Safety</h2>
 * <p>Implementations are thread-safe. Concurrent recalculations of the same
 * segment are serialized; different segments proceed in parallel.
 */
public interface ISegmentService {

    /**
     * Recomputes a segment's membership and applies the difference atomically.
     *
     * @param tenantId the tenant scope
     * @param segmentId the segment to recalculate
     * @return final count plus the number of members added and removed
     * @throws com.helios.crm.api.exceptions.SegmentNotFoundException if the segment does not exist
     * @throws com.helios.crm.api.exceptions.TransactionException if the changes could not be committed
     */
    CalculationResult calculateSegmentMembers(String tenantId, String segmentId);

    /**
     * Evaluates an unsaved rule set without touching stored membership.
     *
     * @param limit sample size; values outside the configured range are clamped
     */
    SegmentPreview previewSegmentMembers(String tenantId, TargetEntity targetEntity,
                                         List<SegmentRule> rules, RuleLogic logic, int limit);

    /**
     * Field aliases that rules over the target may reference.
     */
    List<SegmentFieldOption> availableFields(TargetEntity targetEntity);

    /**
     * Reports rules that evaluation would skip (unknown field or operator) or run without a value.
     *
     * @return one message per problem; empty when every rule is usable
     */
    List<String> validateRules(TargetEntity targetEntity, List<SegmentRule> rules);
}
