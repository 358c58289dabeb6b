/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.segment.compiler;

import com.helios.crm.api.model.RuleLogic;
import com.helios.crm.api.model.RuleOperator;
import com.helios.crm.api.model.SegmentRule;
import com.helios.crm.api.model.TargetEntity;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Translates segment rules into a {@link CompiledSegmentQuery}.
 *
 * <p>Rules naming an unknown field alias or operator are dropped with a warning and
 * listed in {@link CompiledSegmentQuery#skippedRules()}; the rest still apply.
 * Use {@link SegmentRuleValidator} to reject such rules when a segment is saved.
 */
public class RuleConditionCompiler {

    private static final Logger logger = Logger.getLogger(RuleConditionCompiler.class.getName());

    public CompiledSegmentQuery compile(List<SegmentRule> rules, RuleLogic logic,
                                        TargetEntity targetEntity, String tenantId) {
        List<CompiledCondition> conditions = new ArrayList<>();
        List<SegmentRule> skipped = new ArrayList<>();

        for (SegmentRule rule : rules == null ? List.<SegmentRule>of() : rules) {
            Optional<FieldPath> path = SegmentFieldCatalog.resolve(targetEntity, rule.field());
            if (path.isEmpty()) {
                logger.warning("Unknown field \"" + rule.field() + "\" for entity " + targetEntity + ", rule skipped");
                skipped.add(rule);
                continue;
            }

            RuleOperator operator = RuleOperator.fromString(rule.operator());
            if (operator == null) {
                logger.warning("Unknown operator: " + rule.operator() + ", rule on \"" + rule.field() + "\" skipped");
                skipped.add(rule);
                continue;
            }

            conditions.add(new CompiledCondition(rule, path.get(), operator));
        }

        return new CompiledSegmentQuery(tenantId, targetEntity, logic == null ? RuleLogic.AND : logic,
            conditions, skipped);
    }
}
