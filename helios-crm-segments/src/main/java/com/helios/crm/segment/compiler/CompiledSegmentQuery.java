/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.segment.compiler;

import com.helios.crm.api.model.EntityRecord;
import com.helios.crm.api.model.RuleLogic;
import com.helios.crm.api.model.SegmentRule;
import com.helios.crm.api.model.TargetEntity;

import java.util.List;

/**
 * Executable form of a segment's rule set for one tenant.
 *
 * <p>With no usable conditions the query matches the whole tenant population.
 *
 * @param skippedRules rules dropped during compilation (unknown field or operator)
 */
public record CompiledSegmentQuery(
    String tenantId,
    TargetEntity targetEntity,
    RuleLogic logic,
    List<CompiledCondition> conditions,
    List<SegmentRule> skippedRules
) {

    public CompiledSegmentQuery {
        conditions = List.copyOf(conditions);
        skippedRules = List.copyOf(skippedRules);
    }

    public boolean matchesEverything() {
        return conditions.isEmpty();
    }

    public boolean requiresRelatedRecords() {
        return conditions.stream().anyMatch(condition -> condition.path().isRelated());
    }

    public boolean matches(EntityRecord record, RelatedRecordLoader related) {
        if (conditions.isEmpty()) {
            return true;
        }
        return switch (logic) {
            case AND -> conditions.stream().allMatch(condition -> condition.test(record, related));
            case OR -> conditions.stream().anyMatch(condition -> condition.test(record, related));
        };
    }
}
