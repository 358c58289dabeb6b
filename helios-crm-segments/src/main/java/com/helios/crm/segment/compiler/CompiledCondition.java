/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.segment.compiler;

import com.helios.crm.api.model.AttributeValue;
import com.helios.crm.api.model.EntityRecord;
import com.helios.crm.api.model.RuleOperator;
import com.helios.crm.api.model.SegmentRule;

/**
 * One usable rule: resolved field path, parsed operator and the rule's value.
 */
public record CompiledCondition(SegmentRule rule, FieldPath path, RuleOperator operator) {

    public boolean test(EntityRecord record, RelatedRecordLoader related) {
        return OperatorEvaluator.test(operator, valueOf(record, related), rule.value());
    }

    /**
     * Value the rule reads; NULL when a related record is missing.
     */
    AttributeValue valueOf(EntityRecord record, RelatedRecordLoader related) {
        if (!path.isRelated()) {
            return record.coreValue(path.attribute());
        }
        String relatedId = record.coreValue(path.relationAttribute()).textValue();
        return related.find(path.relatedType(), relatedId)
            .map(target -> target.coreValue(path.attribute()))
            .orElse(AttributeValue.NULL);
    }
}
