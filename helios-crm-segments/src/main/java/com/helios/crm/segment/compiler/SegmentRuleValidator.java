/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.segment.compiler;

import com.helios.crm.api.model.RuleOperator;
import com.helios.crm.api.model.SegmentRule;
import com.helios.crm.api.model.TargetEntity;

import java.util.ArrayList;
import java.util.List;

/**
 * Save-time check of a rule set. Reports what evaluation would otherwise skip or
 * evaluate against a missing value.
 */
public class SegmentRuleValidator {

    public List<String> validate(TargetEntity targetEntity, List<SegmentRule> rules) {
        List<String> errors = new ArrayList<>();
        if (rules == null) {
            return errors;
        }

        for (int i = 0; i < rules.size(); i++) {
            SegmentRule rule = rules.get(i);
            String prefix = "Rule " + (i + 1) + ": ";

            if (SegmentFieldCatalog.resolve(targetEntity, rule.field()).isEmpty()) {
                errors.add(prefix + "unknown field '" + rule.field() + "' for " + targetEntity);
            }

            RuleOperator operator = RuleOperator.fromString(rule.operator());
            if (operator == null) {
                errors.add(prefix + "unknown operator '" + rule.operator() + "'");
            } else if (!operator.isUnary() && rule.value() == null) {
                errors.add(prefix + "operator '" + operator.wireName() + "' requires a value");
            }
        }
        return errors;
    }
}
