/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.segment.compiler;

import com.helios.crm.api.model.RuleOperator;
import com.helios.crm.api.model.SegmentRule;
import com.helios.crm.api.model.TargetEntity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SegmentRuleValidatorTest {

    private final SegmentRuleValidator validator = new SegmentRuleValidator();

    @Test
    @DisplayName("Valid rules should produce no errors")
    void shouldAcceptValidRules() {
        List<SegmentRule> rules = List.of(
            SegmentRule.of("industry", RuleOperator.EQUALS, "Software"),
            SegmentRule.of("phone", RuleOperator.IS_EMPTY));

        assertThat(validator.validate(TargetEntity.CONTACT, rules)).isEmpty();
        assertThat(validator.validate(TargetEntity.CONTACT, null)).isEmpty();
    }

    @Test
    @DisplayName("Should number each problem by rule position")
    void shouldDescribeProblems() {
        List<SegmentRule> rules = List.of(
            new SegmentRule("status", "equals", "NEW"),
            new SegmentRule("email", "matches", ".*"),
            new SegmentRule("email", "contains", null));

        assertThat(validator.validate(TargetEntity.CONTACT, rules)).containsExactly(
            "Rule 1: unknown field 'status' for CONTACT",
            "Rule 2: unknown operator 'matches'",
            "Rule 3: operator 'contains' requires a value");
        assertThat(validator.validate(TargetEntity.LEAD, rules.subList(0, 1))).isEmpty();
    }
}
