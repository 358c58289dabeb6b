/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.segment.compiler;

import com.helios.crm.api.model.AttributeBag;
import com.helios.crm.api.model.EntityRecord;
import com.helios.crm.api.model.EntityType;
import com.helios.crm.api.model.RuleLogic;
import com.helios.crm.api.model.RuleOperator;
import com.helios.crm.api.model.SegmentRule;
import com.helios.crm.api.model.TargetEntity;
import com.helios.crm.store.memory.InMemoryCrmStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RuleConditionCompilerTest {

    private static final String TENANT = "tenant-a";

    private final RuleConditionCompiler compiler = new RuleConditionCompiler();
    private RelatedRecordLoader loader;

    @BeforeEach
    void setUp() {
        InMemoryCrmStore store = new InMemoryCrmStore();
        store.save(EntityRecord.builtIn("acme", TENANT, EntityType.ACCOUNT,
            AttributeBag.of(Map.of("name", "Acme", "industry", "Software")), AttributeBag.empty()));
        loader = new RelatedRecordLoader(store.repositoryRegistry(), TENANT);
    }

    @Test
    @DisplayName("Should skip rules with unknown fields or operators")
    void shouldSkipInvalidRules() {
        List<SegmentRule> rules = List.of(
            SegmentRule.of("email", RuleOperator.ENDS_WITH, "@acme.com"),
            new SegmentRule("favouriteColour", "equals", "blue"),
            new SegmentRule("title", "between", "a"),
            new SegmentRule("convertedAt", "is_empty", null)
        );

        CompiledSegmentQuery query = compiler.compile(rules, RuleLogic.AND, TargetEntity.CONTACT, TENANT);

        assertThat(query.conditions()).extracting(condition -> condition.rule().field()).containsExactly("email");
        assertThat(query.skippedRules()).hasSize(3);
        assertThat(query.requiresRelatedRecords()).isFalse();
    }

    @Test
    @DisplayName("Rules without usable conditions should match every record")
    void shouldMatchEverythingWithoutConditions() {
        CompiledSegmentQuery query = compiler.compile(
            List.of(new SegmentRule("unknown", "equals", 1)), null, TargetEntity.LEAD, TENANT);

        assertThat(query.matchesEverything()).isTrue();
        assertThat(query.logic()).isEqualTo(RuleLogic.AND);
        assertThat(query.matches(contact(Map.of()), loader)).isTrue();
    }

    @Test
    @DisplayName("Contact company should be read from the related account")
    void shouldReadRelatedAccount() {
        CompiledSegmentQuery query = compiler.compile(
            List.of(SegmentRule.of("company", RuleOperator.EQUALS, "Acme"),
                SegmentRule.of("industry", RuleOperator.CONTAINS, "soft")),
            RuleLogic.AND, TargetEntity.CONTACT, TENANT);

        assertThat(query.requiresRelatedRecords()).isTrue();
        assertThat(query.matches(contact(Map.of("accountId", "acme")), loader)).isTrue();
        assertThat(query.matches(contact(Map.of("accountId", "missing")), loader)).isFalse();
        assertThat(query.matches(contact(Map.of()), loader)).isFalse();
    }

    @Test
    @DisplayName("Lead company should be the lead's own attribute")
    void shouldReadLeadCompanyDirectly() {
        CompiledSegmentQuery query = compiler.compile(
            List.of(SegmentRule.of("company", RuleOperator.EQUALS, "Acme")), RuleLogic.AND, TargetEntity.LEAD, TENANT);

        EntityRecord lead = EntityRecord.builtIn("l1", TENANT, EntityType.LEAD,
            AttributeBag.of(Map.of("company", "Acme")), AttributeBag.empty());

        assertThat(query.requiresRelatedRecords()).isFalse();
        assertThat(query.matches(lead, loader)).isTrue();
    }

    @Test
    @DisplayName("OR logic should match when any condition holds")
    void shouldCombineWithOr() {
        CompiledSegmentQuery query = compiler.compile(
            List.of(SegmentRule.of("title", RuleOperator.STARTS_WITH, "vp"),
                SegmentRule.of("department", RuleOperator.EQUALS, "Sales")),
            RuleLogic.OR, TargetEntity.CONTACT, TENANT);

        assertThat(query.matches(contact(Map.of("title", "VP Marketing")), loader)).isTrue();
        assertThat(query.matches(contact(Map.of("department", "Sales")), loader)).isTrue();
        assertThat(query.matches(contact(Map.of("title", "Engineer")), loader)).isFalse();
    }

    private static EntityRecord contact(Map<String, ?> core) {
        return EntityRecord.builtIn("c1", TENANT, EntityType.CONTACT, AttributeBag.of(core), AttributeBag.empty());
    }
}
