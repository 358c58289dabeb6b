/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A named, tenant-scoped audience over Contacts or Leads.
 *
 * <p>Membership itself is stored separately and only changed by recalculation;
 * {@code memberCount} and {@code lastCalculatedAt} cache the last outcome.
 */
public record Segment(
    @JsonProperty("id") String id,
    @JsonProperty("tenant_id") String tenantId,
    @JsonProperty("name") String name,
    @JsonProperty("type") SegmentType type,
    @JsonProperty("target_entity") TargetEntity targetEntity,
    @JsonProperty("rules") List<SegmentRule> rules,
    @JsonProperty("rule_logic") RuleLogic ruleLogic,
    @JsonProperty("static_members") List<String> staticMemberIds,
    @JsonProperty("member_count") int memberCount,
    @JsonProperty("last_calculated_at") Instant lastCalculatedAt
) implements Serializable {

    public Segment {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(tenantId, "tenantId cannot be null");
        if (type == null) type = SegmentType.DYNAMIC;
        if (targetEntity == null) targetEntity = TargetEntity.CONTACT;
        if (ruleLogic == null) ruleLogic = RuleLogic.AND;
        rules = rules == null ? List.of() : List.copyOf(rules);
        staticMemberIds = staticMemberIds == null ? List.of() : List.copyOf(staticMemberIds);
    }

    public static Segment dynamic(String id, String tenantId, String name, TargetEntity target,
                                  List<SegmentRule> rules, RuleLogic logic) {
        return new Segment(id, tenantId, name, SegmentType.DYNAMIC, target, rules, logic, null, 0, null);
    }

    public static Segment ofStatic(String id, String tenantId, String name, TargetEntity target,
                                   List<String> memberIds) {
        return new Segment(id, tenantId, name, SegmentType.STATIC, target, null, null, memberIds, 0, null);
    }

    public boolean isStatic() {
        return type == SegmentType.STATIC;
    }

    public Segment withCalculation(int newMemberCount, Instant calculatedAt) {
        return new Segment(id, tenantId, name, type, targetEntity, rules, ruleLogic,
            staticMemberIds, newMemberCount, calculatedAt);
    }
}
