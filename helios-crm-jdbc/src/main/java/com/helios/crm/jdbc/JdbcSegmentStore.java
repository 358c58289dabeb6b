/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.helios.crm.api.model.RuleLogic;
import com.helios.crm.api.model.Segment;
import com.helios.crm.api.model.SegmentRule;
import com.helios.crm.api.model.SegmentType;
import com.helios.crm.api.model.TargetEntity;
import com.helios.crm.store.SegmentStore;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Segment definitions in {@code crm_segment}, membership rows in {@code crm_segment_member}.
 */
public class JdbcSegmentStore implements SegmentStore {

    private static final TypeReference<List<SegmentRule>> RULE_LIST = new TypeReference<>() { };
    private static final TypeReference<List<String>> ID_LIST = new TypeReference<>() { };

    private final JdbcCrmStore store;

    JdbcSegmentStore(JdbcCrmStore store) {
        this.store = store;
    }

    @Override
    public Optional<Segment> findById(String tenantId, String segmentId) {
        return load("select_segment", tenantId, segmentId);
    }

    /**
     * Reads the segment with {@code SELECT ... FOR UPDATE}; the row stays locked until
     * the enclosing transaction commits or rolls back.
     */
    @Override
    public Optional<Segment> findForUpdate(String tenantId, String segmentId) {
        return load("select_segment_for_update", tenantId, segmentId);
    }

    private Optional<Segment> load(String query, String tenantId, String segmentId) {
        return store.transactions().withConnection("load segment " + segmentId, conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(store.sql(query))) {
                stmt.setString(1, segmentId);
                stmt.setString(2, tenantId);
                try (ResultSet rs = stmt.executeQuery()) {
                    return rs.next() ? Optional.of(mapSegment(rs)) : Optional.<Segment>empty();
                }
            }
        });
    }

    @Override
    public void save(Segment segment) {
        store.transactions().runInTransaction(() -> store.transactions().withConnection("save segment " + segment.id(), conn -> {
            try (PreparedStatement delete = conn.prepareStatement(store.sql("delete_segment"));
                 PreparedStatement insert = conn.prepareStatement(store.sql("insert_segment"))) {
                delete.setString(1, segment.id());
                delete.executeUpdate();

                int idx = 1;
                insert.setString(idx++, segment.id());
                insert.setString(idx++, segment.tenantId());
                insert.setString(idx++, segment.name());
                insert.setString(idx++, segment.type().name());
                insert.setString(idx++, segment.targetEntity().name());
                insert.setString(idx++, write(segment.rules()));
                insert.setString(idx++, segment.ruleLogic().name());
                insert.setString(idx++, write(segment.staticMemberIds()));
                insert.setInt(idx++, segment.memberCount());
                if (segment.lastCalculatedAt() == null) {
                    insert.setNull(idx, Types.TIMESTAMP);
                } else {
                    insert.setTimestamp(idx, Timestamp.from(segment.lastCalculatedAt()));
                }
                return insert.executeUpdate();
            }
        }));
    }

    @Override
    public Set<String> memberIds(String segmentId) {
        return store.transactions().withConnection("load members of segment " + segmentId, conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(store.sql("select_member_ids"))) {
                stmt.setString(1, segmentId);
                Set<String> ids = new LinkedHashSet<>();
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        ids.add(rs.getString(1));
                    }
                }
                return ids;
            }
        });
    }

    /**
     * @return when the record joined the segment, or null if it is not a member
     */
    public Instant addedAt(String segmentId, String recordId) {
        return store.transactions().withConnection("load membership of " + recordId, conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(store.sql("select_member_added_at"))) {
                stmt.setString(1, segmentId);
                stmt.setString(2, recordId);
                try (ResultSet rs = stmt.executeQuery()) {
                    return rs.next() ? rs.getTimestamp(1).toInstant() : null;
                }
            }
        });
    }

    @Override
    public void removeMembers(String segmentId, Collection<String> recordIds) {
        if (recordIds.isEmpty()) {
            return;
        }
        store.transactions().withConnection("remove members from segment " + segmentId, conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(store.sql("delete_member"))) {
                for (String recordId : recordIds) {
                    stmt.setString(1, segmentId);
                    stmt.setString(2, recordId);
                    stmt.addBatch();
                }
                return stmt.executeBatch();
            }
        });
    }

    @Override
    public void addMembers(String segmentId, Collection<String> recordIds, Instant addedAt) {
        if (recordIds.isEmpty()) {
            return;
        }
        Set<String> existing = memberIds(segmentId);
        store.transactions().withConnection("add members to segment " + segmentId, conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(store.sql("insert_member"))) {
                Timestamp at = Timestamp.from(addedAt);
                int batched = 0;
                for (String recordId : recordIds) {
                    if (existing.contains(recordId)) {
                        continue;
                    }
                    stmt.setString(1, segmentId);
                    stmt.setString(2, recordId);
                    stmt.setTimestamp(3, at);
                    stmt.addBatch();
                    batched++;
                }
                return batched > 0 ? stmt.executeBatch() : new int[0];
            }
        });
    }

    @Override
    public void updateCalculation(String segmentId, int memberCount, Instant calculatedAt) {
        int updated = store.transactions().withConnection("update calculation of segment " + segmentId, conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(store.sql("update_segment_calculation"))) {
                stmt.setInt(1, memberCount);
                stmt.setTimestamp(2, Timestamp.from(calculatedAt));
                stmt.setString(3, segmentId);
                return stmt.executeUpdate();
            }
        });
        if (updated == 0) {
            throw new IllegalStateException("Segment disappeared during calculation: " + segmentId);
        }
    }

    private Segment mapSegment(ResultSet rs) throws SQLException {
        Timestamp calculatedAt = rs.getTimestamp("last_calculated_at");
        return new Segment(
            rs.getString("id"),
            rs.getString("tenant_id"),
            rs.getString("name"),
            SegmentType.valueOf(rs.getString("segment_type")),
            TargetEntity.fromString(rs.getString("target_entity")),
            read(rs.getString("rules_json"), RULE_LIST),
            RuleLogic.fromString(rs.getString("rule_logic")),
            read(rs.getString("static_members_json"), ID_LIST),
            rs.getInt("member_count"),
            calculatedAt != null ? calculatedAt.toInstant() : null
        );
    }

    private String write(Object value) {
        try {
            return store.mapper().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize segment column", e);
        }
    }

    private <T> List<T> read(String json, TypeReference<List<T>> type) throws SQLException {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return store.mapper().readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new SQLException("Corrupt segment column: " + json, e);
        }
    }
}
