/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.jdbc;

import com.helios.crm.api.model.AttributeBag;
import com.helios.crm.api.model.EntityRecord;
import com.helios.crm.api.model.EntityType;
import com.helios.crm.store.EntityRepository;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Records of one entity type in the {@code crm_record} table.
 *
 * <p>Attribute bags are JSON text, so attribute-path queries fall back to the
 * scan-and-filter default of {@link EntityRepository#findByCustomAttribute}.
 */
public class JdbcEntityRepository implements EntityRepository {

    private final JdbcCrmStore store;
    private final EntityType entityType;

    JdbcEntityRepository(JdbcCrmStore store, EntityType entityType) {
        this.store = store;
        this.entityType = entityType;
    }

    @Override
    public EntityType entityType() {
        return entityType;
    }

    @Override
    public Optional<EntityRecord> findById(String tenantId, String id) {
        return store.transactions().withConnection("find " + entityType + " " + id, conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(store.sql("select_record"))) {
                stmt.setString(1, id);
                stmt.setString(2, tenantId);
                stmt.setString(3, entityType.key());
                try (ResultSet rs = stmt.executeQuery()) {
                    return rs.next() ? Optional.of(mapRecord(rs)) : Optional.<EntityRecord>empty();
                }
            }
        });
    }

    @Override
    public boolean exists(String tenantId, String id) {
        return store.transactions().withConnection("check " + entityType + " " + id, conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(store.sql("count_record"))) {
                stmt.setString(1, id);
                stmt.setString(2, tenantId);
                stmt.setString(3, entityType.key());
                try (ResultSet rs = stmt.executeQuery()) {
                    return rs.next() && rs.getInt(1) > 0;
                }
            }
        });
    }

    @Override
    public List<EntityRecord> findByIds(String tenantId, Collection<String> ids) {
        if (ids.isEmpty()) {
            return List.of();
        }
        List<String> requested = List.copyOf(new LinkedHashSet<>(ids));
        String sql = store.sql("select_records_by_ids")
            .replace("{ids}", String.join(", ", Collections.nCopies(requested.size(), "?")));

        Map<String, EntityRecord> byId = store.transactions().withConnection("find " + entityType + " by ids", conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                int idx = 1;
                stmt.setString(idx++, tenantId);
                stmt.setString(idx++, entityType.key());
                for (String id : requested) {
                    stmt.setString(idx++, id);
                }
                Map<String, EntityRecord> found = new HashMap<>();
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        EntityRecord record = mapRecord(rs);
                        found.put(record.id(), record);
                    }
                }
                return found;
            }
        });

        // caller's order
        List<EntityRecord> found = new ArrayList<>(byId.size());
        for (String id : requested) {
            EntityRecord record = byId.get(id);
            if (record != null) {
                found.add(record);
            }
        }
        return found;
    }

    @Override
    public List<EntityRecord> findAll(String tenantId) {
        return store.transactions().withConnection("list " + entityType, conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(store.sql("select_records_by_type"))) {
                stmt.setString(1, tenantId);
                stmt.setString(2, entityType.key());
                List<EntityRecord> records = new ArrayList<>();
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        records.add(mapRecord(rs));
                    }
                }
                return records;
            }
        });
    }

    @Override
    public boolean updateCustomAttributes(String tenantId, String id, AttributeBag custom) {
        return store.transactions().withConnection("update " + entityType + " " + id, conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(store.sql("update_record_custom"))) {
                stmt.setString(1, store.bags().encode(custom));
                stmt.setString(2, id);
                stmt.setString(3, tenantId);
                stmt.setString(4, entityType.key());
                return stmt.executeUpdate() > 0;
            }
        });
    }

    private EntityRecord mapRecord(ResultSet rs) throws SQLException {
        return new EntityRecord(
            rs.getString("id"),
            rs.getString("tenant_id"),
            entityType,
            store.bags().decode(rs.getString("core_json")),
            store.bags().decode(rs.getString("custom_json"))
        );
    }
}
