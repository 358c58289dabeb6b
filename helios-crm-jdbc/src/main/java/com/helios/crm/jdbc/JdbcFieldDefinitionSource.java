/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.helios.crm.api.model.EntityType;
import com.helios.crm.api.model.FieldDefinition;
import com.helios.crm.api.model.FieldKind;
import com.helios.crm.store.FieldDefinitionSource;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

public class JdbcFieldDefinitionSource implements FieldDefinitionSource {

    private static final Logger logger = Logger.getLogger(JdbcFieldDefinitionSource.class.getName());

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() { };

    private final JdbcCrmStore store;

    JdbcFieldDefinitionSource(JdbcCrmStore store) {
        this.store = store;
    }

    @Override
    public List<FieldDefinition> findActive(String tenantId, EntityType entityType) {
        return query("select_active_fields", tenantId, entityType);
    }

    @Override
    public List<FieldDefinition> findActiveRelationshipsTargeting(String tenantId, EntityType targetEntityType) {
        return query("select_active_relationships_targeting", tenantId, targetEntityType);
    }

    private List<FieldDefinition> query(String queryName, String tenantId, EntityType entityType) {
        return store.transactions().withConnection("load field definitions for " + entityType, conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(store.sql(queryName))) {
                stmt.setString(1, tenantId);
                stmt.setString(2, entityType.key());
                List<FieldDefinition> definitions = new ArrayList<>();
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        FieldDefinition definition = mapField(rs);
                        if (definition != null) {
                            definitions.add(definition);
                        }
                    }
                }
                return definitions;
            }
        });
    }

    void save(FieldDefinition definition) {
        store.transactions().runInTransaction(() -> store.transactions().withConnection("save field definition " + definition.fieldKey(), conn -> {
            try (PreparedStatement delete = conn.prepareStatement(store.sql("delete_field"));
                 PreparedStatement insert = conn.prepareStatement(store.sql("insert_field"))) {
                delete.setString(1, definition.id());
                delete.executeUpdate();

                int idx = 1;
                insert.setString(idx++, definition.id());
                insert.setString(idx++, definition.tenantId());
                insert.setString(idx++, definition.entityType().key());
                insert.setString(idx++, definition.fieldKey());
                insert.setString(idx++, definition.kind().name());
                insert.setBoolean(idx++, definition.required());
                insert.setString(idx++, writeOptions(definition.options()));
                if (definition.relatedEntityType() == null) {
                    insert.setNull(idx++, Types.VARCHAR);
                } else {
                    insert.setString(idx++, definition.relatedEntityType().key());
                }
                insert.setBoolean(idx, definition.active());
                return insert.executeUpdate();
            }
        }));
    }

    /**
     * @return the definition, or null for a catalog row with an unknown kind
     */
    private FieldDefinition mapField(ResultSet rs) throws SQLException {
        FieldKind kind = FieldKind.fromString(rs.getString("kind"));
        if (kind == null) {
            logger.warning("Ignoring field definition " + rs.getString("id") + " with unknown kind: " + rs.getString("kind"));
            return null;
        }
        String related = rs.getString("related_entity_type");
        return new FieldDefinition(
            rs.getString("id"),
            rs.getString("tenant_id"),
            EntityType.of(rs.getString("entity_type")),
            rs.getString("field_key"),
            kind,
            rs.getBoolean("required"),
            readOptions(rs.getString("options_json")),
            related != null ? EntityType.of(related) : null,
            rs.getBoolean("active")
        );
    }

    private String writeOptions(List<String> options) {
        try {
            return store.mapper().writeValueAsString(options);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize field options", e);
        }
    }

    private List<String> readOptions(String json) throws SQLException {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return store.mapper().readValue(json, STRING_LIST);
        } catch (JsonProcessingException e) {
            throw new SQLException("Corrupt options column: " + json, e);
        }
    }
}
