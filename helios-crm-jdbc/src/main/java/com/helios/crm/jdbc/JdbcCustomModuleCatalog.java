/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.jdbc;

import com.helios.crm.api.model.CustomModule;
import com.helios.crm.store.CustomModuleCatalog;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class JdbcCustomModuleCatalog implements CustomModuleCatalog {

    private final JdbcCrmStore store;

    JdbcCustomModuleCatalog(JdbcCrmStore store) {
        this.store = store;
    }

    @Override
    public Optional<CustomModule> findBySlug(String tenantId, String slug) {
        return store.transactions().withConnection("find custom module " + slug, conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(store.sql("select_module_by_slug"))) {
                stmt.setString(1, tenantId);
                stmt.setString(2, slug);
                try (ResultSet rs = stmt.executeQuery()) {
                    return rs.next() ? Optional.of(mapModule(rs)) : Optional.<CustomModule>empty();
                }
            }
        });
    }

    @Override
    public List<CustomModule> findAll(String tenantId) {
        return store.transactions().withConnection("list custom modules", conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(store.sql("select_modules"))) {
                stmt.setString(1, tenantId);
                List<CustomModule> modules = new ArrayList<>();
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        modules.add(mapModule(rs));
                    }
                }
                return modules;
            }
        });
    }

    void save(CustomModule module) {
        store.transactions().runInTransaction(() -> store.transactions().withConnection("save custom module " + module.slug(), conn -> {
            try (PreparedStatement delete = conn.prepareStatement(store.sql("delete_module"));
                 PreparedStatement insert = conn.prepareStatement(store.sql("insert_module"))) {
                delete.setString(1, module.id());
                delete.executeUpdate();

                insert.setString(1, module.id());
                insert.setString(2, module.tenantId());
                insert.setString(3, module.slug());
                insert.setString(4, module.name());
                return insert.executeUpdate();
            }
        }));
    }

    private static CustomModule mapModule(ResultSet rs) throws SQLException {
        return new CustomModule(rs.getString("id"), rs.getString("tenant_id"), rs.getString("slug"), rs.getString("name"));
    }
}
