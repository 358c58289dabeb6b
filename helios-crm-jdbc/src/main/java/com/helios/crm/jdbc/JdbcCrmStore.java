/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.jdbc;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.helios.crm.api.model.CustomModule;
import com.helios.crm.api.model.EntityRecord;
import com.helios.crm.api.model.EntityType;
import com.helios.crm.api.model.FieldDefinition;
import com.helios.crm.api.model.Segment;
import com.helios.crm.store.EntityRepository;
import com.helios.crm.store.EntityRepositoryRegistry;

import javax.sql.DataSource;
import java.sql.PreparedStatement;
import java.sql.Statement;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * JDBC-backed CRM persistence.
 *
 * <p>All SQL lives in {@code sql/queries.sql}; the schema in {@code sql/schema.sql}.
 * Every repository view shares one {@link JdbcTransactionManager}, so work started
 * through {@link #transactions()} sees its own uncommitted writes.
 *
 * <p>Usage example:
 * <pre>{@code
 * JdbcCrmStore store = new JdbcCrmStore(dataSource);
 * store.createSchema();
 * RelationshipService service = new RelationshipService(
 *     store.repositoryRegistry(), registry, store.transactions(), IdentifierFormat.uuid(), tracer);
 * }</pre>
 */
public class JdbcCrmStore {

    private static final Logger logger = Logger.getLogger(JdbcCrmStore.class.getName());

    private static final String SCHEMA_RESOURCE = "sql/schema.sql";
    private static final String QUERIES_RESOURCE = "sql/queries.sql";

    private final JdbcTransactionManager transactions;
    private final Map<String, String> queries;
    private final ObjectMapper mapper;
    private final AttributeBagCodec bags;

    private final JdbcCustomModuleCatalog modules;
    private final JdbcFieldDefinitionSource fieldDefinitions;
    private final JdbcSegmentStore segments;
    private final EntityRepositoryRegistry registry;

    public JdbcCrmStore(DataSource dataSource) {
        this.transactions = new JdbcTransactionManager(dataSource);
        this.queries = SqlLoader.loadQueries(QUERIES_RESOURCE);
        this.mapper = new ObjectMapper()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
        this.bags = new AttributeBagCodec(mapper);
        this.modules = new JdbcCustomModuleCatalog(this);
        this.fieldDefinitions = new JdbcFieldDefinitionSource(this);
        this.segments = new JdbcSegmentStore(this);
        List<EntityRepository> builtIns = List.of(
            new JdbcEntityRepository(this, EntityType.ACCOUNT),
            new JdbcEntityRepository(this, EntityType.CONTACT),
            new JdbcEntityRepository(this, EntityType.LEAD),
            new JdbcEntityRepository(this, EntityType.OPPORTUNITY)
        );
        this.registry = new EntityRepositoryRegistry(builtIns, modules,
            module -> new JdbcEntityRepository(this, module.entityType()));
    }

    /**
     * Creates the CRM tables if they do not exist.
     */
    public void createSchema() {
        List<String> statements = SqlLoader.loadStatements(SCHEMA_RESOURCE);
        transactions.withConnection("create schema", conn -> {
            try (Statement stmt = conn.createStatement()) {
                for (String sql : statements) {
                    stmt.execute(sql);
                }
            }
            return statements.size();
        });
        logger.info("CRM schema ready (" + statements.size() + " statements)");
    }

    public JdbcTransactionManager transactions() {
        return transactions;
    }

    public EntityRepositoryRegistry repositoryRegistry() {
        return registry;
    }

    public JdbcCustomModuleCatalog modules() {
        return modules;
    }

    public JdbcFieldDefinitionSource fieldDefinitions() {
        return fieldDefinitions;
    }

    public JdbcSegmentStore segments() {
        return segments;
    }

    /**
     * Inserts or replaces a record.
     */
    public EntityRecord save(EntityRecord record) {
        transactions.withConnection("save " + record.entityType() + " " + record.id(), conn -> {
            String core = bags.encode(record.core());
            String custom = bags.encode(record.custom());
            try (PreparedStatement update = conn.prepareStatement(sql("update_record"))) {
                update.setString(1, record.tenantId());
                update.setString(2, record.entityType().key());
                update.setString(3, core);
                update.setString(4, custom);
                update.setString(5, record.id());
                if (update.executeUpdate() > 0) {
                    return 1;
                }
            }
            try (PreparedStatement insert = conn.prepareStatement(sql("insert_record"))) {
                insert.setString(1, record.id());
                insert.setString(2, record.tenantId());
                insert.setString(3, record.entityType().key());
                insert.setString(4, core);
                insert.setString(5, custom);
                return insert.executeUpdate();
            }
        });
        return record;
    }

    public boolean delete(EntityType entityType, String tenantId, String id) {
        return transactions.withConnection("delete " + entityType + " " + id, conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(sql("delete_record"))) {
                stmt.setString(1, id);
                stmt.setString(2, tenantId);
                stmt.setString(3, entityType.key());
                return stmt.executeUpdate() > 0;
            }
        });
    }

    public CustomModule saveModule(CustomModule module) {
        modules.save(module);
        return module;
    }

    public FieldDefinition saveField(FieldDefinition definition) {
        fieldDefinitions.save(definition);
        return definition;
    }

    public Segment saveSegment(Segment segment) {
        segments.save(segment);
        return segment;
    }

    String sql(String name) {
        String sql = queries.get(name);
        if (sql == null) {
            throw new IllegalStateException("Unknown query: " + name);
        }
        return sql;
    }

    ObjectMapper mapper() {
        return mapper;
    }

    AttributeBagCodec bags() {
        return bags;
    }
}
