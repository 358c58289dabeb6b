/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.relationship;

import com.helios.crm.api.model.AttributeBag;
import com.helios.crm.api.model.CustomModule;
import com.helios.crm.api.model.EntityRecord;
import com.helios.crm.api.model.EntityType;
import com.helios.crm.api.model.FieldDefinition;
import com.helios.crm.api.model.RecordReference;
import com.helios.crm.api.model.RelationshipHop;
import com.helios.crm.infra.config.CrmConfig;
import com.helios.crm.registry.FieldDefinitionRegistry;
import com.helios.crm.store.memory.InMemoryCrmStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RelationshipPathResolverTest {

    private static final String TENANT = "tenant-a";

    private InMemoryCrmStore store;
    private RelationshipPathResolver resolver;

    @BeforeEach
    void setUp() {
        store = new InMemoryCrmStore();
        store.saveModule(new CustomModule("m1", TENANT, "projects", "Projects"));
        store.saveField(FieldDefinition.relationship("f1", TENANT, EntityType.CONTACT, "employer", EntityType.ACCOUNT));
        store.saveField(FieldDefinition.relationship("f2", TENANT, EntityType.ACCOUNT, "parent", EntityType.ACCOUNT));
        store.saveField(FieldDefinition.relationship("f3", TENANT, EntityType.custom("projects"), "client", EntityType.ACCOUNT));

        store.save(builtIn(EntityType.ACCOUNT, "holding", Map.of()));
        store.save(builtIn(EntityType.ACCOUNT, "acme", Map.of("parent", "holding")));
        store.save(builtIn(EntityType.ACCOUNT, "globex", Map.of("parent", "holding")));
        store.save(builtIn(EntityType.CONTACT, "alice", Map.of("employer", "acme")));
        store.save(builtIn(EntityType.CONTACT, "bob", Map.of("employer", "ghost")));
        store.save(EntityRecord.custom("apollo", TENANT, "projects", AttributeBag.of(Map.of("client", "acme"))));

        FieldDefinitionRegistry registry =
            new FieldDefinitionRegistry(store.fieldDefinitions(), CrmConfig.builderWithoutEnvironment().build());
        resolver = new RelationshipPathResolver(store.repositoryRegistry(), registry,
            new ReferenceScanner(store.repositoryRegistry()));
    }

    @Test
    @DisplayName("Should follow a single hop")
    void shouldFollowSingleHop() {
        List<EntityRecord> result = resolver.resolvePath(TENANT, EntityType.CONTACT, "alice",
            List.of(RelationshipHop.of("employer", "accounts")));

        assertThat(result).extracting(EntityRecord::id).containsExactly("acme");
    }

    @Test
    @DisplayName("Should follow multiple hops across types")
    void shouldFollowMultipleHops() {
        List<EntityRecord> result = resolver.resolvePath(TENANT, EntityType.custom("projects"), "apollo",
            List.of(RelationshipHop.of("client", "ACCOUNT"), RelationshipHop.of("parent", "account")));

        assertThat(result).extracting(EntityRecord::id).containsExactly("holding");
    }

    @Test
    @DisplayName("Should stop as soon as a hop yields nothing")
    void shouldStopOnDeadEnd() {
        assertThat(resolver.resolvePath(TENANT, EntityType.CONTACT, "bob",
            List.of(RelationshipHop.of("employer", "accounts"), RelationshipHop.of("parent", "accounts")))).isEmpty();
        assertThat(resolver.resolvePath(TENANT, EntityType.CONTACT, "nobody",
            List.of(RelationshipHop.of("employer", "accounts")))).isEmpty();
        assertThat(resolver.resolvePath(TENANT, EntityType.ACCOUNT, "holding",
            List.of(RelationshipHop.of("parent", "accounts")))).isEmpty();
    }

    @Test
    @DisplayName("Zero hops should resolve to nothing")
    void shouldReturnEmptyForNoHops() {
        assertThat(resolver.resolvePath(TENANT, EntityType.CONTACT, "alice", List.of())).isEmpty();
        assertThat(resolver.resolvePath(TENANT, EntityType.CONTACT, "alice", null)).isEmpty();
    }

    @Test
    @DisplayName("A missing start id should resolve to nothing")
    void shouldReturnEmptyForMissingStartId() {
        assertThat(resolver.resolvePath(TENANT, EntityType.CONTACT, null,
            List.of(RelationshipHop.of("employer", "accounts")))).isEmpty();
    }

    @Test
    @DisplayName("Should not cross tenants")
    void shouldStayInTenant() {
        assertThat(resolver.resolvePath("tenant-b", EntityType.CONTACT, "alice",
            List.of(RelationshipHop.of("employer", "accounts")))).isEmpty();
    }

    @Test
    @DisplayName("Should list every record pointing at a target")
    void shouldFindReferencingRecords() {
        List<RecordReference> references = resolver.getReferencingRecords(TENANT, EntityType.ACCOUNT, "acme");

        assertThat(references).containsExactlyInAnyOrder(
            new RecordReference(EntityType.CONTACT, "alice", "employer"),
            new RecordReference(EntityType.custom("projects"), "apollo", "client"));
        assertThat(resolver.getReferencingRecords(TENANT, EntityType.ACCOUNT, "holding"))
            .extracting(RecordReference::recordId)
            .containsExactlyInAnyOrder("acme", "globex");
        assertThat(resolver.getReferencingRecords(TENANT, EntityType.CONTACT, "alice")).isEmpty();
    }

    private static EntityRecord builtIn(EntityType type, String id, Map<String, ?> custom) {
        return EntityRecord.builtIn(id, TENANT, type, AttributeBag.empty(), AttributeBag.of(custom));
    }
}
