/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.store.memory;

import com.helios.crm.api.model.AttributeBag;
import com.helios.crm.api.model.AttributeValue;
import com.helios.crm.api.model.CustomModule;
import com.helios.crm.api.model.EntityRecord;
import com.helios.crm.api.model.EntityType;
import com.helios.crm.store.EntityRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryCrmStoreTest {

    private static final String TENANT = "tenant-a";

    private InMemoryCrmStore store;
    private EntityRepository leads;

    @BeforeEach
    void setUp() {
        store = new InMemoryCrmStore();
        leads = store.repository(EntityType.LEAD);
        store.save(lead("lead-1", "acme"));
    }

    @Test
    @DisplayName("A failed transaction should roll back every write")
    void shouldRollBackOnFailure() {
        assertThatThrownBy(() -> store.inTransaction(() -> {
            leads.updateCustomAttributes(TENANT, "lead-1", AttributeBag.of(Map.of("primaryAccount", "globex")));
            store.save(lead("lead-2", "acme"));
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(leads.findById(TENANT, "lead-1").orElseThrow().customValue("primaryAccount").textValue())
            .isEqualTo("acme");
        assertThat(leads.exists(TENANT, "lead-2")).isFalse();
        assertThat(store.isInTransaction()).isFalse();
    }

    @Test
    @DisplayName("A failed nested transaction should only undo its own writes")
    void shouldRollBackToSavepoint() {
        store.runInTransaction(() -> {
            store.save(lead("lead-2", "acme"));
            assertThatThrownBy(() -> store.inTransaction(() -> {
                store.save(lead("lead-3", "acme"));
                throw new IllegalStateException("inner");
            })).hasMessage("inner");
            assertThat(store.isInTransaction()).isTrue();
        });

        assertThat(leads.findAll(TENANT)).extracting(EntityRecord::id).containsExactly("lead-1", "lead-2");
    }

    @Test
    @DisplayName("Repositories should be scoped to their tenant")
    void shouldScopeByTenant() {
        store.save(EntityRecord.builtIn("lead-b", "tenant-b", EntityType.LEAD, AttributeBag.empty(), AttributeBag.empty()));

        assertThat(leads.findAll(TENANT)).extracting(EntityRecord::id).containsExactly("lead-1");
        assertThat(leads.findById(TENANT, "lead-b")).isEmpty();
        assertThat(leads.findByIds(TENANT, List.of("lead-b", "lead-1"))).extracting(EntityRecord::id).containsExactly("lead-1");
        assertThat(leads.updateCustomAttributes(TENANT, "lead-b", AttributeBag.empty())).isFalse();
        assertThat(store.delete(EntityType.LEAD, TENANT, "lead-b")).isFalse();
    }

    @Test
    @DisplayName("Custom module records should resolve per tenant through the module catalog")
    void shouldResolveCustomModules() {
        store.saveModule(new CustomModule("m1", TENANT, "projects", "Projects"));
        store.save(EntityRecord.custom("p1", TENANT, "projects", AttributeBag.of(Map.of("name", "Apollo"))));

        assertThat(store.repositoryRegistry().resolve(TENANT, EntityType.custom("projects")))
            .hasValueSatisfying(repo -> assertThat(repo.exists(TENANT, "p1")).isTrue());
        assertThat(store.repositoryRegistry().resolve("tenant-b", EntityType.custom("projects"))).isEmpty();
        assertThat(leads.findByCustomAttribute(TENANT, "primaryAccount", AttributeValue.text("acme")))
            .extracting(EntityRecord::id).containsExactly("lead-1");
    }

    private static EntityRecord lead(String id, String accountId) {
        return EntityRecord.builtIn(id, TENANT, EntityType.LEAD,
            AttributeBag.of(Map.of("firstName", "Lee")), AttributeBag.of(Map.of("primaryAccount", accountId)));
    }
}
