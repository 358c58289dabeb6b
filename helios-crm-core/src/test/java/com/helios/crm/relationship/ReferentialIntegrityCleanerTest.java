/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.relationship;

import com.helios.crm.api.IFieldDefinitionRegistry;
import com.helios.crm.api.model.AttributeBag;
import com.helios.crm.api.model.CleanupResult;
import com.helios.crm.api.model.CustomModule;
import com.helios.crm.api.model.EntityRecord;
import com.helios.crm.api.model.EntityType;
import com.helios.crm.api.model.FieldDefinition;
import com.helios.crm.infra.config.CrmConfig;
import com.helios.crm.registry.FieldDefinitionRegistry;
import com.helios.crm.store.CustomModuleCatalog;
import com.helios.crm.store.EntityRepository;
import com.helios.crm.store.EntityRepositoryRegistry;
import com.helios.crm.store.memory.InMemoryCrmStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ReferentialIntegrityCleanerTest {

    private static final String TENANT = "tenant-a";
    private static final String ACME_ID = "0b7c2f4e-1a2b-4c3d-9e8f-0123456789ab";
    private static final String GLOBEX_ID = "1c8d3a5f-2b3c-4d4e-8f90-123456789abc";

    private InMemoryCrmStore store;
    private FieldDefinitionRegistry registry;

    @BeforeEach
    void setUp() {
        store = new InMemoryCrmStore();
        store.saveField(FieldDefinition.relationship("f1", TENANT, EntityType.LEAD, "primaryAccount", EntityType.ACCOUNT));
        store.saveField(FieldDefinition.relationship("f2", TENANT, EntityType.CONTACT, "billingAccount", EntityType.ACCOUNT));
        registry = new FieldDefinitionRegistry(store.fieldDefinitions(), CrmConfig.builderWithoutEnvironment().build());

        store.save(account(ACME_ID));
        store.save(account(GLOBEX_ID));
        for (int i = 1; i <= 3; i++) {
            store.save(record(EntityType.LEAD, "lead-" + i, Map.of("primaryAccount", ACME_ID, "source", "web")));
        }
        store.save(record(EntityType.LEAD, "lead-4", Map.of("primaryAccount", GLOBEX_ID)));
        store.save(record(EntityType.CONTACT, "contact-1", Map.of("billingAccount", ACME_ID)));
    }

    private ReferentialIntegrityCleaner cleaner(IFieldDefinitionRegistry fields, EntityRepositoryRegistry repositories) {
        return new ReferentialIntegrityCleaner(fields, new ReferenceScanner(repositories), store);
    }

    @Test
    @DisplayName("Should null every reference to the deleted record and nothing else")
    void shouldNullOrphanedReferences() {
        store.delete(EntityType.ACCOUNT, TENANT, ACME_ID);

        CleanupResult result = cleaner(registry, store.repositoryRegistry()).cleanup(TENANT, EntityType.ACCOUNT, ACME_ID);

        assertThat(result.cleanedCount()).isEqualTo(4);
        assertThat(result.errors()).isEmpty();
        EntityRepository leads = store.repository(EntityType.LEAD);
        for (int i = 1; i <= 3; i++) {
            EntityRecord lead = leads.findById(TENANT, "lead-" + i).orElseThrow();
            assertThat(lead.custom().containsKey("primaryAccount")).isTrue();
            assertThat(lead.customValue("primaryAccount").isNull()).isTrue();
            assertThat(lead.customValue("source").textValue()).isEqualTo("web");
        }
        assertThat(leads.findById(TENANT, "lead-4").orElseThrow().customValue("primaryAccount").textValue())
            .isEqualTo(GLOBEX_ID);
        assertThat(store.repository(EntityType.CONTACT).findById(TENANT, "contact-1").orElseThrow()
            .customValue("billingAccount").isNull()).isTrue();
    }

    @Test
    @DisplayName("Should report zero when nothing references the deleted type")
    void shouldReturnZeroWithoutReferencingFields() {
        CleanupResult result = cleaner(registry, store.repositoryRegistry())
            .cleanup(TENANT, EntityType.OPPORTUNITY, ACME_ID);

        assertThat(result.cleanedCount()).isZero();
        assertThat(result.hasErrors()).isFalse();
    }

    @Test
    @DisplayName("Should be idempotent")
    void shouldBeIdempotent() {
        ReferentialIntegrityCleaner cleaner = cleaner(registry, store.repositoryRegistry());
        cleaner.cleanup(TENANT, EntityType.ACCOUNT, ACME_ID);

        assertThat(cleaner.cleanup(TENANT, EntityType.ACCOUNT, ACME_ID).cleanedCount()).isZero();
    }

    @Test
    @DisplayName("Should scan custom module records that reference the deleted record")
    void shouldCleanCustomModuleReferences() {
        store.saveModule(new CustomModule("m1", TENANT, "projects", "Projects"));
        store.saveField(FieldDefinition.relationship("f3", TENANT, EntityType.custom("projects"), "client", EntityType.ACCOUNT));
        store.save(EntityRecord.custom("project-1", TENANT, "projects", AttributeBag.of(Map.of("client", ACME_ID))));
        registry.invalidateTenant(TENANT);

        CleanupResult result = cleaner(registry, store.repositoryRegistry()).cleanup(TENANT, EntityType.ACCOUNT, ACME_ID);

        assertThat(result.cleanedCount()).isEqualTo(5);
        assertThat(store.repositoryRegistry().resolve(TENANT, EntityType.custom("projects")).orElseThrow()
            .findById(TENANT, "project-1").orElseThrow().customValue("client").isNull()).isTrue();
    }

    @Test
    @DisplayName("A failing field should be reported while the others are still cleaned")
    void shouldContinueAfterFieldFailure() {
        EntityRepository brokenContacts = mock(EntityRepository.class);
        when(brokenContacts.entityType()).thenReturn(EntityType.CONTACT);
        when(brokenContacts.findByCustomAttribute(anyString(), anyString(), any()))
            .thenThrow(new IllegalStateException("index unavailable"));
        EntityRepositoryRegistry repositories = new EntityRepositoryRegistry(
            List.of(store.repository(EntityType.LEAD), brokenContacts), store.modules(), store.customRecords());

        CleanupResult result = cleaner(registry, repositories).cleanup(TENANT, EntityType.ACCOUNT, ACME_ID);

        assertThat(result.cleanedCount()).isEqualTo(3);
        assertThat(result.errors()).containsExactly("Failed to clean field billingAccount: index unavailable");
    }

    @Test
    @DisplayName("A registry failure should be reported as a fatal error")
    void shouldReportRegistryFailure() {
        IFieldDefinitionRegistry failing = mock(IFieldDefinitionRegistry.class);
        when(failing.fieldsReferencing(TENANT, EntityType.ACCOUNT)).thenThrow(new IllegalStateException("catalog down"));

        CleanupResult result = cleaner(failing, store.repositoryRegistry()).cleanup(TENANT, EntityType.ACCOUNT, ACME_ID);

        assertThat(result.cleanedCount()).isZero();
        assertThat(result.errors()).containsExactly("Fatal error: catalog down");
    }

    @Test
    @DisplayName("Should leave other tenants untouched")
    void shouldRespectTenantBoundaries() {
        store.saveField(FieldDefinition.relationship("f9", "tenant-b", EntityType.LEAD, "primaryAccount", EntityType.ACCOUNT));
        store.save(record("tenant-b", EntityType.LEAD, "lead-b", Map.of("primaryAccount", ACME_ID)));

        cleaner(registry, store.repositoryRegistry()).cleanup(TENANT, EntityType.ACCOUNT, ACME_ID);

        assertThat(store.repository(EntityType.LEAD).findById("tenant-b", "lead-b").orElseThrow()
            .customValue("primaryAccount").textValue()).isEqualTo(ACME_ID);
    }

    private static EntityRecord account(String id) {
        return EntityRecord.builtIn(id, TENANT, EntityType.ACCOUNT, AttributeBag.of(Map.of("name", id)), AttributeBag.empty());
    }

    private static EntityRecord record(EntityType type, String id, Map<String, ?> custom) {
        return record(TENANT, type, id, custom);
    }

    private static EntityRecord record(String tenant, EntityType type, String id, Map<String, ?> custom) {
        return EntityRecord.builtIn(id, tenant, type, AttributeBag.empty(), AttributeBag.of(custom));
    }
}
