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
import com.helios.crm.api.model.FieldKind;
import com.helios.crm.api.model.RelationshipValidationResult;
import com.helios.crm.api.model.ValidationResult;
import com.helios.crm.store.CustomModuleCatalog;
import com.helios.crm.store.EntityRepository;
import com.helios.crm.store.EntityRepositoryRegistry;
import com.helios.crm.store.memory.InMemoryCrmStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RelationshipValidatorTest {

    private static final String TENANT = "tenant-a";
    private static final String ACME_ID = "0b7c2f4e-1a2b-4c3d-9e8f-0123456789ab";
    private static final String PROJECT_ID = "5d6e7f80-aaaa-4bbb-8ccc-dddddddddddd";
    private static final String MISSING_ID = "ffffffff-ffff-4fff-8fff-ffffffffffff";

    private InMemoryCrmStore store;
    private RelationshipValidator validator;

    @BeforeEach
    void setUp() {
        store = new InMemoryCrmStore();
        store.save(EntityRecord.builtIn(ACME_ID, TENANT, EntityType.ACCOUNT,
            AttributeBag.of(Map.of("name", "Acme")), AttributeBag.empty()));
        store.saveModule(new CustomModule("m1", TENANT, "projects", "Projects"));
        store.save(EntityRecord.custom(PROJECT_ID, TENANT, "projects", AttributeBag.of(Map.of("name", "Apollo"))));
        validator = new RelationshipValidator(store.repositoryRegistry());
    }

    @Test
    @DisplayName("Blank references should always be valid")
    void shouldAcceptBlankReferences() {
        assertThat(validator.validate(EntityType.ACCOUNT, null, TENANT).valid()).isTrue();
        assertThat(validator.validate(EntityType.ACCOUNT, "", TENANT).valid()).isTrue();
        assertThat(validator.validate(EntityType.ACCOUNT, "null", TENANT).valid()).isTrue();
    }

    @Test
    @DisplayName("Should reject malformed identifiers before any lookup")
    void shouldRejectMalformedIds() {
        ValidationResult result = validator.validate(EntityType.ACCOUNT, "acme", TENANT);

        assertThat(result.valid()).isFalse();
        assertThat(result.error()).isEqualTo("Invalid ID format: acme");
    }

    @Test
    @DisplayName("Should validate built-in targets by existence in the tenant")
    void shouldValidateBuiltInTargets() {
        assertThat(validator.validate(EntityType.ACCOUNT, ACME_ID, TENANT).valid()).isTrue();
        assertThat(validator.validate(EntityType.ACCOUNT, ACME_ID.toUpperCase(), TENANT).error())
            .isEqualTo("ACCOUNT record not found: " + ACME_ID.toUpperCase());
        assertThat(validator.validate(EntityType.ACCOUNT, ACME_ID, "tenant-b").error())
            .isEqualTo("ACCOUNT record not found: " + ACME_ID);
        assertThat(validator.validate(EntityType.CONTACT, ACME_ID, TENANT).error())
            .isEqualTo("CONTACT record not found: " + ACME_ID);
    }

    @Test
    @DisplayName("Should validate custom module targets through the module catalog")
    void shouldValidateCustomTargets() {
        assertThat(validator.validate(EntityType.custom("projects"), PROJECT_ID, TENANT).valid()).isTrue();
        assertThat(validator.validate(EntityType.custom("projects"), MISSING_ID, TENANT).error())
            .isEqualTo("Custom module record not found: " + MISSING_ID);
        assertThat(validator.validate(EntityType.custom("tickets"), PROJECT_ID, TENANT).error())
            .isEqualTo("Custom module not found: tickets");
    }

    @Test
    @DisplayName("Should report an unregistered built-in type as an unknown module")
    void shouldReportUnknownModule() {
        EntityRepositoryRegistry accountsOnly = new EntityRepositoryRegistry(
            List.of(store.repository(EntityType.ACCOUNT)), store.modules(), store.customRecords());

        ValidationResult result = new RelationshipValidator(accountsOnly)
            .validate(EntityType.OPPORTUNITY, ACME_ID, TENANT);

        assertThat(result.error()).isEqualTo("Unknown module: OPPORTUNITY");
    }

    @Test
    @DisplayName("Lookup failures should become an invalid result")
    void shouldConvertLookupFailures() {
        EntityRepository broken = mock(EntityRepository.class);
        when(broken.entityType()).thenReturn(EntityType.ACCOUNT);
        when(broken.exists(anyString(), anyString())).thenThrow(new IllegalStateException("connection reset"));
        EntityRepositoryRegistry registry = new EntityRepositoryRegistry(
            List.of(broken), mock(CustomModuleCatalog.class), module -> broken);

        ValidationResult result = new RelationshipValidator(registry).validate(EntityType.ACCOUNT, ACME_ID, TENANT);

        assertThat(result.valid()).isFalse();
        assertThat(result.error()).isEqualTo(RelationshipValidator.LOOKUP_FAILED);
    }

    @Test
    @DisplayName("Should collect one error per invalid relationship field")
    void shouldValidateAllRelationshipFields() {
        List<FieldDefinition> fields = List.of(
            FieldDefinition.relationship("f1", TENANT, EntityType.LEAD, "primaryAccount", EntityType.ACCOUNT),
            FieldDefinition.relationship("f2", TENANT, EntityType.LEAD, "project", EntityType.custom("projects")),
            FieldDefinition.relationship("f3", TENANT, EntityType.LEAD, "partner", EntityType.ACCOUNT),
            FieldDefinition.of("f4", TENANT, EntityType.LEAD, "notes", FieldKind.TEXT, false)
        );
        Map<String, Object> data = new HashMap<>();
        data.put("primaryAccount", ACME_ID);
        data.put("project", MISSING_ID);
        data.put("partner", "not-a-uuid");
        data.put("notes", "not-a-uuid either");

        RelationshipValidationResult result = validator.validateAll(TENANT, fields, data);

        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).containsOnlyKeys("project", "partner");
        assertThat(result.errors().get("project")).isEqualTo("Custom module record not found: " + MISSING_ID);
        assertThat(result.errors().get("partner")).isEqualTo("Invalid ID format: not-a-uuid");
    }

    @Test
    @DisplayName("Absent and null relationship values should pass")
    void shouldSkipAbsentValues() {
        List<FieldDefinition> fields = List.of(
            FieldDefinition.relationship("f1", TENANT, EntityType.LEAD, "primaryAccount", EntityType.ACCOUNT));
        Map<String, Object> data = new HashMap<>();
        data.put("primaryAccount", null);

        assertThat(validator.validateAll(TENANT, fields, data).valid()).isTrue();
        assertThat(validator.validateAll(TENANT, fields, Map.of()).errors()).isEmpty();
    }
}
