/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.validation;

import com.helios.crm.api.model.AttributeBag;
import com.helios.crm.api.model.AttributeValue;
import com.helios.crm.api.model.EntityRecord;
import com.helios.crm.api.model.EntityType;
import com.helios.crm.api.model.FieldDefinition;
import com.helios.crm.api.model.FieldKind;
import com.helios.crm.api.model.FieldValidationResult;
import com.helios.crm.infra.config.CrmConfig;
import com.helios.crm.registry.FieldDefinitionRegistry;
import com.helios.crm.relationship.RelationshipValidator;
import com.helios.crm.store.memory.InMemoryCrmStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CustomFieldValidatorTest {

    private static final String TENANT = "tenant-a";
    private static final String ACME_ID = "0b7c2f4e-1a2b-4c3d-9e8f-0123456789ab";
    private static final String MISSING_ID = "ffffffff-ffff-4fff-8fff-ffffffffffff";

    private CustomFieldValidator validator;

    @BeforeEach
    void setUp() {
        InMemoryCrmStore store = new InMemoryCrmStore();
        store.save(EntityRecord.builtIn(ACME_ID, TENANT, EntityType.ACCOUNT,
            AttributeBag.of(Map.of("name", "Acme")), AttributeBag.empty()));

        store.saveField(FieldDefinition.of("f1", TENANT, EntityType.LEAD, "region", FieldKind.TEXT, true));
        store.saveField(FieldDefinition.of("f2", TENANT, EntityType.LEAD, "budget", FieldKind.CURRENCY, false));
        store.saveField(FieldDefinition.of("f3", TENANT, EntityType.LEAD, "probability", FieldKind.PERCENT, false));
        store.saveField(FieldDefinition.of("f4", TENANT, EntityType.LEAD, "followUp", FieldKind.DATE, false));
        store.saveField(new FieldDefinition("f5", TENANT, EntityType.LEAD, "tier", FieldKind.SELECT, false,
            List.of("gold", "silver"), null, true));
        store.saveField(new FieldDefinition("f6", TENANT, EntityType.LEAD, "channels", FieldKind.MULTISELECT, false,
            List.of("email", "phone"), null, true));
        store.saveField(FieldDefinition.of("f7", TENANT, EntityType.LEAD, "website", FieldKind.URL, false));
        store.saveField(FieldDefinition.of("f8", TENANT, EntityType.LEAD, "assistantEmail", FieldKind.EMAIL, false));
        store.saveField(FieldDefinition.of("f9", TENANT, EntityType.LEAD, "vip", FieldKind.BOOLEAN, false));
        store.saveField(FieldDefinition.relationship("f10", TENANT, EntityType.LEAD, "primaryAccount", EntityType.ACCOUNT));
        store.saveField(new FieldDefinition("f11", TENANT, EntityType.CONTACT, "billingAccount", FieldKind.RELATIONSHIP,
            true, null, EntityType.ACCOUNT, true));

        FieldDefinitionRegistry registry =
            new FieldDefinitionRegistry(store.fieldDefinitions(), CrmConfig.builderWithoutEnvironment().build());
        validator = new CustomFieldValidator(registry, new RelationshipValidator(store.repositoryRegistry()));
    }

    @Test
    @DisplayName("Should accept a well-formed payload and normalize dates")
    void shouldAcceptValidPayload() {
        Map<String, Object> data = new HashMap<>();
        data.put("region", "EMEA");
        data.put("budget", 12500);
        data.put("probability", 40);
        data.put("followUp", "2024-06-01");
        data.put("tier", "gold");
        data.put("channels", List.of("email"));
        data.put("website", "https://acme.example");
        data.put("assistantEmail", "pa@acme.example");
        data.put("vip", true);
        data.put("primaryAccount", ACME_ID);
        data.put("untracked", "kept as is");

        FieldValidationResult result = validator.validate(TENANT, EntityType.LEAD, data);

        assertThat(result.valid()).isTrue();
        assertThat(result.errors()).isEmpty();
        assertThat(result.data().get("followUp")).isEqualTo(AttributeValue.date(Instant.parse("2024-06-01T00:00:00Z")));
        assertThat(result.data().get("untracked").textValue()).isEqualTo("kept as is");
    }

    @Test
    @DisplayName("Should report one message per invalid field")
    void shouldReportKindErrors() {
        Map<String, Object> data = new HashMap<>();
        data.put("budget", "a lot");
        data.put("probability", 120);
        data.put("followUp", "next week");
        data.put("tier", "bronze");
        data.put("channels", "email");
        data.put("website", "acme");
        data.put("assistantEmail", "nobody");
        data.put("vip", "maybe");
        data.put("primaryAccount", "acme");

        FieldValidationResult result = validator.validate(TENANT, EntityType.LEAD, data);

        assertThat(result.valid()).isFalse();
        assertThat(result.errors())
            .containsEntry("region", "Required")
            .containsEntry("budget", "Expected number")
            .containsEntry("probability", "Number must be between 0 and 100")
            .containsEntry("followUp", "Invalid date")
            .containsEntry("tier", "Invalid option: expected one of gold, silver")
            .containsEntry("channels", "Expected array")
            .containsEntry("website", "Invalid url")
            .containsEntry("assistantEmail", "Invalid email")
            .containsEntry("vip", "Expected boolean")
            .containsEntry("primaryAccount", "Invalid uuid");
    }

    @Test
    @DisplayName("Should reject text longer than the field allows")
    void shouldRejectLongText() {
        FieldValidationResult result = validator.validate(TENANT, EntityType.LEAD,
            Map.of("region", "x".repeat(CustomFieldValidator.TEXT_MAX_LENGTH + 1)));

        assertThat(result.errors()).containsEntry("region", "String must contain at most 1000 character(s)");
    }

    @Test
    @DisplayName("Should run relationship checks once the shape is valid")
    void shouldCheckRelationshipTargets() {
        FieldValidationResult result = validator.validate(TENANT, EntityType.LEAD,
            Map.of("region", "EMEA", "primaryAccount", MISSING_ID));

        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).containsOnly(Map.entry("primaryAccount", "ACCOUNT record not found: " + MISSING_ID));
    }

    @Test
    @DisplayName("Should accept an explicit null for a required relationship but not an absent key")
    void shouldAcceptExplicitNullForRequiredRelationship() {
        Map<String, Object> cleared = new HashMap<>();
        cleared.put("billingAccount", null);

        FieldValidationResult explicitNull = validator.validate(TENANT, EntityType.CONTACT, cleared);
        FieldValidationResult absent = validator.validate(TENANT, EntityType.CONTACT, Map.of());

        assertThat(explicitNull.valid()).isTrue();
        assertThat(explicitNull.data().get("billingAccount").isNull()).isTrue();
        assertThat(absent.errors()).containsOnly(Map.entry("billingAccount", "Required"));
    }

    @Test
    @DisplayName("Should treat a null payload as empty")
    void shouldTreatNullPayloadAsEmpty() {
        FieldValidationResult result = validator.validate(TENANT, EntityType.LEAD, null);

        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).containsOnly(Map.entry("region", "Required"));
    }
}
