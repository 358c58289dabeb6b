/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.api.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EntityTypeTest {

    @Test
    @DisplayName("Should normalize every spelling of a built-in module")
    void shouldNormalizeBuiltInAliases() {
        assertThat(EntityType.of("accounts")).isSameAs(EntityType.ACCOUNT);
        assertThat(EntityType.of("ACCOUNT")).isSameAs(EntityType.ACCOUNT);
        assertThat(EntityType.of(" Contact ")).isSameAs(EntityType.CONTACT);
        assertThat(EntityType.of("opportunities")).isSameAs(EntityType.OPPORTUNITY);
        assertThat(EntityType.of("leads").isBuiltIn()).isTrue();
    }

    @Test
    @DisplayName("Unknown names should become custom module slugs")
    void shouldTreatOtherNamesAsCustomSlugs() {
        EntityType projects = EntityType.of("projects");

        assertThat(projects.isCustom()).isTrue();
        assertThat(projects.key()).isEqualTo("projects");
        assertThat(projects).isEqualTo(EntityType.custom("projects"));
        assertThat(projects.toString()).isEqualTo("projects");
    }

    @Test
    @DisplayName("Should reject blank keys")
    void shouldRejectBlankKey() {
        assertThatThrownBy(() -> EntityType.custom(" "))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
