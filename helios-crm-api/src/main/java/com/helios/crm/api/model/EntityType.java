/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.io.Serializable;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Identifies the kind of record a relationship, field definition or segment refers to.
 *
 * <p>Two families exist:
 * <ul>
 *   <li><b>Built-in</b> types have fixed core attributes plus one schemaless extension bag.</li>
 *   <li><b>Custom</b> types are tenant-defined modules, addressed by their slug, whose
 *       attributes live entirely in a schemaless bag.</li>
 * </ul>
 *
 * <p>Built-in types are accepted under several spellings ({@code "accounts"},
 * {@code "ACCOUNT"}, {@code "account"}); {@link #of(String)} normalizes all of them
 * to the same constant. Any other name is treated as a custom module slug.
 *
 * @param key  canonical key (upper-case name for built-ins, slug for custom modules)
 * @param kind built-in or custom
 */
public record EntityType(String key, Kind kind) implements Serializable {

    public enum Kind {
        BUILT_IN,
        CUSTOM
    }

    public static final EntityType ACCOUNT = new EntityType("ACCOUNT", Kind.BUILT_IN);
    public static final EntityType CONTACT = new EntityType("CONTACT", Kind.BUILT_IN);
    public static final EntityType LEAD = new EntityType("LEAD", Kind.BUILT_IN);
    public static final EntityType OPPORTUNITY = new EntityType("OPPORTUNITY", Kind.BUILT_IN);

    private static final Map<String, EntityType> BUILT_IN_ALIASES = Map.of(
        "account", ACCOUNT, "accounts", ACCOUNT,
        "contact", CONTACT, "contacts", CONTACT,
        "lead", LEAD, "leads", LEAD,
        "opportunity", OPPORTUNITY, "opportunities", OPPORTUNITY
    );

    public EntityType {
        Objects.requireNonNull(kind, "kind cannot be null");
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Entity type key cannot be blank");
        }
    }

    /**
     * Resolves a module name to an entity type.
     *
     * @param name built-in module name in any supported spelling, or a custom module slug
     * @return the matching built-in constant, or a custom type for the slug
     */
    @JsonCreator
    public static EntityType of(String name) {
        Objects.requireNonNull(name, "Entity type name cannot be null");
        String trimmed = name.trim();
        EntityType builtIn = BUILT_IN_ALIASES.get(trimmed.toLowerCase(Locale.ROOT));
        return builtIn != null ? builtIn : custom(trimmed);
    }

    public static EntityType custom(String slug) {
        return new EntityType(slug, Kind.CUSTOM);
    }

    public boolean isBuiltIn() {
        return kind == Kind.BUILT_IN;
    }

    public boolean isCustom() {
        return kind == Kind.CUSTOM;
    }

    @JsonValue
    @Override
    public String toString() {
        return key;
    }
}
