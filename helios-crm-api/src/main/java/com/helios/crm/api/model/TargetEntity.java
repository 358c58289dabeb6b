/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.api.model;

/**
 * Populations a segment can be defined over.
 */
public enum TargetEntity {
    CONTACT(EntityType.CONTACT),
    LEAD(EntityType.LEAD);

    private final EntityType entityType;

    TargetEntity(EntityType entityType) {
        this.entityType = entityType;
    }

    public EntityType entityType() {
        return entityType;
    }

    /**
     * @param text the target name, case-insensitive
     * @return the target, or null if unknown
     */
    public static TargetEntity fromString(String text) {
        if (text == null) return null;
        try {
            return TargetEntity.valueOf(text.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
