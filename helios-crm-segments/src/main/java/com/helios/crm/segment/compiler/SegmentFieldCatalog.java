/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.segment.compiler;

import com.helios.crm.api.model.EntityType;
import com.helios.crm.api.model.SegmentFieldOption;
import com.helios.crm.api.model.TargetEntity;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Field aliases available to segment rules, per target population.
 *
 * <p>Contact aliases {@code company}, {@code industry} and {@code accountType} read
 * the related Account through the contact's {@code accountId}.
 */
public final class SegmentFieldCatalog {

    static final String ACCOUNT_ID = "accountId";

    private static final Map<String, FieldPath> CONTACT_FIELDS = index(List.of(
        FieldPath.direct("email", "Email"),
        FieldPath.direct("firstName", "First Name"),
        FieldPath.direct("lastName", "Last Name"),
        FieldPath.direct("phone", "Phone"),
        FieldPath.direct("title", "Job Title"),
        FieldPath.direct("department", "Department"),
        FieldPath.related("company", ACCOUNT_ID, EntityType.ACCOUNT, "name", "Company (Account Name)"),
        FieldPath.related("industry", ACCOUNT_ID, EntityType.ACCOUNT, "industry", "Industry (Account)"),
        FieldPath.related("accountType", ACCOUNT_ID, EntityType.ACCOUNT, "type", "Account Type"),
        FieldPath.direct("isPrimary", "Is Primary Contact"),
        FieldPath.direct("createdAt", "Created Date"),
        FieldPath.direct("updatedAt", "Updated Date").unlisted()
    ));

    private static final Map<String, FieldPath> LEAD_FIELDS = index(List.of(
        FieldPath.direct("email", "Email"),
        FieldPath.direct("firstName", "First Name"),
        FieldPath.direct("lastName", "Last Name"),
        FieldPath.direct("phone", "Phone"),
        FieldPath.direct("title", "Job Title"),
        FieldPath.direct("company", "Company"),
        FieldPath.direct("source", "Lead Source"),
        FieldPath.direct("status", "Status"),
        FieldPath.direct("createdAt", "Created Date"),
        FieldPath.direct("updatedAt", "Updated Date").unlisted(),
        FieldPath.direct("convertedAt", "Converted Date").unlisted()
    ));

    private SegmentFieldCatalog() {
    }

    private static Map<String, FieldPath> index(List<FieldPath> paths) {
        Map<String, FieldPath> byAlias = new LinkedHashMap<>();
        paths.forEach(path -> byAlias.put(path.alias(), path));
        return Collections.unmodifiableMap(byAlias);
    }

    public static Optional<FieldPath> resolve(TargetEntity target, String alias) {
        if (alias == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(fieldsOf(target).get(alias));
    }

    private static Map<String, FieldPath> fieldsOf(TargetEntity target) {
        return switch (target) {
            case CONTACT -> CONTACT_FIELDS;
            case LEAD -> LEAD_FIELDS;
        };
    }

    /**
     * Aliases offered to rule editors, in display order.
     */
    public static List<SegmentFieldOption> options(TargetEntity target) {
        return fieldsOf(target).values().stream()
            .filter(FieldPath::listed)
            .map(path -> new SegmentFieldOption(path.alias(), path.label()))
            .toList();
    }
}
