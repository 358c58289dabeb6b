/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.segment.compiler;

import com.helios.crm.api.model.EntityType;

/**
 * Where a segment field alias reads its value.
 *
 * <p>A direct path reads {@code attribute} from the target record's core attributes.
 * A related path first follows the core attribute {@code relationAttribute} (an id) to
 * a record of {@code relatedType}, then reads {@code attribute} there.
 *
 * @param alias name used in rules
 * @param label display label
 * @param listed whether the alias is offered in field pickers
 */
public record FieldPath(
    String alias,
    String label,
    String attribute,
    String relationAttribute,
    EntityType relatedType,
    boolean listed
) {

    static FieldPath direct(String alias, String label) {
        return new FieldPath(alias, label, alias, null, null, true);
    }

    static FieldPath related(String alias, String relationAttribute, EntityType relatedType,
                             String attribute, String label) {
        return new FieldPath(alias, label, attribute, relationAttribute, relatedType, true);
    }

    FieldPath unlisted() {
        return new FieldPath(alias, label, attribute, relationAttribute, relatedType, false);
    }

    public boolean isRelated() {
        return relatedType != null;
    }
}
