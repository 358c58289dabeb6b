/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.api.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * One condition of a dynamic segment: {@code field operator value}.
 *
 * <p>{@code field} is a segment field alias (see the segment field catalog), not a
 * storage column. {@code operator} is kept as received so that unknown operators
 * can be reported instead of failing deserialization.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SegmentRule(
    @JsonProperty("field") String field,
    @JsonProperty("operator") String operator,
    @JsonProperty("value") Object value
) implements Serializable {

    public static SegmentRule of(String field, RuleOperator operator, Object value) {
        return new SegmentRule(field, operator.wireName(), value);
    }

    public static SegmentRule of(String field, RuleOperator operator) {
        return new SegmentRule(field, operator.wireName(), null);
    }
}
