/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable, insertion-ordered mapping from field key to {@link AttributeValue}.
 *
 * <p>Holds the schemaless part of a record: the extension bag of a built-in record or
 * the whole data of a custom module record. Reads of absent keys return
 * {@link AttributeValue#NULL}; writes return a new bag.
 */
public final class AttributeBag implements Serializable {

    private static final AttributeBag EMPTY = new AttributeBag(new LinkedHashMap<>());

    private final Map<String, AttributeValue> values;

    private AttributeBag(LinkedHashMap<String, AttributeValue> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static AttributeBag empty() {
        return EMPTY;
    }

    /**
     * Builds a bag from untyped data, coercing each value through {@link AttributeValue#fromJava(Object)}.
     */
    @JsonCreator
    public static AttributeBag of(Map<String, ?> data) {
        if (data == null || data.isEmpty()) {
            return EMPTY;
        }
        LinkedHashMap<String, AttributeValue> copy = new LinkedHashMap<>();
        data.forEach((key, value) -> copy.put(Objects.requireNonNull(key, "field key"), AttributeValue.fromJava(value)));
        return new AttributeBag(copy);
    }

    public AttributeValue get(String fieldKey) {
        return values.getOrDefault(fieldKey, AttributeValue.NULL);
    }

    public boolean containsKey(String fieldKey) {
        return values.containsKey(fieldKey);
    }

    public AttributeBag with(String fieldKey, AttributeValue value) {
        Objects.requireNonNull(fieldKey, "fieldKey");
        LinkedHashMap<String, AttributeValue> copy = new LinkedHashMap<>(values);
        copy.put(fieldKey, value == null ? AttributeValue.NULL : value);
        return new AttributeBag(copy);
    }

    public AttributeBag with(String fieldKey, Object value) {
        return with(fieldKey, AttributeValue.fromJava(value));
    }

    public AttributeBag without(String fieldKey) {
        if (!values.containsKey(fieldKey)) {
            return this;
        }
        LinkedHashMap<String, AttributeValue> copy = new LinkedHashMap<>(values);
        copy.remove(fieldKey);
        return new AttributeBag(copy);
    }

    public Map<String, AttributeValue> asMap() {
        return values;
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * Plain-Java view used for serialization.
     */
    @JsonValue
    public Map<String, Object> toJavaMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        values.forEach((key, value) -> out.put(key, value.toJava()));
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AttributeBag other)) return false;
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
