/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.helios.crm.api.model.AttributeBag;
import com.helios.crm.api.model.AttributeValue;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON column format for {@link AttributeBag}.
 *
 * <p>Each value is stored with its tag so that numbers, dates and text survive a
 * round trip unchanged:
 * <pre>
 * {"industry": {"type": "TEXT", "value": "Software"},
 *  "score":    {"type": "NUMBER", "value": 42},
 *  "primaryAccount": {"type": "NULL"}}
 * </pre>
 */
final class AttributeBagCodec {

    private final ObjectMapper mapper;

    AttributeBagCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    String encode(AttributeBag bag) {
        ObjectNode root = mapper.createObjectNode();
        bag.asMap().forEach((key, value) -> root.set(key, encodeValue(value)));
        try {
            return mapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize attribute bag", e);
        }
    }

    AttributeBag decode(String json) {
        if (json == null || json.isBlank()) {
            return AttributeBag.empty();
        }
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Corrupt attribute bag column", e);
        }

        Map<String, AttributeValue> values = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            values.put(field.getKey(), decodeValue(field.getValue()));
        }
        return AttributeBag.of(values);
    }

    private ObjectNode encodeValue(AttributeValue value) {
        ObjectNode node = mapper.createObjectNode();
        node.put("type", value.type().name());
        switch (value.type()) {
            case NULL -> { }
            case TEXT -> node.put("value", value.textValue());
            case NUMBER -> node.put("value", value.numberValue());
            case BOOLEAN -> node.put("value", value.booleanValue());
            case DATE -> node.put("value", value.dateValue().toString());
            case LIST -> {
                ArrayNode items = node.putArray("value");
                value.listValue().forEach(item -> items.add(encodeValue(item)));
            }
        }
        return node;
    }

    private AttributeValue decodeValue(JsonNode node) {
        AttributeValue.ValueType type = AttributeValue.ValueType.valueOf(node.path("type").asText("NULL"));
        JsonNode payload = node.get("value");
        return switch (type) {
            case NULL -> AttributeValue.NULL;
            case TEXT -> AttributeValue.text(payload.asText());
            case NUMBER -> AttributeValue.number(payload.decimalValue());
            case BOOLEAN -> AttributeValue.bool(payload.asBoolean());
            case DATE -> AttributeValue.date(Instant.parse(payload.asText()));
            case LIST -> {
                List<AttributeValue> items = new ArrayList<>();
                payload.forEach(item -> items.add(decodeValue(item)));
                yield AttributeValue.list(items);
            }
        };
    }
}
