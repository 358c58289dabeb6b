/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.api.model;

import java.io.Serializable;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * A single value stored in an {@link AttributeBag}, tagged with its {@link ValueType}.
 *
 * <p>The payload class is fixed per tag:
 * <pre>
 * TEXT    → String
 * NUMBER  → BigDecimal (trailing zeros stripped, so 1.0 equals 1)
 * BOOLEAN → Boolean
 * DATE    → Instant
 * LIST    → List&lt;AttributeValue&gt; (immutable)
 * NULL    → null
 * </pre>
 *
 * <p>Untyped input (JSON payloads, collaborator maps) enters through
 * {@link #fromJava(Object)}, which is the only place coercion happens.
 */
public record AttributeValue(ValueType type, Object raw) implements Serializable {

    public enum ValueType {
        TEXT, NUMBER, BOOLEAN, DATE, LIST, NULL
    }

    public static final AttributeValue NULL = new AttributeValue(ValueType.NULL, null);

    private static final Pattern DATE_ONLY = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");

    public AttributeValue {
        Objects.requireNonNull(type, "type cannot be null");
        switch (type) {
            case NULL -> {
                if (raw != null) {
                    throw new IllegalArgumentException("NULL value cannot carry a payload");
                }
            }
            case TEXT -> requirePayload(raw, String.class, type);
            case NUMBER -> raw = ((BigDecimal) requirePayload(raw, BigDecimal.class, type)).stripTrailingZeros();
            case BOOLEAN -> requirePayload(raw, Boolean.class, type);
            case DATE -> requirePayload(raw, Instant.class, type);
            case LIST -> {
                List<?> items = (List<?>) requirePayload(raw, List.class, type);
                for (Object item : items) {
                    if (!(item instanceof AttributeValue)) {
                        throw new IllegalArgumentException("LIST items must be AttributeValue, got: " + item);
                    }
                }
                raw = List.copyOf(items);
            }
        }
    }

    private static Object requirePayload(Object raw, Class<?> expected, ValueType type) {
        if (!expected.isInstance(raw)) {
            throw new IllegalArgumentException(type + " value requires " + expected.getSimpleName() + ", got: " + raw);
        }
        return raw;
    }

    public static AttributeValue text(String value) {
        return value == null ? NULL : new AttributeValue(ValueType.TEXT, value);
    }

    public static AttributeValue number(BigDecimal value) {
        return value == null ? NULL : new AttributeValue(ValueType.NUMBER, value);
    }

    public static AttributeValue number(long value) {
        return new AttributeValue(ValueType.NUMBER, BigDecimal.valueOf(value));
    }

    public static AttributeValue number(double value) {
        return new AttributeValue(ValueType.NUMBER, BigDecimal.valueOf(value));
    }

    public static AttributeValue bool(Boolean value) {
        return value == null ? NULL : new AttributeValue(ValueType.BOOLEAN, value);
    }

    public static AttributeValue date(Instant value) {
        return value == null ? NULL : new AttributeValue(ValueType.DATE, value);
    }

    public static AttributeValue list(List<AttributeValue> values) {
        return values == null ? NULL : new AttributeValue(ValueType.LIST, values);
    }

    /**
     * Converts an untyped Java value into a tagged value.
     *
     * @param value any of: null, String, Number, Boolean, Instant, Date, LocalDate,
     *              OffsetDateTime, ZonedDateTime, Collection or AttributeValue
     * @return the tagged value; unknown types are stored as their string form
     */
    public static AttributeValue fromJava(Object value) {
        if (value == null) {
            return NULL;
        } else if (value instanceof AttributeValue attributeValue) {
            return attributeValue;
        } else if (value instanceof String str) {
            return text(str);
        } else if (value instanceof BigDecimal decimal) {
            return number(decimal);
        } else if (value instanceof Integer || value instanceof Long
            || value instanceof Short || value instanceof Byte) {
            return number(((Number) value).longValue());
        } else if (value instanceof Double || value instanceof Float) {
            return number(((Number) value).doubleValue());
        } else if (value instanceof Number number) {
            return number(new BigDecimal(number.toString()));
        } else if (value instanceof Boolean bool) {
            return bool(bool);
        } else if (value instanceof Instant instant) {
            return date(instant);
        } else if (value instanceof Date date) {
            return date(date.toInstant());
        } else if (value instanceof LocalDate localDate) {
            return date(localDate.atStartOfDay(ZoneOffset.UTC).toInstant());
        } else if (value instanceof OffsetDateTime offsetDateTime) {
            return date(offsetDateTime.toInstant());
        } else if (value instanceof ZonedDateTime zonedDateTime) {
            return date(zonedDateTime.toInstant());
        } else if (value instanceof Collection<?> collection) {
            List<AttributeValue> items = new ArrayList<>(collection.size());
            for (Object item : collection) {
                items.add(fromJava(item));
            }
            return list(items);
        }
        return text(value.toString());
    }

    public boolean isNull() {
        return type == ValueType.NULL;
    }

    /**
     * True for NULL and for empty text. Absent keys in a bag read as NULL.
     */
    public boolean isEmpty() {
        return type == ValueType.NULL || (type == ValueType.TEXT && ((String) raw).isEmpty());
    }

    /**
     * String form of the value, or null for NULL.
     */
    public String textValue() {
        return switch (type) {
            case NULL -> null;
            case TEXT -> (String) raw;
            case NUMBER -> ((BigDecimal) raw).toPlainString();
            case BOOLEAN, DATE -> raw.toString();
            case LIST -> listValue().stream()
                .map(AttributeValue::textValue)
                .map(String::valueOf)
                .collect(Collectors.joining(", "));
        };
    }

    /**
     * Numeric form of the value. Text is parsed; anything else yields null.
     */
    public BigDecimal numberValue() {
        if (type == ValueType.NUMBER) {
            return (BigDecimal) raw;
        }
        if (type == ValueType.TEXT) {
            try {
                return new BigDecimal(((String) raw).trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    /**
     * Instant form of the value. ISO-8601 instants and dates in text are parsed.
     */
    public Instant dateValue() {
        if (type == ValueType.DATE) {
            return (Instant) raw;
        }
        if (type == ValueType.TEXT) {
            return parseInstant(((String) raw).trim());
        }
        return null;
    }

    /**
     * Boolean form of the value; text {@code "true"}/{@code "false"} is accepted.
     */
    public Boolean booleanValue() {
        if (type == ValueType.BOOLEAN) {
            return (Boolean) raw;
        }
        if (type == ValueType.TEXT) {
            String text = ((String) raw).trim();
            if ("true".equalsIgnoreCase(text)) {
                return Boolean.TRUE;
            }
            if ("false".equalsIgnoreCase(text)) {
                return Boolean.FALSE;
            }
        }
        return null;
    }

    @SuppressWarnings("unchecked")
    public List<AttributeValue> listValue() {
        return type == ValueType.LIST ? (List<AttributeValue>) raw : List.of();
    }

    /**
     * Converts back into plain Java objects (the inverse of {@link #fromJava(Object)}).
     */
    public Object toJava() {
        if (type == ValueType.LIST) {
            return listValue().stream().map(AttributeValue::toJava).collect(Collectors.toList());
        }
        return raw;
    }

    static Instant parseInstant(String text) {
        if (text.isEmpty()) {
            return null;
        }
        try {
            if (DATE_ONLY.matcher(text).matches()) {
                return LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant();
            }
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                .parseBest(text, OffsetDateTime::from, LocalDateTime::from);
            return parsed instanceof OffsetDateTime offsetDateTime
                ? offsetDateTime.toInstant()
                : ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    @Override
    public String toString() {
        return type == ValueType.NULL ? "NULL" : type + "(" + textValue() + ")";
    }
}
