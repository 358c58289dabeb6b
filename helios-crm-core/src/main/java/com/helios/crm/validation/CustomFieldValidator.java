/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.validation;

import com.helios.crm.api.IFieldDefinitionRegistry;
import com.helios.crm.api.model.AttributeBag;
import com.helios.crm.api.model.AttributeValue;
import com.helios.crm.api.model.EntityType;
import com.helios.crm.api.model.FieldDefinition;
import com.helios.crm.api.model.FieldKind;
import com.helios.crm.api.model.FieldValidationResult;
import com.helios.crm.api.model.RelationshipValidationResult;
import com.helios.crm.relationship.IdentifierFormat;
import com.helios.crm.relationship.RelationshipValidator;

import java.math.BigDecimal;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Validates the custom-field payload of a record against the tenant's active field
 * definitions, then checks that every relationship value points at an existing record.
 *
 * <p>Keys without a definition are passed through unchanged. DATE values given as
 * ISO-8601 text are converted to dates in the returned data.
 */
public class CustomFieldValidator {

    static final int TEXT_MAX_LENGTH = 1000;
    static final int TEXTAREA_MAX_LENGTH = 5000;
    static final int PHONE_MAX_LENGTH = 30;

    private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");

    private final IFieldDefinitionRegistry registry;
    private final RelationshipValidator relationshipValidator;
    private final IdentifierFormat identifierFormat;

    public CustomFieldValidator(IFieldDefinitionRegistry registry, RelationshipValidator relationshipValidator,
                                IdentifierFormat identifierFormat) {
        this.registry = registry;
        this.relationshipValidator = relationshipValidator;
        this.identifierFormat = identifierFormat;
    }

    public CustomFieldValidator(IFieldDefinitionRegistry registry, RelationshipValidator relationshipValidator) {
        this(registry, relationshipValidator, IdentifierFormat.uuid());
    }

    public FieldValidationResult validate(String tenantId, EntityType entityType, Map<String, ?> data) {
        if (data == null) {
            data = Map.of();
        }
        List<FieldDefinition> definitions = registry.fieldsOfType(tenantId, entityType);
        Map<String, Object> normalized = new LinkedHashMap<>(data);
        Map<String, String> errors = new LinkedHashMap<>();

        for (FieldDefinition definition : definitions) {
            String key = definition.fieldKey();
            AttributeValue value = AttributeValue.fromJava(data.get(key));

            if (value.isNull()) {
                if (definition.required() && !acceptsExplicitNull(definition, data, key)) {
                    errors.put(key, "Required");
                }
                continue;
            }

            String error = checkKind(definition, value);
            if (error != null) {
                errors.put(key, error);
            } else if (definition.kind() == FieldKind.DATE) {
                normalized.put(key, AttributeValue.date(value.dateValue()));
            }
        }

        if (!errors.isEmpty()) {
            return FieldValidationResult.failure(errors);
        }

        RelationshipValidationResult relationships =
            relationshipValidator.validateAll(tenantId, definitions, normalized);
        if (!relationships.valid()) {
            return FieldValidationResult.failure(relationships.errors());
        }

        return FieldValidationResult.success(AttributeBag.of(normalized));
    }

    /**
     * A relationship may be cleared with an explicit null even when required; only an
     * absent key counts as missing.
     */
    private static boolean acceptsExplicitNull(FieldDefinition definition, Map<String, ?> data, String key) {
        return definition.kind() == FieldKind.RELATIONSHIP && data.containsKey(key);
    }

    /**
     * @return an error message, or null if the value fits the field's kind
     */
    private String checkKind(FieldDefinition definition, AttributeValue value) {
        return switch (definition.kind()) {
            case TEXT -> checkText(value, TEXT_MAX_LENGTH);
            case TEXTAREA -> checkText(value, TEXTAREA_MAX_LENGTH);
            case PHONE -> checkText(value, PHONE_MAX_LENGTH);
            case NUMBER, CURRENCY -> value.type() == AttributeValue.ValueType.NUMBER ? null : "Expected number";
            case PERCENT -> checkPercent(value);
            case DATE -> value.dateValue() != null ? null : "Invalid date";
            case BOOLEAN -> value.type() == AttributeValue.ValueType.BOOLEAN ? null : "Expected boolean";
            case SELECT -> checkOption(definition, value);
            case MULTISELECT -> checkOptions(definition, value);
            case URL -> checkUrl(value);
            case EMAIL -> value.type() == AttributeValue.ValueType.TEXT && EMAIL.matcher(value.textValue()).matches()
                ? null : "Invalid email";
            case RELATIONSHIP -> checkRelationship(value);
        };
    }

    private static String checkText(AttributeValue value, int maxLength) {
        if (value.type() != AttributeValue.ValueType.TEXT) {
            return "Expected string";
        }
        return value.textValue().length() <= maxLength
            ? null
            : "String must contain at most " + maxLength + " character(s)";
    }

    private static String checkPercent(AttributeValue value) {
        if (value.type() != AttributeValue.ValueType.NUMBER) {
            return "Expected number";
        }
        BigDecimal number = value.numberValue();
        if (number.signum() < 0 || number.compareTo(BigDecimal.valueOf(100)) > 0) {
            return "Number must be between 0 and 100";
        }
        return null;
    }

    private static String checkOption(FieldDefinition definition, AttributeValue value) {
        if (value.type() != AttributeValue.ValueType.TEXT) {
            return "Expected string";
        }
        if (!definition.options().isEmpty() && !definition.options().contains(value.textValue())) {
            return "Invalid option: expected one of " + String.join(", ", definition.options());
        }
        return null;
    }

    private static String checkOptions(FieldDefinition definition, AttributeValue value) {
        if (value.type() != AttributeValue.ValueType.LIST) {
            return "Expected array";
        }
        for (AttributeValue item : value.listValue()) {
            String error = checkOption(definition, item);
            if (error != null) {
                return error;
            }
        }
        return null;
    }

    private static String checkUrl(AttributeValue value) {
        if (value.type() != AttributeValue.ValueType.TEXT) {
            return "Expected string";
        }
        try {
            URI uri = new URI(value.textValue());
            return uri.getScheme() != null && uri.getHost() != null ? null : "Invalid url";
        } catch (URISyntaxException e) {
            return "Invalid url";
        }
    }

    private String checkRelationship(AttributeValue value) {
        if (value.type() != AttributeValue.ValueType.TEXT) {
            return "Expected string";
        }
        String id = value.textValue();
        return id.isEmpty() || identifierFormat.isWellFormed(id) ? null : "Invalid uuid";
    }
}
