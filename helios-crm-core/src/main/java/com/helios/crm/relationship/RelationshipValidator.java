/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.relationship;

import com.helios.crm.api.model.AttributeValue;
import com.helios.crm.api.model.CustomModule;
import com.helios.crm.api.model.EntityType;
import com.helios.crm.api.model.FieldDefinition;
import com.helios.crm.api.model.RelationshipValidationResult;
import com.helios.crm.api.model.ValidationResult;
import com.helios.crm.store.EntityRepository;
import com.helios.crm.store.EntityRepositoryRegistry;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Checks that relationship values point at existing records of the declared target type.
 *
 * <p>Outcomes are always returned as {@link ValidationResult}; persistence failures
 * during the lookup are logged and reported as an invalid result.
 */
public class RelationshipValidator {

    private static final Logger logger = Logger.getLogger(RelationshipValidator.class.getName());

    static final String LOOKUP_FAILED = "Failed to validate relationship";

    private final EntityRepositoryRegistry repositories;
    private final IdentifierFormat identifierFormat;

    public RelationshipValidator(EntityRepositoryRegistry repositories, IdentifierFormat identifierFormat) {
        this.repositories = Objects.requireNonNull(repositories, "repositories");
        this.identifierFormat = Objects.requireNonNull(identifierFormat, "identifierFormat");
    }

    public RelationshipValidator(EntityRepositoryRegistry repositories) {
        this(repositories, IdentifierFormat.uuid());
    }

    /**
     * Validates a single identifier against the target type.
     *
     * @param targetEntityType type the relationship points to
     * @param rawId candidate identifier; null, empty and {@code "null"} are valid
     * @param tenantId tenant scope of the lookup
     */
    public ValidationResult validate(EntityType targetEntityType, String rawId, String tenantId) {
        if (isBlankReference(rawId)) {
            return ValidationResult.ok();
        }
        if (!identifierFormat.isWellFormed(rawId)) {
            return ValidationResult.invalid("Invalid ID format: " + rawId);
        }

        try {
            if (targetEntityType.isBuiltIn()) {
                Optional<EntityRepository> repository = repositories.builtIn(targetEntityType);
                if (repository.isEmpty()) {
                    return ValidationResult.invalid("Unknown module: " + targetEntityType);
                }
                return repository.get().exists(tenantId, rawId)
                    ? ValidationResult.ok()
                    : ValidationResult.invalid(targetEntityType + " record not found: " + rawId);
            }

            Optional<CustomModule> module = repositories.customModule(tenantId, targetEntityType.key());
            if (module.isEmpty()) {
                return ValidationResult.invalid("Custom module not found: " + targetEntityType.key());
            }
            return repositories.forModule(module.get()).exists(tenantId, rawId)
                ? ValidationResult.ok()
                : ValidationResult.invalid("Custom module record not found: " + rawId);

        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Error validating relationship to " + targetEntityType + ": " + rawId, e);
            return ValidationResult.invalid(LOOKUP_FAILED);
        }
    }

    /**
     * Validates every relationship field of a payload. All fields are checked; errors
     * are keyed by field key in definition order.
     */
    public RelationshipValidationResult validateAll(String tenantId, List<FieldDefinition> fieldDefinitions,
                                                    Map<String, ?> recordData) {
        Map<String, String> errors = new LinkedHashMap<>();

        for (FieldDefinition field : fieldDefinitions) {
            if (!field.isRelationship()) {
                continue;
            }
            String value = AttributeValue.fromJava(recordData.get(field.fieldKey())).textValue();
            if (isBlankReference(value)) {
                continue;
            }

            ValidationResult result = validate(field.relatedEntityType(), value, tenantId);
            if (!result.valid()) {
                errors.put(field.fieldKey(), result.error() != null ? result.error() : "Invalid relationship");
            }
        }

        if (!errors.isEmpty()) {
            logger.fine("Relationship validation failed for " + errors.keySet() + " in tenant " + tenantId);
        }
        return RelationshipValidationResult.of(errors);
    }

    static boolean isBlankReference(String id) {
        return id == null || id.isEmpty() || "null".equals(id);
    }
}
