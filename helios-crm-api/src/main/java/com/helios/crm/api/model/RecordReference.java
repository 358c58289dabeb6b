/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * A record holding a relationship value that points at some target record.
 *
 * @param entityType type owning the referencing field (module slug for custom modules)
 * @param recordId   id of the referencing record
 * @param fieldKey   relationship field holding the reference
 */
public record RecordReference(
    @JsonProperty("module") EntityType entityType,
    @JsonProperty("record_id") String recordId,
    @JsonProperty("field_key") String fieldKey
) implements Serializable {
}
