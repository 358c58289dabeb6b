/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A field alias usable in segment rules, with its display label.
 */
public record SegmentFieldOption(
    @JsonProperty("value") String value,
    @JsonProperty("label") String label
) {
}
