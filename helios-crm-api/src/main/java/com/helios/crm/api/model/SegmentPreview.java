/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Non-authoritative preview of a rule set: total match count plus a capped sample.
 */
public record SegmentPreview(
    @JsonProperty("count") int count,
    @JsonProperty("preview") List<PreviewMember> sample
) implements Serializable {

    public SegmentPreview {
        sample = sample == null ? List.of() : List.copyOf(sample);
    }

    public record PreviewMember(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("email") String email
    ) implements Serializable {
    }
}
