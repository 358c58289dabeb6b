/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;

/**
 * Outcome of one segment recalculation.
 */
public record CalculationResult(
    @JsonProperty("member_count") int memberCount,
    @JsonProperty("members_added") int membersAdded,
    @JsonProperty("members_removed") int membersRemoved,
    @JsonProperty("calculated_at") Instant calculatedAt
) implements Serializable {

    public boolean changed() {
        return membersAdded > 0 || membersRemoved > 0;
    }
}
