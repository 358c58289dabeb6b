/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.api.exceptions;

/**
 * Thrown when a recalculation targets a segment that does not exist in the tenant.
 */
public class SegmentNotFoundException extends CrmException {

    private final String segmentId;
    private final String tenantId;

    public SegmentNotFoundException(String segmentId, String tenantId) {
        super("Segment not found: " + segmentId);
        this.segmentId = segmentId;
        this.tenantId = tenantId;
    }

    public String getSegmentId() {
        return segmentId;
    }

    public String getTenantId() {
        return tenantId;
    }
}
