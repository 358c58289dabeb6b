/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.api.model;

/**
 * STATIC segments hold an explicit member list; DYNAMIC segments are defined by rules.
 */
public enum SegmentType {
    STATIC,
    DYNAMIC
}
