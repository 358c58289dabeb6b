/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.store;

import com.helios.crm.api.model.CustomModule;

import java.util.List;
import java.util.Optional;

/**
 * Lookup of tenant-defined modules.
 */
public interface CustomModuleCatalog {

    Optional<CustomModule> findBySlug(String tenantId, String slug);

    List<CustomModule> findAll(String tenantId);
}
