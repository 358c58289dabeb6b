/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.store;

import com.helios.crm.api.model.CustomModule;

/**
 * Generic storage for custom module records; one repository view per module.
 */
public interface CustomRecordStore {

    EntityRepository forModule(CustomModule module);
}
