/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.api.exceptions;

/**
 * A read or write against the record store failed.
 */
public class PersistenceException extends CrmException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
