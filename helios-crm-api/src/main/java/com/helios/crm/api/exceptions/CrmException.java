/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.api.exceptions;

/**
 * Base exception for CRM core failures.
 *
 * <p>Unchecked: validation outcomes are returned as results, so an exception here
 * means the caller cannot proceed (missing segment, failed transaction).
 */
public class CrmException extends RuntimeException {

    public CrmException(String message) {
        super(message);
    }

    public CrmException(String message, Throwable cause) {
        super(message, cause);
    }
}
