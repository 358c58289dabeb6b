/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.store;

import java.util.function.Supplier;

/**
 * Unit-of-work boundary for multi-step writes.
 *
 * <p>A call made while a transaction is already open on the current thread runs as a
 * nested unit (savepoint): if it fails, only its own changes are rolled back and the
 * exception propagates to the caller, which may continue the outer transaction.
 * Failures to commit surface as {@link com.helios.crm.api.exceptions.TransactionException}.
 */
public interface TransactionManager {

    <T> T inTransaction(Supplier<T> work);

    /**
     * @return true if a transaction is open on the current thread
     */
    boolean isInTransaction();

    default void runInTransaction(Runnable work) {
        inTransaction(() -> {
            work.run();
            return null;
        });
    }
}
