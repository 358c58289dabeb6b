/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.jdbc;

import com.helios.crm.api.exceptions.PersistenceException;
import com.helios.crm.api.exceptions.TransactionException;
import com.helios.crm.store.TransactionManager;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Transactions bound to a thread-local JDBC connection.
 *
 * <p>The outermost {@link #inTransaction} opens a connection with auto-commit off and
 * commits or rolls back at the end. Nested calls run under a savepoint: a failure
 * rolls back to the savepoint and rethrows. Outside a transaction each statement
 * runs on its own auto-commit connection.
 */
public class JdbcTransactionManager implements TransactionManager {

    private static final Logger logger = Logger.getLogger(JdbcTransactionManager.class.getName());

    private final DataSource dataSource;
    private final ThreadLocal<Connection> current = new ThreadLocal<>();

    public JdbcTransactionManager(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public <T> T inTransaction(Supplier<T> work) {
        Connection connection = current.get();
        if (connection != null) {
            return inSavepoint(connection, work);
        }

        try {
            connection = dataSource.getConnection();
            connection.setAutoCommit(false);
        } catch (SQLException e) {
            closeAfterFailure(connection, e);
            throw new TransactionException("Failed to begin transaction", e);
        }

        current.set(connection);
        try {
            T result = work.get();
            connection.commit();
            return result;
        } catch (SQLException e) {
            rollback(connection, e);
            logger.log(Level.SEVERE, "Failed to commit transaction", e);
            throw new TransactionException("Failed to commit transaction", e);
        } catch (RuntimeException | Error e) {
            rollback(connection, e);
            throw e;
        } finally {
            current.remove();
            close(connection);
        }
    }

    private <T> T inSavepoint(Connection connection, Supplier<T> work) {
        Savepoint savepoint;
        try {
            savepoint = connection.setSavepoint();
        } catch (SQLException e) {
            throw new TransactionException("Failed to create savepoint", e);
        }

        try {
            T result = work.get();
            connection.releaseSavepoint(savepoint);
            return result;
        } catch (SQLException e) {
            throw new TransactionException("Failed to release savepoint", e);
        } catch (RuntimeException | Error e) {
            try {
                connection.rollback(savepoint);
            } catch (SQLException rollbackFailure) {
                e.addSuppressed(rollbackFailure);
                throw new TransactionException("Failed to roll back to savepoint", e);
            }
            throw e;
        }
    }

    /**
     * Runs JDBC work on the current transaction's connection, or on a fresh
     * auto-commit connection when no transaction is open.
     *
     * @throws PersistenceException wrapping any {@link SQLException}
     */
    public <T> T withConnection(String description, SqlWork<T> work) {
        Connection connection = current.get();
        try {
            if (connection != null) {
                return work.apply(connection);
            }
            try (Connection standalone = dataSource.getConnection()) {
                return work.apply(standalone);
            }
        } catch (SQLException e) {
            logger.log(Level.WARNING, "Failed to " + description, e);
            throw new PersistenceException("Failed to " + description, e);
        }
    }

    @Override
    public boolean isInTransaction() {
        return current.get() != null;
    }

    private static void rollback(Connection connection, Throwable cause) {
        try {
            connection.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
            logger.log(Level.SEVERE, "Failed to roll back transaction", e);
        }
    }

    private static void close(Connection connection) {
        try {
            connection.setAutoCommit(true);
        } catch (SQLException e) {
            logger.log(Level.WARNING, "Failed to reset auto-commit", e);
        } finally {
            try {
                connection.close();
            } catch (SQLException e) {
                logger.log(Level.WARNING, "Failed to close connection", e);
            }
        }
    }

    private static void closeAfterFailure(Connection connection, SQLException cause) {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }
}
