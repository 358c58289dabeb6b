/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.jdbc;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loads SQL statements kept in classpath resource files.
 *
 * <p><b>Query Format:</b>
 * <pre>
 * -- @name: query_name
 * SELECT * FROM table WHERE id = ?;
 * </pre>
 */
public final class SqlLoader {

    private static final Logger logger = Logger.getLogger(SqlLoader.class.getName());

    private static final String NAME_MARKER = "-- @name:";

    private SqlLoader() {
    }

    /**
     * Load all named queries from a resource file.
     *
     * @param resourcePath path to SQL file (e.g., "sql/queries.sql")
     * @return map of query names to SQL strings, without trailing semicolons
     */
    public static Map<String, String> loadQueries(String resourcePath) {
        Map<String, String> queries = new HashMap<>();

        try (BufferedReader reader = open(resourcePath)) {
            String line;
            String currentQueryName = null;
            StringBuilder currentQuery = new StringBuilder();

            while ((line = reader.readLine()) != null) {
                line = line.trim();

                if (line.startsWith(NAME_MARKER)) {
                    putQuery(queries, currentQueryName, currentQuery);
                    currentQueryName = line.substring(NAME_MARKER.length()).trim();
                    currentQuery = new StringBuilder();
                } else if (line.startsWith("--") || line.isEmpty()) {
                    continue;
                } else if (currentQueryName != null) {
                    if (currentQuery.length() > 0) {
                        currentQuery.append(" ");
                    }
                    currentQuery.append(line);
                }
            }
            putQuery(queries, currentQueryName, currentQuery);

            logger.info("Loaded " + queries.size() + " SQL queries from " + resourcePath);

        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to load SQL queries from " + resourcePath, e);
            throw new IllegalStateException("Failed to load SQL queries", e);
        }

        return queries;
    }

    /**
     * Load a schema file as individual statements.
     *
     * @param resourcePath path to SQL file (e.g., "sql/schema.sql")
     * @return DDL statements in file order
     */
    public static List<String> loadStatements(String resourcePath) {
        StringBuilder schema = new StringBuilder();
        try (BufferedReader reader = open(resourcePath)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.trim().startsWith("--")) {
                    continue;
                }
                schema.append(line).append("\n");
            }
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to load SQL schema from " + resourcePath, e);
            throw new IllegalStateException("Failed to load SQL schema", e);
        }

        return Arrays.stream(schema.toString().split(";"))
            .map(String::trim)
            .filter(statement -> !statement.isEmpty())
            .toList();
    }

    private static BufferedReader open(String resourcePath) throws IOException {
        InputStream is = SqlLoader.class.getClassLoader().getResourceAsStream(resourcePath);
        if (is == null) {
            throw new IOException("Resource not found: " + resourcePath);
        }
        return new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8));
    }

    private static void putQuery(Map<String, String> queries, String name, StringBuilder body) {
        if (name == null || body.length() == 0) {
            return;
        }
        String sql = body.toString().trim();
        if (sql.endsWith(";")) {
            sql = sql.substring(0, sql.length() - 1).trim();
        }
        queries.put(name, sql);
    }
}
