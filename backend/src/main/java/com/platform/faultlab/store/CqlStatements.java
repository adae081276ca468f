package com.platform.faultlab.store;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * CQL text for the statements the Cassandra driver issues.
 * Identifiers are validated since they are concatenated into the query.
 */
final class CqlStatements {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    /**
     * Column definitions of the tables this service creates.
     */
    static final Map<String, String> KNOWN_TABLES = Map.of(
        "devices", "id uuid PRIMARY KEY, name text, status text, type text",
        "failure_monitor", "id uuid PRIMARY KEY, name text, status text, type text",
        "performance_test", "id uuid PRIMARY KEY, name text, status text, type text, value double, timestamp text"
    );

    private CqlStatements() {
    }

    static String createKeyspace(String keyspace, int replicationFactor) {
        return String.format(
            "CREATE KEYSPACE IF NOT EXISTS %s WITH replication = {'class': 'SimpleStrategy', 'replication_factor': %d}",
            identifier(keyspace), replicationFactor);
    }

    static String createTable(String keyspace, String table) {
        String columns = KNOWN_TABLES.get(table);
        if (columns == null) {
            throw new IllegalArgumentException("No schema known for table " + table);
        }
        return String.format("CREATE TABLE IF NOT EXISTS %s (%s)", qualified(keyspace, table), columns);
    }

    static String insert(String keyspace, String table, Collection<String> columns) {
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("Insert needs at least one column");
        }
        String names = columns.stream().map(CqlStatements::identifier).collect(Collectors.joining(", "));
        String markers = columns.stream().map(c -> "?").collect(Collectors.joining(", "));
        return String.format("INSERT INTO %s (%s) VALUES (%s)", qualified(keyspace, table), names, markers);
    }

    static String select(String keyspace, String table, Collection<String> filterColumns) {
        if (filterColumns.isEmpty()) {
            return "SELECT * FROM " + qualified(keyspace, table);
        }
        return String.format("SELECT * FROM %s WHERE %s ALLOW FILTERING",
            qualified(keyspace, table), equalities(filterColumns, " AND "));
    }

    static String update(String keyspace, String table, Collection<String> setColumns, Collection<String> whereColumns) {
        if (setColumns.isEmpty() || whereColumns.isEmpty()) {
            throw new IllegalArgumentException("Update needs both a filter and a patch");
        }
        return String.format("UPDATE %s SET %s WHERE %s",
            qualified(keyspace, table), equalities(setColumns, ", "), equalities(whereColumns, " AND "));
    }

    static String truncate(String keyspace, String table) {
        return "TRUNCATE " + qualified(keyspace, table);
    }

    /**
     * Strings that parse as UUIDs are bound as UUIDs.
     */
    static Map<String, Object> bindableValues(Map<String, Object> values) {
        Map<String, Object> converted = new LinkedHashMap<>();
        values.forEach((key, value) -> converted.put(key, toBindable(value)));
        return converted;
    }

    private static Object toBindable(Object value) {
        if (value instanceof String text && text.length() == 36) {
            try {
                return UUID.fromString(text);
            } catch (IllegalArgumentException e) {
                return text;
            }
        }
        return value;
    }

    static String qualified(String keyspace, String table) {
        return identifier(keyspace) + "." + identifier(table);
    }

    static String identifier(String name) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid CQL identifier: " + name);
        }
        return name;
    }

    private static String equalities(Collection<String> columns, String separator) {
        return columns.stream()
            .map(c -> identifier(c) + " = ?")
            .collect(Collectors.joining(separator));
    }
}
