/*
 * Copyright 2020 Johan Haleby
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.strata.projection;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.StringJoiner;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * A table of a projection (read model). Tables are created in a view schema, so the same table exists in the live schema and, during a
 * migration, in the shadow schema.
 *
 * <pre>
 * ProjectionTable accounts = ProjectionTable.builder("account_records")
 *         .column("aggregate_id", "VARCHAR(255) NOT NULL")
 *         .column("balance", "BIGINT NOT NULL")
 *         .primaryKey("aggregate_id")
 *         .build();
 * </pre>
 */
public final class ProjectionTable {
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final String name;
    private final Map<String, String> columns;
    private final List<String> primaryKey;
    private final Set<String> columnNames;

    private ProjectionTable(String name, Map<String, String> columns, List<String> primaryKey) {
        this.name = name;
        this.columns = new LinkedHashMap<>(columns);
        this.primaryKey = List.copyOf(primaryKey);
        this.columnNames = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        this.columnNames.addAll(columns.keySet());
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    public List<String> columnNames() {
        return List.copyOf(columns.keySet());
    }

    public List<String> primaryKey() {
        return primaryKey;
    }

    public String qualifiedName(String schema) {
        return requireIdentifier(schema, "Schema") + "." + name;
    }

    public String createTableSql(String schema) {
        StringJoiner definitions = new StringJoiner(", ", "CREATE TABLE " + qualifiedName(schema) + " (", ")");
        columns.forEach((column, type) -> definitions.add(column + " " + type));
        if (!primaryKey.isEmpty()) {
            definitions.add("PRIMARY KEY (" + String.join(", ", primaryKey) + ")");
        }
        return definitions.toString();
    }

    /**
     * @throws IllegalArgumentException If any of the columns is not a column of this table
     */
    public void requireColumns(Collection<String> columns) {
        for (String column : columns) {
            if (!columnNames.contains(column)) {
                throw new IllegalArgumentException("Unknown column " + column + " of table " + name);
            }
        }
    }

    public boolean isPrimaryKey(Collection<String> columns) {
        if (primaryKey.isEmpty() || columns.size() != primaryKey.size()) {
            return false;
        }
        Set<String> keyColumns = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        keyColumns.addAll(primaryKey);
        return keyColumns.containsAll(columns);
    }

    public static String requireIdentifier(String identifier, String what) {
        Objects.requireNonNull(identifier, what + " cannot be null");
        if (!IDENTIFIER.matcher(identifier).matches()) {
            throw new IllegalArgumentException(what + " '" + identifier + "' is not a valid identifier");
        }
        return identifier;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProjectionTable that)) return false;
        return name.equals(that.name) && columns.equals(that.columns) && primaryKey.equals(that.primaryKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, columns, primaryKey);
    }

    @Override
    public String toString() {
        return name;
    }

    public static final class Builder {
        private final String name;
        private final Map<String, String> columns = new LinkedHashMap<>();
        private final List<String> primaryKey = new ArrayList<>();

        private Builder(String name) {
            this.name = requireIdentifier(name, "Table name");
        }

        public Builder column(String name, String sqlType) {
            requireIdentifier(name, "Column name");
            Objects.requireNonNull(sqlType, "Sql type cannot be null");
            if (columns.putIfAbsent(name, sqlType) != null) {
                throw new IllegalArgumentException("Column " + name + " is already defined");
            }
            return this;
        }

        public Builder primaryKey(String... columns) {
            primaryKey.addAll(List.of(columns));
            return this;
        }

        public ProjectionTable build() {
            if (columns.isEmpty()) {
                throw new IllegalArgumentException("Table " + name + " must have at least one column");
            }
            ProjectionTable table = new ProjectionTable(name, columns, primaryKey);
            table.requireColumns(primaryKey);
            return table;
        }
    }
}
