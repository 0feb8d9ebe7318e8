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

package org.strata.projection.persistor;

import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.strata.projection.ProjectionTable;

import javax.sql.DataSource;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;

import static java.util.Objects.requireNonNull;

/**
 * A {@link Persistor} that executes every operation immediately against the tables in the given view schema, in the transaction of
 * the caller if there is one.
 */
public class JdbcPersistor implements Persistor {
    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final String schema;

    public JdbcPersistor(DataSource dataSource, String schema) {
        requireNonNull(dataSource, DataSource.class.getSimpleName() + " cannot be null");
        this.jdbcTemplate = new NamedParameterJdbcTemplate(dataSource);
        this.schema = ProjectionTable.requireIdentifier(schema, "Schema");
    }

    @Override
    public void createRecord(ProjectionTable table, Map<String, ?> values) {
        requireNonNull(values, "Values cannot be null");
        table.requireColumns(values.keySet());
        MapSqlParameterSource parameters = new MapSqlParameterSource();
        StringJoiner columns = new StringJoiner(", ", "(", ")");
        StringJoiner placeholders = new StringJoiner(", ", "(", ")");
        values.forEach((column, value) -> {
            columns.add(column);
            placeholders.add(":v_" + column);
            parameters.addValue("v_" + column, SqlValues.toJdbc(value));
        });
        jdbcTemplate.update("INSERT INTO " + table.qualifiedName(schema) + " " + columns + " VALUES " + placeholders, parameters);
    }

    @Override
    public void updateRecords(ProjectionTable table, Map<String, ?> where, Map<String, ?> values) {
        update(table, where, values);
    }

    @Override
    public void createOrUpdateRecord(ProjectionTable table, Map<String, ?> where, Map<String, ?> values) {
        if (update(table, where, values) == 0) {
            Map<String, Object> record = new LinkedHashMap<>(where);
            record.putAll(values);
            createRecord(table, record);
        }
    }

    @Override
    public Optional<Map<String, Object>> getRecord(ProjectionTable table, Map<String, ?> where) {
        return findRecords(table, where).stream().findFirst();
    }

    @Override
    public List<Map<String, Object>> findRecords(ProjectionTable table, Map<String, ?> where) {
        MapSqlParameterSource parameters = new MapSqlParameterSource();
        String sql = "SELECT * FROM " + table.qualifiedName(schema) + whereClause(table, where, parameters);
        return jdbcTemplate.queryForList(sql, parameters);
    }

    @Override
    public void deleteRecords(ProjectionTable table, Map<String, ?> where) {
        MapSqlParameterSource parameters = new MapSqlParameterSource();
        jdbcTemplate.update("DELETE FROM " + table.qualifiedName(schema) + whereClause(table, where, parameters), parameters);
    }

    private int update(ProjectionTable table, Map<String, ?> where, Map<String, ?> values) {
        requireNonNull(values, "Values cannot be null");
        if (values.isEmpty()) {
            throw new IllegalArgumentException("Values cannot be empty");
        }
        table.requireColumns(values.keySet());
        MapSqlParameterSource parameters = new MapSqlParameterSource();
        StringJoiner assignments = new StringJoiner(", ");
        values.forEach((column, value) -> {
            assignments.add(column + " = :v_" + column);
            parameters.addValue("v_" + column, SqlValues.toJdbc(value));
        });
        return jdbcTemplate.update("UPDATE " + table.qualifiedName(schema) + " SET " + assignments + whereClause(table, where, parameters), parameters);
    }

    private static String whereClause(ProjectionTable table, Map<String, ?> where, MapSqlParameterSource parameters) {
        requireNonNull(where, "Where cannot be null");
        table.requireColumns(where.keySet());
        if (where.isEmpty()) {
            return "";
        }
        StringJoiner conditions = new StringJoiner(" AND ", " WHERE ", "");
        where.forEach((column, value) -> {
            if (value == null) {
                conditions.add(column + " IS NULL");
            } else {
                conditions.add(column + " = :w_" + column);
                parameters.addValue("w_" + column, SqlValues.toJdbc(value));
            }
        });
        return conditions.toString();
    }
}
