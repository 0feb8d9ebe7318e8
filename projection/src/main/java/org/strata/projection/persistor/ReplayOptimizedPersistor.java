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

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.LinkedCaseInsensitiveMap;
import org.strata.projection.ProjectionTable;

import javax.sql.DataSource;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.StringJoiner;

import static java.util.Objects.requireNonNull;

/**
 * A {@link Persistor} for rebuilding projections. Records are kept in memory while events are replayed and written to the view schema
 * in batches. Rebuilding a record typically takes one insert followed by many updates, which this persistor turns into a single insert.
 * Records are indexed by the primary key of their table, lookups by any other columns scan the table.
 * <p>
 * {@link #flush()} writes the records of the tables that have a primary key and removes them from memory, so that a replay of a long
 * event history doesn't need to hold the whole view schema in memory. Lookups in a flushed table, or in a table passed to
 * {@link #readFromViewSchema(Collection)}, read the records that are not in memory from the view schema. Records that are changed or
 * deleted afterwards are updated or deleted by the next flush. Tables without a primary key stay in memory until {@link #commit()},
 * lookups in them only see the records in memory.
 * <p>
 * Not thread-safe.
 */
public class ReplayOptimizedPersistor implements Persistor {
    private static final Logger log = LoggerFactory.getLogger(ReplayOptimizedPersistor.class);
    public static final int DEFAULT_BATCH_SIZE = 1000;

    private final @Nullable JdbcTemplate jdbcTemplate;
    private final @Nullable JdbcPersistor viewSchema;
    private final @Nullable TransactionTemplate transactionTemplate;
    private final @Nullable String schema;
    private final int batchSize;
    private final Map<ProjectionTable, TableStore> store = new LinkedHashMap<>();
    private final Set<ProjectionTable> persistedTables = new HashSet<>();

    public ReplayOptimizedPersistor(DataSource dataSource, PlatformTransactionManager transactionManager, String schema) {
        this(dataSource, transactionManager, schema, DEFAULT_BATCH_SIZE);
    }

    public ReplayOptimizedPersistor(DataSource dataSource, PlatformTransactionManager transactionManager, String schema, int batchSize) {
        requireNonNull(dataSource, DataSource.class.getSimpleName() + " cannot be null");
        requireNonNull(transactionManager, PlatformTransactionManager.class.getSimpleName() + " cannot be null");
        if (batchSize < 1) {
            throw new IllegalArgumentException("Batch size must be greater than 0");
        }
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.viewSchema = new JdbcPersistor(dataSource, schema);
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.schema = ProjectionTable.requireIdentifier(schema, "Schema");
        this.batchSize = batchSize;
    }

    /**
     * For subclasses that never write the records.
     */
    protected ReplayOptimizedPersistor() {
        this.jdbcTemplate = null;
        this.viewSchema = null;
        this.transactionTemplate = null;
        this.schema = null;
        this.batchSize = DEFAULT_BATCH_SIZE;
    }

    @Override
    public void createRecord(ProjectionTable table, Map<String, ?> values) {
        requireNonNull(values, "Values cannot be null");
        table.requireColumns(values.keySet());
        Map<String, Object> record = new LinkedCaseInsensitiveMap<>();
        record.putAll(values);
        tableStore(table).add(record);
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
        return find(table, where).stream().map(Collections::unmodifiableMap).toList();
    }

    @Override
    public void deleteRecords(ProjectionTable table, Map<String, ?> where) {
        List<Map<String, Object>> records = find(table, where);
        TableStore tableStore = tableStore(table);
        records.forEach(tableStore::remove);
    }

    /**
     * Read the records of {@code tables} that are not in memory from the view schema, for tables that already contain records
     * when the replay starts.
     */
    public void readFromViewSchema(Collection<ProjectionTable> tables) {
        tables.stream().filter(table -> !table.primaryKey().isEmpty()).forEach(persistedTables::add);
    }

    /**
     * Write the records of the tables with a primary key to the view schema, in one transaction, and remove them from memory.
     */
    public void flush() {
        List<ProjectionTable> tables = store.keySet().stream().filter(table -> !table.primaryKey().isEmpty()).toList();
        write(tables);
        tables.forEach(store::remove);
        persistedTables.addAll(tables);
    }

    /**
     * Write all records to the view schema, in one transaction, and clear the in-memory store.
     */
    @Override
    public void commit() {
        write(List.copyOf(store.keySet()));
        clear();
    }

    /**
     * @return The number of records in memory
     */
    public int recordCount() {
        return store.values().stream().mapToInt(TableStore::size).sum();
    }

    /**
     * @return The number of records in memory that {@link #flush()} would write
     */
    public int flushableRecordCount() {
        return store.entrySet().stream()
                .filter(entry -> !entry.getKey().primaryKey().isEmpty())
                .mapToInt(entry -> entry.getValue().size())
                .sum();
    }

    protected void clear() {
        store.clear();
        persistedTables.clear();
    }

    private void write(Collection<ProjectionTable> tables) {
        TransactionTemplate template = requireNonNull(transactionTemplate, "No data source to write records to");
        template.executeWithoutResult(status -> tables.forEach(table -> write(table, store.get(table))));
    }

    private void write(ProjectionTable table, TableStore tableStore) {
        JdbcTemplate template = requireNonNull(jdbcTemplate);
        String target = table.qualifiedName(requireNonNull(schema));
        List<String> columns = table.columnNames();
        List<String> keyColumns = table.primaryKey();

        if (!tableStore.deletedKeys.isEmpty()) {
            String sql = "DELETE FROM " + target + keyCondition(keyColumns);
            template.batchUpdate(sql, tableStore.deletedKeys, batchSize, (ps, key) -> {
                for (int i = 0; i < key.size(); i++) {
                    ps.setObject(i + 1, SqlValues.toJdbc(key.get(i)));
                }
            });
        }

        List<Map<String, Object>> changed = tableStore.records().stream().filter(tableStore.changed::contains).toList();
        if (!changed.isEmpty()) {
            StringJoiner assignments = new StringJoiner(", ");
            columns.forEach(column -> assignments.add(column + " = ?"));
            String sql = "UPDATE " + target + " SET " + assignments + keyCondition(keyColumns);
            template.batchUpdate(sql, changed, batchSize, (ps, record) -> {
                int index = setValues(ps, columns, record, 1);
                List<Object> key = tableStore.persistedKeys.get(record);
                for (Object value : key) {
                    ps.setObject(index++, SqlValues.toJdbc(value));
                }
            });
        }

        List<Map<String, Object>> created = tableStore.records().stream().filter(record -> !tableStore.persistedKeys.containsKey(record)).toList();
        if (!created.isEmpty()) {
            StringJoiner placeholders = new StringJoiner(", ", "(", ")");
            columns.forEach(__ -> placeholders.add("?"));
            String sql = "INSERT INTO " + target + " (" + String.join(", ", columns) + ") VALUES " + placeholders;
            template.batchUpdate(sql, created, batchSize, (ps, record) -> setValues(ps, columns, record, 1));
        }
        log.debug("Wrote {} records to {}, updated {} and deleted {}", created.size(), target, changed.size(), tableStore.deletedKeys.size());
    }

    private static int setValues(PreparedStatement ps, List<String> columns, Map<String, Object> record, int firstIndex) throws SQLException {
        int index = firstIndex;
        for (String column : columns) {
            Object value = record.get(column);
            ps.setObject(index++, value == null ? null : SqlValues.toJdbc(value));
        }
        return index;
    }

    private static String keyCondition(List<String> keyColumns) {
        StringJoiner conditions = new StringJoiner(" AND ", " WHERE ", "");
        keyColumns.forEach(column -> conditions.add(column + " = ?"));
        return conditions.toString();
    }

    private int update(ProjectionTable table, Map<String, ?> where, Map<String, ?> values) {
        requireNonNull(values, "Values cannot be null");
        table.requireColumns(values.keySet());
        List<Map<String, Object>> records = find(table, where);
        TableStore tableStore = tableStore(table);
        for (Map<String, Object> record : records) {
            tableStore.update(record, values);
        }
        return records.size();
    }

    private List<Map<String, Object>> find(ProjectionTable table, Map<String, ?> where) {
        requireNonNull(where, "Where cannot be null");
        table.requireColumns(where.keySet());
        TableStore tableStore = tableStore(table);
        if (persistedTables.contains(table)) {
            loadFromViewSchema(table, tableStore, where);
        }
        return tableStore.find(where);
    }

    private void loadFromViewSchema(ProjectionTable table, TableStore tableStore, Map<String, ?> where) {
        if (table.isPrimaryKey(where.keySet()) && !where.containsValue(null)) {
            List<Object> key = tableStore.primaryKey(where);
            if (key == null || tableStore.claims(key)) {
                return;
            }
        }
        for (Map<String, Object> row : requireNonNull(viewSchema).findRecords(table, where)) {
            List<Object> key = tableStore.primaryKey(row);
            if (key != null && !tableStore.claims(key)) {
                Map<String, Object> record = new LinkedCaseInsensitiveMap<>();
                record.putAll(row);
                tableStore.load(record, key);
            }
        }
    }

    private TableStore tableStore(ProjectionTable table) {
        requireNonNull(table, ProjectionTable.class.getSimpleName() + " cannot be null");
        return store.computeIfAbsent(table, TableStore::new);
    }

    private static final class TableStore {
        private final ProjectionTable table;
        private final List<Map<String, Object>> insertionOrder = new ArrayList<>();
        private final Map<List<Object>, Map<String, Object>> byPrimaryKey = new HashMap<>();
        // Records read from the view schema, with the key they are stored under
        private final Map<Map<String, Object>, List<Object>> persistedKeys = new IdentityHashMap<>();
        private final Set<Map<String, Object>> changed = Collections.newSetFromMap(new IdentityHashMap<>());
        private final Set<List<Object>> claimedKeys = new HashSet<>();
        private final List<List<Object>> deletedKeys = new ArrayList<>();

        private TableStore(ProjectionTable table) {
            this.table = table;
        }

        void add(Map<String, Object> record) {
            List<Object> key = primaryKey(record);
            if (key != null && byPrimaryKey.putIfAbsent(key, record) != null) {
                throw new IllegalStateException("Duplicate key " + key + " in table " + table.name());
            }
            insertionOrder.add(record);
        }

        void load(Map<String, Object> record, List<Object> key) {
            add(record);
            persistedKeys.put(record, key);
            claimedKeys.add(key);
        }

        /**
         * @return {@code true} if the record stored under {@code key} in the view schema must not be read again
         */
        boolean claims(List<Object> key) {
            return byPrimaryKey.containsKey(key) || claimedKeys.contains(key);
        }

        void remove(Map<String, Object> record) {
            List<Object> key = primaryKey(record);
            if (key != null) {
                byPrimaryKey.remove(key);
            }
            insertionOrder.removeIf(r -> r == record);
            changed.remove(record);
            List<Object> persistedKey = persistedKeys.remove(record);
            if (persistedKey != null) {
                deletedKeys.add(persistedKey);
            }
        }

        void update(Map<String, Object> record, Map<String, ?> values) {
            List<Object> key = primaryKey(record);
            if (key != null) {
                byPrimaryKey.remove(key);
            }
            record.putAll(values);
            List<Object> newKey = primaryKey(record);
            if (newKey != null && byPrimaryKey.putIfAbsent(newKey, record) != null) {
                throw new IllegalStateException("Duplicate key " + newKey + " in table " + table.name());
            }
            if (persistedKeys.containsKey(record)) {
                changed.add(record);
            }
        }

        List<Map<String, Object>> find(Map<String, ?> where) {
            if (table.isPrimaryKey(where.keySet()) && !where.containsValue(null)) {
                Map<String, Object> record = byPrimaryKey.get(primaryKey(where));
                return record == null ? List.of() : List.of(record);
            }
            return insertionOrder.stream().filter(record -> matches(record, where)).toList();
        }

        List<Map<String, Object>> records() {
            return insertionOrder;
        }

        int size() {
            return insertionOrder.size();
        }

        private static boolean matches(Map<String, Object> record, Map<String, ?> where) {
            for (Map.Entry<String, ?> condition : where.entrySet()) {
                if (!SqlValues.equal(record.get(condition.getKey()), condition.getValue())) {
                    return false;
                }
            }
            return true;
        }

        private @Nullable List<Object> primaryKey(Map<String, ?> record) {
            List<String> keyColumns = table.primaryKey();
            if (keyColumns.isEmpty()) {
                return null;
            }
            Map<String, Object> caseInsensitive = new LinkedCaseInsensitiveMap<>();
            caseInsensitive.putAll(record);
            List<Object> key = new ArrayList<>(keyColumns.size());
            for (String column : keyColumns) {
                Object value = caseInsensitive.get(column);
                if (value == null) {
                    return null;
                }
                key.add(SqlValues.normalize(value));
            }
            return key;
        }
    }
}
