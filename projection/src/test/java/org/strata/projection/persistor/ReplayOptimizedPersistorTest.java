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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;
import org.strata.projection.AccountProjector;
import org.strata.projection.ProjectionTable;
import org.strata.testsupport.jdbc.TestDatabase;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.assertj.core.api.Assertions.tuple;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayNameGeneration(ReplaceUnderscores.class)
class ReplayOptimizedPersistorTest {
    private static final String SCHEMA = "replay";
    private static final ProjectionTable ACCOUNTS = AccountProjector.ACCOUNTS;
    private static final ProjectionTable TRANSFERS = ProjectionTable.builder("transfers")
            .column("account_id", "VARCHAR(255) NOT NULL")
            .column("amount", "BIGINT NOT NULL")
            .build();

    private TestDatabase database;
    private ReplayOptimizedPersistor persistor;

    @BeforeEach
    void create_database() {
        database = TestDatabase.create();
        database.jdbcTemplate().execute("CREATE SCHEMA " + SCHEMA);
        database.jdbcTemplate().execute(ACCOUNTS.createTableSql(SCHEMA));
        database.jdbcTemplate().execute(TRANSFERS.createTableSql(SCHEMA));
        persistor = new ReplayOptimizedPersistor(database.dataSource(), database.transactionManager(), SCHEMA, 2);
    }

    @AfterEach
    void shutdown_database() {
        database.close();
    }

    @Test
    void keeps_records_in_memory_until_commit() {
        // When
        persistor.createRecord(ACCOUNTS, Map.of("account_id", "account1", "owner", "Jane", "balance", 0L));

        // Then
        assertAll(
                () -> assertThat(persistor.recordCount()).isEqualTo(1),
                () -> assertThat(persistor.getRecord(ACCOUNTS, Map.of("ACCOUNT_ID", "account1"))).isPresent(),
                () -> assertThat(database.count(ACCOUNTS.qualifiedName(SCHEMA))).isZero()
        );
    }

    @Test
    void updates_records_found_by_primary_key_and_by_other_columns() {
        // Given
        persistor.createRecord(ACCOUNTS, Map.of("account_id", "account1", "owner", "Jane", "balance", 0L));
        persistor.createRecord(ACCOUNTS, Map.of("account_id", "account2", "owner", "Jane", "balance", 0L));
        persistor.createRecord(ACCOUNTS, Map.of("account_id", "account3", "owner", "Joe", "balance", 0L));

        // When
        persistor.updateRecords(ACCOUNTS, Map.of("account_id", "account1"), Map.of("balance", 100));
        persistor.updateRecords(ACCOUNTS, Map.of("owner", "Jane"), Map.of("owner", "Ann"));

        // Then
        assertThat(persistor.findRecords(ACCOUNTS, Map.of("owner", "Ann")))
                .extracting(record -> record.get("account_id"), record -> record.get("balance"))
                .containsExactly(tuple("account1", 100), tuple("account2", 0L));
    }

    @Test
    void integral_values_of_different_types_match() {
        // Given
        persistor.createRecord(ACCOUNTS, Map.of("account_id", "account1", "owner", "Jane", "balance", 10L));

        // Then
        assertThat(persistor.findRecords(ACCOUNTS, Map.of("balance", 10))).hasSize(1);
    }

    @Test
    void creates_or_updates_record() {
        // When
        persistor.createOrUpdateRecord(ACCOUNTS, Map.of("account_id", "account1"), Map.of("owner", "Jane", "balance", 0L));
        persistor.createOrUpdateRecord(ACCOUNTS, Map.of("account_id", "account1"), Map.of("balance", 5L));

        // Then
        assertThat(persistor.findRecords(ACCOUNTS, Map.of()))
                .singleElement()
                .satisfies(record -> assertThat(record).containsEntry("owner", "Jane").containsEntry("balance", 5L));
    }

    @Test
    void deleted_records_can_be_created_again() {
        // Given
        persistor.createRecord(ACCOUNTS, Map.of("account_id", "account1", "owner", "Jane", "balance", 0L));

        // When
        persistor.deleteRecords(ACCOUNTS, Map.of("account_id", "account1"));
        persistor.createRecord(ACCOUNTS, Map.of("account_id", "account1", "owner", "Joe", "balance", 0L));

        // Then
        assertThat(persistor.findRecords(ACCOUNTS, Map.of())).extracting(record -> record.get("owner")).containsExactly("Joe");
    }

    @Test
    void rejects_duplicate_primary_keys() {
        // Given
        persistor.createRecord(ACCOUNTS, Map.of("account_id", "account1", "owner", "Jane", "balance", 0L));

        // When
        Throwable throwable = catchThrowable(() -> persistor.createRecord(ACCOUNTS, Map.of("account_id", "account1", "owner", "Joe", "balance", 0L)));

        // Then
        assertThat(throwable).isExactlyInstanceOf(IllegalStateException.class).hasMessageContaining("Duplicate key");
    }

    @Test
    void tables_without_primary_key_keep_duplicates() {
        // When
        persistor.createRecord(TRANSFERS, Map.of("account_id", "account1", "amount", 10L));
        persistor.createRecord(TRANSFERS, Map.of("account_id", "account1", "amount", 10L));

        // Then
        assertThat(persistor.findRecords(TRANSFERS, Map.of("account_id", "account1"))).hasSize(2);
    }

    @Test
    void commit_writes_all_records_in_batches_and_clears_memory() {
        // Given
        for (int i = 1; i <= 5; i++) {
            persistor.createRecord(ACCOUNTS, Map.of("account_id", "account" + i, "owner", "Jane", "balance", (long) i));
        }
        persistor.createRecord(TRANSFERS, Map.of("account_id", "account1", "amount", 10L));

        // When
        persistor.commit();

        // Then
        List<Map<String, Object>> accounts = database.jdbcTemplate().queryForList("SELECT * FROM replay.accounts ORDER BY account_id");
        assertAll(
                () -> assertThat(accounts).extracting(record -> record.get("account_id"))
                        .containsExactly("account1", "account2", "account3", "account4", "account5"),
                () -> assertThat(database.count(TRANSFERS.qualifiedName(SCHEMA))).isEqualTo(1),
                () -> assertThat(persistor.recordCount()).isZero()
        );
    }

    @Test
    void flush_writes_the_records_and_later_lookups_read_them_from_the_view_schema() {
        // Given
        persistor.createRecord(ACCOUNTS, Map.of("account_id", "account1", "owner", "Jane", "balance", 10L));
        persistor.createRecord(ACCOUNTS, Map.of("account_id", "account2", "owner", "Joe", "balance", 20L));
        persistor.flush();

        // When
        persistor.updateRecords(ACCOUNTS, Map.of("account_id", "account1"), Map.of("balance", 15L));
        persistor.deleteRecords(ACCOUNTS, Map.of("owner", "Joe"));
        persistor.createRecord(ACCOUNTS, Map.of("account_id", "account3", "owner", "Jane", "balance", 30L));

        // Then
        assertAll(
                () -> assertThat(persistor.findRecords(ACCOUNTS, Map.of("owner", "Jane")))
                        .extracting(record -> record.get("account_id"), record -> ((Number) record.get("balance")).longValue())
                        .containsExactlyInAnyOrder(tuple("account1", 15L), tuple("account3", 30L)),
                () -> assertThat(persistor.getRecord(ACCOUNTS, Map.of("account_id", "account2"))).isEmpty(),
                () -> assertThat(database.count(ACCOUNTS.qualifiedName(SCHEMA))).isEqualTo(2)
        );

        // When
        persistor.flush();

        // Then
        assertAll(
                () -> assertThat(persistor.recordCount()).isZero(),
                () -> assertThat(database.jdbcTemplate().queryForList("SELECT account_id, balance FROM replay.accounts ORDER BY account_id"))
                        .extracting(record -> record.get("account_id"), record -> record.get("balance"))
                        .containsExactly(tuple("account1", 15L), tuple("account3", 30L))
        );
    }

    @Test
    void records_of_a_flushed_table_can_be_recreated_after_they_were_deleted() {
        // Given
        persistor.createRecord(ACCOUNTS, Map.of("account_id", "account1", "owner", "Jane", "balance", 10L));
        persistor.flush();

        // When
        persistor.deleteRecords(ACCOUNTS, Map.of("account_id", "account1"));
        persistor.createRecord(ACCOUNTS, Map.of("account_id", "account1", "owner", "Joe", "balance", 0L));
        persistor.commit();

        // Then
        assertThat(database.jdbcTemplate().queryForList("SELECT owner FROM replay.accounts", String.class)).containsExactly("Joe");
    }

    @Test
    void flush_keeps_tables_without_primary_key_in_memory_until_commit() {
        // Given
        persistor.createRecord(TRANSFERS, Map.of("account_id", "account1", "amount", 10L));
        persistor.createRecord(ACCOUNTS, Map.of("account_id", "account1", "owner", "Jane", "balance", 10L));

        // When
        persistor.flush();

        // Then
        assertAll(
                () -> assertThat(persistor.recordCount()).isEqualTo(1),
                () -> assertThat(persistor.flushableRecordCount()).isZero(),
                () -> assertThat(database.count(TRANSFERS.qualifiedName(SCHEMA))).isZero(),
                () -> assertThat(database.count(ACCOUNTS.qualifiedName(SCHEMA))).isEqualTo(1)
        );
    }
}
