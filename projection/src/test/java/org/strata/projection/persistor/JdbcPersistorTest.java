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
import org.strata.projection.ProjectionTable;
import org.strata.testsupport.jdbc.TestDatabase;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

@DisplayNameGeneration(ReplaceUnderscores.class)
class JdbcPersistorTest {
    private static final ProjectionTable TRANSACTIONS = ProjectionTable.builder("transactions")
            .column("transaction_id", "VARCHAR(255) NOT NULL")
            .column("account_id", "VARCHAR(255)")
            .column("amount", "BIGINT NOT NULL")
            .column("booked_at", "TIMESTAMP WITH TIME ZONE")
            .primaryKey("transaction_id")
            .build();

    private TestDatabase database;
    private JdbcPersistor persistor;

    @BeforeEach
    void create_database() {
        database = TestDatabase.create();
        database.jdbcTemplate().execute("CREATE SCHEMA projections");
        database.jdbcTemplate().execute(TRANSACTIONS.createTableSql("projections"));
        persistor = new JdbcPersistor(database.dataSource(), "projections");
    }

    @AfterEach
    void shutdown_database() {
        database.close();
    }

    @Test
    void stores_instants_as_utc_timestamps() {
        // Given
        Instant bookedAt = Instant.parse("2024-03-01T10:15:30Z");

        // When
        persistor.createRecord(TRANSACTIONS, Map.of("transaction_id", "t1", "account_id", "account1", "amount", 10L, "booked_at", bookedAt));

        // Then
        assertThat(persistor.getRecord(TRANSACTIONS, Map.of("transaction_id", "t1")))
                .hasValueSatisfying(record -> assertThat(record.get("booked_at")).isEqualTo(OffsetDateTime.of(2024, 3, 1, 10, 15, 30, 0, ZoneOffset.UTC)));
    }

    @Test
    void null_conditions_match_null_columns() {
        // Given
        Map<String, Object> unassigned = new HashMap<>();
        unassigned.put("transaction_id", "t1");
        unassigned.put("account_id", null);
        unassigned.put("amount", 10L);
        persistor.createRecord(TRANSACTIONS, unassigned);
        persistor.createRecord(TRANSACTIONS, Map.of("transaction_id", "t2", "account_id", "account1", "amount", 20L));

        // When
        Map<String, Object> where = new HashMap<>();
        where.put("account_id", null);
        persistor.updateRecords(TRANSACTIONS, where, Map.of("account_id", "suspense"));

        // Then
        assertThat(persistor.findRecords(TRANSACTIONS, Map.of("account_id", "suspense")))
                .extracting(record -> record.get("transaction_id"))
                .containsExactly("t1");
    }

    @Test
    void creates_record_when_update_matches_nothing() {
        // When
        persistor.createOrUpdateRecord(TRANSACTIONS, Map.of("transaction_id", "t1"), Map.of("amount", 10L));
        persistor.createOrUpdateRecord(TRANSACTIONS, Map.of("transaction_id", "t1"), Map.of("amount", 15L));

        // Then
        assertThat(persistor.findRecords(TRANSACTIONS, Map.of()))
                .singleElement()
                .satisfies(record -> assertThat(record).containsEntry("amount", 15L));
    }

    @Test
    void deletes_matching_records() {
        // Given
        persistor.createRecord(TRANSACTIONS, Map.of("transaction_id", "t1", "account_id", "account1", "amount", 10L));
        persistor.createRecord(TRANSACTIONS, Map.of("transaction_id", "t2", "account_id", "account2", "amount", 10L));

        // When
        persistor.deleteRecords(TRANSACTIONS, Map.of("account_id", "account1"));

        // Then
        assertThat(database.count("projections.transactions")).isEqualTo(1);
    }

    @Test
    void rejects_columns_the_table_does_not_have() {
        Throwable throwable = catchThrowable(() -> persistor.createRecord(TRANSACTIONS, Map.of("transaction_id", "t1", "iban", "x")));

        assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class).hasMessageContaining("iban");
    }
}
