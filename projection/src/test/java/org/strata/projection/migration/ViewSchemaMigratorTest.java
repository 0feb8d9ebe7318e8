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

package org.strata.projection.migration;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;
import org.strata.aggregate.AggregateRepository;
import org.strata.application.command.CommandService;
import org.strata.application.command.CommandServiceConfig;
import org.strata.eventstore.api.ErrorKind;
import org.strata.projection.AccountCommands;
import org.strata.projection.AccountCommands.Deposit;
import org.strata.projection.AccountCommands.OpenAccount;
import org.strata.projection.AccountCommands.Withdraw;
import org.strata.projection.AccountProjector;
import org.strata.projection.OwnerProjector;
import org.strata.projection.ProjectorType;
import org.strata.projection.persistor.DryRunReport;
import org.strata.testsupport.domain.BankAccounts;
import org.strata.testsupport.jdbc.TestDatabase;
import org.strata.transaction.ReadWriteTransactionProvider;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.assertj.core.api.Assertions.tuple;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayNameGeneration(ReplaceUnderscores.class)
class ViewSchemaMigratorTest {
    private static final MigrationConfig CONFIG = MigrationConfig.defaultConfig().replayBatchSize(2);

    private TestDatabase database;
    private JdbcMigrationStateStore stateStore;
    private CommandService commandService;

    @BeforeEach
    void create_database_with_accounts() {
        database = TestDatabase.create();
        stateStore = new JdbcMigrationStateStore(database.dataSource(), database.transactionManager(), true);
        commandService = new CommandService(new ReadWriteTransactionProvider(database.transactionManager()),
                () -> new AggregateRepository(database.eventStore(), BankAccounts.aggregateTypes(), BankAccounts.eventConverter()),
                BankAccounts.eventConverter(), CommandServiceConfig.defaultConfig().commandHandlers(AccountCommands.handlers()));
        commandService.execute(new OpenAccount("account1", "Jane"), new Deposit("account1", 100));
        commandService.execute(new OpenAccount("account2", "Joe"));
        commandService.execute(new OpenAccount("account3", "Jane"), new Deposit("account3", 5), new Withdraw("account3", 2));
    }

    @AfterEach
    void shutdown_database() {
        database.close();
    }

    private ViewSchemaMigrator migrator(MigrationVersions versions, MigrationConfig config) {
        return migrator(versions, config, List.of(AccountProjector.TYPE, OwnerProjector.TYPE, FailingProjector.TYPE));
    }

    private ViewSchemaMigrator migrator(MigrationVersions versions, MigrationConfig config, List<ProjectorType> projectorTypes) {
        MigrationPlanner planner = new MigrationPlanner(versions, projectorTypes);
        return new ViewSchemaMigrator(database.dataSource(), database.transactionManager(), database.eventStore(), BankAccounts.eventConverter(),
                planner, stateStore, config);
    }

    private ViewSchemaMigrator migrator(MigrationVersions versions) {
        return migrator(versions, CONFIG);
    }

    private boolean schemaExists(String schema) {
        Integer count = database.jdbcTemplate().queryForObject("SELECT COUNT(*) FROM information_schema.schemata WHERE UPPER(schema_name) = UPPER(?)",
                Integer.class, schema);
        return count != null && count > 0;
    }

    private List<Map<String, Object>> accounts(String schema) {
        return database.jdbcTemplate().queryForList("SELECT account_id, owner, balance FROM " + schema + ".accounts ORDER BY account_id");
    }

    private List<Map<String, Object>> owners(String schema) {
        return database.jdbcTemplate().queryForList("SELECT owner, accounts FROM " + schema + ".owners ORDER BY owner");
    }

    @Test
    void builds_the_view_schema_from_all_events() {
        // When
        MigrationPlan plan = migrator(MigrationVersions.builder().version(1, "accounts", "owners").build()).migrate();

        // Then
        assertAll(
                () -> assertThat(plan.projectorNames()).containsExactly("accounts", "owners"),
                () -> assertThat(accounts("projections")).extracting(r -> r.get("account_id"), r -> r.get("owner"), r -> r.get("balance"))
                        .containsExactly(tuple("account1", "Jane", 100L), tuple("account2", "Joe", 0L), tuple("account3", "Jane", 3L)),
                () -> assertThat(database.jdbcTemplate().queryForList("SELECT owner, accounts FROM projections.owners ORDER BY owner"))
                        .extracting(r -> r.get("owner"), r -> r.get("accounts"))
                        .containsExactly(tuple("Jane", 2L), tuple("Joe", 1L)),
                () -> assertThat(database.count("projections.deposits")).isZero(),
                () -> assertThat(database.count("projections.replayed_ids")).isZero(),
                () -> assertThat(schemaExists("projections_replay")).isFalse(),
                () -> assertThat(stateStore.currentVersion()).isEqualTo(1),
                () -> assertThat(stateStore.isMigrationRunning()).isFalse()
        );
    }

    @Test
    void rebuilds_only_the_projectors_of_new_versions_and_keeps_the_previous_schema() {
        // Given
        migrator(MigrationVersions.builder().version(1, "accounts", "owners").build()).migrate();
        database.jdbcTemplate().update("UPDATE projections.accounts SET balance = 0");
        database.jdbcTemplate().update("DELETE FROM projections.owners WHERE owner = 'Joe'");

        // When
        MigrationPlan plan = migrator(MigrationVersions.builder().version(1, "accounts", "owners").version(2, "accounts").build()).migrate();

        // Then
        assertAll(
                () -> assertThat(plan.fromVersion()).isEqualTo(1),
                () -> assertThat(plan.projectorNames()).containsExactly("accounts"),
                () -> assertThat(accounts("projections")).extracting(r -> r.get("balance")).containsExactly(100L, 0L, 3L),
                () -> assertThat(database.jdbcTemplate().queryForList("SELECT owner FROM projections.owners", String.class)).containsExactly("Jane"),
                () -> assertThat(accounts("projections_v1")).extracting(r -> r.get("balance")).containsOnly(0L),
                () -> assertThat(stateStore.currentVersion()).isEqualTo(2)
        );
    }

    @Test
    void does_nothing_when_the_view_schema_is_up_to_date() {
        // Given
        MigrationVersions versions = MigrationVersions.builder().version(1, "accounts").build();
        migrator(versions).migrate();

        // When
        MigrationPlan plan = migrator(versions).migrate();

        // Then
        assertAll(
                () -> assertThat(plan.isEmpty()).isTrue(),
                () -> assertThat(plan.toVersion()).isEqualTo(1),
                () -> assertThat(schemaExists("projections_v0")).isFalse()
        );
    }

    @Test
    void refuses_to_migrate_to_a_lower_version() {
        // Given
        migrator(MigrationVersions.builder().version(1, "accounts").version(2, "owners").build()).migrate();

        // When
        Throwable throwable = catchThrowable(() -> migrator(MigrationVersions.builder().version(1, "accounts").build()).migrate());

        // Then
        assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class)
                .hasMessage("New version 1 must be greater than or equal to current version 2");
    }

    @Test
    void failed_replay_leaves_the_live_view_schema_untouched() {
        // Given
        migrator(MigrationVersions.builder().version(1, "accounts").build()).migrate();

        // When
        Throwable throwable = catchThrowable(() -> migrator(MigrationVersions.builder().version(1, "accounts").version(2, "deposits").build()).migrate());

        // Then
        assertAll(
                () -> assertThat(throwable).isExactlyInstanceOf(MigrationException.class)
                        .hasRootCauseExactlyInstanceOf(IllegalStateException.class)
                        .hasRootCauseMessage("Cannot project deposit of 100"),
                () -> assertThat(stateStore.currentVersion()).isEqualTo(1),
                () -> assertThat(stateStore.isMigrationRunning()).isFalse(),
                () -> assertThat(stateStore.status(2)).isEmpty(),
                () -> assertThat(schemaExists("projections_replay")).isFalse(),
                () -> assertThat(accounts("projections")).hasSize(3)
        );
    }

    @Test
    void refuses_to_start_while_another_migration_is_running() {
        // Given
        stateStore.startMigration(7);

        // When
        Throwable throwable = catchThrowable(() -> migrator(MigrationVersions.builder().version(1, "accounts").build()).migrate());

        // Then
        assertAll(
                () -> assertThat(throwable).isExactlyInstanceOf(ConcurrentMigrationException.class),
                () -> assertThat(((ConcurrentMigrationException) throwable).kind()).isEqualTo(ErrorKind.CONCURRENT_MIGRATION),
                () -> assertThat(schemaExists("projections")).isFalse(),
                () -> assertThat(stateStore.runningVersion()).contains(7)
        );
    }

    @Test
    void drops_schemas_older_than_the_kept_versions() {
        // Given
        MigrationConfig config = CONFIG.keptVersions(1);
        migrator(MigrationVersions.builder().version(1, "accounts").build(), config).migrate();
        migrator(MigrationVersions.builder().version(1, "accounts").version(2, "accounts").build(), config).migrate();

        // When
        migrator(MigrationVersions.builder().version(1, "accounts").version(2, "accounts").version(3, "accounts").build(), config).migrate();

        // Then
        assertAll(
                () -> assertThat(schemaExists("projections")).isTrue(),
                () -> assertThat(schemaExists("projections_v2")).isTrue(),
                () -> assertThat(schemaExists("projections_v1")).isFalse()
        );
    }

    @Test
    void dry_run_replays_the_selected_projectors_without_writing() {
        // When
        DryRunReport accountsOnly = migrator(MigrationVersions.builder().version(1, "accounts").build()).migrateDryRun(Pattern.compile("^accounts$"));
        DryRunReport all = migrator(MigrationVersions.builder().version(1, "accounts").build()).migrateDryRun(Pattern.compile("accounts|owners"));
        DryRunReport none = migrator(MigrationVersions.builder().version(1, "accounts").build()).migrateDryRun(Pattern.compile("transfers"));

        // Then
        assertAll(
                () -> assertThat(accountsOnly.records()).isEqualTo(3),
                () -> assertThat(all.records()).isEqualTo(5),
                () -> assertThat(none).isEqualTo(DryRunReport.empty()),
                () -> assertThat(schemaExists("projections")).isFalse(),
                () -> assertThat(schemaExists("projections_replay")).isFalse(),
                () -> assertThat(stateStore.currentVersion()).isZero()
        );
    }

    @Test
    void offline_migration_replays_the_events_committed_after_the_online_migration() {
        // Given
        ViewSchemaMigrator migrator = migrator(MigrationVersions.builder().version(1, "accounts", "owners").build());
        long lastCommitOrder = database.eventStore().lastCommitOrder();
        migrator.migrateOnline();
        commandService.execute(new Deposit("account2", 7));
        commandService.execute(new OpenAccount("account4", "Joe"));

        // Then
        assertAll(
                () -> assertThat(stateStore.status(1)).contains(MigrationStatus.ONLINE_FINISHED),
                () -> assertThat(stateStore.replayedUntil(1)).hasValue(lastCommitOrder),
                () -> assertThat(stateStore.runningVersion()).contains(1),
                () -> assertThat(schemaExists("projections")).isFalse(),
                () -> assertThat(accounts("projections_replay")).extracting(r -> r.get("balance")).containsExactly(100L, 0L, 3L)
        );

        // When
        MigrationPlan plan = migrator.migrateOffline();

        // Then
        assertAll(
                () -> assertThat(plan.projectorNames()).containsExactly("accounts", "owners"),
                () -> assertThat(accounts("projections")).extracting(r -> r.get("account_id"), r -> r.get("balance"))
                        .containsExactly(tuple("account1", 100L), tuple("account2", 7L), tuple("account3", 3L), tuple("account4", 0L)),
                () -> assertThat(owners("projections")).extracting(r -> r.get("owner"), r -> r.get("accounts"))
                        .containsExactly(tuple("Jane", 2L), tuple("Joe", 2L)),
                () -> assertThat(database.count("projections.replayed_ids")).isZero(),
                () -> assertThat(schemaExists("projections_replay")).isFalse(),
                () -> assertThat(stateStore.currentVersion()).isEqualTo(1),
                () -> assertThat(stateStore.isMigrationRunning()).isFalse()
        );
    }

    @Test
    void offline_migration_cannot_run_before_the_online_migration() {
        // When
        Throwable throwable = catchThrowable(() -> migrator(MigrationVersions.builder().version(1, "accounts").build()).migrateOffline());

        // Then
        assertAll(
                () -> assertThat(throwable).isInstanceOf(IllegalStateException.class),
                () -> assertThat(stateStore.currentVersion()).isZero()
        );
    }

    @Test
    void failed_offline_migration_keeps_the_shadow_schema_and_resumes_after_the_replayed_events() {
        // Given
        ViewSchemaMigrator migrator = migrator(MigrationVersions.builder().version(1, "accounts", "owners").build(), CONFIG.maxRecordsInMemory(1));
        migrator.migrateOnline();
        commandService.execute(new OpenAccount("account4", "Joe"), new Deposit("account4", 10));
        commandService.execute(new Deposit("account2", 5000));
        database.jdbcTemplate().execute("ALTER TABLE projections_replay.accounts ADD CONSTRAINT small_balance CHECK (balance < 1000)");

        // When
        Throwable throwable = catchThrowable(migrator::migrateOffline);

        // Then
        assertAll(
                () -> assertThat(throwable).isExactlyInstanceOf(MigrationException.class),
                () -> assertThat(stateStore.status(1)).contains(MigrationStatus.ONLINE_FINISHED),
                () -> assertThat(schemaExists("projections")).isFalse(),
                () -> assertThat(accounts("projections_replay")).extracting(r -> r.get("account_id"), r -> r.get("balance"))
                        .containsExactly(tuple("account1", 100L), tuple("account2", 0L), tuple("account3", 3L), tuple("account4", 10L))
        );

        // When
        database.jdbcTemplate().execute("ALTER TABLE projections_replay.accounts DROP CONSTRAINT small_balance");
        migrator.migrateOffline();

        // Then
        assertAll(
                () -> assertThat(accounts("projections")).extracting(r -> r.get("account_id"), r -> r.get("balance"))
                        .containsExactly(tuple("account1", 100L), tuple("account2", 5000L), tuple("account3", 3L), tuple("account4", 10L)),
                () -> assertThat(owners("projections")).extracting(r -> r.get("owner"), r -> r.get("accounts"))
                        .containsExactly(tuple("Jane", 2L), tuple("Joe", 2L)),
                () -> assertThat(stateStore.currentVersion()).isEqualTo(1)
        );
    }

    @Test
    void abort_discards_the_running_migration() {
        // Given
        ViewSchemaMigrator migrator = migrator(MigrationVersions.builder().version(1, "accounts").build());
        migrator.migrateOnline();

        // When
        Optional<Integer> aborted = migrator.abortMigration();

        // Then
        assertAll(
                () -> assertThat(aborted).contains(1),
                () -> assertThat(stateStore.isMigrationRunning()).isFalse(),
                () -> assertThat(stateStore.status(1)).isEmpty(),
                () -> assertThat(schemaExists("projections_replay")).isFalse(),
                () -> assertThat(migrator.abortMigration()).isEmpty()
        );
    }

    @Test
    void replay_that_flushes_records_in_groups_builds_the_same_view_schema() {
        // Given
        commandService.execute(new Deposit("account3", 4), new Withdraw("account1", 50));
        commandService.execute(new OpenAccount("account4", "Joe"), new Deposit("account2", 1));

        // When
        migrator(MigrationVersions.builder().version(1, "accounts", "owners").build(), CONFIG.maxRecordsInMemory(1)).migrate();

        // Then
        assertAll(
                () -> assertThat(accounts("projections")).extracting(r -> r.get("account_id"), r -> r.get("owner"), r -> r.get("balance"))
                        .containsExactly(tuple("account1", "Jane", 50L), tuple("account2", "Joe", 1L), tuple("account3", "Jane", 7L),
                                tuple("account4", "Joe", 0L)),
                () -> assertThat(owners("projections")).extracting(r -> r.get("owner"), r -> r.get("accounts"))
                        .containsExactly(tuple("Jane", 2L), tuple("Joe", 2L)),
                () -> assertThat(database.count("projections.replayed_ids")).isZero()
        );
    }

    @Test
    void replay_only_reads_the_events_of_the_aggregate_types_of_the_projectors() {
        // Given
        List<ProjectorType> projectorTypes = List.of(AccountProjector.TYPE.aggregateTypes("Loan"));

        // When
        migrator(MigrationVersions.builder().version(1, "accounts").build(), CONFIG, projectorTypes).migrate();

        // Then
        assertAll(
                () -> assertThat(stateStore.currentVersion()).isEqualTo(1),
                () -> assertThat(accounts("projections")).isEmpty()
        );
    }
}
