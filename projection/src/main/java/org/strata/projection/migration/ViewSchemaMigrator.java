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

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.strata.aggregate.EventConverter;
import org.strata.eventstore.api.EventStore;
import org.strata.projection.ProjectionTable;
import org.strata.projection.ProjectorType;
import org.strata.projection.persistor.DryRunPersistor;
import org.strata.projection.persistor.DryRunReport;
import org.strata.projection.persistor.ReplayOptimizedPersistor;

import javax.sql.DataSource;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.util.Objects.requireNonNull;

/**
 * Migrates the view schema to the version defined by the {@link MigrationVersions} of the {@link MigrationPlanner}.
 * <p>
 * A migration has two phases:
 * <ol>
 *     <li>{@link #migrateOnline()} rebuilds the projectors that the new versions list by replaying the events committed so far
 *     into a shadow schema, while the live view schema keeps serving reads and commands are accepted. The tables of the other
 *     projectors are copied to the shadow schema as they are.</li>
 *     <li>{@link #migrateOffline()} replays the events committed since the online phase started and replaces the live schema
 *     with the shadow schema. It must run while no commands are accepted. The live schema is renamed to
 *     {@code <view schema>_v<old version>}, superseded schemas are kept for {@link MigrationConfig#keptVersions} versions.</li>
 * </ol>
 * The commit order of every replayed event is written to the {@code replayed_ids} table of the shadow schema together with the
 * records it produced. An offline phase that fails keeps the shadow schema, running it again continues with the events that
 * are not in {@code replayed_ids}. {@link #abortMigration()} discards a migration that is not finished.
 */
public class ViewSchemaMigrator {
    private static final Logger log = LoggerFactory.getLogger(ViewSchemaMigrator.class);
    private static final Pattern ALL_PROJECTORS = Pattern.compile(".*");

    private final DataSource dataSource;
    private final PlatformTransactionManager transactionManager;
    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final EventStore eventStore;
    private final MigrationPlanner planner;
    private final MigrationStateStore stateStore;
    private final MigrationConfig config;
    private final EventReplayer replayer;

    public ViewSchemaMigrator(DataSource dataSource, PlatformTransactionManager transactionManager, EventStore eventStore, EventConverter eventConverter,
                              MigrationPlanner planner, MigrationStateStore stateStore) {
        this(dataSource, transactionManager, eventStore, eventConverter, planner, stateStore, MigrationConfig.defaultConfig());
    }

    public ViewSchemaMigrator(DataSource dataSource, PlatformTransactionManager transactionManager, EventStore eventStore, EventConverter eventConverter,
                              MigrationPlanner planner, MigrationStateStore stateStore, MigrationConfig config) {
        requireNonNull(eventConverter, EventConverter.class.getSimpleName() + " cannot be null");
        this.dataSource = requireNonNull(dataSource, DataSource.class.getSimpleName() + " cannot be null");
        this.transactionManager = requireNonNull(transactionManager, PlatformTransactionManager.class.getSimpleName() + " cannot be null");
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.eventStore = requireNonNull(eventStore, EventStore.class.getSimpleName() + " cannot be null");
        this.planner = requireNonNull(planner, MigrationPlanner.class.getSimpleName() + " cannot be null");
        this.stateStore = requireNonNull(stateStore, MigrationStateStore.class.getSimpleName() + " cannot be null");
        this.config = requireNonNull(config, MigrationConfig.class.getSimpleName() + " cannot be null");
        this.replayer = new EventReplayer(eventStore, eventConverter, config.replayBatchSize, config.maxRecordsInMemory);
    }

    public int currentVersion() {
        return stateStore.currentVersion();
    }

    public int newVersion() {
        return planner.versions().currentVersion();
    }

    /**
     * Run {@link #migrateOnline()} followed by {@link #migrateOffline()}. If the offline phase fails the migration is aborted.
     * Does nothing if the view schema is up to date.
     *
     * @return The plan that was executed
     * @throws IllegalArgumentException     If the new version is lower than the current version
     * @throws ConcurrentMigrationException If another migration is running
     * @throws MigrationException           If the migration failed, the live view schema is left untouched
     */
    public MigrationPlan migrate() {
        MigrationPlan plan = migrateOnline();
        if (plan.fromVersion() == plan.toVersion()) {
            return plan;
        }
        try {
            migrateOffline();
        } catch (MigrationException e) {
            rollback(plan.toVersion(), e);
            throw e;
        }
        return plan;
    }

    /**
     * Create the shadow schema and replay the events committed so far into it. The migration stays running until
     * {@link #migrateOffline()} or {@link #abortMigration()}. Does nothing if the view schema is up to date.
     *
     * @return The plan that is executed
     * @throws IllegalArgumentException     If the new version is lower than the current version
     * @throws ConcurrentMigrationException If another migration is running
     * @throws MigrationException           If the replay failed, the migration is rolled back and the shadow schema dropped
     */
    public MigrationPlan migrateOnline() {
        int currentVersion = stateStore.currentVersion();
        int newVersion = newVersion();
        if (newVersion < currentVersion) {
            throw new IllegalArgumentException("New version " + newVersion + " must be greater than or equal to current version " + currentVersion);
        }
        if (newVersion == currentVersion) {
            log.info("View schema {} is up to date at version {}", config.viewSchema, currentVersion);
            return MigrationPlan.upToDate(currentVersion);
        }

        MigrationPlan plan = planner.plan(currentVersion, newVersion);
        stateStore.startMigration(newVersion);
        try {
            log.info("Migrating view schema {} from version {} to {} online, rebuilding {}", config.viewSchema, currentVersion, newVersion, plan.projectorNames());
            createShadowSchema(plan);
            long replayUntil = eventStore.lastCommitOrder();
            replay(plan, 0, replayUntil);
            stateStore.finishOnline(newVersion, replayUntil);
            log.info("Online migration of view schema {} to version {} replayed the events up to commit order {}", config.viewSchema, newVersion, replayUntil);
        } catch (RuntimeException e) {
            log.error("Online migration of view schema {} to version {} failed, rolling back", config.viewSchema, newVersion, e);
            rollback(newVersion, e);
            throw new MigrationException("Migration of view schema " + config.viewSchema + " to version " + newVersion + " failed", e);
        }
        return plan;
    }

    /**
     * Replay the events committed since {@link #migrateOnline()} into the shadow schema and make it the live view schema.
     * No commands may be executed while this runs. Does nothing if the view schema is up to date.
     *
     * @return The plan that was executed
     * @throws IllegalStateException        If the online phase of the new version has not finished
     * @throws ConcurrentMigrationException If the offline phase is already running
     * @throws MigrationException           If the replay or the swap failed, the shadow schema is kept so that the offline phase can
     *                                      be run again
     */
    public MigrationPlan migrateOffline() {
        int currentVersion = stateStore.currentVersion();
        int newVersion = newVersion();
        if (newVersion == currentVersion) {
            log.info("View schema {} is up to date at version {}", config.viewSchema, currentVersion);
            return MigrationPlan.upToDate(currentVersion);
        }

        MigrationPlan plan = planner.plan(currentVersion, newVersion);
        stateStore.startOffline(newVersion);
        try {
            long replayedUntil = stateStore.replayedUntil(newVersion)
                    .orElseThrow(() -> new IllegalStateException("Online migration to version " + newVersion + " did not record where its replay ended"));
            log.info("Migrating view schema {} to version {} offline, replaying the events after commit order {}", config.viewSchema, newVersion, replayedUntil);
            replay(plan, replayedUntil, Long.MAX_VALUE);
            swapSchemas(currentVersion, newVersion);
        } catch (RuntimeException e) {
            log.error("Offline migration of view schema {} to version {} failed, keeping {} to resume from", config.viewSchema, newVersion, config.shadowSchema, e);
            interruptOffline(newVersion, e);
            throw new MigrationException("Migration of view schema " + config.viewSchema + " to version " + newVersion + " failed", e);
        }
        log.info("Migrated view schema {} to version {}", config.viewSchema, newVersion);
        dropSupersededSchemas(newVersion);
        return plan;
    }

    /**
     * Roll back the running migration, if any, and drop the shadow schema.
     *
     * @return The version of the migration that was aborted
     */
    public Optional<Integer> abortMigration() {
        Optional<Integer> running = stateStore.runningVersion();
        running.ifPresent(version -> {
            log.warn("Aborting migration of view schema {} to version {}", config.viewSchema, version);
            stateStore.rollback(version);
            dropSchema(config.shadowSchema);
        });
        return running;
    }

    /**
     * Replay all events into the projectors whose name matches {@code projectorNames} without writing anything,
     * to find out how long a migration would take.
     *
     * @param projectorNames Selects the projectors by name, all projectors if {@code null}
     */
    public DryRunReport migrateDryRun(@Nullable Pattern projectorNames) {
        Pattern selection = projectorNames == null ? ALL_PROJECTORS : projectorNames;
        List<ProjectorType> projectorTypes = planner.projectorTypes().stream()
                .filter(type -> selection.matcher(type.name()).find())
                .toList();
        if (projectorTypes.isEmpty()) {
            log.info("No projectors match {}, nothing to replay", selection);
            return DryRunReport.empty();
        }
        log.info("Dry run of projectors {}", projectorTypes.stream().map(ProjectorType::name).toList());
        DryRunPersistor persistor = new DryRunPersistor();
        replayer.replay(projectorTypes, persistor, 0, Long.MAX_VALUE, ReplayedIds.none(), ReplayProgressListener.NONE);
        return persistor.report();
    }

    private void createShadowSchema(MigrationPlan plan) {
        String shadow = config.shadowSchema;
        if (schemaExists(shadow)) {
            log.warn("Dropping shadow schema {} left by an interrupted migration", shadow);
            dropSchema(shadow);
        }
        jdbcTemplate.execute("CREATE SCHEMA " + shadow);
        jdbcTemplate.execute(ReplayedIds.TABLE.createTableSql(shadow));
        for (ProjectorType projectorType : planner.projectorTypes()) {
            boolean rebuilt = plan.rebuilds(projectorType);
            for (ProjectionTable table : projectorType.managedTables()) {
                jdbcTemplate.execute(table.createTableSql(shadow));
                if (!rebuilt && tableExists(config.viewSchema, table.name())) {
                    String columns = String.join(", ", table.columnNames());
                    int copied = jdbcTemplate.update("INSERT INTO " + table.qualifiedName(shadow) + " (" + columns + ")" +
                            " SELECT " + columns + " FROM " + table.qualifiedName(config.viewSchema));
                    log.debug("Copied {} records of {} to {}", copied, table.name(), shadow);
                }
            }
        }
    }

    private void replay(MigrationPlan plan, long after, long upTo) {
        if (plan.isEmpty()) {
            return;
        }
        ReplayOptimizedPersistor persistor = new ReplayOptimizedPersistor(dataSource, transactionManager, config.shadowSchema, config.replayBatchSize);
        if (after > 0) {
            persistor.readFromViewSchema(plan.tables());
        }
        ReplayedIds replayedIds = ReplayedIds.recordedIn(jdbcTemplate, config.shadowSchema, after);
        if (replayedIds.size() > 0) {
            log.info("Skipping {} events that were already replayed into {}", replayedIds.size(), config.shadowSchema);
        }
        long replayed = replayer.replay(plan.projectors(), persistor, after, upTo, replayedIds, (progress, done, aggregateIds) -> {
            if (done) {
                log.info("Replayed {} events into {}", progress, config.shadowSchema);
            } else {
                log.debug("Replayed {} events", progress);
            }
        });
        log.debug("Replayed {} events after commit order {}", replayed, after);
    }

    private void swapSchemas(int currentVersion, int newVersion) {
        transactionTemplate.executeWithoutResult(status -> {
            if (schemaExists(config.viewSchema)) {
                String archived = config.archivedSchema(currentVersion);
                if (schemaExists(archived)) {
                    dropSchema(archived);
                }
                jdbcTemplate.execute("ALTER SCHEMA " + config.viewSchema + " RENAME TO " + archived);
                log.info("Renamed view schema {} to {}", config.viewSchema, archived);
            }
            jdbcTemplate.execute("ALTER SCHEMA " + config.shadowSchema + " RENAME TO " + config.viewSchema);
            jdbcTemplate.update("DELETE FROM " + ReplayedIds.TABLE.qualifiedName(config.viewSchema));
            stateStore.finishMigration(newVersion);
        });
    }

    private void dropSupersededSchemas(int newVersion) {
        Pattern archivedSchema = Pattern.compile(Pattern.quote(config.viewSchema.toLowerCase(Locale.ROOT)) + "_v(\\d+)");
        List<String> schemas = jdbcTemplate.queryForList("SELECT schema_name FROM information_schema.schemata", String.class);
        for (String schema : schemas) {
            Matcher matcher = archivedSchema.matcher(schema.toLowerCase(Locale.ROOT));
            if (matcher.matches() && Integer.parseInt(matcher.group(1)) < newVersion - config.keptVersions) {
                log.info("Dropping superseded view schema {}", schema);
                dropSchema(schema);
            }
        }
    }

    private void rollback(int newVersion, RuntimeException failure) {
        try {
            stateStore.rollback(newVersion);
            dropSchema(config.shadowSchema);
        } catch (RuntimeException e) {
            failure.addSuppressed(e);
        }
    }

    private void interruptOffline(int newVersion, RuntimeException failure) {
        try {
            stateStore.interruptOffline(newVersion);
        } catch (RuntimeException e) {
            failure.addSuppressed(e);
        }
    }

    private boolean schemaExists(String schema) {
        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM information_schema.schemata WHERE UPPER(schema_name) = UPPER(?)",
                Integer.class, schema);
        return count != null && count > 0;
    }

    private boolean tableExists(String schema, String table) {
        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM information_schema.tables" +
                " WHERE UPPER(table_schema) = UPPER(?) AND UPPER(table_name) = UPPER(?)", Integer.class, schema, table);
        return count != null && count > 0;
    }

    private void dropSchema(String schema) {
        jdbcTemplate.execute("DROP SCHEMA IF EXISTS " + schema + " CASCADE");
    }
}
