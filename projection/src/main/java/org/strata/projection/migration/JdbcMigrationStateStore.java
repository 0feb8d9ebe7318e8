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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

import static java.util.Objects.requireNonNull;

/**
 * Stores the migration state in the {@code migration_versions} and {@code migration_lock} tables. The lock table has
 * a single row, a migration is started by setting its running version, which only succeeds if no other migration
 * has set it first.
 * <p>
 * All operations join an ongoing Spring transaction, so finishing a migration commits together with the schema swap.
 * {@link #lockAgainstMigration()} locks the row of the lock table with {@code SELECT ... FOR UPDATE}, a migration
 * cannot start before the transaction that took the row lock ends.
 */
public class JdbcMigrationStateStore implements MigrationStateStore {
    public static final String SCHEMA_LOCATION = "org/strata/projection/migration/schema.sql";

    private static final Logger log = LoggerFactory.getLogger(JdbcMigrationStateStore.class);
    private static final int LOCK_ID = 1;

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    public JdbcMigrationStateStore(DataSource dataSource, PlatformTransactionManager transactionManager) {
        this(dataSource, transactionManager, false);
    }

    public JdbcMigrationStateStore(DataSource dataSource, PlatformTransactionManager transactionManager, boolean initializeSchema) {
        requireNonNull(dataSource, DataSource.class.getSimpleName() + " cannot be null");
        requireNonNull(transactionManager, PlatformTransactionManager.class.getSimpleName() + " cannot be null");
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        if (initializeSchema) {
            log.info("Initializing migration state schema from {}", SCHEMA_LOCATION);
            new ResourceDatabasePopulator(new ClassPathResource(SCHEMA_LOCATION)).execute(dataSource);
        }
        transactionTemplate.executeWithoutResult(status -> {
            Integer locks = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM migration_lock WHERE id = ?", Integer.class, LOCK_ID);
            if (locks == null || locks == 0) {
                jdbcTemplate.update("INSERT INTO migration_lock (id, running_version) VALUES (?, NULL)", LOCK_ID);
            }
        });
    }

    @Override
    public int currentVersion() {
        Integer version = jdbcTemplate.queryForObject("SELECT MAX(version) FROM migration_versions WHERE status IS NULL", Integer.class);
        return version == null ? 0 : version;
    }

    @Override
    public Optional<Integer> runningVersion() {
        List<Integer> running = jdbcTemplate.queryForList("SELECT running_version FROM migration_lock WHERE id = ?", Integer.class, LOCK_ID);
        return running.isEmpty() ? Optional.empty() : Optional.ofNullable(running.get(0));
    }

    @Override
    public Optional<MigrationStatus> status(int version) {
        List<MigrationStatus> statuses = jdbcTemplate.query("SELECT status FROM migration_versions WHERE version = ?",
                (rs, rowNum) -> MigrationStatus.fromCode(rs.getObject("status", Integer.class)), version);
        return statuses.stream().findFirst();
    }

    @Override
    public void startMigration(int version) {
        transactionTemplate.executeWithoutResult(status -> {
            int claimed = jdbcTemplate.update("UPDATE migration_lock SET running_version = ? WHERE id = ? AND running_version IS NULL", version, LOCK_ID);
            if (claimed == 0) {
                throw new ConcurrentMigrationException("Cannot migrate to version " + version + ", migration to version "
                        + runningVersion().map(String::valueOf).orElse("unknown") + " is running");
            }
            if (status(version).filter(s -> s == MigrationStatus.DONE).isPresent()) {
                throw new IllegalStateException("Version " + version + " has already been migrated");
            }
            // Leftover of a migration that was interrupted before it could roll back
            jdbcTemplate.update("DELETE FROM migration_versions WHERE version = ?", version);
            jdbcTemplate.update("INSERT INTO migration_versions (version, status) VALUES (?, ?)", version, MigrationStatus.ONLINE_RUNNING.code());
        });
    }

    @Override
    public void finishOnline(int version, long replayedUntil) {
        int updated = jdbcTemplate.update("UPDATE migration_versions SET status = ?, replayed_until = ? WHERE version = ? AND status = ?",
                MigrationStatus.ONLINE_FINISHED.code(), replayedUntil, version, MigrationStatus.ONLINE_RUNNING.code());
        if (updated == 0) {
            throw new IllegalStateException("Migration to version " + version + " is not running");
        }
    }

    @Override
    public OptionalLong replayedUntil(int version) {
        List<Long> until = jdbcTemplate.query("SELECT replayed_until FROM migration_versions WHERE version = ?",
                (rs, rowNum) -> rs.getObject("replayed_until", Long.class), version);
        return until.isEmpty() || until.get(0) == null ? OptionalLong.empty() : OptionalLong.of(until.get(0));
    }

    @Override
    public void startOffline(int version) {
        int updated = jdbcTemplate.update("UPDATE migration_versions SET status = ? WHERE version = ? AND status = ?",
                MigrationStatus.OFFLINE_RUNNING.code(), version, MigrationStatus.ONLINE_FINISHED.code());
        if (updated == 0) {
            if (status(version).filter(s -> s == MigrationStatus.OFFLINE_RUNNING).isPresent()) {
                throw new ConcurrentMigrationException("Offline migration to version " + version + " is already running");
            }
            throw new IllegalStateException("Online migration to version " + version + " has not finished");
        }
    }

    @Override
    public void interruptOffline(int version) {
        int updated = jdbcTemplate.update("UPDATE migration_versions SET status = ? WHERE version = ? AND status = ?",
                MigrationStatus.ONLINE_FINISHED.code(), version, MigrationStatus.OFFLINE_RUNNING.code());
        if (updated == 0) {
            throw new IllegalStateException("Offline migration to version " + version + " is not running");
        }
    }

    @Override
    public void finishMigration(int version) {
        transactionTemplate.executeWithoutResult(status -> {
            int updated = jdbcTemplate.update("UPDATE migration_versions SET status = NULL WHERE version = ? AND status IS NOT NULL", version);
            if (updated == 0) {
                throw new IllegalStateException("Migration to version " + version + " is not running");
            }
            jdbcTemplate.update("UPDATE migration_lock SET running_version = NULL WHERE id = ? AND running_version = ?", LOCK_ID, version);
        });
    }

    @Override
    public void rollback(int version) {
        transactionTemplate.executeWithoutResult(status -> {
            jdbcTemplate.update("DELETE FROM migration_versions WHERE version = ? AND status IS NOT NULL", version);
            jdbcTemplate.update("UPDATE migration_lock SET running_version = NULL WHERE id = ? AND running_version = ?", LOCK_ID, version);
        });
    }

    @Override
    public void lockAgainstMigration() {
        List<Integer> running = jdbcTemplate.query("SELECT running_version FROM migration_lock WHERE id = ? FOR UPDATE",
                (rs, rowNum) -> rs.getObject("running_version", Integer.class), LOCK_ID);
        Integer version = running.isEmpty() ? null : running.get(0);
        if (version != null) {
            throw new ConcurrentMigrationException("Partition maintenance cannot run while migration to version " + version + " is running");
        }
    }
}
