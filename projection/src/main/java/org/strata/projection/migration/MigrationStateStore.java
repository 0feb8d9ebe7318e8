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

import java.util.Optional;
import java.util.OptionalLong;

/**
 * Keeps track of the view schema versions and of the migration that is running, if any. At most one migration
 * can run at a time.
 */
public interface MigrationStateStore {

    /**
     * @return The highest version with status {@link MigrationStatus#DONE}, 0 if no migration has finished yet.
     */
    int currentVersion();

    /**
     * @return The version that is being migrated to, or empty if no migration is running.
     */
    Optional<Integer> runningVersion();

    default boolean isMigrationRunning() {
        return runningVersion().isPresent();
    }

    Optional<MigrationStatus> status(int version);

    /**
     * Claim the migration lock for {@code version} and record the version as {@link MigrationStatus#ONLINE_RUNNING}.
     *
     * @throws ConcurrentMigrationException If another migration is running
     */
    void startMigration(int version);

    /**
     * Record that the online replay of {@code version} has finished.
     *
     * @param replayedUntil The commit order of the last event the online replay included
     */
    void finishOnline(int version, long replayedUntil);

    /**
     * @return The commit order up to which the online phase of {@code version} replayed the events
     */
    OptionalLong replayedUntil(int version);

    /**
     * Move {@code version} from {@link MigrationStatus#ONLINE_FINISHED} to {@link MigrationStatus#OFFLINE_RUNNING}.
     *
     * @throws ConcurrentMigrationException If the offline phase of {@code version} is already running
     * @throws IllegalStateException        If the online phase of {@code version} has not finished
     */
    void startOffline(int version);

    /**
     * Move {@code version} back to {@link MigrationStatus#ONLINE_FINISHED} after its offline phase failed, so that the
     * offline phase can be run again.
     */
    void interruptOffline(int version);

    /**
     * Record {@code version} as {@link MigrationStatus#DONE} and release the migration lock.
     */
    void finishMigration(int version);

    /**
     * Forget the unfinished {@code version} and release the migration lock.
     */
    void rollback(int version);

    /**
     * Make sure that no migration runs, and that none can start, until the current transaction ends. Must be invoked
     * in a transaction.
     *
     * @throws ConcurrentMigrationException If a migration is running
     */
    void lockAgainstMigration();
}
