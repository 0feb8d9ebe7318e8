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

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.TreeMap;

/**
 * A {@link MigrationStateStore} for tests. There are no transactions, so {@link #lockAgainstMigration()} only checks
 * that no migration is running.
 */
public class InMemoryMigrationStateStore implements MigrationStateStore {
    private final Map<Integer, MigrationStatus> versions = new TreeMap<>();
    private final Map<Integer, Long> replayedUntil = new HashMap<>();
    private Integer runningVersion;

    @Override
    public synchronized int currentVersion() {
        return versions.entrySet().stream()
                .filter(e -> e.getValue() == MigrationStatus.DONE)
                .mapToInt(Map.Entry::getKey)
                .max()
                .orElse(0);
    }

    @Override
    public synchronized Optional<Integer> runningVersion() {
        return Optional.ofNullable(runningVersion);
    }

    @Override
    public synchronized Optional<MigrationStatus> status(int version) {
        return Optional.ofNullable(versions.get(version));
    }

    @Override
    public synchronized void startMigration(int version) {
        if (runningVersion != null) {
            throw new ConcurrentMigrationException("Cannot migrate to version " + version + ", migration to version " + runningVersion + " is running");
        }
        if (versions.get(version) == MigrationStatus.DONE) {
            throw new IllegalStateException("Version " + version + " has already been migrated");
        }
        runningVersion = version;
        versions.put(version, MigrationStatus.ONLINE_RUNNING);
    }

    @Override
    public synchronized void finishOnline(int version, long replayedUntil) {
        requireStatus(version, MigrationStatus.ONLINE_RUNNING);
        versions.put(version, MigrationStatus.ONLINE_FINISHED);
        this.replayedUntil.put(version, replayedUntil);
    }

    @Override
    public synchronized OptionalLong replayedUntil(int version) {
        Long until = replayedUntil.get(version);
        return until == null ? OptionalLong.empty() : OptionalLong.of(until);
    }

    @Override
    public synchronized void startOffline(int version) {
        requireRunning(version);
        if (versions.get(version) == MigrationStatus.OFFLINE_RUNNING) {
            throw new ConcurrentMigrationException("Offline migration to version " + version + " is already running");
        }
        requireStatus(version, MigrationStatus.ONLINE_FINISHED);
        versions.put(version, MigrationStatus.OFFLINE_RUNNING);
    }

    @Override
    public synchronized void interruptOffline(int version) {
        requireStatus(version, MigrationStatus.OFFLINE_RUNNING);
        versions.put(version, MigrationStatus.ONLINE_FINISHED);
    }

    @Override
    public synchronized void finishMigration(int version) {
        requireRunning(version);
        versions.put(version, MigrationStatus.DONE);
        runningVersion = null;
    }

    @Override
    public synchronized void rollback(int version) {
        if (versions.get(version) != MigrationStatus.DONE) {
            versions.remove(version);
            replayedUntil.remove(version);
        }
        if (runningVersion != null && runningVersion == version) {
            runningVersion = null;
        }
    }

    @Override
    public synchronized void lockAgainstMigration() {
        if (runningVersion != null) {
            throw new ConcurrentMigrationException("Partition maintenance cannot run while migration to version " + runningVersion + " is running");
        }
    }

    private void requireStatus(int version, MigrationStatus status) {
        requireRunning(version);
        if (versions.get(version) != status) {
            throw new IllegalStateException("Migration to version " + version + " is " + versions.get(version) + ", expected " + status);
        }
    }

    private void requireRunning(int version) {
        if (runningVersion == null || runningVersion != version) {
            throw new IllegalStateException("Migration to version " + version + " is not running");
        }
    }
}
