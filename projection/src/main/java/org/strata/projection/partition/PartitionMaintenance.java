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

package org.strata.projection.partition;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.strata.eventstore.api.PartitionKeyStore;
import org.strata.eventstore.api.PendingPartitionChange;
import org.strata.projection.migration.ConcurrentMigrationException;
import org.strata.projection.migration.MigrationStateStore;
import org.strata.transaction.TransactionProvider;
import org.strata.transaction.UnitOfWork;

import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Applies the pending partition key changes, oldest first. Each change is applied in its own transaction, so that
 * a failure leaves the changes that were already applied in place. The transaction holds the migration lock,
 * so a view schema migration cannot start while a change is being applied, and it holds the row lock of the
 * pending change, so concurrent runs apply different changes.
 */
public class PartitionMaintenance {
    private static final Logger log = LoggerFactory.getLogger(PartitionMaintenance.class);

    private final PartitionKeyStore partitionKeyStore;
    private final MigrationStateStore migrationStateStore;
    private final TransactionProvider transactionProvider;

    public PartitionMaintenance(PartitionKeyStore partitionKeyStore, MigrationStateStore migrationStateStore, TransactionProvider transactionProvider) {
        this.partitionKeyStore = requireNonNull(partitionKeyStore, PartitionKeyStore.class.getSimpleName() + " cannot be null");
        this.migrationStateStore = requireNonNull(migrationStateStore, MigrationStateStore.class.getSimpleName() + " cannot be null");
        this.transactionProvider = requireNonNull(transactionProvider, TransactionProvider.class.getSimpleName() + " cannot be null");
    }

    /**
     * @param limit The max number of changes to apply
     * @return The number of changes that were applied
     * @throws ConcurrentMigrationException If a view schema migration is running
     */
    public int run(int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("Limit must be greater than 0");
        }
        int applied = 0;
        while (applied < limit && transactionProvider.transactional(new UnitOfWork(), this::applyOldestChange)) {
            applied++;
        }
        log.info("Applied {} partition key changes", applied);
        return applied;
    }

    private boolean applyOldestChange() {
        migrationStateStore.lockAgainstMigration();
        Optional<PendingPartitionChange> oldest = partitionKeyStore.oldestPendingPartitionChange();
        if (oldest.isEmpty()) {
            return false;
        }
        PendingPartitionChange change = oldest.get();
        int events = partitionKeyStore.repointEvents(change);
        partitionKeyStore.deletePendingPartitionChange(change);
        log.debug("Repointed {} events for {}", events, change);
        return true;
    }
}
