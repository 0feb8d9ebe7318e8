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

package org.strata.aggregate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.strata.eventstore.api.EventStore;

import java.util.List;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * Takes snapshots of the aggregates whose number of events since their latest snapshot reached the snapshot threshold of their stream.
 * Typically invoked periodically in the background. A failure to snapshot one aggregate is logged and doesn't prevent the others
 * from being snapshotted.
 */
public class AggregateSnapshotter {
    private static final Logger log = LoggerFactory.getLogger(AggregateSnapshotter.class);
    private static final int DEFAULT_PAGE_SIZE = 100;

    private final EventStore eventStore;
    private final Supplier<AggregateRepository> repositoryFactory;
    private final int pageSize;

    /**
     * @param repositoryFactory Creates the repository used to load each aggregate, a new repository is created for every aggregate
     */
    public AggregateSnapshotter(EventStore eventStore, Supplier<AggregateRepository> repositoryFactory) {
        this(eventStore, repositoryFactory, DEFAULT_PAGE_SIZE);
    }

    public AggregateSnapshotter(EventStore eventStore, Supplier<AggregateRepository> repositoryFactory, int pageSize) {
        requireNonNull(eventStore, EventStore.class.getSimpleName() + " cannot be null");
        requireNonNull(repositoryFactory, "Repository factory cannot be null");
        if (pageSize < 1) {
            throw new IllegalArgumentException("Page size must be greater than 0");
        }
        this.eventStore = eventStore;
        this.repositoryFactory = repositoryFactory;
        this.pageSize = pageSize;
    }

    /**
     * Snapshot at most {@code limit} aggregates that need a snapshot.
     *
     * @return The number of snapshots taken
     */
    public int takeSnapshots(int limit) {
        int taken = 0;
        int attempted = 0;
        String lastAggregateId = null;
        while (attempted < limit) {
            List<String> aggregateIds = eventStore.aggregatesThatNeedSnapshots(lastAggregateId, Math.min(pageSize, limit - attempted));
            if (aggregateIds.isEmpty()) {
                break;
            }
            for (String aggregateId : aggregateIds) {
                attempted++;
                try {
                    if (takeSnapshot(aggregateId)) {
                        taken++;
                    }
                } catch (RuntimeException e) {
                    log.error("Failed to take snapshot of aggregate {}, skipping it", aggregateId, e);
                }
            }
            lastAggregateId = aggregateIds.get(aggregateIds.size() - 1);
        }
        log.info("Took {} snapshots", taken);
        return taken;
    }

    /**
     * @return {@code true} if a snapshot was taken
     */
    public boolean takeSnapshot(String aggregateId) {
        requireNonNull(aggregateId, "Aggregate id cannot be null");
        AggregateRepository repository = repositoryFactory.get();
        try {
            return repository.takeSnapshot(aggregateId);
        } finally {
            repository.clear();
        }
    }
}
