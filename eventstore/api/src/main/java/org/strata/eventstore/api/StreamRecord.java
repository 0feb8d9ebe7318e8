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

package org.strata.eventstore.api;

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.Objects;

/**
 * One stream per aggregate instance.
 *
 * @param snapshotThreshold The number of events after the latest snapshot that triggers a new snapshot, {@code null} if the aggregate is never snapshotted.
 * @param partitionKey      The key used to segment the events of the aggregate, empty string if partitioning is not used.
 */
@NullMarked
public record StreamRecord(String aggregateId, String aggregateType, Instant createdAt, @Nullable Integer snapshotThreshold, String partitionKey) {
    public static final String DEFAULT_PARTITION_KEY = "";

    public StreamRecord {
        Objects.requireNonNull(aggregateId, "Aggregate id cannot be null");
        Objects.requireNonNull(aggregateType, "Aggregate type cannot be null");
        Objects.requireNonNull(createdAt, "Created at cannot be null");
        Objects.requireNonNull(partitionKey, "Partition key cannot be null");
        if (snapshotThreshold != null && snapshotThreshold < 1) {
            throw new IllegalArgumentException("Snapshot threshold must be greater than 0");
        }
    }

    public StreamRecord(String aggregateId, String aggregateType, Instant createdAt, @Nullable Integer snapshotThreshold) {
        this(aggregateId, aggregateType, createdAt, snapshotThreshold, DEFAULT_PARTITION_KEY);
    }

    public StreamRecord withPartitionKey(String partitionKey) {
        return new StreamRecord(aggregateId, aggregateType, createdAt, snapshotThreshold, partitionKey);
    }
}
