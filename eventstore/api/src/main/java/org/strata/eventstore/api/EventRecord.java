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
 * A serialized event, or a snapshot, as stored in the event store. Immutable once persisted.
 * <p>
 * {@code commandId}, {@code partitionKey} and {@code commitOrder} are assigned by the event store and are {@code null}
 * for events that have not yet been appended.
 */
@NullMarked
public record EventRecord(String aggregateId, long sequenceNumber, String eventType, String eventJson, Instant createdAt,
                          @Nullable Long commandId, @Nullable String partitionKey, @Nullable Long commitOrder) {

    public EventRecord {
        Objects.requireNonNull(aggregateId, "Aggregate id cannot be null");
        Objects.requireNonNull(eventType, "Event type cannot be null");
        Objects.requireNonNull(eventJson, "Event json cannot be null");
        Objects.requireNonNull(createdAt, "Created at cannot be null");
        if (sequenceNumber < 1) {
            throw new IllegalArgumentException("Sequence number must be greater than 0, was " + sequenceNumber);
        }
    }

    /**
     * Create a new event record that is not yet appended to the event store.
     */
    public static EventRecord uncommitted(String aggregateId, long sequenceNumber, String eventType, String eventJson, Instant createdAt) {
        return new EventRecord(aggregateId, sequenceNumber, eventType, eventJson, createdAt, null, null, null);
    }

    public EventRecord persisted(@Nullable Long commandId, String partitionKey, long commitOrder) {
        return new EventRecord(aggregateId, sequenceNumber, eventType, eventJson, createdAt, commandId, partitionKey, commitOrder);
    }
}
