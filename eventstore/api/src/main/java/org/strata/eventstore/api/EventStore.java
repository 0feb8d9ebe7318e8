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

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * An append-only store of events, commands and streams.
 * <p>
 * Optimistic concurrency is based on the uniqueness of {@code (aggregateId, sequenceNumber, snapshot)}. When two
 * committers race for the same sequence number of an aggregate, exactly one of them succeeds and the other one
 * receives a {@link ConcurrencyConflictException}.
 */
@NullMarked
public interface EventStore {
    String DEFAULT_SNAPSHOT_EVENT_TYPE = "SnapshotEvent";

    /**
     * Write the command and the events of all streams in one atomic unit. A stream is created if it doesn't exist,
     * otherwise its snapshot threshold is updated. If the partition key of a stream differs from the stored one, a
     * {@link PendingPartitionChange} is recorded and the events are written with the current partition key of the stream.
     *
     * @return The command record with the id assigned by the event store
     * @throws ConcurrencyConflictException if the first sequence number of a stream's events is not exactly the current max sequence number + 1
     */
    CommandRecord append(CommandRecord command, List<StreamWithEvents> streamsWithEvents);

    default CommandRecord append(StreamRecord stream, CommandRecord command, List<EventRecord> events) {
        return append(command, List.of(new StreamWithEvents(stream, events)));
    }

    /**
     * Load the events of several aggregates, in the order of {@code aggregateIds}. For each aggregate the most recent
     * snapshot (if {@code useSnapshots} is {@code true} and a snapshot exists) is returned first, followed by all
     * non-snapshot events with a sequence number greater than or equal to the snapshot's. Without a snapshot all
     * non-snapshot events are returned, starting from sequence number 1.
     * <p>
     * The returned stream is lazy and must be closed by the caller if it's not fully consumed.
     */
    Stream<EventRecord> load(Collection<String> aggregateIds, String snapshotEventType, boolean useSnapshots);

    default Stream<EventRecord> load(String aggregateId, String snapshotEventType, boolean useSnapshots) {
        return load(List.of(aggregateId), snapshotEventType, useSnapshots);
    }

    default Stream<EventRecord> load(String aggregateId) {
        return load(aggregateId, DEFAULT_SNAPSHOT_EVENT_TYPE, true);
    }

    /**
     * Store a snapshot of an aggregate. The snapshot represents the state of the aggregate after applying the event with
     * the same sequence number. Snapshots are never required for correctness.
     */
    void createSnapshot(EventRecord snapshot);

    /**
     * Delete all snapshots of the aggregate. Regular events are never deleted.
     */
    void deleteSnapshots(String aggregateId);

    Optional<StreamRecord> findStream(String aggregateId);

    /**
     * @return The streams of the aggregates that exist, in no particular order
     */
    default List<StreamRecord> findStreams(Collection<String> aggregateIds) {
        return aggregateIds.stream().distinct().map(this::findStream).flatMap(Optional::stream).toList();
    }

    default boolean streamExists(String aggregateId) {
        return findStream(aggregateId).isPresent();
    }

    Optional<CommandRecord> findCommand(long commandId);

    /**
     * @return The non-snapshot event with the given sequence number
     */
    Optional<EventRecord> loadEvent(String aggregateId, long sequenceNumber);

    /**
     * Read committed events, snapshots excluded, in commit order. The commit order is assigned when the transaction
     * that appended the events commits, so paging on the commit order of the last event read never skips an event.
     *
     * @param commitOrder    Only events with a commit order greater than this value are returned
     * @param aggregateTypes Only events of aggregates of these types are returned, all events if empty
     * @param limit          The max number of events to return
     */
    List<EventRecord> readEventsAfter(long commitOrder, Collection<String> aggregateTypes, int limit);

    /**
     * @return The highest commit order that has been assigned to a committed event, 0 if there are no events. Every
     * event with a lower or equal commit order is visible to {@link #readEventsAfter(long, Collection, int)}.
     */
    long lastCommitOrder();

    /**
     * @param lastAggregateId Only aggregate ids greater than this id are returned, {@code null} to start from the beginning
     * @return Aggregate ids, in ascending order, whose number of events since the latest snapshot reached the snapshot threshold of the stream
     */
    List<String> aggregatesThatNeedSnapshots(@Nullable String lastAggregateId, int limit);
}
