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

package org.strata.eventstore.inmemory;

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.strata.eventstore.api.CommandRecord;
import org.strata.eventstore.api.ConcurrencyConflictException;
import org.strata.eventstore.api.EventRecord;
import org.strata.eventstore.api.EventStore;
import org.strata.eventstore.api.EventStoreException;
import org.strata.eventstore.api.PartitionKeyStore;
import org.strata.eventstore.api.PendingPartitionChange;
import org.strata.eventstore.api.StreamRecord;
import org.strata.eventstore.api.StreamWithEvents;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Consumer;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;

/**
 * This is an {@link EventStore} that stores events in-memory. This is mainly useful for testing
 * and/or demo purposes. It enforces the same constraints as the JDBC event store, assigns command ids and commit order
 * and records pending partition key changes, so it also supports the {@link PartitionKeyStore} contract.
 */
@NullMarked
public class InMemoryEventStore implements EventStore, PartitionKeyStore {

    private final Map<String, StreamRecord> streams = new TreeMap<>();
    private final Map<String, List<EventRecord>> events = new HashMap<>();
    private final Map<String, List<EventRecord>> snapshots = new HashMap<>();
    private final Map<Long, CommandRecord> commands = new HashMap<>();
    // Insertion order is the age of the change
    private final Map<String, PendingPartitionChange> pendingPartitionChanges = new LinkedHashMap<>();
    private final Consumer<List<EventRecord>> listener;

    private long lastCommandId = 0;
    private long lastCommitOrder = 0;

    public InMemoryEventStore() {
        // @formatter:off
        this(__ -> {});
        // @formatter:on
    }

    /**
     * Create an instance of {@link InMemoryEventStore} that has a <code>listener</code> that will be invoked
     * (synchronously) after events have been appended to the event store.
     */
    public InMemoryEventStore(Consumer<List<EventRecord>> listener) {
        requireNonNull(listener, "listener cannot be null");
        this.listener = listener;
    }

    @Override
    public CommandRecord append(CommandRecord command, List<StreamWithEvents> streamsWithEvents) {
        requireNonNull(command, CommandRecord.class.getSimpleName() + " cannot be null");
        requireNonNull(streamsWithEvents, "Streams with events cannot be null");

        final List<EventRecord> appended = new ArrayList<>();
        final CommandRecord persistedCommand;
        synchronized (this) {
            // Verify everything before changing any state to make the append atomic
            Map<String, Long> nextSequenceNumbers = new HashMap<>();
            for (StreamWithEvents streamWithEvents : streamsWithEvents) {
                String aggregateId = streamWithEvents.stream().aggregateId();
                long next = nextSequenceNumbers.computeIfAbsent(aggregateId, id -> (long) events.getOrDefault(id, List.of()).size() + 1);
                for (EventRecord event : streamWithEvents.events()) {
                    if (event.sequenceNumber() != next) {
                        throw new ConcurrencyConflictException(aggregateId, event.sequenceNumber(),
                                String.format("Cannot append event with sequence number %d to aggregate %s, expected sequence number %d.", event.sequenceNumber(), aggregateId, next));
                    }
                    next++;
                }
                nextSequenceNumbers.put(aggregateId, next);
            }

            long commandId = ++lastCommandId;
            persistedCommand = command.withId(commandId);
            commands.put(commandId, persistedCommand);

            for (StreamWithEvents streamWithEvents : streamsWithEvents) {
                StreamRecord stream = upsertStream(streamWithEvents.stream());
                List<EventRecord> streamEvents = events.computeIfAbsent(stream.aggregateId(), __ -> new ArrayList<>());
                for (EventRecord event : streamWithEvents.events()) {
                    EventRecord persisted = event.persisted(commandId, stream.partitionKey(), ++lastCommitOrder);
                    streamEvents.add(persisted);
                    appended.add(persisted);
                }
            }
        }

        if (!appended.isEmpty()) {
            listener.accept(List.copyOf(appended));
        }
        return persistedCommand;
    }

    private StreamRecord upsertStream(StreamRecord stream) {
        StreamRecord existing = streams.get(stream.aggregateId());
        if (existing == null) {
            streams.put(stream.aggregateId(), stream);
            return stream;
        }

        StreamRecord updated = new StreamRecord(existing.aggregateId(), existing.aggregateType(), existing.createdAt(), stream.snapshotThreshold(), existing.partitionKey());
        streams.put(stream.aggregateId(), updated);

        PendingPartitionChange pending = pendingPartitionChanges.get(stream.aggregateId());
        if (Objects.equals(stream.partitionKey(), existing.partitionKey())) {
            pendingPartitionChanges.remove(stream.aggregateId());
        } else if (pending == null || !pending.newPartitionKey().equals(stream.partitionKey())) {
            pendingPartitionChanges.remove(stream.aggregateId());
            pendingPartitionChanges.put(stream.aggregateId(), new PendingPartitionChange(stream.aggregateId(), existing.partitionKey(), stream.partitionKey()));
        }
        return updated;
    }

    @Override
    public Stream<EventRecord> load(Collection<String> aggregateIds, String snapshotEventType, boolean useSnapshots) {
        requireNonNull(aggregateIds, "Aggregate ids cannot be null");
        requireNonNull(snapshotEventType, "Snapshot event type cannot be null");
        List<String> ids = List.copyOf(aggregateIds);
        return ids.stream().flatMap(aggregateId -> loadSingle(aggregateId, snapshotEventType, useSnapshots).stream());
    }

    private synchronized List<EventRecord> loadSingle(String aggregateId, String snapshotEventType, boolean useSnapshots) {
        List<EventRecord> streamEvents = events.getOrDefault(aggregateId, List.of());
        EventRecord snapshot = useSnapshots ? latestSnapshot(aggregateId, snapshotEventType) : null;
        if (snapshot == null) {
            return List.copyOf(streamEvents);
        }
        List<EventRecord> result = new ArrayList<>();
        result.add(snapshot);
        streamEvents.stream().filter(e -> e.sequenceNumber() >= snapshot.sequenceNumber()).forEach(result::add);
        return result;
    }

    private @Nullable EventRecord latestSnapshot(String aggregateId, String snapshotEventType) {
        return snapshots.getOrDefault(aggregateId, List.of()).stream()
                .filter(s -> s.eventType().equals(snapshotEventType))
                .max(Comparator.comparingLong(EventRecord::sequenceNumber))
                .orElse(null);
    }

    @Override
    public synchronized void createSnapshot(EventRecord snapshot) {
        requireNonNull(snapshot, "Snapshot cannot be null");
        StreamRecord stream = streams.get(snapshot.aggregateId());
        if (stream == null) {
            throw new EventStoreException("Cannot create snapshot for aggregate " + snapshot.aggregateId() + " since it has no stream");
        }
        List<EventRecord> streamSnapshots = snapshots.computeIfAbsent(snapshot.aggregateId(), __ -> new ArrayList<>());
        if (streamSnapshots.stream().anyMatch(s -> s.sequenceNumber() == snapshot.sequenceNumber())) {
            throw new ConcurrencyConflictException(snapshot.aggregateId(), snapshot.sequenceNumber(),
                    String.format("Snapshot with sequence number %d already exists for aggregate %s.", snapshot.sequenceNumber(), snapshot.aggregateId()));
        }
        streamSnapshots.add(snapshot.persisted(null, stream.partitionKey(), ++lastCommitOrder));
    }

    @Override
    public synchronized void deleteSnapshots(String aggregateId) {
        requireNonNull(aggregateId, "Aggregate id cannot be null");
        snapshots.remove(aggregateId);
    }

    @Override
    public synchronized Optional<StreamRecord> findStream(String aggregateId) {
        requireNonNull(aggregateId, "Aggregate id cannot be null");
        return Optional.ofNullable(streams.get(aggregateId));
    }

    @Override
    public synchronized List<StreamRecord> findStreams(Collection<String> aggregateIds) {
        requireNonNull(aggregateIds, "Aggregate ids cannot be null");
        return aggregateIds.stream().distinct().map(streams::get).filter(Objects::nonNull).toList();
    }

    @Override
    public synchronized Optional<CommandRecord> findCommand(long commandId) {
        return Optional.ofNullable(commands.get(commandId));
    }

    @Override
    public synchronized Optional<EventRecord> loadEvent(String aggregateId, long sequenceNumber) {
        List<EventRecord> streamEvents = events.getOrDefault(aggregateId, List.of());
        if (sequenceNumber < 1 || sequenceNumber > streamEvents.size()) {
            return Optional.empty();
        }
        return Optional.of(streamEvents.get((int) sequenceNumber - 1));
    }

    @Override
    public synchronized List<EventRecord> readEventsAfter(long commitOrder, Collection<String> aggregateTypes, int limit) {
        requireNonNull(aggregateTypes, "Aggregate types cannot be null");
        return events.values().stream()
                .flatMap(List::stream)
                .filter(e -> requireNonNull(e.commitOrder()) > commitOrder)
                .filter(e -> aggregateTypes.isEmpty() || aggregateTypes.contains(streams.get(e.aggregateId()).aggregateType()))
                .sorted(Comparator.comparing(EventRecord::commitOrder))
                .limit(limit)
                .toList();
    }

    @Override
    public synchronized long lastCommitOrder() {
        return lastCommitOrder;
    }

    @Override
    public synchronized List<String> aggregatesThatNeedSnapshots(@Nullable String lastAggregateId, int limit) {
        return streams.values().stream()
                .filter(s -> lastAggregateId == null || s.aggregateId().compareTo(lastAggregateId) > 0)
                .filter(s -> s.snapshotThreshold() != null)
                .filter(s -> eventsSinceLatestSnapshot(s.aggregateId()) >= requireNonNull(s.snapshotThreshold()))
                .map(StreamRecord::aggregateId)
                .limit(limit)
                .toList();
    }

    private long eventsSinceLatestSnapshot(String aggregateId) {
        long latestSnapshotSequenceNumber = snapshots.getOrDefault(aggregateId, List.of()).stream().mapToLong(EventRecord::sequenceNumber).max().orElse(0);
        return events.getOrDefault(aggregateId, List.of()).stream().filter(e -> e.sequenceNumber() > latestSnapshotSequenceNumber).count();
    }

    @Override
    public synchronized Optional<PendingPartitionChange> oldestPendingPartitionChange() {
        return pendingPartitionChanges.values().stream().findFirst();
    }

    @Override
    public synchronized int repointEvents(PendingPartitionChange change) {
        requireNonNull(change, PendingPartitionChange.class.getSimpleName() + " cannot be null");
        String aggregateId = change.aggregateId();
        StreamRecord stream = streams.get(aggregateId);
        if (stream == null) {
            return 0;
        }
        if (!stream.partitionKey().equals(change.newPartitionKey())) {
            streams.put(aggregateId, stream.withPartitionKey(change.newPartitionKey()));
        }
        int count = 0;
        List<EventRecord> streamEvents = events.getOrDefault(aggregateId, new ArrayList<>());
        for (int i = 0; i < streamEvents.size(); i++) {
            EventRecord e = streamEvents.get(i);
            if (!change.newPartitionKey().equals(e.partitionKey())) {
                streamEvents.set(i, e.persisted(e.commandId(), change.newPartitionKey(), requireNonNull(e.commitOrder())));
                count++;
            }
        }
        return count;
    }

    @Override
    public synchronized void deletePendingPartitionChange(PendingPartitionChange change) {
        requireNonNull(change, PendingPartitionChange.class.getSimpleName() + " cannot be null");
        pendingPartitionChanges.remove(change.aggregateId());
    }

    @Override
    public synchronized List<PendingPartitionChange> pendingPartitionChanges() {
        return List.copyOf(pendingPartitionChanges.values());
    }
}
