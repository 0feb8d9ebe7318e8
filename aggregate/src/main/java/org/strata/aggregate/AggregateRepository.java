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

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.strata.eventstore.api.CommandRecord;
import org.strata.eventstore.api.EventRecord;
import org.strata.eventstore.api.EventStore;
import org.strata.eventstore.api.StreamRecord;
import org.strata.eventstore.api.StreamWithEvents;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;

/**
 * Loads aggregates by replaying their events and commits the events applied to them.
 * <p>
 * An {@code AggregateRepository} caches the aggregates it has loaded or that have been added to it, so it's meant to be used
 * for a single unit of work, for example the execution of a command, after which it must be {@link #clear() cleared}. It's not thread-safe.
 */
@NullMarked
public class AggregateRepository {
    private static final Logger log = LoggerFactory.getLogger(AggregateRepository.class);

    private final EventStore eventStore;
    private final AggregateTypeRegistry aggregateTypes;
    private final EventConverter eventConverter;
    private final String snapshotEventType;
    private final Map<String, AggregateRoot<?>> aggregates = new LinkedHashMap<>();

    public AggregateRepository(EventStore eventStore, AggregateTypeRegistry aggregateTypes, EventConverter eventConverter) {
        this(eventStore, aggregateTypes, eventConverter, EventStore.DEFAULT_SNAPSHOT_EVENT_TYPE);
    }

    public AggregateRepository(EventStore eventStore, AggregateTypeRegistry aggregateTypes, EventConverter eventConverter, String snapshotEventType) {
        requireNonNull(eventStore, EventStore.class.getSimpleName() + " cannot be null");
        requireNonNull(aggregateTypes, AggregateTypeRegistry.class.getSimpleName() + " cannot be null");
        requireNonNull(eventConverter, EventConverter.class.getSimpleName() + " cannot be null");
        requireNonNull(snapshotEventType, "Snapshot event type cannot be null");
        this.eventStore = eventStore;
        this.aggregateTypes = aggregateTypes;
        this.eventConverter = eventConverter;
        this.snapshotEventType = snapshotEventType;
    }

    /**
     * Register a new aggregate so that its events are stored on the next {@link #commit(CommandRecord)}.
     *
     * @throws NonUniqueAggregateIdException if a different aggregate with the same id is already registered
     */
    public void addAggregate(AggregateRoot<?> aggregate) {
        requireNonNull(aggregate, "Aggregate cannot be null");
        aggregateTypes.byInstance(aggregate);
        AggregateRoot<?> existing = aggregates.get(aggregate.id());
        if (existing != null && existing != aggregate) {
            throw new NonUniqueAggregateIdException(aggregate.id(), existing.getClass().getSimpleName(), aggregate.getClass().getSimpleName());
        }
        aggregates.put(aggregate.id(), aggregate);
    }

    /**
     * Load an aggregate of any type.
     *
     * @throws AggregateNotFoundException if there are no events for the aggregate
     */
    public AggregateRoot<?> loadAggregate(String aggregateId) {
        requireNonNull(aggregateId, "Aggregate id cannot be null");
        AggregateRoot<?> cached = aggregates.get(aggregateId);
        if (cached != null) {
            return cached;
        }
        AggregateType<?> aggregateType = storedAggregateType(aggregateId, null);
        return replay(List.of(aggregateId), List.of(aggregateType)).get(0);
    }

    /**
     * Load an aggregate that is expected to be of type {@code type}.
     *
     * @throws AggregateNotFoundException     if there are no events for the aggregate
     * @throws AggregateTypeMismatchException if the aggregate is not of type {@code type}
     */
    public <A extends AggregateRoot<A>> A loadAggregate(String aggregateId, Class<A> type) {
        return loadAggregates(List.of(aggregateId), type).get(0);
    }

    /**
     * Load several aggregates of the same type. The events of the aggregates that are not already cached are loaded from the event store in one batch.
     *
     * @return The aggregates, in the order of {@code aggregateIds}
     */
    public <A extends AggregateRoot<A>> List<A> loadAggregates(Collection<String> aggregateIds, Class<A> type) {
        requireNonNull(aggregateIds, "Aggregate ids cannot be null");
        requireNonNull(type, "Type cannot be null");

        List<String> toLoad = new ArrayList<>();
        for (String aggregateId : new LinkedHashSet<>(aggregateIds)) {
            AggregateRoot<?> cached = aggregates.get(aggregateId);
            if (cached == null) {
                toLoad.add(aggregateId);
            } else if (!type.isInstance(cached)) {
                throw new AggregateTypeMismatchException(aggregateId, type.getSimpleName(), cached.getClass().getSimpleName());
            }
        }
        if (!toLoad.isEmpty()) {
            Map<String, StreamRecord> streams = eventStore.findStreams(toLoad).stream()
                    .collect(Collectors.toMap(StreamRecord::aggregateId, Function.identity()));
            List<AggregateType<?>> toLoadTypes = toLoad.stream()
                    .<AggregateType<?>>map(aggregateId -> aggregateType(aggregateId, streams.get(aggregateId), type))
                    .toList();
            replay(toLoad, toLoadTypes);
        }
        return aggregateIds.stream().map(aggregates::get).map(type::cast).toList();
    }

    /**
     * @throws AggregateNotFoundException     if there are no events for the aggregate
     * @throws AggregateTypeMismatchException if the aggregate is not of type {@code type}
     */
    public <A extends AggregateRoot<A>> void ensureExists(String aggregateId, Class<A> type) {
        loadAggregate(aggregateId, type);
    }

    /**
     * @return {@code true} if the aggregate is part of this unit of work or has been stored in the event store
     */
    public boolean contains(String aggregateId) {
        requireNonNull(aggregateId, "Aggregate id cannot be null");
        return aggregates.containsKey(aggregateId) || eventStore.streamExists(aggregateId);
    }

    /**
     * @return The ids of the aggregates that are part of this unit of work
     */
    public Set<String> aggregateIds() {
        return Set.copyOf(aggregates.keySet());
    }

    /**
     * Append the uncommitted events of all aggregates in this unit of work, on behalf of {@code command}, and take snapshots of
     * the aggregates whose number of events since their latest snapshot reached the snapshot threshold of their type.
     * The command is only stored if there are events to append.
     */
    public CommitResult commit(CommandRecord command) {
        requireNonNull(command, CommandRecord.class.getSimpleName() + " cannot be null");
        List<AggregateRoot<?>> changed = aggregates.values().stream().filter(AggregateRoot::hasUncommittedEvents).toList();
        if (changed.isEmpty()) {
            return CommitResult.empty();
        }

        List<StreamWithEvents> streamsWithEvents = new ArrayList<>();
        List<DomainEvent> events = new ArrayList<>();
        for (AggregateRoot<?> aggregate : changed) {
            AggregateType<?> aggregateType = aggregateTypes.byInstance(aggregate);
            List<DomainEvent> uncommitted = aggregate.uncommittedEvents();
            StreamRecord stream = new StreamRecord(aggregate.id(), aggregateType.name(), uncommitted.get(0).createdAt(), aggregateType.snapshotThreshold(), aggregate.partitionKey());
            streamsWithEvents.add(new StreamWithEvents(stream, uncommitted.stream().map(eventConverter::toEventRecord).toList()));
            events.addAll(uncommitted);
        }

        CommandRecord stored = eventStore.append(command, streamsWithEvents);
        changed.forEach(AggregateRoot::clearUncommittedEvents);
        log.debug("Committed {} events of {} aggregates for command {}", events.size(), changed.size(), stored.commandType());

        for (AggregateRoot<?> aggregate : changed) {
            Integer threshold = aggregateTypes.byInstance(aggregate).snapshotThreshold();
            if (threshold != null && aggregate.sequenceNumber() - aggregate.latestSnapshotSequenceNumber() >= threshold) {
                takeSnapshot(aggregate);
            }
        }
        return new CommitResult(stored, events);
    }

    /**
     * Store a snapshot of the current state of the aggregate, if it's {@link Snapshottable} and has events since its latest snapshot.
     *
     * @return {@code true} if a snapshot was stored
     */
    public boolean takeSnapshot(String aggregateId) {
        return takeSnapshot(loadAggregate(aggregateId));
    }

    private boolean takeSnapshot(AggregateRoot<?> aggregate) {
        if (!(aggregate instanceof Snapshottable<?> snapshottable) || aggregate.hasUncommittedEvents()
                || aggregate.sequenceNumber() == aggregate.latestSnapshotSequenceNumber()) {
            return false;
        }
        EventRecord snapshot = eventConverter.toSnapshotRecord(aggregate.id(), aggregate.sequenceNumber(), snapshotEventType,
                snapshottable.snapshotState(), Instant.now().truncatedTo(ChronoUnit.MICROS));
        eventStore.createSnapshot(snapshot);
        aggregate.snapshotTaken(aggregate.sequenceNumber());
        log.debug("Took snapshot of aggregate {} at sequence number {}", aggregate.id(), aggregate.sequenceNumber());
        return true;
    }

    /**
     * Remove all aggregates from this unit of work, including their uncommitted events.
     */
    public void clear() {
        aggregates.clear();
    }

    public boolean isEmpty() {
        return aggregates.isEmpty();
    }

    private AggregateType<?> storedAggregateType(String aggregateId, @Nullable Class<?> expectedType) {
        return aggregateType(aggregateId, eventStore.findStream(aggregateId).orElse(null), expectedType);
    }

    private AggregateType<?> aggregateType(String aggregateId, @Nullable StreamRecord stream, @Nullable Class<?> expectedType) {
        if (stream == null) {
            throw new AggregateNotFoundException(aggregateId);
        }
        AggregateType<?> aggregateType = aggregateTypes.byName(stream.aggregateType())
                .orElseThrow(() -> new IllegalStateException("Aggregate type " + stream.aggregateType() + " of aggregate " + aggregateId + " is not registered"));
        if (expectedType != null && !expectedType.isAssignableFrom(aggregateType.type())) {
            throw new AggregateTypeMismatchException(aggregateId, expectedType.getSimpleName(), aggregateType.type().getSimpleName());
        }
        return aggregateType;
    }

    private List<AggregateRoot<?>> replay(List<String> aggregateIds, List<AggregateType<?>> types) {
        Map<String, AggregateRoot<?>> loaded = new LinkedHashMap<>();
        for (int i = 0; i < aggregateIds.size(); i++) {
            loaded.put(aggregateIds.get(i), types.get(i).create(aggregateIds.get(i)));
        }

        try (Stream<EventRecord> records = eventStore.load(aggregateIds, snapshotEventType, true)) {
            records.forEach(record -> {
                AggregateRoot<?> aggregate = requireNonNull(loaded.get(record.aggregateId()), "Unexpected event of aggregate " + record.aggregateId());
                if (record.eventType().equals(snapshotEventType)) {
                    restoreSnapshot(aggregate, record);
                } else {
                    aggregate.replay(eventConverter.toDomainEvent(record));
                }
            });
        }

        for (AggregateRoot<?> aggregate : loaded.values()) {
            if (aggregate.sequenceNumber() == 0) {
                throw new AggregateNotFoundException(aggregate.id());
            }
        }
        aggregates.putAll(loaded);
        return List.copyOf(loaded.values());
    }

    private void restoreSnapshot(AggregateRoot<?> aggregate, EventRecord record) {
        if (!(aggregate instanceof Snapshottable<?> snapshottable)) {
            log.warn("Ignoring snapshot of aggregate {} since {} is not {}", aggregate.id(), aggregate.getClass().getSimpleName(), Snapshottable.class.getSimpleName());
            return;
        }
        Object state = eventConverter.deserialize(record.eventJson(), snapshottable.snapshotStateType());
        aggregate.restoreSnapshot(state, record.sequenceNumber());
    }
}
