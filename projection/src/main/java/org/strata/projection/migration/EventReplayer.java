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
import org.strata.aggregate.DomainEvent;
import org.strata.aggregate.EventConverter;
import org.strata.eventstore.api.EventRecord;
import org.strata.eventstore.api.EventStore;
import org.strata.projection.Projector;
import org.strata.projection.ProjectorType;
import org.strata.projection.persistor.ReplayOptimizedPersistor;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Feeds the events of the event store, in commit order, to a set of projectors. Only the events of the aggregate types the
 * projectors declare are read, and only events whose type one of the projectors handles are deserialized. The event type names
 * are derived from the classes the projectors dispatch on.
 * <p>
 * The persistor is flushed whenever it holds more than {@code maxRecordsInMemory} records after a batch of events.
 */
class EventReplayer {
    private static final Logger log = LoggerFactory.getLogger(EventReplayer.class);

    private final EventStore eventStore;
    private final EventConverter eventConverter;
    private final int batchSize;
    private final int maxRecordsInMemory;

    EventReplayer(EventStore eventStore, EventConverter eventConverter, int batchSize, int maxRecordsInMemory) {
        this.eventStore = eventStore;
        this.eventConverter = eventConverter;
        this.batchSize = batchSize;
        this.maxRecordsInMemory = maxRecordsInMemory;
    }

    /**
     * Replay the events with a commit order greater than {@code after} and less than or equal to {@code upTo}, except the ones
     * {@code replayedIds} contains.
     *
     * @return The number of events that were replayed
     */
    long replay(List<ProjectorType> projectorTypes, ReplayOptimizedPersistor persistor, long after, long upTo, ReplayedIds replayedIds,
                ReplayProgressListener listener) {
        List<Projector<?>> projectors = projectorTypes.stream().<Projector<?>>map(type -> type.create(persistor)).toList();
        Set<String> eventTypes = projectors.stream()
                .flatMap(p -> p.handledEventTypes().stream())
                .map(eventConverter::eventType)
                .collect(Collectors.toSet());
        Set<String> aggregateTypes = aggregateTypes(projectorTypes);
        log.debug("Replaying event types {} of aggregate types {} after commit order {} up to {}", eventTypes,
                aggregateTypes.isEmpty() ? "all" : aggregateTypes, after, upTo);

        persistor.prepare();
        long position = after;
        long replayed = 0;
        boolean inRange = true;
        List<EventRecord> batch;
        do {
            batch = eventStore.readEventsAfter(position, aggregateTypes, batchSize);
            Set<String> aggregateIds = new LinkedHashSet<>();
            for (EventRecord record : batch) {
                long commitOrder = commitOrder(record);
                if (commitOrder > upTo) {
                    inRange = false;
                    break;
                }
                position = commitOrder;
                if (!eventTypes.contains(record.eventType()) || replayedIds.contains(commitOrder)) {
                    continue;
                }
                DomainEvent event = eventConverter.toDomainEvent(record);
                for (Projector<?> projector : projectors) {
                    projector.handle(event);
                }
                replayedIds.record(persistor, commitOrder);
                aggregateIds.add(record.aggregateId());
                replayed++;
            }
            if (!aggregateIds.isEmpty()) {
                listener.onProgress(replayed, false, List.copyOf(aggregateIds));
            }
            if (persistor.flushableRecordCount() >= maxRecordsInMemory) {
                log.debug("Flushing {} records after commit order {}", persistor.flushableRecordCount(), position);
                persistor.flush();
            }
        } while (inRange && batch.size() == batchSize);
        listener.onProgress(replayed, true, List.of());
        persistor.commit();
        return replayed;
    }

    /**
     * @return The aggregate types of all projectors, empty if any of them needs the events of all aggregates
     */
    static Set<String> aggregateTypes(List<ProjectorType> projectorTypes) {
        Set<String> aggregateTypes = new TreeSet<>();
        for (ProjectorType projectorType : projectorTypes) {
            if (projectorType.aggregateTypes().isEmpty()) {
                return Set.of();
            }
            aggregateTypes.addAll(projectorType.aggregateTypes());
        }
        return aggregateTypes;
    }

    private static long commitOrder(EventRecord record) {
        Long commitOrder = record.commitOrder();
        if (commitOrder == null) {
            throw new IllegalStateException("Event " + record.eventType() + " of aggregate " + record.aggregateId() + " has no commit order");
        }
        return commitOrder;
    }
}
