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
import org.strata.eventstore.api.StreamRecord;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Base class of aggregates. State changes are made by {@link #apply(Object) applying} events, which are dispatched through
 * the same {@link EventDispatchTable} that is used when the aggregate is loaded from its history, so that the in-memory state
 * and the stored events can never diverge.
 *
 * @param <A> The type of the aggregate itself
 */
@NullMarked
public abstract class AggregateRoot<A extends AggregateRoot<A>> {
    private final String id;
    private final List<DomainEvent> uncommittedEvents = new ArrayList<>();
    private long sequenceNumber;
    private long latestSnapshotSequenceNumber;

    protected AggregateRoot(String id) {
        Objects.requireNonNull(id, "Id cannot be null");
        this.id = id;
    }

    protected abstract EventDispatchTable<A> dispatchTable();

    /**
     * Apply a new event to this aggregate. The event gets the sequence number following the last applied one.
     */
    protected final void apply(Object payload) {
        Objects.requireNonNull(payload, "Payload cannot be null");
        DomainEvent event = new DomainEvent(id, sequenceNumber + 1, now(), payload);
        dispatch(event);
        sequenceNumber = event.sequenceNumber();
        uncommittedEvents.add(event);
    }

    /**
     * The time stamp of events applied to this aggregate. Truncated to microseconds which is the precision of the event store.
     */
    protected Instant now() {
        return Instant.now().truncatedTo(ChronoUnit.MICROS);
    }

    /**
     * @return The partition key of the events of this aggregate
     */
    public String partitionKey() {
        return StreamRecord.DEFAULT_PARTITION_KEY;
    }

    public final String id() {
        return id;
    }

    /**
     * @return The sequence number of the last applied event, {@code 0} if no events have been applied
     */
    public final long sequenceNumber() {
        return sequenceNumber;
    }

    public final long latestSnapshotSequenceNumber() {
        return latestSnapshotSequenceNumber;
    }

    public final List<DomainEvent> uncommittedEvents() {
        return Collections.unmodifiableList(uncommittedEvents);
    }

    public final boolean hasUncommittedEvents() {
        return !uncommittedEvents.isEmpty();
    }

    final void replay(DomainEvent event) {
        if (event.sequenceNumber() <= sequenceNumber) {
            // Already part of the restored snapshot
            return;
        }
        if (event.sequenceNumber() != sequenceNumber + 1) {
            throw new IllegalStateException("Cannot replay event " + event.sequenceNumber() + " of aggregate " + id + " after event " + sequenceNumber);
        }
        dispatch(event);
        sequenceNumber = event.sequenceNumber();
    }

    @SuppressWarnings("unchecked")
    final <S> void restoreSnapshot(S state, long snapshotSequenceNumber) {
        ((Snapshottable<S>) this).restoreSnapshotState(state);
        sequenceNumber = snapshotSequenceNumber;
        latestSnapshotSequenceNumber = snapshotSequenceNumber;
    }

    final void snapshotTaken(long snapshotSequenceNumber) {
        latestSnapshotSequenceNumber = snapshotSequenceNumber;
    }

    final void clearUncommittedEvents() {
        uncommittedEvents.clear();
    }

    @SuppressWarnings("unchecked")
    private void dispatch(DomainEvent event) {
        dispatchTable().dispatch((A) this, event);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[id='" + id + "', sequenceNumber=" + sequenceNumber + "]";
    }
}
