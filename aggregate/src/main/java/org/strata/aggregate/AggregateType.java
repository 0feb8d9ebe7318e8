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

import java.util.Objects;
import java.util.function.Function;

/**
 * Describes how aggregates of a given type are stored and created.
 *
 * @param name              The aggregate type stored in the stream of each aggregate
 * @param type              The aggregate class
 * @param factory           Creates an empty aggregate with the given id, before its history is replayed
 * @param snapshotThreshold The number of events after the latest snapshot that triggers a new snapshot, {@code null} to never snapshot
 */
@NullMarked
public record AggregateType<A extends AggregateRoot<A>>(String name, Class<A> type, Function<String, A> factory, @Nullable Integer snapshotThreshold) {

    public AggregateType {
        Objects.requireNonNull(name, "Name cannot be null");
        Objects.requireNonNull(type, "Type cannot be null");
        Objects.requireNonNull(factory, "Factory cannot be null");
        if (snapshotThreshold != null) {
            if (snapshotThreshold < 1) {
                throw new IllegalArgumentException("Snapshot threshold must be greater than 0");
            }
            if (!Snapshottable.class.isAssignableFrom(type)) {
                throw new IllegalArgumentException(type.getName() + " must implement " + Snapshottable.class.getSimpleName() + " to have a snapshot threshold");
            }
        }
    }

    /**
     * An aggregate type named after the simple name of the class, that is never snapshotted.
     */
    public static <A extends AggregateRoot<A>> AggregateType<A> of(Class<A> type, Function<String, A> factory) {
        return new AggregateType<>(type.getSimpleName(), type, factory, null);
    }

    public AggregateType<A> snapshotThreshold(int snapshotThreshold) {
        return new AggregateType<>(name, type, factory, snapshotThreshold);
    }

    A create(String aggregateId) {
        return factory.apply(aggregateId);
    }
}
