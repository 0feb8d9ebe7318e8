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

import java.time.Instant;
import java.util.Objects;

/**
 * The envelope of an event that has been applied to an aggregate. {@code data} is the domain specific payload.
 */
public record DomainEvent(String aggregateId, long sequenceNumber, Instant createdAt, Object data) {

    public DomainEvent {
        Objects.requireNonNull(aggregateId, "Aggregate id cannot be null");
        Objects.requireNonNull(createdAt, "Created at cannot be null");
        Objects.requireNonNull(data, "Data cannot be null");
        if (sequenceNumber < 1) {
            throw new IllegalArgumentException("Sequence number must be greater than 0, was " + sequenceNumber);
        }
    }

    public <T> T data(Class<T> type) {
        return type.cast(data);
    }
}
