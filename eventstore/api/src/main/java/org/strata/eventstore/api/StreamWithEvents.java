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

import java.util.List;
import java.util.Objects;

/**
 * The events to append to a stream. The events must belong to the stream and have contiguous sequence numbers.
 */
public record StreamWithEvents(StreamRecord stream, List<EventRecord> events) {

    public StreamWithEvents {
        Objects.requireNonNull(stream, StreamRecord.class.getSimpleName() + " cannot be null");
        Objects.requireNonNull(events, "Events cannot be null");
        events = List.copyOf(events);
        for (int i = 0; i < events.size(); i++) {
            EventRecord event = events.get(i);
            if (!stream.aggregateId().equals(event.aggregateId())) {
                throw new IllegalArgumentException("Event with aggregate id " + event.aggregateId() + " doesn't belong to stream " + stream.aggregateId());
            }
            if (i > 0 && event.sequenceNumber() != events.get(i - 1).sequenceNumber() + 1) {
                throw new IllegalArgumentException("Sequence numbers of stream " + stream.aggregateId() + " are not contiguous");
            }
        }
    }
}
