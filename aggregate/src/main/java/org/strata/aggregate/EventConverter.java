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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.strata.eventstore.api.EventRecord;

import java.io.UncheckedIOException;
import java.time.Instant;

import static java.util.Objects.requireNonNull;

/**
 * Converts {@link DomainEvent}s to and from the {@link EventRecord}s stored in the event store, using a Jackson {@link ObjectMapper}
 * to serialize the payload to JSON. Also serializes commands and snapshot states.
 */
public class EventConverter {
    private final ObjectMapper objectMapper;
    private final EventTypeMapper eventTypeMapper;

    public EventConverter(ObjectMapper objectMapper, EventTypeMapper eventTypeMapper) {
        requireNonNull(objectMapper, ObjectMapper.class.getSimpleName() + " cannot be null");
        requireNonNull(eventTypeMapper, EventTypeMapper.class.getSimpleName() + " cannot be null");
        this.objectMapper = objectMapper;
        this.eventTypeMapper = eventTypeMapper;
    }

    /**
     * Create an {@link EventConverter} with an {@link ObjectMapper} that writes {@code java.time} types as ISO-8601 strings.
     */
    public EventConverter(EventTypeMapper eventTypeMapper) {
        this(defaultObjectMapper(), eventTypeMapper);
    }

    public static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public EventRecord toEventRecord(DomainEvent event) {
        requireNonNull(event, DomainEvent.class.getSimpleName() + " cannot be null");
        return EventRecord.uncommitted(event.aggregateId(), event.sequenceNumber(), eventTypeMapper.eventType(event.data().getClass()), serialize(event.data()), event.createdAt());
    }

    public DomainEvent toDomainEvent(EventRecord record) {
        requireNonNull(record, EventRecord.class.getSimpleName() + " cannot be null");
        Object payload = deserialize(record.eventJson(), eventTypeMapper.payloadType(record.eventType()));
        return new DomainEvent(record.aggregateId(), record.sequenceNumber(), record.createdAt(), payload);
    }

    public EventRecord toSnapshotRecord(String aggregateId, long sequenceNumber, String snapshotEventType, Object state, Instant createdAt) {
        return EventRecord.uncommitted(aggregateId, sequenceNumber, snapshotEventType, serialize(state), createdAt);
    }

    public String eventType(Class<?> payloadType) {
        return eventTypeMapper.eventType(payloadType);
    }

    public String serialize(Object value) {
        requireNonNull(value, "Value cannot be null");
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    public <T> T deserialize(String json, Class<T> type) {
        requireNonNull(json, "Json cannot be null");
        requireNonNull(type, "Type cannot be null");
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
