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
 * A serialized command that caused events to be stored. The causation fields link the command to the event
 * that triggered it, if the command was issued while handling an event.
 */
@NullMarked
public record CommandRecord(@Nullable Long id, @Nullable String userId, @Nullable String aggregateId, String commandType, String commandJson,
                            @Nullable String causationAggregateId, @Nullable Long causationSequenceNumber, Instant createdAt) {

    public CommandRecord {
        Objects.requireNonNull(commandType, "Command type cannot be null");
        Objects.requireNonNull(commandJson, "Command json cannot be null");
        Objects.requireNonNull(createdAt, "Created at cannot be null");
    }

    public CommandRecord withId(long id) {
        return new CommandRecord(id, userId, aggregateId, commandType, commandJson, causationAggregateId, causationSequenceNumber, createdAt);
    }
}
