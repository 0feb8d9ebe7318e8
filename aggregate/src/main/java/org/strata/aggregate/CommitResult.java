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
import org.strata.eventstore.api.CommandRecord;

import java.util.List;

/**
 * The outcome of {@link AggregateRepository#commit(CommandRecord)}.
 *
 * @param command The stored command, {@code null} if there were no events to commit and hence nothing was stored
 * @param events  The committed events, in the order they were appended
 */
@NullMarked
public record CommitResult(@Nullable CommandRecord command, List<DomainEvent> events) {
    private static final CommitResult EMPTY = new CommitResult(null, List.of());

    public CommitResult {
        events = List.copyOf(events);
    }

    public static CommitResult empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }
}
