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
import java.util.Optional;

/**
 * Access to the partition key changes that an {@link EventStore} records when an aggregate is appended with a
 * partition key different from the current partition key of its stream.
 */
public interface PartitionKeyStore {

    /**
     * @return The pending change that was recorded first, or empty if there are no pending changes.
     */
    Optional<PendingPartitionChange> oldestPendingPartitionChange();

    /**
     * Update the stream and all events of the aggregate whose partition key differs from {@code newPartitionKey}.
     *
     * @return The number of events that were repointed.
     */
    int repointEvents(PendingPartitionChange change);

    void deletePendingPartitionChange(PendingPartitionChange change);

    /**
     * @return All pending changes, oldest first.
     */
    List<PendingPartitionChange> pendingPartitionChanges();
}
