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

import java.util.Objects;

/**
 * A queued request to move all events of an aggregate to a new partition key.
 */
public record PendingPartitionChange(String aggregateId, String oldPartitionKey, String newPartitionKey) {

    public PendingPartitionChange {
        Objects.requireNonNull(aggregateId, "Aggregate id cannot be null");
        Objects.requireNonNull(oldPartitionKey, "Old partition key cannot be null");
        Objects.requireNonNull(newPartitionKey, "New partition key cannot be null");
    }
}
