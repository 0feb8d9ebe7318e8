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

import java.util.List;

/**
 * Notified after each batch of events that has been replayed.
 */
@FunctionalInterface
public interface ReplayProgressListener {

    ReplayProgressListener NONE = (progress, done, aggregateIds) -> {
    };

    /**
     * @param progress     The number of events replayed so far
     * @param done         {@code true} on the last notification, after all events have been replayed
     * @param aggregateIds The ids of the aggregates whose events were replayed in the batch
     */
    void onProgress(long progress, boolean done, List<String> aggregateIds);
}
