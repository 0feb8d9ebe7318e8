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

package org.strata.application.event;

import org.strata.aggregate.DomainEvent;

/**
 * Receives the events that were committed by a command, for example a projector or a {@link Workflow}.
 */
public interface EventHandler {

    void handle(DomainEvent event, EventContext context);

    default String name() {
        return getClass().getSimpleName();
    }
}
