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

package org.strata.projection;

import org.strata.aggregate.DomainEvent;
import org.strata.application.event.EventContext;
import org.strata.application.event.EventHandler;

import java.util.Objects;

/**
 * Lets a {@link Projector} handle the events committed by the {@link org.strata.application.command.CommandService}, so that the live
 * projection is updated in the transaction of the command.
 */
public class ProjectorEventHandler implements EventHandler {
    private final Projector<?> projector;

    public ProjectorEventHandler(Projector<?> projector) {
        this.projector = Objects.requireNonNull(projector, Projector.class.getSimpleName() + " cannot be null");
    }

    @Override
    public void handle(DomainEvent event, EventContext context) {
        projector.handle(event);
    }

    @Override
    public String name() {
        return projector.name();
    }
}
