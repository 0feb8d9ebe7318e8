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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Publishes events to the {@link EventHandler}s in the order they are published. An event that is published while another one is
 * being handled is queued and handled when the current one has been handled by all handlers, so events are never handled out of order.
 * <p>
 * An {@code EventPublisher} keeps state and must not be shared between units of work.
 */
public class EventPublisher {
    private static final Logger log = LoggerFactory.getLogger(EventPublisher.class);

    private final List<EventHandler> eventHandlers;
    private final Deque<EventContext> queue = new ArrayDeque<>();
    private boolean publishing;

    public EventPublisher(List<EventHandler> eventHandlers) {
        Objects.requireNonNull(eventHandlers, "Event handlers cannot be null");
        this.eventHandlers = List.copyOf(eventHandlers);
    }

    public void publish(List<EventContext> events) {
        Objects.requireNonNull(events, "Events cannot be null");
        queue.addAll(events);
        if (publishing) {
            return;
        }
        publishing = true;
        try {
            EventContext next;
            while ((next = queue.poll()) != null) {
                publish(next);
            }
        } finally {
            queue.clear();
            publishing = false;
        }
    }

    private void publish(EventContext context) {
        log.debug("Publishing event {}", context.event().data().getClass().getSimpleName());
        for (EventHandler eventHandler : eventHandlers) {
            try {
                eventHandler.handle(context.event(), context);
            } catch (RuntimeException e) {
                throw new PublishEventException(eventHandler.name(), context.event(), e);
            }
        }
    }
}
