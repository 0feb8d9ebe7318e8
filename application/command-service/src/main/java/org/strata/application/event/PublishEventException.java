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
import org.strata.eventstore.api.ErrorKind;
import org.strata.eventstore.api.StrataException;

/**
 * An {@link EventHandler} failed to handle an event. The cause is the exception thrown by the handler.
 */
public class PublishEventException extends RuntimeException implements StrataException {
    private final String eventHandlerName;
    private final transient DomainEvent event;

    public PublishEventException(String eventHandlerName, DomainEvent event, Throwable cause) {
        super("Event handler " + eventHandlerName + " failed to handle event " + event + ": " + cause.getMessage(), cause);
        this.eventHandlerName = eventHandlerName;
        this.event = event;
    }

    public String eventHandlerName() {
        return eventHandlerName;
    }

    public DomainEvent event() {
        return event;
    }

    @Override
    public ErrorKind kind() {
        return getCause() instanceof StrataException strataException ? strataException.kind() : ErrorKind.INTERNAL;
    }
}
