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

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiConsumer;

/**
 * An immutable mapping from event payload class to the handler that applies the event to a target, for example
 * an aggregate or a projector. The handler of a payload class is resolved once, the first time an event of that class
 * is dispatched, and is the handler registered for the class itself or else for its closest superclass or interface.
 * Events without a handler are ignored.
 *
 * <pre>
 * private static final EventDispatchTable&lt;BankAccount&gt; EVENTS = EventDispatchTable.&lt;BankAccount&gt;builder()
 *         .on(AccountOpened.class, (account, event) -&gt; account.balance = 0)
 *         .on(MoneyDeposited.class, (account, event) -&gt; account.balance += event.amount())
 *         .build();
 * </pre>
 *
 * @param <T> The type of the target that events are applied to
 */
@NullMarked
public final class EventDispatchTable<T> {

    @FunctionalInterface
    public interface Handler<T, E> {
        void handle(T target, E payload, DomainEvent event);
    }

    private final Map<Class<?>, Handler<T, Object>> handlers;
    private final Map<Class<?>, Optional<Handler<T, Object>>> resolved = new ConcurrentHashMap<>();

    private EventDispatchTable(Map<Class<?>, Handler<T, Object>> handlers) {
        this.handlers = Collections.unmodifiableMap(new LinkedHashMap<>(handlers));
    }

    public static <T> Builder<T> builder() {
        return new Builder<>();
    }

    /**
     * Apply the event to the target.
     *
     * @return {@code true} if a handler was found for the payload of the event, {@code false} if the event was ignored.
     */
    public boolean dispatch(T target, DomainEvent event) {
        Objects.requireNonNull(target, "Target cannot be null");
        Objects.requireNonNull(event, DomainEvent.class.getSimpleName() + " cannot be null");
        Optional<Handler<T, Object>> handler = resolved.computeIfAbsent(event.data().getClass(), this::resolve);
        handler.ifPresent(h -> h.handle(target, event.data(), event));
        return handler.isPresent();
    }

    public boolean handles(Class<?> payloadType) {
        return resolved.computeIfAbsent(payloadType, this::resolve).isPresent();
    }

    /**
     * @return The payload classes that handlers are registered for, in registration order
     */
    public Set<Class<?>> handledTypes() {
        return handlers.keySet();
    }

    private Optional<Handler<T, Object>> resolve(Class<?> payloadType) {
        // Breadth first, so that the closest supertype wins
        Deque<Class<?>> candidates = new ArrayDeque<>();
        candidates.add(payloadType);
        while (!candidates.isEmpty()) {
            Class<?> candidate = candidates.poll();
            Handler<T, Object> handler = handlers.get(candidate);
            if (handler != null) {
                return Optional.of(handler);
            }
            Class<?> superclass = candidate.getSuperclass();
            if (superclass != null) {
                candidates.add(superclass);
            }
            Collections.addAll(candidates, candidate.getInterfaces());
        }
        return Optional.empty();
    }

    public static final class Builder<T> {
        private final Map<Class<?>, Handler<T, Object>> handlers = new LinkedHashMap<>();

        private Builder() {
        }

        public <E> Builder<T> on(Class<E> payloadType, BiConsumer<T, E> handler) {
            Objects.requireNonNull(handler, "Handler cannot be null");
            return onEvent(payloadType, (target, payload, __) -> handler.accept(target, payload));
        }

        /**
         * Register a handler that also receives the {@link DomainEvent} envelope, for example to access the sequence number.
         */
        @SuppressWarnings("unchecked")
        public <E> Builder<T> onEvent(Class<E> payloadType, Handler<T, E> handler) {
            Objects.requireNonNull(payloadType, "Payload type cannot be null");
            Objects.requireNonNull(handler, "Handler cannot be null");
            Handler<T, Object> existing = handlers.putIfAbsent(payloadType, (Handler<T, Object>) handler);
            if (existing != null) {
                throw new IllegalArgumentException("A handler for " + payloadType.getName() + " is already registered");
            }
            return this;
        }

        public EventDispatchTable<T> build() {
            return new EventDispatchTable<>(handlers);
        }
    }
}
