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

package org.strata.application.command;

import org.strata.application.event.EventHandler;
import org.strata.eventstore.api.ConcurrencyConflictException;
import org.strata.retry.RetryStrategy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Configuration for the {@link CommandService}. Handlers, filters and middleware are invoked in the order they were added.
 */
public class CommandServiceConfig {

    public final List<CommandHandler> commandHandlers;
    public final List<EventHandler> eventHandlers;
    public final List<CommandFilter> commandFilters;
    public final MiddlewareChain middleware;
    public final EventPublication eventPublication;
    public final RetryStrategy retryStrategy;

    private CommandServiceConfig(List<CommandHandler> commandHandlers, List<EventHandler> eventHandlers, List<CommandFilter> commandFilters,
                                 MiddlewareChain middleware, EventPublication eventPublication, RetryStrategy retryStrategy) {
        Objects.requireNonNull(middleware, MiddlewareChain.class.getSimpleName() + " cannot be null");
        Objects.requireNonNull(eventPublication, EventPublication.class.getSimpleName() + " cannot be null");
        Objects.requireNonNull(retryStrategy, RetryStrategy.class.getSimpleName() + " cannot be null");
        this.commandHandlers = List.copyOf(commandHandlers);
        this.eventHandlers = List.copyOf(eventHandlers);
        this.commandFilters = List.copyOf(commandFilters);
        this.middleware = middleware;
        this.eventPublication = eventPublication;
        this.retryStrategy = retryStrategy;
    }

    /**
     * No handlers, filters or middleware. Events are published in the transaction of the command and commands are not retried.
     */
    public static CommandServiceConfig defaultConfig() {
        return new CommandServiceConfig(List.of(), List.of(), List.of(), MiddlewareChain.empty(), EventPublication.IN_TRANSACTION, RetryStrategy.none());
    }

    /**
     * @return A {@link RetryStrategy} that retries a batch of commands up to 5 times, with exponential backoff starting at 100 ms and capped at 2 seconds,
     * when a {@link ConcurrencyConflictException} is thrown.
     */
    public static RetryStrategy.Retry retryOnConcurrencyConflict() {
        return RetryStrategy.exponentialBackoff(Duration.ofMillis(100), Duration.ofSeconds(2), 2.0).maxAttempts(5).retryIf(ConcurrencyConflictException.class::isInstance);
    }

    public CommandServiceConfig commandHandlers(CommandHandler... commandHandlers) {
        return new CommandServiceConfig(append(this.commandHandlers, commandHandlers), eventHandlers, commandFilters, middleware, eventPublication, retryStrategy);
    }

    public CommandServiceConfig eventHandlers(EventHandler... eventHandlers) {
        return new CommandServiceConfig(commandHandlers, append(this.eventHandlers, eventHandlers), commandFilters, middleware, eventPublication, retryStrategy);
    }

    public CommandServiceConfig commandFilters(CommandFilter... commandFilters) {
        return new CommandServiceConfig(commandHandlers, eventHandlers, append(this.commandFilters, commandFilters), middleware, eventPublication, retryStrategy);
    }

    public CommandServiceConfig middleware(Middleware... middleware) {
        MiddlewareChain chain = this.middleware;
        for (Middleware m : middleware) {
            chain = chain.add(m);
        }
        return new CommandServiceConfig(commandHandlers, eventHandlers, commandFilters, chain, eventPublication, retryStrategy);
    }

    public CommandServiceConfig eventPublication(EventPublication eventPublication) {
        return new CommandServiceConfig(commandHandlers, eventHandlers, commandFilters, middleware, eventPublication, retryStrategy);
    }

    /**
     * The retry strategy for a batch of commands. Each attempt executes the batch from scratch in a new unit of work.
     *
     * @see #retryOnConcurrencyConflict()
     */
    public CommandServiceConfig retryStrategy(RetryStrategy retryStrategy) {
        return new CommandServiceConfig(commandHandlers, eventHandlers, commandFilters, middleware, eventPublication, retryStrategy);
    }

    @SafeVarargs
    private static <T> List<T> append(List<T> existing, T... additional) {
        List<T> list = new ArrayList<>(existing);
        for (T t : additional) {
            list.add(Objects.requireNonNull(t, "Handlers cannot contain null"));
        }
        return list;
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", CommandServiceConfig.class.getSimpleName() + "[", "]")
                .add("commandHandlers=" + commandHandlers.size())
                .add("eventHandlers=" + eventHandlers.size())
                .add("commandFilters=" + commandFilters.size())
                .add("middleware=" + middleware.entries().size())
                .add("eventPublication=" + eventPublication)
                .add("retryStrategy=" + retryStrategy)
                .toString();
    }
}
