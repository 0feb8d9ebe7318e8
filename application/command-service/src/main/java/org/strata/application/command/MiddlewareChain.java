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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * An immutable chain of {@link Middleware}. The first added middleware is the outermost one.
 */
public final class MiddlewareChain {
    private static final MiddlewareChain EMPTY = new MiddlewareChain(List.of());

    private final List<Middleware> entries;

    private MiddlewareChain(List<Middleware> entries) {
        this.entries = List.copyOf(entries);
    }

    public static MiddlewareChain empty() {
        return EMPTY;
    }

    public static MiddlewareChain of(Middleware... middleware) {
        return new MiddlewareChain(List.of(middleware));
    }

    public MiddlewareChain add(Middleware middleware) {
        Objects.requireNonNull(middleware, Middleware.class.getSimpleName() + " cannot be null");
        List<Middleware> newEntries = new ArrayList<>(entries);
        newEntries.add(middleware);
        return new MiddlewareChain(newEntries);
    }

    public List<Middleware> entries() {
        return entries;
    }

    /**
     * Invoke each middleware, in the order they were added, and finally {@code processCommand}.
     */
    public void invoke(Command command, CommandContext context, Runnable processCommand) {
        Objects.requireNonNull(command, Command.class.getSimpleName() + " cannot be null");
        Objects.requireNonNull(processCommand, "Process command cannot be null");
        new Continuation(command, context, processCommand, 0).run();
    }

    private final class Continuation implements Runnable {
        private final Command command;
        private final CommandContext context;
        private final Runnable processCommand;
        private final int index;

        private Continuation(Command command, CommandContext context, Runnable processCommand, int index) {
            this.command = command;
            this.context = context;
            this.processCommand = processCommand;
            this.index = index;
        }

        @Override
        public void run() {
            if (index == entries.size()) {
                processCommand.run();
            } else {
                entries.get(index).invoke(command, context, new Continuation(command, context, processCommand, index + 1));
            }
        }
    }
}
