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

import java.util.Objects;
import java.util.function.BiConsumer;

/**
 * Handles the commands that it {@link #handles(Command)}. A command is handled by every registered handler that handles it.
 */
public interface CommandHandler {

    boolean handles(Command command);

    void handle(Command command, CommandContext context);

    /**
     * Create a {@code CommandHandler} that handles commands of the given type, for example:
     * <pre>
     * CommandHandler.on(Deposit.class, (command, context) -&gt;
     *         context.repository().loadAggregate(command.aggregateId(), BankAccount.class).deposit(command.amount()));
     * </pre>
     */
    static <C extends Command> CommandHandler on(Class<C> commandType, BiConsumer<C, CommandContext> handler) {
        Objects.requireNonNull(commandType, "Command type cannot be null");
        Objects.requireNonNull(handler, "Handler cannot be null");
        return new CommandHandler() {
            @Override
            public boolean handles(Command command) {
                return commandType.isInstance(command);
            }

            @Override
            public void handle(Command command, CommandContext context) {
                handler.accept(commandType.cast(command), context);
            }

            @Override
            public String toString() {
                return CommandHandler.class.getSimpleName() + "[" + commandType.getSimpleName() + "]";
            }
        };
    }
}
