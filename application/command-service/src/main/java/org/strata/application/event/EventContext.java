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
import org.strata.application.command.Command;
import org.strata.eventstore.api.CommandRecord;
import org.strata.transaction.UnitOfWork;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.StringJoiner;

/**
 * The event being handled together with the command that caused it. Commands executed through the context are recorded as caused
 * by the event and run in the unit of work of the command, or in a new one if that has already committed.
 */
public final class EventContext {
    private final DomainEvent event;
    private final CommandRecord command;
    private final UnitOfWork unitOfWork;
    private final Consumer<List<Command>> commandExecutor;

    public EventContext(DomainEvent event, CommandRecord command, UnitOfWork unitOfWork, Consumer<List<Command>> commandExecutor) {
        this.event = Objects.requireNonNull(event, DomainEvent.class.getSimpleName() + " cannot be null");
        this.command = Objects.requireNonNull(command, CommandRecord.class.getSimpleName() + " cannot be null");
        this.unitOfWork = Objects.requireNonNull(unitOfWork, UnitOfWork.class.getSimpleName() + " cannot be null");
        this.commandExecutor = Objects.requireNonNull(commandExecutor, "Command executor cannot be null");
    }

    public DomainEvent event() {
        return event;
    }

    public CommandRecord command() {
        return command;
    }

    public UnitOfWork unitOfWork() {
        return unitOfWork;
    }

    public void executeCommands(Command... commands) {
        executeCommands(List.of(commands));
    }

    public void executeCommands(List<Command> commands) {
        Objects.requireNonNull(commands, "Commands cannot be null");
        commandExecutor.accept(List.copyOf(commands));
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", EventContext.class.getSimpleName() + "[", "]")
                .add("event=" + event)
                .add("command=" + command.commandType())
                .toString();
    }
}
