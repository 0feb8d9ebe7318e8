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

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.strata.aggregate.AggregateRepository;
import org.strata.aggregate.CommitResult;
import org.strata.aggregate.DomainEvent;
import org.strata.aggregate.EventConverter;
import org.strata.application.event.EventContext;
import org.strata.application.event.EventPublisher;
import org.strata.eventstore.api.CommandRecord;
import org.strata.transaction.TransactionProvider;
import org.strata.transaction.UnitOfWork;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * Executes commands. A batch of commands is executed in one transaction:
 * <ol>
 *     <li>Each command runs through the middleware, the command filters and validation before the transaction is opened. The middleware
 *     of a command wraps the rest of the batch, so it also wraps the handling of the command. If any command is rejected nothing is
 *     written.</li>
 *     <li>In the transaction every command handler that handles a command is invoked, and the events of the aggregates changed by the
 *     command are committed, together with the command</li>
 *     <li>The committed events are published to the event handlers. Commands executed by event handlers, such as workflows,
 *     are queued and executed in the same transaction, running through the middleware, the filters and validation when they
 *     are processed.</li>
 * </ol>
 * If anything fails, the transaction is rolled back and the exception is propagated. Each batch gets a fresh {@link AggregateRepository}, which
 * is cleared when the batch is done.
 */
public class CommandService {
    private static final Logger log = LoggerFactory.getLogger(CommandService.class);

    private final TransactionProvider transactionProvider;
    private final Supplier<AggregateRepository> repositoryFactory;
    private final EventConverter eventConverter;
    private final CommandServiceConfig config;

    /**
     * @param transactionProvider The transaction provider that every batch of commands is executed in
     * @param repositoryFactory   Creates the aggregate repository of a unit of work
     * @param eventConverter      Serializes commands when they are stored
     * @param config              Handlers, middleware and policies
     */
    public CommandService(TransactionProvider transactionProvider, Supplier<AggregateRepository> repositoryFactory, EventConverter eventConverter, CommandServiceConfig config) {
        this.transactionProvider = requireNonNull(transactionProvider, TransactionProvider.class.getSimpleName() + " cannot be null");
        this.repositoryFactory = requireNonNull(repositoryFactory, "Repository factory cannot be null");
        this.eventConverter = requireNonNull(eventConverter, EventConverter.class.getSimpleName() + " cannot be null");
        this.config = requireNonNull(config, CommandServiceConfig.class.getSimpleName() + " cannot be null");
    }

    public void execute(Command... commands) {
        execute(List.of(commands));
    }

    public void execute(List<? extends Command> commands) {
        execute(commands, null);
    }

    private void execute(List<? extends Command> commands, @Nullable DomainEvent causation) {
        requireNonNull(commands, "Commands cannot be null");
        commands.forEach(command -> requireNonNull(command, Command.class.getSimpleName() + " cannot be null"));
        config.retryStrategy.execute(() -> executeInUnitOfWork(commands, causation));
    }

    private void executeInUnitOfWork(List<? extends Command> commands, @Nullable DomainEvent causation) {
        Execution execution = new Execution(new UnitOfWork(), repositoryFactory.get());
        try {
            execution.admit(commands, 0, causation);
        } finally {
            execution.queue.clear();
            execution.repository.clear();
        }
    }

    private void filterAndValidate(Command command) {
        config.commandFilters.forEach(filter -> filter.execute(command));
        List<ValidationError> errors = command.validate();
        if (!errors.isEmpty()) {
            throw new CommandNotValidException(command, errors);
        }
    }

    private record QueuedCommand(Command command, @Nullable DomainEvent causation, boolean admitted) {
    }

    private final class Execution {
        private final UnitOfWork unitOfWork;
        private final AggregateRepository repository;
        private final Deque<QueuedCommand> queue = new ArrayDeque<>();
        private final EventPublisher eventPublisher = new EventPublisher(config.eventHandlers);

        private Execution(UnitOfWork unitOfWork, AggregateRepository repository) {
            this.unitOfWork = unitOfWork;
            this.repository = repository;
        }

        /**
         * Run the commands from {@code index} on through their middleware, filters and validation, and process the admitted commands
         * in a transaction once all of them have been admitted. A command whose middleware doesn't continue is skipped.
         */
        private void admit(List<? extends Command> commands, int index, @Nullable DomainEvent causation) {
            if (index == commands.size()) {
                if (!queue.isEmpty()) {
                    transactionProvider.transactional(unitOfWork, () -> {
                        processQueue();
                        return null;
                    });
                }
                return;
            }
            Command command = commands.get(index);
            boolean[] continued = {false};
            config.middleware.invoke(command, new CommandContext(unitOfWork, repository), () -> {
                continued[0] = true;
                filterAndValidate(command);
                queue.add(new QueuedCommand(command, causation, true));
                admit(commands, index + 1, causation);
            });
            if (!continued[0]) {
                log.debug("Middleware skipped command {}", command.getClass().getSimpleName());
                admit(commands, index + 1, causation);
            }
        }

        private void processQueue() {
            QueuedCommand next;
            while ((next = queue.poll()) != null) {
                QueuedCommand queued = next;
                CommandContext context = new CommandContext(unitOfWork, repository);
                if (queued.admitted()) {
                    process(queued, context);
                } else {
                    config.middleware.invoke(queued.command(), context, () -> {
                        filterAndValidate(queued.command());
                        process(queued, context);
                    });
                }
            }
        }

        private void process(QueuedCommand queued, CommandContext context) {
            Command command = queued.command();
            log.debug("Processing command {}", command.getClass().getSimpleName());

            config.commandHandlers.stream()
                    .filter(handler -> handler.handles(command))
                    .forEach(handler -> handler.handle(command, context));

            CommitResult result = repository.commit(toCommandRecord(command, queued.causation()));
            if (result.isEmpty()) {
                return;
            }

            CommandRecord stored = Objects.requireNonNull(result.command());
            List<EventContext> events = result.events().stream()
                    .map(event -> new EventContext(event, stored, unitOfWork, commands -> executeCausedBy(event, commands)))
                    .toList();
            switch (config.eventPublication) {
                case IN_TRANSACTION -> eventPublisher.publish(events);
                case AFTER_COMMIT -> unitOfWork.afterCommit(() -> eventPublisher.publish(events));
            }
        }

        private void executeCausedBy(DomainEvent event, List<Command> commands) {
            if (unitOfWork.isInTransaction()) {
                for (Command command : commands) {
                    queue.add(new QueuedCommand(command, event, false));
                }
            } else {
                // The unit of work has committed, so the commands form a new batch
                execute(commands, event);
            }
        }

        private CommandRecord toCommandRecord(Command command, @Nullable DomainEvent causation) {
            return new CommandRecord(null, command.userId(), command.aggregateId(), command.getClass().getSimpleName(), eventConverter.serialize(command),
                    causation == null ? null : causation.aggregateId(), causation == null ? null : causation.sequenceNumber(),
                    Instant.now().truncatedTo(ChronoUnit.MICROS));
        }
    }
}
