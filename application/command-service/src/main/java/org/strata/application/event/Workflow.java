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
import org.strata.aggregate.DomainEvent;
import org.strata.aggregate.EventDispatchTable;
import org.strata.application.command.Command;

import java.util.Objects;

/**
 * An event handler that reacts to events by executing commands or scheduling side effects that run after the transaction has committed.
 * Subclasses declare their handlers in a dispatch table that receives the {@link EventContext}:
 *
 * <pre>
 * public class SendWelcomeMail extends Workflow {
 *     private final EventDispatchTable&lt;EventContext&gt; events = EventDispatchTable.&lt;EventContext&gt;builder()
 *             .on(AccountOpened.class, this::accountOpened)
 *             .build();
 *
 *     private void accountOpened(EventContext context, AccountOpened accountOpened) {
 *         afterCommit(context, true, () -&gt; mailer.sendWelcomeMail(accountOpened.owner()));
 *     }
 *
 *     protected EventDispatchTable&lt;EventContext&gt; dispatchTable() {
 *         return events;
 *     }
 * }
 * </pre>
 */
public abstract class Workflow implements EventHandler {
    private static final Logger log = LoggerFactory.getLogger(Workflow.class);

    protected abstract EventDispatchTable<EventContext> dispatchTable();

    @Override
    public final void handle(DomainEvent event, EventContext context) {
        dispatchTable().dispatch(context, event);
    }

    /**
     * Execute commands caused by the event being handled.
     */
    protected final void executeCommands(EventContext context, Command... commands) {
        context.executeCommands(commands);
    }

    /**
     * Run {@code callback} after the transaction has committed. The callback can't roll back the transaction.
     *
     * @param ignoreErrors {@code true} to log errors thrown by the callback instead of propagating them
     */
    protected final void afterCommit(EventContext context, boolean ignoreErrors, Runnable callback) {
        Objects.requireNonNull(callback, "Callback cannot be null");
        context.unitOfWork().afterCommit(() -> {
            try {
                callback.run();
            } catch (RuntimeException e) {
                if (!ignoreErrors) {
                    throw e;
                }
                log.warn("An exception was thrown in an after commit callback of {}", name(), e);
            }
        });
    }
}
