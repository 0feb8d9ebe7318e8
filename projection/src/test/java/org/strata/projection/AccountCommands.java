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

import org.strata.application.command.Command;
import org.strata.application.command.CommandHandler;
import org.strata.testsupport.domain.BankAccount;

public class AccountCommands {

    public record OpenAccount(String aggregateId, String owner) implements Command {
    }

    public record Deposit(String aggregateId, long amount) implements Command {
    }

    public record Withdraw(String aggregateId, long amount) implements Command {
    }

    public record ChangeOwner(String aggregateId, String owner) implements Command {
    }

    public static CommandHandler[] handlers() {
        return new CommandHandler[]{
                CommandHandler.on(OpenAccount.class, (command, context) -> context.repository().addAggregate(BankAccount.open(command.aggregateId(), command.owner()))),
                CommandHandler.on(Deposit.class, (command, context) -> context.repository().loadAggregate(command.aggregateId(), BankAccount.class).deposit(command.amount())),
                CommandHandler.on(Withdraw.class, (command, context) -> context.repository().loadAggregate(command.aggregateId(), BankAccount.class).withdraw(command.amount())),
                CommandHandler.on(ChangeOwner.class, (command, context) -> context.repository().loadAggregate(command.aggregateId(), BankAccount.class).changeOwner(command.owner()))
        };
    }

    private AccountCommands() {
    }
}
