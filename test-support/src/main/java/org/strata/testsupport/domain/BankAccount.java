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

package org.strata.testsupport.domain;

import org.strata.aggregate.AggregateRoot;
import org.strata.aggregate.EventDispatchTable;
import org.strata.aggregate.Snapshottable;

/**
 * A bank account used as sample aggregate in tests. The partition key of an account is the first letter of its owner.
 */
public class BankAccount extends AggregateRoot<BankAccount> implements Snapshottable<BankAccount.State> {

    public record State(String owner, long balance) {
    }

    private static final EventDispatchTable<BankAccount> EVENTS = EventDispatchTable.<BankAccount>builder()
            .on(AccountOpened.class, (account, e) -> account.owner = e.owner())
            .on(MoneyDeposited.class, (account, e) -> account.balance += e.amount())
            .on(MoneyWithdrawn.class, (account, e) -> account.balance -= e.amount())
            .on(OwnerChanged.class, (account, e) -> account.owner = e.owner())
            .build();

    private String owner;
    private long balance;

    public BankAccount(String id) {
        super(id);
    }

    public static BankAccount open(String id, String owner) {
        BankAccount account = new BankAccount(id);
        account.apply(new AccountOpened(owner));
        return account;
    }

    public void deposit(long amount) {
        if (amount <= 0) {
            throw new IllegalArgumentException("Amount must be positive");
        }
        apply(new MoneyDeposited(amount));
    }

    public void withdraw(long amount) {
        if (amount > balance) {
            throw new IllegalStateException("Insufficient funds in account " + id() + ": balance " + balance + ", requested " + amount);
        }
        apply(new MoneyWithdrawn(amount));
    }

    public void changeOwner(String owner) {
        apply(new OwnerChanged(owner));
    }

    public String owner() {
        return owner;
    }

    public long balance() {
        return balance;
    }

    @Override
    public String partitionKey() {
        return owner == null || owner.isEmpty() ? "" : owner.substring(0, 1).toLowerCase();
    }

    @Override
    protected EventDispatchTable<BankAccount> dispatchTable() {
        return EVENTS;
    }

    @Override
    public State snapshotState() {
        return new State(owner, balance);
    }

    @Override
    public void restoreSnapshotState(State state) {
        this.owner = state.owner();
        this.balance = state.balance();
    }

    @Override
    public Class<State> snapshotStateType() {
        return State.class;
    }
}
