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

import org.strata.aggregate.AggregateType;
import org.strata.aggregate.AggregateTypeRegistry;
import org.strata.aggregate.EventConverter;
import org.strata.aggregate.ReflectionEventTypeMapper;

/**
 * Wiring of the {@link BankAccount} sample domain.
 */
public class BankAccounts {

    public static final int SNAPSHOT_THRESHOLD = 5;

    private BankAccounts() {
    }

    public static AggregateTypeRegistry aggregateTypes() {
        return AggregateTypeRegistry.of(AggregateType.of(BankAccount.class, BankAccount::new).snapshotThreshold(SNAPSHOT_THRESHOLD));
    }

    public static EventConverter eventConverter() {
        return new EventConverter(ReflectionEventTypeMapper.simple(AccountOpened.class, MoneyDeposited.class, MoneyWithdrawn.class, OwnerChanged.class));
    }
}
