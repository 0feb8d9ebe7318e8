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

package org.strata.transaction;

import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * A {@link TransactionProvider} that always starts a new, independent transaction using Spring's {@link TransactionTemplate}, so that
 * a rollback of the block never depends on whether the caller already has a transaction.
 */
public class ReadWriteTransactionProvider extends AbstractTransactionProvider {
    private final TransactionTemplate transactionTemplate;

    public ReadWriteTransactionProvider(PlatformTransactionManager transactionManager) {
        requireNonNull(transactionManager, PlatformTransactionManager.class.getSimpleName() + " cannot be null");
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @Override
    <T> T executeInTransaction(Supplier<T> block) {
        return transactionTemplate.execute(__ -> block.get());
    }
}
