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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * A {@link TransactionProvider} that makes transactions read only. Read-only scopes may be nested: only the outermost scope opens a
 * transaction, using the wrapped provider, and applies the {@link ReadOnlyDirective}. Nested scopes run in the transaction of the
 * outermost scope. The nesting depth is kept in the {@link UnitOfWork}.
 * <p>
 * A write rejected by the backing store is recorded in the unit of work and propagated as a {@link ReadOnlyViolationException}.
 */
public class ReadOnlyTransactionProvider implements TransactionProvider {
    private static final Logger log = LoggerFactory.getLogger(ReadOnlyTransactionProvider.class);

    private final TransactionProvider transactionProvider;
    private final ReadOnlyDirective readOnlyDirective;

    public ReadOnlyTransactionProvider(TransactionProvider transactionProvider, ReadOnlyDirective readOnlyDirective) {
        requireNonNull(transactionProvider, TransactionProvider.class.getSimpleName() + " cannot be null");
        requireNonNull(readOnlyDirective, ReadOnlyDirective.class.getSimpleName() + " cannot be null");
        this.transactionProvider = transactionProvider;
        this.readOnlyDirective = readOnlyDirective;
    }

    @Override
    public <T> T transactional(UnitOfWork unitOfWork, Supplier<T> block) {
        Objects.requireNonNull(unitOfWork, UnitOfWork.class.getSimpleName() + " cannot be null");
        Objects.requireNonNull(block, "Block cannot be null");
        boolean outermost = unitOfWork.enterReadOnlyScope();
        try {
            if (!outermost) {
                return runDetectingViolations(unitOfWork, block);
            }
            return transactionProvider.transactional(unitOfWork, () -> {
                readOnlyDirective.apply();
                return runDetectingViolations(unitOfWork, block);
            });
        } finally {
            if (unitOfWork.exitReadOnlyScope()) {
                readOnlyDirective.release();
            }
        }
    }

    private <T> T runDetectingViolations(UnitOfWork unitOfWork, Supplier<T> block) {
        try {
            return block.get();
        } catch (ReadOnlyViolationException e) {
            throw e;
        } catch (RuntimeException e) {
            if (readOnlyDirective.isReadOnlyViolation(e)) {
                log.warn("Write attempted in read-only transaction", e);
                unitOfWork.markReadOnlyViolation();
                throw new ReadOnlyViolationException(e);
            }
            throw e;
        }
    }
}
