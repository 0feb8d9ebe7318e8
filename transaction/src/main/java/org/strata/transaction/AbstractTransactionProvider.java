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

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Keeps track of the transaction depth of the {@link UnitOfWork} and runs its after-commit callbacks when the outermost transaction has committed.
 * The callbacks run outside the transaction. The after-commit queue is always empty when the outermost transaction has ended, regardless of its outcome.
 */
abstract class AbstractTransactionProvider implements TransactionProvider {

    @Override
    public final <T> T transactional(UnitOfWork unitOfWork, Supplier<T> block) {
        Objects.requireNonNull(unitOfWork, UnitOfWork.class.getSimpleName() + " cannot be null");
        Objects.requireNonNull(block, "Block cannot be null");
        boolean outermost = unitOfWork.enterTransaction();
        boolean committed = false;
        T result;
        try {
            result = executeInTransaction(block);
            committed = true;
        } finally {
            unitOfWork.exitTransaction();
            if (outermost && !committed) {
                unitOfWork.clearAfterCommitCallbacks();
            }
        }

        if (outermost) {
            try {
                unitOfWork.runAfterCommitCallbacks();
            } finally {
                unitOfWork.clearAfterCommitCallbacks();
            }
        }
        return result;
    }

    /**
     * Run the block in a transaction that has committed when this method returns.
     */
    abstract <T> T executeInTransaction(Supplier<T> block);
}
