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

import java.util.function.Supplier;

/**
 * A {@link TransactionProvider} that runs the block without a transaction. Used where isolation is guaranteed elsewhere or is irrelevant,
 * for example when rebuilding projections that are thrown away on failure, and in tests. After-commit callbacks run when the block returns.
 */
public class NoTransactionProvider extends AbstractTransactionProvider {

    @Override
    <T> T executeInTransaction(Supplier<T> block) {
        return block.get();
    }
}
