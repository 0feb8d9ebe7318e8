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
 * Runs a block of code in a transaction of a {@link UnitOfWork}.
 */
public interface TransactionProvider {

    /**
     * Run {@code block} in a transaction. The after-commit callbacks of the unit of work are run after the outermost transaction
     * of the unit of work has committed, and discarded when it fails.
     *
     * @return The result of {@code block}
     */
    <T> T transactional(UnitOfWork unitOfWork, Supplier<T> block);
}
