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

import java.sql.SQLException;

/**
 * Tells the backing store that the current transaction is read only.
 */
public interface ReadOnlyDirective {
    /**
     * The SQL state used by PostgreSQL (and the SQL standard) when a write is attempted in a read-only transaction.
     */
    String READ_ONLY_SQL_TRANSACTION = "25006";

    /**
     * Invoked once, at the start of the outermost read-only scope, inside the transaction.
     */
    void apply();

    /**
     * Invoked once, when the outermost read-only scope has ended.
     */
    default void release() {
    }

    /**
     * @return {@code true} if {@code throwable}, or one of its causes, is the backing store rejecting a write
     */
    default boolean isReadOnlyViolation(Throwable throwable) {
        for (Throwable t = throwable; t != null; t = t.getCause()) {
            if (t instanceof SQLException sqlException && READ_ONLY_SQL_TRANSACTION.equals(sqlException.getSQLState())) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }
}
