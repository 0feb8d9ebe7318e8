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

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * The execution context of one unit of work, for example the execution of a batch of commands. It's passed explicitly to the
 * {@link TransactionProvider} and carries the callbacks to run after the transaction has committed and the nesting depth of
 * read-only scopes. A {@code UnitOfWork} is confined to the thread that executes it.
 */
@NullMarked
public final class UnitOfWork {
    private final Deque<Runnable> afterCommitCallbacks = new ArrayDeque<>();
    private int transactionDepth;
    private @Nullable Integer readOnlyDepth;
    private boolean readOnlyViolation;

    /**
     * Enqueue a callback that is run after the outermost transaction of this unit of work has committed. Callbacks run in the order
     * they were enqueued and are discarded if the transaction is rolled back.
     */
    public void afterCommit(Runnable callback) {
        Objects.requireNonNull(callback, "Callback cannot be null");
        afterCommitCallbacks.add(callback);
    }

    public int pendingAfterCommitCallbacks() {
        return afterCommitCallbacks.size();
    }

    public boolean isInTransaction() {
        return transactionDepth > 0;
    }

    /**
     * @return The nesting depth of read-only scopes, {@code null} if not in a read-only scope
     */
    public @Nullable Integer readOnlyDepth() {
        return readOnlyDepth;
    }

    public boolean isReadOnly() {
        return readOnlyDepth != null;
    }

    /**
     * @return {@code true} if the store rejected a write in a read-only scope of this unit of work
     */
    public boolean hasReadOnlyViolation() {
        return readOnlyViolation;
    }

    boolean enterTransaction() {
        return ++transactionDepth == 1;
    }

    void exitTransaction() {
        transactionDepth--;
    }

    void runAfterCommitCallbacks() {
        Runnable callback;
        while ((callback = afterCommitCallbacks.poll()) != null) {
            callback.run();
        }
    }

    void clearAfterCommitCallbacks() {
        afterCommitCallbacks.clear();
    }

    boolean enterReadOnlyScope() {
        readOnlyDepth = readOnlyDepth == null ? 1 : readOnlyDepth + 1;
        return readOnlyDepth == 1;
    }

    /**
     * @return {@code true} if the outermost read-only scope was exited
     */
    boolean exitReadOnlyScope() {
        if (readOnlyDepth == null) {
            throw new IllegalStateException("Not in a read-only scope");
        }
        readOnlyDepth = readOnlyDepth - 1;
        if (readOnlyDepth == 0) {
            readOnlyDepth = null;
            return true;
        }
        return false;
    }

    void markReadOnlyViolation() {
        readOnlyViolation = true;
    }
}
