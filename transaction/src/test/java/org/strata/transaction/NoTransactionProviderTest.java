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

import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

@DisplayNameGeneration(ReplaceUnderscores.class)
class NoTransactionProviderTest {

    private final NoTransactionProvider transactionProvider = new NoTransactionProvider();

    @Test
    void runs_after_commit_callbacks_when_the_block_returns() {
        // Given
        UnitOfWork unitOfWork = new UnitOfWork();
        List<String> log = new ArrayList<>();

        // When
        transactionProvider.transactional(unitOfWork, () -> {
            unitOfWork.afterCommit(() -> log.add("callback"));
            log.add("block");
            return null;
        });

        // Then
        assertThat(log).containsExactly("block", "callback");
    }

    @Test
    void runs_after_commit_callbacks_outside_the_transaction() {
        // Given
        UnitOfWork unitOfWork = new UnitOfWork();
        List<Boolean> inTransaction = new ArrayList<>();

        // When
        transactionProvider.transactional(unitOfWork, () -> {
            inTransaction.add(unitOfWork.isInTransaction());
            unitOfWork.afterCommit(() -> inTransaction.add(unitOfWork.isInTransaction()));
            return null;
        });

        // Then
        assertThat(inTransaction).containsExactly(true, false);
    }

    @Test
    void clears_after_commit_callbacks_when_the_block_fails() {
        // Given
        UnitOfWork unitOfWork = new UnitOfWork();
        List<String> log = new ArrayList<>();

        // When
        Throwable throwable = catchThrowable(() -> transactionProvider.transactional(unitOfWork, () -> {
            unitOfWork.afterCommit(() -> log.add("callback"));
            throw new IllegalArgumentException("expected");
        }));

        // Then
        assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class);
        assertThat(log).isEmpty();
        assertThat(unitOfWork.pendingAfterCommitCallbacks()).isZero();
        assertThat(unitOfWork.isInTransaction()).isFalse();
    }

    @Test
    void clears_remaining_after_commit_callbacks_when_a_callback_fails() {
        // Given
        UnitOfWork unitOfWork = new UnitOfWork();
        List<String> log = new ArrayList<>();

        // When
        Throwable throwable = catchThrowable(() -> transactionProvider.transactional(unitOfWork, () -> {
            unitOfWork.afterCommit(() -> {
                throw new IllegalStateException("callback failed");
            });
            unitOfWork.afterCommit(() -> log.add("second"));
            return null;
        }));

        // Then
        assertThat(throwable).hasMessage("callback failed");
        assertThat(log).isEmpty();
        assertThat(unitOfWork.pendingAfterCommitCallbacks()).isZero();
    }
}
