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

package org.strata.retry;

import org.strata.retry.internal.RetryImpl;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

import static org.strata.retry.internal.RetryExecution.executeWithRetry;

/**
 * Retry strategy to use if an action throws an exception.
 * <p>
 * A {@code RetryStrategy} is immutable and thread-safe, every configuration method returns a new instance:
 * <pre>
 * RetryStrategy retryStrategy = RetryStrategy.fixed(100).maxAttempts(5).retryIf(ConcurrencyConflictException.class::isInstance);
 * retryStrategy.execute(() -> commandService.execute(command));
 * </pre>
 */
public sealed interface RetryStrategy permits RetryStrategy.DontRetry, RetryStrategy.Retry {

    /**
     * Create a retry strategy that retries on all exceptions, without backoff, an infinite number of times.
     */
    static Retry retry() {
        return new RetryImpl();
    }

    /**
     * Create a retry strategy that doesn't retry.
     */
    static DontRetry none() {
        return DontRetry.INSTANCE;
    }

    static Retry exponentialBackoff(Duration initial, Duration max, double multiplier) {
        return retry().backoff(Backoff.exponential(initial, max, multiplier));
    }

    static Retry fixed(Duration duration) {
        return retry().backoff(Backoff.fixed(duration));
    }

    static Retry fixed(long millis) {
        return retry().backoff(Backoff.fixed(millis));
    }

    /**
     * Execute the function with the configured retry settings. Rethrows the last exception when the strategy is exhausted.
     *
     * @param function A function that takes a {@link RetryInfo} and returns the result
     * @return The result of the function
     */
    default <T> T execute(Function<RetryInfo, T> function) {
        Objects.requireNonNull(function, Function.class.getSimpleName() + " cannot be null");
        return executeWithRetry(function, this);
    }

    default <T> T execute(Supplier<T> supplier) {
        Objects.requireNonNull(supplier, Supplier.class.getSimpleName() + " cannot be null");
        return executeWithRetry(__ -> supplier.get(), this);
    }

    default void execute(Runnable runnable) {
        Objects.requireNonNull(runnable, Runnable.class.getSimpleName() + " cannot be null");
        executeWithRetry(__ -> {
            runnable.run();
            return null;
        }, this);
    }

    final class DontRetry implements RetryStrategy {
        private static final DontRetry INSTANCE = new DontRetry();

        private DontRetry() {
        }

        @Override
        public String toString() {
            return DontRetry.class.getSimpleName();
        }
    }

    non-sealed interface Retry extends RetryStrategy {

        Retry backoff(Backoff backoff);

        Retry infiniteAttempts();

        /**
         * Specify the max number of times the action is invoked before failing, including the first attempt.
         */
        Retry maxAttempts(int maxAttempts);

        /**
         * Only retry if the predicate is {@code true}. Overrides the previous retry predicate.
         */
        Retry retryIf(Predicate<Throwable> retryPredicate);

        /**
         * Invoked for every error that will be retried, before waiting for the backoff.
         */
        Retry onRetryableError(Consumer<Throwable> retryableErrorListener);
    }
}
