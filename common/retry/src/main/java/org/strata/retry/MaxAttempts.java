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

import org.jspecify.annotations.NullMarked;

/**
 * The max number of times an action is invoked by a {@link RetryStrategy}, including the first attempt.
 */
@NullMarked
public sealed interface MaxAttempts {

    /**
     * @return {@code true} if no further attempt may be made after {@code attempt}
     */
    boolean isExhaustedAfter(int attempt);

    /**
     * @return The number of attempts, {@code Integer.MAX_VALUE} if unbounded
     */
    int asInt();

    static MaxAttempts limit(int attempts) {
        return new Limit(attempts);
    }

    static MaxAttempts infinite() {
        return Infinite.INSTANCE;
    }

    record Limit(int attempts) implements MaxAttempts {
        public Limit {
            if (attempts < 1) {
                throw new IllegalArgumentException("Max attempts must be greater than or equal to 1");
            }
        }

        @Override
        public boolean isExhaustedAfter(int attempt) {
            return attempt >= attempts;
        }

        @Override
        public int asInt() {
            return attempts;
        }
    }

    final class Infinite implements MaxAttempts {
        private static final Infinite INSTANCE = new Infinite();

        private Infinite() {
        }

        @Override
        public boolean isExhaustedAfter(int attempt) {
            return false;
        }

        @Override
        public int asInt() {
            return Integer.MAX_VALUE;
        }

        @Override
        public String toString() {
            return Infinite.class.getSimpleName();
        }
    }
}
