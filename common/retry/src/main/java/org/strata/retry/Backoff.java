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

import java.time.Duration;
import java.util.Objects;

/**
 * The time to wait between two attempts of a {@link RetryStrategy}.
 */
@NullMarked
public sealed interface Backoff {

    static Backoff none() {
        return None.INSTANCE;
    }

    static Backoff fixed(long millis) {
        return new Fixed(Duration.ofMillis(millis));
    }

    static Backoff fixed(Duration duration) {
        return new Fixed(duration);
    }

    /**
     * Wait {@code initial} before the first retry, then multiply the wait time with {@code multiplier} for each retry, never exceeding {@code max}.
     */
    static Backoff exponential(Duration initial, Duration max, double multiplier) {
        return new Exponential(initial, max, multiplier);
    }

    final class None implements Backoff {
        private static final None INSTANCE = new None();

        private None() {
        }

        @Override
        public String toString() {
            return None.class.getSimpleName();
        }
    }

    record Fixed(Duration duration) implements Backoff {
        public Fixed {
            Objects.requireNonNull(duration, "Duration cannot be null");
            if (duration.isNegative()) {
                throw new IllegalArgumentException("Duration cannot be negative");
            }
        }
    }

    record Exponential(Duration initial, Duration max, double multiplier) implements Backoff {
        public Exponential {
            Objects.requireNonNull(initial, "Initial duration cannot be null");
            Objects.requireNonNull(max, "Max duration cannot be null");
            if (multiplier < 1.0) {
                throw new IllegalArgumentException("Multiplier must be greater than or equal to 1");
            }
            if (initial.compareTo(max) > 0) {
                throw new IllegalArgumentException("Initial duration cannot be greater than max duration");
            }
        }
    }
}
