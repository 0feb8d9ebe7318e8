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

import java.time.Duration;

/**
 * Information about the current attempt, passed to functions executed by {@link RetryStrategy#execute(java.util.function.Function)}.
 *
 * @param attemptNumber The number of this attempt, {@code 1} if first attempt.
 * @param maxAttempts   The configured max attempts, {@code Integer.MAX_VALUE} if infinite.
 * @param backoff       The backoff that was waited before this attempt.
 */
public record RetryInfo(int attemptNumber, int maxAttempts, Duration backoff) {

    /**
     * @return The number of retries that have been made before this attempt.
     */
    public int retryCount() {
        return attemptNumber - 1;
    }

    public boolean isFirstAttempt() {
        return attemptNumber == 1;
    }

    public boolean isLastAttempt() {
        return attemptNumber == maxAttempts;
    }
}
