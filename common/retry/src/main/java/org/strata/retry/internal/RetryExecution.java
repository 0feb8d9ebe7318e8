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

package org.strata.retry.internal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.strata.retry.Backoff;
import org.strata.retry.MaxAttempts;
import org.strata.retry.RetryInfo;
import org.strata.retry.RetryStrategy;
import org.strata.retry.RetryStrategy.DontRetry;

import java.time.Duration;
import java.util.Iterator;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * Internal class for executing functions with retry capability. Never use this class directly from your own code!
 */
public class RetryExecution {
    private static final Logger log = LoggerFactory.getLogger(RetryExecution.class);

    public static <T> T executeWithRetry(Function<RetryInfo, T> fn, RetryStrategy retryStrategy) {
        if (retryStrategy instanceof DontRetry) {
            return fn.apply(new RetryInfo(1, 1, Duration.ZERO));
        }
        RetryImpl retry = (RetryImpl) retryStrategy;
        Iterator<Long> delay = convertToDelayStream(retry.backoff);
        MaxAttempts maxAttempts = retry.maxAttempts;

        int attempt = 1;
        Duration previousBackoff = Duration.ZERO;
        for (; ; ) {
            try {
                return fn.apply(new RetryInfo(attempt, maxAttempts.asInt(), previousBackoff));
            } catch (Throwable e) {
                if (maxAttempts.isExhaustedAfter(attempt) || !retry.retryPredicate.test(e)) {
                    return sneakyThrow(e);
                }
                retry.retryableErrorListener.accept(e);
                long backoffMillis = delay.next();
                log.debug("Attempt {} failed with {}, retrying in {} ms", attempt, e.getClass().getSimpleName(), backoffMillis);
                if (backoffMillis > 0) {
                    try {
                        TimeUnit.MILLISECONDS.sleep(backoffMillis);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        throw new RuntimeException(e);
                    }
                }
                previousBackoff = Duration.ofMillis(backoffMillis);
                attempt++;
            }
        }
    }

    private static Iterator<Long> convertToDelayStream(Backoff backoff) {
        final Stream<Long> delay;
        if (backoff instanceof Backoff.None) {
            delay = Stream.iterate(0L, __ -> 0L);
        } else if (backoff instanceof Backoff.Fixed fixed) {
            long millis = fixed.duration().toMillis();
            delay = Stream.iterate(millis, __ -> millis);
        } else if (backoff instanceof Backoff.Exponential exponential) {
            long maxMillis = exponential.max().toMillis();
            delay = Stream.iterate(exponential.initial().toMillis(), current -> Math.min(maxMillis, Math.round(current * exponential.multiplier())));
        } else {
            throw new IllegalStateException("Invalid backoff: " + backoff.getClass().getName());
        }
        return delay.iterator();
    }

    @SuppressWarnings("unchecked")
    private static <T, E extends Throwable> T sneakyThrow(Throwable t) throws E {
        throw (E) t;
    }
}
