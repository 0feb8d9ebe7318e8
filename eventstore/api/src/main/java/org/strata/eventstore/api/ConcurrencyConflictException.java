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

package org.strata.eventstore.api;

import java.util.Objects;
import java.util.StringJoiner;

/**
 * Another committer has already claimed the sequence number that was about to be written for the aggregate,
 * so no events have been written to the event store. This is effectively an optimistic locking exception and
 * the whole command should be retried after the aggregate has been reloaded.
 */
public class ConcurrencyConflictException extends RuntimeException implements StrataException {
    public final String aggregateId;
    public final long sequenceNumber;

    public ConcurrencyConflictException(String aggregateId, long sequenceNumber, String message) {
        this(aggregateId, sequenceNumber, message, null);
    }

    public ConcurrencyConflictException(String aggregateId, long sequenceNumber, String message, Throwable cause) {
        super(message, cause);
        this.aggregateId = aggregateId;
        this.sequenceNumber = sequenceNumber;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.CONCURRENCY_CONFLICT;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConcurrencyConflictException that)) return false;
        return sequenceNumber == that.sequenceNumber && Objects.equals(aggregateId, that.aggregateId) && Objects.equals(getMessage(), that.getMessage());
    }

    @Override
    public int hashCode() {
        return Objects.hash(aggregateId, sequenceNumber);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", ConcurrencyConflictException.class.getSimpleName() + "[", "]")
                .add("aggregateId='" + aggregateId + "'")
                .add("sequenceNumber=" + sequenceNumber)
                .add("message=" + super.getMessage())
                .toString();
    }
}
