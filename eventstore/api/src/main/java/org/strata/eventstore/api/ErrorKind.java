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

/**
 * The kind of error that occurred, so that a command submitter can react to it without inspecting exception types.
 */
public enum ErrorKind {
    COMMAND_NOT_VALID(true),
    CONCURRENCY_CONFLICT(true),
    AGGREGATE_NOT_FOUND(false),
    TYPE_MISMATCH(false),
    CONCURRENT_MIGRATION(true),
    READ_ONLY_VIOLATION(false),
    INTEGRITY(false),
    INTERNAL(false);

    private final boolean recoverable;

    ErrorKind(boolean recoverable) {
        this.recoverable = recoverable;
    }

    /**
     * @return {@code true} if the caller may recover from this kind of error, by retrying or by correcting the submitted command.
     */
    public boolean isRecoverable() {
        return recoverable;
    }
}
