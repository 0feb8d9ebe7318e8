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

package org.strata.application.command;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * A request to change the state of one or more aggregates. Commands are serialized and stored, together with
 * the events they cause, so they should be plain values that Jackson can serialize.
 */
public interface Command {

    /**
     * @return The id of the aggregate that this command targets, {@code null} if it targets no single aggregate
     */
    @Nullable
    String aggregateId();

    /**
     * @return The id of the user that issued the command, if known
     */
    default @Nullable String userId() {
        return null;
    }

    /**
     * Validate the command. Commands are validated before any transaction is opened.
     *
     * @return The validation errors, empty if the command is valid
     */
    default List<ValidationError> validate() {
        return List.of();
    }
}
