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

import org.strata.eventstore.api.ErrorKind;
import org.strata.eventstore.api.StrataException;

import java.util.List;

/**
 * Thrown when a {@link Command} is not valid. Nothing has been stored. The command may be corrected and submitted again.
 */
public class CommandNotValidException extends RuntimeException implements StrataException {
    private final transient Command command;
    private final List<ValidationError> errors;

    public CommandNotValidException(Command command, List<ValidationError> errors) {
        super(message(command, errors));
        this.command = command;
        this.errors = List.copyOf(errors);
    }

    public Command command() {
        return command;
    }

    public List<ValidationError> errors() {
        return errors;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.COMMAND_NOT_VALID;
    }

    private static String message(Command command, List<ValidationError> errors) {
        String aggregateId = command.aggregateId() == null ? "" : " " + command.aggregateId();
        return "Invalid command " + command.getClass().getSimpleName() + aggregateId + ", errors: " + errors;
    }
}
