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

import java.util.Objects;

/**
 * A field level validation error of a {@link Command}.
 */
public record ValidationError(String field, String message) {

    public ValidationError {
        Objects.requireNonNull(field, "Field cannot be null");
        Objects.requireNonNull(message, "Message cannot be null");
    }

    public static ValidationError of(String field, String message) {
        return new ValidationError(field, message);
    }

    @Override
    public String toString() {
        return field + " " + message;
    }
}
