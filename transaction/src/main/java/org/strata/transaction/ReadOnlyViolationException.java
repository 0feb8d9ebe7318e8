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

package org.strata.transaction;

import org.strata.eventstore.api.ErrorKind;
import org.strata.eventstore.api.StrataException;

/**
 * A write was attempted in a read-only scope and was rejected by the backing store.
 */
public class ReadOnlyViolationException extends RuntimeException implements StrataException {

    public ReadOnlyViolationException(Throwable cause) {
        super("Write attempted in a read-only transaction", cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.READ_ONLY_VIOLATION;
    }
}
