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

package org.strata.projection.migration;

import org.strata.eventstore.api.ErrorKind;
import org.strata.eventstore.api.StrataException;

/**
 * Thrown when a migration, or partition maintenance, is started while another migration is running.
 */
public class ConcurrentMigrationException extends RuntimeException implements StrataException {

    public ConcurrentMigrationException(String message) {
        super(message);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.CONCURRENT_MIGRATION;
    }
}
