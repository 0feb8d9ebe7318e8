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

package org.strata.aggregate;

import org.strata.eventstore.api.ErrorKind;
import org.strata.eventstore.api.StrataException;

/**
 * Another instance of an aggregate with the same id is already part of the unit of work.
 */
public class NonUniqueAggregateIdException extends RuntimeException implements StrataException {
    public final String aggregateId;

    public NonUniqueAggregateIdException(String aggregateId, String existingType, String newType) {
        super(String.format("Duplicate aggregate id %s, an aggregate of type %s is already registered while adding %s", aggregateId, existingType, newType));
        this.aggregateId = aggregateId;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.INTEGRITY;
    }
}
