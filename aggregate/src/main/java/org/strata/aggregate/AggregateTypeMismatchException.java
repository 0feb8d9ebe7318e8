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
 * The aggregate was loaded as a different type than the one it was stored as.
 */
public class AggregateTypeMismatchException extends RuntimeException implements StrataException {
    public final String aggregateId;
    public final String expectedType;
    public final String actualType;

    public AggregateTypeMismatchException(String aggregateId, String expectedType, String actualType) {
        super(String.format("Aggregate with id %s is of type %s but %s was expected", aggregateId, actualType, expectedType));
        this.aggregateId = aggregateId;
        this.expectedType = expectedType;
        this.actualType = actualType;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.TYPE_MISMATCH;
    }
}
