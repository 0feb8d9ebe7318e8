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

package org.strata.projection.persistor;

import org.strata.projection.ProjectionTable;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads and writes the records of projection tables on behalf of a {@link org.strata.projection.Projector}. Records are maps from
 * column name to value. Column names are case insensitive. {@code where} maps select the records whose columns equal all the given values.
 */
public interface Persistor {

    void createRecord(ProjectionTable table, Map<String, ?> values);

    void updateRecords(ProjectionTable table, Map<String, ?> where, Map<String, ?> values);

    /**
     * Update the records selected by {@code where}, or create a record with the columns of both {@code where} and {@code values} if there is none.
     */
    void createOrUpdateRecord(ProjectionTable table, Map<String, ?> where, Map<String, ?> values);

    Optional<Map<String, Object>> getRecord(ProjectionTable table, Map<String, ?> where);

    List<Map<String, Object>> findRecords(ProjectionTable table, Map<String, ?> where);

    void deleteRecords(ProjectionTable table, Map<String, ?> where);

    /**
     * Invoked before a replay starts.
     */
    default void prepare() {
    }

    /**
     * Invoked when a replay is done. Persistors that buffer records write them here.
     */
    default void commit() {
    }
}
