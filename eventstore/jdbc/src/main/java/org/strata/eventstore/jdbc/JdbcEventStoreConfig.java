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

package org.strata.eventstore.jdbc;

import java.util.Objects;
import java.util.StringJoiner;

/**
 * Configuration for the {@link JdbcEventStore}.
 */
public class JdbcEventStoreConfig {
    public static final int DEFAULT_FETCH_SIZE = 1000;
    public static final String DEFAULT_SCHEMA_LOCATION = "org/strata/eventstore/jdbc/schema.sql";

    public final int fetchSize;
    public final boolean initializeSchema;

    private JdbcEventStoreConfig(int fetchSize, boolean initializeSchema) {
        if (fetchSize < 1) {
            throw new IllegalArgumentException("Fetch size must be greater than 0");
        }
        this.fetchSize = fetchSize;
        this.initializeSchema = initializeSchema;
    }

    public static JdbcEventStoreConfig defaultConfig() {
        return new JdbcEventStoreConfig(DEFAULT_FETCH_SIZE, false);
    }

    /**
     * The number of rows fetched per round trip when events are loaded.
     */
    public JdbcEventStoreConfig fetchSize(int fetchSize) {
        return new JdbcEventStoreConfig(fetchSize, initializeSchema);
    }

    /**
     * Create the event store tables, if they don't exist, when the {@link JdbcEventStore} is created.
     */
    public JdbcEventStoreConfig initializeSchema(boolean initializeSchema) {
        return new JdbcEventStoreConfig(fetchSize, initializeSchema);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JdbcEventStoreConfig that)) return false;
        return fetchSize == that.fetchSize && initializeSchema == that.initializeSchema;
    }

    @Override
    public int hashCode() {
        return Objects.hash(fetchSize, initializeSchema);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", JdbcEventStoreConfig.class.getSimpleName() + "[", "]")
                .add("fetchSize=" + fetchSize)
                .add("initializeSchema=" + initializeSchema)
                .toString();
    }
}
