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

import org.springframework.jdbc.core.JdbcTemplate;
import org.strata.projection.ProjectionTable;
import org.strata.projection.persistor.Persistor;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * The commit orders of the events that have been replayed into the shadow schema. They are written by the persistor of the replay,
 * in the same transaction as the records the events produced, so an interrupted offline replay can be resumed without replaying an
 * event twice.
 */
class ReplayedIds {
    static final ProjectionTable TABLE = ProjectionTable.builder("replayed_ids")
            .column("commit_order", "BIGINT NOT NULL")
            .primaryKey("commit_order")
            .build();

    private static final ReplayedIds NONE = new ReplayedIds(false, Set.of());

    private final boolean recording;
    private final Set<Long> replayed;

    private ReplayedIds(boolean recording, Set<Long> replayed) {
        this.recording = recording;
        this.replayed = replayed;
    }

    /**
     * Neither records nor skips anything.
     */
    static ReplayedIds none() {
        return NONE;
    }

    /**
     * @return The ids recorded in {@code schema} with a commit order greater than {@code commitOrder}
     */
    static ReplayedIds recordedIn(JdbcTemplate jdbcTemplate, String schema, long commitOrder) {
        Set<Long> replayed = new HashSet<>(jdbcTemplate.queryForList("SELECT commit_order FROM " + TABLE.qualifiedName(schema) +
                " WHERE commit_order > ?", Long.class, commitOrder));
        return new ReplayedIds(true, replayed);
    }

    boolean contains(long commitOrder) {
        return replayed.contains(commitOrder);
    }

    int size() {
        return replayed.size();
    }

    void record(Persistor persistor, long commitOrder) {
        if (recording) {
            persistor.createRecord(TABLE, Map.of("commit_order", commitOrder));
        }
    }
}
