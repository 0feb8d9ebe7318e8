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

import org.strata.eventstore.api.CommandRecord;
import org.strata.eventstore.api.EventRecord;
import org.strata.eventstore.api.PendingPartitionChange;
import org.strata.eventstore.api.StreamRecord;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

class RowMappers {
    static final String EVENT_COLUMNS = "e.aggregate_id, e.sequence_number, e.event_type, e.event_json, e.created_at, e.command_record_id, e.partition_key, e.commit_order";

    static final RowMapper<EventRecord> EVENT = (rs, __) -> new EventRecord(
            rs.getString("aggregate_id"),
            rs.getLong("sequence_number"),
            rs.getString("event_type"),
            rs.getString("event_json"),
            instant(rs, "created_at"),
            nullableLong(rs, "command_record_id"),
            rs.getString("partition_key"),
            nullableLong(rs, "commit_order"));

    static final RowMapper<StreamRecord> STREAM = (rs, __) -> new StreamRecord(
            rs.getString("aggregate_id"),
            rs.getString("aggregate_type"),
            instant(rs, "created_at"),
            rs.getObject("snapshot_threshold", Integer.class),
            rs.getString("partition_key"));

    static final RowMapper<CommandRecord> COMMAND = (rs, __) -> new CommandRecord(
            rs.getLong("id"),
            rs.getString("user_id"),
            rs.getString("aggregate_id"),
            rs.getString("command_type"),
            rs.getString("command_json"),
            rs.getString("causation_aggregate_id"),
            nullableLong(rs, "causation_sequence_number"),
            instant(rs, "created_at"));

    static final RowMapper<PendingPartitionChange> PENDING_PARTITION_CHANGE = (rs, __) -> new PendingPartitionChange(
            rs.getString("aggregate_id"),
            rs.getString("old_partition_key"),
            rs.getString("new_partition_key"));

    static OffsetDateTime timestamp(Instant instant) {
        return OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    private static Instant instant(ResultSet rs, String column) throws SQLException {
        return rs.getObject(column, OffsetDateTime.class).toInstant();
    }

    private static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }
}
