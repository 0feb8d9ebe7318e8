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

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.strata.eventstore.api.CommandRecord;
import org.strata.eventstore.api.ConcurrencyConflictException;
import org.strata.eventstore.api.EventRecord;
import org.strata.eventstore.api.EventStore;
import org.strata.eventstore.api.EventStoreException;
import org.strata.eventstore.api.PartitionKeyStore;
import org.strata.eventstore.api.PendingPartitionChange;
import org.strata.eventstore.api.StreamRecord;
import org.strata.eventstore.api.StreamWithEvents;

import javax.sql.DataSource;
import java.sql.PreparedStatement;
import java.sql.Statement;
import java.sql.Types;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;
import static org.strata.eventstore.jdbc.RowMappers.EVENT_COLUMNS;
import static org.strata.eventstore.jdbc.RowMappers.timestamp;

/**
 * An {@link EventStore} backed by a relational database, accessed with Spring's {@link JdbcTemplate}. The tables are
 * defined in {@value JdbcEventStoreConfig#DEFAULT_SCHEMA_LOCATION} which works for both PostgreSQL and H2.
 * <p>
 * Writes join the surrounding Spring transaction if there is one, otherwise a new transaction is started for the write.
 * The commit order of appended events is assigned when that transaction commits, until then it's {@code null}.
 */
@NullMarked
public class JdbcEventStore implements EventStore, PartitionKeyStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcEventStore.class);

    // Position of an event's aggregate in the requested ids is appended per query
    private static final String LOAD_EVENTS_WITH_SNAPSHOT = "SELECT " + EVENT_COLUMNS + " FROM event_records e" +
            " WHERE e.aggregate_id IN (:aggregateIds) AND (" +
            " (e.is_snapshot = TRUE AND e.event_type = :snapshotEventType AND e.sequence_number = (" + latestSnapshotSequenceNumber() + "))" +
            " OR (e.is_snapshot = FALSE AND e.sequence_number >= COALESCE((" + latestSnapshotSequenceNumber() + "), 0)))" +
            " ORDER BY ";
    private static final String LOAD_EVENTS = "SELECT " + EVENT_COLUMNS + " FROM event_records e" +
            " WHERE e.aggregate_id IN (:aggregateIds) AND e.is_snapshot = FALSE ORDER BY ";
    private static final String STREAM_COLUMNS = "aggregate_id, aggregate_type, created_at, snapshot_threshold, partition_key";
    private static final int COMMIT_ORDER_SEQUENCE_ID = 1;

    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate namedJdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    public JdbcEventStore(DataSource dataSource, PlatformTransactionManager transactionManager) {
        this(dataSource, transactionManager, JdbcEventStoreConfig.defaultConfig());
    }

    public JdbcEventStore(DataSource dataSource, PlatformTransactionManager transactionManager, JdbcEventStoreConfig config) {
        requireNonNull(dataSource, DataSource.class.getSimpleName() + " cannot be null");
        requireNonNull(transactionManager, PlatformTransactionManager.class.getSimpleName() + " cannot be null");
        requireNonNull(config, JdbcEventStoreConfig.class.getSimpleName() + " cannot be null");
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.jdbcTemplate.setFetchSize(config.fetchSize);
        this.namedJdbcTemplate = new NamedParameterJdbcTemplate(jdbcTemplate);
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        if (config.initializeSchema) {
            initializeSchema(dataSource);
        }
    }

    /**
     * Create the event store tables if they don't exist.
     */
    public static void initializeSchema(DataSource dataSource) {
        log.info("Initializing event store schema from {}", JdbcEventStoreConfig.DEFAULT_SCHEMA_LOCATION);
        new ResourceDatabasePopulator(new ClassPathResource(JdbcEventStoreConfig.DEFAULT_SCHEMA_LOCATION)).execute(dataSource);
        JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
        Integer sequences = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM commit_order_sequence WHERE id = ?", Integer.class, COMMIT_ORDER_SEQUENCE_ID);
        if (sequences == null || sequences == 0) {
            jdbcTemplate.update("INSERT INTO commit_order_sequence (id, last_commit_order) VALUES (?, 0)", COMMIT_ORDER_SEQUENCE_ID);
        }
    }

    @Override
    public CommandRecord append(CommandRecord command, List<StreamWithEvents> streamsWithEvents) {
        requireNonNull(command, CommandRecord.class.getSimpleName() + " cannot be null");
        requireNonNull(streamsWithEvents, "Streams with events cannot be null");
        return transactionTemplate.execute(__ -> {
            long commandId = insertCommand(command);
            for (StreamWithEvents streamWithEvents : streamsWithEvents) {
                StreamRecord stream = upsertStream(streamWithEvents.stream());
                insertEvents(commandId, stream, streamWithEvents.events());
            }
            assignCommitOrderBeforeCommit(commandId);
            return command.withId(commandId);
        });
    }

    private long insertCommand(CommandRecord command) {
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement("INSERT INTO command_records" +
                    " (user_id, aggregate_id, command_type, command_json, causation_aggregate_id, causation_sequence_number, created_at)" +
                    " VALUES (?, ?, ?, ?, ?, ?, ?)", Statement.RETURN_GENERATED_KEYS);
            ps.setString(1, command.userId());
            ps.setString(2, command.aggregateId());
            ps.setString(3, command.commandType());
            ps.setString(4, command.commandJson());
            ps.setString(5, command.causationAggregateId());
            if (command.causationSequenceNumber() == null) {
                ps.setNull(6, Types.BIGINT);
            } else {
                ps.setLong(6, command.causationSequenceNumber());
            }
            ps.setObject(7, timestamp(command.createdAt()));
            return ps;
        }, keyHolder);
        Map<String, Object> keys = requireNonNull(keyHolder.getKeys(), "Generated command id cannot be null");
        // Key names are case-insensitive
        return ((Number) requireNonNull(keys.get("id"), "Generated command id cannot be null")).longValue();
    }

    private void assignCommitOrderBeforeCommit(long commandId) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            throw new EventStoreException("Events can only be appended in a transaction with transaction synchronization");
        }
        CommitOrderAssignment assignment = TransactionSynchronizationManager.getSynchronizations().stream()
                .filter(CommitOrderAssignment.class::isInstance)
                .map(CommitOrderAssignment.class::cast)
                .filter(candidate -> candidate.eventStore() == this)
                .findFirst()
                .orElseGet(() -> {
                    CommitOrderAssignment created = new CommitOrderAssignment();
                    TransactionSynchronizationManager.registerSynchronization(created);
                    return created;
                });
        assignment.commandIds.add(commandId);
    }

    private void assignCommitOrder(Collection<Long> commandIds) {
        List<Long> eventIds = namedJdbcTemplate.queryForList("SELECT id FROM event_records WHERE command_record_id IN (:commandIds) AND commit_order IS NULL ORDER BY id",
                Map.of("commandIds", List.copyOf(commandIds)), Long.class);
        if (eventIds.isEmpty()) {
            return;
        }
        // Locks the sequence row until the transaction has committed
        int locked = jdbcTemplate.update("UPDATE commit_order_sequence SET last_commit_order = last_commit_order + ? WHERE id = ?", eventIds.size(), COMMIT_ORDER_SEQUENCE_ID);
        if (locked == 0) {
            throw new EventStoreException("Table commit_order_sequence is not initialized, see " + JdbcEventStoreConfig.DEFAULT_SCHEMA_LOCATION);
        }
        long last = requireNonNull(jdbcTemplate.queryForObject("SELECT last_commit_order FROM commit_order_sequence WHERE id = ?", Long.class, COMMIT_ORDER_SEQUENCE_ID));
        long first = last - eventIds.size() + 1;
        SqlParameterSource[] batch = IntStream.range(0, eventIds.size())
                .mapToObj(i -> new MapSqlParameterSource().addValue("id", eventIds.get(i)).addValue("commitOrder", first + i))
                .toArray(SqlParameterSource[]::new);
        namedJdbcTemplate.batchUpdate("UPDATE event_records SET commit_order = :commitOrder WHERE id = :id", batch);
        log.trace("Assigned commit orders {}..{} to the events of commands {}", first, last, commandIds);
    }

    private StreamRecord upsertStream(StreamRecord stream) {
        Optional<StreamRecord> existing = findStream(stream.aggregateId());
        if (existing.isEmpty()) {
            try {
                namedJdbcTemplate.update("INSERT INTO stream_records (aggregate_id, aggregate_type, created_at, snapshot_threshold, partition_key)" +
                                " VALUES (:aggregateId, :aggregateType, :createdAt, :snapshotThreshold, :partitionKey)",
                        new MapSqlParameterSource()
                                .addValue("aggregateId", stream.aggregateId())
                                .addValue("aggregateType", stream.aggregateType())
                                .addValue("createdAt", timestamp(stream.createdAt()))
                                .addValue("snapshotThreshold", stream.snapshotThreshold(), Types.INTEGER)
                                .addValue("partitionKey", stream.partitionKey()));
            } catch (DuplicateKeyException e) {
                throw new ConcurrencyConflictException(stream.aggregateId(), 1, "Stream " + stream.aggregateId() + " was created concurrently.", e);
            }
            return stream;
        }

        StreamRecord current = existing.get();
        namedJdbcTemplate.update("UPDATE stream_records SET snapshot_threshold = :snapshotThreshold WHERE aggregate_id = :aggregateId",
                new MapSqlParameterSource()
                        .addValue("aggregateId", stream.aggregateId())
                        .addValue("snapshotThreshold", stream.snapshotThreshold(), Types.INTEGER));
        recordPartitionKeyChange(current, stream.partitionKey());
        return new StreamRecord(current.aggregateId(), current.aggregateType(), current.createdAt(), stream.snapshotThreshold(), current.partitionKey());
    }

    private void recordPartitionKeyChange(StreamRecord current, String requestedPartitionKey) {
        String aggregateId = current.aggregateId();
        Optional<PendingPartitionChange> pending = namedJdbcTemplate.query("SELECT aggregate_id, old_partition_key, new_partition_key FROM pending_partition_changes WHERE aggregate_id = :aggregateId",
                Map.of("aggregateId", aggregateId), RowMappers.PENDING_PARTITION_CHANGE).stream().findFirst();
        if (pending.isPresent() && pending.get().newPartitionKey().equals(requestedPartitionKey)) {
            return;
        }
        pending.ifPresent(this::deletePendingPartitionChange);
        if (!current.partitionKey().equals(requestedPartitionKey)) {
            log.debug("Recording partition key change of aggregate {} from '{}' to '{}'", aggregateId, current.partitionKey(), requestedPartitionKey);
            namedJdbcTemplate.update("INSERT INTO pending_partition_changes (aggregate_id, old_partition_key, new_partition_key) VALUES (:aggregateId, :oldPartitionKey, :newPartitionKey)",
                    Map.of("aggregateId", aggregateId, "oldPartitionKey", current.partitionKey(), "newPartitionKey", requestedPartitionKey));
        }
    }

    private void insertEvents(long commandId, StreamRecord stream, List<EventRecord> events) {
        if (events.isEmpty()) {
            return;
        }
        String aggregateId = stream.aggregateId();
        long currentSequenceNumber = requireNonNull(namedJdbcTemplate.queryForObject(
                "SELECT COALESCE(MAX(sequence_number), 0) FROM event_records WHERE aggregate_id = :aggregateId AND is_snapshot = FALSE",
                Map.of("aggregateId", aggregateId), Long.class));
        long firstSequenceNumber = events.get(0).sequenceNumber();
        if (firstSequenceNumber != currentSequenceNumber + 1) {
            throw new ConcurrencyConflictException(aggregateId, firstSequenceNumber,
                    String.format("Cannot append event with sequence number %d to aggregate %s, expected sequence number %d.", firstSequenceNumber, aggregateId, currentSequenceNumber + 1));
        }

        SqlParameterSource[] batch = events.stream()
                .map(event -> eventParameters(event, commandId, stream.partitionKey()))
                .toArray(SqlParameterSource[]::new);
        try {
            namedJdbcTemplate.batchUpdate("INSERT INTO event_records" +
                    " (aggregate_id, sequence_number, is_snapshot, event_type, event_json, created_at, command_record_id, partition_key)" +
                    " VALUES (:aggregateId, :sequenceNumber, :snapshot, :eventType, :eventJson, :createdAt, :commandId, :partitionKey)", batch);
        } catch (DuplicateKeyException e) {
            throw new ConcurrencyConflictException(aggregateId, firstSequenceNumber,
                    String.format("Sequence number %d of aggregate %s was claimed by another committer.", firstSequenceNumber, aggregateId), e);
        }
    }

    private static MapSqlParameterSource eventParameters(EventRecord event, @Nullable Long commandId, String partitionKey) {
        return new MapSqlParameterSource()
                .addValue("aggregateId", event.aggregateId())
                .addValue("sequenceNumber", event.sequenceNumber())
                .addValue("snapshot", commandId == null)
                .addValue("eventType", event.eventType())
                .addValue("eventJson", event.eventJson())
                .addValue("createdAt", timestamp(event.createdAt()))
                .addValue("commandId", commandId, Types.BIGINT)
                .addValue("partitionKey", partitionKey);
    }

    @Override
    public Stream<EventRecord> load(Collection<String> aggregateIds, String snapshotEventType, boolean useSnapshots) {
        requireNonNull(aggregateIds, "Aggregate ids cannot be null");
        requireNonNull(snapshotEventType, "Snapshot event type cannot be null");
        List<String> ids = List.copyOf(new LinkedHashSet<>(aggregateIds));
        if (ids.isEmpty()) {
            return Stream.empty();
        }
        MapSqlParameterSource parameters = new MapSqlParameterSource()
                .addValue("aggregateIds", ids)
                .addValue("snapshotEventType", snapshotEventType);
        StringBuilder sql = new StringBuilder(useSnapshots ? LOAD_EVENTS_WITH_SNAPSHOT : LOAD_EVENTS).append("CASE e.aggregate_id");
        for (int i = 0; i < ids.size(); i++) {
            sql.append(" WHEN :aggregateId").append(i).append(" THEN ").append(i);
            parameters.addValue("aggregateId" + i, ids.get(i));
        }
        sql.append(" END, e.sequence_number, e.is_snapshot DESC");
        return namedJdbcTemplate.queryForStream(sql.toString(), parameters, RowMappers.EVENT);
    }

    @Override
    public void createSnapshot(EventRecord snapshot) {
        requireNonNull(snapshot, "Snapshot cannot be null");
        String partitionKey = findStream(snapshot.aggregateId())
                .map(StreamRecord::partitionKey)
                .orElseThrow(() -> new EventStoreException("Cannot create snapshot for aggregate " + snapshot.aggregateId() + " since it has no stream"));
        try {
            namedJdbcTemplate.update("INSERT INTO event_records" +
                    " (aggregate_id, sequence_number, is_snapshot, event_type, event_json, created_at, command_record_id, partition_key)" +
                    " VALUES (:aggregateId, :sequenceNumber, :snapshot, :eventType, :eventJson, :createdAt, :commandId, :partitionKey)", eventParameters(snapshot, null, partitionKey));
        } catch (DuplicateKeyException e) {
            throw new ConcurrencyConflictException(snapshot.aggregateId(), snapshot.sequenceNumber(),
                    String.format("Snapshot with sequence number %d already exists for aggregate %s.", snapshot.sequenceNumber(), snapshot.aggregateId()), e);
        } catch (DataIntegrityViolationException e) {
            throw new EventStoreException("Failed to create snapshot for aggregate " + snapshot.aggregateId(), e);
        }
    }

    @Override
    public void deleteSnapshots(String aggregateId) {
        requireNonNull(aggregateId, "Aggregate id cannot be null");
        int deleted = namedJdbcTemplate.update("DELETE FROM event_records WHERE aggregate_id = :aggregateId AND is_snapshot = TRUE", Map.of("aggregateId", aggregateId));
        log.debug("Deleted {} snapshots of aggregate {}", deleted, aggregateId);
    }

    @Override
    public Optional<StreamRecord> findStream(String aggregateId) {
        requireNonNull(aggregateId, "Aggregate id cannot be null");
        return namedJdbcTemplate.query("SELECT " + STREAM_COLUMNS + " FROM stream_records WHERE aggregate_id = :aggregateId",
                Map.of("aggregateId", aggregateId), RowMappers.STREAM).stream().findFirst();
    }

    @Override
    public List<StreamRecord> findStreams(Collection<String> aggregateIds) {
        requireNonNull(aggregateIds, "Aggregate ids cannot be null");
        if (aggregateIds.isEmpty()) {
            return List.of();
        }
        return namedJdbcTemplate.query("SELECT " + STREAM_COLUMNS + " FROM stream_records WHERE aggregate_id IN (:aggregateIds) ORDER BY aggregate_id",
                Map.of("aggregateIds", List.copyOf(new LinkedHashSet<>(aggregateIds))), RowMappers.STREAM);
    }

    @Override
    public Optional<CommandRecord> findCommand(long commandId) {
        return namedJdbcTemplate.query("SELECT id, user_id, aggregate_id, command_type, command_json, causation_aggregate_id, causation_sequence_number, created_at" +
                " FROM command_records WHERE id = :id", Map.of("id", commandId), RowMappers.COMMAND).stream().findFirst();
    }

    @Override
    public Optional<EventRecord> loadEvent(String aggregateId, long sequenceNumber) {
        requireNonNull(aggregateId, "Aggregate id cannot be null");
        return namedJdbcTemplate.query("SELECT " + EVENT_COLUMNS + " FROM event_records e" +
                        " WHERE e.aggregate_id = :aggregateId AND e.sequence_number = :sequenceNumber AND e.is_snapshot = FALSE",
                Map.of("aggregateId", aggregateId, "sequenceNumber", sequenceNumber), RowMappers.EVENT).stream().findFirst();
    }

    @Override
    public List<EventRecord> readEventsAfter(long commitOrder, Collection<String> aggregateTypes, int limit) {
        requireNonNull(aggregateTypes, "Aggregate types cannot be null");
        MapSqlParameterSource parameters = new MapSqlParameterSource()
                .addValue("commitOrder", commitOrder)
                .addValue("limit", limit);
        StringBuilder sql = new StringBuilder("SELECT ").append(EVENT_COLUMNS)
                .append(" FROM event_records e JOIN stream_records s ON s.aggregate_id = e.aggregate_id")
                .append(" WHERE e.is_snapshot = FALSE AND e.commit_order > :commitOrder");
        if (!aggregateTypes.isEmpty()) {
            sql.append(" AND s.aggregate_type IN (:aggregateTypes)");
            parameters.addValue("aggregateTypes", List.copyOf(aggregateTypes));
        }
        sql.append(" ORDER BY e.commit_order LIMIT :limit");
        return namedJdbcTemplate.query(sql.toString(), parameters, RowMappers.EVENT);
    }

    @Override
    public long lastCommitOrder() {
        List<Long> last = jdbcTemplate.queryForList("SELECT last_commit_order FROM commit_order_sequence WHERE id = ?", Long.class, COMMIT_ORDER_SEQUENCE_ID);
        return last.isEmpty() ? 0 : last.get(0);
    }

    @Override
    public List<String> aggregatesThatNeedSnapshots(@Nullable String lastAggregateId, int limit) {
        MapSqlParameterSource parameters = new MapSqlParameterSource().addValue("limit", limit);
        StringBuilder sql = new StringBuilder("SELECT s.aggregate_id FROM stream_records s WHERE s.snapshot_threshold IS NOT NULL");
        if (lastAggregateId != null) {
            sql.append(" AND s.aggregate_id > :lastAggregateId");
            parameters.addValue("lastAggregateId", lastAggregateId);
        }
        sql.append(" AND (SELECT COUNT(*) FROM event_records e WHERE e.aggregate_id = s.aggregate_id AND e.is_snapshot = FALSE")
                .append(" AND e.sequence_number > COALESCE((SELECT MAX(x.sequence_number) FROM event_records x WHERE x.aggregate_id = s.aggregate_id AND x.is_snapshot = TRUE), 0))")
                .append(" >= s.snapshot_threshold")
                .append(" ORDER BY s.aggregate_id LIMIT :limit");
        return namedJdbcTemplate.queryForList(sql.toString(), parameters, String.class);
    }

    @Override
    public Optional<PendingPartitionChange> oldestPendingPartitionChange() {
        // Skips the change that another maintenance transaction is applying
        return jdbcTemplate.query("SELECT aggregate_id, old_partition_key, new_partition_key FROM pending_partition_changes ORDER BY id LIMIT 1 FOR UPDATE SKIP LOCKED",
                RowMappers.PENDING_PARTITION_CHANGE).stream().findFirst();
    }

    @Override
    public int repointEvents(PendingPartitionChange change) {
        requireNonNull(change, PendingPartitionChange.class.getSimpleName() + " cannot be null");
        Map<String, String> parameters = Map.of("aggregateId", change.aggregateId(), "newPartitionKey", change.newPartitionKey());
        return requireNonNull(transactionTemplate.execute(__ -> {
            namedJdbcTemplate.update("UPDATE stream_records SET partition_key = :newPartitionKey WHERE aggregate_id = :aggregateId AND partition_key <> :newPartitionKey", parameters);
            return namedJdbcTemplate.update("UPDATE event_records SET partition_key = :newPartitionKey WHERE aggregate_id = :aggregateId AND partition_key <> :newPartitionKey", parameters);
        }));
    }

    @Override
    public void deletePendingPartitionChange(PendingPartitionChange change) {
        requireNonNull(change, PendingPartitionChange.class.getSimpleName() + " cannot be null");
        namedJdbcTemplate.update("DELETE FROM pending_partition_changes WHERE aggregate_id = :aggregateId", Map.of("aggregateId", change.aggregateId()));
    }

    @Override
    public List<PendingPartitionChange> pendingPartitionChanges() {
        return jdbcTemplate.query("SELECT aggregate_id, old_partition_key, new_partition_key FROM pending_partition_changes ORDER BY id",
                RowMappers.PENDING_PARTITION_CHANGE);
    }

    private static String latestSnapshotSequenceNumber() {
        return "SELECT MAX(s.sequence_number) FROM event_records s WHERE s.aggregate_id = e.aggregate_id AND s.is_snapshot = TRUE AND s.event_type = :snapshotEventType";
    }

    /**
     * Assigns the commit order of the events appended in a transaction just before the transaction commits. The row lock
     * on {@code commit_order_sequence} is held until the commit, so events of a transaction that commits later always get
     * a higher commit order and a reader never sees a commit order before all lower ones are visible.
     */
    private class CommitOrderAssignment implements TransactionSynchronization {
        private final Set<Long> commandIds = new LinkedHashSet<>();

        private JdbcEventStore eventStore() {
            return JdbcEventStore.this;
        }

        @Override
        public void beforeCommit(boolean readOnly) {
            assignCommitOrder(commandIds);
        }
    }
}
