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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.transaction.support.TransactionTemplate;
import org.strata.eventstore.api.CommandRecord;
import org.strata.eventstore.api.ConcurrencyConflictException;
import org.strata.eventstore.api.EventRecord;
import org.strata.eventstore.api.EventStoreException;
import org.strata.eventstore.api.PendingPartitionChange;
import org.strata.eventstore.api.StreamRecord;
import org.strata.eventstore.api.StreamWithEvents;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.LongStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.assertj.core.api.Assertions.tuple;
import static org.junit.jupiter.api.Assertions.assertAll;
import static org.strata.eventstore.api.EventStore.DEFAULT_SNAPSHOT_EVENT_TYPE;

@DisplayNameGeneration(ReplaceUnderscores.class)
public class JdbcEventStoreTest {

    private static final Instant NOW = Instant.parse("2024-01-01T10:00:00Z");

    private DriverManagerDataSource dataSource;
    private DataSourceTransactionManager transactionManager;
    private JdbcEventStore eventStore;

    @BeforeEach
    void create_event_store() {
        // Simple H2 in-memory DB, one per test
        dataSource = new DriverManagerDataSource("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1", "sa", "");
        transactionManager = new DataSourceTransactionManager(dataSource);
        eventStore = new JdbcEventStore(dataSource, transactionManager, JdbcEventStoreConfig.defaultConfig().initializeSchema(true));
    }

    @AfterEach
    void shutdown_database() {
        new JdbcTemplate(dataSource).execute("SHUTDOWN");
    }

    @Test
    void append_stores_command_stream_and_events() {
        // When
        CommandRecord command = eventStore.append(stream("a1", null), command("a1"), events("a1", 1, 2));

        // Then
        List<EventRecord> loaded = eventStore.load("a1").toList();
        assertAll(
                () -> assertThat(command.id()).isNotNull(),
                () -> assertThat(eventStore.findCommand(command.id())).contains(command),
                () -> assertThat(eventStore.findStream("a1")).contains(stream("a1", null)),
                () -> assertThat(loaded).extracting(EventRecord::sequenceNumber, EventRecord::eventJson).containsExactly(tuple(1L, "{\"amount\":1}"), tuple(2L, "{\"amount\":2}")),
                () -> assertThat(loaded).extracting(EventRecord::commandId).containsOnly(command.id()),
                () -> assertThat(loaded).extracting(EventRecord::createdAt).containsOnly(NOW),
                () -> assertThat(eventStore.loadEvent("a1", 2)).hasValueSatisfying(e -> assertThat(e.sequenceNumber()).isEqualTo(2L)),
                () -> assertThat(eventStore.loadEvent("a1", 3)).isEmpty()
        );
    }

    @Test
    void append_updates_snapshot_threshold_of_existing_stream() {
        // Given
        eventStore.append(stream("a1", null), command("a1"), events("a1", 1, 1));

        // When
        eventStore.append(stream("a1", 10), command("a1"), events("a1", 2, 2));

        // Then
        assertThat(eventStore.findStream("a1")).hasValueSatisfying(stream -> assertThat(stream.snapshotThreshold()).isEqualTo(10));
    }

    @Test
    void commit_order_orders_events_across_aggregates() {
        // Given
        eventStore.append(stream("a1", null), command("a1"), events("a1", 1, 1));
        eventStore.append(new StreamRecord("o1", "Other", NOW, null), command("o1"), events("o1", 1, 1));
        eventStore.append(stream("a2", null), command("a2"), events("a2", 1, 1));
        eventStore.append(stream("a1", null), command("a1"), events("a1", 2, 2));

        // When
        List<EventRecord> all = eventStore.readEventsAfter(0, List.of(), 100);
        List<EventRecord> bankAccounts = eventStore.readEventsAfter(all.get(0).commitOrder(), List.of("BankAccount"), 100);

        // Then
        assertAll(
                () -> assertThat(all).extracting(e -> e.aggregateId() + ":" + e.sequenceNumber()).containsExactly("a1:1", "o1:1", "a2:1", "a1:2"),
                () -> assertThat(bankAccounts).extracting(e -> e.aggregateId() + ":" + e.sequenceNumber()).containsExactly("a2:1", "a1:2")
        );
    }

    @Test
    void commit_order_follows_the_commit_of_overlapping_transactions() throws Exception {
        // Given
        CountDownLatch appended = new CountDownLatch(1);
        CountDownLatch commit = new CountDownLatch(1);
        TransactionTemplate transactionTemplate = new TransactionTemplate(transactionManager);
        CompletableFuture<Void> slowWriter = CompletableFuture.runAsync(() -> transactionTemplate.executeWithoutResult(__ -> {
            eventStore.append(stream("a1", null), command("a1"), events("a1", 1, 1));
            appended.countDown();
            await(commit);
        }));
        await(appended);
        eventStore.append(stream("a2", null), command("a2"), events("a2", 1, 1));

        // When
        List<EventRecord> beforeSlowCommit = eventStore.readEventsAfter(0, List.of(), 100);
        commit.countDown();
        slowWriter.get(10, TimeUnit.SECONDS);
        List<EventRecord> afterSlowCommit = eventStore.readEventsAfter(beforeSlowCommit.get(beforeSlowCommit.size() - 1).commitOrder(), List.of(), 100);

        // Then
        assertAll(
                () -> assertThat(beforeSlowCommit).extracting(EventRecord::aggregateId, EventRecord::commitOrder).containsExactly(tuple("a2", 1L)),
                () -> assertThat(afterSlowCommit).extracting(EventRecord::aggregateId, EventRecord::commitOrder).containsExactly(tuple("a1", 2L)),
                () -> assertThat(eventStore.lastCommitOrder()).isEqualTo(2L)
        );
    }

    @Test
    void events_have_no_commit_order_until_their_transaction_commits() {
        // Given
        TransactionTemplate transactionTemplate = new TransactionTemplate(transactionManager);

        // When
        List<EventRecord> inTransaction = transactionTemplate.execute(__ -> {
            eventStore.append(stream("a1", null), command("a1"), events("a1", 1, 2));
            return eventStore.load("a1").toList();
        });

        // Then
        assertAll(
                () -> assertThat(inTransaction).extracting(EventRecord::commitOrder).containsOnlyNulls(),
                () -> assertThat(eventStore.load("a1")).extracting(EventRecord::commitOrder).containsExactly(1L, 2L)
        );
    }

    @Test
    void find_streams_returns_the_streams_that_exist() {
        // Given
        eventStore.append(stream("a1", null), command("a1"), events("a1", 1, 1));
        eventStore.append(stream("a2", 5), command("a2"), events("a2", 1, 1));

        // When
        List<StreamRecord> streams = eventStore.findStreams(List.of("a2", "unknown", "a1"));

        // Then
        assertThat(streams).containsExactlyInAnyOrder(stream("a1", null), stream("a2", 5));
    }

    @Nested
    @DisplayName("optimistic concurrency")
    class OptimisticConcurrency {

        @Test
        void the_losing_writer_receives_a_concurrency_conflict_and_succeeds_after_reload() {
            // Given
            eventStore.append(stream("a1", null), command("a1"), events("a1", 1, 1));
            long nextSequenceNumberSeenByBoth = eventStore.load("a1").count() + 1;
            eventStore.append(stream("a1", null), command("a1"), events("a1", nextSequenceNumberSeenByBoth, nextSequenceNumberSeenByBoth));

            // When
            Throwable throwable = catchThrowable(() -> eventStore.append(stream("a1", null), command("a1"), events("a1", nextSequenceNumberSeenByBoth, nextSequenceNumberSeenByBoth)));
            long reloadedNextSequenceNumber = eventStore.load("a1").count() + 1;
            eventStore.append(stream("a1", null), command("a1"), events("a1", reloadedNextSequenceNumber, reloadedNextSequenceNumber));

            // Then
            assertAll(
                    () -> assertThat(throwable).isExactlyInstanceOf(ConcurrencyConflictException.class),
                    () -> assertThat(eventStore.load("a1")).extracting(EventRecord::sequenceNumber).containsExactly(1L, 2L, 3L)
            );
        }

        @Test
        void the_command_is_rolled_back_when_a_stream_conflicts() {
            // Given
            eventStore.append(stream("a2", null), command("a2"), events("a2", 1, 1));
            Integer commandsBefore = new JdbcTemplate(dataSource).queryForObject("SELECT COUNT(*) FROM command_records", Integer.class);

            // When
            Throwable throwable = catchThrowable(() -> eventStore.append(command("a1"), List.of(
                    new StreamWithEvents(stream("a1", null), events("a1", 1, 1)),
                    new StreamWithEvents(stream("a2", null), events("a2", 1, 1)))));

            // Then
            assertAll(
                    () -> assertThat(throwable).isExactlyInstanceOf(ConcurrencyConflictException.class),
                    () -> assertThat(eventStore.streamExists("a1")).isFalse(),
                    () -> assertThat(new JdbcTemplate(dataSource).queryForObject("SELECT COUNT(*) FROM command_records", Integer.class)).isEqualTo(commandsBefore)
            );
        }

        @Test
        void append_joins_the_surrounding_transaction() {
            // Given
            TransactionTemplate transactionTemplate = new TransactionTemplate(transactionManager);

            // When
            catchThrowable(() -> transactionTemplate.executeWithoutResult(__ -> {
                eventStore.append(stream("a1", null), command("a1"), events("a1", 1, 1));
                throw new IllegalStateException("rollback");
            }));

            // Then
            assertThat(eventStore.streamExists("a1")).isFalse();
        }
    }

    @Nested
    @DisplayName("snapshots")
    class Snapshots {

        @Test
        void load_returns_latest_snapshot_followed_by_events_from_the_snapshot_sequence_number() {
            // Given
            eventStore.append(stream("a1", 3), command("a1"), events("a1", 1, 7));
            eventStore.createSnapshot(snapshot("a1", 3));
            eventStore.createSnapshot(snapshot("a1", 5));

            // When
            List<EventRecord> loaded = eventStore.load("a1").toList();

            // Then
            assertAll(
                    () -> assertThat(loaded).extracting(EventRecord::eventType).containsExactly(DEFAULT_SNAPSHOT_EVENT_TYPE, "Deposited", "Deposited", "Deposited"),
                    () -> assertThat(loaded).extracting(EventRecord::sequenceNumber).containsExactly(5L, 5L, 6L, 7L),
                    () -> assertThat(loaded.get(0).commandId()).isNull()
            );
        }

        @Test
        void load_without_snapshots_returns_the_full_history() {
            // Given
            eventStore.append(stream("a1", 3), command("a1"), events("a1", 1, 4));
            eventStore.createSnapshot(snapshot("a1", 3));

            // When
            List<EventRecord> loaded = eventStore.load("a1", DEFAULT_SNAPSHOT_EVENT_TYPE, false).toList();

            // Then
            assertThat(loaded).extracting(EventRecord::sequenceNumber).containsExactly(1L, 2L, 3L, 4L);
        }

        @Test
        void batched_load_emits_each_aggregate_in_input_order() {
            // Given
            eventStore.append(stream("a1", 2), command("a1"), events("a1", 1, 3));
            eventStore.append(stream("a2", null), command("a2"), events("a2", 1, 2));
            eventStore.createSnapshot(snapshot("a1", 2));

            // When
            List<EventRecord> loaded = eventStore.load(List.of("a2", "unknown", "a1", "a2"), DEFAULT_SNAPSHOT_EVENT_TYPE, true).toList();

            // Then
            assertThat(loaded).extracting(e -> e.aggregateId() + ":" + e.eventType() + ":" + e.sequenceNumber())
                    .containsExactly("a2:Deposited:1", "a2:Deposited:2", "a1:SnapshotEvent:2", "a1:Deposited:2", "a1:Deposited:3");
        }

        @Test
        void creating_the_same_snapshot_twice_is_a_concurrency_conflict() {
            // Given
            eventStore.append(stream("a1", 2), command("a1"), events("a1", 1, 2));
            eventStore.createSnapshot(snapshot("a1", 2));

            // When
            Throwable throwable = catchThrowable(() -> eventStore.createSnapshot(snapshot("a1", 2)));

            // Then
            assertThat(throwable).isExactlyInstanceOf(ConcurrencyConflictException.class);
        }

        @Test
        void snapshot_of_unknown_aggregate_is_rejected() {
            // When
            Throwable throwable = catchThrowable(() -> eventStore.createSnapshot(snapshot("unknown", 1)));

            // Then
            assertThat(throwable).isExactlyInstanceOf(EventStoreException.class);
        }

        @Test
        void deleting_snapshots_never_deletes_events() {
            // Given
            eventStore.append(stream("a1", 2), command("a1"), events("a1", 1, 3));
            eventStore.createSnapshot(snapshot("a1", 2));

            // When
            eventStore.deleteSnapshots("a1");

            // Then
            assertThat(eventStore.load("a1")).extracting(EventRecord::sequenceNumber).containsExactly(1L, 2L, 3L);
        }

        @Test
        void finds_aggregates_that_need_snapshots_after_the_last_aggregate_id() {
            // Given
            eventStore.append(stream("a1", 3), command("a1"), events("a1", 1, 4));
            eventStore.append(stream("a2", 3), command("a2"), events("a2", 1, 2));
            eventStore.append(stream("a3", null), command("a3"), events("a3", 1, 5));
            eventStore.append(stream("a4", 2), command("a4"), events("a4", 1, 3));
            eventStore.append(stream("a5", 2), command("a5"), events("a5", 1, 2));
            eventStore.createSnapshot(snapshot("a4", 2));

            // When
            List<String> first = eventStore.aggregatesThatNeedSnapshots(null, 1);
            List<String> next = eventStore.aggregatesThatNeedSnapshots(first.get(0), 10);

            // Then
            assertAll(
                    () -> assertThat(first).containsExactly("a1"),
                    () -> assertThat(next).containsExactly("a5")
            );
        }
    }

    @Nested
    @DisplayName("partition keys")
    class PartitionKeys {

        @Test
        void changing_partition_key_records_a_pending_change() {
            // Given
            eventStore.append(stream("a1", null).withPartitionKey("p1"), command("a1"), events("a1", 1, 1));
            eventStore.append(stream("a2", null).withPartitionKey("p1"), command("a2"), events("a2", 1, 1));

            // When
            eventStore.append(stream("a2", null).withPartitionKey("p2"), command("a2"), events("a2", 2, 2));
            eventStore.append(stream("a1", null).withPartitionKey("p3"), command("a1"), events("a1", 2, 2));

            // Then
            assertAll(
                    () -> assertThat(eventStore.pendingPartitionChanges()).containsExactly(new PendingPartitionChange("a2", "p1", "p2"), new PendingPartitionChange("a1", "p1", "p3")),
                    () -> assertThat(eventStore.oldestPendingPartitionChange()).contains(new PendingPartitionChange("a2", "p1", "p2")),
                    () -> assertThat(eventStore.load("a2")).extracting(EventRecord::partitionKey).containsOnly("p1")
            );
        }

        @Test
        void reverting_the_partition_key_removes_the_pending_change() {
            // Given
            eventStore.append(stream("a1", null).withPartitionKey("p1"), command("a1"), events("a1", 1, 1));
            eventStore.append(stream("a1", null).withPartitionKey("p2"), command("a1"), events("a1", 2, 2));

            // When
            eventStore.append(stream("a1", null).withPartitionKey("p1"), command("a1"), events("a1", 3, 3));

            // Then
            assertThat(eventStore.pendingPartitionChanges()).isEmpty();
        }

        @Test
        void repoint_events_moves_the_stream_and_its_events_to_the_new_key() {
            // Given
            eventStore.append(stream("a1", null).withPartitionKey("p1"), command("a1"), events("a1", 1, 2));
            eventStore.append(stream("a1", null).withPartitionKey("p2"), command("a1"), events("a1", 3, 3));
            PendingPartitionChange change = eventStore.oldestPendingPartitionChange().orElseThrow();

            // When
            int repointed = eventStore.repointEvents(change);
            eventStore.deletePendingPartitionChange(change);

            // Then
            assertAll(
                    () -> assertThat(repointed).isEqualTo(3),
                    () -> assertThat(eventStore.findStream("a1")).hasValueSatisfying(s -> assertThat(s.partitionKey()).isEqualTo("p2")),
                    () -> assertThat(eventStore.load("a1")).extracting(EventRecord::partitionKey).containsOnly("p2"),
                    () -> assertThat(eventStore.pendingPartitionChanges()).isEmpty()
            );
        }
    }

    private static void await(CountDownLatch latch) {
        try {
            assertThat(latch.await(10, TimeUnit.SECONDS)).isTrue();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    private static StreamRecord stream(String aggregateId, Integer snapshotThreshold) {
        return new StreamRecord(aggregateId, "BankAccount", NOW, snapshotThreshold);
    }

    private static CommandRecord command(String aggregateId) {
        return new CommandRecord(null, "user", aggregateId, "Deposit", "{}", null, null, NOW);
    }

    private static List<EventRecord> events(String aggregateId, long from, long toInclusive) {
        return LongStream.rangeClosed(from, toInclusive)
                .mapToObj(sequenceNumber -> EventRecord.uncommitted(aggregateId, sequenceNumber, "Deposited", "{\"amount\":" + sequenceNumber + "}", NOW))
                .toList();
    }

    private static EventRecord snapshot(String aggregateId, long sequenceNumber) {
        return EventRecord.uncommitted(aggregateId, sequenceNumber, DEFAULT_SNAPSHOT_EVENT_TYPE, "{\"balance\":" + sequenceNumber + "}", NOW);
    }
}
