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

package org.strata.eventstore.inmemory;

import org.assertj.core.api.SoftAssertions;
import org.assertj.core.api.junit.jupiter.SoftAssertionsExtension;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.strata.eventstore.api.CommandRecord;
import org.strata.eventstore.api.ConcurrencyConflictException;
import org.strata.eventstore.api.EventRecord;
import org.strata.eventstore.api.PendingPartitionChange;
import org.strata.eventstore.api.StreamRecord;
import org.strata.eventstore.api.StreamWithEvents;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.LongStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.junit.jupiter.api.Assertions.assertAll;
import static org.strata.eventstore.api.EventStore.DEFAULT_SNAPSHOT_EVENT_TYPE;

@ExtendWith(SoftAssertionsExtension.class)
@DisplayNameGeneration(ReplaceUnderscores.class)
public class InMemoryEventStoreTest {

    private static final Instant NOW = Instant.parse("2024-01-01T10:00:00Z");

    @Test
    void append_assigns_command_id_commit_order_and_partition_key(SoftAssertions softly) {
        // Given
        InMemoryEventStore eventStore = new InMemoryEventStore();

        // When
        CommandRecord command = eventStore.append(stream("a1", null), command("a1"), events("a1", 1, 2));

        // Then
        List<EventRecord> loaded = eventStore.load("a1").toList();
        softly.assertThat(command.id()).isEqualTo(1L);
        softly.assertThat(loaded).extracting(EventRecord::sequenceNumber).containsExactly(1L, 2L);
        softly.assertThat(loaded).extracting(EventRecord::commandId).containsOnly(1L);
        softly.assertThat(loaded).extracting(EventRecord::commitOrder).containsExactly(1L, 2L);
        softly.assertThat(loaded).extracting(EventRecord::partitionKey).containsOnly(StreamRecord.DEFAULT_PARTITION_KEY);
        softly.assertThat(eventStore.findCommand(1)).contains(command);
        softly.assertThat(eventStore.streamExists("a1")).isTrue();
    }

    @Test
    void invokes_listener_after_events_have_been_appended() {
        // Given
        CopyOnWriteArrayList<EventRecord> appended = new CopyOnWriteArrayList<>();
        InMemoryEventStore eventStore = new InMemoryEventStore(appended::addAll);

        // When
        eventStore.append(stream("a1", null), command("a1"), events("a1", 1, 3));

        // Then
        assertThat(appended).extracting(EventRecord::sequenceNumber).containsExactly(1L, 2L, 3L);
    }

    @Nested
    @DisplayName("concurrency conflicts")
    class ConcurrencyConflicts {

        @Test
        void throws_concurrency_conflict_when_sequence_number_is_already_taken() {
            // Given
            InMemoryEventStore eventStore = new InMemoryEventStore();
            eventStore.append(stream("a1", null), command("a1"), events("a1", 1, 2));

            // When
            Throwable throwable = catchThrowable(() -> eventStore.append(stream("a1", null), command("a1"), events("a1", 2, 3)));

            // Then
            assertAll(
                    () -> assertThat(throwable).isExactlyInstanceOf(ConcurrencyConflictException.class),
                    () -> assertThat(((ConcurrencyConflictException) throwable).aggregateId).isEqualTo("a1"),
                    () -> assertThat(eventStore.load("a1")).hasSize(2)
            );
        }

        @Test
        void nothing_is_written_when_one_of_the_streams_conflicts() {
            // Given
            InMemoryEventStore eventStore = new InMemoryEventStore();
            eventStore.append(stream("a2", null), command("a2"), events("a2", 1, 1));

            // When
            Throwable throwable = catchThrowable(() -> eventStore.append(command("a1"), List.of(
                    new StreamWithEvents(stream("a1", null), events("a1", 1, 1)),
                    new StreamWithEvents(stream("a2", null), events("a2", 1, 1)))));

            // Then
            assertAll(
                    () -> assertThat(throwable).isExactlyInstanceOf(ConcurrencyConflictException.class),
                    () -> assertThat(eventStore.streamExists("a1")).isFalse(),
                    () -> assertThat(eventStore.findCommand(2)).isEmpty()
            );
        }

        @Test
        void gaps_in_sequence_numbers_are_rejected() {
            // Given
            InMemoryEventStore eventStore = new InMemoryEventStore();

            // When
            Throwable throwable = catchThrowable(() -> eventStore.append(stream("a1", null), command("a1"), events("a1", 2, 3)));

            // Then
            assertThat(throwable).isExactlyInstanceOf(ConcurrencyConflictException.class);
        }
    }

    @Nested
    @DisplayName("snapshots")
    class Snapshots {

        @Test
        void load_returns_latest_snapshot_followed_by_events_from_the_snapshot_sequence_number() {
            // Given
            InMemoryEventStore eventStore = new InMemoryEventStore();
            eventStore.append(stream("a1", 3), command("a1"), events("a1", 1, 7));
            eventStore.createSnapshot(snapshot("a1", 3));
            eventStore.createSnapshot(snapshot("a1", 5));

            // When
            List<EventRecord> loaded = eventStore.load("a1").toList();

            // Then
            assertAll(
                    () -> assertThat(loaded).extracting(EventRecord::eventType).containsExactly(DEFAULT_SNAPSHOT_EVENT_TYPE, "Deposited", "Deposited", "Deposited"),
                    () -> assertThat(loaded).extracting(EventRecord::sequenceNumber).containsExactly(5L, 5L, 6L, 7L)
            );
        }

        @Test
        void load_ignores_snapshots_when_told_to() {
            // Given
            InMemoryEventStore eventStore = new InMemoryEventStore();
            eventStore.append(stream("a1", 3), command("a1"), events("a1", 1, 4));
            eventStore.createSnapshot(snapshot("a1", 3));

            // When
            List<EventRecord> loaded = eventStore.load("a1", DEFAULT_SNAPSHOT_EVENT_TYPE, false).toList();

            // Then
            assertThat(loaded).extracting(EventRecord::sequenceNumber).containsExactly(1L, 2L, 3L, 4L);
        }

        @Test
        void batched_load_emits_aggregates_in_input_order() {
            // Given
            InMemoryEventStore eventStore = new InMemoryEventStore();
            eventStore.append(stream("a1", null), command("a1"), events("a1", 1, 2));
            eventStore.append(stream("a2", null), command("a2"), events("a2", 1, 1));

            // When
            List<EventRecord> loaded = eventStore.load(List.of("a2", "a1"), DEFAULT_SNAPSHOT_EVENT_TYPE, true).toList();

            // Then
            assertThat(loaded).extracting(e -> e.aggregateId() + ":" + e.sequenceNumber()).containsExactly("a2:1", "a1:1", "a1:2");
        }

        @Test
        void deleting_snapshots_keeps_events() {
            // Given
            InMemoryEventStore eventStore = new InMemoryEventStore();
            eventStore.append(stream("a1", 2), command("a1"), events("a1", 1, 3));
            eventStore.createSnapshot(snapshot("a1", 2));

            // When
            eventStore.deleteSnapshots("a1");

            // Then
            assertThat(eventStore.load("a1")).extracting(EventRecord::sequenceNumber).containsExactly(1L, 2L, 3L);
        }

        @Test
        void finds_aggregates_whose_events_since_latest_snapshot_reach_the_threshold() {
            // Given
            InMemoryEventStore eventStore = new InMemoryEventStore();
            eventStore.append(stream("a1", 3), command("a1"), events("a1", 1, 4));
            eventStore.append(stream("a2", 3), command("a2"), events("a2", 1, 2));
            eventStore.append(stream("a3", null), command("a3"), events("a3", 1, 5));
            eventStore.append(stream("a4", 2), command("a4"), events("a4", 1, 3));
            eventStore.createSnapshot(snapshot("a4", 2));

            // When
            List<String> aggregateIds = eventStore.aggregatesThatNeedSnapshots(null, 10);

            // Then
            assertThat(aggregateIds).containsExactly("a1");
        }
    }

    @Test
    void read_events_after_returns_events_in_commit_order_filtered_by_aggregate_type() {
        // Given
        InMemoryEventStore eventStore = new InMemoryEventStore();
        eventStore.append(stream("a1", null), command("a1"), events("a1", 1, 1));
        eventStore.append(new StreamRecord("o1", "Other", NOW, null), command("o1"), events("o1", 1, 1));
        eventStore.append(stream("a1", null), command("a1"), events("a1", 2, 2));

        // When
        List<EventRecord> events = eventStore.readEventsAfter(1, List.of("BankAccount"), 10);

        // Then
        assertThat(events).extracting(EventRecord::aggregateId, EventRecord::commitOrder).containsExactly(org.assertj.core.groups.Tuple.tuple("a1", 3L));
    }

    @Nested
    @DisplayName("partition keys")
    class PartitionKeys {

        @Test
        void changing_partition_key_records_pending_change_and_keeps_current_key_until_repointed() {
            // Given
            InMemoryEventStore eventStore = new InMemoryEventStore();
            eventStore.append(stream("a1", null).withPartitionKey("p1"), command("a1"), events("a1", 1, 1));

            // When
            eventStore.append(stream("a1", null).withPartitionKey("p2"), command("a1"), events("a1", 2, 2));

            // Then
            assertAll(
                    () -> assertThat(eventStore.pendingPartitionChanges()).containsExactly(new PendingPartitionChange("a1", "p1", "p2")),
                    () -> assertThat(eventStore.load("a1")).extracting(EventRecord::partitionKey).containsOnly("p1")
            );
        }

        @Test
        void repoint_events_moves_stream_and_events_to_new_key() {
            // Given
            InMemoryEventStore eventStore = new InMemoryEventStore();
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
                    () -> assertThat(eventStore.oldestPendingPartitionChange()).isEmpty()
            );
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
