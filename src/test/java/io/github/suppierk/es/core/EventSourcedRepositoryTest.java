package io.github.suppierk.es.core;

import static io.github.suppierk.test.Counters.COUNTER;
import static io.github.suppierk.test.Counters.INCREMENTED;
import static io.github.suppierk.test.Counters.count;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.es.async.CommitListener;
import io.github.suppierk.test.Counters.IncrementCounter;
import io.github.suppierk.test.Counters.IncrementCounterHandler;
import io.github.suppierk.test.RecordingEventLog;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class EventSourcedRepositoryTest {
  RecordingEventLog eventLog;
  List<List<DomainEvent>> notifications;
  EventSourcedRepository repository;

  @BeforeEach
  void setUp() {
    eventLog = new RecordingEventLog();
    notifications = new ArrayList<>();
    repository =
        EventSourcedRepository.builder(eventLog)
            .register(COUNTER)
            .commitListener((aggregate, committedEvents) -> notifications.add(committedEvents))
            .build();
  }

  @Nested
  class Construction {
    @Test
    void when_any_of_the_builder_arguments_is_null_illegal_argument_must_be_thrown() {
      assertThrows(IllegalArgumentException.class, () -> EventSourcedRepository.builder(null));

      final var builder = EventSourcedRepository.builder(eventLog);
      assertThrows(IllegalArgumentException.class, () -> builder.register(null));
      assertThrows(IllegalArgumentException.class, () -> builder.registerAll(null));
      assertThrows(IllegalArgumentException.class, () -> builder.commitListener(null));
    }

    @Test
    void when_registering_existing_type_name_illegal_state_must_be_thrown() {
      final var builder = EventSourcedRepository.builder(eventLog).register(COUNTER);
      final var lookalike = AggregateType.builder("counter").identifiedBy("name").build();

      assertThrows(IllegalStateException.class, () -> builder.register(COUNTER));
      assertThrows(IllegalStateException.class, () -> builder.register(lookalike));
    }

    @Test
    void registered_types_must_be_exposed() {
      final var user = AggregateType.builder("user").identifiedBy("email").build();
      final var built =
          EventSourcedRepository.builder(eventLog).registerAll(List.of(COUNTER, user)).build();

      assertEquals(Set.of("counter", "user"), built.getSupportedAggregateTypes());
    }
  }

  @Nested
  class Fetching {
    @Test
    void fresh_stream_must_yield_new_aggregate() {
      final var counter = repository.fetchLatest(COUNTER.id("c1"));

      assertTrue(counter.isNew());
      assertEquals(COUNTER.empty("c1"), counter);
      assertEquals(1, eventLog.reads.get());
    }

    @Test
    void committed_events_must_be_folded_in_order() {
      final var live =
          COUNTER.empty("c1").apply(INCREMENTED, Map.of()).apply(INCREMENTED, Map.of());
      assertTrue(repository.commit(live).isOk());

      final var fetched = COUNTER.fetch(repository, "c1");

      assertEquals(1L, fetched.version());
      assertEquals(live.state(), fetched.state());
      assertTrue(fetched.pending().isEmpty());
    }

    @Test
    void held_aggregate_must_be_caught_up_from_its_version() {
      final var held =
          repository.commit(COUNTER.empty("c1").apply(INCREMENTED, Map.of())).aggregate();
      final var concurrent = repository.fetchLatest(COUNTER.id("c1"));
      repository.commit(concurrent.apply(INCREMENTED, Map.of()).apply(INCREMENTED, Map.of()));

      final var refreshed = repository.fetchLatest(held);

      assertEquals(2L, refreshed.version());
      assertEquals(3, count(refreshed));
    }

    @Test
    void held_aggregate_with_pending_events_must_be_refused() {
      final var pending = COUNTER.empty("c1").apply(INCREMENTED, Map.of());
      assertThrows(IllegalArgumentException.class, () -> repository.fetchLatest(pending));
    }

    @Test
    void when_type_is_not_registered_illegal_argument_must_be_thrown() {
      final var foreign = AggregateId.of("user", Map.of("email", "a@b.com"));

      assertThrows(IllegalArgumentException.class, () -> repository.fetchLatest(foreign));
      assertThrows(IllegalArgumentException.class, () -> repository.fetchLatest((AggregateId) null));
      assertThrows(IllegalArgumentException.class, () -> repository.fetchLatest((Aggregate) null));
      assertEquals(0, eventLog.reads.get());
    }

    @Test
    void when_log_returns_a_gap_illegal_state_must_be_thrown() {
      final var event = COUNTER.empty("c1").newEvent(INCREMENTED, Map.of());
      final var gappy =
          new EventLog() {
            @Override
            public List<CommittedEvent> read(AggregateId id, long sinceVersion) {
              return List.of(new CommittedEvent(0, event), new CommittedEvent(2, event));
            }

            @Override
            public AppendOutcome appendConditional(
                AggregateId id, long expectedVersion, List<DomainEvent> events) {
              return AppendOutcome.CONFLICT;
            }
          };
      final var gappyRepository = EventSourcedRepository.builder(gappy).register(COUNTER).build();

      assertThrows(IllegalStateException.class, () -> gappyRepository.fetchLatest(COUNTER.id("c1")));
    }

    @Test
    void when_log_fails_the_exception_must_propagate_unchanged() {
      final var unavailable = new IllegalStateException("Log is down");
      eventLog.failure.set(unavailable);

      final var thrown =
          assertThrows(
              IllegalStateException.class, () -> repository.fetchLatest(COUNTER.id("c1")));
      assertSame(unavailable, thrown);
    }
  }

  @Nested
  class Committing {
    @Test
    void commit_without_pending_events_must_not_contact_the_log() {
      final var counter = COUNTER.empty("c1");

      final var result = repository.commit(counter);

      final var ok = assertInstanceOf(Result.Ok.class, result);
      assertTrue(ok.committedEvents().isEmpty());
      assertSame(counter, ok.aggregate());
      assertEquals(0, eventLog.appends.get());
      assertTrue(notifications.isEmpty());
    }

    @Test
    void successful_commit_must_advance_version_by_committed_count() {
      final var first =
          repository.commit(
              COUNTER.empty("c1").apply(INCREMENTED, Map.of()).apply(INCREMENTED, Map.of()));
      final var firstOk = assertInstanceOf(Result.Ok.class, first);

      assertEquals(1L, firstOk.aggregate().version());
      assertEquals(2, firstOk.committedEvents().size());
      assertFalse(firstOk.aggregate().hasPending());

      var next = firstOk.aggregate();
      for (int i = 0; i < 3; i++) {
        next = next.apply(INCREMENTED, Map.of());
      }

      final var second = assertInstanceOf(Result.Ok.class, repository.commit(next));

      assertEquals(4L, second.aggregate().version());
      assertEquals(5, count(second.aggregate()));
      assertEquals(5L, eventLog.delegate.length(COUNTER.id("c1")));
    }

    @Test
    void stale_aggregate_must_yield_conflict_and_leave_log_untouched() {
      final var first = repository.fetchLatest(COUNTER.id("c1")).apply(INCREMENTED, Map.of());
      final var second = repository.fetchLatest(COUNTER.id("c1")).apply(INCREMENTED, Map.of());

      assertTrue(repository.commit(first).isOk());
      final var result = repository.commit(second);

      final var conflict = assertInstanceOf(Result.Conflict.class, result);
      assertSame(second, conflict.aggregate());
      assertEquals(1L, eventLog.delegate.length(COUNTER.id("c1")));
      assertEquals(1, notifications.size());
    }

    @Test
    void listener_must_receive_committed_events() {
      final var counter = COUNTER.empty("c1").apply(INCREMENTED, Map.of());

      repository.commit(counter);

      assertEquals(List.of(counter.pending()), notifications);
    }

    @Test
    void when_listener_fails_commit_must_still_be_ok() {
      final CommitListener failing =
          (aggregate, committedEvents) -> {
            throw new IllegalStateException("Projection is down");
          };
      final var failingRepository =
          EventSourcedRepository.builder(eventLog).register(COUNTER).commitListener(failing).build();
      final var counter = COUNTER.empty("c1").apply(INCREMENTED, Map.of());

      final var result = assertDoesNotThrow(() -> failingRepository.commit(counter));

      final var ok = assertInstanceOf(Result.Ok.class, result);
      assertEquals(counter.pending(), ok.committedEvents());
      assertEquals(0L, ok.aggregate().version());
      assertEquals(1L, eventLog.delegate.length(COUNTER.id("c1")));
    }

    @Test
    void when_listener_fails_command_must_be_applied_once() {
      final CommitListener failing =
          (aggregate, committedEvents) -> {
            throw new IllegalStateException("Projection is down");
          };
      final var failingRepository =
          EventSourcedRepository.builder(eventLog).register(COUNTER).commitListener(failing).build();
      final var commandBus =
          new CommandBus(failingRepository).addCommandHandler(new IncrementCounterHandler());

      assertTrue(commandBus.transact(new IncrementCounter("c1")).isOk());

      assertEquals(1L, eventLog.delegate.length(COUNTER.id("c1")));
      assertEquals(1, count(COUNTER.fetch(failingRepository, "c1")));
    }

    @Test
    void when_aggregate_type_is_not_registered_illegal_argument_must_be_thrown() {
      final var lookalike =
          AggregateType.builder("counter")
              .identifiedBy("name")
              .build()
              .empty("c1")
              .apply(INCREMENTED, Map.of());

      assertThrows(IllegalArgumentException.class, () -> repository.commit(lookalike));
      assertThrows(IllegalArgumentException.class, () -> repository.commit(null));
      assertEquals(0, eventLog.appends.get());
    }

    @Test
    void when_log_fails_the_exception_must_propagate_unchanged() {
      final var unavailable = new IllegalStateException("Log is down");
      final var counter = COUNTER.empty("c1").apply(INCREMENTED, Map.of());
      eventLog.failure.set(unavailable);

      final var thrown = assertThrows(IllegalStateException.class, () -> repository.commit(counter));

      assertSame(unavailable, thrown);
      assertTrue(notifications.isEmpty());
    }
  }
}
