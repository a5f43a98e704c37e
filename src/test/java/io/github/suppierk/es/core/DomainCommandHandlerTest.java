package io.github.suppierk.es.core;

import static io.github.suppierk.test.Counters.COUNTER;
import static io.github.suppierk.test.Counters.INCREMENTED;
import static io.github.suppierk.test.Counters.OWNER;
import static io.github.suppierk.test.Counters.RESET;
import static io.github.suppierk.test.Counters.count;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.es.authorization.AnonymousDomainClient;
import io.github.suppierk.es.authorization.ScopedDomainClient;
import io.github.suppierk.es.authorization.UnauthorizedException;
import io.github.suppierk.test.AnotherDomainClient;
import io.github.suppierk.test.Counters.IncrementCounter;
import io.github.suppierk.test.Counters.IncrementCounterHandler;
import io.github.suppierk.test.RecordingEventLog;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.BiFunction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class DomainCommandHandlerTest {
  RecordingEventLog eventLog;
  EventSourcedRepository repository;

  @BeforeEach
  void setUp() {
    eventLog = new RecordingEventLog();
    repository = EventSourcedRepository.builder(eventLog).register(COUNTER).build();
  }

  static DomainCommandHandler<IncrementCounter> handler(
      final BiFunction<Aggregate, IncrementCounter, Decision> decide) {
    return new DomainCommandHandler<>(IncrementCounter.class) {
      @Override
      protected AggregateId locate(IncrementCounter command) {
        return COUNTER.id(command.name());
      }

      @Override
      protected Decision handle(Aggregate aggregate, IncrementCounter command) {
        return decide.apply(aggregate, command);
      }

      @Override
      protected Set<String> producedEventTypes() {
        return Set.of(INCREMENTED);
      }
    };
  }

  @Test
  void when_command_class_is_null_illegal_argument_must_be_thrown() {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            new DomainCommandHandler<IncrementCounter>(null) {
              @Override
              protected AggregateId locate(IncrementCounter command) {
                return null;
              }

              @Override
              protected Decision handle(Aggregate aggregate, IncrementCounter command) {
                return null;
              }
            });
  }

  @Nested
  class Authorization {
    final DomainCommandHandler<IncrementCounter> handler = new IncrementCounterHandler();

    @Test
    void when_role_is_refused_unauthorized_must_be_thrown_before_fetching() {
      final var command = new IncrementCounter(AnotherDomainClient.getInstance(), "c1");

      final var thrown =
          assertThrows(
              UnauthorizedException.class, () -> handler.runInContext(command, repository));

      assertEquals(403, thrown.getStatusCode());
      assertEquals(Optional.of("OTHER"), thrown.getDomainRole());
      assertEquals(Optional.of(COUNTER.id("c1")), thrown.getTarget());
      assertEquals(0, eventLog.reads.get());
      assertEquals(0, eventLog.appends.get());
    }

    @Test
    void scoped_client_must_reach_its_own_aggregate() {
      final var owner = ScopedDomainClient.of(OWNER, COUNTER.id("c1"));

      final var result = handler.runInContext(new IncrementCounter(owner, "c1"), repository);

      assertTrue(result.isOk());
      assertEquals(1L, eventLog.delegate.length(COUNTER.id("c1")));
    }

    @Test
    void scoped_client_must_not_reach_other_aggregates() {
      final var owner = ScopedDomainClient.of(OWNER, COUNTER.id("c1"));
      final var command = new IncrementCounter(owner, "c2");

      final var thrown =
          assertThrows(
              UnauthorizedException.class, () -> handler.runInContext(command, repository));

      assertEquals(Optional.of(COUNTER.id("c2")), thrown.getTarget());
      assertEquals(0, eventLog.reads.get());
    }

    @Test
    void scope_must_not_grant_a_refused_role() {
      final var stranger = ScopedDomainClient.of("STRANGER", COUNTER.id("c1"));
      final var command = new IncrementCounter(stranger, "c1");

      assertThrows(UnauthorizedException.class, () -> handler.runInContext(command, repository));
    }

    @Test
    void when_client_is_null_illegal_state_must_be_thrown() {
      final var command = new IncrementCounter(UUID.randomUUID(), Instant.now(), null, "c1");

      assertThrows(IllegalStateException.class, () -> handler.runInContext(command, repository));
    }

    @Test
    void anonymous_client_must_be_the_default() {
      final DomainCommand<UUID, Instant> command =
          new DomainCommand<>() {
            @Override
            public UUID messageId() {
              return UUID.randomUUID();
            }

            @Override
            public Instant createdAt() {
              return Instant.now();
            }
          };

      assertSame(AnonymousDomainClient.getInstance(), command.domainClient());
    }
  }

  @Nested
  class Decisions {
    @Test
    void accepted_aggregate_must_be_committed() {
      final DomainCommandHandler<IncrementCounter> handler = new IncrementCounterHandler();

      final var result = handler.runInContext(new IncrementCounter("c1"), repository);

      final var ok = assertInstanceOf(Result.Ok.class, result);
      assertEquals(1, count(ok.aggregate()));
      assertEquals(0L, ok.aggregate().version());
      assertEquals(1L, eventLog.delegate.length(COUNTER.id("c1")));
    }

    @Test
    void accepting_without_events_must_not_contact_the_log() {
      final var result =
          handler((aggregate, command) -> Decision.accept(aggregate))
              .runInContext(new IncrementCounter("c1"), repository);

      assertTrue(result.isOk());
      assertEquals(0, eventLog.appends.get());
    }

    @Test
    void rejection_must_leave_the_log_untouched() {
      final var result =
          handler((aggregate, command) -> Result.rejected(aggregate, "Not today"))
              .runInContext(new IncrementCounter("c1"), repository);

      final var rejected = assertInstanceOf(Result.Rejected.class, result);
      assertEquals("Not today", rejected.reason());
      assertTrue(rejected.aggregate().isEmpty());
      assertEquals(0, eventLog.appends.get());
    }

    @Test
    void rejection_carrying_another_aggregate_must_be_refused() {
      final var handler =
          handler(
              (aggregate, command) ->
                  Result.rejected(aggregate.apply(INCREMENTED, Map.of()), "Sneaky"));
      final var command = new IncrementCounter("c1");

      assertThrows(IllegalStateException.class, () -> handler.runInContext(command, repository));
      assertEquals(0, eventLog.appends.get());
    }

    @Test
    void accepting_another_aggregate_must_be_refused() {
      final var handler =
          handler(
              (aggregate, command) ->
                  Decision.accept(COUNTER.empty("c2").apply(INCREMENTED, Map.of())));
      final var command = new IncrementCounter("c1");

      assertThrows(IllegalStateException.class, () -> handler.runInContext(command, repository));
      assertEquals(0, eventLog.appends.get());
    }

    @Test
    void producing_undeclared_event_must_be_refused() {
      final var handler =
          handler((aggregate, command) -> Decision.accept(aggregate.apply(RESET, Map.of())));
      final var command = new IncrementCounter("c1");

      assertThrows(IllegalStateException.class, () -> handler.runInContext(command, repository));
      assertEquals(0, eventLog.appends.get());
    }

    @Test
    void when_handler_returns_null_illegal_state_must_be_thrown() {
      final var handler = handler((aggregate, command) -> null);
      final var command = new IncrementCounter("c1");

      assertThrows(IllegalStateException.class, () -> handler.runInContext(command, repository));
    }

    @Test
    void when_handler_fails_the_exception_must_propagate_unchanged() {
      final var failure = new ArithmeticException("Division by zero");
      final var handler =
          handler(
              (aggregate, command) -> {
                throw failure;
              });
      final var command = new IncrementCounter("c1");

      final var thrown =
          assertThrows(ArithmeticException.class, () -> handler.runInContext(command, repository));

      assertSame(failure, thrown);
      assertEquals(0, eventLog.appends.get());
    }
  }

  @Nested
  class Concurrency {
    @Test
    void racing_commands_must_yield_one_commit_and_one_conflict() throws Exception {
      final var barrier = new CyclicBarrier(2);
      final var handler =
          handler(
              (aggregate, command) -> {
                try {
                  // Both callers hold the same version before either commits
                  barrier.await(5, TimeUnit.SECONDS);
                } catch (Exception e) {
                  throw new IllegalStateException(e);
                }

                return Decision.accept(aggregate.apply(INCREMENTED, Map.of()));
              });

      final var executor = Executors.newFixedThreadPool(2);
      final List<Result> results;
      try {
        final Future<Result> first =
            executor.submit(() -> handler.runInContext(new IncrementCounter("c1"), repository));
        final Future<Result> second =
            executor.submit(() -> handler.runInContext(new IncrementCounter("c1"), repository));

        results = List.of(first.get(10, TimeUnit.SECONDS), second.get(10, TimeUnit.SECONDS));
      } finally {
        executor.shutdownNow();
      }

      assertEquals(1, results.stream().filter(Result::isOk).count());
      assertEquals(1, results.stream().filter(Result::isConflict).count());
      assertEquals(1L, eventLog.delegate.length(COUNTER.id("c1")));

      final var conflict = results.stream().filter(Result::isConflict).findFirst().orElseThrow();
      assertEquals(Aggregate.NEW_VERSION, conflict.aggregate().version());

      final DomainCommandHandler<IncrementCounter> incrementing = new IncrementCounterHandler();
      final var retried = incrementing.runInContext(new IncrementCounter("c1"), repository);

      assertTrue(retried.isOk());
      assertEquals(2, count(retried.aggregate()));
      assertEquals(2L, eventLog.delegate.length(COUNTER.id("c1")));
    }
  }
}
