package io.github.suppierk.es.memory;

import static io.github.suppierk.test.Counters.COUNTER;
import static io.github.suppierk.test.Counters.INCREMENTED;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.es.core.AppendOutcome;
import io.github.suppierk.es.core.CommittedEvent;
import io.github.suppierk.es.core.DomainEvent;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryEventLogTest {
  static final DomainEvent FIRST =
      COUNTER.empty("c1").newEvent(INCREMENTED, Map.of("step", 1));
  static final DomainEvent SECOND =
      COUNTER.empty("c1").newEvent(INCREMENTED, Map.of("step", 2));

  InMemoryEventLog eventLog;

  @BeforeEach
  void setUp() {
    eventLog = new InMemoryEventLog();
  }

  @Test
  void unknown_stream_must_read_as_empty() {
    assertTrue(eventLog.read(COUNTER.id("c1"), -1).isEmpty());
    assertEquals(0L, eventLog.length(COUNTER.id("c1")));
  }

  @Test
  void appended_events_must_get_consecutive_offsets() {
    assertEquals(
        AppendOutcome.APPENDED, eventLog.appendConditional(COUNTER.id("c1"), -1, List.of(FIRST)));
    assertEquals(
        AppendOutcome.APPENDED, eventLog.appendConditional(COUNTER.id("c1"), 0, List.of(SECOND)));

    assertEquals(
        List.of(new CommittedEvent(0, FIRST), new CommittedEvent(1, SECOND)),
        eventLog.read(COUNTER.id("c1"), -1));
    assertEquals(List.of(new CommittedEvent(1, SECOND)), eventLog.read(COUNTER.id("c1"), 0));
    assertTrue(eventLog.read(COUNTER.id("c1"), 1).isEmpty());
  }

  @Test
  void append_at_stale_version_must_conflict_and_change_nothing() {
    eventLog.appendConditional(COUNTER.id("c1"), -1, List.of(FIRST, SECOND));

    assertEquals(
        AppendOutcome.CONFLICT, eventLog.appendConditional(COUNTER.id("c1"), 0, List.of(FIRST)));
    assertEquals(
        AppendOutcome.CONFLICT, eventLog.appendConditional(COUNTER.id("c1"), 5, List.of(FIRST)));
    assertEquals(2L, eventLog.length(COUNTER.id("c1")));
  }

  @Test
  void streams_must_be_independent() {
    eventLog.appendConditional(COUNTER.id("c1"), -1, List.of(FIRST));

    assertEquals(
        AppendOutcome.APPENDED, eventLog.appendConditional(COUNTER.id("c2"), -1, List.of(FIRST)));
    assertEquals(1L, eventLog.length(COUNTER.id("c1")));
    assertEquals(1L, eventLog.length(COUNTER.id("c2")));
  }

  @Test
  void when_arguments_are_invalid_illegal_argument_must_be_thrown() {
    final var id = COUNTER.id("c1");
    final List<DomainEvent> noEvents = List.of();

    assertThrows(IllegalArgumentException.class, () -> eventLog.read(null, -1));
    assertThrows(IllegalArgumentException.class, () -> eventLog.length(null));
    assertThrows(
        IllegalArgumentException.class, () -> eventLog.appendConditional(null, -1, List.of(FIRST)));
    assertThrows(
        IllegalArgumentException.class, () -> eventLog.appendConditional(id, -1, noEvents));
    assertThrows(IllegalArgumentException.class, () -> eventLog.appendConditional(id, -1, null));
  }
}
