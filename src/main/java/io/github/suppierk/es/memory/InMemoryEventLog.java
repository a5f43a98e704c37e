/*
 * Copyright 2024 Roman Khlebnov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.suppierk.es.memory;

import io.github.suppierk.es.core.AggregateId;
import io.github.suppierk.es.core.AppendOutcome;
import io.github.suppierk.es.core.CommittedEvent;
import io.github.suppierk.es.core.DomainEvent;
import io.github.suppierk.es.core.EventLog;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link EventLog} keeping all streams in memory, meant for tests and prototypes.
 *
 * <p>Each stream is an immutable list replaced as a whole on append, so readers always see a
 * complete stream and the length check plus the append happen atomically per stream.
 */
public final class InMemoryEventLog implements EventLog {
  private final ConcurrentMap<String, List<CommittedEvent>> streams;

  public InMemoryEventLog() {
    this.streams = new ConcurrentHashMap<>();
  }

  /** {@inheritDoc} */
  @Override
  public List<CommittedEvent> read(final AggregateId id, final long sinceVersion) {
    if (id == null) {
      throw new IllegalArgumentException("Aggregate ID cannot be null");
    }

    final List<CommittedEvent> stream = streams.getOrDefault(id.streamId(), List.of());
    final long from = Math.max(0L, sinceVersion + 1);

    if (from >= stream.size()) {
      return List.of();
    }

    return stream.subList((int) from, stream.size());
  }

  /** {@inheritDoc} */
  @Override
  public AppendOutcome appendConditional(
      final AggregateId id, final long expectedVersion, final List<DomainEvent> events) {
    if (id == null) {
      throw new IllegalArgumentException("Aggregate ID cannot be null");
    }

    if (events == null || events.isEmpty()) {
      throw new IllegalArgumentException("Events to append cannot be empty");
    }

    final var appended = new AtomicBoolean(false);

    streams.compute(
        id.streamId(),
        (streamId, existing) -> {
          final List<CommittedEvent> current = existing == null ? List.of() : existing;

          if (current.size() != expectedVersion + 1) {
            return existing;
          }

          final var next = new ArrayList<CommittedEvent>(current.size() + events.size());
          next.addAll(current);
          for (DomainEvent event : events) {
            next.add(new CommittedEvent(next.size(), event));
          }

          appended.set(true);
          return Collections.unmodifiableList(next);
        });

    return appended.get() ? AppendOutcome.APPENDED : AppendOutcome.CONFLICT;
  }

  /**
   * @param id of the aggregate owning the stream
   * @return number of events in the stream
   */
  public long length(final AggregateId id) {
    if (id == null) {
      throw new IllegalArgumentException("Aggregate ID cannot be null");
    }

    return streams.getOrDefault(id.streamId(), List.of()).size();
  }
}
