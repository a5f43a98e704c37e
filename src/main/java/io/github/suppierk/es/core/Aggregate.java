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

package io.github.suppierk.es.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * An entity whose state is the fold of its event history.
 *
 * <p>The state always equals the fold of all committed events followed by all pending events,
 * starting from the identity of the aggregate. Committed events are counted by the {@link
 * #version()}: {@code -1} means no event was ever committed, {@code 0} means one event was, and so
 * on. Pending events are facts produced in the current session which were not handed to the {@link
 * EventLog} yet.
 *
 * <p>Instances are immutable, every operation returns a new {@link Aggregate}. This is what allows
 * {@link Result.Rejected} and {@link Result.Conflict} to hand back the very aggregate they were
 * given.
 */
public final class Aggregate {
  /** Version of an aggregate without committed events. */
  public static final long NEW_VERSION = -1L;

  private final AggregateType type;
  private final AggregateId id;
  private final long version;
  private final AggregateState state;
  private final List<DomainEvent> pending;

  Aggregate(
      final AggregateType type,
      final AggregateId id,
      final long version,
      final AggregateState state,
      final List<DomainEvent> pending) {
    this.type = type;
    this.id = id;
    this.version = version;
    this.state = state;
    this.pending = pending;
  }

  public AggregateType type() {
    return type;
  }

  public AggregateId id() {
    return id;
  }

  /**
   * @return index of the last committed event, or {@link #NEW_VERSION}
   */
  public long version() {
    return version;
  }

  public AggregateState state() {
    return state;
  }

  /**
   * @return events applied in this session and not committed yet, in application order
   */
  public List<DomainEvent> pending() {
    return pending;
  }

  /**
   * @return {@code true} if no event was ever committed for this aggregate
   */
  public boolean isNew() {
    return version == NEW_VERSION;
  }

  public boolean hasPending() {
    return !pending.isEmpty();
  }

  /**
   * @return {@code true} if the aggregate has neither committed nor pending events
   */
  public boolean isEmpty() {
    return isNew() && !hasPending();
  }

  /**
   * Standard way for command handlers to check whether the aggregate has any history.
   *
   * @return this aggregate if it is not new, {@link Optional#empty()} otherwise
   */
  public Optional<Aggregate> exists() {
    return isNew() ? Optional.empty() : Optional.of(this);
  }

  /**
   * Builds an event for this aggregate without applying it.
   *
   * <p>Identifying properties and the type tag are merged into the event and take precedence over
   * same-named properties.
   *
   * @param eventType of the event
   * @param properties of the event
   * @return a new self-describing {@link DomainEvent}
   */
  public DomainEvent newEvent(final String eventType, final Map<String, ?> properties) {
    if (properties == null) {
      throw new IllegalArgumentException("Event properties cannot be null");
    }

    final var merged = new LinkedHashMap<String, Object>(properties);
    merged.putAll(id.properties());
    merged.put(AggregateId.TYPE_PROPERTY, type.name());
    return new DomainEvent(eventType, merged);
  }

  /**
   * Builds a new event for this aggregate and applies it.
   *
   * @param eventType of the event
   * @param properties of the event
   * @return aggregate with the new event applied and pending
   * @see #newEvent(String, Map)
   * @see #applyNew(DomainEvent)
   */
  public Aggregate apply(final String eventType, final Map<String, ?> properties) {
    return applyNew(newEvent(eventType, properties));
  }

  /**
   * Applies a fact produced by a command. The event becomes pending and is stored by the next
   * {@link Repository#commit(Aggregate)}.
   *
   * @param event to apply
   * @return aggregate with the event folded into its state and appended to its pending events
   */
  public Aggregate applyNew(final DomainEvent event) {
    if (event == null) {
      throw new IllegalArgumentException("Event cannot be null");
    }

    final var nextPending = new ArrayList<DomainEvent>(pending.size() + 1);
    nextPending.addAll(pending);
    nextPending.add(event);

    return new Aggregate(
        type,
        id,
        version,
        type.reducers().apply(state, event),
        Collections.unmodifiableList(nextPending));
  }

  /**
   * Applies an event read back from the {@link EventLog}. Only used during hydration.
   *
   * @param event to apply
   * @return aggregate with the event folded into its state and the version incremented
   * @throws IllegalStateException if the aggregate has pending events
   */
  public Aggregate applyCommitted(final DomainEvent event) {
    if (event == null) {
      throw new IllegalArgumentException("Event cannot be null");
    }

    if (hasPending()) {
      throw new IllegalStateException(
          "Committed events cannot be applied on top of pending events of '%s'".formatted(id));
    }

    return new Aggregate(type, id, version + 1, type.reducers().apply(state, event), pending);
  }

  /**
   * @return aggregate as it is after all pending events were appended to the log
   */
  Aggregate markCommitted() {
    return new Aggregate(type, id, version + pending.size(), state, List.of());
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    Aggregate that = (Aggregate) o;
    return version == that.version
        && type.equals(that.type)
        && id.equals(that.id)
        && state.equals(that.state)
        && pending.equals(that.pending);
  }

  @Override
  public int hashCode() {
    int result = id.hashCode();
    result = 31 * result + Long.hashCode(version);
    result = 31 * result + state.hashCode();
    result = 31 * result + pending.hashCode();
    return result;
  }

  @Override
  public String toString() {
    return new StringJoiner(", ", Aggregate.class.getSimpleName() + "[", "]")
        .add("id=" + id)
        .add("version=" + version)
        .add("state=" + state)
        .add("pending=" + pending)
        .toString();
  }
}
