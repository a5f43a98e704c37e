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

import io.github.suppierk.es.async.CommitListener;
import io.github.suppierk.java.Try;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Repository} keeping nothing but the {@link EventLog}: every fetch replays the stream of
 * the aggregate, every commit is a single conditional append.
 *
 * <p>Only aggregates of registered {@link AggregateType}s are served. Anything else indicates a
 * broken call site and is refused with {@link IllegalArgumentException}.
 *
 * <pre>{@code
 * Repository repository =
 *     EventSourcedRepository.builder(new InMemoryEventLog())
 *         .register(COUNTER)
 *         .commitListener(projection)
 *         .build();
 * }</pre>
 */
public final class EventSourcedRepository extends Suspicious implements Repository {
  private static final Logger LOGGER = LoggerFactory.getLogger(EventSourcedRepository.class);

  private final EventLog eventLog;
  private final Map<String, AggregateType> aggregateTypes;
  private final CommitListener commitListener;

  private EventSourcedRepository(
      final EventLog eventLog,
      final Map<String, AggregateType> aggregateTypes,
      final CommitListener commitListener) {
    this.eventLog = eventLog;
    this.aggregateTypes = Map.copyOf(aggregateTypes);
    this.commitListener = commitListener;
  }

  /**
   * @param eventLog backing the repository
   * @return a new {@link Builder}
   * @throws IllegalArgumentException if the event log is {@code null}
   */
  public static Builder builder(final EventLog eventLog) {
    if (eventLog == null) {
      throw new IllegalArgumentException("Event log cannot be null");
    }

    return new Builder(eventLog);
  }

  /**
   * @return names of aggregate types served by this repository
   */
  public Set<String> getSupportedAggregateTypes() {
    return aggregateTypes.keySet();
  }

  /** {@inheritDoc} */
  @Override
  public Aggregate fetchLatest(final AggregateId id) {
    final AggregateId nonNullId = throwIllegalArgumentIfNull(id, "Aggregate ID");
    final AggregateType aggregateType = aggregateTypes.get(nonNullId.type());

    if (aggregateType == null) {
      throw new IllegalArgumentException(
          "Aggregate type '%s' is not registered".formatted(nonNullId.type()));
    }

    return hydrate(aggregateType.empty(nonNullId));
  }

  /** {@inheritDoc} */
  @Override
  public Aggregate fetchLatest(final Aggregate aggregate) {
    final Aggregate nonNullAggregate = verifyRegistered(aggregate);

    if (nonNullAggregate.hasPending()) {
      throw new IllegalArgumentException(
          "Aggregate '%s' has pending events and cannot be refreshed"
              .formatted(nonNullAggregate.id()));
    }

    return hydrate(nonNullAggregate);
  }

  /** {@inheritDoc} */
  @Override
  public Result commit(final Aggregate aggregate) {
    final Aggregate nonNullAggregate = verifyRegistered(aggregate);

    if (!nonNullAggregate.hasPending()) {
      return Result.ok(List.of(), nonNullAggregate);
    }

    final AggregateId id = nonNullAggregate.id();
    final List<DomainEvent> pending = nonNullAggregate.pending();

    final Try<AppendOutcome> output =
        Try.of(() -> eventLog.appendConditional(id, nonNullAggregate.version(), pending));

    output.ifFailure(
        cause ->
            LOGGER.warn(
                "Failed to append {} event(s) to '{}' at version {}",
                pending.size(),
                id,
                nonNullAggregate.version(),
                cause));

    final AppendOutcome appendOutcome = throwIllegalStateIfNull(output.get(), "Append outcome");

    if (appendOutcome == AppendOutcome.CONFLICT) {
      LOGGER.debug(
          "Conflict on '{}': stream moved past version {}", id, nonNullAggregate.version());
      return Result.conflict(nonNullAggregate);
    }

    final Aggregate committed = nonNullAggregate.markCommitted();
    LOGGER.debug(
        "Committed {} event(s) to '{}', version is now {}",
        pending.size(),
        id,
        committed.version());

    Try.of(
            () -> {
              commitListener.onCommit(committed, pending);
              return committed;
            })
        .ifFailure(
            cause ->
                LOGGER.warn(
                    "Commit listener failed on '{}' at version {}, events stay committed",
                    id,
                    committed.version(),
                    cause));

    return Result.ok(pending, committed);
  }

  /**
   * Folds all events committed after the version of the aggregate.
   *
   * @param aggregate to start from
   * @return caught up aggregate
   * @throws IllegalStateException if the log returned a gap or a duplicate
   */
  private Aggregate hydrate(final Aggregate aggregate) {
    final AggregateId id = aggregate.id();

    final Try<List<CommittedEvent>> output = Try.of(() -> eventLog.read(id, aggregate.version()));

    output.ifFailure(
        cause ->
            LOGGER.warn(
                "Failed to read '{}' after version {}", id, aggregate.version(), cause));

    Aggregate current = aggregate;
    for (CommittedEvent committedEvent : throwIllegalStateIfNull(output.get(), "Read events")) {
      if (committedEvent.offset() != current.version() + 1) {
        throw new IllegalStateException(
            "Stream of '%s' is inconsistent: expected offset %d, got %d"
                .formatted(id, current.version() + 1, committedEvent.offset()));
      }

      current = current.applyCommitted(committedEvent.event());
    }

    LOGGER.debug("Fetched '{}' at version {}", id, current.version());
    return current;
  }

  private Aggregate verifyRegistered(final Aggregate aggregate) {
    final Aggregate nonNullAggregate = throwIllegalArgumentIfNull(aggregate, "Aggregate");
    final AggregateType aggregateType =
        throwIllegalStateIfNull(nonNullAggregate.type(), "Aggregate type");

    if (aggregateTypes.get(aggregateType.name()) != aggregateType) {
      throw new IllegalArgumentException(
          "Aggregate type '%s' is not registered".formatted(aggregateType.name()));
    }

    return nonNullAggregate;
  }

  /** Collects the configuration of an {@link EventSourcedRepository}. */
  public static final class Builder {
    private final EventLog eventLog;
    private final Map<String, AggregateType> aggregateTypes;
    private CommitListener commitListener;

    private Builder(final EventLog eventLog) {
      this.eventLog = eventLog;
      this.aggregateTypes = new ConcurrentHashMap<>();
      this.commitListener = CommitListener.empty();
    }

    /**
     * @param aggregateType to serve
     * @return this builder
     * @throws IllegalArgumentException if the type is {@code null}
     * @throws IllegalStateException if another type with the same name is registered already
     */
    public Builder register(final AggregateType aggregateType) {
      if (aggregateType == null) {
        throw new IllegalArgumentException("Aggregate type cannot be null");
      }

      if (aggregateTypes.putIfAbsent(aggregateType.name(), aggregateType) != null) {
        throw new IllegalStateException(
            "Aggregate type '%s' is already registered".formatted(aggregateType.name()));
      }

      return this;
    }

    /**
     * @param aggregateTypes to serve
     * @return this builder
     * @see #register(AggregateType)
     */
    public Builder registerAll(final Collection<AggregateType> aggregateTypes) {
      if (aggregateTypes == null) {
        throw new IllegalArgumentException("Aggregate types cannot be null");
      }

      aggregateTypes.forEach(this::register);
      return this;
    }

    /**
     * @param commitListener to notify after every successful commit, replacing the previous one
     * @return this builder
     * @throws IllegalArgumentException if the listener is {@code null}
     */
    public Builder commitListener(final CommitListener commitListener) {
      if (commitListener == null) {
        throw new IllegalArgumentException("Commit listener cannot be null");
      }

      this.commitListener = commitListener;
      return this;
    }

    public EventSourcedRepository build() {
      return new EventSourcedRepository(eventLog, aggregateTypes, commitListener);
    }
  }
}
