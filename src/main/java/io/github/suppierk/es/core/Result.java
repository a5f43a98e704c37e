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

import java.util.List;

/**
 * Outcome of {@link Repository#commit(Aggregate)} and {@link CommandBus#transact(DomainCommand)}.
 *
 * <p>Business refusals and lost races are expected outcomes, so they are returned rather than
 * thrown, and callers are expected to branch on all three variants:
 *
 * <ul>
 *   <li>{@link Ok} - pending events were appended to the log, or there was nothing to append.
 *   <li>{@link Rejected} - the command handler refused to proceed. Retrying with the same inputs
 *       yields the same refusal.
 *   <li>{@link Conflict} - another writer appended to the same stream first. Fetching the
 *       aggregate again and reapplying the command may succeed.
 * </ul>
 */
public sealed interface Result permits Result.Ok, Result.Rejected, Result.Conflict {
  /**
   * @return for {@link Ok} - the committed aggregate, otherwise the aggregate passed in unchanged
   */
  Aggregate aggregate();

  default boolean isOk() {
    return this instanceof Ok;
  }

  default boolean isRejected() {
    return this instanceof Rejected;
  }

  default boolean isConflict() {
    return this instanceof Conflict;
  }

  static Ok ok(final List<DomainEvent> committedEvents, final Aggregate aggregate) {
    return new Ok(committedEvents, aggregate);
  }

  static Rejected rejected(final Aggregate aggregate, final String reason) {
    return new Rejected(reason, aggregate);
  }

  static Conflict conflict(final Aggregate aggregate) {
    return new Conflict(aggregate);
  }

  /**
   * @param committedEvents appended to the log, empty if there was nothing to commit
   * @param aggregate with no pending events and the version matching the log
   */
  record Ok(List<DomainEvent> committedEvents, Aggregate aggregate) implements Result {
    public Ok {
      if (committedEvents == null) {
        throw new IllegalArgumentException("Committed events cannot be null");
      }

      if (aggregate == null) {
        throw new IllegalArgumentException("Aggregate cannot be null");
      }

      committedEvents = List.copyOf(committedEvents);
    }
  }

  /**
   * Also a {@link Decision}: handlers return it directly and {@link CommandBus} passes it on.
   *
   * @param reason human-readable explanation of the refusal
   * @param aggregate exactly as it was given to the handler
   */
  record Rejected(String reason, Aggregate aggregate) implements Result, Decision {
    public Rejected {
      if (reason == null || reason.isBlank()) {
        throw new IllegalArgumentException("Rejection reason cannot be blank");
      }

      if (aggregate == null) {
        throw new IllegalArgumentException("Aggregate cannot be null");
      }
    }
  }

  /**
   * @param aggregate exactly as it was given to {@link Repository#commit(Aggregate)}
   */
  record Conflict(Aggregate aggregate) implements Result {
    public Conflict {
      if (aggregate == null) {
        throw new IllegalArgumentException("Aggregate cannot be null");
      }
    }
  }
}
