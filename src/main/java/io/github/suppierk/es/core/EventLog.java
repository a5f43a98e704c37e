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
 * Abstract contract for the append-only store of {@link DomainEvent}s, one stream per {@link
 * AggregateId}.
 *
 * <p>Implementations own durability, transport and encoding of event properties. Concurrency
 * control relies entirely on {@link #appendConditional(AggregateId, long, List)} being atomic:
 * there is no other lock between readers and writers.
 *
 * <p>Any exception thrown by an implementation reaches the caller of {@link
 * Repository#fetchLatest(AggregateId)} or {@link Repository#commit(Aggregate)} unchanged.
 */
public interface EventLog {
  /**
   * Reads the stream in a single consistent pass.
   *
   * @param id of the aggregate owning the stream
   * @param sinceVersion offset of the last event already known to the caller, {@link
   *     Aggregate#NEW_VERSION} to read from the start
   * @return events with offset strictly greater than {@code sinceVersion}, in append order
   */
  List<CommittedEvent> read(final AggregateId id, final long sinceVersion);

  /**
   * Atomically appends events if nobody appended to the stream since {@code expectedVersion}.
   *
   * <p>Either all events are appended starting at offset {@code expectedVersion + 1}, or none are.
   *
   * @param id of the aggregate owning the stream
   * @param expectedVersion offset of the last event in the stream, {@link Aggregate#NEW_VERSION} if
   *     the stream must be empty
   * @param events to append, in order, never empty
   * @return {@link AppendOutcome#CONFLICT} if the stream length is not {@code expectedVersion + 1}
   */
  AppendOutcome appendConditional(
      final AggregateId id, final long expectedVersion, final List<DomainEvent> events);
}
