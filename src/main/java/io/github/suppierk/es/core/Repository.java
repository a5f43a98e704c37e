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

/**
 * Mediates between in-memory {@link Aggregate}s and the {@link EventLog}.
 *
 * <p>Implementations perform no locking: concurrent callers race freely until the conditional
 * append, where at most one of them wins and the others observe {@link Result.Conflict}.
 */
public interface Repository {
  /**
   * Rebuilds the aggregate from its full stream.
   *
   * @param id of the aggregate
   * @return the aggregate with all committed events applied, {@link Aggregate#isNew()} if there
   *     are none
   * @throws IllegalArgumentException if the aggregate type is unknown to this repository
   */
  Aggregate fetchLatest(final AggregateId id);

  /**
   * Applies events committed after the version of an aggregate held by the caller.
   *
   * @param aggregate previously fetched, without pending events
   * @return the aggregate with all newer committed events applied
   * @throws IllegalArgumentException if the aggregate has pending events or is of unknown type
   */
  Aggregate fetchLatest(final Aggregate aggregate);

  /**
   * Appends pending events of the aggregate to its stream.
   *
   * @param aggregate with zero or more pending events
   * @return {@link Result.Ok} with the committed aggregate, or {@link Result.Conflict} if another
   *     writer was faster
   * @throws IllegalArgumentException if the aggregate type is unknown to this repository
   */
  Result commit(final Aggregate aggregate);
}
