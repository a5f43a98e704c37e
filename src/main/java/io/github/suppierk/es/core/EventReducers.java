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

import java.util.Collections;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Registry of {@link EventReducer}s keyed by {@link DomainEvent#type()}.
 *
 * <p>Events without a registered reducer leave the state as is: older code must be able to replay
 * streams containing event types introduced later.
 */
public final class EventReducers extends Suspicious {
  private final ConcurrentMap<String, EventReducer> reducers;

  public EventReducers() {
    this.reducers = new ConcurrentHashMap<>();
  }

  /**
   * @param eventType to register the reducer for
   * @param reducer to fold events of the given type
   * @return this registry
   * @throws IllegalArgumentException if any of the arguments is {@code null}
   * @throws IllegalStateException if a reducer for this event type already exists
   */
  public EventReducers register(final String eventType, final EventReducer reducer) {
    final String nonNullEventType = throwIllegalArgumentIfNull(eventType, "Event type");
    final EventReducer nonNullReducer = throwIllegalArgumentIfNull(reducer, "Event reducer");

    if (reducers.putIfAbsent(nonNullEventType, nonNullReducer) != null) {
      throw new IllegalStateException(
          "Reducer for '%s' event is already registered".formatted(nonNullEventType));
    }

    return this;
  }

  /**
   * Folds the event into the state.
   *
   * @param state to fold the event into
   * @param event to fold
   * @return new state, or the given state if no reducer is registered for this event type
   * @throws IllegalArgumentException if any of the arguments is {@code null}
   * @throws IllegalStateException if the reducer returned {@code null}
   */
  public AggregateState apply(final AggregateState state, final DomainEvent event) {
    final AggregateState nonNullState = throwIllegalArgumentIfNull(state, "Aggregate state");
    final DomainEvent nonNullEvent = throwIllegalArgumentIfNull(event, "Event");

    final EventReducer reducer = reducers.get(nonNullEvent.type());
    if (reducer == null) {
      return nonNullState;
    }

    return throwIllegalStateIfNull(
        reducer.apply(nonNullState, nonNullEvent),
        "State reduced from '%s' event".formatted(nonNullEvent.type()));
  }

  /**
   * @return a new registry holding the same reducers, unaffected by later registrations here
   */
  EventReducers copy() {
    final var copy = new EventReducers();
    copy.reducers.putAll(reducers);
    return copy;
  }

  /**
   * @param eventType to check
   * @return {@code true} if a reducer is registered for this event type
   */
  public boolean supports(final String eventType) {
    return eventType != null && reducers.containsKey(eventType);
  }

  /**
   * @return read-only view of event types having a reducer
   */
  public Set<String> registeredEventTypes() {
    return Collections.unmodifiableSet(reducers.keySet());
  }
}
