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
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Represents an immutable fact which happened to an {@link Aggregate}.
 *
 * <p>Events are past-tense and task-oriented - e.g. 'Counter Incremented' rather than 'Count Set
 * To 4'. Events produced through {@link Aggregate#newEvent(String, Map)} carry the identifying
 * properties of their aggregate, which makes every stored event replayable on its own.
 *
 * <p>The properties are the only shape which reaches the {@link EventLog}; how they are encoded
 * there is up to the log.
 *
 * @param type of the event, used to select an {@link EventReducer}
 * @param properties of the event
 */
public record DomainEvent(String type, Map<String, Object> properties) {
  public DomainEvent {
    if (type == null || type.isBlank()) {
      throw new IllegalArgumentException("Event type cannot be blank");
    }

    if (properties == null) {
      throw new IllegalArgumentException("Event properties cannot be null");
    }

    properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
  }

  /**
   * @param type of the event
   * @return a new event without properties
   */
  public static DomainEvent of(final String type) {
    return new DomainEvent(type, Map.of());
  }

  /**
   * @param name of the property
   * @param <T> expected type of the value
   * @return the value or {@code null} if absent
   */
  @SuppressWarnings("unchecked")
  public <T> T property(final String name) {
    return (T) properties.get(name);
  }
}
