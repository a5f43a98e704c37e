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
 * Immutable property bag describing the current state of an {@link Aggregate}.
 *
 * <p>Every modification returns a new instance, which keeps {@link EventReducer}s free of side
 * effects: the state given to a reducer is never changed by it.
 */
public final class AggregateState {
  private static final AggregateState EMPTY = new AggregateState(Collections.emptyMap());

  private final Map<String, Object> properties;

  private AggregateState(final Map<String, Object> properties) {
    this.properties = properties;
  }

  /**
   * @return a state without any properties
   */
  public static AggregateState empty() {
    return EMPTY;
  }

  /**
   * @param properties to copy
   * @return a new state holding a copy of the given properties
   * @throws IllegalArgumentException if properties or any of their names are {@code null}
   */
  public static AggregateState of(final Map<String, ?> properties) {
    if (properties == null) {
      throw new IllegalArgumentException("State properties cannot be null");
    }

    for (String name : properties.keySet()) {
      if (name == null) {
        throw new IllegalArgumentException("State property name cannot be null");
      }
    }

    return new AggregateState(Collections.unmodifiableMap(new LinkedHashMap<>(properties)));
  }

  /**
   * @param name of the property
   * @param <T> expected type of the value
   * @return the value or {@code null} if absent
   * @throws ClassCastException if the value is not of the expected type
   */
  @SuppressWarnings("unchecked")
  public <T> T get(final String name) {
    return (T) properties.get(name);
  }

  /**
   * @param name of the property
   * @param defaultValue returned when the property is absent
   * @param <T> expected type of the value
   * @return the value or {@code defaultValue} if absent
   */
  @SuppressWarnings("unchecked")
  public <T> T getOrDefault(final String name, final T defaultValue) {
    return (T) properties.getOrDefault(name, defaultValue);
  }

  public boolean contains(final String name) {
    return properties.containsKey(name);
  }

  /**
   * @param name of the property to set
   * @param value to set
   * @return a copy of this state with the property set
   * @throws IllegalArgumentException if the name is {@code null}
   */
  public AggregateState with(final String name, final Object value) {
    if (name == null) {
      throw new IllegalArgumentException("State property name cannot be null");
    }

    final var copy = new LinkedHashMap<>(properties);
    copy.put(name, value);
    return new AggregateState(Collections.unmodifiableMap(copy));
  }

  /**
   * @param name of the property to remove
   * @return a copy of this state without the property, or this state if it was absent
   */
  public AggregateState without(final String name) {
    if (!properties.containsKey(name)) {
      return this;
    }

    final var copy = new LinkedHashMap<>(properties);
    copy.remove(name);
    return new AggregateState(Collections.unmodifiableMap(copy));
  }

  /**
   * @return read-only view of all properties
   */
  public Map<String, Object> asMap() {
    return properties;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    AggregateState that = (AggregateState) o;
    return properties.equals(that.properties);
  }

  @Override
  public int hashCode() {
    return properties.hashCode();
  }

  @Override
  public String toString() {
    return properties.toString();
  }
}
