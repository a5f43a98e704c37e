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
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Describes a kind of {@link Aggregate}: its type tag, the properties identifying each instance
 * and the {@link EventReducers} folding its events.
 *
 * <p>Types are declared once at startup:
 *
 * <pre>{@code
 * AggregateType COUNTER =
 *     AggregateType.builder("counter")
 *         .identifiedBy("name")
 *         .on("incremented", (state, event) -> state.with("count", state.getOrDefault("count", 0) + 1))
 *         .build();
 *
 * Aggregate counter = COUNTER.empty("c1");
 * }</pre>
 */
public final class AggregateType extends Suspicious {
  private final String name;
  private final List<String> identifyingProperties;
  private final EventReducers reducers;

  private AggregateType(
      final String name, final List<String> identifyingProperties, final EventReducers reducers) {
    this.name = name;
    this.identifyingProperties = List.copyOf(identifyingProperties);
    this.reducers = reducers;
  }

  /**
   * @param name of the aggregate type, used as the type tag
   * @return a new {@link Builder}
   * @throws IllegalArgumentException if the name is blank
   */
  public static Builder builder(final String name) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Aggregate type name cannot be blank");
    }

    return new Builder(name);
  }

  /**
   * @return the type tag
   */
  public String name() {
    return name;
  }

  /**
   * @return names of identifying properties in declaration order
   */
  public List<String> identifyingProperties() {
    return identifyingProperties;
  }

  /**
   * @return reducers folding events of this aggregate type
   */
  public EventReducers reducers() {
    return reducers;
  }

  /**
   * Builds an identifier from values given in the order of {@link #identifyingProperties()}.
   *
   * @param values of identifying properties
   * @return a new {@link AggregateId}
   * @throws IllegalArgumentException if the number of values does not match
   */
  public AggregateId id(final Object... values) {
    final Object[] nonNullValues = throwIllegalArgumentIfNull(values, "Identifying values");

    if (nonNullValues.length != identifyingProperties.size()) {
      throw new IllegalArgumentException(
          "'%s' is identified by %s, got %d value(s)"
              .formatted(name, identifyingProperties, nonNullValues.length));
    }

    final Map<String, Object> properties = new LinkedHashMap<>();
    for (int i = 0; i < nonNullValues.length; i++) {
      properties.put(identifyingProperties.get(i), nonNullValues[i]);
    }

    return AggregateId.of(name, properties);
  }

  /**
   * @param properties identifying an aggregate of this type
   * @return a new {@link AggregateId}
   * @throws IllegalArgumentException if property names differ from {@link
   *     #identifyingProperties()}
   */
  public AggregateId id(final Map<String, ?> properties) {
    final Map<String, ?> nonNullProperties =
        throwIllegalArgumentIfNull(properties, "Identifying properties");

    if (!nonNullProperties.keySet().equals(Set.copyOf(identifyingProperties))) {
      throw new IllegalArgumentException(
          "'%s' is identified by %s, got %s"
              .formatted(name, identifyingProperties, nonNullProperties.keySet()));
    }

    return AggregateId.of(name, nonNullProperties);
  }

  /**
   * Creates an aggregate without any history: version {@code -1}, state holding only its identity.
   *
   * @param id of the aggregate
   * @return a new empty {@link Aggregate}
   * @throws IllegalArgumentException if the identifier does not belong to this type
   */
  public Aggregate empty(final AggregateId id) {
    final AggregateId nonNullId = throwIllegalArgumentIfNull(id, "Aggregate ID");

    if (!name.equals(nonNullId.type())
        || !nonNullId.properties().keySet().equals(Set.copyOf(identifyingProperties))) {
      throw new IllegalArgumentException(
          "'%s' does not identify an aggregate of type '%s'".formatted(nonNullId, name));
    }

    final var seed = new LinkedHashMap<String, Object>(nonNullId.properties());
    seed.put(AggregateId.TYPE_PROPERTY, name);

    return new Aggregate(this, nonNullId, Aggregate.NEW_VERSION, AggregateState.of(seed), List.of());
  }

  /**
   * @param values of identifying properties, see {@link #id(Object...)}
   * @return a new empty {@link Aggregate}
   */
  public Aggregate empty(final Object... values) {
    return empty(id(values));
  }

  /**
   * @param repository to fetch the aggregate from
   * @param values of identifying properties, see {@link #id(Object...)}
   * @return the latest known state of the aggregate
   */
  public Aggregate fetch(final Repository repository, final Object... values) {
    return throwIllegalArgumentIfNull(repository, "Repository").fetchLatest(id(values));
  }

  @Override
  public String toString() {
    return "AggregateType[" + name + identifyingProperties + "]";
  }

  /** Collects the declaration of an {@link AggregateType}. */
  public static final class Builder {
    private final String name;
    private final Set<String> identifyingProperties;
    private final EventReducers reducers;

    private Builder(final String name) {
      this.name = name;
      this.identifyingProperties = new LinkedHashSet<>();
      this.reducers = new EventReducers();
    }

    /**
     * @param properties identifying each aggregate of this type
     * @return this builder
     * @throws IllegalArgumentException if any property is blank, reserved or repeated
     */
    public Builder identifiedBy(final String... properties) {
      if (properties == null) {
        throw new IllegalArgumentException("Identifying properties cannot be null");
      }

      for (String property : properties) {
        if (property == null || property.isBlank()) {
          throw new IllegalArgumentException("Identifying property cannot be blank");
        }

        if (AggregateId.TYPE_PROPERTY.equals(property)) {
          throw new IllegalArgumentException(
              "'%s' is reserved and cannot identify an aggregate".formatted(property));
        }

        if (!identifyingProperties.add(property)) {
          throw new IllegalArgumentException(
              "Identifying property '%s' is declared twice".formatted(property));
        }
      }

      return this;
    }

    /**
     * @param eventType to fold
     * @param reducer folding events of the given type
     * @return this builder
     * @see EventReducers#register(String, EventReducer)
     */
    public Builder on(final String eventType, final EventReducer reducer) {
      reducers.register(eventType, reducer);
      return this;
    }

    public AggregateType build() {
      return new AggregateType(name, new ArrayList<>(identifyingProperties), reducers.copy());
    }
  }
}
