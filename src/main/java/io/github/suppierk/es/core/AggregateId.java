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

import java.io.Serial;
import java.io.Serializable;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.StringJoiner;
import java.util.TreeMap;

/**
 * Immutable identifier of an {@link Aggregate}: the aggregate type tag plus the identifying
 * properties, e.g. {@code user{email=a@b.com}}.
 *
 * <p>Properties are kept sorted by name, which makes two identifiers built from the same
 * properties in a different order equal and gives them the same {@link #streamId()}.
 */
public final class AggregateId implements Serializable {
  @Serial private static final long serialVersionUID = 4127394062193843718L;

  /** Name of the state and event property holding the aggregate type tag. */
  public static final String TYPE_PROPERTY = "aggregateType";

  private final String type;
  private final SortedMap<String, Object> properties;

  private AggregateId(final String type, final SortedMap<String, Object> properties) {
    this.type = type;
    this.properties = Collections.unmodifiableSortedMap(properties);
  }

  /**
   * @param type of the aggregate
   * @param properties identifying the aggregate within its type
   * @return a new {@link AggregateId}
   * @throws IllegalArgumentException if the type is blank, if any property name or value is {@code
   *     null}, or if {@link #TYPE_PROPERTY} is used as a property name
   */
  public static AggregateId of(final String type, final Map<String, ?> properties) {
    if (type == null || type.isBlank()) {
      throw new IllegalArgumentException("Aggregate type cannot be blank");
    }

    if (properties == null) {
      throw new IllegalArgumentException("Identifying properties cannot be null");
    }

    final SortedMap<String, Object> sorted = new TreeMap<>();
    for (Map.Entry<String, ?> entry : properties.entrySet()) {
      if (entry.getKey() == null || entry.getValue() == null) {
        throw new IllegalArgumentException(
            "Identifying property '%s' of '%s' cannot be null".formatted(entry.getKey(), type));
      }

      if (TYPE_PROPERTY.equals(entry.getKey())) {
        throw new IllegalArgumentException(
            "'%s' is reserved and cannot identify an aggregate".formatted(TYPE_PROPERTY));
      }

      sorted.put(entry.getKey(), entry.getValue());
    }

    return new AggregateId(type, sorted);
  }

  /**
   * @return the aggregate type tag
   */
  public String type() {
    return type;
  }

  /**
   * @return identifying properties sorted by name
   */
  public SortedMap<String, Object> properties() {
    return properties;
  }

  /**
   * Canonical key of the event stream belonging to this aggregate.
   *
   * <p>Names and values are URL-encoded, so the separators used here never appear inside them.
   *
   * @return stream key, identical for equal identifiers and distinct otherwise
   */
  public String streamId() {
    final var joiner = new StringJoiner("&", encode(type) + "?", "");
    joiner.setEmptyValue(encode(type));
    properties.forEach(
        (name, value) -> joiner.add(encode(name) + "=" + encode(String.valueOf(value))));
    return joiner.toString();
  }

  private static String encode(final String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    AggregateId that = (AggregateId) o;
    return type.equals(that.type) && properties.equals(that.properties);
  }

  @Override
  public int hashCode() {
    int result = type.hashCode();
    result = 31 * result + properties.hashCode();
    return result;
  }

  @Override
  public String toString() {
    return type + properties;
  }
}
