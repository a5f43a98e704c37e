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
 * Internal sealed utility for verifying inputs crossing the boundary between application code and
 * the event sourcing runtime.
 *
 * <p>Application code supplies reducers, handlers, aggregates and commands - any of those may carry
 * a {@code null} where none is allowed. Such a {@code null} always indicates a broken call site, so
 * it is reported immediately with an exception naming the offending value.
 */
abstract sealed class Suspicious
    permits AggregateType, CommandBus, DomainCommandHandler, EventReducers, EventSourcedRepository {
  /**
   * This method must be used whenever we deal with values produced by application code, such as
   * the outputs of reducers and handlers, or properties of arguments.
   *
   * @param value which must not be {@code null}
   * @param whatMustNotBeNull is the value name
   * @param <T> is the type of the value
   * @return value if it was not {@code null}
   * @throws IllegalStateException when the value is {@code null}
   */
  protected final <T> T throwIllegalStateIfNull(T value, String whatMustNotBeNull)
      throws IllegalStateException {
    if (value == null) {
      throw new IllegalStateException("%s cannot be null".formatted(whatMustNotBeNull));
    }

    return value;
  }

  /**
   * This method must be used whenever we deal with method arguments only. When we need to check
   * values derived from arguments use {@link #throwIllegalStateIfNull(Object, String)} instead.
   *
   * @param value which must not be {@code null}
   * @param whatMustNotBeNull is the parameter name
   * @param <T> is the type of the value
   * @return value if it was not {@code null}
   * @throws IllegalArgumentException when the value is {@code null}
   */
  protected final <T> T throwIllegalArgumentIfNull(T value, String whatMustNotBeNull)
      throws IllegalArgumentException {
    if (value == null) {
      throw new IllegalArgumentException("%s cannot be null".formatted(whatMustNotBeNull));
    }

    return value;
  }

  /**
   * This method must be used whenever a lookup in one of the registries came back empty and the
   * runtime cannot serve the request.
   *
   * @param value which must not be {@code null}
   * @param whatMustNotBeNull is the name of the missing registration
   * @param <T> is the type of the value
   * @return value if it was not {@code null}
   * @throws UnsupportedOperationException when the value is {@code null}
   */
  protected final <T> T throwUnsupportedOperationIfNull(T value, String whatMustNotBeNull)
      throws UnsupportedOperationException {
    if (value == null) {
      throw new UnsupportedOperationException("%s is not registered".formatted(whatMustNotBeNull));
    }

    return value;
  }
}
