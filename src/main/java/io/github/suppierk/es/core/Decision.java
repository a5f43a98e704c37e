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
 * Verdict of a {@link DomainCommandHandler}: either the aggregate with the new facts applied, or a
 * {@link Result.Rejected} which leaves everything untouched.
 */
public sealed interface Decision permits Decision.Accepted, Result.Rejected {
  Aggregate aggregate();

  static Accepted accept(final Aggregate aggregate) {
    return new Accepted(aggregate);
  }

  /**
   * @param aggregate to commit, carrying zero or more pending events
   */
  record Accepted(Aggregate aggregate) implements Decision {
    public Accepted {
      if (aggregate == null) {
        throw new IllegalArgumentException("Aggregate cannot be null");
      }
    }
  }
}
