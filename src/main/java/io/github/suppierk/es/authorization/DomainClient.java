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

package io.github.suppierk.es.authorization;

import io.github.suppierk.es.core.AggregateId;
import java.io.Serializable;
import java.util.Map;

/**
 * Issuer of commands, checked against the aggregate a command targets.
 *
 * <p>Every client carries a role, which command handlers use to accept or refuse it, and a scope:
 * identifying properties the client is confined to. A client scoped to {@code owner=alice} reaches
 * only aggregates identified by {@code owner} with the value {@code alice}, whatever their type.
 * An empty scope reaches every aggregate.
 */
public interface DomainClient extends Serializable {
  /**
   * @return role of the client within the domain, used by handlers and in refusal messages
   */
  String domainRole();

  /**
   * @return identifying properties the client is confined to, empty if it is not confined
   */
  default Map<String, Object> scope() {
    return Map.of();
  }

  /**
   * An aggregate is within reach if it is identified by every scoped property with the scoped
   * value. Aggregates not identified by a scoped property are out of reach.
   *
   * @param id of the targeted aggregate
   * @return {@code true} if the aggregate is within the scope of this client
   */
  default boolean canAccess(final AggregateId id) {
    if (id == null) {
      return false;
    }

    for (Map.Entry<String, Object> scoped : scope().entrySet()) {
      if (!scoped.getValue().equals(id.properties().get(scoped.getKey()))) {
        return false;
      }
    }

    return true;
  }
}
