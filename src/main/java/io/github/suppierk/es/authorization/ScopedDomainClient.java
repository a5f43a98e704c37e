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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Client confined to the aggregates sharing some of its identifying properties, e.g. a customer
 * who may only reach accounts identified by their own {@code owner}.
 *
 * @param domainRole of the client
 * @param scope identifying properties the client is confined to, never empty
 */
public record ScopedDomainClient(String domainRole, Map<String, Object> scope)
    implements DomainClient {
  public ScopedDomainClient {
    if (domainRole == null || domainRole.isBlank()) {
      throw new IllegalArgumentException("Client role cannot be blank");
    }

    if (scope == null || scope.isEmpty()) {
      throw new IllegalArgumentException("Client scope cannot be empty");
    }

    for (Map.Entry<String, Object> scoped : scope.entrySet()) {
      if (scoped.getKey() == null || scoped.getValue() == null) {
        throw new IllegalArgumentException(
            "Scoped property '%s' cannot be null".formatted(scoped.getKey()));
      }
    }

    scope = Collections.unmodifiableMap(new LinkedHashMap<>(scope));
  }

  /**
   * @param domainRole of the client
   * @param id whose identifying properties become the scope
   * @return a client reaching the given aggregate and any other identified the same way
   */
  public static ScopedDomainClient of(final String domainRole, final AggregateId id) {
    if (id == null) {
      throw new IllegalArgumentException("Aggregate ID cannot be null");
    }

    return new ScopedDomainClient(domainRole, id.properties());
  }
}
