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
import java.io.Serial;
import java.util.Optional;

/**
 * Thrown when a {@link DomainClient} issues a command against an aggregate out of its reach, or a
 * command its handler does not accept from its role.
 *
 * <p>Raised before the aggregate is fetched, so a refused command never reaches the event log.
 */
public class UnauthorizedException extends RuntimeException {
  @Serial private static final long serialVersionUID = -6370231984513207251L;

  private final String domainRole;
  private final AggregateId target;

  /**
   * @param domainClient which was refused
   * @param target aggregate of the refused command
   * @param commandName of the refused command
   */
  public UnauthorizedException(
      final DomainClient domainClient, final AggregateId target, final String commandName) {
    super(
        "Client '%s' is not allowed to use '%s' command on '%s'"
            .formatted(
                domainClient == null ? null : domainClient.domainRole(), commandName, target));
    this.domainRole = domainClient == null ? null : domainClient.domainRole();
    this.target = target;
  }

  /**
   * @param message explaining the refusal
   * @param cause of the refusal, e.g. a failed permission lookup
   */
  public UnauthorizedException(final String message, final Throwable cause) {
    super(message, cause);
    this.domainRole = null;
    this.target = null;
  }

  /**
   * @return role of the refused client, if known
   */
  public Optional<String> getDomainRole() {
    return Optional.ofNullable(domainRole);
  }

  /**
   * @return aggregate the refused command targeted, if known
   */
  public Optional<AggregateId> getTarget() {
    return Optional.ofNullable(target);
  }

  /**
   * @return the most appropriate HTTP status code for this exception for consumer convenience.
   * @see <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Status/403">403 Forbidden</a>
   * @see <a href="https://rules.sonarsource.com/java/RSPEC-3400/">Suppressed Sonar rule about
   *     declaring a constant instead</a>
   */
  @SuppressWarnings("squid:S3400")
  public final int getStatusCode() {
    return 403;
  }
}
