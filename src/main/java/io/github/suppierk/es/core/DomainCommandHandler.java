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

import io.github.suppierk.es.authorization.DomainClient;
import io.github.suppierk.es.authorization.UnauthorizedException;
import io.github.suppierk.java.Try;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Class to accept and process the work associated to a specific {@link DomainCommand}:
 *
 * <ul>
 *   <li>Locate the target {@link Aggregate}.
 *   <li>Assert that the {@link DomainClient} can reach it and can issue the {@link DomainCommand}.
 *   <li>Fetch the latest state of the aggregate.
 *   <li>Decide: apply zero or more events, or reject the command.
 *   <li>Commit accepted aggregates through the {@link Repository}.
 * </ul>
 *
 * <p>Implementations provide {@link #locate(DomainCommand)} and {@link #handle(Aggregate,
 * DomainCommand)}. The latter must be deterministic given the aggregate state and the command:
 * no hidden I/O, no implicit reads of other aggregates. Anything else the decision depends on must
 * be fetched by the caller and put into the command.
 *
 * <p><b>Design note</b>: whichever parameters can be controlled must be covered with null checks
 * and {@code final} (if possible), whichever values are expected to be provided by the
 * implementation must be checked with the help of {@link Suspicious} methods.
 *
 * @param <COMMAND> the type of the particular {@link DomainCommand}
 * @see <a href="https://rules.sonarsource.com/java/RSPEC-119/">Suppressed Sonar rule for the sake
 *     to have more readable type names</a>
 */
@SuppressWarnings("squid:S119")
public abstract non-sealed class DomainCommandHandler<COMMAND extends DomainCommand<?, ?>>
    extends Suspicious {
  private static final Logger LOGGER = LoggerFactory.getLogger(DomainCommandHandler.class);

  private final Class<COMMAND> commandClass;

  /**
   * Constructs a new {@link DomainCommandHandler} for a specific {@link DomainCommand} class.
   *
   * @param commandClass the class of the {@link DomainCommand} to handle
   * @throws IllegalArgumentException if the command class is null
   */
  protected DomainCommandHandler(final Class<COMMAND> commandClass) {
    this.commandClass = throwIllegalArgumentIfNull(commandClass, "Command class");
  }

  /**
   * Returns the class type of the command being handled by this {@link DomainCommandHandler}.
   *
   * @return the class type of the command
   */
  public final Class<COMMAND> getCommandClass() {
    return commandClass;
  }

  /**
   * Extracts the identity of the target aggregate from the command.
   *
   * @param command being executed
   * @return identifier of the aggregate to fetch
   */
  protected abstract AggregateId locate(final COMMAND command);

  /**
   * Business logic of the command.
   *
   * @param aggregate latest state of the target aggregate, possibly {@link Aggregate#isNew()}
   * @param command being executed
   * @return {@link #accept(Aggregate)} with new events applied through {@link
   *     Aggregate#applyNew(DomainEvent)}, or {@link #reject(Aggregate, String)} with the aggregate
   *     exactly as given
   */
  protected abstract Decision handle(final Aggregate aggregate, final COMMAND command);

  /**
   * Checked after {@link DomainClient#canAccess(AggregateId)}, so only clients within reach of the
   * aggregate get here.
   *
   * @param domainClient issuing the command
   * @param id of the aggregate the command targets
   * @return {@code true} if the client can issue the command, {@code false} otherwise
   */
  protected boolean canBeUsedBy(final DomainClient domainClient, final AggregateId id) {
    return true;
  }

  /**
   * Restricts the event types the handler may produce. Producing an undeclared event type is
   * treated as a defect of the handler.
   *
   * @return event types the handler may produce, empty for no restriction
   */
  protected Set<String> producedEventTypes() {
    return Set.of();
  }

  /**
   * @param aggregate with new events applied
   * @return decision to commit the aggregate
   */
  protected final Decision accept(final Aggregate aggregate) {
    return Decision.accept(aggregate);
  }

  /**
   * @param aggregate exactly as given to {@link #handle(Aggregate, DomainCommand)}
   * @param reason human-readable explanation of the refusal
   * @return decision to leave the log untouched
   */
  protected final Decision reject(final Aggregate aggregate, final String reason) {
    return Result.rejected(aggregate, reason);
  }

  /**
   * Runs the command: fetch, decide, commit.
   *
   * @param command to be executed
   * @param repository to fetch from and commit to
   * @return {@link Result.Rejected} as returned by the handler, or the result of the commit
   * @throws IllegalArgumentException if any parameter is null
   * @throws IllegalStateException if the handler broke its contract
   * @throws UnauthorizedException if the client cannot reach the aggregate or issue the command
   */
  final Result runInContext(final COMMAND command, final Repository repository) {
    final COMMAND nonNullCommand = throwIllegalArgumentIfNull(command, "Command");
    final Repository nonNullRepository = throwIllegalArgumentIfNull(repository, "Repository");
    final DomainClient nonNullDomainClient =
        throwIllegalStateIfNull(nonNullCommand.domainClient(), "Command's client");

    final AggregateId id = throwIllegalStateIfNull(locate(nonNullCommand), "Located aggregate ID");

    if (!nonNullDomainClient.canAccess(id) || !canBeUsedBy(nonNullDomainClient, id)) {
      throw new UnauthorizedException(
          nonNullDomainClient, id, getCommandClass().getSimpleName());
    }

    final Aggregate aggregate = nonNullRepository.fetchLatest(id);

    final Try<Decision> output = Try.of(() -> handle(aggregate, nonNullCommand));

    output.ifFailure(
        cause ->
            LOGGER.warn(
                "'{}' failed on '{}' at version {}",
                getCommandClass().getSimpleName(),
                id,
                aggregate.version(),
                cause));

    final Decision decision = throwIllegalStateIfNull(output.get(), "Handler decision");

    if (decision instanceof Result.Rejected rejected) {
      if (rejected.aggregate() != aggregate) {
        throw new IllegalStateException(
            "'%s' rejection must carry the aggregate given to the handler"
                .formatted(getCommandClass().getSimpleName()));
      }

      LOGGER.debug(
          "'{}' rejected on '{}': {}",
          getCommandClass().getSimpleName(),
          id,
          rejected.reason());
      return rejected;
    }

    return nonNullRepository.commit(verifyAccepted(aggregate, decision.aggregate()));
  }

  private Aggregate verifyAccepted(final Aggregate fetched, final Aggregate accepted) {
    if (!fetched.id().equals(accepted.id()) || fetched.version() != accepted.version()) {
      throw new IllegalStateException(
          "'%s' must accept '%s' at version %d, got '%s' at version %d"
              .formatted(
                  getCommandClass().getSimpleName(),
                  fetched.id(),
                  fetched.version(),
                  accepted.id(),
                  accepted.version()));
    }

    final Set<String> allowed =
        throwIllegalStateIfNull(producedEventTypes(), "Produced event types");

    if (!allowed.isEmpty()) {
      for (DomainEvent event : accepted.pending()) {
        if (!allowed.contains(event.type())) {
          throw new IllegalStateException(
              "'%s' produced undeclared '%s' event, allowed: %s"
                  .formatted(getCommandClass().getSimpleName(), event.type(), allowed));
        }
      }
    }

    return accepted;
  }
}
