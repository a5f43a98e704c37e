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

import io.github.suppierk.es.authorization.UnauthorizedException;
import java.util.Collections;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single entry point executing {@link DomainCommand}s against aggregates of a {@link Repository}.
 *
 * <p>Handlers are registered once at startup, one per command class. Every command flows through
 * {@link #transact(Repository, DomainCommand)}:
 *
 * <ol>
 *   <li>fetch the aggregate located by the handler,
 *   <li>let the handler decide,
 *   <li>return a rejection as is, or commit the accepted aggregate.
 * </ol>
 *
 * <p>No lock is held across these steps and conflicts are never retried here: a caller receiving
 * {@link Result.Conflict} decides on its own whether to call {@link #transact(DomainCommand)}
 * again.
 */
public final class CommandBus extends Suspicious {
  private static final Logger LOGGER = LoggerFactory.getLogger(CommandBus.class);

  private final Repository repository;
  private final ConcurrentMap<Class<?>, DomainCommandHandler<?>> commandHandlers;

  /**
   * @param repository used by {@link #transact(DomainCommand)}
   * @throws IllegalArgumentException if the repository is {@code null}
   */
  public CommandBus(final Repository repository) {
    this.repository = throwIllegalArgumentIfNull(repository, "Repository");
    this.commandHandlers = new ConcurrentHashMap<>();
  }

  /**
   * @param commandHandler to register
   * @return this bus
   * @throws IllegalArgumentException if the handler is {@code null}
   * @throws IllegalStateException if a handler for the same command class is already registered
   */
  public CommandBus addCommandHandler(final DomainCommandHandler<?> commandHandler) {
    final DomainCommandHandler<?> nonNullCommandHandler =
        throwIllegalArgumentIfNull(commandHandler, "Command handler");

    if (commandHandlers.putIfAbsent(nonNullCommandHandler.getCommandClass(), nonNullCommandHandler)
        != null) {
      throw new IllegalStateException(
          "Handler for '%s' command is already registered"
              .formatted(nonNullCommandHandler.getCommandClass().getSimpleName()));
    }

    return this;
  }

  /**
   * @return read-only view of command classes having a handler
   */
  public Set<Class<?>> getSupportedCommandClasses() {
    return Collections.unmodifiableSet(commandHandlers.keySet());
  }

  public Repository getRepository() {
    return repository;
  }

  /**
   * Executes the command against the repository of this bus.
   *
   * @param command to execute
   * @param <COMMAND> type of the command
   * @return outcome of the command
   * @see #transact(Repository, DomainCommand)
   */
  @SuppressWarnings("squid:S119")
  public <COMMAND extends DomainCommand<?, ?>> Result transact(final COMMAND command) {
    return transact(repository, command);
  }

  /**
   * Executes the command against the given repository.
   *
   * @param repository to fetch from and commit to
   * @param command to execute
   * @param <COMMAND> type of the command
   * @return {@link Result.Ok}, {@link Result.Rejected} or {@link Result.Conflict}
   * @throws IllegalArgumentException if any argument is {@code null}, or if the command targets an
   *     aggregate type unknown to the repository
   * @throws UnsupportedOperationException if no handler is registered for the command class
   * @throws UnauthorizedException if the client of the command is refused by the handler
   * @throws IllegalStateException if the handler broke its contract
   */
  @SuppressWarnings({"unchecked", "squid:S119"})
  public <COMMAND extends DomainCommand<?, ?>> Result transact(
      final Repository repository, final COMMAND command) {
    final Repository nonNullRepository = throwIllegalArgumentIfNull(repository, "Repository");
    final COMMAND nonNullCommand = throwIllegalArgumentIfNull(command, "Command");

    final var commandHandler =
        (DomainCommandHandler<COMMAND>)
            throwUnsupportedOperationIfNull(
                commandHandlers.get(nonNullCommand.getClass()),
                "Handler for '%s' command".formatted(nonNullCommand.getClass().getSimpleName()));

    final Result result = commandHandler.runInContext(nonNullCommand, nonNullRepository);

    LOGGER.debug(
        "'{}' ({}) finished with {}",
        nonNullCommand.getClass().getSimpleName(),
        nonNullCommand.messageId(),
        result.getClass().getSimpleName());
    return result;
  }
}
