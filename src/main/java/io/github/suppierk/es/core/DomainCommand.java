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

import java.io.Serializable;
import java.time.temporal.Temporal;

/**
 * Represents an immutable request to validate and possibly record new facts about an {@link
 * Aggregate}.
 *
 * <p>It is highly recommended to use this interface with Java {@link Record}s: the class of the
 * command is its type tag, used by {@link CommandBus} to select a {@link DomainCommandHandler}, and
 * the record components are its properties - whatever locates the target aggregate plus the
 * command arguments.
 *
 * <p>Commands must be task-oriented, not data-centric - e.g. 'Increment Counter' instead of 'Set
 * Count to 4'.
 *
 * <p>Commands can be queued and processed later, which is the reason this interface extends {@link
 * DomainMessage} and, through it, {@link Serializable}.
 *
 * @param <I> is the type of the command identifier
 * @param <T> is the type of the timestamp when this command was created
 */
// @formatter:off
public interface DomainCommand<
  I extends Serializable,
  T extends Temporal & Serializable
> extends DomainMessage<I, T> {}
// @formatter:on
