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

package io.github.suppierk.es.async;

import io.github.suppierk.es.core.Aggregate;
import io.github.suppierk.es.core.DomainEvent;
import java.util.List;

/**
 * Abstract contract for an entity which reacts to events after they became durable, such as a
 * projection updater or a publisher relaying events to other systems.
 *
 * <p>Listeners run synchronously on the committing thread, after the conditional append
 * succeeded. Anything a listener throws is logged and dropped: the events are already stored, so
 * the commit still reports success. Listeners which must not lose work should hand it off to a
 * queue of their own.
 */
@FunctionalInterface
public interface CommitListener {
  /**
   * @return an instance of listener which does not perform any operations
   */
  static CommitListener empty() {
    return NoOp.INSTANCE;
  }

  /**
   * @param aggregate after the commit, without pending events
   * @param committedEvents appended to the stream of the aggregate, in order, never empty
   */
  void onCommit(final Aggregate aggregate, final List<DomainEvent> committedEvents);

  /** Default implementation of the listener ignoring all commits */
  final class NoOp implements CommitListener {
    private static final CommitListener INSTANCE = new NoOp();

    private NoOp() {
      // Cannot be instantiated from the outside
    }

    @Override
    public void onCommit(final Aggregate aggregate, final List<DomainEvent> committedEvents) {
      // Do nothing
    }
  }
}
