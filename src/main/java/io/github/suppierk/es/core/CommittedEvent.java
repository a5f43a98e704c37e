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
 * A {@link DomainEvent} as read back from an {@link EventLog}.
 *
 * @param offset 0-based position of the event within its stream
 * @param event stored at that position
 */
public record CommittedEvent(long offset, DomainEvent event) {
  public CommittedEvent {
    if (offset < 0) {
      throw new IllegalArgumentException("Offset cannot be negative, got %d".formatted(offset));
    }

    if (event == null) {
      throw new IllegalArgumentException("Event cannot be null");
    }
  }
}
