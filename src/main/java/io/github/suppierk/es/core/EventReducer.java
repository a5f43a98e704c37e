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

import java.util.function.BiFunction;

/**
 * Folds a single {@link DomainEvent} into an {@link AggregateState}.
 *
 * <p>Reducers must be pure: the result depends only on the given state and event, so that
 * replaying the same events always rebuilds the same state. Reducers never see the aggregate
 * version or its pending events.
 */
@FunctionalInterface
public interface EventReducer extends BiFunction<AggregateState, DomainEvent, AggregateState> {}
