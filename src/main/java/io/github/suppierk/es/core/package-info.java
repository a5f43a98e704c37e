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

/**
 * Event sourcing runtime: aggregates rebuilt from their history and changed by appending new events.
 *
 * <p>Here is an example to help explain how different domain objects are related to each other -
 * let's assume that we keep a ledger of a bank account:
 *
 * <ul>
 *   <li>The account is an {@link io.github.suppierk.es.core.Aggregate} of the {@code account}
 *       {@link io.github.suppierk.es.core.AggregateType}, identified by its {@code iban} through an
 *       {@link io.github.suppierk.es.core.AggregateId}.
 *   <li>The ledger lines are {@link io.github.suppierk.es.core.DomainEvent}s such as {@code
 *       deposited} or {@code withdrawn}, stored one after another in the stream of the account
 *       kept by an {@link io.github.suppierk.es.core.EventLog}.
 *   <li>The balance is never stored: it is a property of the {@link
 *       io.github.suppierk.es.core.AggregateState} obtained by folding every ledger line with the
 *       {@link io.github.suppierk.es.core.EventReducer}s of the account type.
 *   <li>A customer, being a {@link io.github.suppierk.es.authorization.DomainClient}, sends a
 *       {@link io.github.suppierk.es.core.DomainCommand} to {@code Withdraw}:
 *       <ul>
 *         <li>The {@link io.github.suppierk.es.core.DomainCommandHandler} fetches the account from
 *             the {@link io.github.suppierk.es.core.Repository} and either applies a {@code
 *             withdrawn} event or rejects the command when the balance is too low.
 *         <li>The accepted account is committed only if nobody appended to its stream in the
 *             meantime, otherwise the customer receives a {@link
 *             io.github.suppierk.es.core.Result.Conflict} and may try again.
 *       </ul>
 *   <li>Every command flows through the {@link io.github.suppierk.es.core.CommandBus}, which routes
 *       it to the handler registered for its class.
 * </ul>
 */
package io.github.suppierk.es.core;
