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

package io.github.suppierk.es.jooq;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.suppierk.es.core.AggregateId;
import io.github.suppierk.es.core.AppendOutcome;
import io.github.suppierk.es.core.CommittedEvent;
import io.github.suppierk.es.core.DomainEvent;
import io.github.suppierk.es.core.EventLog;
import io.github.suppierk.java.UnsafeFunctions;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import org.jooq.Configuration;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.InsertValuesStep4;
import org.jooq.Record;
import org.jooq.Table;
import org.jooq.exception.DataAccessException;
import org.jooq.exception.SQLStateClass;
import org.jooq.impl.DSL;
import org.jooq.impl.SQLDataType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link EventLog} storing streams in a relational table through jOOQ.
 *
 * <p>One row per event, keyed by {@code (stream_id, stream_offset)}. Event properties are stored as
 * JSON text written by Jackson, so they must be representable as JSON. Top-level values come back
 * with the type they were appended with when that type is a string, a boolean, an {@link
 * Integer}, a {@link Double} or one of the scalars JSON cannot tell apart on its own ({@link Long},
 * {@link Short}, {@link Byte}, {@link Float}, {@link Character}, {@link BigInteger}, {@link
 * BigDecimal}, {@link UUID}), which keeps replays equal to the live state. Anything nested inside
 * lists or objects comes back as plain JSON values: numbers as {@link Integer}, {@link Long} or
 * {@link Double}, objects as {@link Map}s.
 *
 * <p>The conditional append runs in a transaction which checks the stream length before inserting.
 * A writer slipping in between the check and the insert hits the primary key instead, which is
 * reported as {@link AppendOutcome#CONFLICT} as well.
 */
public final class JooqEventLog implements EventLog {
  private static final Logger LOGGER = LoggerFactory.getLogger(JooqEventLog.class);

  public static final String DEFAULT_TABLE_NAME = "event_log";

  private static final TypeReference<Map<String, Map<String, Object>>> DOCUMENT_TYPE =
      new TypeReference<>() {};

  private static final String PLAIN_VALUES = "values";
  private static final String TYPED_VALUES = "typed";

  private static final Map<Class<?>, String> SCALAR_TYPE_NAMES =
      Map.of(
          Long.class, "long",
          Short.class, "short",
          Byte.class, "byte",
          Float.class, "float",
          Character.class, "char",
          BigInteger.class, "big-integer",
          BigDecimal.class, "big-decimal",
          UUID.class, "uuid");

  private static final Map<String, Function<String, Object>> SCALAR_PARSERS =
      Map.of(
          "long", Long::valueOf,
          "short", Short::valueOf,
          "byte", Byte::valueOf,
          "float", Float::valueOf,
          "char", value -> value.charAt(0),
          "big-integer", BigInteger::new,
          "big-decimal", BigDecimal::new,
          "uuid", UUID::fromString);

  private static final Field<String> STREAM_ID =
      DSL.field(DSL.name("stream_id"), SQLDataType.VARCHAR);
  private static final Field<Long> STREAM_OFFSET =
      DSL.field(DSL.name("stream_offset"), SQLDataType.BIGINT);
  private static final Field<String> EVENT_TYPE =
      DSL.field(DSL.name("event_type"), SQLDataType.VARCHAR);
  private static final Field<String> PROPERTIES =
      DSL.field(DSL.name("properties"), SQLDataType.CLOB);

  private final DslContextProvider dslContextProvider;
  private final String tableName;
  private final Table<Record> table;
  private final ObjectMapper objectMapper;

  /**
   * @param dslContextProvider selecting the database of each stream
   * @throws IllegalArgumentException if the provider is {@code null}
   */
  public JooqEventLog(final DslContextProvider dslContextProvider) {
    this(dslContextProvider, DEFAULT_TABLE_NAME, new ObjectMapper());
  }

  /**
   * @param dslContextProvider selecting the database of each stream
   * @param tableName of the event table
   * @param objectMapper encoding event properties
   * @throws IllegalArgumentException if any of the arguments is {@code null} or the name is blank
   */
  public JooqEventLog(
      final DslContextProvider dslContextProvider,
      final String tableName,
      final ObjectMapper objectMapper) {
    if (dslContextProvider == null) {
      throw new IllegalArgumentException("DSLContext provider cannot be null");
    }

    if (tableName == null || tableName.isBlank()) {
      throw new IllegalArgumentException("Event table name cannot be blank");
    }

    if (objectMapper == null) {
      throw new IllegalArgumentException("Object mapper cannot be null");
    }

    this.dslContextProvider = dslContextProvider;
    this.tableName = tableName;
    this.table = DSL.table(DSL.name(tableName));
    this.objectMapper = objectMapper;
  }

  /**
   * Creates the event table in the given database unless it exists.
   *
   * @param dsl of the database to create the table in
   */
  public void createTableIfNotExists(final DSLContext dsl) {
    if (dsl == null) {
      throw new IllegalArgumentException("DSLContext cannot be null");
    }

    dsl.createTableIfNotExists(table)
        .column(STREAM_ID, SQLDataType.VARCHAR(1024).nullable(false))
        .column(STREAM_OFFSET, SQLDataType.BIGINT.nullable(false))
        .column(EVENT_TYPE, SQLDataType.VARCHAR(255).nullable(false))
        .column(PROPERTIES, SQLDataType.CLOB.nullable(false))
        .constraints(
            DSL.constraint(DSL.name(tableName + "_pk")).primaryKey(STREAM_ID, STREAM_OFFSET))
        .execute();
  }

  /** {@inheritDoc} */
  @Override
  public List<CommittedEvent> read(final AggregateId id, final long sinceVersion) {
    if (id == null) {
      throw new IllegalArgumentException("Aggregate ID cannot be null");
    }

    return dsl(id)
        .select(STREAM_OFFSET, EVENT_TYPE, PROPERTIES)
        .from(table)
        .where(STREAM_ID.eq(id.streamId()))
        .and(STREAM_OFFSET.gt(sinceVersion))
        .orderBy(STREAM_OFFSET.asc())
        .fetch()
        .stream()
        .map(
            UnsafeFunctions.unsafeFunction(
                dbRecord ->
                    new CommittedEvent(
                        dbRecord.value1(),
                        new DomainEvent(dbRecord.value2(), decode(dbRecord.value3())))))
        .toList();
  }

  /** {@inheritDoc} */
  @Override
  public AppendOutcome appendConditional(
      final AggregateId id, final long expectedVersion, final List<DomainEvent> events) {
    if (id == null) {
      throw new IllegalArgumentException("Aggregate ID cannot be null");
    }

    if (events == null || events.isEmpty()) {
      throw new IllegalArgumentException("Events to append cannot be empty");
    }

    final String streamId = id.streamId();
    final List<String> encodedProperties =
        events.stream()
            .map(
                UnsafeFunctions.unsafeFunction(
                    (DomainEvent event) -> encode(event.properties())))
            .toList();

    try {
      return dsl(id)
          .transactionResult(
              (final Configuration trx) -> {
                final DSLContext trxDsl = trx.dsl();

                if (trxDsl.fetchCount(table, STREAM_ID.eq(streamId)) != expectedVersion + 1) {
                  return AppendOutcome.CONFLICT;
                }

                InsertValuesStep4<Record, String, Long, String, String> insert =
                    trxDsl.insertInto(table, STREAM_ID, STREAM_OFFSET, EVENT_TYPE, PROPERTIES);

                for (int i = 0; i < events.size(); i++) {
                  insert =
                      insert.values(
                          streamId,
                          expectedVersion + 1 + i,
                          events.get(i).type(),
                          encodedProperties.get(i));
                }

                insert.execute();
                return AppendOutcome.APPENDED;
              });
    } catch (DataAccessException e) {
      if (e.sqlStateClass() == SQLStateClass.C23_INTEGRITY_CONSTRAINT_VIOLATION) {
        LOGGER.debug("Concurrent append to '{}' detected by the primary key", streamId);
        return AppendOutcome.CONFLICT;
      }

      throw e;
    }
  }

  /**
   * Writes scalars whose type JSON would lose as {@code [typeName, text]} pairs next to the plain
   * values: {@code {"values": {...}, "typed": {"amount": ["long", "5"]}}}.
   */
  private String encode(final Map<String, Object> properties) throws JsonProcessingException {
    final Map<String, Object> plainValues = new LinkedHashMap<>();
    final Map<String, Object> typedValues = new LinkedHashMap<>();

    properties.forEach(
        (name, value) -> {
          final String typeName = value == null ? null : SCALAR_TYPE_NAMES.get(value.getClass());

          if (typeName == null) {
            plainValues.put(name, value);
          } else {
            typedValues.put(name, List.of(typeName, value.toString()));
          }
        });

    return objectMapper.writeValueAsString(
        Map.of(PLAIN_VALUES, plainValues, TYPED_VALUES, typedValues));
  }

  private Map<String, Object> decode(final String document) throws JsonProcessingException {
    final Map<String, Map<String, Object>> stored = objectMapper.readValue(document, DOCUMENT_TYPE);
    final Map<String, Object> properties =
        new LinkedHashMap<>(stored.getOrDefault(PLAIN_VALUES, Map.of()));

    stored
        .getOrDefault(TYPED_VALUES, Map.of())
        .forEach((name, typedValue) -> properties.put(name, parseTyped(name, typedValue)));

    return properties;
  }

  private static Object parseTyped(final String name, final Object typedValue) {
    if (!(typedValue instanceof List<?> pair) || pair.size() != 2) {
      throw new IllegalStateException(
          "Typed property '%s' must be a [type, value] pair, got %s".formatted(name, typedValue));
    }

    final Function<String, Object> parser = SCALAR_PARSERS.get(String.valueOf(pair.get(0)));

    if (parser == null) {
      throw new IllegalStateException(
          "Typed property '%s' has unknown type '%s'".formatted(name, pair.get(0)));
    }

    return parser.apply(String.valueOf(pair.get(1)));
  }

  private DSLContext dsl(final AggregateId id) {
    final DSLContext dsl = dslContextProvider.apply(id);

    if (dsl == null) {
      throw new IllegalStateException("No DSLContext provided for '%s'".formatted(id));
    }

    return dsl;
  }
}
