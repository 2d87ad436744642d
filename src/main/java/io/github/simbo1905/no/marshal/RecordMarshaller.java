// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.marshal;

import java.util.ArrayDeque;
import java.util.Objects;

import static io.github.simbo1905.no.marshal.Marshaller.LOGGER;

/// Marshaller of a record root type. Holds the routine published by the [RoutineCache].
final class RecordMarshaller<T> implements Marshaller<T> {
  final Class<T> type;
  final RoutineKey key;
  final CompiledRoutine routine;

  private RecordMarshaller(Class<T> type, RoutineKey key, CompiledRoutine routine) {
    this.type = type;
    this.key = key;
    this.routine = routine;
  }

  static <T> RecordMarshaller<T> create(Class<T> type, MarshalConfig callSiteConfig) {
    final MarshalConfig config = ConfigResolver.resolveRoot(type, callSiteConfig);
    final var key = new RoutineKey(type, config);
    LOGGER.fine(() -> "Creating RecordMarshaller for " + type.getName());
    return new RecordMarshaller<>(type, key, RoutineCache.GLOBAL.getOrCompile(key, new ArrayDeque<>()));
  }

  @Override
  public T load(Object dynamicValue) {
    return type.cast(routine.loader().load(dynamicValue));
  }

  @Override
  public Object dump(T value) {
    Objects.requireNonNull(value, "Record to dump must not be null");
    return routine.dumper().dump(value);
  }

  CompiledRoutine routine() {
    return routine;
  }

  @Override
  public String toString() {
    return "RecordMarshaller{" + type.getSimpleName() + "}";
  }
}
