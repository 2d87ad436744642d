// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.marshal;

import java.util.ArrayDeque;
import java.util.Objects;

import static io.github.simbo1905.no.marshal.Marshaller.LOGGER;

/// Marshaller of a sealed interface root type. Loads through the tag or trial dispatch of its
/// alternatives and dumps through the alternative matching the runtime class.
final class UnionMarshaller<T> implements Marshaller<T> {
  final Class<T> type;
  final CompiledRoutine routine;

  private UnionMarshaller(Class<T> type, CompiledRoutine routine) {
    this.type = type;
    this.routine = routine;
  }

  static <T> UnionMarshaller<T> create(Class<T> type, MarshalConfig callSiteConfig) {
    final MarshalConfig config = ConfigResolver.resolveRoot(type, callSiteConfig);
    LOGGER.fine(() -> "Creating UnionMarshaller for " + type.getName());
    final var key = new RoutineKey(type, config);
    return new UnionMarshaller<>(type, RoutineCache.GLOBAL.getOrCompile(key, new ArrayDeque<>()));
  }

  @Override
  public T load(Object dynamicValue) {
    return type.cast(routine.loader().load(dynamicValue));
  }

  @Override
  public Object dump(T value) {
    Objects.requireNonNull(value, "Value to dump must not be null");
    return routine.dumper().dump(value);
  }

  CompiledRoutine routine() {
    return routine;
  }

  @Override
  public String toString() {
    return "UnionMarshaller{" + type.getSimpleName() + "}";
  }
}
