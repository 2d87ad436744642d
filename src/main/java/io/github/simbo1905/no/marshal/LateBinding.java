// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.marshal;

import java.util.ArrayDeque;
import java.util.Objects;

import static io.github.simbo1905.no.marshal.Marshaller.LOGGER;

/// Indirect call to the routine of a record that was still being compiled when a field referring to
/// it was compiled. The key is looked up on first use, compiled if still absent, and then remembered.
final class LateBinding {

  private final RoutineCache cache;
  private final RoutineKey key;
  private volatile CompiledRoutine resolved;

  LateBinding(RoutineCache cache, RoutineKey key) {
    this.cache = Objects.requireNonNull(cache, "cache must not be null");
    this.key = Objects.requireNonNull(key, "key must not be null");
    LOGGER.fine(() -> "Late binding to " + key);
  }

  CompiledRoutine routine() {
    CompiledRoutine routine = resolved;
    if (routine == null) {
      routine = cache.getOrCompile(key, new ArrayDeque<>());
      resolved = routine;
      LOGGER.finer(() -> "Late binding resolved " + key);
    }
    return routine;
  }

  RoutineKey key() {
    return key;
  }

  @Override
  public String toString() {
    return "@" + key;
  }
}
