// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.marshal;

import java.lang.reflect.Type;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static io.github.simbo1905.no.marshal.Marshaller.LOGGER;

/// Process-wide table of compiled routines keyed by (record type, effective config).
///
/// Compile-and-swap: a miss compiles outside any lock and publishes with `putIfAbsent`, so two threads
/// racing on the same key may both compile but every caller gets the single published winner.
/// Entries are never evicted.
final class RoutineCache {

  static final RoutineCache GLOBAL = new RoutineCache();

  private final Map<RoutineKey, CompiledRoutine> routines = new ConcurrentHashMap<>();

  /// @param ancestors the types being compiled on this thread, innermost first; nested records
  ///                  found on it are reached through a [LateBinding]
  CompiledRoutine getOrCompile(RoutineKey key, Deque<Type> ancestors) {
    final CompiledRoutine cached = routines.get(key);
    if (cached != null) {
      LOGGER.finer(() -> "Routine cache hit " + key);
      return cached;
    }
    LOGGER.fine(() -> "Routine cache miss, compiling " + key);
    final CompiledRoutine compiled = RoutineCompiler.compile(this, key, ancestors);
    final CompiledRoutine winner = routines.putIfAbsent(key, compiled);
    if (winner != null) {
      LOGGER.fine(() -> "Discarded a concurrent compilation of " + key);
      return winner;
    }
    return compiled;
  }

  CompiledRoutine get(RoutineKey key) {
    return routines.get(key);
  }

  int size() {
    return routines.size();
  }
}
