// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.marshal;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/// Frozen name to value table produced by [RoutineAssembler#freeze()].
final class SymbolTable {

  private final Map<String, Object> symbols;

  SymbolTable(Map<String, Object> symbols) {
    this.symbols = new LinkedHashMap<>(symbols);
  }

  <T> T get(String name, Class<T> type) {
    final Object value = symbols.get(name);
    if (value == null && !symbols.containsKey(name)) {
      throw new IllegalStateException("No symbol " + name + " in " + symbols.keySet());
    }
    return type.cast(value);
  }

  Set<String> names() {
    return Set.copyOf(symbols.keySet());
  }

  int size() {
    return symbols.size();
  }

  @Override
  public String toString() {
    return "SymbolTable" + symbols.keySet();
  }
}
