// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.marshal;

import java.util.Objects;

/// The load and dump routines of one (record type, effective config) pair with the symbols they were
/// bound against. Immutable once published by the [RoutineCache].
record CompiledRoutine(Loader loader, Dumper dumper, SymbolTable symbols) {
  CompiledRoutine {
    Objects.requireNonNull(loader, "loader must not be null");
    Objects.requireNonNull(dumper, "dumper must not be null");
    Objects.requireNonNull(symbols, "symbols must not be null");
  }
}
