// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.marshal;

/// The load half of one descriptor node before its symbols are frozen. Binding looks up every
/// symbol the fragment interned and returns a routine that no longer touches the table.
@FunctionalInterface
interface LoadFragment {
  Loader bind(SymbolTable symbols);
}
