// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.marshal;

import java.util.function.Function;

/// A compiled dump routine: typed value in, dynamic value out.
interface Dumper extends
    Function<Object, Object> {

  /// Dump a typed value to its dynamic form
  default Object dump(Object typed) {
    return apply(typed);
  }
}
