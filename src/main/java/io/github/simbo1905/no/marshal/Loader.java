// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.marshal;

import java.util.function.Function;

/// A compiled load routine: dynamic value in, typed value out.
interface Loader extends
    Function<Object, Object> {

  /// Load a typed value from its dynamic form
  default Object load(Object dynamic) {
    return apply(dynamic);
  }
}
