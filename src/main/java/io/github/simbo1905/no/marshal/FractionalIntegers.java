// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.marshal;

/// How integer fields treat a floating value such as `2.5`. Whole values such as `2.0` are always accepted.
public enum FractionalIntegers {
  /// Round half up to the nearest integer.
  ROUND,
  /// Fail with [TypeMismatchException].
  REJECT
}
