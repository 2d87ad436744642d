// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.marshal;

/// Implemented by an enum whose constants marshal as something other than their names.
///
/// ```java
/// enum Size implements EnumValue {
///   SMALL("s"), LARGE("l");
///   private final String v;
///   Size(String v) { this.v = v; }
///   public Object value() { return v; }
/// }
/// ```
///
/// Values must be distinct scalars (`String`, `Number` or `Boolean`).
public interface EnumValue {
  Object value();
}
