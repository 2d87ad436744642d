// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.marshal;

/// A dynamic value does not coerce to the expected scalar or shape.
public class TypeMismatchException extends MarshalException {

  private final String expected;

  public TypeMismatchException(String expected, Object value) {
    this(expected, value, null);
  }

  public TypeMismatchException(String expected, Object value, Throwable cause) {
    super("Expected " + expected + " but got " + describe(value) +
        (cause != null && cause.getMessage() != null ? ": " + cause.getMessage() : ""), value, cause);
    this.expected = expected;
  }

  protected TypeMismatchException(String message, String expected, Object value) {
    super(message, value, null);
    this.expected = expected;
  }

  public String expected() {
    return expected;
  }

  static String describe(Object value) {
    return value == null ? "null" : value.getClass().getSimpleName();
  }
}
