// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.marshal;

/// A fixed tuple was loaded from a sequence of the wrong arity.
public class LengthMismatchException extends TypeMismatchException {

  private final int expectedLength;
  private final int actualLength;

  public LengthMismatchException(Class<?> tupleType, int expectedLength, int actualLength, Object value) {
    super(tupleType.getSimpleName() + " expects exactly " + expectedLength + " elements but got " + actualLength,
        "sequence of length " + expectedLength, value);
    this.expectedLength = expectedLength;
    this.actualLength = actualLength;
  }

  public int expectedLength() {
    return expectedLength;
  }

  public int actualLength() {
    return actualLength;
  }
}
