// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.marshal;

import java.lang.reflect.Type;

/// No built-in handler and no [TypeHooks] entry exists for a declared type.
public class UnsupportedTypeException extends MarshalException {

  private final transient Type type;

  public UnsupportedTypeException(Type type) {
    super("No handler and no registered hook for type " + type.getTypeName() +
        ". Register one with TypeHooks.register(...)");
    this.type = type;
  }

  public UnsupportedTypeException(Type type, String reason) {
    super("Unsupported type " + type.getTypeName() + ": " + reason);
    this.type = type;
  }

  public Type type() {
    return type;
  }
}
