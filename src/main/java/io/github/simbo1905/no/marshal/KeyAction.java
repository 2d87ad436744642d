// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.marshal;

import java.util.Arrays;

/// What a load routine does with input keys that no field maps. The process wide default is read
/// from the system property `no.framework.Marshaller.OnUnknownKey` and is [#IGNORE] when unset.
public enum KeyAction {
  /// Drop unknown keys silently.
  IGNORE,
  /// Log unknown keys at WARNING and carry on.
  WARN,
  /// Fail the load with [UnknownKeyException].
  RAISE;

  static final String PROPERTY = "no.framework.Marshaller.OnUnknownKey";

  static KeyAction fromSystemProperty() {
    final String action = System.getProperty(PROPERTY, "IGNORE").toUpperCase();
    try {
      return KeyAction.valueOf(action);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid " + PROPERTY + ": " + action + ". Must be one of: " +
          Arrays.toString(KeyAction.values()), e);
    }
  }
}
