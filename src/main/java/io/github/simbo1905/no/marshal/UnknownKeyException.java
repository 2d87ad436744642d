// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.marshal;

import java.util.List;

/// Raised under [KeyAction#RAISE] when an input map holds keys that no field maps.
public class UnknownKeyException extends MarshalException {

  private final List<String> unknownKeys;
  private final List<String> knownFields;

  public UnknownKeyException(Class<?> recordType, List<String> unknownKeys, List<String> knownFields) {
    super("One or more keys are not mapped to the schema of " + recordType.getSimpleName() +
        ". Unknown keys: " + unknownKeys + ", known fields: " + knownFields);
    this.unknownKeys = List.copyOf(unknownKeys);
    this.knownFields = List.copyOf(knownFields);
  }

  public List<String> unknownKeys() {
    return unknownKeys;
  }

  public List<String> knownFields() {
    return knownFields;
  }
}
