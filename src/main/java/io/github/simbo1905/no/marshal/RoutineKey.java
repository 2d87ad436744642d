// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.marshal;

import java.lang.reflect.Type;
import java.util.Objects;

/// Cache key: a record type, possibly parameterized, and its effective configuration.
record RoutineKey(Type recordType, MarshalConfig config) {
  RoutineKey {
    Objects.requireNonNull(recordType, "recordType must not be null");
    Objects.requireNonNull(config, "config must not be null");
  }

  Class<?> rawType() {
    return Types.rawClass(recordType);
  }

  @Override
  public String toString() {
    return recordType.getTypeName() + "@" + Integer.toHexString(config.hashCode());
  }
}
