// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.marshal;

import java.util.List;
import java.util.stream.Collectors;

/// Every field error of one record load, raised when `collectAllErrors` is enabled.
public class AggregateMarshalException extends MarshalException {

  private final List<MarshalException> errors;

  public AggregateMarshalException(Class<?> recordType, List<MarshalException> errors) {
    super(errors.size() + " error(s) loading " + recordType.getSimpleName() + ":\n  " +
        errors.stream().map(MarshalException::getMessage).collect(Collectors.joining("\n  ")));
    this.errors = List.copyOf(errors);
    errors.forEach(this::addSuppressed);
  }

  public List<MarshalException> errors() {
    return errors;
  }
}
