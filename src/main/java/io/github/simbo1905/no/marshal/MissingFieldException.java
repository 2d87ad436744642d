// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.marshal;

import java.util.List;

/// Required fields had no value under any of their candidate keys and no default.
public class MissingFieldException extends MarshalException {

  private final List<String> missingFields;
  private final List<String> keysTried;

  public MissingFieldException(Class<?> recordType, List<String> missingFields, List<String> keysTried, Object input) {
    super(recordType.getSimpleName() + " is missing required fields " + missingFields +
        " (keys tried: " + keysTried + ")", input, null);
    this.missingFields = List.copyOf(missingFields);
    this.keysTried = List.copyOf(keysTried);
  }

  public List<String> missingFields() {
    return missingFields;
  }

  public List<String> keysTried() {
    return keysTried;
  }
}
