// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.marshal;

import java.util.List;

/// A date or time string matched neither the ISO-8601 form nor any configured pattern.
public class PatternParseException extends MarshalException {

  private final List<String> patternsTried;

  public PatternParseException(Class<?> target, Object value, List<String> patternsTried, Throwable lastFailure) {
    super("Cannot parse " + target.getSimpleName() + "; patterns tried: " + patternsTried, value, lastFailure);
    this.patternsTried = List.copyOf(patternsTried);
  }

  public List<String> patternsTried() {
    return patternsTried;
  }
}
