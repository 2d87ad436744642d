// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.marshal;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/// Base of every data or schema error raised while compiling or running a marshalling routine.
///
/// The field path is built from the inside out: each enclosing routine prepends its own segment
/// (`Outer.field`, `[3]`, `{key}`) as the exception travels up, so the final message reads from the
/// root record down to the failing value.
public class MarshalException extends RuntimeException {

  private static final int MAX_VALUE_CHARS = 120;

  private final Deque<String> path = new ArrayDeque<>();
  private final transient Object rawValue;
  private final boolean hasRawValue;

  public MarshalException(String message) {
    super(message);
    this.rawValue = null;
    this.hasRawValue = false;
  }

  public MarshalException(String message, Throwable cause) {
    super(message, cause);
    this.rawValue = null;
    this.hasRawValue = false;
  }

  public MarshalException(String message, Object rawValue, Throwable cause) {
    super(message, cause);
    this.rawValue = rawValue;
    this.hasRawValue = true;
  }

  /// Prepend a path segment and return this same exception for rethrow.
  public MarshalException atPath(String segment) {
    path.addFirst(segment);
    return this;
  }

  /// The field path from the outermost record inward.
  public List<String> path() {
    return List.copyOf(path);
  }

  /// The message without path or value decoration.
  public String detail() {
    return super.getMessage();
  }

  public boolean hasRawValue() {
    return hasRawValue;
  }

  /// The offending dynamic value, or null when there is none or it was null.
  public Object rawValue() {
    return rawValue;
  }

  @Override
  public String getMessage() {
    final var sb = new StringBuilder(detail());
    if (!path.isEmpty()) {
      sb.append(" [at ").append(String.join(" -> ", path)).append(']');
    }
    if (hasRawValue) {
      sb.append(" [value: ").append(abbreviate(rawValue)).append(']');
    }
    return sb.toString();
  }

  static String abbreviate(Object value) {
    final var text = value instanceof String s ? '"' + s + '"' : String.valueOf(value);
    return text.length() <= MAX_VALUE_CHARS ? text : text.substring(0, MAX_VALUE_CHARS) + "...";
  }
}
