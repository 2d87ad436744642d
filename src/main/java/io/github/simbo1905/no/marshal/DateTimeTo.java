// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.marshal;

/// Output form of instant-like values on dump.
public enum DateTimeTo {
  /// ISO-8601 text such as `2025-01-31T10:15:30Z`.
  ISO,
  /// Epoch seconds as a `Long`. Applies to `Instant`, `OffsetDateTime`, `ZonedDateTime` and
  /// `LocalDateTime` (read as UTC); dates, times and durations stay ISO.
  TIMESTAMP
}
