// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.marshal;

import io.github.simbo1905.no.marshal.TypeDescriptor.TemporalKind;

import java.math.BigDecimal;
import java.time.*;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/// Date, time and duration loading and dumping.
///
/// Text is parsed as ISO-8601 first and then with each custom pattern in declaration order. Numbers
/// are epoch seconds in UTC, or plain seconds for a [Duration].
final class Temporals {

  static final String ISO = "ISO-8601";

  private Temporals() {
  }

  static List<DateTimeFormatter> formatters(List<String> patterns) {
    final List<DateTimeFormatter> formatters = new ArrayList<>(patterns.size());
    for (String pattern : patterns) {
      try {
        formatters.add(DateTimeFormatter.ofPattern(pattern));
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException("Invalid date/time pattern '" + pattern + "': " + e.getMessage(), e);
      }
    }
    return List.copyOf(formatters);
  }

  static Object load(TemporalKind kind, Class<?> type, List<String> patterns, List<DateTimeFormatter> formatters,
                     Object value) {
    if (type.isInstance(value)) {
      return value;
    }
    if (value instanceof Number number) {
      return fromSeconds(kind, type, number);
    }
    if (!(value instanceof CharSequence chars)) {
      throw new TypeMismatchException(type.getSimpleName(), value);
    }
    final String text = chars.toString().trim();
    DateTimeException last;
    try {
      return parseIso(kind, text);
    } catch (DateTimeException e) {
      last = e;
    }
    for (DateTimeFormatter formatter : formatters) {
      try {
        return parse(kind, text, formatter);
      } catch (DateTimeException e) {
        last = e;
      }
    }
    final List<String> tried = new ArrayList<>(patterns.size() + 1);
    tried.add(ISO);
    tried.addAll(patterns);
    throw new PatternParseException(type, value, tried, last);
  }

  static Object dump(TemporalKind kind, DateTimeTo output, Object value) {
    if (output == DateTimeTo.TIMESTAMP) {
      switch (kind) {
        case INSTANT -> {
          final Instant instant = (Instant) value;
          return seconds(instant.getEpochSecond(), instant.getNano());
        }
        case OFFSET_DATE_TIME -> {
          final OffsetDateTime odt = (OffsetDateTime) value;
          return seconds(odt.toEpochSecond(), odt.getNano());
        }
        case ZONED_DATE_TIME -> {
          final ZonedDateTime zdt = (ZonedDateTime) value;
          return seconds(zdt.toEpochSecond(), zdt.getNano());
        }
        case DATE_TIME -> {
          final LocalDateTime ldt = (LocalDateTime) value;
          return seconds(ldt.toEpochSecond(ZoneOffset.UTC), ldt.getNano());
        }
        default -> {
          // dates, times and durations have no timestamp form
        }
      }
    }
    return value.toString();
  }

  private static Number seconds(long epochSecond, int nanos) {
    if (nanos == 0) {
      return epochSecond;
    }
    return BigDecimal.valueOf(epochSecond).add(BigDecimal.valueOf(nanos, 9)).stripTrailingZeros();
  }

  private static Object fromSeconds(TemporalKind kind, Class<?> type, Number number) {
    if ((number instanceof Double || number instanceof Float) && !Double.isFinite(number.doubleValue())) {
      throw new TypeMismatchException(type.getSimpleName(), number);
    }
    final BigDecimal exact = new BigDecimal(number.toString());
    final long seconds = exact.longValue();
    final long nanos = exact.subtract(BigDecimal.valueOf(seconds)).movePointRight(9).longValue();
    if (kind == TemporalKind.DURATION) {
      return Duration.ofSeconds(seconds, nanos);
    }
    final Instant instant = Instant.ofEpochSecond(seconds, nanos);
    return switch (kind) {
      case INSTANT -> instant;
      case DATE -> LocalDate.ofInstant(instant, ZoneOffset.UTC);
      case TIME -> LocalTime.ofInstant(instant, ZoneOffset.UTC);
      case DATE_TIME -> LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
      case OFFSET_DATE_TIME -> OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
      case ZONED_DATE_TIME -> ZonedDateTime.ofInstant(instant, ZoneOffset.UTC);
      case DURATION -> throw new IllegalStateException("unreachable");
    };
  }

  private static Object parseIso(TemporalKind kind, String text) {
    return switch (kind) {
      case DATE -> LocalDate.parse(text);
      case TIME -> LocalTime.parse(text);
      case DATE_TIME -> LocalDateTime.parse(text);
      case OFFSET_DATE_TIME -> OffsetDateTime.parse(text);
      case ZONED_DATE_TIME -> ZonedDateTime.parse(text);
      case INSTANT -> Instant.parse(text);
      case DURATION -> Duration.parse(text);
    };
  }

  private static Object parse(TemporalKind kind, String text, DateTimeFormatter formatter) {
    return switch (kind) {
      case DATE -> LocalDate.parse(text, formatter);
      case TIME -> LocalTime.parse(text, formatter);
      case DATE_TIME -> LocalDateTime.parse(text, formatter);
      case OFFSET_DATE_TIME -> OffsetDateTime.parse(text, formatter);
      case ZONED_DATE_TIME -> ZonedDateTime.parse(text, formatter);
      case INSTANT -> Instant.from(formatter.withZone(ZoneOffset.UTC).parse(text));
      case DURATION -> throw new DateTimeException("Durations are only read as ISO-8601 or seconds");
    };
  }
}
