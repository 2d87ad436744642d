// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.marshal;

import io.github.simbo1905.LoggingControl;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.*;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class TemporalTest {

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  public record Event(LocalDate day, @Pattern({"dd/MM/yyyy", "yyyyMMdd"}) LocalDate alt, Instant at,
                      Duration took) {
  }

  public record Stamps(Instant instant, OffsetDateTime offset, ZonedDateTime zoned, LocalDateTime local,
                       LocalDate date, LocalTime time) {
  }

  public record Schedule(List<@Pattern("HH.mm") LocalTime> slots) {
  }

  public record Plain(LocalDate day) {
  }

  @Test
  void isoTextLoads() {
    final Event event = Marshaller.forClass(Event.class).load(Map.of(
        "day", "2024-01-02", "alt", "2024-03-04", "at", "2024-01-02T10:15:30Z", "took", "PT1M30S"));

    assertThat(event).isEqualTo(new Event(LocalDate.of(2024, 1, 2), LocalDate.of(2024, 3, 4),
        Instant.parse("2024-01-02T10:15:30Z"), Duration.ofSeconds(90)));
  }

  @Test
  void customPatternsAreTriedAfterIso() {
    final Marshaller<Event> marshaller = Marshaller.forClass(Event.class);
    final Map<String, Object> base = Map.of("day", "2024-01-02", "at", 0, "took", 0);

    assertThat(marshaller.load(with(base, "alt", "02/01/2024")).alt()).isEqualTo(LocalDate.of(2024, 1, 2));
    assertThat(marshaller.load(with(base, "alt", "20240102")).alt()).isEqualTo(LocalDate.of(2024, 1, 2));
  }

  @Test
  void unparseableTextListsThePatternsTried() {
    final Marshaller<Event> marshaller = Marshaller.forClass(Event.class);

    assertThatThrownBy(() -> marshaller.load(Map.of("day", "2024-01-02", "alt", "2024/01/02", "at", 0, "took", 0)))
        .isInstanceOf(PatternParseException.class)
        .satisfies(e -> {
          final var error = (PatternParseException) e;
          assertThat(error.patternsTried()).containsExactly("ISO-8601", "dd/MM/yyyy", "yyyyMMdd");
          assertThat(error.path()).containsExactly("Event.alt");
        });
  }

  @Test
  void numbersAreEpochSeconds() {
    final Event event = Marshaller.forClass(Event.class).load(Map.of(
        "day", 86_400, "alt", "2024-01-01", "at", 1.5, "took", 2.25));

    assertThat(event.day()).isEqualTo(LocalDate.of(1970, 1, 2));
    assertThat(event.at()).isEqualTo(Instant.ofEpochSecond(1, 500_000_000));
    assertThat(event.took()).isEqualTo(Duration.ofMillis(2250));
  }

  @Test
  void instancesPassThrough() {
    final var day = LocalDate.of(2020, 2, 29);
    assertThat(Marshaller.forClass(Plain.class).load(Map.of("day", day)).day()).isSameAs(day);
  }

  @Test
  void configuredPatternsByFieldName() {
    final Marshaller<Plain> marshaller = Marshaller.forClass(Plain.class,
        MarshalConfig.builder().customPatterns("day", "d.M.uuuu").build());

    assertThat(marshaller.load(Map.of("day", "2.1.2024")).day()).isEqualTo(LocalDate.of(2024, 1, 2));
  }

  @Test
  void patternsOnTypeArguments() {
    final Schedule schedule = Marshaller.forClass(Schedule.class).load(Map.of("slots", List.of("09.30", "14:00")));

    assertThat(schedule.slots()).containsExactly(LocalTime.of(9, 30), LocalTime.of(14, 0));
  }

  @Test
  void dumpsIsoByDefault() {
    final var stamps = new Stamps(Instant.parse("2024-01-02T10:15:30Z"),
        OffsetDateTime.parse("2024-01-02T12:15:30+02:00"),
        ZonedDateTime.parse("2024-01-02T10:15:30Z[UTC]"),
        LocalDateTime.parse("2024-01-02T10:15:30"),
        LocalDate.parse("2024-01-02"),
        LocalTime.parse("10:15:30"));

    @SuppressWarnings("unchecked") final var dumped = (Map<String, Object>) Marshaller.forClass(Stamps.class)
        .dump(stamps);

    assertThat(dumped).containsEntry("instant", "2024-01-02T10:15:30Z")
        .containsEntry("offset", "2024-01-02T12:15:30+02:00")
        .containsEntry("local", "2024-01-02T10:15:30")
        .containsEntry("date", "2024-01-02")
        .containsEntry("time", "10:15:30");
    assertThat(Marshaller.forClass(Stamps.class).load(dumped)).isEqualTo(stamps);
  }

  @Test
  void dumpsEpochSecondsWhenAsked() {
    final var stamps = new Stamps(Instant.ofEpochSecond(10, 500_000_000),
        OffsetDateTime.parse("1970-01-01T02:00:20+02:00"),
        ZonedDateTime.parse("1970-01-01T00:00:30Z[UTC]"),
        LocalDateTime.parse("1970-01-01T00:00:40"),
        LocalDate.parse("2024-01-02"),
        LocalTime.parse("10:15:30"));
    final Marshaller<Stamps> marshaller = Marshaller.forClass(Stamps.class,
        MarshalConfig.builder().dateTimeOutput(DateTimeTo.TIMESTAMP).build());

    @SuppressWarnings("unchecked") final var dumped = (Map<String, Object>) marshaller.dump(stamps);

    assertThat(dumped.get("instant")).isEqualTo(new BigDecimal("10.5"));
    assertThat(dumped.get("offset")).isEqualTo(20L);
    assertThat(dumped.get("zoned")).isEqualTo(30L);
    assertThat(dumped.get("local")).isEqualTo(40L);
    assertThat(dumped.get("date")).isEqualTo("2024-01-02");
    assertThat(dumped.get("time")).isEqualTo("10:15:30");
  }

  @Test
  void invalidPatternFailsAtCompile() {
    assertThatThrownBy(() -> Marshaller.forClass(Plain.class,
        MarshalConfig.builder().customPatterns("day", "yyyy-MM-dd'").build()))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Invalid date/time pattern");
  }

  private static Map<String, Object> with(Map<String, Object> base, String key, Object value) {
    final var copy = new LinkedHashMap<>(base);
    copy.put(key, value);
    return copy;
  }
}
