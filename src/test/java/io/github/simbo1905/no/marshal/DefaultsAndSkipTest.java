// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.marshal;

import io.github.simbo1905.LoggingControl;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.*;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class DefaultsAndSkipTest {

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  public enum Color {RED, GREEN}

  public static final class DefaultTags implements Supplier<List<String>> {
    @Override
    public List<String> get() {
      return new ArrayList<>(List.of("new"));
    }
  }

  public record Settings(String host,
                         @Default("8080") int port,
                         @Default("GREEN") Color color,
                         @Default("guest") Optional<String> user,
                         Optional<String> note,
                         @DefaultFactory(DefaultTags.class) List<String> tags) {
  }

  public record BadDefault(@Default("eighty") int port) {
  }

  public record Both(@Default("1") @DefaultFactory(DefaultTags.class) List<String> tags) {
  }

  public record Account(String user,
                        @Skip String password,
                        @SkipIf(op = SkipCondition.Op.EQ, value = "0") int retries,
                        @SkipIf(op = SkipCondition.Op.IS_NULL) Optional<String> nick,
                        @SkipIf(op = SkipCondition.Op.GT, value = "100") long score) {
  }

  public record Sparse(String a, String b, List<String> c) {
  }

  @Test
  void absentFieldsTakeTheirDefaults() {
    final Settings settings = Marshaller.forClass(Settings.class).load(Map.of("host", "localhost"));

    assertThat(settings).isEqualTo(new Settings("localhost", 8080, Color.GREEN, Optional.of("guest"),
        Optional.empty(), List.of("new")));
  }

  @Test
  void presentValuesBeatDefaults() {
    final Settings settings = Marshaller.forClass(Settings.class).load(Map.of("host", "h", "port", "9090",
        "color", "RED", "user", "root", "note", "hi", "tags", List.of()));

    assertThat(settings).isEqualTo(new Settings("h", 9090, Color.RED, Optional.of("root"), Optional.of("hi"),
        List.of()));
  }

  @Test
  void factoriesRunOnEveryLoad() {
    final Marshaller<Settings> marshaller = Marshaller.forClass(Settings.class);

    final Settings first = marshaller.load(Map.of("host", "a"));
    final Settings second = marshaller.load(Map.of("host", "b"));

    assertThat(first.tags()).isEqualTo(second.tags()).isNotSameAs(second.tags());
  }

  @Test
  void explicitNullIsNotAbsent() {
    final Map<String, Object> input = new HashMap<>();
    input.put("host", "h");
    input.put("user", null);

    assertThat(Marshaller.forClass(Settings.class).load(input).user()).isEmpty();
  }

  @Test
  void defaultsThatDoNotLoadFailAtCompile() {
    assertThatThrownBy(() -> Marshaller.forClass(BadDefault.class))
        .isInstanceOf(MarshalException.class)
        .hasMessageContaining("@Default value 'eighty'")
        .hasMessageContaining("BadDefault.port");
  }

  @Test
  void defaultAndFactoryAreExclusive() {
    assertThatThrownBy(() -> Marshaller.forClass(Both.class))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("both @Default and @DefaultFactory");
  }

  @Test
  void skipAndSkipIf() {
    final Marshaller<Account> marshaller = Marshaller.forClass(Account.class);

    assertThat(marshaller.dump(new Account("ann", "secret", 0, Optional.empty(), 5)))
        .isEqualTo(Map.of("user", "ann", "score", 5L));
    assertThat(marshaller.dump(new Account("ann", "secret", 2, Optional.of("a"), 500)))
        .isEqualTo(Map.of("user", "ann", "retries", 2, "nick", "a"));
  }

  @Test
  void skippedFieldsStillLoad() {
    final Account account = Marshaller.forClass(Account.class).load(Map.of("user", "u", "password", "p",
        "retries", 1, "score", 0));

    assertThat(account.password()).isEqualTo("p");
    assertThat(account.nick()).isEmpty();
  }

  @Test
  void configuredSkipIfAppliesToEveryField() {
    final Marshaller<Sparse> marshaller = Marshaller.forClass(Sparse.class,
        MarshalConfig.builder().skipIf(SkipCondition.isFalsy()).build());

    assertThat(marshaller.dump(new Sparse("x", null, List.of()))).isEqualTo(Map.of("a", "x"));
    assertThat(marshaller.dump(new Sparse("", "y", List.of("z")))).isEqualTo(Map.of("b", "y", "c", List.of("z")));
  }

  @Test
  void nullsAreWrittenWithoutSkipRules() {
    @SuppressWarnings("unchecked") final var dumped = (Map<String, Object>) Marshaller.forClass(Sparse.class)
        .dump(new Sparse("x", null, null));

    assertThat(dumped).containsOnlyKeys("a", "b", "c");
    assertThat(dumped.get("b")).isNull();
  }

  @Test
  void skipDefaultsLeavesOutDefaultValues() {
    final Marshaller<Settings> marshaller = Marshaller.forClass(Settings.class,
        MarshalConfig.builder().skipDefaults(true).build());

    assertThat(marshaller.dump(new Settings("h", 8080, Color.GREEN, Optional.of("guest"), Optional.empty(),
        List.of("new")))).isEqualTo(Map.of("host", "h"));
    assertThat(marshaller.dump(new Settings("h", 1, Color.RED, Optional.of("x"), Optional.of("n"), List.of())))
        .isEqualTo(Map.of("host", "h", "port", 1, "color", "RED", "user", "x", "note", "n", "tags", List.of()));
  }

  @Test
  void skipDefaultsIfNarrowsWhichDefaultsAreLeftOut() {
    final Marshaller<Settings> marshaller = Marshaller.forClass(Settings.class,
        MarshalConfig.builder().skipDefaultsIf(SkipCondition.isNotNull()).build());

    @SuppressWarnings("unchecked") final var dumped = (Map<String, Object>) marshaller.dump(
        new Settings("h", 8080, Color.RED, Optional.empty(), Optional.empty(), List.of()));

    assertThat(dumped).containsOnlyKeys("host", "color", "user", "note", "tags");
  }

  @Test
  void skipConditions() {
    assertThat(SkipCondition.gt(5).test(7)).isTrue();
    assertThat(SkipCondition.gt(5).test(5L)).isFalse();
    assertThat(SkipCondition.ge(5).test(5.0)).isTrue();
    assertThat(SkipCondition.eq(1).test(1.0)).isTrue();
    assertThat(SkipCondition.ne("a").test("b")).isTrue();
    assertThat(SkipCondition.lt("b").test("a")).isTrue();
    assertThat(SkipCondition.lt(3).test("a")).isFalse();
    assertThat(SkipCondition.gt(LocalDate.of(2024, 1, 1)).test(LocalDate.of(2024, 6, 1))).isTrue();
    assertThat(SkipCondition.le(LocalDate.of(2024, 1, 1)).test(LocalDate.of(2024, 6, 1))).isFalse();
    assertThat(SkipCondition.lt(LocalDate.of(2024, 1, 1)).test("2023-01-01")).isFalse();
    assertThat(SkipCondition.isNull().test(Optional.empty())).isTrue();
    assertThat(SkipCondition.isTruthy().test(List.of())).isFalse();
    assertThat(SkipCondition.isFalsy().test("")).isTrue();
    assertThat(SkipCondition.isFalsy().test(0.0)).isTrue();
    assertThat(SkipCondition.isTruthy().test(new int[]{1})).isTrue();
    assertThatThrownBy(() -> new SkipCondition(SkipCondition.Op.EQ, null))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
