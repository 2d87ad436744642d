// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.marshal;

import io.github.simbo1905.LoggingControl;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ConfigResolverTest {

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  public record Inner(String innerName) {
  }

  @Meta(keyCaseDump = KeyCase.SNAKE)
  public record Outer(String someName, Inner inner) {
  }

  @Meta(keyCaseDump = KeyCase.SNAKE, recursive = false)
  public record Sealed(String someName, Inner inner) {
  }

  @Meta(keyCaseDump = KeyCase.PASCAL)
  public record Pascal(String innerName) {
  }

  @Meta(keyCaseDump = KeyCase.SNAKE)
  public record OwnWins(String someName, Pascal pascal) {
  }

  @Meta(keyCaseLoad = {KeyCase.CAMEL, KeyCase.SNAKE})
  public record Ambiguous(String a) {
  }

  @Meta(tag = "t1", keyCaseDump = KeyCase.KEBAB)
  public record Tagged(String someName) {
  }

  @Test
  void nestedRecordsInheritUnsetOptions() {
    assertThat(Marshaller.forClass(Outer.class).dump(new Outer("a", new Inner("b"))))
        .isEqualTo(Map.of("some_name", "a", "inner", Map.of("inner_name", "b")));
  }

  @Test
  void recursiveFalseStopsPropagation() {
    assertThat(Marshaller.forClass(Sealed.class).dump(new Sealed("a", new Inner("b"))))
        .isEqualTo(Map.of("some_name", "a", "inner", Map.of("innerName", "b")));
  }

  @Test
  void ownMetaBeatsInherited() {
    assertThat(Marshaller.forClass(OwnWins.class).dump(new OwnWins("a", new Pascal("b"))))
        .isEqualTo(Map.of("some_name", "a", "pascal", Map.of("InnerName", "b")));
  }

  @Test
  void callSiteBeatsRootMetaAndFlowsDown() {
    final Marshaller<Outer> marshaller = Marshaller.forClass(Outer.class,
        MarshalConfig.builder().keyCaseDump(KeyCase.KEBAB).build());

    assertThat(marshaller.dump(new Outer("a", new Inner("b"))))
        .isEqualTo(Map.of("some-name", "a", "inner", Map.of("inner-name", "b")));
  }

  @Test
  void metaMembersTakeOneValue() {
    assertThatThrownBy(() -> Marshaller.forClass(Ambiguous.class))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("keyCaseLoad");
  }

  @Test
  void ownConfigurationReadsMeta() {
    final MarshalConfig own = ConfigResolver.own(Tagged.class);

    assertThat(own.tag()).isEqualTo("t1");
    assertThat(own.keyCaseDump()).isEqualTo(KeyCase.KEBAB);
    assertThat(own.keyCaseLoad()).isNull();
    assertThat(ConfigResolver.own(Inner.class)).isEqualTo(MarshalConfig.EMPTY);
  }

  @Test
  void tagAndAliasesAreNeverInherited() {
    final MarshalConfig parent = MarshalConfig.builder()
        .tag("parent")
        .alias("someName", "sn")
        .keyCaseLoad(KeyCase.CAMEL)
        .recursive(false)
        .build()
        .withDefaults();

    final MarshalConfig child = ConfigResolver.resolve(Inner.class, parent);

    assertThat(child.tag()).isNull();
    assertThat(child.fieldAliasesLoad()).isEmpty();
    assertThat(child.keyCaseLoad()).isEqualTo(KeyCase.CAMEL);
    assertThat(child.recursive()).isTrue();
  }

  @Test
  void defaultsFillEveryUnsetOption() {
    final MarshalConfig effective = MarshalConfig.EMPTY.withDefaults();

    assertThat(effective.keyCaseLoad()).isEqualTo(KeyCase.NONE);
    assertThat(effective.keyCaseDump()).isEqualTo(KeyCase.NONE);
    assertThat(effective.tagKey()).isEqualTo(MarshalConfig.DEFAULT_TAG_KEY);
    assertThat(effective.onUnknownKey()).isNotNull();
    assertThat(effective.recursive()).isTrue();
    assertThat(effective.dateTimeOutput()).isEqualTo(DateTimeTo.ISO);
    assertThat(effective.fractionalIntegers()).isEqualTo(FractionalIntegers.ROUND);
    assertThat(effective.collectAllErrors()).isFalse();
    assertThat(effective.tag()).isNull();
    assertThat(effective.skipIf()).isNull();
  }

  @Test
  void overlayPrefersTheTopLayer() {
    final MarshalConfig top = MarshalConfig.builder().keyCaseDump(KeyCase.CAMEL).build();
    final MarshalConfig under = MarshalConfig.builder().keyCaseDump(KeyCase.SNAKE).tag("x").build();

    final MarshalConfig merged = top.overlay(under);

    assertThat(merged.keyCaseDump()).isEqualTo(KeyCase.CAMEL);
    assertThat(merged.tag()).isEqualTo("x");
  }

  @Test
  void configsAreValues() {
    final MarshalConfig a = MarshalConfig.builder().alias("x", "y").customPatterns("d", "yyyy").build();
    final MarshalConfig b = MarshalConfig.builder().alias("x", "y").customPatterns("d", "yyyy").build();

    assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
    assertThat(a.fieldAliasesLoad()).containsEntry("x", List.of(KeyPath.of("y")));
    assertThat(a.toBuilder().tagKey("k").build()).isNotEqualTo(a);
  }

  @Test
  void resolutionIsCached() {
    final MarshalConfig first = ConfigResolver.resolve(Inner.class, MarshalConfig.EMPTY.withDefaults());
    final MarshalConfig second = ConfigResolver.resolve(Inner.class, MarshalConfig.EMPTY.withDefaults());

    assertThat(second).isSameAs(first);
  }
}
