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

public class AggregateErrorsTest {

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  public record Inner(int n) {
  }

  public record Form(int age, String name, Inner inner) {
  }

  public record Item(int n) {
  }

  public record Order(List<Item> items, Map<String, Item> byName) {
  }

  @Meta(collectAllErrors = true, onUnknownKey = KeyAction.RAISE)
  public record StrictForm(int age, String name) {
  }

  private static final MarshalConfig COLLECT = MarshalConfig.builder().collectAllErrors(true).build();

  @Test
  void everyFieldErrorIsReported() {
    final Marshaller<Form> marshaller = Marshaller.forClass(Form.class, COLLECT);

    assertThatThrownBy(() -> marshaller.load(Map.of("age", "old", "inner", Map.of("n", "many"))))
        .isInstanceOf(AggregateMarshalException.class)
        .satisfies(e -> {
          final var aggregate = (AggregateMarshalException) e;
          assertThat(aggregate.errors()).hasSize(3);
          assertThat(aggregate.errors().get(0)).isInstanceOf(TypeMismatchException.class);
          assertThat(aggregate.errors().get(0).path()).containsExactly("Form.age");
          assertThat(aggregate.errors().get(1)).isInstanceOf(TypeMismatchException.class);
          assertThat(aggregate.errors().get(1).path()).containsExactly("Form.inner", "Inner.n");
          assertThat(aggregate.errors().get(2)).isInstanceOf(MissingFieldException.class);
          assertThat(((MissingFieldException) aggregate.errors().get(2)).missingFields()).containsExactly("name");
          assertThat(aggregate.getSuppressed()).hasSize(3);
          assertThat(aggregate.getMessage()).startsWith("3 error(s) loading Form");
        });
  }

  @Test
  void firstErrorWinsByDefault() {
    assertThatThrownBy(() -> Marshaller.forClass(Form.class).load(Map.of("age", "old", "inner", Map.of("n", "many"))))
        .isInstanceOf(TypeMismatchException.class)
        .satisfies(e -> assertThat(((MarshalException) e).path()).containsExactly("Form.age"));
  }

  @Test
  void unknownKeysJoinTheAggregate() {
    assertThatThrownBy(() -> Marshaller.forClass(StrictForm.class).load(Map.of("age", "x", "extra", 1)))
        .isInstanceOf(AggregateMarshalException.class)
        .satisfies(e -> assertThat(((AggregateMarshalException) e).errors())
            .extracting(Object::getClass)
            .containsExactly(TypeMismatchException.class, MissingFieldException.class, UnknownKeyException.class));
  }

  @Test
  void validInputLoadsNormally() {
    assertThat(Marshaller.forClass(Form.class, COLLECT).load(Map.of("age", 3, "name", "n", "inner", Map.of("n", 1))))
        .isEqualTo(new Form(3, "n", new Inner(1)));
  }

  @Test
  void collectedErrorsKeepContainerSegments() {
    final Map<String, Object> input = Map.of(
        "items", List.of(Map.of("n", 1), Map.of("n", "x")),
        "byName", Map.of("b", Map.of("n", "y")));

    assertThatThrownBy(() -> Marshaller.forClass(Order.class, COLLECT).load(input))
        .isInstanceOf(AggregateMarshalException.class)
        .satisfies(e -> assertThat(((AggregateMarshalException) e).errors())
            .extracting(MarshalException::path)
            .containsExactly(
                List.of("Order.items", "[1]", "Item.n"),
                List.of("Order.byName", "[\"b\"]", "Item.n")));
    assertThatThrownBy(() -> Marshaller.forClass(Order.class).load(input))
        .isInstanceOf(TypeMismatchException.class)
        .satisfies(e -> assertThat(((MarshalException) e).path()).containsExactly("Order.items", "[1]", "Item.n"));
  }
}
