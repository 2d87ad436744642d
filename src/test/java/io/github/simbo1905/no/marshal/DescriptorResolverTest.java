// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.marshal;

import io.github.simbo1905.LoggingControl;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.time.LocalDate;
import java.util.*;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class DescriptorResolverTest {

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  public enum Color {RED, GREEN}

  public sealed interface Pet permits Dog, Cat {
  }

  public record Dog(String name) implements Pet {
  }

  public record Cat(int lives) implements Pet {
  }

  public record Box<T>(T value) {
  }

  public record Kitchen(
      List<Optional<@Pattern("dd/MM/yyyy") LocalDate>> dates,
      Map<String, int[]> counts,
      Optional<Object> anything,
      Set<Color> colors,
      Pet pet,
      Box<String> box,
      SortedMap<Integer, Deque<Long>> nested,
      String[][] grid) {
  }

  public record RawBox(Box box) {
  }

  public record Wild(List<?> items) {
  }

  public record Unsupported(Thread thread) {
  }

  public record Good(String name) {
  }

  public record Outer(Good good, Wild wild, List<Unsupported> unsupported) {
  }

  private static String tree(Class<?> owner, int component) {
    return tree(owner, component, Map.of());
  }

  private static String tree(Class<?> owner, int component, Map<TypeVariable<?>, Type> bindings) {
    final var field = RecordSchema.of(owner).fields().get(component);
    return DescriptorResolver.resolve(field, owner, bindings, List.of(), List.of()).toTreeString();
  }

  @Test
  void describesNestedContainers() {
    assertThat(tree(Kitchen.class, 0)).isEqualTo("LIST(OPTIONAL(LocalDate[dd/MM/yyyy]))");
    assertThat(tree(Kitchen.class, 1)).isEqualTo("MAP(String,ARRAY(int))");
    assertThat(tree(Kitchen.class, 2)).isEqualTo("OPTIONAL(ANY)");
    assertThat(tree(Kitchen.class, 3)).isEqualTo("SET(Color[enum])");
    assertThat(tree(Kitchen.class, 4)).isEqualTo("UNION(Dog[record]|Cat[record])");
    assertThat(tree(Kitchen.class, 5)).isEqualTo("Box[record]");
    assertThat(tree(Kitchen.class, 6)).isEqualTo("MAP(Integer,DEQUE(Long))");
    assertThat(tree(Kitchen.class, 7)).isEqualTo("ARRAY(ARRAY(String))");
  }

  @Test
  void boundTypeVariablesResolveToTheirArguments() {
    final Type boxOfString = Kitchen.class.getRecordComponents()[5].getGenericType();
    assertThat(boxOfString).isInstanceOf(ParameterizedType.class);

    assertThat(tree(Box.class, 0, Types.bindings(boxOfString))).isEqualTo("String");
  }

  @Test
  void unboundTypeVariablesAreRejected() {
    assertThatThrownBy(() -> tree(Box.class, 0))
        .isInstanceOf(DescriptorResolutionException.class)
        .satisfies(e -> {
          final var error = (DescriptorResolutionException) e;
          assertThat(error.field()).isEqualTo("Box.value");
          assertThat(error.fragment()).isEqualTo("T");
        });
  }

  @Test
  void rawGenericRecordsAreRejected() {
    assertThatThrownBy(() -> tree(RawBox.class, 0))
        .isInstanceOf(DescriptorResolutionException.class)
        .hasMessageContaining("without type arguments");
  }

  @Test
  void wildcardsAreRejected() {
    assertThatThrownBy(() -> tree(Wild.class, 0))
        .isInstanceOf(DescriptorResolutionException.class)
        .hasMessageContaining("wildcard");
  }

  @Test
  void unknownTypesNeedAHook() {
    assertThatThrownBy(() -> tree(Unsupported.class, 0))
        .isInstanceOf(UnsupportedTypeException.class)
        .hasMessageContaining("java.lang.Thread")
        .hasMessageContaining("TypeHooks.register");
  }

  @Test
  void unsupportedFieldFailsForClassWithItsPath() {
    assertThatThrownBy(() -> Marshaller.forClass(Unsupported.class))
        .isInstanceOf(UnsupportedTypeException.class)
        .satisfies(e -> assertThat(((MarshalException) e).path()).containsExactly("Unsupported.thread"));
  }

  @Test
  void genericRootThroughAField() {
    final Marshaller<Kitchen> marshaller = Marshaller.forClass(Kitchen.class);
    final Map<String, Object> input = new LinkedHashMap<>();
    input.put("dates", Arrays.asList("01/02/2024", null));
    input.put("counts", Map.of("a", List.of(1, 2)));
    input.put("anything", "x");
    input.put("colors", List.of("RED"));
    input.put("pet", Map.of("lives", 3));
    input.put("box", Map.of("value", "boxed"));
    input.put("nested", Map.of("1", List.of(5)));
    input.put("grid", List.of(List.of("a", "b"), List.of("c")));

    final Kitchen kitchen = marshaller.load(input);

    assertThat(kitchen.dates()).containsExactly(Optional.of(LocalDate.of(2024, 2, 1)), Optional.empty());
    assertThat(kitchen.counts().get("a")).containsExactly(1, 2);
    assertThat(kitchen.anything()).contains("x");
    assertThat(kitchen.pet()).isEqualTo(new Cat(3));
    assertThat(kitchen.box()).isEqualTo(new Box<>("boxed"));
    assertThat(kitchen.nested().get(1)).containsExactly(5L);
    assertThat(kitchen.grid()[0]).containsExactly("a", "b");
    assertThat(kitchen.grid()[1]).containsExactly("c");
  }

  @Test
  void validateSchemaCollectsEveryProblem() {
    final List<MarshalException> errors = Marshaller.validateSchema(Outer.class);

    assertThat(errors).hasSize(2);
    assertThat(errors).anySatisfy(e -> assertThat(e).isInstanceOf(DescriptorResolutionException.class)
        .hasMessageContaining("Wild.items"));
    assertThat(errors).anySatisfy(e -> assertThat(e).isInstanceOf(UnsupportedTypeException.class)
        .satisfies(u -> assertThat(((MarshalException) u).path()).containsExactly("Unsupported.thread")));
  }

  @Test
  void validSchemaHasNoErrors() {
    assertThat(Marshaller.validateSchema(Kitchen.class)).isEmpty();
    assertThat(Marshaller.validateSchema(Pet.class)).isEmpty();
  }

  @Test
  void nestedSealedInterfacesAreFlattened() {
    assertThat(DescriptorResolver.leafAlternatives(Pet.class)).containsExactly(Dog.class, Cat.class);
    assertThat(DescriptorResolver.resolveRootUnion(Pet.class).toTreeString()).isEqualTo("UNION(Dog[record]|Cat[record])");
  }
}
