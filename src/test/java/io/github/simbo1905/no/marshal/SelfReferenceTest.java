// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.marshal;

import io.github.simbo1905.LoggingControl;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

public class SelfReferenceTest {

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  public record Node(int value, Optional<Node> next) {
  }

  public record TreeNode(String label, List<TreeNode> children) {
  }

  public record Employee(String name, Optional<Department> department) {
  }

  public record Department(String title, List<Employee> staff) {
  }

  public sealed interface Expr permits Literal, Sum {
  }

  public record Literal(int value) implements Expr {
  }

  public record Sum(Expr left, Expr right) implements Expr {
  }

  @Test
  void linkedListOfNodes() {
    final Marshaller<Node> marshaller = Marshaller.forClass(Node.class);
    final Map<String, Object> input = Map.of("value", 1,
        "next", Map.of("value", 2, "next", Map.of("value", 3)));

    final Node head = marshaller.load(input);

    assertThat(head).isEqualTo(new Node(1, Optional.of(new Node(2, Optional.of(new Node(3, Optional.empty()))))));
    @SuppressWarnings("unchecked") final var dumped = (Map<String, Object>) marshaller.dump(head);
    assertThat(marshaller.load(dumped)).isEqualTo(head);
  }

  @Test
  void longChainsLoad() {
    final Marshaller<Node> marshaller = Marshaller.forClass(Node.class);
    Node chain = new Node(0, Optional.empty());
    for (int i = 1; i < 200; i++) {
      chain = new Node(i, Optional.of(chain));
    }

    assertThat(marshaller.load(marshaller.dump(chain))).isEqualTo(chain);
  }

  @Test
  void treeOfNodes() {
    final Marshaller<TreeNode> marshaller = Marshaller.forClass(TreeNode.class);
    final var tree = new TreeNode("root", List.of(
        new TreeNode("left", List.of()),
        new TreeNode("right", List.of(new TreeNode("leaf", List.of())))));

    final Object dumped = marshaller.dump(tree);

    assertThat(dumped).isEqualTo(Map.of("label", "root", "children", List.of(
        Map.of("label", "left", "children", List.of()),
        Map.of("label", "right", "children", List.of(Map.of("label", "leaf", "children", List.of()))))));
    assertThat(marshaller.load(dumped)).isEqualTo(tree);
  }

  @Test
  void mutuallyRecursiveRecords() {
    final Marshaller<Employee> marshaller = Marshaller.forClass(Employee.class);
    final Map<String, Object> input = Map.of("name", "Ada", "department", Map.of("title", "R&D",
        "staff", List.of(Map.of("name", "Bob"), Map.of("name", "Cy", "department",
            Map.of("title", "Ops", "staff", List.of())))));

    final Employee ada = marshaller.load(input);

    final Department rnd = ada.department().orElseThrow();
    assertThat(rnd.title()).isEqualTo("R&D");
    assertThat(rnd.staff()).extracting(Employee::name).containsExactly("Bob", "Cy");
    assertThat(rnd.staff().get(1).department().orElseThrow().title()).isEqualTo("Ops");
    assertThat(marshaller.load(marshaller.dump(ada))).isEqualTo(ada);
  }

  @Test
  void recursiveSumType() {
    final Marshaller<Expr> marshaller = Marshaller.forClass(Expr.class);
    final Map<String, Object> input = Map.of(
        "left", Map.of("value", 1),
        "right", Map.of("left", Map.of("value", 2), "right", Map.of("value", 3)));

    final Expr expr = marshaller.load(input);

    assertThat(expr).isEqualTo(new Sum(new Literal(1), new Sum(new Literal(2), new Literal(3))));
    assertThat(marshaller.dump(expr)).isEqualTo(input);
  }

  @Test
  void descriptorMarksTheBackReference() {
    final var field = RecordSchema.of(Node.class).fields().get(1);
    final TypeDescriptor descriptor = DescriptorResolver.resolve(field, Node.class, Map.of(), List.of(Node.class),
        List.of());

    assertThat(descriptor.toTreeString()).isEqualTo("OPTIONAL(Node[recursive])");
  }
}
