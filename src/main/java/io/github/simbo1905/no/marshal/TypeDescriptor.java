// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.marshal;

import java.lang.reflect.Type;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/// Canonical, immutable description of a declared component type, built once per record when its
/// routines are compiled. Every node is one origin [Kind] and composes its type arguments as child
/// descriptors. The [Position] carries compile-time bookkeeping only.
public sealed interface TypeDescriptor permits
    TypeDescriptor.ScalarNode, TypeDescriptor.TemporalNode, TypeDescriptor.OptionalNode,
    TypeDescriptor.SequenceNode, TypeDescriptor.MappingNode, TypeDescriptor.TupleNode,
    TypeDescriptor.EnumNode, TypeDescriptor.RecordNode, TypeDescriptor.UnionNode,
    TypeDescriptor.AnyNode, TypeDescriptor.CustomNode {

  /// Origin kinds, one handler each.
  enum Kind {
    PRIMITIVE, TEMPORAL, OPTIONAL, COLLECTION, MAPPING, TUPLE, ENUM, RECORD, SUM, ANY, CUSTOM
  }

  enum ScalarKind {
    BOOLEAN, BYTE, SHORT, INT, LONG, FLOAT, DOUBLE, CHAR, STRING, BIG_INTEGER, BIG_DECIMAL, BYTES, UUID, PATH
  }

  enum TemporalKind {
    DATE, TIME, DATE_TIME, OFFSET_DATE_TIME, ZONED_DATE_TIME, INSTANT, DURATION
  }

  enum SequenceKind {
    LIST, SET, SORTED_SET, DEQUE, ARRAY
  }

  /// `iteration` is unique within one component's expansion, `fieldOrdinal` is the component's index
  /// in its record, and `inOptional` marks the direct child of an `Optional`.
  record Position(int iteration, int fieldOrdinal, boolean inOptional) {
    public Position {
      if (iteration < 0 || fieldOrdinal < 0) {
        throw new IllegalArgumentException("Position indices must not be negative: " + iteration + "," + fieldOrdinal);
      }
    }
  }

  Kind kind();

  Position position();

  /// The Java type this node describes, for diagnostics.
  Type javaType();

  /// Compact rendering such as `LIST(OPTIONAL(LocalDate[dd/MM/yyyy]))`.
  String toTreeString();

  record ScalarNode(ScalarKind scalar, Class<?> javaType, Position position) implements TypeDescriptor {
    public ScalarNode {
      Objects.requireNonNull(scalar, "Scalar kind cannot be null");
      Objects.requireNonNull(javaType, "Java type cannot be null");
      Objects.requireNonNull(position, "Position cannot be null");
    }

    @Override
    public Kind kind() {
      return Kind.PRIMITIVE;
    }

    @Override
    public String toTreeString() {
      return javaType.getSimpleName();
    }
  }

  record TemporalNode(TemporalKind temporal, Class<?> javaType, List<String> patterns, Position position)
      implements TypeDescriptor {
    public TemporalNode {
      Objects.requireNonNull(temporal, "Temporal kind cannot be null");
      Objects.requireNonNull(javaType, "Java type cannot be null");
      patterns = List.copyOf(patterns);
      Objects.requireNonNull(position, "Position cannot be null");
    }

    @Override
    public Kind kind() {
      return Kind.TEMPORAL;
    }

    @Override
    public String toTreeString() {
      return patterns.isEmpty() ? javaType.getSimpleName() : javaType.getSimpleName() + patterns;
    }
  }

  record OptionalNode(TypeDescriptor wrapped, Type javaType, Position position) implements TypeDescriptor {
    public OptionalNode {
      Objects.requireNonNull(wrapped, "Optional wrapped type cannot be null");
      Objects.requireNonNull(javaType, "Java type cannot be null");
      Objects.requireNonNull(position, "Position cannot be null");
    }

    @Override
    public Kind kind() {
      return Kind.OPTIONAL;
    }

    @Override
    public String toTreeString() {
      return "OPTIONAL(" + wrapped.toTreeString() + ")";
    }
  }

  /// `containerType` is the declared raw class (e.g. `Set`, `TreeSet`, `int[]`).
  record SequenceNode(SequenceKind sequence, Class<?> containerType, TypeDescriptor element, Type javaType,
                      Position position) implements TypeDescriptor {
    public SequenceNode {
      Objects.requireNonNull(sequence, "Sequence kind cannot be null");
      Objects.requireNonNull(containerType, "Container type cannot be null");
      Objects.requireNonNull(element, "Element type cannot be null");
      Objects.requireNonNull(javaType, "Java type cannot be null");
      Objects.requireNonNull(position, "Position cannot be null");
    }

    @Override
    public Kind kind() {
      return Kind.COLLECTION;
    }

    @Override
    public String toTreeString() {
      return sequence + "(" + element.toTreeString() + ")";
    }
  }

  record MappingNode(Class<?> containerType, TypeDescriptor key, TypeDescriptor value, Type javaType,
                     Position position) implements TypeDescriptor {
    public MappingNode {
      Objects.requireNonNull(containerType, "Container type cannot be null");
      Objects.requireNonNull(key, "Map key type cannot be null");
      Objects.requireNonNull(value, "Map value type cannot be null");
      Objects.requireNonNull(javaType, "Java type cannot be null");
      Objects.requireNonNull(position, "Position cannot be null");
    }

    @Override
    public Kind kind() {
      return Kind.MAPPING;
    }

    @Override
    public String toTreeString() {
      return "MAP(" + key.toTreeString() + "," + value.toTreeString() + ")";
    }
  }

  /// A `@Tuple` record: fixed arity, one descriptor per component in declaration order.
  record TupleNode(Class<?> recordType, List<String> names, List<TypeDescriptor> elements, Type javaType,
                   Position position) implements TypeDescriptor {
    public TupleNode {
      Objects.requireNonNull(recordType, "Record type cannot be null");
      names = List.copyOf(names);
      elements = List.copyOf(elements);
      if (names.size() != elements.size()) {
        throw new IllegalArgumentException("Tuple names and elements differ in size: " + names + " " + elements);
      }
      Objects.requireNonNull(javaType, "Java type cannot be null");
      Objects.requireNonNull(position, "Position cannot be null");
    }

    @Override
    public Kind kind() {
      return Kind.TUPLE;
    }

    @Override
    public String toTreeString() {
      return "TUPLE(" + elements.stream().map(TypeDescriptor::toTreeString).collect(Collectors.joining(",")) + ")";
    }
  }

  record EnumNode(Class<?> javaType, Position position) implements TypeDescriptor {
    public EnumNode {
      Objects.requireNonNull(javaType, "Java type cannot be null");
      if (!javaType.isEnum()) {
        throw new IllegalArgumentException("Not an enum: " + javaType);
      }
      Objects.requireNonNull(position, "Position cannot be null");
    }

    @Override
    public Kind kind() {
      return Kind.ENUM;
    }

    @Override
    public String toTreeString() {
      return javaType.getSimpleName() + "[enum]";
    }
  }

  /// A nested record compiled into its own routine. `recursive` marks a record that is already
  /// being compiled further up, which is reached through a late-bound call.
  record RecordNode(Type javaType, Class<?> recordType, boolean recursive, Position position)
      implements TypeDescriptor {
    public RecordNode {
      Objects.requireNonNull(javaType, "Java type cannot be null");
      Objects.requireNonNull(recordType, "Record type cannot be null");
      Objects.requireNonNull(position, "Position cannot be null");
    }

    @Override
    public Kind kind() {
      return Kind.RECORD;
    }

    @Override
    public String toTreeString() {
      return recordType.getSimpleName() + (recursive ? "[recursive]" : "[record]");
    }
  }

  /// A sealed hierarchy or `@OneOf` union; alternatives keep declaration order.
  record UnionNode(Type javaType, List<TypeDescriptor> alternatives, Position position) implements TypeDescriptor {
    public UnionNode {
      Objects.requireNonNull(javaType, "Java type cannot be null");
      alternatives = List.copyOf(alternatives);
      if (alternatives.isEmpty()) {
        throw new IllegalArgumentException("A union needs at least one alternative: " + javaType);
      }
      Objects.requireNonNull(position, "Position cannot be null");
    }

    @Override
    public Kind kind() {
      return Kind.SUM;
    }

    @Override
    public String toTreeString() {
      return "UNION(" + alternatives.stream().map(TypeDescriptor::toTreeString).collect(Collectors.joining("|")) + ")";
    }
  }

  record AnyNode(Position position) implements TypeDescriptor {
    public AnyNode {
      Objects.requireNonNull(position, "Position cannot be null");
    }

    @Override
    public Kind kind() {
      return Kind.ANY;
    }

    @Override
    public Type javaType() {
      return Object.class;
    }

    @Override
    public String toTreeString() {
      return "ANY";
    }
  }

  /// A type with a [TypeHook]. `builtin` is the descriptor the type would have without the hook,
  /// used for a direction the hook leaves out; it is null when there is none.
  record CustomNode(Class<?> javaType, TypeHook hook, TypeDescriptor builtin, Position position)
      implements TypeDescriptor {
    public CustomNode {
      Objects.requireNonNull(javaType, "Java type cannot be null");
      Objects.requireNonNull(hook, "Hook cannot be null");
      Objects.requireNonNull(position, "Position cannot be null");
    }

    @Override
    public Kind kind() {
      return Kind.CUSTOM;
    }

    @Override
    public String toTreeString() {
      return javaType.getSimpleName() + "[hook]";
    }
  }
}
