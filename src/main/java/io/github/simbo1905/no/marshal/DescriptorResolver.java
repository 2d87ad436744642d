// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.marshal;

import io.github.simbo1905.no.marshal.RecordSchema.FieldSchema;
import io.github.simbo1905.no.marshal.TypeDescriptor.*;
import org.jetbrains.annotations.NotNull;

import java.lang.reflect.*;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.file.Path;
import java.time.*;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import static io.github.simbo1905.no.marshal.Marshaller.LOGGER;

/// Recursive descent over a component's declared [AnnotatedType], producing its [TypeDescriptor].
///
/// `Optional` becomes an [OptionalNode] whose child is flagged as in-optional. Type-use metadata
/// ([Pattern], [OneOf]) is read off the annotated type and folded into the node it decorates.
/// Type variables are replaced with the bindings of the parameterized record being compiled; one
/// without a binding, or a wildcard, is a [DescriptorResolutionException]. A nested record that is
/// already being compiled further up becomes a recursive [RecordNode] instead of being expanded.
final class DescriptorResolver {

  static final Map<Class<?>, ScalarKind> SCALARS = Map.ofEntries(
      Map.entry(boolean.class, ScalarKind.BOOLEAN), Map.entry(Boolean.class, ScalarKind.BOOLEAN),
      Map.entry(byte.class, ScalarKind.BYTE), Map.entry(Byte.class, ScalarKind.BYTE),
      Map.entry(short.class, ScalarKind.SHORT), Map.entry(Short.class, ScalarKind.SHORT),
      Map.entry(int.class, ScalarKind.INT), Map.entry(Integer.class, ScalarKind.INT),
      Map.entry(long.class, ScalarKind.LONG), Map.entry(Long.class, ScalarKind.LONG),
      Map.entry(float.class, ScalarKind.FLOAT), Map.entry(Float.class, ScalarKind.FLOAT),
      Map.entry(double.class, ScalarKind.DOUBLE), Map.entry(Double.class, ScalarKind.DOUBLE),
      Map.entry(char.class, ScalarKind.CHAR), Map.entry(Character.class, ScalarKind.CHAR),
      Map.entry(String.class, ScalarKind.STRING),
      Map.entry(BigInteger.class, ScalarKind.BIG_INTEGER),
      Map.entry(BigDecimal.class, ScalarKind.BIG_DECIMAL),
      Map.entry(byte[].class, ScalarKind.BYTES),
      Map.entry(UUID.class, ScalarKind.UUID),
      Map.entry(Path.class, ScalarKind.PATH));

  static final Map<Class<?>, TemporalKind> TEMPORALS = Map.of(
      LocalDate.class, TemporalKind.DATE,
      LocalTime.class, TemporalKind.TIME,
      LocalDateTime.class, TemporalKind.DATE_TIME,
      OffsetDateTime.class, TemporalKind.OFFSET_DATE_TIME,
      ZonedDateTime.class, TemporalKind.ZONED_DATE_TIME,
      Instant.class, TemporalKind.INSTANT,
      Duration.class, TemporalKind.DURATION);

  private static final Map<Class<?>, SequenceKind> SEQUENCES = Map.ofEntries(
      Map.entry(Iterable.class, SequenceKind.LIST), Map.entry(Collection.class, SequenceKind.LIST),
      Map.entry(List.class, SequenceKind.LIST), Map.entry(ArrayList.class, SequenceKind.LIST),
      Map.entry(LinkedList.class, SequenceKind.LIST),
      Map.entry(Set.class, SequenceKind.SET), Map.entry(HashSet.class, SequenceKind.SET),
      Map.entry(LinkedHashSet.class, SequenceKind.SET),
      Map.entry(SortedSet.class, SequenceKind.SORTED_SET), Map.entry(NavigableSet.class, SequenceKind.SORTED_SET),
      Map.entry(TreeSet.class, SequenceKind.SORTED_SET),
      Map.entry(Queue.class, SequenceKind.DEQUE), Map.entry(Deque.class, SequenceKind.DEQUE),
      Map.entry(ArrayDeque.class, SequenceKind.DEQUE));

  private static final Set<Class<?>> MAPS = Set.of(
      Map.class, HashMap.class, LinkedHashMap.class, SortedMap.class, NavigableMap.class, TreeMap.class,
      ConcurrentMap.class, ConcurrentHashMap.class);

  private DescriptorResolver() {
  }

  /// Mutable walk state for one component.
  private static final class Scope {
    final String fieldName;
    final int ordinal;
    final Collection<Type> ancestors;
    final List<String> configPatterns;
    final Deque<Type> tuples = new ArrayDeque<>();
    Map<TypeVariable<?>, Type> bindings;
    int iteration;

    Scope(String fieldName, int ordinal, Map<TypeVariable<?>, Type> bindings, Collection<Type> ancestors,
          List<String> configPatterns) {
      this.fieldName = fieldName;
      this.ordinal = ordinal;
      this.bindings = bindings;
      this.ancestors = ancestors;
      this.configPatterns = configPatterns;
    }

    Position next(boolean inOptional) {
      return new Position(iteration++, ordinal, inOptional);
    }
  }

  /// Resolve one component of `owner`.
  ///
  /// @param bindings type variable bindings when `owner` is used as a parameterized type
  /// @param ancestors records currently being compiled, outermost first
  /// @param configPatterns configured date/time patterns for this component name
  static TypeDescriptor resolve(FieldSchema field, Class<?> owner, Map<TypeVariable<?>, Type> bindings,
                                Collection<Type> ancestors, List<String> configPatterns) {
    final var scope = new Scope(owner.getSimpleName() + "." + field.name(), field.ordinal(), bindings, ancestors,
        configPatterns);
    final TypeDescriptor result = resolve(field.genericType(), field.annotatedType(), false, scope);
    LOGGER.finer(() -> "Resolved " + scope.fieldName + " to " + result.toTreeString());
    return result;
  }

  /// Alternatives of a sum type, with nested sealed interfaces flattened, in declaration order.
  static List<Class<?>> leafAlternatives(Class<?> sealed) {
    final List<Class<?>> leaves = new ArrayList<>();
    for (Class<?> permitted : sealed.getPermittedSubclasses()) {
      if (permitted.isSealed() && !permitted.isRecord() && !permitted.isEnum()) {
        leaves.addAll(leafAlternatives(permitted));
      } else {
        leaves.add(permitted);
      }
    }
    return leaves;
  }

  /// Resolve a sum type that is used as a root, outside of any record component.
  static UnionNode resolveRootUnion(Class<?> sealed) {
    final var scope = new Scope(sealed.getSimpleName(), 0, Map.of(), List.of(), List.of());
    return sealedUnion(sealed, scope.next(false), scope);
  }

  private static @NotNull TypeDescriptor resolve(Type type, AnnotatedType annotated, boolean inOptional, Scope scope) {
    LOGGER.finer(() -> "Resolving " + scope.fieldName + " fragment " + type.getTypeName());
    if (type instanceof Class<?> cls) {
      return resolveClass(cls, annotated, inOptional, scope);
    }
    if (type instanceof ParameterizedType pt) {
      return resolveParameterized(pt, annotated, inOptional, scope);
    }
    if (type instanceof GenericArrayType gat) {
      final Position position = scope.next(inOptional);
      final AnnotatedType component = annotated instanceof AnnotatedArrayType aat && aat.getType().equals(type)
          ? aat.getAnnotatedGenericComponentType() : null;
      final TypeDescriptor element = resolve(gat.getGenericComponentType(), component, false, scope);
      final Class<?> arrayClass = Array.newInstance(Types.rawClass(element.javaType()), 0).getClass();
      return new SequenceNode(SequenceKind.ARRAY, arrayClass, element, type, position);
    }
    if (type instanceof TypeVariable<?> tv) {
      final Type bound = scope.bindings.get(tv);
      if (bound == null) {
        throw new DescriptorResolutionException(scope.fieldName, tv,
            "is a type variable with no binding; use the record through a parameterized type such as Box<String>");
      }
      return resolve(bound, annotated, inOptional, scope);
    }
    if (type instanceof WildcardType) {
      throw new DescriptorResolutionException(scope.fieldName, type, "is a wildcard; declare a concrete type argument");
    }
    throw new DescriptorResolutionException(scope.fieldName, type, "is not a class, parameterized type or array");
  }

  private static TypeDescriptor resolveClass(Class<?> cls, AnnotatedType annotated, boolean inOptional, Scope scope) {
    final Position position = scope.next(inOptional);
    final TypeHook hook = TypeHooks.lookup(cls);
    if (hook != null) {
      return new CustomNode(cls, hook, builtin(cls, annotated, position, scope), position);
    }
    final TypeDescriptor builtin = builtin(cls, annotated, position, scope);
    if (builtin == null) {
      throw new UnsupportedTypeException(cls);
    }
    return builtin;
  }

  private static TypeDescriptor builtin(Class<?> cls, AnnotatedType annotated, Position position, Scope scope) {
    final ScalarKind scalar = SCALARS.get(cls);
    if (scalar != null) {
      return new ScalarNode(scalar, cls, position);
    }
    final TemporalKind temporal = TEMPORALS.get(cls);
    if (temporal != null) {
      return new TemporalNode(temporal, cls, patterns(annotated, scope), position);
    }
    if (cls.isArray()) {
      final AnnotatedType component = annotated instanceof AnnotatedArrayType aat
          ? aat.getAnnotatedGenericComponentType() : null;
      final TypeDescriptor element = resolve(cls.getComponentType(), component, false, scope);
      return new SequenceNode(SequenceKind.ARRAY, cls, element, cls, position);
    }
    if (cls.isEnum()) {
      return new EnumNode(cls, position);
    }
    if (cls == Object.class) {
      final OneOf oneOf = annotated == null ? null : annotated.getAnnotation(OneOf.class);
      if (oneOf == null) {
        return new AnyNode(position);
      }
      final List<TypeDescriptor> alternatives = new ArrayList<>();
      for (Class<?> alternative : oneOf.value()) {
        alternatives.add(resolveClass(alternative, null, false, scope));
      }
      return new UnionNode(cls, alternatives, position);
    }
    if (cls.isRecord()) {
      if (cls.getTypeParameters().length > 0) {
        throw new DescriptorResolutionException(scope.fieldName, cls,
            "is a generic record used without type arguments");
      }
      return cls.isAnnotationPresent(Tuple.class)
          ? tuple(cls, cls, Map.of(), position, scope)
          : new RecordNode(cls, cls, scope.ancestors.contains(cls), position);
    }
    if (cls.isSealed()) {
      return sealedUnion(cls, position, scope);
    }
    if (cls == Optional.class) {
      return new OptionalNode(new AnyNode(scope.next(true)), cls, position);
    }
    final SequenceKind sequence = SEQUENCES.get(cls);
    if (sequence != null) {
      return new SequenceNode(sequence, cls, new AnyNode(scope.next(false)), cls, position);
    }
    if (MAPS.contains(cls)) {
      return new MappingNode(cls, new AnyNode(scope.next(false)), new AnyNode(scope.next(false)), cls, position);
    }
    return null;
  }

  private static TypeDescriptor resolveParameterized(ParameterizedType pt, AnnotatedType annotated,
                                                     boolean inOptional, Scope scope) {
    final Class<?> raw = Types.rawClass(pt);
    final Position position = scope.next(inOptional);
    final Type[] arguments = pt.getActualTypeArguments();
    final AnnotatedType[] annotatedArguments =
        annotated instanceof AnnotatedParameterizedType apt && apt.getType().equals(pt)
            ? apt.getAnnotatedActualTypeArguments() : new AnnotatedType[arguments.length];

    final TypeHook hook = TypeHooks.lookup(raw);
    if (hook != null) {
      return new CustomNode(raw, hook, null, position);
    }
    if (raw == Optional.class) {
      return new OptionalNode(resolve(arguments[0], annotatedArguments[0], true, scope), pt, position);
    }
    final SequenceKind sequence = SEQUENCES.get(raw);
    if (sequence != null) {
      return new SequenceNode(sequence, raw, resolve(arguments[0], annotatedArguments[0], false, scope), pt, position);
    }
    if (MAPS.contains(raw)) {
      final TypeDescriptor key = resolve(arguments[0], annotatedArguments[0], false, scope);
      final TypeDescriptor value = resolve(arguments[1], annotatedArguments[1], false, scope);
      return new MappingNode(raw, key, value, pt, position);
    }
    if (raw.isRecord()) {
      final Type concrete = Types.substitute(pt, scope.bindings);
      if (Types.hasTypeVariable(concrete)) {
        throw new DescriptorResolutionException(scope.fieldName, pt, "mentions a type variable with no binding");
      }
      if (Arrays.stream(((ParameterizedType) concrete).getActualTypeArguments()).anyMatch(WildcardType.class::isInstance)) {
        throw new DescriptorResolutionException(scope.fieldName, pt, "has a wildcard type argument");
      }
      return raw.isAnnotationPresent(Tuple.class)
          ? tuple(raw, concrete, Types.bindings(concrete), position, scope)
          : new RecordNode(concrete, raw, scope.ancestors.contains(concrete), position);
    }
    throw new UnsupportedTypeException(pt);
  }

  private static TupleNode tuple(Class<?> raw, Type type, Map<TypeVariable<?>, Type> bindings, Position position,
                                 Scope scope) {
    if (scope.tuples.contains(type)) {
      throw new DescriptorResolutionException(scope.fieldName, type, "is a @Tuple that contains itself");
    }
    final RecordSchema schema = RecordSchema.of(raw);
    final Map<TypeVariable<?>, Type> outer = scope.bindings;
    scope.tuples.push(type);
    scope.bindings = bindings;
    try {
      final List<TypeDescriptor> elements = new ArrayList<>();
      for (FieldSchema component : schema.fields()) {
        elements.add(resolve(component.genericType(), component.annotatedType(), false, scope));
      }
      return new TupleNode(raw, schema.fieldNames(), elements, type, position);
    } finally {
      scope.bindings = outer;
      scope.tuples.pop();
    }
  }

  private static UnionNode sealedUnion(Class<?> sealed, Position position, Scope scope) {
    final List<TypeDescriptor> alternatives = new ArrayList<>();
    for (Class<?> alternative : leafAlternatives(sealed)) {
      alternatives.add(resolveClass(alternative, null, false, scope));
    }
    return new UnionNode(sealed, alternatives, position);
  }

  private static List<String> patterns(AnnotatedType annotated, Scope scope) {
    final Pattern pattern = annotated == null ? null : annotated.getAnnotation(Pattern.class);
    if (pattern == null) {
      return scope.configPatterns;
    }
    final List<String> patterns = new ArrayList<>(List.of(pattern.value()));
    patterns.addAll(scope.configPatterns);
    return patterns;
  }

  /// Resolve every component reachable from `root`, collecting errors instead of stopping at the
  /// first. Used by `Marshaller.validateSchema`.
  static List<MarshalException> collectErrors(Class<?> root) {
    final List<MarshalException> errors = new ArrayList<>();
    final Deque<Type> work = new ArrayDeque<>();
    final Set<Type> seen = new HashSet<>();
    work.add(root);
    seen.add(root);
    while (!work.isEmpty()) {
      final Type type = work.poll();
      final Class<?> raw = Types.rawClass(type);
      if (raw.isSealed() && !raw.isRecord()) {
        for (Class<?> alternative : leafAlternatives(raw)) {
          if (seen.add(alternative)) {
            work.add(alternative);
          }
        }
        continue;
      }
      if (!raw.isRecord()) {
        continue;
      }
      final RecordSchema schema;
      try {
        schema = RecordSchema.of(raw);
      } catch (IllegalArgumentException | IllegalStateException e) {
        errors.add(new MarshalException("Invalid record " + raw.getSimpleName() + ": " + e.getMessage(), e));
        continue;
      }
      final MarshalConfig config = ConfigResolver.own(raw).withDefaults();
      for (FieldSchema field : schema.fields()) {
        try {
          final TypeDescriptor descriptor = resolve(field, raw, Types.bindings(type), List.of(type),
              config.customPatterns().getOrDefault(field.name(), List.of()));
          AliasResolver.resolve(field, config);
          nestedRecords(descriptor).forEach(nested -> {
            if (seen.add(nested)) {
              work.add(nested);
            }
          });
        } catch (DescriptorResolutionException e) {
          errors.add(e);
        } catch (MarshalException e) {
          errors.add(e.atPath(raw.getSimpleName() + "." + field.name()));
        } catch (IllegalArgumentException e) {
          errors.add(new MarshalException("Invalid metadata on " + raw.getSimpleName() + "." + field.name() + ": " +
              e.getMessage(), e));
        }
      }
    }
    return errors;
  }

  private static List<Type> nestedRecords(TypeDescriptor descriptor) {
    final List<Type> found = new ArrayList<>();
    collectNested(descriptor, found);
    return found;
  }

  private static void collectNested(TypeDescriptor descriptor, List<Type> found) {
    if (descriptor instanceof RecordNode node) {
      found.add(node.javaType());
    } else if (descriptor instanceof OptionalNode node) {
      collectNested(node.wrapped(), found);
    } else if (descriptor instanceof SequenceNode node) {
      collectNested(node.element(), found);
    } else if (descriptor instanceof MappingNode node) {
      collectNested(node.key(), found);
      collectNested(node.value(), found);
    } else if (descriptor instanceof TupleNode node) {
      node.elements().forEach(element -> collectNested(element, found));
    } else if (descriptor instanceof UnionNode node) {
      node.alternatives().forEach(alternative -> collectNested(alternative, found));
    }
  }
}
