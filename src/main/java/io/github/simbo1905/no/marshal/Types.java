// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.marshal;

import java.lang.reflect.GenericArrayType;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/// Reflection helpers for generic record types.
final class Types {

  private static final Map<Class<?>, Class<?>> BOXES = Map.of(
      boolean.class, Boolean.class, byte.class, Byte.class, short.class, Short.class, char.class, Character.class,
      int.class, Integer.class, long.class, Long.class, float.class, Float.class, double.class, Double.class);

  private Types() {
  }

  static Class<?> rawClass(Type type) {
    if (type instanceof Class<?> cls) {
      return cls;
    }
    if (type instanceof ParameterizedType pt) {
      return (Class<?>) pt.getRawType();
    }
    if (type instanceof GenericArrayType gat) {
      return java.lang.reflect.Array.newInstance(rawClass(gat.getGenericComponentType()), 0).getClass();
    }
    throw new IllegalArgumentException("Cannot determine raw class for type: " + type);
  }

  static Class<?> box(Class<?> cls) {
    return cls.isPrimitive() ? BOXES.get(cls) : cls;
  }

  /// Type variable bindings of a parameterized record, empty for a plain class.
  static Map<TypeVariable<?>, Type> bindings(Type type) {
    if (!(type instanceof ParameterizedType pt)) {
      return Map.of();
    }
    final TypeVariable<?>[] variables = rawClass(pt).getTypeParameters();
    final Type[] arguments = pt.getActualTypeArguments();
    final Map<TypeVariable<?>, Type> bindings = new HashMap<>();
    for (int i = 0; i < variables.length; i++) {
      bindings.put(variables[i], arguments[i]);
    }
    return bindings;
  }

  /// Replace bound type variables inside `type`. Unbound variables are left in place for the
  /// resolver to report.
  static Type substitute(Type type, Map<TypeVariable<?>, Type> bindings) {
    if (bindings.isEmpty()) {
      return type;
    }
    if (type instanceof TypeVariable<?> tv) {
      return bindings.getOrDefault(tv, tv);
    }
    if (type instanceof ParameterizedType pt) {
      final Type[] arguments = Arrays.stream(pt.getActualTypeArguments())
          .map(arg -> substitute(arg, bindings))
          .toArray(Type[]::new);
      return new Parameterized(rawClass(pt), pt.getOwnerType(), arguments);
    }
    return type;
  }

  /// True when a type still mentions a type variable after substitution.
  static boolean hasTypeVariable(Type type) {
    if (type instanceof TypeVariable<?>) {
      return true;
    }
    if (type instanceof ParameterizedType pt) {
      return Arrays.stream(pt.getActualTypeArguments()).anyMatch(Types::hasTypeVariable);
    }
    if (type instanceof GenericArrayType gat) {
      return hasTypeVariable(gat.getGenericComponentType());
    }
    return false;
  }

  /// A substituted parameterized type. `equals` and `hashCode` follow the `ParameterizedType`
  /// contract so instances are interchangeable with the JDK's own as cache keys.
  record Parameterized(Class<?> raw, Type owner, Type[] arguments) implements ParameterizedType {
    Parameterized {
      Objects.requireNonNull(raw, "raw type cannot be null");
      arguments = arguments.clone();
    }

    @Override
    public Type[] getActualTypeArguments() {
      return arguments.clone();
    }

    @Override
    public Type getRawType() {
      return raw;
    }

    @Override
    public Type getOwnerType() {
      return owner;
    }

    @Override
    public boolean equals(Object o) {
      if (o instanceof ParameterizedType that) {
        return raw.equals(that.getRawType()) &&
            Objects.equals(owner, that.getOwnerType()) &&
            Arrays.equals(arguments, that.getActualTypeArguments());
      }
      return false;
    }

    @Override
    public int hashCode() {
      return Arrays.hashCode(arguments) ^ Objects.hashCode(owner) ^ raw.hashCode();
    }

    @Override
    public String toString() {
      return getTypeName();
    }

    @Override
    public String getTypeName() {
      return raw.getName() + Arrays.stream(arguments).map(Type::getTypeName).collect(Collectors.joining(", ", "<", ">"));
    }
  }
}
