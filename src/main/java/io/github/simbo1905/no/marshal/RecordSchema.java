// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.marshal;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.reflect.AccessibleObject;
import java.lang.reflect.AnnotatedType;
import java.lang.reflect.Constructor;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import static io.github.simbo1905.no.marshal.Marshaller.LOGGER;

/// The components of one record class with the method handles to read and construct it.
/// Discovered once per class and cached for the life of the process.
record RecordSchema(Class<?> type, List<FieldSchema> fields, MethodHandle constructor, FieldSchema catchAll) {

  private static final Map<Class<?>, RecordSchema> SCHEMAS = new ConcurrentHashMap<>();

  RecordSchema {
    Objects.requireNonNull(type, "type must not be null");
    fields = List.copyOf(fields);
    Objects.requireNonNull(constructor, "constructor must not be null");
  }

  /// One record component plus the marshalling metadata declared on it.
  record FieldSchema(
      String name,
      int ordinal,
      AnnotatedType annotatedType,
      MethodHandle accessor,
      Alias alias,
      AliasPath aliasPath,
      Default defaultLiteral,
      Supplier<?> defaultFactory,
      boolean skip,
      SkipIf skipIf,
      boolean catchAll
  ) {
    FieldSchema {
      Objects.requireNonNull(name, "name must not be null");
      Objects.requireNonNull(annotatedType, "annotatedType must not be null");
      Objects.requireNonNull(accessor, "accessor must not be null");
      if (defaultLiteral != null && defaultFactory != null) {
        throw new IllegalArgumentException("Component " + name + " declares both @Default and @DefaultFactory");
      }
    }

    Type genericType() {
      return annotatedType.getType();
    }

    boolean hasDefault() {
      return defaultLiteral != null || defaultFactory != null;
    }

    boolean isOptional() {
      final Type generic = genericType();
      return generic == Optional.class || generic instanceof ParameterizedType pt && pt.getRawType() == Optional.class;
    }

    Object read(Object record) {
      try {
        return accessor.invoke(record);
      } catch (RuntimeException | Error e) {
        throw e;
      } catch (Throwable t) {
        throw new IllegalStateException("Failed to read component " + name + " of " + record.getClass().getName(), t);
      }
    }
  }

  static RecordSchema of(Class<?> recordType) {
    return SCHEMAS.computeIfAbsent(recordType, RecordSchema::discover);
  }

  /// Build an instance from loaded component values. A compact constructor that rejects the values
  /// surfaces as a [MarshalException].
  Object construct(Object[] values) {
    try {
      return constructor.invokeWithArguments(values);
    } catch (ClassCastException e) {
      throw new IllegalStateException("Loaded values do not match the components of " + type.getName() + ": " +
          Arrays.toString(values), e);
    } catch (RuntimeException e) {
      throw new MarshalException(type.getSimpleName() + " rejected the loaded values: " + e.getMessage(), e);
    } catch (Throwable t) {
      throw new IllegalStateException("Failed to construct " + type.getName(), t);
    }
  }

  List<String> fieldNames() {
    return fields.stream().map(FieldSchema::name).toList();
  }

  private static RecordSchema discover(Class<?> type) {
    if (!type.isRecord()) {
      throw new IllegalArgumentException("Not a record: " + type.getName());
    }
    final RecordComponent[] components = type.getRecordComponents();
    final var lookup = MethodHandles.lookup();
    final MethodHandle constructor;
    try {
      final Class<?>[] parameterTypes = Arrays.stream(components)
          .map(RecordComponent::getType)
          .toArray(Class<?>[]::new);
      final Constructor<?> canonical = type.getDeclaredConstructor(parameterTypes);
      openAccess(canonical);
      constructor = lookup.unreflectConstructor(canonical);
    } catch (Exception e) {
      throw new IllegalArgumentException("Failed to create constructor handle for " + type.getName(), e);
    }

    final List<FieldSchema> fields = new ArrayList<>(components.length);
    final var names = new HashSet<String>();
    FieldSchema catchAll = null;
    for (int i = 0; i < components.length; i++) {
      final RecordComponent component = components[i];
      if (!names.add(component.getName())) {
        throw new IllegalStateException("Duplicate component name " + component.getName() + " in " + type.getName());
      }
      final MethodHandle accessor;
      try {
        openAccess(component.getAccessor());
        accessor = lookup.unreflect(component.getAccessor());
      } catch (Exception e) {
        throw new IllegalArgumentException("Failed to create accessor for " + component.getName(), e);
      }
      final var field = new FieldSchema(
          component.getName(),
          i,
          component.getAnnotatedType(),
          accessor,
          component.getAnnotation(Alias.class),
          component.getAnnotation(AliasPath.class),
          component.getAnnotation(Default.class),
          defaultFactory(component),
          component.isAnnotationPresent(Skip.class),
          component.getAnnotation(SkipIf.class),
          component.isAnnotationPresent(CatchAll.class));
      if (field.catchAll()) {
        if (catchAll != null) {
          throw new IllegalArgumentException(type.getName() + " declares more than one @CatchAll component");
        }
        requireStringKeyedMap(type, component);
        catchAll = field;
      }
      fields.add(field);
    }
    final var schema = new RecordSchema(type, fields, constructor, catchAll);
    LOGGER.fine(() -> "Discovered schema " + type.getSimpleName() + "(" +
        schema.fields().stream().map(FieldSchema::name).collect(Collectors.joining(", ")) + ")");
    return schema;
  }

  private static Supplier<?> defaultFactory(RecordComponent component) {
    final DefaultFactory annotation = component.getAnnotation(DefaultFactory.class);
    if (annotation == null) {
      return null;
    }
    try {
      final Constructor<? extends Supplier<?>> constructor = annotation.value().getDeclaredConstructor();
      openAccess(constructor);
      return constructor.newInstance();
    } catch (ReflectiveOperationException e) {
      throw new IllegalArgumentException("Cannot instantiate @DefaultFactory " + annotation.value().getName() +
          " of component " + component.getName(), e);
    }
  }

  private static void requireStringKeyedMap(Class<?> type, RecordComponent component) {
    final Type generic = component.getGenericType();
    final boolean mapType = Map.class.isAssignableFrom(component.getType()) &&
        component.getType().isAssignableFrom(LinkedHashMap.class);
    if (!mapType || !stringKeyed(generic)) {
      throw new IllegalArgumentException("@CatchAll component " + type.getSimpleName() + "." + component.getName() +
          " must be declared as Map<String, Object>");
    }
  }

  /// Raw `Map` or `Map<String, Object>`.
  private static boolean stringKeyed(Type generic) {
    if (!(generic instanceof ParameterizedType pt)) {
      return true;
    }
    final Type[] args = pt.getActualTypeArguments();
    return args.length == 2 && args[0] == String.class && args[1] == Object.class;
  }

  /// Records nested in non-public classes need their members opened before unreflecting.
  private static void openAccess(AccessibleObject member) {
    try {
      member.setAccessible(true);
    } catch (RuntimeException e) {
      LOGGER.fine(() -> "Could not open " + member + ": " + e.getMessage());
    }
  }
}
