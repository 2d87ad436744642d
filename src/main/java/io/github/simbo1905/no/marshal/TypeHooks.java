// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.marshal;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

import static io.github.simbo1905.no.marshal.Marshaller.LOGGER;

/// Process-wide registry of [TypeHook]s, consulted by the compiler before its built-in handlers.
///
/// Register hooks before the first `Marshaller.forClass` that reaches the type: routines are cached
/// once compiled, so a later registration only affects routines compiled after it.
///
/// ```java
/// TypeHooks.register(Money.class, v -> Money.parse((String) v), Money::toString);
/// ```
public final class TypeHooks {

  static final Map<Class<?>, TypeHook> REGISTRY = new ConcurrentHashMap<>();

  private TypeHooks() {
  }

  /// Register plain transforms. Either may be null to keep the built-in handling of that direction.
  @SuppressWarnings("unchecked")
  public static <T> void register(Class<T> type, Function<Object, ? extends T> load, Function<? super T, ?> dump) {
    register(new TypeHook(type,
        load == null ? null : new TypeHook.Transform(load),
        dump == null ? null : new TypeHook.Transform((Function<Object, ?>) dump)));
  }

  /// Register a hook, replacing any earlier one for the same type.
  public static void register(TypeHook hook) {
    Objects.requireNonNull(hook, "hook must not be null");
    final TypeHook previous = REGISTRY.put(hook.type(), hook);
    LOGGER.fine(() -> (previous == null ? "Registered" : "Replaced") + " type hook for " + hook.type().getName());
  }

  /// Remove the hook for a type. Returns false when there was none.
  public static boolean unregister(Class<?> type) {
    return REGISTRY.remove(type) != null;
  }

  static TypeHook lookup(Class<?> type) {
    return REGISTRY.get(type);
  }
}
