// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.marshal;

import java.util.Objects;
import java.util.function.Function;

/// Load and dump handling for a type the built-in handlers do not cover, or cover differently.
/// Either side may be null, in which case that direction uses the built-in handler if there is one.
public record TypeHook(Class<?> type, Side load, Side dump) {

  public TypeHook {
    Objects.requireNonNull(type, "type must not be null");
    if (type.isPrimitive()) {
      throw new IllegalArgumentException("Hooks cannot be registered for primitive type " + type);
    }
    if (load == null && dump == null) {
      throw new IllegalArgumentException("A hook for " + type.getName() + " needs a load side, a dump side or both");
    }
  }

  /// How one direction is handled.
  public sealed interface Side permits Transform, Fragment {
  }

  /// A plain value transform applied to every value.
  public record Transform(Function<Object, ?> function) implements Side {
    public Transform {
      Objects.requireNonNull(function, "function must not be null");
    }
  }

  /// A compile-time hook that produces the per-value function.
  public record Fragment(FragmentHook hook) implements Side {
    public Fragment {
      Objects.requireNonNull(hook, "hook must not be null");
    }
  }
}
