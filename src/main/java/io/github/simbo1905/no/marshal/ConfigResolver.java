// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.marshal;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

import static io.github.simbo1905.no.marshal.Marshaller.LOGGER;

/// Merges a record's own [Meta] configuration with what it inherits from the record that encloses it.
/// Results are cached per (record type, inherited configuration) so each merge happens once.
final class ConfigResolver {

  private static final Map<Class<?>, MarshalConfig> OWN = new ConcurrentHashMap<>();
  private static final Map<Key, MarshalConfig> EFFECTIVE = new ConcurrentHashMap<>();

  private record Key(Class<?> type, MarshalConfig inherited, boolean root) {
  }

  private ConfigResolver() {
  }

  /// The configuration a type declares itself, nothing inherited and no defaults.
  static MarshalConfig own(Class<?> type) {
    return OWN.computeIfAbsent(type, t -> MarshalConfig.fromMeta(t.getAnnotation(Meta.class)));
  }

  /// Effective configuration of a nested record. `inherited` is what the enclosing record passes
  /// down; see [#passedDown(MarshalConfig)].
  static MarshalConfig resolve(Class<?> type, MarshalConfig inherited) {
    Objects.requireNonNull(inherited, "inherited must not be null");
    return EFFECTIVE.computeIfAbsent(new Key(type, inherited, false), key -> {
      final MarshalConfig effective = own(type).inheritFrom(inherited).withDefaults();
      LOGGER.finer(() -> "Resolved config of " + type.getSimpleName() + ": " + effective);
      return effective;
    });
  }

  /// Effective configuration of the type handed to `Marshaller.forClass`. The call-site options act as
  /// the type's own configuration and win over its `@Meta`.
  static MarshalConfig resolveRoot(Class<?> type, MarshalConfig callSite) {
    Objects.requireNonNull(callSite, "call site config must not be null");
    return EFFECTIVE.computeIfAbsent(new Key(type, callSite, true), key -> {
      final MarshalConfig effective = callSite.overlay(own(type)).withDefaults();
      LOGGER.finer(() -> "Resolved root config of " + type.getSimpleName() + ": " + effective);
      return effective;
    });
  }

  /// What a record hands down to the records nested in it: everything, unless it turned propagation off.
  static MarshalConfig passedDown(MarshalConfig effective) {
    return Boolean.FALSE.equals(effective.recursive()) ? MarshalConfig.EMPTY : effective;
  }
}
