// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.marshal;

import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Main interface of the No Framework Marshaller library.
/// Converts between records (or sealed interfaces of records) and the dynamic model of `Map`, `List`,
/// scalars and `null` that JSON, YAML or TOML parsers produce. Routines are compiled once per
/// (type, effective configuration) and cached for the life of the process.
public sealed interface Marshaller<T> permits RecordMarshaller, UnionMarshaller {

  Logger LOGGER = Logger.getLogger(Marshaller.class.getName());

  /// Load a typed value from its dynamic form
  /// @param dynamicValue a `Map` for a record, or any dynamic value a union alternative accepts
  /// @return the loaded value
  /// @throws MarshalException if the value does not conform to the type
  T load(Object dynamicValue);

  /// Dump a typed value to its dynamic form
  /// @param value the value to dump
  /// @return the dynamic form, a `Map` for a record
  Object dump(T value);

  /// Marshaller for a record or sealed interface using the type's own `@Meta` configuration
  /// @param type the root record or sealed interface
  /// @return a marshaller instance
  static <T> Marshaller<T> forClass(Class<T> type) {
    return forClass(type, MarshalConfig.EMPTY);
  }

  /// Marshaller for a record or sealed interface
  /// @param type the root record or sealed interface
  /// @param callSiteConfig options laid over the root type's own `@Meta`; options set here win
  /// @return a marshaller instance
  static <T> Marshaller<T> forClass(Class<T> type, MarshalConfig callSiteConfig) {
    Objects.requireNonNull(type, "Class must not be null");
    Objects.requireNonNull(callSiteConfig, "Call site config must not be null");
    if (type.isRecord()) {
      return RecordMarshaller.create(type, callSiteConfig);
    }
    if (type.isSealed()) {
      return UnionMarshaller.create(type, callSiteConfig);
    }
    throw new IllegalArgumentException("Class must be a record or a sealed interface: " + type);
  }

  /// Resolve every component type reachable from `type` and report all the problems at once,
  /// without compiling or throwing.
  /// @param type the root record or sealed interface
  /// @return the resolution errors, empty when the type graph is usable
  static List<MarshalException> validateSchema(Class<?> type) {
    Objects.requireNonNull(type, "Class must not be null");
    final List<MarshalException> errors = DescriptorResolver.collectErrors(type);
    LOGGER.fine(() -> "Validated " + type.getName() + ": " + errors.size() + " error(s)");
    return errors;
  }
}
