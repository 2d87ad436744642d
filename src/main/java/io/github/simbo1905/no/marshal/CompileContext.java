// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.marshal;

import io.github.simbo1905.no.marshal.RecordSchema.FieldSchema;
import io.github.simbo1905.no.marshal.TypeDescriptor.Position;

import java.lang.reflect.Type;
import java.util.Deque;
import java.util.Objects;

/// What a handler needs while emitting the fragments of one component: the routine cache, the
/// compile stack, the assembler collecting symbols, and the effective config of the enclosing record.
record CompileContext(RoutineCache cache, Deque<Type> ancestors, RoutineAssembler assembler, MarshalConfig config,
                      Class<?> owner, FieldSchema field) {

  CompileContext {
    Objects.requireNonNull(cache, "cache must not be null");
    Objects.requireNonNull(ancestors, "ancestors must not be null");
    Objects.requireNonNull(assembler, "assembler must not be null");
    Objects.requireNonNull(config, "config must not be null");
    Objects.requireNonNull(owner, "owner must not be null");
  }

  /// Effective config of a record nested beneath this one.
  MarshalConfig nestedConfig(Class<?> recordType) {
    return ConfigResolver.resolve(recordType, ConfigResolver.passedDown(config));
  }

  RoutineKey nestedKey(Type recordType) {
    return new RoutineKey(recordType, nestedConfig(Types.rawClass(recordType)));
  }

  String define(String prefix, Position position, Object value) {
    return assembler.define(prefix, position, value);
  }

  /// `Owner.field`, or just the owner for a root union.
  String fieldPath() {
    return field == null ? owner.getSimpleName() : owner.getSimpleName() + "." + field.name();
  }
}
