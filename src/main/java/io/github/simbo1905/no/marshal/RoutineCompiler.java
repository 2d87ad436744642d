// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.marshal;

import io.github.simbo1905.no.marshal.AliasResolver.AliasTable;
import io.github.simbo1905.no.marshal.RecordSchema.FieldSchema;
import io.github.simbo1905.no.marshal.RoutineAssembler.FieldPlan;
import io.github.simbo1905.no.marshal.TypeDescriptor.Position;
import io.github.simbo1905.no.marshal.TypeDescriptor.UnionNode;

import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

import static io.github.simbo1905.no.marshal.Marshaller.LOGGER;

/// Compiles the routines of one cache key. Called only by [RoutineCache] on a miss.
final class RoutineCompiler {

  private RoutineCompiler() {
  }

  static CompiledRoutine compile(RoutineCache cache, RoutineKey key, Deque<Type> ancestors) {
    final Class<?> raw = key.rawType();
    if (raw.isRecord()) {
      ancestors.push(key.recordType());
      try {
        return compileRecord(cache, key, ancestors);
      } finally {
        ancestors.pop();
      }
    }
    if (raw.isSealed()) {
      return compileUnion(cache, key, ancestors);
    }
    throw new IllegalArgumentException("Only records and sealed types have routines: " + raw.getName());
  }

  private static CompiledRoutine compileRecord(RoutineCache cache, RoutineKey key, Deque<Type> ancestors) {
    final Class<?> raw = key.rawType();
    final MarshalConfig config = key.config();
    final RecordSchema schema = RecordSchema.of(raw);
    final Map<TypeVariable<?>, Type> bindings = Types.bindings(key.recordType());
    final var assembler = new RoutineAssembler(raw);
    final List<FieldPlan> plans = new ArrayList<>(schema.fields().size());

    for (FieldSchema field : schema.fields()) {
      final Position fieldPosition = new Position(0, field.ordinal(), false);
      final AliasTable aliases = AliasResolver.resolve(field, config);
      final String aliasSymbol = assembler.define("alias", fieldPosition, aliases);
      if (field.catchAll()) {
        plans.add(new FieldPlan(field, aliasSymbol, null, null, null, null));
        continue;
      }
      try {
        final TypeDescriptor descriptor = DescriptorResolver.resolve(field, raw, bindings, ancestors,
            config.customPatterns().getOrDefault(field.name(), List.of()));
        LOGGER.fine(() -> "Compiling " + raw.getSimpleName() + "." + field.name() + " as " +
            descriptor.toTreeString());
        final var context = new CompileContext(cache, ancestors, assembler, config, raw, field);
        final LoadFragment load = Handlers.load(descriptor, context);
        final DumpFragment dump = Handlers.dump(descriptor, context);
        final String defaultSymbol = field.defaultFactory() != null
            ? assembler.define("default", fieldPosition, field.defaultFactory())
            : field.defaultLiteral() != null
            ? assembler.define("default", fieldPosition, field.defaultLiteral().value())
            : null;
        final String skipSymbol = field.skipIf() == null ? null : assembler.define("skip", fieldPosition,
            field.skipIf());
        plans.add(new FieldPlan(field, aliasSymbol, load, dump, defaultSymbol, skipSymbol));
      } catch (DescriptorResolutionException e) {
        throw e;
      } catch (MarshalException e) {
        throw e.atPath(raw.getSimpleName() + "." + field.name());
      }
    }
    return assembler.assembleRecord(schema, config, plans);
  }

  private static CompiledRoutine compileUnion(RoutineCache cache, RoutineKey key, Deque<Type> ancestors) {
    final Class<?> raw = key.rawType();
    final UnionNode union = DescriptorResolver.resolveRootUnion(raw);
    LOGGER.fine(() -> "Compiling root union " + raw.getSimpleName() + " as " + union.toTreeString());
    final var assembler = new RoutineAssembler(raw);
    final var context = new CompileContext(cache, ancestors, assembler, key.config(), raw, null);
    final LoadFragment load = Handlers.load(union, context);
    final DumpFragment dump = Handlers.dump(union, context);
    final SymbolTable symbols = assembler.freeze();
    return new CompiledRoutine(load.bind(symbols), dump.bind(symbols), symbols);
  }
}
