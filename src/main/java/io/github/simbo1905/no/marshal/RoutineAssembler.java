// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.marshal;

import io.github.simbo1905.no.marshal.AliasResolver.AliasTable;
import io.github.simbo1905.no.marshal.RecordSchema.FieldSchema;
import io.github.simbo1905.no.marshal.TypeDescriptor.Position;

import java.util.*;
import java.util.function.Supplier;

import static io.github.simbo1905.no.marshal.Marshaller.LOGGER;

/// Collects the fragments of one record and binds them into a load routine and a dump routine.
///
/// Every runtime value a fragment needs (nested routines, late bindings, lookup tables, formatters,
/// defaults, alias tables, hook functions) is interned here under a name made of the fragment prefix,
/// the component ordinal and the iteration index. [#freeze()] ends interning; fragments are then
/// bound against the frozen table and run without it.
final class RoutineAssembler {

  private final Class<?> owner;
  private final Map<String, Object> symbols = new LinkedHashMap<>();
  private SymbolTable frozen;

  RoutineAssembler(Class<?> owner) {
    this.owner = Objects.requireNonNull(owner, "owner must not be null");
  }

  /// Intern `value` and return its unique name. Collisions get a `$n` suffix.
  String define(String prefix, Position position, Object value) {
    if (frozen != null) {
      throw new IllegalStateException("Symbols of " + owner.getName() + " are already frozen");
    }
    final String base = prefix + "_" + position.fieldOrdinal() + "_" + position.iteration();
    String name = base;
    int suffix = 1;
    while (symbols.containsKey(name)) {
      name = base + "$" + suffix++;
    }
    symbols.put(name, value);
    return name;
  }

  SymbolTable freeze() {
    if (frozen == null) {
      frozen = new SymbolTable(symbols);
      LOGGER.finer(() -> "Froze " + frozen.size() + " symbols of " + owner.getSimpleName() + ": " + frozen);
    }
    return frozen;
  }

  /// The compiled pieces of one component. The fragments are null for a `@CatchAll` component.
  record FieldPlan(FieldSchema field, String aliasSymbol, LoadFragment load, DumpFragment dump,
                   String defaultSymbol, String skipSymbol) {
    FieldPlan {
      Objects.requireNonNull(field, "field must not be null");
      Objects.requireNonNull(aliasSymbol, "aliasSymbol must not be null");
    }
  }

  /// A component with its fragments bound.
  private record BoundField(FieldSchema field, String path, AliasTable aliases, Loader loader, Dumper dumper,
                            Supplier<?> defaultValue, SkipCondition skipIf) {

    boolean skips(Object value, MarshalConfig config) {
      if (field.skip()) {
        return true;
      }
      if (skipIf != null && skipIf.test(value)) {
        return true;
      }
      if (config.skipIf() != null && config.skipIf().test(value)) {
        return true;
      }
      if (defaultValue == null || !Boolean.TRUE.equals(config.skipDefaults()) && config.skipDefaultsIf() == null) {
        return false;
      }
      final boolean isDefault = Objects.equals(value, defaultValue.get());
      if (Boolean.TRUE.equals(config.skipDefaults()) && isDefault) {
        return true;
      }
      return isDefault && config.skipDefaultsIf() != null && config.skipDefaultsIf().test(value);
    }
  }

  CompiledRoutine assembleRecord(RecordSchema schema, MarshalConfig config, List<FieldPlan> plans) {
    final SymbolTable table = freeze();
    final Class<?> type = schema.type();
    final BoundField[] fields = new BoundField[plans.size()];
    for (int i = 0; i < fields.length; i++) {
      fields[i] = bind(plans.get(i), table);
    }
    final int catchAllIndex = schema.catchAll() == null ? -1 : schema.catchAll().ordinal();

    final Set<String> knownKeys = new HashSet<>();
    for (BoundField field : fields) {
      if (!field.field().catchAll()) {
        field.aliases().loadCandidates().forEach(candidate -> knownKeys.add(String.valueOf(candidate.head())));
      }
    }
    knownKeys.add(config.tagKey());

    final KeyAction onUnknownKey = config.onUnknownKey();
    final boolean collectAll = Boolean.TRUE.equals(config.collectAllErrors());
    final String typeName = type.getSimpleName();

    final Loader loader = value -> {
      if (!(value instanceof Map<?, ?> input)) {
        throw new TypeMismatchException("mapping for " + typeName, value);
      }
      final Object[] values = new Object[fields.length];
      final List<MarshalException> errors = collectAll ? new ArrayList<>() : null;
      final List<String> missing = new ArrayList<>();
      final List<String> keysTried = new ArrayList<>();

      for (int i = 0; i < fields.length; i++) {
        if (i == catchAllIndex) {
          continue;
        }
        final BoundField field = fields[i];
        try {
          final Object loaded = loadField(field, input);
          if (loaded == KeyPath.MISSING) {
            missing.add(field.field().name());
            keysTried.addAll(field.aliases().keysTried());
          } else {
            values[i] = loaded;
          }
        } catch (AggregateMarshalException e) {
          if (errors == null) {
            throw e;
          }
          final List<String> prefix = e.path();
          for (MarshalException nested : e.errors()) {
            for (int p = prefix.size() - 1; p >= 0; p--) {
              nested.atPath(prefix.get(p));
            }
            errors.add(nested);
          }
        } catch (MarshalException e) {
          if (errors == null) {
            throw e;
          }
          errors.add(e);
        }
      }

      if (!missing.isEmpty()) {
        final var error = new MissingFieldException(type, missing, keysTried, value);
        if (errors == null) {
          throw error;
        }
        errors.add(error);
      }

      if (catchAllIndex >= 0 || onUnknownKey != KeyAction.IGNORE) {
        final Map<String, Object> unknown = new LinkedHashMap<>();
        input.forEach((k, v) -> {
          final String key = String.valueOf(k);
          if (!knownKeys.contains(key)) {
            unknown.put(key, v);
          }
        });
        if (catchAllIndex >= 0) {
          values[catchAllIndex] = unknown;
        } else if (!unknown.isEmpty()) {
          final List<String> unknownKeys = List.copyOf(unknown.keySet());
          if (onUnknownKey == KeyAction.WARN) {
            LOGGER.warning(() -> "Unknown keys " + unknownKeys + " loading " + typeName + ", known fields " +
                schema.fieldNames());
          } else {
            final var error = new UnknownKeyException(type, unknownKeys, schema.fieldNames());
            if (errors == null) {
              throw error;
            }
            errors.add(error);
          }
        }
      }

      if (errors != null && !errors.isEmpty()) {
        throw new AggregateMarshalException(type, errors);
      }
      return schema.construct(values);
    };

    final Dumper dumper = value -> {
      final Map<String, Object> out = new LinkedHashMap<>();
      for (int i = 0; i < fields.length; i++) {
        if (i == catchAllIndex) {
          continue;
        }
        final BoundField field = fields[i];
        final Object fieldValue = field.field().read(value);
        if (field.skips(fieldValue, config)) {
          continue;
        }
        final Object dumped;
        try {
          dumped = field.dumper().dump(fieldValue);
        } catch (MarshalException e) {
          throw e.atPath(field.path());
        }
        field.aliases().dumpPath().put(out, dumped);
      }
      if (catchAllIndex >= 0 && fields[catchAllIndex].field().read(value) instanceof Map<?, ?> extra) {
        extra.forEach((k, v) -> out.putIfAbsent(String.valueOf(k), v));
      }
      return out;
    };

    LOGGER.fine(() -> "Assembled routines of " + typeName + " with " + table.size() + " symbols");
    return new CompiledRoutine(loader, dumper, table);
  }

  private static Object loadField(BoundField field, Map<?, ?> input) {
    Object raw = KeyPath.MISSING;
    for (KeyPath candidate : field.aliases().loadCandidates()) {
      raw = candidate.find(input);
      if (raw != KeyPath.MISSING) {
        break;
      }
    }
    if (raw == KeyPath.MISSING) {
      if (field.defaultValue() != null) {
        return field.defaultValue().get();
      }
      return KeyPath.MISSING;
    }
    try {
      return field.loader().load(raw);
    } catch (MarshalException e) {
      throw e.atPath(field.path());
    } catch (IllegalStateException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new TypeMismatchException(field.field().genericType().getTypeName(), raw, e).atPath(field.path());
    }
  }

  private BoundField bind(FieldPlan plan, SymbolTable table) {
    final FieldSchema field = plan.field();
    final String path = owner.getSimpleName() + "." + field.name();
    final AliasTable aliases = table.get(plan.aliasSymbol(), AliasTable.class);
    if (plan.load() == null) {
      return new BoundField(field, path, aliases, null, null, LinkedHashMap::new, null);
    }
    final Loader loader = plan.load().bind(table);
    final Dumper dumper = plan.dump().bind(table);

    Supplier<?> defaultValue = null;
    if (plan.defaultSymbol() != null) {
      final Object declared = table.get(plan.defaultSymbol(), Object.class);
      if (declared instanceof Supplier<?> factory) {
        defaultValue = factory;
      } else {
        final Object literal = loadCompileTime(loader, declared, path, "@Default");
        defaultValue = () -> literal;
      }
    } else if (field.isOptional()) {
      defaultValue = Optional::empty;
    }

    SkipCondition skipIf = null;
    if (plan.skipSymbol() != null) {
      final SkipIf annotation = table.get(plan.skipSymbol(), SkipIf.class);
      final Object operand = switch (annotation.op()) {
        case IS_NULL, IS_NOT_NULL, IS_TRUTHY, IS_FALSY -> null;
        default -> {
          final Object loaded = loadCompileTime(loader, annotation.value(), path, "@SkipIf");
          yield loaded instanceof Optional<?> optional ? optional.orElse(null) : loaded;
        }
      };
      skipIf = new SkipCondition(annotation.op(), operand);
    }
    return new BoundField(field, path, aliases, loader, dumper, defaultValue, skipIf);
  }

  private static Object loadCompileTime(Loader loader, Object literal, String path, String annotation) {
    try {
      return loader.load(literal);
    } catch (MarshalException e) {
      throw new MarshalException(annotation + " value '" + literal + "' of " + path + " does not load: " +
          e.getMessage(), e);
    }
  }
}
