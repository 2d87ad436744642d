// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.marshal;

import io.github.simbo1905.no.marshal.TypeDescriptor.*;
import org.jetbrains.annotations.NotNull;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.format.DateTimeFormatter;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

/// Dispatch table from descriptor kind to the fragment that loads or dumps it.
///
/// Load fragments reject `null` except for `Optional` and `Object`; dump fragments pass `null`
/// through. Failures of JDK conversions inside a fragment surface as [TypeMismatchException] carrying
/// the original as cause, and container fragments prepend `[i]` or `["key"]` to the error path.
final class Handlers {

  private Handlers() {
  }

  static LoadFragment load(TypeDescriptor descriptor, CompileContext ctx) {
    final LoadFragment fragment = switch (descriptor.kind()) {
      case PRIMITIVE -> primitiveLoad((ScalarNode) descriptor, ctx);
      case TEMPORAL -> temporalLoad((TemporalNode) descriptor, ctx);
      case OPTIONAL -> optionalLoad((OptionalNode) descriptor, ctx);
      case COLLECTION -> sequenceLoad((SequenceNode) descriptor, ctx);
      case MAPPING -> mappingLoad((MappingNode) descriptor, ctx);
      case TUPLE -> tupleLoad((TupleNode) descriptor, ctx);
      case ENUM -> enumLoad((EnumNode) descriptor, ctx);
      case RECORD -> recordLoad((RecordNode) descriptor, ctx);
      case SUM -> unionLoad((UnionNode) descriptor, ctx);
      case ANY -> symbols -> value -> value;
      case CUSTOM -> customLoad((CustomNode) descriptor, ctx);
    };
    if (descriptor.kind() == Kind.ANY || descriptor.kind() == Kind.OPTIONAL) {
      return fragment;
    }
    final String expected = "non-null " + descriptor.toTreeString();
    return symbols -> {
      final Loader loader = fragment.bind(symbols);
      return value -> {
        if (value == null) {
          throw new TypeMismatchException(expected, null);
        }
        return loader.load(value);
      };
    };
  }

  static DumpFragment dump(TypeDescriptor descriptor, CompileContext ctx) {
    final DumpFragment fragment = switch (descriptor.kind()) {
      case PRIMITIVE -> primitiveDump((ScalarNode) descriptor);
      case TEMPORAL -> temporalDump((TemporalNode) descriptor, ctx);
      case OPTIONAL -> optionalDump((OptionalNode) descriptor, ctx);
      case COLLECTION -> sequenceDump((SequenceNode) descriptor, ctx);
      case MAPPING -> mappingDump((MappingNode) descriptor, ctx);
      case TUPLE -> tupleDump((TupleNode) descriptor, ctx);
      case ENUM -> enumDump((EnumNode) descriptor, ctx);
      case RECORD -> recordDump((RecordNode) descriptor, ctx);
      case SUM -> unionDump((UnionNode) descriptor, ctx);
      case ANY -> anyDump((AnyNode) descriptor, ctx);
      case CUSTOM -> customDump((CustomNode) descriptor, ctx);
    };
    return symbols -> {
      final Dumper dumper = fragment.bind(symbols);
      return value -> value == null ? null : dumper.dump(value);
    };
  }

  /// Wrap a leaf conversion so JDK failures become type mismatches.
  private static Loader guarded(TypeDescriptor descriptor, Function<Object, ?> conversion) {
    final String expected = descriptor.toTreeString();
    return value -> {
      try {
        return conversion.apply(value);
      } catch (MarshalException e) {
        throw e;
      } catch (DateTimeException | IllegalArgumentException | ArithmeticException | ClassCastException e) {
        throw new TypeMismatchException(expected, value, e);
      }
    };
  }

  private static LoadFragment primitiveLoad(ScalarNode node, CompileContext ctx) {
    final Function<Object, Object> coercion = Coercions.loader(node.scalar(), ctx.config().fractionalIntegers());
    return symbols -> guarded(node, coercion);
  }

  private static DumpFragment primitiveDump(ScalarNode node) {
    final Function<Object, Object> render = Coercions.dumper(node.scalar());
    return symbols -> render::apply;
  }

  private static LoadFragment temporalLoad(TemporalNode node, CompileContext ctx) {
    final String name = ctx.define("formats", node.position(), Temporals.formatters(node.patterns()));
    final TemporalKind kind = node.temporal();
    final Class<?> type = node.javaType();
    final List<String> patterns = node.patterns();
    return symbols -> {
      @SuppressWarnings("unchecked") final List<DateTimeFormatter> formatters = symbols.get(name, List.class);
      return guarded(node, value -> Temporals.load(kind, type, patterns, formatters, value));
    };
  }

  private static DumpFragment temporalDump(TemporalNode node, CompileContext ctx) {
    final TemporalKind kind = node.temporal();
    final DateTimeTo output = ctx.config().dateTimeOutput();
    return symbols -> value -> Temporals.dump(kind, output, value);
  }

  private static LoadFragment optionalLoad(OptionalNode node, CompileContext ctx) {
    final LoadFragment wrapped = load(node.wrapped(), ctx);
    return symbols -> {
      final Loader inner = wrapped.bind(symbols);
      return value -> value == null ? Optional.empty() : Optional.ofNullable(inner.load(value));
    };
  }

  private static DumpFragment optionalDump(OptionalNode node, CompileContext ctx) {
    final DumpFragment wrapped = dump(node.wrapped(), ctx);
    return symbols -> {
      final Dumper inner = wrapped.bind(symbols);
      return value -> value instanceof Optional<?> optional ? optional.map(inner::dump).orElse(null) : inner.dump(value);
    };
  }

  /// The elements of a dynamic sequence, or null when the value is not one.
  private static List<?> elements(Object value) {
    if (value instanceof List<?> list) {
      return list;
    }
    if (value instanceof Collection<?> collection) {
      return new ArrayList<>(collection);
    }
    if (value != null && value.getClass().isArray()) {
      final int length = Array.getLength(value);
      final List<Object> items = new ArrayList<>(length);
      for (int i = 0; i < length; i++) {
        items.add(Array.get(value, i));
      }
      return items;
    }
    return null;
  }

  private static LoadFragment sequenceLoad(SequenceNode node, CompileContext ctx) {
    final LoadFragment elementFragment = load(node.element(), ctx);
    final String expected = node.toTreeString();
    return symbols -> {
      final Loader element = elementFragment.bind(symbols);
      return value -> {
        final List<?> items = elements(value);
        if (items == null) {
          throw new TypeMismatchException(expected, value);
        }
        final List<Object> loaded = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
          try {
            loaded.add(element.load(items.get(i)));
          } catch (MarshalException e) {
            throw e.atPath("[" + i + "]");
          }
        }
        try {
          return collect(node, loaded);
        } catch (ClassCastException | NullPointerException | IllegalArgumentException e) {
          throw new TypeMismatchException(expected, value, e);
        }
      };
    };
  }

  private static Object collect(SequenceNode node, List<Object> loaded) {
    final Class<?> container = node.containerType();
    return switch (node.sequence()) {
      case LIST -> {
        if (container == LinkedList.class) {
          yield new LinkedList<>(loaded);
        }
        yield container == ArrayList.class ? loaded : Collections.unmodifiableList(loaded);
      }
      case SET -> container == HashSet.class ? new HashSet<>(loaded) : new LinkedHashSet<>(loaded);
      case SORTED_SET -> new TreeSet<>(loaded);
      case DEQUE -> new ArrayDeque<>(loaded);
      case ARRAY -> {
        final Object array = Array.newInstance(container.getComponentType(), loaded.size());
        for (int i = 0; i < loaded.size(); i++) {
          Array.set(array, i, loaded.get(i));
        }
        yield array;
      }
    };
  }

  private static DumpFragment sequenceDump(SequenceNode node, CompileContext ctx) {
    final DumpFragment elementFragment = dump(node.element(), ctx);
    final String expected = node.toTreeString();
    return symbols -> {
      final Dumper element = elementFragment.bind(symbols);
      return value -> {
        final List<?> items = elements(value);
        if (items == null) {
          throw new TypeMismatchException(expected, value);
        }
        final List<Object> dumped = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
          try {
            dumped.add(element.dump(items.get(i)));
          } catch (MarshalException e) {
            throw e.atPath("[" + i + "]");
          }
        }
        return dumped;
      };
    };
  }

  private static Map<Object, Object> newMap(Class<?> container) {
    if (SortedMap.class.isAssignableFrom(container)) {
      return new TreeMap<>();
    }
    if (ConcurrentMap.class.isAssignableFrom(container)) {
      return new ConcurrentHashMap<>();
    }
    if (container == HashMap.class) {
      return new HashMap<>();
    }
    return new LinkedHashMap<>();
  }

  private static LoadFragment mappingLoad(MappingNode node, CompileContext ctx) {
    final LoadFragment keyFragment = load(node.key(), ctx);
    final LoadFragment valueFragment = load(node.value(), ctx);
    final String expected = node.toTreeString();
    final Class<?> container = node.containerType();
    return symbols -> {
      final Loader keys = keyFragment.bind(symbols);
      final Loader values = valueFragment.bind(symbols);
      return value -> {
        if (!(value instanceof Map<?, ?> input)) {
          throw new TypeMismatchException(expected, value);
        }
        final Map<Object, Object> loaded = newMap(container);
        for (Map.Entry<?, ?> entry : input.entrySet()) {
          try {
            loaded.put(keys.load(entry.getKey()), values.load(entry.getValue()));
          } catch (MarshalException e) {
            throw e.atPath("[\"" + entry.getKey() + "\"]");
          } catch (ClassCastException | NullPointerException e) {
            throw new TypeMismatchException(expected, value, e).atPath("[\"" + entry.getKey() + "\"]");
          }
        }
        return loaded;
      };
    };
  }

  private static DumpFragment mappingDump(MappingNode node, CompileContext ctx) {
    final DumpFragment keyFragment = dump(node.key(), ctx);
    final DumpFragment valueFragment = dump(node.value(), ctx);
    final String expected = node.toTreeString();
    return symbols -> {
      final Dumper keys = keyFragment.bind(symbols);
      final Dumper values = valueFragment.bind(symbols);
      return value -> {
        if (!(value instanceof Map<?, ?> input)) {
          throw new TypeMismatchException(expected, value);
        }
        final Map<String, Object> dumped = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : input.entrySet()) {
          try {
            dumped.put(String.valueOf(keys.dump(entry.getKey())), values.dump(entry.getValue()));
          } catch (MarshalException e) {
            throw e.atPath("[\"" + entry.getKey() + "\"]");
          }
        }
        return dumped;
      };
    };
  }

  private static LoadFragment tupleLoad(TupleNode node, CompileContext ctx) {
    final List<LoadFragment> fragments = node.elements().stream().map(element -> load(element, ctx)).toList();
    final RecordSchema schema = RecordSchema.of(node.recordType());
    final boolean asMaps = Boolean.TRUE.equals(ctx.config().tuplesAsMaps());
    final List<String> names = node.names();
    final String expected = node.toTreeString();
    return symbols -> {
      final Loader[] elements = fragments.stream().map(fragment -> fragment.bind(symbols)).toArray(Loader[]::new);
      return value -> {
        final Object[] loaded = new Object[elements.length];
        if (asMaps && value instanceof Map<?, ?> input) {
          final List<String> missing = new ArrayList<>();
          for (int i = 0; i < elements.length; i++) {
            if (!input.containsKey(names.get(i))) {
              missing.add(names.get(i));
              continue;
            }
            loaded[i] = loadElement(elements[i], input.get(names.get(i)), names.get(i));
          }
          if (!missing.isEmpty()) {
            throw new MissingFieldException(node.recordType(), missing, missing, value);
          }
          return schema.construct(loaded);
        }
        final List<?> items = value instanceof Map ? null : elements(value);
        if (items == null) {
          throw new TypeMismatchException(expected, value);
        }
        if (items.size() != elements.length) {
          throw new LengthMismatchException(node.recordType(), elements.length, items.size(), value);
        }
        for (int i = 0; i < elements.length; i++) {
          loaded[i] = loadElement(elements[i], items.get(i), "[" + i + "]");
        }
        return schema.construct(loaded);
      };
    };
  }

  private static Object loadElement(Loader loader, Object value, String segment) {
    try {
      return loader.load(value);
    } catch (MarshalException e) {
      throw e.atPath(segment);
    }
  }

  private static DumpFragment tupleDump(TupleNode node, CompileContext ctx) {
    final List<DumpFragment> fragments = node.elements().stream().map(element -> dump(element, ctx)).toList();
    final RecordSchema schema = RecordSchema.of(node.recordType());
    final boolean asMaps = Boolean.TRUE.equals(ctx.config().tuplesAsMaps());
    return symbols -> {
      final Dumper[] elements = fragments.stream().map(fragment -> fragment.bind(symbols)).toArray(Dumper[]::new);
      return value -> {
        final Map<String, Object> map = asMaps ? new LinkedHashMap<>() : null;
        final List<Object> list = asMaps ? null : new ArrayList<>(elements.length);
        for (int i = 0; i < elements.length; i++) {
          final var component = schema.fields().get(i);
          final Object dumped;
          try {
            dumped = elements[i].dump(component.read(value));
          } catch (MarshalException e) {
            throw e.atPath(asMaps ? component.name() : "[" + i + "]");
          }
          if (asMaps) {
            map.put(component.name(), dumped);
          } else {
            list.add(dumped);
          }
        }
        return asMaps ? map : list;
      };
    };
  }

  /// The value an enum constant is written as.
  static Object enumValue(Enum<?> constant, boolean byName) {
    return !byName && constant instanceof EnumValue valued ? valued.value() : constant.name();
  }

  /// Numbers compare by value so `1`, `1L` and `1.0` find the same constant.
  private static Object enumKey(Object value) {
    if (value instanceof Number number && !(value instanceof Double d && !Double.isFinite(d))
        && !(value instanceof Float f && !Float.isFinite(f))) {
      return new BigDecimal(number.toString()).stripTrailingZeros();
    }
    return value;
  }

  private static LoadFragment enumLoad(EnumNode node, CompileContext ctx) {
    final boolean byName = Boolean.TRUE.equals(ctx.config().enumsByName());
    final Map<Object, Object> lookup = new HashMap<>();
    final List<Object> accepted = new ArrayList<>();
    for (Object constant : node.javaType().getEnumConstants()) {
      final Object value = enumValue((Enum<?>) constant, byName);
      if (lookup.putIfAbsent(enumKey(value), constant) != null) {
        throw new IllegalArgumentException("Enum " + node.javaType().getName() + " has duplicate value " + value);
      }
      accepted.add(value);
    }
    final String name = ctx.define("enum", node.position(), Map.copyOf(lookup));
    final Class<?> type = node.javaType();
    final String expected = "one of " + accepted + " for " + type.getSimpleName();
    return symbols -> {
      @SuppressWarnings("unchecked") final Map<Object, Object> table = symbols.get(name, Map.class);
      return value -> {
        if (type.isInstance(value)) {
          return value;
        }
        final Object constant = table.get(enumKey(value));
        if (constant == null) {
          throw new TypeMismatchException(expected, value);
        }
        return constant;
      };
    };
  }

  private static DumpFragment enumDump(EnumNode node, CompileContext ctx) {
    final boolean byName = Boolean.TRUE.equals(ctx.config().enumsByName());
    return symbols -> value -> enumValue((Enum<?>) value, byName);
  }

  /// Symbol of the routine a record node calls: the compiled routine itself, or a late binding when
  /// the record is still being compiled further up the stack.
  private static String recordSymbol(RecordNode node, CompileContext ctx) {
    final RoutineKey key = ctx.nestedKey(node.javaType());
    if (node.recursive()) {
      return ctx.define("late", node.position(), new LateBinding(ctx.cache(), key));
    }
    return ctx.define("routine", node.position(), ctx.cache().getOrCompile(key, ctx.ancestors()));
  }

  private static LoadFragment recordLoad(RecordNode node, CompileContext ctx) {
    final String name = recordSymbol(node, ctx);
    return symbols -> {
      final Object target = symbols.get(name, Object.class);
      if (target instanceof LateBinding binding) {
        return value -> binding.routine().loader().load(value);
      }
      return ((CompiledRoutine) target).loader();
    };
  }

  private static DumpFragment recordDump(RecordNode node, CompileContext ctx) {
    final String name = recordSymbol(node, ctx);
    return symbols -> {
      final Object target = symbols.get(name, Object.class);
      if (target instanceof LateBinding binding) {
        return value -> binding.routine().dumper().dump(value);
      }
      return ((CompiledRoutine) target).dumper();
    };
  }

  /// Load and dump fragments of one alternative with its dispatch facts.
  private record UnionPlan(String label, Class<?> javaType, String tag, boolean isRecord, LoadFragment load,
                           DumpFragment dump, TypeDescriptor descriptor) {
  }

  /// Emit the fragments of every alternative and intern them, returning the symbol name.
  private static String planUnion(UnionNode node, CompileContext ctx) {
    final List<UnionPlan> plans = new ArrayList<>();
    for (TypeDescriptor alternative : node.alternatives()) {
      final Class<?> javaType = Types.box(Types.rawClass(alternative.javaType()));
      String tag = null;
      boolean isRecord = false;
      if (alternative instanceof RecordNode record) {
        isRecord = true;
        final MarshalConfig config = ctx.nestedConfig(record.recordType());
        tag = config.tag() != null ? config.tag()
            : Boolean.TRUE.equals(config.autoAssignTags()) ? record.recordType().getSimpleName() : null;
      }
      plans.add(new UnionPlan(javaType.getSimpleName(), javaType, tag, isRecord, load(alternative, ctx),
          dump(alternative, ctx), alternative));
    }
    return ctx.define("union", node.position(), List.copyOf(plans));
  }

  private static UnionDispatcher unionDispatcher(UnionNode node, CompileContext ctx, String name,
                                                 SymbolTable symbols) {
    @SuppressWarnings("unchecked") final List<UnionPlan> plans = symbols.get(name, List.class);
    final List<UnionDispatcher.Alternative> alternatives = new ArrayList<>(plans.size());
    for (UnionPlan plan : plans) {
      alternatives.add(new UnionDispatcher.Alternative(plan.label(), plan.javaType(), plan.tag(), plan.isRecord(),
          plan.descriptor() instanceof ScalarNode scalar ? Coercions.naturalShape(scalar.scalar()) : null,
          plan.load().bind(symbols), plan.dump().bind(symbols)));
    }
    return new UnionDispatcher(Types.rawClass(node.javaType()).getSimpleName(), ctx.config().tagKey(),
        Boolean.TRUE.equals(ctx.config().unsafeUnionDispatch()), alternatives);
  }

  private static LoadFragment unionLoad(UnionNode node, CompileContext ctx) {
    final String name = planUnion(node, ctx);
    return symbols -> unionDispatcher(node, ctx, name, symbols)::load;
  }

  private static DumpFragment unionDump(UnionNode node, CompileContext ctx) {
    final String name = planUnion(node, ctx);
    return symbols -> unionDispatcher(node, ctx, name, symbols)::dump;
  }

  /// `Object` values are dispatched on their runtime class so the output holds only dynamic types:
  /// hooks first, then records and containers, then the scalar and date/time renderings.
  private static DumpFragment anyDump(AnyNode node, CompileContext ctx) {
    final RoutineCache cache = ctx.cache();
    final MarshalConfig config = ctx.config();
    final MarshalConfig inherited = ConfigResolver.passedDown(config);
    final DateTimeTo output = config.dateTimeOutput();
    return symbols -> new Dumper() {
      private final Map<TypeHook, Function<Object, ?>> hooks = new ConcurrentHashMap<>();

      @Override
      public Object apply(Object value) {
        return dumpAny(value);
      }

      private Object dumpAny(Object value) {
        if (value == null) {
          return null;
        }
        final Class<?> type = value.getClass();
        final TypeHook hook = TypeHooks.lookup(type);
        if (hook != null && hook.dump() != null) {
          return hooks.computeIfAbsent(hook, h ->
              hookFunction(h.dump(), new CustomNode(type, h, null, node.position()), config)).apply(value);
        }
        if (type.isRecord()) {
          final var key = new RoutineKey(type, ConfigResolver.resolve(type, inherited));
          return cache.getOrCompile(key, new ArrayDeque<>()).dumper().dump(value);
        }
        if (value instanceof Optional<?> optional) {
          return dumpAny(optional.orElse(null));
        }
        if (value instanceof Map<?, ?> map) {
          final Map<String, Object> dumped = new LinkedHashMap<>();
          for (Map.Entry<?, ?> entry : map.entrySet()) {
            try {
              dumped.put(String.valueOf(dumpAny(entry.getKey())), dumpAny(entry.getValue()));
            } catch (MarshalException e) {
              throw e.atPath("[\"" + entry.getKey() + "\"]");
            }
          }
          return dumped;
        }
        if (value instanceof Collection<?> || type.isArray() && type != byte[].class) {
          final List<?> items = Objects.requireNonNull(elements(value));
          final List<Object> dumped = new ArrayList<>(items.size());
          for (int i = 0; i < items.size(); i++) {
            try {
              dumped.add(dumpAny(items.get(i)));
            } catch (MarshalException e) {
              throw e.atPath("[" + i + "]");
            }
          }
          return dumped;
        }
        if (value instanceof Enum<?> constant) {
          return enumValue(constant, Boolean.TRUE.equals(config.enumsByName()));
        }
        final ScalarKind scalar = DescriptorResolver.SCALARS.get(type);
        if (scalar != null) {
          return Coercions.dumper(scalar).apply(value);
        }
        final TemporalKind temporal = DescriptorResolver.TEMPORALS.get(type);
        if (temporal != null) {
          return Temporals.dump(temporal, output, value);
        }
        throw new UnsupportedTypeException(type, "it has no dynamic form; register a dump hook with TypeHooks.register");
      }
    };
  }

  private static LoadFragment customLoad(CustomNode node, CompileContext ctx) {
    final TypeHook.Side side = node.hook().load();
    if (side == null) {
      return load(requireBuiltin(node, "load"), ctx);
    }
    final Function<Object, ?> function = hookFunction(side, node, ctx.config());
    final String name = ctx.define("hook", node.position(), function);
    return symbols -> {
      @SuppressWarnings("unchecked") final Function<Object, ?> hook = symbols.get(name, Function.class);
      return guarded(node, hook);
    };
  }

  private static DumpFragment customDump(CustomNode node, CompileContext ctx) {
    final TypeHook.Side side = node.hook().dump();
    if (side == null) {
      return dump(requireBuiltin(node, "dump"), ctx);
    }
    final Function<Object, ?> function = hookFunction(side, node, ctx.config());
    final String name = ctx.define("hook", node.position(), function);
    return symbols -> {
      @SuppressWarnings("unchecked") final Function<Object, ?> hook = symbols.get(name, Function.class);
      return hook::apply;
    };
  }

  private static @NotNull TypeDescriptor requireBuiltin(CustomNode node, String direction) {
    if (node.builtin() == null) {
      throw new UnsupportedTypeException(node.javaType(),
          "its hook has no " + direction + " side and there is no built-in handler");
    }
    return node.builtin();
  }

  private static Function<Object, ?> hookFunction(TypeHook.Side side, CustomNode node, MarshalConfig config) {
    if (side instanceof TypeHook.Transform transform) {
      return transform.function();
    }
    final var fragment = (TypeHook.Fragment) side;
    final Function<Object, Object> emitted = fragment.hook().emit(node, config);
    if (emitted == null) {
      throw new IllegalStateException("Hook for " + node.javaType().getName() + " emitted no function");
    }
    return emitted;
  }
}
