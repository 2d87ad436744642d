// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.marshal;

import java.util.*;
import java.util.function.Predicate;

/// Picks the alternative of a sum type that handles a value.
///
/// Load dispatches on the tag when the input map carries one and any alternative is tagged. Without a
/// tag only the untagged alternatives are candidates: it either takes the first untagged record (unsafe
/// mode) or tries them in turn, scalars whose natural dynamic class matches the input first and then
/// the rest in declaration order. The first one that loads without a [MarshalException] wins, so
/// untagged dispatch depends on declaration order.
///
/// Dump picks the first alternative whose class accepts the value and writes its tag, if any, as the
/// first key of the produced map.
final class UnionDispatcher {

  /// One bound alternative. `exactShape` is null for non-scalar alternatives.
  record Alternative(String label, Class<?> javaType, String tag, boolean isRecord, Predicate<Object> exactShape,
                     Loader loader, Dumper dumper) {
    Alternative {
      Objects.requireNonNull(label, "label must not be null");
      Objects.requireNonNull(javaType, "javaType must not be null");
      Objects.requireNonNull(loader, "loader must not be null");
      Objects.requireNonNull(dumper, "dumper must not be null");
    }
  }

  private final String unionName;
  private final String tagKey;
  private final boolean unsafe;
  private final List<Alternative> alternatives;
  private final Map<String, Alternative> byTag = new LinkedHashMap<>();
  private final List<Alternative> untagged;
  private final List<String> labels;

  UnionDispatcher(String unionName, String tagKey, boolean unsafe, List<Alternative> alternatives) {
    this.unionName = unionName;
    this.tagKey = tagKey;
    this.unsafe = unsafe;
    this.alternatives = List.copyOf(alternatives);
    for (Alternative alternative : this.alternatives) {
      if (alternative.tag() != null) {
        final Alternative clash = byTag.putIfAbsent(alternative.tag(), alternative);
        if (clash != null) {
          throw new IllegalArgumentException("Alternatives " + clash.label() + " and " + alternative.label() +
              " of " + unionName + " share the tag '" + alternative.tag() + "'");
        }
      }
    }
    this.untagged = this.alternatives.stream().filter(alternative -> alternative.tag() == null).toList();
    this.labels = this.alternatives.stream().map(Alternative::label).toList();
  }

  List<String> knownTags() {
    return List.copyOf(byTag.keySet());
  }

  Object load(Object value) {
    if (!byTag.isEmpty() && value instanceof Map<?, ?> map && map.containsKey(tagKey)) {
      final Object tag = map.get(tagKey);
      final Alternative tagged = tag == null ? null : byTag.get(tag.toString());
      if (tagged == null) {
        throw TagDispatchException.unknownTag(unionName, tagKey, tag, knownTags(), value);
      }
      return tagged.loader().load(value);
    }
    if (untagged.isEmpty() && !byTag.isEmpty()) {
      throw TagDispatchException.missingTag(unionName, tagKey, knownTags(), value);
    }
    if (unsafe && value instanceof Map) {
      for (Alternative alternative : untagged) {
        if (alternative.isRecord()) {
          return alternative.loader().load(value);
        }
      }
    }
    MarshalException last = null;
    final boolean[] tried = new boolean[untagged.size()];
    for (int i = 0; i < tried.length; i++) {
      final Alternative alternative = untagged.get(i);
      if (alternative.exactShape() != null && alternative.exactShape().test(value)) {
        tried[i] = true;
        try {
          return alternative.loader().load(value);
        } catch (MarshalException e) {
          last = e;
        }
      }
    }
    for (int i = 0; i < tried.length; i++) {
      if (tried[i]) {
        continue;
      }
      try {
        return untagged.get(i).loader().load(value);
      } catch (MarshalException e) {
        last = e;
      }
    }
    throw TagDispatchException.noMatch(unionName, labels, knownTags(), value, last);
  }

  Object dump(Object value) {
    for (Alternative alternative : alternatives) {
      if (alternative.javaType().isInstance(value)) {
        final Object dumped = alternative.dumper().dump(value);
        if (alternative.tag() == null || !(dumped instanceof Map<?, ?> fields)) {
          return dumped;
        }
        final Map<String, Object> tagged = new LinkedHashMap<>();
        tagged.put(tagKey, alternative.tag());
        fields.forEach((k, v) -> tagged.putIfAbsent(String.valueOf(k), v));
        return tagged;
      }
    }
    throw new TypeMismatchException("one of " + labels + " of " + unionName, value);
  }
}
