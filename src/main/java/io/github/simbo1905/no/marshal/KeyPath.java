// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.marshal;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// A sequence of map keys (`String`) and sequence indices (`Integer`) locating a value inside a
/// dynamic tree. A single-segment path is a plain key.
///
/// Path syntax: segments separated by `.`, indices in brackets, and keys that contain `.` or
/// brackets quoted: `data.items[0]."first.name"` or `data["x.y"][2]`.
public record KeyPath(List<Object> segments) {

  /// Marker returned by [#find(Object)] when a segment is absent.
  static final Object MISSING = new Object() {
    @Override
    public String toString() {
      return "<missing>";
    }
  };

  public KeyPath {
    Objects.requireNonNull(segments, "segments must not be null");
    if (segments.isEmpty()) {
      throw new IllegalArgumentException("A key path needs at least one segment");
    }
    for (Object segment : segments) {
      if (!(segment instanceof String) && !(segment instanceof Integer)) {
        throw new IllegalArgumentException("Key path segments must be String or Integer, got: " + segment);
      }
    }
    segments = List.copyOf(segments);
  }

  /// A path of exactly one map key, taken literally.
  public static KeyPath of(String key) {
    return new KeyPath(List.of(Objects.requireNonNull(key, "key must not be null")));
  }

  /// Parse a path expression.
  public static KeyPath parse(String expression) {
    Objects.requireNonNull(expression, "expression must not be null");
    final List<Object> segments = new ArrayList<>();
    final var current = new StringBuilder();
    boolean pending = false;
    int i = 0;
    while (i < expression.length()) {
      final char c = expression.charAt(i);
      if (c == '.') {
        if (pending) {
          segments.add(current.toString());
          current.setLength(0);
          pending = false;
        }
        i++;
      } else if (c == '"' || c == '\'') {
        final int end = expression.indexOf(c, i + 1);
        if (end < 0) {
          throw new IllegalArgumentException("Unterminated quote in key path: " + expression);
        }
        current.append(expression, i + 1, end);
        pending = true;
        i = end + 1;
      } else if (c == '[') {
        if (pending) {
          segments.add(current.toString());
          current.setLength(0);
          pending = false;
        }
        final int end = closingBracket(expression, i);
        segments.add(bracketSegment(expression.substring(i + 1, end).trim(), expression));
        i = end + 1;
      } else {
        current.append(c);
        pending = true;
        i++;
      }
    }
    if (pending) {
      segments.add(current.toString());
    }
    if (segments.isEmpty()) {
      throw new IllegalArgumentException("Empty key path: '" + expression + "'");
    }
    return new KeyPath(segments);
  }

  private static int closingBracket(String expression, int open) {
    int i = open + 1;
    while (i < expression.length()) {
      final char c = expression.charAt(i);
      if (c == '"' || c == '\'') {
        final int end = expression.indexOf(c, i + 1);
        if (end < 0) {
          break;
        }
        i = end + 1;
      } else if (c == ']') {
        return i;
      } else {
        i++;
      }
    }
    throw new IllegalArgumentException("Unterminated '[' in key path: " + expression);
  }

  private static Object bracketSegment(String inner, String expression) {
    if (inner.isEmpty()) {
      throw new IllegalArgumentException("Empty brackets in key path: " + expression);
    }
    final char first = inner.charAt(0);
    if ((first == '"' || first == '\'') && inner.length() >= 2 && inner.charAt(inner.length() - 1) == first) {
      return inner.substring(1, inner.length() - 1);
    }
    try {
      return Integer.valueOf(inner);
    } catch (NumberFormatException e) {
      return inner;
    }
  }

  boolean isSingleKey() {
    return segments.size() == 1 && segments.get(0) instanceof String;
  }

  /// The first segment, which is the key looked up in the record's own map.
  Object head() {
    return segments.get(0);
  }

  /// Walk the path from `root`, returning [#MISSING] as soon as a segment is absent.
  Object find(Object root) {
    Object current = root;
    for (Object segment : segments) {
      if (segment instanceof Integer index) {
        if (current instanceof List<?> list && index >= 0 && index < list.size()) {
          current = list.get(index);
        } else if (current instanceof Map<?, ?> map && map.containsKey(index)) {
          current = map.get(index);
        } else {
          return MISSING;
        }
      } else if (current instanceof Map<?, ?> map && map.containsKey(segment)) {
        current = map.get(segment);
      } else {
        return MISSING;
      }
    }
    return current;
  }

  /// Store `value` at this path under `root`, creating intermediate maps and lists.
  @SuppressWarnings("unchecked")
  void put(Map<String, Object> root, Object value) {
    Object container = root;
    for (int i = 0; i < segments.size(); i++) {
      final Object segment = segments.get(i);
      final boolean last = i == segments.size() - 1;
      final Object next = last ? null : segments.get(i + 1);
      if (segment instanceof Integer index) {
        if (!(container instanceof List)) {
          throw new IllegalStateException("Key path " + this + " indexes into a non-list at segment " + i);
        }
        final var list = (List<Object>) container;
        while (list.size() <= index) {
          list.add(null);
        }
        if (last) {
          list.set(index, value);
        } else {
          if (list.get(index) == null) {
            list.set(index, next instanceof Integer ? new ArrayList<>() : new LinkedHashMap<String, Object>());
          }
          container = list.get(index);
        }
      } else {
        if (!(container instanceof Map)) {
          throw new IllegalStateException("Key path " + this + " descends into a non-map at segment " + i);
        }
        final var map = (Map<String, Object>) container;
        if (last) {
          map.put((String) segment, value);
        } else {
          container = map.computeIfAbsent((String) segment,
              k -> next instanceof Integer ? new ArrayList<>() : new LinkedHashMap<String, Object>());
        }
      }
    }
  }

  @Override
  public String toString() {
    final var sb = new StringBuilder();
    for (Object segment : segments) {
      if (segment instanceof Integer index) {
        sb.append('[').append(index).append(']');
      } else {
        final var key = (String) segment;
        if (sb.length() > 0) {
          sb.append('.');
        }
        if (key.indexOf('.') >= 0 || key.indexOf('[') >= 0 || key.isEmpty()) {
          sb.append('"').append(key).append('"');
        } else {
          sb.append(key);
        }
      }
    }
    return sb.toString();
  }
}
