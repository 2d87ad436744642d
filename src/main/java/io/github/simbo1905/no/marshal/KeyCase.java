// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.marshal;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Transform applied to a record component name to derive its map key.
///
/// `AUTO` is only meaningful on load: the component name is tried as written and then under every
/// other transform in the fixed order camel, pascal, kebab, snake. On dump `AUTO` writes the name as is.
public enum KeyCase {
  NONE,
  /// `device_type` → `deviceType`
  CAMEL,
  /// `device_type` → `DeviceType`
  PASCAL,
  /// `DeviceType` → `device-type`
  KEBAB,
  /// `DeviceType` → `device_type`
  SNAKE,
  AUTO;

  private static final Pattern AFTER_UNDERSCORE = Pattern.compile("_(.)");
  private static final Pattern SNAKE_BOUNDARY = Pattern.compile("((?!^)(?<!_)[A-Z][a-z]+|(?<=[a-z0-9])[A-Z])");
  private static final Pattern KEBAB_BOUNDARY = Pattern.compile("((?!^)(?<!-)[A-Z][a-z]+|(?<=[a-z0-9])[A-Z])");

  static final List<KeyCase> AUTO_TRIAL_ORDER = List.of(NONE, CAMEL, PASCAL, KEBAB, SNAKE);

  /// Apply this transform to a name. `NONE` and `AUTO` return it unchanged.
  public String apply(String name) {
    if (name.isEmpty()) {
      return name;
    }
    return switch (this) {
      case NONE, AUTO -> name;
      case CAMEL -> toCamelCase(name);
      case PASCAL -> toPascalCase(name);
      case KEBAB -> toKebabCase(name);
      case SNAKE -> toSnakeCase(name);
    };
  }

  /// Candidate keys for a name on load. For `AUTO` that is every distinct transform in trial order.
  List<String> loadCandidates(String name) {
    if (this != AUTO) {
      return List.of(apply(name));
    }
    final var keys = new LinkedHashSet<String>();
    AUTO_TRIAL_ORDER.forEach(kc -> keys.add(kc.apply(name)));
    return new ArrayList<>(keys);
  }

  static String toCamelCase(String name) {
    final var s = collapse(name.replace('-', '_').replace(' ', '_'), '_');
    return Character.toLowerCase(s.charAt(0)) + upperAfterUnderscore(s.substring(1));
  }

  static String toPascalCase(String name) {
    final var s = collapse(name.replace('-', '_').replace(' ', '_'), '_');
    return Character.toUpperCase(s.charAt(0)) + upperAfterUnderscore(s.substring(1));
  }

  static String toKebabCase(String name) {
    final var s = name.replace('_', '-').replace(' ', '-');
    if (isLowerCase(s)) {
      return collapse(s, '-');
    }
    return collapse(KEBAB_BOUNDARY.matcher(s).replaceAll("-$1").toLowerCase(), '-');
  }

  static String toSnakeCase(String name) {
    final var s = name.replace('-', '_').replace(' ', '_');
    if (isLowerCase(s)) {
      return collapse(s, '_');
    }
    return collapse(SNAKE_BOUNDARY.matcher(s).replaceAll("_$1").toLowerCase(), '_');
  }

  private static String upperAfterUnderscore(String s) {
    return AFTER_UNDERSCORE.matcher(s).replaceAll(m -> Matcher.quoteReplacement(m.group(1).toUpperCase()));
  }

  /// At least one cased character and no upper-case ones.
  private static boolean isLowerCase(String s) {
    boolean cased = false;
    for (int i = 0; i < s.length(); i++) {
      final char c = s.charAt(i);
      if (Character.isUpperCase(c) || Character.isTitleCase(c)) {
        return false;
      }
      cased |= Character.isLowerCase(c);
    }
    return cased;
  }

  private static String collapse(String s, char separator) {
    final var sb = new StringBuilder(s.length());
    for (int i = 0; i < s.length(); i++) {
      final char c = s.charAt(i);
      if (c == separator && sb.length() > 0 && sb.charAt(sb.length() - 1) == separator) {
        continue;
      }
      sb.append(c);
    }
    return sb.toString();
  }
}
