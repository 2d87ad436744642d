// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.marshal;

import io.github.simbo1905.no.marshal.RecordSchema.FieldSchema;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/// Works out which keys a component is read from and written to.
final class AliasResolver {

  private AliasResolver() {
  }

  /// Ordered load candidates (first present wins) and the single dump location of one component.
  record AliasTable(List<KeyPath> loadCandidates, KeyPath dumpPath) {
    AliasTable {
      loadCandidates = List.copyOf(loadCandidates);
      if (loadCandidates.isEmpty()) {
        throw new IllegalArgumentException("A component needs at least one load candidate");
      }
      Objects.requireNonNull(dumpPath, "dumpPath must not be null");
    }

    /// The printable keys tried, for diagnostics.
    List<String> keysTried() {
      return loadCandidates.stream().map(KeyPath::toString).toList();
    }
  }

  /// Candidates are the explicit aliases, then the name under the load casing, then under `AUTO`
  /// every other casing. Annotations on the component replace any configured aliases for it.
  static AliasTable resolve(FieldSchema field, MarshalConfig config) {
    final List<KeyPath> explicit = new ArrayList<>();
    KeyPath dump = null;
    KeyPath firstBothWays = null;

    if (field.alias() != null || field.aliasPath() != null) {
      if (field.alias() != null) {
        final Alias alias = field.alias();
        for (String key : alias.value()) {
          explicit.add(KeyPath.of(key));
        }
        if (alias.value().length > 0) {
          firstBothWays = KeyPath.of(alias.value()[0]);
        }
        for (String key : alias.load()) {
          explicit.add(KeyPath.of(key));
        }
        if (!alias.dump().isEmpty()) {
          dump = KeyPath.of(alias.dump());
        }
      }
      if (field.aliasPath() != null) {
        final AliasPath paths = field.aliasPath();
        for (String path : paths.value()) {
          explicit.add(KeyPath.parse(path));
        }
        if (firstBothWays == null && paths.value().length > 0) {
          firstBothWays = KeyPath.parse(paths.value()[0]);
        }
        for (String path : paths.load()) {
          explicit.add(KeyPath.parse(path));
        }
        if (dump == null && !paths.dump().isEmpty()) {
          dump = KeyPath.parse(paths.dump());
        }
      }
    } else {
      final List<KeyPath> configured = config.fieldAliasesLoad().get(field.name());
      if (configured != null && !configured.isEmpty()) {
        explicit.addAll(configured);
        firstBothWays = configured.get(0);
      }
      dump = config.fieldAliasesDump().get(field.name());
    }

    final var candidates = new LinkedHashSet<>(explicit);
    config.keyCaseLoad().loadCandidates(field.name()).forEach(key -> candidates.add(KeyPath.of(key)));

    if (dump == null) {
      dump = firstBothWays != null ? firstBothWays : KeyPath.of(config.keyCaseDump().apply(field.name()));
    }
    return new AliasTable(new ArrayList<>(candidates), dump);
  }
}
