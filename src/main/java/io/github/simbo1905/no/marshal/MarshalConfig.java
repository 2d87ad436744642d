// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.marshal;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Marshalling options for a record. A `null` component means "not set here"; [#withDefaults()]
/// fills every unset option so an effective configuration never holds nulls except for the optional
/// `tag`, `skipIf` and `skipDefaultsIf`.
///
/// The record is an immutable value: collections are copied on construction, so it doubles as the
/// fingerprint half of the routine cache key.
///
/// | option | default | inherited by nested records |
/// |---|---|---|
/// | keyCaseLoad / keyCaseDump | NONE | yes |
/// | fieldAliasesLoad / fieldAliasesDump | none | no |
/// | tagKey | `__tag__` | yes |
/// | tag | none | no |
/// | autoAssignTags, unsafeUnionDispatch | false | yes |
/// | onUnknownKey | `no.framework.Marshaller.OnUnknownKey` or IGNORE | yes |
/// | skipIf, skipDefaultsIf | none | yes |
/// | skipDefaults | false | yes |
/// | recursive | true | no |
/// | dateTimeOutput | ISO | yes |
/// | customPatterns | none | yes |
/// | tuplesAsMaps, enumsByName, collectAllErrors | false | yes |
/// | fractionalIntegers | ROUND | yes |
public record MarshalConfig(
    KeyCase keyCaseLoad,
    KeyCase keyCaseDump,
    Map<String, List<KeyPath>> fieldAliasesLoad,
    Map<String, KeyPath> fieldAliasesDump,
    String tagKey,
    String tag,
    Boolean autoAssignTags,
    Boolean unsafeUnionDispatch,
    KeyAction onUnknownKey,
    SkipCondition skipIf,
    Boolean skipDefaults,
    SkipCondition skipDefaultsIf,
    Boolean recursive,
    DateTimeTo dateTimeOutput,
    Map<String, List<String>> customPatterns,
    Boolean tuplesAsMaps,
    Boolean enumsByName,
    FractionalIntegers fractionalIntegers,
    Boolean collectAllErrors
) {

  public static final String DEFAULT_TAG_KEY = "__tag__";

  /// Nothing set.
  public static final MarshalConfig EMPTY = builder().build();

  public MarshalConfig {
    fieldAliasesLoad = copyListMap(fieldAliasesLoad);
    fieldAliasesDump = fieldAliasesDump == null ? null : Map.copyOf(fieldAliasesDump);
    customPatterns = copyListMap(customPatterns);
  }

  private static <V> Map<String, List<V>> copyListMap(Map<String, List<V>> map) {
    if (map == null) {
      return null;
    }
    final var copy = new LinkedHashMap<String, List<V>>();
    map.forEach((k, v) -> copy.put(k, List.copyOf(v)));
    return Map.copyOf(copy);
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  /// Options set here win; anything unset is taken from `under`, including the options that are
  /// never inherited. Used to lay a call-site configuration over a record's own `@Meta`.
  public MarshalConfig overlay(MarshalConfig under) {
    return new MarshalConfig(
        pick(keyCaseLoad, under.keyCaseLoad),
        pick(keyCaseDump, under.keyCaseDump),
        pick(fieldAliasesLoad, under.fieldAliasesLoad),
        pick(fieldAliasesDump, under.fieldAliasesDump),
        pick(tagKey, under.tagKey),
        pick(tag, under.tag),
        pick(autoAssignTags, under.autoAssignTags),
        pick(unsafeUnionDispatch, under.unsafeUnionDispatch),
        pick(onUnknownKey, under.onUnknownKey),
        pick(skipIf, under.skipIf),
        pick(skipDefaults, under.skipDefaults),
        pick(skipDefaultsIf, under.skipDefaultsIf),
        pick(recursive, under.recursive),
        pick(dateTimeOutput, under.dateTimeOutput),
        pick(customPatterns, under.customPatterns),
        pick(tuplesAsMaps, under.tuplesAsMaps),
        pick(enumsByName, under.enumsByName),
        pick(fractionalIntegers, under.fractionalIntegers),
        pick(collectAllErrors, under.collectAllErrors));
  }

  /// Options set here win; unset inheritable options come from `inherited`. The record's
  /// `recursive` flag, field aliases and tag are kept exactly as declared here.
  public MarshalConfig inheritFrom(MarshalConfig inherited) {
    return new MarshalConfig(
        pick(keyCaseLoad, inherited.keyCaseLoad),
        pick(keyCaseDump, inherited.keyCaseDump),
        fieldAliasesLoad,
        fieldAliasesDump,
        pick(tagKey, inherited.tagKey),
        tag,
        pick(autoAssignTags, inherited.autoAssignTags),
        pick(unsafeUnionDispatch, inherited.unsafeUnionDispatch),
        pick(onUnknownKey, inherited.onUnknownKey),
        pick(skipIf, inherited.skipIf),
        pick(skipDefaults, inherited.skipDefaults),
        pick(skipDefaultsIf, inherited.skipDefaultsIf),
        recursive,
        pick(dateTimeOutput, inherited.dateTimeOutput),
        pick(customPatterns, inherited.customPatterns),
        pick(tuplesAsMaps, inherited.tuplesAsMaps),
        pick(enumsByName, inherited.enumsByName),
        pick(fractionalIntegers, inherited.fractionalIntegers),
        pick(collectAllErrors, inherited.collectAllErrors));
  }

  /// Fill every unset option with its default.
  public MarshalConfig withDefaults() {
    return new MarshalConfig(
        pick(keyCaseLoad, KeyCase.NONE),
        pick(keyCaseDump, KeyCase.NONE),
        pick(fieldAliasesLoad, Map.of()),
        pick(fieldAliasesDump, Map.of()),
        pick(tagKey, DEFAULT_TAG_KEY),
        tag,
        pick(autoAssignTags, Boolean.FALSE),
        pick(unsafeUnionDispatch, Boolean.FALSE),
        onUnknownKey != null ? onUnknownKey : KeyAction.fromSystemProperty(),
        skipIf,
        pick(skipDefaults, Boolean.FALSE),
        skipDefaultsIf,
        pick(recursive, Boolean.TRUE),
        pick(dateTimeOutput, DateTimeTo.ISO),
        pick(customPatterns, Map.of()),
        pick(tuplesAsMaps, Boolean.FALSE),
        pick(enumsByName, Boolean.FALSE),
        pick(fractionalIntegers, FractionalIntegers.ROUND),
        pick(collectAllErrors, Boolean.FALSE));
  }

  /// Read the options a record declares with [Meta]. Returns [#EMPTY] for null.
  static MarshalConfig fromMeta(Meta meta) {
    if (meta == null) {
      return EMPTY;
    }
    return builder()
        .keyCaseLoad(single(meta.keyCaseLoad(), "keyCaseLoad"))
        .keyCaseDump(single(meta.keyCaseDump(), "keyCaseDump"))
        .tagKey(single(meta.tagKey(), "tagKey"))
        .tag(single(meta.tag(), "tag"))
        .autoAssignTags(single(meta.autoAssignTags(), "autoAssignTags"))
        .unsafeUnionDispatch(single(meta.unsafeUnionDispatch(), "unsafeUnionDispatch"))
        .onUnknownKey(single(meta.onUnknownKey(), "onUnknownKey"))
        .skipDefaults(single(meta.skipDefaults(), "skipDefaults"))
        .recursive(single(meta.recursive(), "recursive"))
        .dateTimeOutput(single(meta.dateTimeOutput(), "dateTimeOutput"))
        .tuplesAsMaps(single(meta.tuplesAsMaps(), "tuplesAsMaps"))
        .enumsByName(single(meta.enumsByName(), "enumsByName"))
        .fractionalIntegers(single(meta.fractionalIntegers(), "fractionalIntegers"))
        .collectAllErrors(single(meta.collectAllErrors(), "collectAllErrors"))
        .build();
  }

  private static <T> T single(T[] values, String member) {
    if (values.length > 1) {
      throw new IllegalArgumentException("@Meta(" + member + ") takes at most one value, got " + Arrays.toString(values));
    }
    return values.length == 0 ? null : values[0];
  }

  private static Boolean single(boolean[] values, String member) {
    if (values.length > 1) {
      throw new IllegalArgumentException("@Meta(" + member + ") takes at most one value, got " + Arrays.toString(values));
    }
    return values.length == 0 ? null : values[0];
  }

  private static <T> T pick(T own, T fallback) {
    return own != null ? own : fallback;
  }

  /// Fluent builder. Alias helpers accumulate per field.
  public static final class Builder {
    private KeyCase keyCaseLoad;
    private KeyCase keyCaseDump;
    private Map<String, List<KeyPath>> fieldAliasesLoad;
    private Map<String, KeyPath> fieldAliasesDump;
    private String tagKey;
    private String tag;
    private Boolean autoAssignTags;
    private Boolean unsafeUnionDispatch;
    private KeyAction onUnknownKey;
    private SkipCondition skipIf;
    private Boolean skipDefaults;
    private SkipCondition skipDefaultsIf;
    private Boolean recursive;
    private DateTimeTo dateTimeOutput;
    private Map<String, List<String>> customPatterns;
    private Boolean tuplesAsMaps;
    private Boolean enumsByName;
    private FractionalIntegers fractionalIntegers;
    private Boolean collectAllErrors;

    private Builder() {
    }

    private Builder(MarshalConfig c) {
      keyCaseLoad = c.keyCaseLoad;
      keyCaseDump = c.keyCaseDump;
      fieldAliasesLoad = c.fieldAliasesLoad == null ? null : new LinkedHashMap<>(c.fieldAliasesLoad);
      fieldAliasesDump = c.fieldAliasesDump == null ? null : new LinkedHashMap<>(c.fieldAliasesDump);
      tagKey = c.tagKey;
      tag = c.tag;
      autoAssignTags = c.autoAssignTags;
      unsafeUnionDispatch = c.unsafeUnionDispatch;
      onUnknownKey = c.onUnknownKey;
      skipIf = c.skipIf;
      skipDefaults = c.skipDefaults;
      skipDefaultsIf = c.skipDefaultsIf;
      recursive = c.recursive;
      dateTimeOutput = c.dateTimeOutput;
      customPatterns = c.customPatterns == null ? null : new LinkedHashMap<>(c.customPatterns);
      tuplesAsMaps = c.tuplesAsMaps;
      enumsByName = c.enumsByName;
      fractionalIntegers = c.fractionalIntegers;
      collectAllErrors = c.collectAllErrors;
    }

    public Builder keyCaseLoad(KeyCase keyCase) {
      this.keyCaseLoad = keyCase;
      return this;
    }

    public Builder keyCaseDump(KeyCase keyCase) {
      this.keyCaseDump = keyCase;
      return this;
    }

    /// Same casing in both directions; `AUTO` dumps names unchanged.
    public Builder keyCase(KeyCase keyCase) {
      return keyCaseLoad(keyCase).keyCaseDump(keyCase);
    }

    /// Flat keys accepted on load for `field`, tried before the name-derived key. The first also
    /// becomes the dump key unless [#dumpAlias(String, String)] is given.
    public Builder alias(String field, String... keys) {
      return aliasPaths(field, Arrays.stream(keys).map(KeyPath::of).toList());
    }

    /// Key paths in [KeyPath#parse(String)] syntax accepted on load for `field`.
    public Builder aliasPath(String field, String... paths) {
      return aliasPaths(field, Arrays.stream(paths).map(KeyPath::parse).toList());
    }

    private Builder aliasPaths(String field, List<KeyPath> paths) {
      if (fieldAliasesLoad == null) {
        fieldAliasesLoad = new LinkedHashMap<>();
      }
      fieldAliasesLoad.computeIfAbsent(field, k -> new ArrayList<>());
      final var merged = new ArrayList<>(fieldAliasesLoad.get(field));
      merged.addAll(paths);
      fieldAliasesLoad.put(field, merged);
      return this;
    }

    public Builder dumpAlias(String field, String key) {
      return dumpPath(field, KeyPath.of(key));
    }

    public Builder dumpAliasPath(String field, String path) {
      return dumpPath(field, KeyPath.parse(path));
    }

    private Builder dumpPath(String field, KeyPath path) {
      if (fieldAliasesDump == null) {
        fieldAliasesDump = new LinkedHashMap<>();
      }
      fieldAliasesDump.put(field, path);
      return this;
    }

    public Builder tagKey(String tagKey) {
      this.tagKey = tagKey;
      return this;
    }

    public Builder tag(String tag) {
      this.tag = tag;
      return this;
    }

    public Builder autoAssignTags(Boolean autoAssignTags) {
      this.autoAssignTags = autoAssignTags;
      return this;
    }

    public Builder unsafeUnionDispatch(Boolean unsafeUnionDispatch) {
      this.unsafeUnionDispatch = unsafeUnionDispatch;
      return this;
    }

    public Builder onUnknownKey(KeyAction onUnknownKey) {
      this.onUnknownKey = onUnknownKey;
      return this;
    }

    public Builder skipIf(SkipCondition skipIf) {
      this.skipIf = skipIf;
      return this;
    }

    public Builder skipDefaults(Boolean skipDefaults) {
      this.skipDefaults = skipDefaults;
      return this;
    }

    /// Skip a field on dump when it equals its default and also satisfies this condition.
    public Builder skipDefaultsIf(SkipCondition skipDefaultsIf) {
      this.skipDefaultsIf = skipDefaultsIf;
      return this;
    }

    public Builder recursive(Boolean recursive) {
      this.recursive = recursive;
      return this;
    }

    public Builder dateTimeOutput(DateTimeTo dateTimeOutput) {
      this.dateTimeOutput = dateTimeOutput;
      return this;
    }

    /// Extra date/time patterns for the named field, tried after ISO-8601 and after any
    /// [Pattern] annotation on the field's type.
    public Builder customPatterns(String field, String... patterns) {
      if (customPatterns == null) {
        customPatterns = new LinkedHashMap<>();
      }
      customPatterns.put(field, List.of(patterns));
      return this;
    }

    public Builder tuplesAsMaps(Boolean tuplesAsMaps) {
      this.tuplesAsMaps = tuplesAsMaps;
      return this;
    }

    public Builder enumsByName(Boolean enumsByName) {
      this.enumsByName = enumsByName;
      return this;
    }

    public Builder fractionalIntegers(FractionalIntegers fractionalIntegers) {
      this.fractionalIntegers = fractionalIntegers;
      return this;
    }

    public Builder collectAllErrors(Boolean collectAllErrors) {
      this.collectAllErrors = collectAllErrors;
      return this;
    }

    public MarshalConfig build() {
      return new MarshalConfig(keyCaseLoad, keyCaseDump, fieldAliasesLoad, fieldAliasesDump, tagKey, tag,
          autoAssignTags, unsafeUnionDispatch, onUnknownKey, skipIf, skipDefaults, skipDefaultsIf, recursive,
          dateTimeOutput, customPatterns, tuplesAsMaps, enumsByName, fractionalIntegers, collectAllErrors);
    }
  }
}
