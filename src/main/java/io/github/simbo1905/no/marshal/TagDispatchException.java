// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.marshal;

import java.util.List;

/// A sum type could not pick an alternative: the tag is unknown or no alternative accepted the value.
public class TagDispatchException extends MarshalException {

  private final transient Object tag;
  private final List<String> knownTags;

  private TagDispatchException(String message, Object tag, List<String> knownTags, Object value, Throwable cause) {
    super(message, value, cause);
    this.tag = tag;
    this.knownTags = List.copyOf(knownTags);
  }

  static TagDispatchException unknownTag(String unionName, String tagKey, Object tag, List<String> knownTags,
                                         Object value) {
    return new TagDispatchException("Tag " + MarshalException.abbreviate(tag) + " under key '" + tagKey +
        "' is not one of the known tags " + knownTags + " of " + unionName, tag, knownTags, value, null);
  }

  static TagDispatchException missingTag(String unionName, String tagKey, List<String> knownTags, Object value) {
    return new TagDispatchException("No tag under key '" + tagKey + "' and every alternative of " + unionName +
        " is tagged; known tags " + knownTags, null, knownTags, value, null);
  }

  /// `lastFailure` is the error of the last alternative tried, kept as the cause.
  static TagDispatchException noMatch(String unionName, List<String> alternatives, List<String> knownTags,
                                      Object value, Throwable lastFailure) {
    return new TagDispatchException("Value was not accepted by any alternative of " + unionName + " " +
        alternatives, null, knownTags, value, lastFailure);
  }

  /// The tag read from the input, or null when dispatch was by trial.
  public Object tag() {
    return tag;
  }

  public List<String> knownTags() {
    return knownTags;
  }
}
