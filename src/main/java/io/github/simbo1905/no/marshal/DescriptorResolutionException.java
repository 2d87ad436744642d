// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.marshal;

import java.lang.reflect.Type;

/// A field's declared type contains a fragment that cannot be turned into a descriptor,
/// such as an unbound type variable or a wildcard.
public class DescriptorResolutionException extends MarshalException {

  private final String field;
  private final String fragment;

  public DescriptorResolutionException(String field, Type fragment, String reason) {
    super("Cannot resolve type of field " + field + ": fragment " + fragment.getTypeName() + " " + reason);
    this.field = field;
    this.fragment = fragment.getTypeName();
  }

  /// `Record.component` naming of the failing field.
  public String field() {
    return field;
  }

  public String fragment() {
    return fragment;
  }
}
