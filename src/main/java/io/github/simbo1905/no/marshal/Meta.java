// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.marshal;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/// A record's own marshalling configuration. Every member is an array so that "not set" (the empty
/// default) can be told apart from an explicit value; single values need no braces:
///
/// ```java
/// @Meta(keyCaseLoad = KeyCase.AUTO, onUnknownKey = KeyAction.RAISE, tag = "circle")
/// record Circle(double radius) implements Shape {}
/// ```
///
/// Unset members are inherited from the enclosing record, except [#recursive()] and [#tag()]
/// which only ever apply to the annotated record. See [MarshalConfig] for the meaning of each option.
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface Meta {
  KeyCase[] keyCaseLoad() default {};

  KeyCase[] keyCaseDump() default {};

  String[] tagKey() default {};

  String[] tag() default {};

  boolean[] autoAssignTags() default {};

  boolean[] unsafeUnionDispatch() default {};

  KeyAction[] onUnknownKey() default {};

  boolean[] skipDefaults() default {};

  boolean[] recursive() default {};

  DateTimeTo[] dateTimeOutput() default {};

  boolean[] tuplesAsMaps() default {};

  boolean[] enumsByName() default {};

  FractionalIntegers[] fractionalIntegers() default {};

  boolean[] collectAllErrors() default {};
}
