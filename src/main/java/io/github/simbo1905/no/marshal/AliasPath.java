// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.marshal;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/// Nested key paths for a record component, in [KeyPath#parse(String)] syntax.
///
/// ```java
/// record Order(@AliasPath("customer.address[0].city") String city) {}
/// ```
///
/// When a component carries both [Alias] and [AliasPath], the flat aliases are tried first.
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.RECORD_COMPONENT)
public @interface AliasPath {
  /// Paths tried on load in order. The first is also the dump path unless [#dump()] is set.
  String[] value() default {};

  String[] load() default {};

  String dump() default "";
}
