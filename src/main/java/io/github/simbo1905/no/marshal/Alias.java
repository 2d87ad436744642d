// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.marshal;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/// Alternative map keys for a record component. Explicit aliases take precedence over any
/// `fieldAliasesLoad` / `fieldAliasesDump` configuration for the same component.
///
/// ```java
/// record User(@Alias({"user_id", "uid"}) long id, @Alias(load = "mail", dump = "email") String email) {}
/// ```
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.RECORD_COMPONENT)
public @interface Alias {
  /// Keys tried on load in order. The first is also the dump key unless [#dump()] is set.
  String[] value() default {};

  /// Keys tried on load after [#value()] that are never used on dump.
  String[] load() default {};

  /// Key written on dump.
  String dump() default "";
}
