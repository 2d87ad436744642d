// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.marshal;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/// Leave the component out of the dumped map when the condition holds. Overrides the
/// `skipIf` configuration for this component. The operand text is loaded with the component's
/// own load routine, so `@SkipIf(op = EQ, value = "0") int retries` compares against the int 0.
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.RECORD_COMPONENT)
public @interface SkipIf {
  SkipCondition.Op op();

  String value() default "";
}
