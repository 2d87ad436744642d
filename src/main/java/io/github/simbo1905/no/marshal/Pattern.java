// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.marshal;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/// Extra `DateTimeFormatter` patterns for a date or time type, tried in order after ISO-8601.
///
/// ```java
/// record Event(@Pattern({"dd/MM/yyyy", "yyyyMMdd"}) LocalDate day, List<@Pattern("HH.mm") LocalTime> slots) {}
/// ```
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE_USE)
public @interface Pattern {
  String[] value();
}
