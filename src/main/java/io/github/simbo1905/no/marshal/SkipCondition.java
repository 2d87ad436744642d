// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.marshal;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// A predicate description evaluated against a field value before it is written on dump.
/// Values wrapped in `Optional` are unwrapped first; numbers compare by numeric value.
public record SkipCondition(Op op, Object operand) {

  public enum Op {
    EQ, NE, LT, LE, GT, GE, IS_NULL, IS_NOT_NULL, IS_TRUTHY, IS_FALSY;

    boolean needsOperand() {
      return switch (this) {
        case EQ, NE, LT, LE, GT, GE -> true;
        case IS_NULL, IS_NOT_NULL, IS_TRUTHY, IS_FALSY -> false;
      };
    }
  }

  public SkipCondition {
    Objects.requireNonNull(op, "op must not be null");
    if (op.needsOperand() && operand == null) {
      throw new IllegalArgumentException(op + " needs an operand");
    }
  }

  public static SkipCondition eq(Object operand) {
    return new SkipCondition(Op.EQ, operand);
  }

  public static SkipCondition ne(Object operand) {
    return new SkipCondition(Op.NE, operand);
  }

  public static SkipCondition lt(Object operand) {
    return new SkipCondition(Op.LT, operand);
  }

  public static SkipCondition le(Object operand) {
    return new SkipCondition(Op.LE, operand);
  }

  public static SkipCondition gt(Object operand) {
    return new SkipCondition(Op.GT, operand);
  }

  public static SkipCondition ge(Object operand) {
    return new SkipCondition(Op.GE, operand);
  }

  public static SkipCondition isNull() {
    return new SkipCondition(Op.IS_NULL, null);
  }

  public static SkipCondition isNotNull() {
    return new SkipCondition(Op.IS_NOT_NULL, null);
  }

  public static SkipCondition isTruthy() {
    return new SkipCondition(Op.IS_TRUTHY, null);
  }

  public static SkipCondition isFalsy() {
    return new SkipCondition(Op.IS_FALSY, null);
  }

  /// True when the value should be left out of the dumped map.
  public boolean test(Object fieldValue) {
    final Object value = fieldValue instanceof Optional<?> optional ? optional.orElse(null) : fieldValue;
    return switch (op) {
      case IS_NULL -> value == null;
      case IS_NOT_NULL -> value != null;
      case IS_TRUTHY -> truthy(value);
      case IS_FALSY -> !truthy(value);
      case EQ -> same(value, operand);
      case NE -> !same(value, operand);
      case LT -> compare(value) < 0;
      case LE -> compare(value) <= 0;
      case GT -> compare(value) > 0;
      case GE -> compare(value) >= 0;
    };
  }

  static boolean truthy(Object value) {
    if (value == null) {
      return false;
    }
    if (value instanceof Boolean b) {
      return b;
    }
    if (value instanceof Double || value instanceof Float) {
      return ((Number) value).doubleValue() != 0.0;
    }
    if (value instanceof Number n) {
      return new BigDecimal(n.toString()).signum() != 0;
    }
    if (value instanceof CharSequence cs) {
      return cs.length() > 0;
    }
    if (value instanceof Collection<?> c) {
      return !c.isEmpty();
    }
    if (value instanceof Map<?, ?> m) {
      return !m.isEmpty();
    }
    if (value.getClass().isArray()) {
      return java.lang.reflect.Array.getLength(value) > 0;
    }
    return true;
  }

  private static boolean same(Object value, Object operand) {
    if (value instanceof Number a && operand instanceof Number b) {
      return numericCompare(a, b) == 0;
    }
    return Objects.equals(value, operand);
  }

  /// Values that cannot be ordered against the operand never match an ordering condition.
  private int compare(Object value) {
    if (value instanceof Number a && operand instanceof Number b) {
      return numericCompare(a, b);
    }
    if (value instanceof Comparable<?> && value.getClass().isInstance(operand)) {
      return compareSameClass(value, operand);
    }
    return switch (op) {
      case LT, LE -> 1;
      default -> -1;
    };
  }

  /// Both arguments are instances of the same `Comparable` class.
  @SuppressWarnings("unchecked")
  private static int compareSameClass(Object value, Object operand) {
    return ((Comparable<Object>) value).compareTo(operand);
  }

  private static int numericCompare(Number a, Number b) {
    final double da = a.doubleValue();
    final double db = b.doubleValue();
    if (!Double.isFinite(da) || !Double.isFinite(db)) {
      return Double.compare(da, db);
    }
    return new BigDecimal(a.toString()).compareTo(new BigDecimal(b.toString()));
  }
}
