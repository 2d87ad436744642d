// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.marshal;

import io.github.simbo1905.no.marshal.TypeDescriptor.ScalarKind;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.nio.file.Path;
import java.util.*;
import java.util.function.Function;
import java.util.function.Predicate;

/// Conversion rules between dynamic scalars and the scalar Java types.
///
/// Integer targets accept integral numbers, floating numbers and numeric strings. A fractional part
/// is rounded half-up or rejected according to [FractionalIntegers]. Booleans never count as numbers.
final class Coercions {

  /// Strings that load as `true`, compared lower-cased.
  static final Set<String> TRUTHY = Set.of("true", "t", "yes", "y", "on", "1");

  private Coercions() {
  }

  static Function<Object, Object> loader(ScalarKind kind, FractionalIntegers fractional) {
    return switch (kind) {
      case BOOLEAN -> Coercions::toBoolean;
      case BYTE -> value -> exact(value, "byte", fractional, BigInteger::byteValueExact);
      case SHORT -> value -> exact(value, "short", fractional, BigInteger::shortValueExact);
      case INT -> value -> exact(value, "int", fractional, BigInteger::intValueExact);
      case LONG -> value -> exact(value, "long", fractional, BigInteger::longValueExact);
      case BIG_INTEGER -> value -> toBigInteger(value, "BigInteger", fractional);
      case FLOAT -> value -> (float) toDouble(value, "float");
      case DOUBLE -> value -> toDouble(value, "double");
      case BIG_DECIMAL -> Coercions::toBigDecimal;
      case CHAR -> Coercions::toChar;
      case STRING -> Coercions::toText;
      case BYTES -> Coercions::toBytes;
      case UUID -> value -> value instanceof UUID ? value : UUID.fromString(requireText(value, "UUID").trim());
      case PATH -> value -> value instanceof Path ? value : Path.of(requireText(value, "Path"));
    };
  }

  static Function<Object, Object> dumper(ScalarKind kind) {
    return switch (kind) {
      case BOOLEAN, BYTE, SHORT, INT, LONG, BIG_INTEGER, FLOAT, DOUBLE, STRING -> Function.identity();
      case CHAR, UUID, PATH -> String::valueOf;
      case BIG_DECIMAL -> value -> ((BigDecimal) value).toString();
      case BYTES -> value -> Base64.getEncoder().encodeToString((byte[]) value);
    };
  }

  /// The dynamic classes a scalar kind naturally arrives as. Untagged unions try alternatives whose
  /// natural shape matches the input first.
  static Predicate<Object> naturalShape(ScalarKind kind) {
    return switch (kind) {
      case BOOLEAN -> Boolean.class::isInstance;
      case BYTE, SHORT, INT, LONG, BIG_INTEGER -> Coercions::isIntegral;
      case FLOAT, DOUBLE, BIG_DECIMAL -> value -> value instanceof Double || value instanceof Float ||
          value instanceof BigDecimal;
      case STRING, CHAR, BYTES, UUID, PATH -> CharSequence.class::isInstance;
    };
  }

  static boolean toBoolean(Object value) {
    if (value instanceof Boolean b) {
      return b;
    }
    if (value instanceof CharSequence text) {
      return TRUTHY.contains(text.toString().trim().toLowerCase(Locale.ROOT));
    }
    if (value instanceof Double || value instanceof Float) {
      return ((Number) value).doubleValue() == 1.0d;
    }
    if (value instanceof Number n) {
      return new BigDecimal(n.toString()).compareTo(BigDecimal.ONE) == 0;
    }
    return false;
  }

  private static boolean isIntegral(Object value) {
    return value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte ||
        value instanceof BigInteger;
  }

  private static Object exact(Object value, String target, FractionalIntegers fractional,
                              Function<BigInteger, Object> narrow) {
    final BigInteger whole = toBigInteger(value, target, fractional);
    try {
      return narrow.apply(whole);
    } catch (ArithmeticException e) {
      throw new TypeMismatchException(target + " in range", value, e);
    }
  }

  static BigInteger toBigInteger(Object value, String target, FractionalIntegers fractional) {
    if (value instanceof BigInteger bi) {
      return bi;
    }
    if (isIntegral(value)) {
      return BigInteger.valueOf(((Number) value).longValue());
    }
    if (value instanceof Double || value instanceof Float) {
      final double d = ((Number) value).doubleValue();
      if (!Double.isFinite(d)) {
        throw new TypeMismatchException(target, value);
      }
      return whole(new BigDecimal(value.toString()), target, fractional, value);
    }
    if (value instanceof BigDecimal bd) {
      return whole(bd, target, fractional, value);
    }
    if (value instanceof CharSequence text) {
      final String trimmed = text.toString().trim();
      try {
        return new BigInteger(trimmed);
      } catch (NumberFormatException notWhole) {
        try {
          return whole(new BigDecimal(trimmed), target, fractional, value);
        } catch (NumberFormatException e) {
          throw new TypeMismatchException(target, value, e);
        }
      }
    }
    throw new TypeMismatchException(target, value);
  }

  private static BigInteger whole(BigDecimal number, String target, FractionalIntegers fractional, Object value) {
    if (number.signum() == 0 || number.stripTrailingZeros().scale() <= 0) {
      return number.toBigInteger();
    }
    if (fractional == FractionalIntegers.REJECT) {
      throw new TypeMismatchException("whole number for " + target, value);
    }
    return number.setScale(0, RoundingMode.HALF_UP).toBigInteger();
  }

  private static double toDouble(Object value, String target) {
    if (value instanceof Number n) {
      return n.doubleValue();
    }
    if (value instanceof CharSequence text) {
      try {
        return Double.parseDouble(text.toString().trim());
      } catch (NumberFormatException e) {
        throw new TypeMismatchException(target, value, e);
      }
    }
    throw new TypeMismatchException(target, value);
  }

  private static BigDecimal toBigDecimal(Object value) {
    if (value instanceof BigDecimal bd) {
      return bd;
    }
    if (value instanceof BigInteger bi) {
      return new BigDecimal(bi);
    }
    if (value instanceof Number || value instanceof CharSequence) {
      try {
        return new BigDecimal(value.toString().trim());
      } catch (NumberFormatException e) {
        throw new TypeMismatchException("BigDecimal", value, e);
      }
    }
    throw new TypeMismatchException("BigDecimal", value);
  }

  private static Character toChar(Object value) {
    if (value instanceof Character c) {
      return c;
    }
    if (value instanceof CharSequence text && text.length() == 1) {
      return text.charAt(0);
    }
    throw new TypeMismatchException("single character string", value);
  }

  private static String toText(Object value) {
    if (value instanceof Map || value instanceof Collection || value.getClass().isArray()) {
      throw new TypeMismatchException("String", value);
    }
    return value.toString();
  }

  private static byte[] toBytes(Object value) {
    if (value instanceof byte[] bytes) {
      return bytes;
    }
    try {
      return Base64.getDecoder().decode(requireText(value, "base64 string"));
    } catch (IllegalArgumentException e) {
      throw new TypeMismatchException("base64 string", value, e);
    }
  }

  private static String requireText(Object value, String expected) {
    if (value instanceof CharSequence text) {
      return text.toString();
    }
    throw new TypeMismatchException(expected, value);
  }
}
