// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.expressions;

import static io.github.simbo1905.expressions.Expression.LOGGER;

/// Builds operator nodes from operands whose static type is not known to be [Expression].
/// This is where a native number on the left of an operator is handled: `Arithmetic.sub(2, x)` is
/// `Sub(Number(2), x)`. Operand order is always kept as written.
public final class Arithmetic {

  private Arithmetic() {
  }

  public static Expression.Operator add(Object left, Object right) {
    return apply(Kind.ADD, left, right);
  }

  public static Expression.Operator sub(Object left, Object right) {
    return apply(Kind.SUB, left, right);
  }

  public static Expression.Operator mul(Object left, Object right) {
    return apply(Kind.MUL, left, right);
  }

  public static Expression.Operator div(Object left, Object right) {
    return apply(Kind.DIV, left, right);
  }

  public static Expression.Operator pow(Object left, Object right) {
    return apply(Kind.POW, left, right);
  }

  /// Combine two operands with an operator kind
  /// @param kind an operator kind
  /// @param left an [Expression] or a `java.lang.Number`
  /// @param right an [Expression] or a `java.lang.Number`
  /// @return the new operator node with native numbers wrapped in [Expression.Number]
  /// @throws UnsupportedOperandTypeException if an operand has any other type, or neither is an [Expression]
  public static Expression.Operator apply(Kind kind, Object left, Object right) {
    if (!(left instanceof Expression) && !(right instanceof Expression)) {
      final var msg = "Unsupported operand types for " + kind.displayName() + ": " +
          typeName(left) + " and " + typeName(right) + ", at least one operand must be an Expression";
      LOGGER.severe(() -> msg);
      throw new UnsupportedOperandTypeException(msg);
    }
    return create(kind, operand(kind, left), operand(kind, right));
  }

  /// Construct the operator node for a kind
  /// @throws IllegalArgumentException if the kind is a terminal kind
  public static Expression.Operator create(Kind kind, Expression left, Expression right) {
    return switch (kind) {
      case ADD -> new Expression.Add(left, right);
      case SUB -> new Expression.Sub(left, right);
      case MUL -> new Expression.Mul(left, right);
      case DIV -> new Expression.Div(left, right);
      case POW -> new Expression.Pow(left, right);
      case NUMBER, SYMBOL -> {
        final var msg = "Not an operator kind: " + kind;
        LOGGER.severe(() -> msg);
        throw new IllegalArgumentException(msg);
      }
    };
  }

  static Expression operand(Kind kind, Object value) {
    if (value instanceof Expression expression) {
      return expression;
    }
    if (value instanceof java.lang.Number) {
      return Expression.number(value);
    }
    final var msg = "Unsupported operand type for " + kind.displayName() + ": " + typeName(value);
    LOGGER.severe(() -> msg);
    throw new UnsupportedOperandTypeException(msg);
  }

  private static String typeName(Object value) {
    return value == null ? "null" : value.getClass().getName();
  }
}
