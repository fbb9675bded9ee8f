// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.expressions;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

import static io.github.simbo1905.expressions.Expression.LOGGER;

/// Symbolic differentiation with respect to a named symbol.
/// Derivatives are computed bottom up by [PostorderVisitor], so a subexpression shared by several parents is
/// differentiated once. Every rule builds a new expression and never touches its inputs. No simplification is done,
/// so `d(x * x)/dx` is `1.0 * x + 1.0 * x`.
public final class Differentiator {

  /// The derivative rule for every kind, keyed off an exhaustive switch
  static final KindDispatch<String, Expression> RULES = KindDispatch.covering(Differentiator::ruleFor);

  private Differentiator() {
  }

  /// @param expression the expression to differentiate
  /// @param variable the name of the symbol to differentiate with respect to
  /// @return a new expression for the derivative
  public static Expression differentiate(@NotNull Expression expression, @NotNull String variable) {
    Objects.requireNonNull(expression, "expression cannot be null");
    Objects.requireNonNull(variable, "variable cannot be null");
    LOGGER.fine(() -> "Differentiating " + expression.kind() + " with respect to " + variable);
    return PostorderVisitor.visit(expression, RULES, variable);
  }

  public static Expression differentiate(@NotNull Expression expression, @NotNull Expression.Symbol variable) {
    Objects.requireNonNull(variable, "variable cannot be null");
    return differentiate(expression, variable.name());
  }

  /// `d0`, `d1` are the derivatives of the operands, `e0`, `e1` the operands themselves.
  /// The power rule assumes the exponent does not depend on the variable.
  static NodeFunction<String, Expression> ruleFor(Kind kind) {
    return switch (kind) {
      case NUMBER -> (e, d, target) -> new Expression.Number(0.0);
      case SYMBOL -> (e, d, target) -> new Expression.Number(((Expression.Symbol) e).name().equals(target) ? 1.0 : 0.0);
      case ADD -> (e, d, target) -> d.get(0).add(d.get(1));
      case SUB -> (e, d, target) -> d.get(0).sub(d.get(1));
      case MUL -> (e, d, target) -> {
        final var op = (Expression.Operator) e;
        return d.get(0).mul(op.right()).add(d.get(1).mul(op.left()));
      };
      case DIV -> (e, d, target) -> {
        final var op = (Expression.Operator) e;
        return d.get(0).mul(op.right()).sub(op.left().mul(d.get(1))).div(op.right().pow(2));
      };
      case POW -> (e, d, target) -> {
        final var op = (Expression.Operator) e;
        return op.right().mul(op.left().pow(op.right().sub(1))).mul(d.get(0));
      };
    };
  }
}
