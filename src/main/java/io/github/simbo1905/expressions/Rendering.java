// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.expressions;

import static io.github.simbo1905.expressions.Expression.LOGGER;

/// String forms of expressions. Works directly on the node structure as it needs the precedence of each operand
/// relative to its parent.
///
/// Both forms recurse once per level of nesting, so graphs many thousands of levels deep overflow the stack here.
/// Inspect those with a [NodeFunction] run through [PostorderVisitor] instead of `toString()`.
public final class Rendering {

  static final String PARENTHESES_PROPERTY = "expressions.Rendering.Parentheses";

  static final ParenthesesMode DEFAULT_MODE =
      ParenthesesMode.valueOf(System.getProperty(PARENTHESES_PROPERTY, ParenthesesMode.MINIMAL.name()));

  static {
    LOGGER.config(() -> PARENTHESES_PROPERTY + "=" + DEFAULT_MODE);
  }

  private Rendering() {
  }

  /// Readable form using the configured default [ParenthesesMode]
  public static String render(Expression expression) {
    return render(expression, DEFAULT_MODE);
  }

  /// Readable form such as `(x + y) * z`
  public static String render(Expression expression, ParenthesesMode mode) {
    if (expression instanceof Expression.Terminal terminal) {
      return String.valueOf(terminal.value());
    }
    final var operator = (Expression.Operator) expression;
    final var left = operand(operator, operator.left(), false, mode);
    final var right = operand(operator, operator.right(), true, mode);
    return left + " " + operator.symbol() + " " + right;
  }

  private static String operand(Expression.Operator parent, Expression child, boolean isRight, ParenthesesMode mode) {
    final var rendered = render(child, mode);
    return needsParentheses(parent, child, isRight, mode) ? "(" + rendered + ")" : rendered;
  }

  static boolean needsParentheses(Expression.Operator parent, Expression child, boolean isRight, ParenthesesMode mode) {
    if (child.precedence() < parent.precedence()) {
      return true;
    }
    if (mode == ParenthesesMode.MINIMAL || child.precedence() != parent.precedence()) {
      return false;
    }
    return switch (parent.kind()) {
      case SUB, DIV -> isRight;
      case POW -> true;
      case ADD, MUL, NUMBER, SYMBOL -> false;
    };
  }

  /// Debug form: the kind name followed by the operands' debug forms, e.g. `Mul(Add("x", 1), "y")`.
  /// Terminals print only their value: numbers as `toString()` and names as a quoted Java string literal.
  public static String treeString(Expression expression) {
    if (expression instanceof Expression.Number number) {
      return String.valueOf(number.value());
    }
    if (expression instanceof Expression.Symbol symbol) {
      return quote(symbol.name());
    }
    final var operator = (Expression.Operator) expression;
    return operator.kind().displayName() + "(" + treeString(operator.left()) + ", " + treeString(operator.right()) + ")";
  }

  static String quote(String name) {
    final var sb = new StringBuilder(name.length() + 2).append('"');
    for (char ch : name.toCharArray()) {
      switch (ch) {
        case '"' -> sb.append("\\\"");
        case '\\' -> sb.append("\\\\");
        case '\n' -> sb.append("\\n");
        case '\t' -> sb.append("\\t");
        default -> sb.append(ch);
      }
    }
    return sb.append('"').toString();
  }
}
