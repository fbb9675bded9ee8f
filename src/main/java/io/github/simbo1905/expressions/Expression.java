// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.expressions;

import org.jetbrains.annotations.NotNull;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/// A node in a symbolic algebraic expression graph.
/// Nodes are immutable records. A node may be the operand of several parents, so a built expression is a DAG
/// rather than a tree. Anything that needs to know "have I seen this node" must key on identity, never on the
/// structural equality that records provide.
public sealed interface Expression permits Expression.Terminal, Expression.Operator {

  Logger LOGGER = Logger.getLogger(Expression.class.getName());

  /// The ordered operands. Empty for terminals and exactly two for operators.
  List<Expression> operands();

  Kind kind();

  default int precedence() {
    return kind().precedence();
  }

  /// Debug form such as `Add("x", 2)`. The kind name and the operand count can be read back from it.
  default String toTreeString() {
    return Rendering.treeString(this);
  }

  default Operator add(@NotNull Expression other) {
    return new Add(this, other);
  }

  default Operator add(java.lang.Number other) {
    return new Add(this, number(other));
  }

  default Operator sub(@NotNull Expression other) {
    return new Sub(this, other);
  }

  default Operator sub(java.lang.Number other) {
    return new Sub(this, number(other));
  }

  default Operator mul(@NotNull Expression other) {
    return new Mul(this, other);
  }

  default Operator mul(java.lang.Number other) {
    return new Mul(this, number(other));
  }

  default Operator div(@NotNull Expression other) {
    return new Div(this, other);
  }

  default Operator div(java.lang.Number other) {
    return new Div(this, number(other));
  }

  default Operator pow(@NotNull Expression other) {
    return new Pow(this, other);
  }

  default Operator pow(java.lang.Number other) {
    return new Pow(this, number(other));
  }

  /// Wraps a native number, failing fast when the value is not numeric
  /// @param value expected to be a `java.lang.Number`
  /// @return the literal node
  /// @throws InvalidLiteralException if the value is null or not numeric
  static Number number(Object value) {
    if (value instanceof java.lang.Number n) {
      return new Number(n);
    }
    final var msg = "Number expects a numeric value, not " + describe(value);
    LOGGER.severe(() -> msg);
    throw new InvalidLiteralException(msg);
  }

  /// Wraps a variable name, failing fast when the name is not a string
  /// @param name expected to be a `String`
  /// @return the symbol node
  /// @throws InvalidSymbolNameException if the name is null or not a string
  static Symbol symbol(Object name) {
    if (name instanceof String s) {
      return new Symbol(s);
    }
    final var msg = "Symbol expects a string name, not " + describe(name);
    LOGGER.severe(() -> msg);
    throw new InvalidSymbolNameException(msg);
  }

  private static String describe(Object value) {
    return value == null ? "null" : value.getClass().getName();
  }

  /// A node without operands that wraps a single value
  sealed interface Terminal extends Expression permits Number, Symbol {
    Object value();

    @Override
    default List<Expression> operands() {
      return List.of();
    }
  }

  /// A binary operator node
  sealed interface Operator extends Expression permits Add, Sub, Mul, Div, Pow {
    Expression left();

    Expression right();

    @Override
    default List<Expression> operands() {
      return List.of(left(), right());
    }

    /// The glyph printed between the operands
    default String symbol() {
      return kind().glyph();
    }
  }

  /// A numeric literal at the native precision of the wrapped value.
  /// Only the immutable JDK number types are accepted. Mutable ones such as `AtomicInteger` or `LongAdder`
  /// would let a literal change after construction.
  record Number(java.lang.Number value) implements Terminal {

    static final Set<Class<?>> IMMUTABLE_TYPES = Set.of(
        Byte.class, Short.class, Integer.class, Long.class, Float.class, Double.class,
        BigInteger.class, BigDecimal.class);

    public Number {
      if (value == null) {
        final var msg = "Number expects a numeric value, not null";
        LOGGER.severe(() -> msg);
        throw new InvalidLiteralException(msg);
      }
      if (!IMMUTABLE_TYPES.contains(value.getClass())) {
        final var msg = "Number expects an immutable numeric value, not " + value.getClass().getName();
        LOGGER.severe(() -> msg);
        throw new InvalidLiteralException(msg);
      }
    }

    @Override
    public Kind kind() {
      return Kind.NUMBER;
    }

    @Override
    public String toString() {
      return Rendering.render(this);
    }
  }

  /// A named variable
  record Symbol(String name) implements Terminal {
    public Symbol {
      if (name == null) {
        final var msg = "Symbol expects a string name, not null";
        LOGGER.severe(() -> msg);
        throw new InvalidSymbolNameException(msg);
      }
    }

    @Override
    public String value() {
      return name;
    }

    @Override
    public Kind kind() {
      return Kind.SYMBOL;
    }

    @Override
    public String toString() {
      return Rendering.render(this);
    }
  }

  record Add(Expression left, Expression right) implements Operator {
    public Add {
      Objects.requireNonNull(left, "Add left operand cannot be null");
      Objects.requireNonNull(right, "Add right operand cannot be null");
    }

    @Override
    public Kind kind() {
      return Kind.ADD;
    }

    @Override
    public String toString() {
      return Rendering.render(this);
    }
  }

  record Sub(Expression left, Expression right) implements Operator {
    public Sub {
      Objects.requireNonNull(left, "Sub left operand cannot be null");
      Objects.requireNonNull(right, "Sub right operand cannot be null");
    }

    @Override
    public Kind kind() {
      return Kind.SUB;
    }

    @Override
    public String toString() {
      return Rendering.render(this);
    }
  }

  record Mul(Expression left, Expression right) implements Operator {
    public Mul {
      Objects.requireNonNull(left, "Mul left operand cannot be null");
      Objects.requireNonNull(right, "Mul right operand cannot be null");
    }

    @Override
    public Kind kind() {
      return Kind.MUL;
    }

    @Override
    public String toString() {
      return Rendering.render(this);
    }
  }

  record Div(Expression left, Expression right) implements Operator {
    public Div {
      Objects.requireNonNull(left, "Div left operand cannot be null");
      Objects.requireNonNull(right, "Div right operand cannot be null");
    }

    @Override
    public Kind kind() {
      return Kind.DIV;
    }

    @Override
    public String toString() {
      return Rendering.render(this);
    }
  }

  record Pow(Expression left, Expression right) implements Operator {
    public Pow {
      Objects.requireNonNull(left, "Pow left operand cannot be null");
      Objects.requireNonNull(right, "Pow right operand cannot be null");
    }

    @Override
    public Kind kind() {
      return Kind.POW;
    }

    @Override
    public String toString() {
      return Rendering.render(this);
    }
  }
}
