// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.expressions;

/// The closed set of node kinds. Every [Expression] reports exactly one.
/// Switch expressions over this enum are checked for exhaustiveness by the compiler, so adding a kind
/// breaks the build of every rule set that does not handle it.
public enum Kind {
  NUMBER("Number", null, 3, 0),
  SYMBOL("Symbol", null, 3, 0),
  ADD("Add", "+", 0, 2),
  SUB("Sub", "-", 0, 2),
  MUL("Mul", "*", 1, 2),
  DIV("Div", "/", 1, 2),
  POW("Pow", "^", 2, 2);

  private final String displayName;
  private final String glyph;
  private final int precedence;
  private final int arity;

  Kind(String displayName, String glyph, int precedence, int arity) {
    this.displayName = displayName;
    this.glyph = glyph;
    this.precedence = precedence;
    this.arity = arity;
  }

  /// The name used by [Expression#toTreeString()]
  public String displayName() {
    return displayName;
  }

  /// The operator glyph, or null for terminals
  public String glyph() {
    return glyph;
  }

  /// Higher binds tighter. Terminals are 3 and never need parentheses.
  public int precedence() {
    return precedence;
  }

  public int arity() {
    return arity;
  }

  public boolean isTerminal() {
    return arity == 0;
  }
}
