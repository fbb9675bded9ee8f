// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.expressions;

/// Parenthesization mode for the readable form. Set via system property `expressions.Rendering.Parentheses`.
/// The default is MINIMAL.
///
/// **MINIMAL** wraps an operand only when its precedence is strictly lower than its parent's. A right operand at the
/// same precedence is never wrapped, so `x - (y - z)` prints as `x - y - z`, which reads back as `(x - y) - z`.
///
/// **STRICT** (the opt-in) also wraps an equal-precedence right operand of `-` or `/`, and an equal-precedence
/// operand on either side of `^`, so the printed text always reads back as the tree that was built.
public enum ParenthesesMode {
  MINIMAL,
  STRICT
}
