// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.expressions;

/// Thrown by [Arithmetic] when an operand is neither an [Expression] nor a `java.lang.Number`,
/// or when neither operand is an [Expression]
public class UnsupportedOperandTypeException extends IllegalArgumentException {
  public UnsupportedOperandTypeException(final String message) {
    super(message);
  }
}
