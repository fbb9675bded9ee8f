// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.expressions;

/// Thrown when a [Expression.Symbol] is built from something that is not a `String`
public class InvalidSymbolNameException extends IllegalArgumentException {
  public InvalidSymbolNameException(final String message) {
    super(message);
  }
}
