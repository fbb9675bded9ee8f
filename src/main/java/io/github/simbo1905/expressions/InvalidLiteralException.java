// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.expressions;

/// Thrown when a [Expression.Number] is built from something that is not a `java.lang.Number`
public class InvalidLiteralException extends IllegalArgumentException {
  public InvalidLiteralException(final String message) {
    super(message);
  }
}
