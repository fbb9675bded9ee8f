// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.expressions;

/// Thrown when a rule table has no rule for the kind of node it was applied to
public class UnsupportedNodeKindException extends UnsupportedOperationException {
  private final Kind kind;

  public UnsupportedNodeKindException(final Kind kind, final String message) {
    super(message);
    this.kind = kind;
  }

  public Kind kind() {
    return kind;
  }
}
