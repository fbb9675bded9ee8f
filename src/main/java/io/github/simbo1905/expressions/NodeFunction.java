// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.expressions;

import java.util.List;

/// The function [PostorderVisitor] applies at each node.
/// @param <C> the type of the context passed unchanged to every invocation
/// @param <R> the type of the per-node result
@FunctionalInterface
public interface NodeFunction<C, R> {
  /// @param node the node being visited
  /// @param operands the results already computed for `node.operands()`, in the same order
  /// @param context the context given to the traversal
  /// @return the result for this node
  R apply(Expression node, List<R> operands, C context);
}
