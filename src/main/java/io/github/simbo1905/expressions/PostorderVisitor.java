// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.expressions;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static io.github.simbo1905.expressions.Expression.LOGGER;

/// Evaluates a [NodeFunction] bottom up over an expression graph.
/// Uses an explicit work stack rather than recursion so that very deep expressions cannot overflow the thread stack.
/// Results are memoized by node identity, so a node that is the operand of several parents is evaluated once and
/// its single result is handed to each parent.
public final class PostorderVisitor {

  private PostorderVisitor() {
  }

  /// Visit with a null context
  public static <R> R visit(@NotNull Expression root, @NotNull NodeFunction<Void, R> fn) {
    return visit(root, fn, null);
  }

  /// Apply `fn` to every node reachable from `root`, operands before the nodes that use them
  /// @param root the expression to visit
  /// @param fn invoked exactly once per distinct node
  /// @param context passed unchanged to every invocation of `fn`
  /// @return the result computed for `root`
  public static <C, R> R visit(@NotNull Expression root, @NotNull NodeFunction<C, R> fn, C context) {
    Objects.requireNonNull(root, "root cannot be null");
    Objects.requireNonNull(fn, "fn cannot be null");

    final Deque<Expression> stack = new ArrayDeque<>();
    final Map<Expression, R> visited = new IdentityHashMap<>();
    stack.push(root);
    while (!stack.isEmpty()) {
      final var e = stack.pop();
      // pushed by more than one parent before it was evaluated
      if (visited.containsKey(e)) {
        continue;
      }
      final var operands = e.operands();
      final List<Expression> unvisited = new ArrayList<>(operands.size());
      for (Expression o : operands) {
        if (!visited.containsKey(o) && !containsIdentical(unvisited, o)) {
          unvisited.add(o);
        }
      }
      if (!unvisited.isEmpty()) {
        stack.push(e);
        unvisited.forEach(stack::push);
      } else {
        final List<R> results = new ArrayList<>(operands.size());
        for (Expression o : operands) {
          results.add(visited.get(o));
        }
        LOGGER.finest(() -> "Applying node function to " + e.kind() + " with " + results.size() + " operand results");
        visited.put(e, fn.apply(e, Collections.unmodifiableList(results), context));
      }
    }
    LOGGER.finer(() -> "Postorder visit from " + root.kind() + " evaluated " + visited.size() + " distinct nodes");
    return visited.get(root);
  }

  private static boolean containsIdentical(List<Expression> expressions, Expression candidate) {
    for (Expression e : expressions) {
      if (e == candidate) {
        return true;
      }
    }
    return false;
  }
}
