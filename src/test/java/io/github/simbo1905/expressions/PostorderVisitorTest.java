// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.expressions;

import org.junit.jupiter.api.*;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static io.github.simbo1905.expressions.Expression.LOGGER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

class PostorderVisitorTest {

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  @BeforeEach
  void setUp() {
    LOGGER.fine(() -> "Starting PostorderVisitorTest test");
  }

  @AfterEach
  void tearDown() {
    LOGGER.fine(() -> "Finished PostorderVisitorTest test");
  }

  @Test
  @DisplayName("Terminal root is evaluated once with no operand results")
  void terminalRoot() {
    final var calls = new AtomicInteger();
    final String result = PostorderVisitor.visit(Expression.symbol("x"), (node, operands, ctx) -> {
      calls.incrementAndGet();
      assertThat(operands).isEmpty();
      return "leaf";
    });
    assertEquals("leaf", result);
    assertEquals(1, calls.get());
  }

  @Test
  @DisplayName("Operands are evaluated before the nodes that use them")
  void operandsBeforeParents() {
    final var x = Expression.symbol("x");
    final var two = Expression.number(2);
    final var sum = x.add(two);
    final var root = sum.mul(Expression.symbol("y"));

    final List<Expression> order = new ArrayList<>();
    PostorderVisitor.visit(root, (node, operands, ctx) -> {
      for (Expression operand : node.operands()) {
        assertThat(order).anySatisfy(seen -> assertSame(operand, seen));
      }
      order.add(node);
      return null;
    });

    assertThat(order).hasSize(5);
    assertSame(root, order.get(order.size() - 1));
    assertThat(order.indexOf(sum)).isGreaterThan(Math.max(order.indexOf(x), order.indexOf(two)));
  }

  @Test
  @DisplayName("Operand results arrive in operand order")
  void operandResultsInOrder() {
    final var expr = Expression.symbol("a").sub(Expression.symbol("b")).div(Expression.symbol("c"));
    final String prefix = PostorderVisitor.visit(expr, (node, operands, ctx) -> {
      if (node instanceof Expression.Symbol symbol) {
        return symbol.name();
      }
      return node.kind().glyph() + operands.get(0) + operands.get(1);
    });
    assertEquals("/-abc", prefix);
  }

  @Test
  @DisplayName("A shared subexpression is evaluated once")
  void sharedSubexpressionEvaluatedOnce() {
    final var shared = Expression.symbol("x").add(Expression.symbol("x"));
    final var twice = shared.add(shared);

    final Map<Expression, Integer> calls = new IdentityHashMap<>();
    final Integer total = PostorderVisitor.visit(twice, (node, operands, ctx) -> {
      calls.merge(node, 1, Integer::sum);
      return 1 + operands.stream().mapToInt(Integer::intValue).sum();
    });

    assertEquals(4, calls.size());
    assertThat(calls.values()).containsOnly(1);
    assertEquals(1, calls.get(shared));
    // the shared result is handed to both operand slots of the root
    assertEquals(7, total);
  }

  @Test
  @DisplayName("Diamond sharing through different parents is evaluated once")
  void diamondSharing() {
    final var x = Expression.symbol("x");
    final var left = x.mul(2);
    final var right = x.pow(3);
    final var root = left.sub(right);

    final var calls = new AtomicInteger();
    final Map<Expression, Integer> xCalls = new IdentityHashMap<>();
    PostorderVisitor.visit(root, (node, operands, ctx) -> {
      calls.incrementAndGet();
      if (node == x) {
        xCalls.merge(node, 1, Integer::sum);
      }
      return node;
    });
    // x, 2, 3, left, right, root
    assertEquals(6, calls.get());
    assertEquals(1, xCalls.get(x));
  }

  @Test
  @DisplayName("The same result object reaches every parent of a shared node")
  void sharedResultIdentity() {
    final var shared = Expression.symbol("x").mul(Expression.symbol("y"));
    final var root = shared.add(shared.pow(2));

    final List<List<Object>> seen = new ArrayList<>();
    PostorderVisitor.visit(root, (node, operands, ctx) -> {
      seen.add(List.copyOf(operands));
      return new Object();
    });
    final var powOperands = seen.get(seen.size() - 2);
    final var rootOperands = seen.get(seen.size() - 1);
    assertSame(rootOperands.get(0), powOperands.get(0));
  }

  @Test
  @DisplayName("The context is passed unchanged to every invocation")
  void contextForwarded() {
    final var context = new StringBuilder();
    final var expr = Expression.symbol("x").add(1).mul(Expression.symbol("y"));
    final Integer count = PostorderVisitor.visit(expr, (node, operands, ctx) -> {
      assertSame(context, ctx);
      ctx.append(node.kind().displayName().charAt(0));
      return operands.size();
    }, context);
    assertEquals(2, count);
    assertEquals(5, context.length());
  }

  @Test
  @DisplayName("Deep expressions do not overflow the stack")
  void deepExpression() {
    Expression expr = Expression.symbol("x");
    final int depth = 100_000;
    for (int i = 0; i < depth; i++) {
      expr = expr.add(i);
    }
    final Integer height = PostorderVisitor.visit(expr, (node, operands, ctx) ->
        operands.isEmpty() ? 0 : 1 + Math.max(operands.get(0), operands.get(1)));
    assertEquals(depth, height);
  }

  @Test
  @DisplayName("Exceptions from the node function propagate unchanged")
  void exceptionsPropagate() {
    final var failure = new IllegalStateException("boom");
    assertThatThrownBy(() -> PostorderVisitor.visit(Expression.symbol("x").add(1), (node, operands, ctx) -> {
      if (node instanceof Expression.Number) {
        throw failure;
      }
      return node;
    })).isSameAs(failure);
  }

  @Test
  @DisplayName("Operand result lists are read only")
  void operandResultsReadOnly() {
    assertThrows(UnsupportedOperationException.class, () ->
        PostorderVisitor.visit(Expression.symbol("x").add(1), (node, operands, ctx) -> {
          if (!operands.isEmpty()) {
            operands.clear();
          }
          return 0;
        }));
  }

  @Test
  void nullArgumentsRejected() {
    assertThrows(NullPointerException.class, () -> PostorderVisitor.visit(null, (node, operands, ctx) -> 0));
    assertThrows(NullPointerException.class, () -> PostorderVisitor.visit(Expression.number(1), null));
  }
}
