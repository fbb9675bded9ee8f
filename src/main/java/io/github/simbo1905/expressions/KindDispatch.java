// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.expressions;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

import static io.github.simbo1905.expressions.Expression.LOGGER;

/// A [NodeFunction] that picks the rule registered for the kind of each node.
/// Pass one to [PostorderVisitor#visit] to run a per-kind rule set over a graph.
/// @param <C> context type
/// @param <R> result type
public final class KindDispatch<C, R> implements NodeFunction<C, R> {

  private final Map<Kind, NodeFunction<C, R>> rules;

  private KindDispatch(Map<Kind, NodeFunction<C, R>> rules) {
    final Map<Kind, NodeFunction<C, R>> copy = new EnumMap<>(Kind.class);
    copy.putAll(rules);
    this.rules = Collections.unmodifiableMap(copy);
  }

  public static <C, R> Builder<C, R> builder() {
    return new Builder<>();
  }

  /// A table with a rule for every kind
  /// @param ruleFor expected to be an exhaustive switch over [Kind] so that a new kind fails compilation
  public static <C, R> KindDispatch<C, R> covering(Function<Kind, NodeFunction<C, R>> ruleFor) {
    final Map<Kind, NodeFunction<C, R>> rules = new EnumMap<>(Kind.class);
    for (Kind kind : Kind.values()) {
      rules.put(kind, Objects.requireNonNull(ruleFor.apply(kind), "No rule returned for " + kind));
    }
    return new KindDispatch<>(rules);
  }

  public boolean handles(Kind kind) {
    return rules.containsKey(kind);
  }

  @Override
  public R apply(Expression node, List<R> operands, C context) {
    final var rule = rules.get(node.kind());
    if (rule == null) {
      final var msg = "No rule registered for node kind " + node.kind().displayName();
      LOGGER.severe(() -> msg);
      throw new UnsupportedNodeKindException(node.kind(), msg);
    }
    return rule.apply(node, operands, context);
  }

  public static final class Builder<C, R> {
    private final Map<Kind, NodeFunction<C, R>> rules = new EnumMap<>(Kind.class);

    private Builder() {
    }

    public Builder<C, R> on(Kind kind, NodeFunction<C, R> rule) {
      rules.put(Objects.requireNonNull(kind, "kind cannot be null"), Objects.requireNonNull(rule, "rule cannot be null"));
      return this;
    }

    public KindDispatch<C, R> build() {
      return new KindDispatch<>(rules);
    }
  }
}
