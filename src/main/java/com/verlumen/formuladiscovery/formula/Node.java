package com.verlumen.formuladiscovery.formula;

import com.google.common.collect.ImmutableList;
import java.util.Map;

/**
 * A node of an immutable formula tree: a {@link Constant}, a {@link Variable} or an {@link
 * Operation}.
 *
 * <p>Trees are never modified after construction. Transformations build new trees, so two
 * formulas can only share nodes if a caller shares them explicitly; genetic operators never do.
 */
public interface Node {
  /** Evaluates this tree. Never fails; see {@link Operator#apply} for the edge-case policy. */
  double evaluate(VariableSource variables);

  /**
   * Evaluates this tree against a name-keyed map. Variables missing from the map, or a null map,
   * read as {@code 0.0}.
   */
  default double evaluate(Map<String, Double> variables) {
    return evaluate(VariableSource.fromMap(variables));
  }

  /** Returns a structurally distinct deep clone of this tree. */
  Node copy();

  /** Direct children, left first. Empty for terminals. */
  ImmutableList<Node> children();

  /** Renders the canonical infix / function-call form of this tree. */
  @Override
  String toString();
}
