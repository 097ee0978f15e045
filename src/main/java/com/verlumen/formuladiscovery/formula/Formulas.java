package com.verlumen.formuladiscovery.formula;

import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.Deque;

/** Static helpers over formula trees. */
public final class Formulas {
  /**
   * Converts a formula into a function over training inputs. Variables are bound to features when
   * the tree is built, so applying the function performs no name lookups.
   */
  public static FormulaFunction toFunction(Node formula) {
    checkNotNull(formula);
    return inputs -> formula.evaluate(VariableSource.fromInputs(inputs));
  }

  /** Number of nodes in the tree; {@code 0} for a null tree. */
  public static int complexity(Node formula) {
    if (formula == null) {
      return 0;
    }
    int complexity = 1;
    for (Node child : formula.children()) {
      complexity += complexity(child);
    }
    return complexity;
  }

  /** Depth of the tree; a lone terminal has depth {@code 1}, a null tree {@code 0}. */
  public static int depth(Node formula) {
    if (formula == null) {
      return 0;
    }
    int deepest = 0;
    for (Node child : formula.children()) {
      deepest = Math.max(deepest, depth(child));
    }
    return deepest + 1;
  }

  /** All nodes of the tree in preorder; index {@code 0} is the root. */
  public static ImmutableList<Node> collectNodes(Node formula) {
    ImmutableList.Builder<Node> nodes = ImmutableList.builder();
    Deque<Node> pending = new ArrayDeque<>();
    pending.push(formula);
    while (!pending.isEmpty()) {
      Node node = pending.pop();
      nodes.add(node);
      ImmutableList<Node> children = node.children();
      for (int i = children.size() - 1; i >= 0; i--) {
        pending.push(children.get(i));
      }
    }
    return nodes.build();
  }

  /**
   * Returns a new tree equal to {@code formula} except that the subtree at preorder position
   * {@code index} is replaced by {@code replacement}. Nodes off the replaced path are reused.
   */
  public static Node replaceAt(Node formula, int index, Node replacement) {
    checkElementIndex(index, complexity(formula));
    return replace(formula, new int[] {index}, replacement);
  }

  private static Node replace(Node node, int[] remaining, Node replacement) {
    if (remaining[0] == 0) {
      remaining[0] = -1;
      return replacement;
    }
    remaining[0]--;
    if (!(node instanceof Operation)) {
      return node;
    }
    Operation operation = (Operation) node;
    Node left = replace(operation.left(), remaining, replacement);
    Node right =
        operation.right() == null || remaining[0] < 0
            ? operation.right()
            : replace(operation.right(), remaining, replacement);
    if (left == operation.left() && right == operation.right()) {
      return operation;
    }
    return new Operation(operation.operator(), left, right);
  }

  private Formulas() {}
}
