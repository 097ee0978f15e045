package com.verlumen.formuladiscovery.evolution;

import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import com.verlumen.formuladiscovery.formula.Constant;
import com.verlumen.formuladiscovery.formula.Node;
import com.verlumen.formuladiscovery.formula.Operation;
import com.verlumen.formuladiscovery.formula.Operator;
import com.verlumen.formuladiscovery.formula.Variable;
import java.util.List;
import java.util.random.RandomGenerator;

final class FormulaGeneratorImpl implements FormulaGenerator {
  @Inject
  FormulaGeneratorImpl() {}

  @Override
  public Node randomFormula(
      List<String> variables, int maxDepth, int maxNodes, RandomGenerator random) {
    if (variables.isEmpty()) {
      return randomConstant(random);
    }
    return grow(variables, 0, maxDepth, maxNodes, 0, random);
  }

  @Override
  public Node randomTerminal(List<String> variables, RandomGenerator random) {
    if (variables.isEmpty()) {
      return randomConstant(random);
    }
    if (random.nextDouble() < 0.5) {
      return Variable.of(variables.get(random.nextInt(variables.size())));
    }
    return randomConstant(random);
  }

  /**
   * {@code nodeCount} is not a running total of the tree: a binary node passes {@code nodeCount +
   * 1} to its left child and {@code nodeCount + 2} to its right child, however large the left
   * subtree grows.
   */
  private Node grow(
      List<String> variables,
      int depth,
      int maxDepth,
      int maxNodes,
      int nodeCount,
      RandomGenerator random) {
    if (nodeCount >= maxNodes || depth >= maxDepth) {
      return randomTerminal(variables, random);
    }

    double terminalProbability =
        GPConstants.BASE_TERMINAL_PROBABILITY + depth * GPConstants.TERMINAL_PROBABILITY_STEP;
    if (random.nextDouble() < terminalProbability) {
      return randomTerminal(variables, random);
    }

    if (random.nextInt(2) == 0) {
      Operator operator = pick(Operator.BINARY_OPERATORS, random);
      Node left = grow(variables, depth + 1, maxDepth, maxNodes, nodeCount + 1, random);
      Node right = grow(variables, depth + 1, maxDepth, maxNodes, nodeCount + 2, random);
      return Operation.binary(operator, left, right);
    }

    Operator operator = pick(Operator.UNARY_OPERATORS, random);
    return Operation.unary(
        operator, grow(variables, depth + 1, maxDepth, maxNodes, nodeCount + 1, random));
  }

  static Operator pick(ImmutableList<Operator> operators, RandomGenerator random) {
    return operators.get(random.nextInt(operators.size()));
  }

  private static Constant randomConstant(RandomGenerator random) {
    return Constant.of(random.nextDouble() * 2.0 - 1.0);
  }
}
