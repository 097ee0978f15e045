package com.verlumen.formuladiscovery.evolution;

import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import com.verlumen.formuladiscovery.formula.Constant;
import com.verlumen.formuladiscovery.formula.Formulas;
import com.verlumen.formuladiscovery.formula.Node;
import com.verlumen.formuladiscovery.formula.Operation;
import com.verlumen.formuladiscovery.formula.Operator;
import java.util.List;
import java.util.random.RandomGenerator;

final class GeneticOperatorsImpl implements GeneticOperators {
  private final FormulaGenerator generator;

  @Inject
  GeneticOperatorsImpl(FormulaGenerator generator) {
    this.generator = generator;
  }

  @Override
  public Node mutate(
      Node formula,
      List<String> variables,
      double mutationRate,
      boolean symmetric,
      RandomGenerator random) {
    if (random.nextDouble() > mutationRate) {
      return formula.copy();
    }
    return mutateNode(formula, variables, mutationRate, symmetric, random);
  }

  private Node mutateNode(
      Node node,
      List<String> variables,
      double mutationRate,
      boolean symmetric,
      RandomGenerator random) {
    if (random.nextDouble() > mutationRate) {
      if (!(node instanceof Operation)) {
        return node.copy();
      }
      Operation operation = (Operation) node;
      Node left = mutateNode(operation.left(), variables, mutationRate, symmetric, random);
      Node right = operation.right();
      if (right != null) {
        right =
            symmetric
                ? mutateNode(right, variables, mutationRate, symmetric, random)
                : right.copy();
      }
      return new Operation(operation.operator(), left, right);
    }

    switch (random.nextInt(4)) {
      case 0:
        return generator.randomTerminal(variables, random);
      case 1:
        if (node instanceof Constant) {
          double delta = (random.nextDouble() * 2.0 - 1.0) * GPConstants.CONSTANT_PERTURBATION;
          return Constant.of(((Constant) node).value() + delta);
        }
        return generator.randomTerminal(variables, random);
      case 2:
        if (node instanceof Operation) {
          Operation operation = (Operation) node;
          ImmutableList<Operator> pool =
              operation.operator().isBinary()
                  ? Operator.BINARY_OPERATORS
                  : Operator.UNARY_OPERATORS;
          return operation.copy().withOperator(FormulaGeneratorImpl.pick(pool, random));
        }
        return generator.randomTerminal(variables, random);
      default:
        return generator.randomFormula(
            variables, GPConstants.REGROW_MAX_DEPTH, GPConstants.REGROW_MAX_NODES, random);
    }
  }

  @Override
  public Offspring crossover(Node first, Node second, RandomGenerator random) {
    ImmutableList<Node> firstNodes = Formulas.collectNodes(first);
    ImmutableList<Node> secondNodes = Formulas.collectNodes(second);
    int firstPoint = random.nextInt(firstNodes.size());
    int secondPoint = random.nextInt(secondNodes.size());

    if (firstPoint == 0 || secondPoint == 0) {
      return new Offspring(first.copy(), second.copy());
    }

    Node firstChild =
        Formulas.replaceAt(first.copy(), firstPoint, secondNodes.get(secondPoint).copy());
    Node secondChild =
        Formulas.replaceAt(second.copy(), secondPoint, firstNodes.get(firstPoint).copy());
    return new Offspring(firstChild, secondChild);
  }
}
