package com.verlumen.formuladiscovery.evolution;

import com.verlumen.formuladiscovery.formula.Node;
import java.util.List;
import java.util.random.RandomGenerator;

/** Mutation and crossover over formula trees. Inputs are never modified. */
public interface GeneticOperators {
  /** Two offspring of a crossover. */
  record Offspring(Node first, Node second) {}

  /**
   * Mutates a formula.
   *
   * @param formula the parent formula
   * @param variables names available to new terminals
   * @param mutationRate probability that mutation proceeds at all, and then per visited node
   * @param symmetric whether nodes left in place have both children visited, not only the left
   * @param random the source of randomness for this call
   * @return a new tree; a clone of {@code formula} when no mutation happens
   */
  Node mutate(
      Node formula,
      List<String> variables,
      double mutationRate,
      boolean symmetric,
      RandomGenerator random);

  /**
   * Swaps a random subtree of each parent. If either chosen point is its tree's root, returns
   * clones of both parents.
   */
  Offspring crossover(Node first, Node second, RandomGenerator random);
}
