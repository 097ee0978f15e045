package com.verlumen.formuladiscovery.evolution;

import com.verlumen.formuladiscovery.formula.Node;
import java.util.List;
import java.util.random.RandomGenerator;

/** Builds random formula trees. */
public interface FormulaGenerator {
  /**
   * Generates a random formula.
   *
   * @param variables names a variable terminal may reference; when empty only constants are used
   * @param maxDepth depth at which a terminal is forced
   * @param maxNodes node count at which a terminal is forced
   * @param random the source of randomness for this call
   */
  Node randomFormula(List<String> variables, int maxDepth, int maxNodes, RandomGenerator random);

  /** A variable or a constant in [-1, 1) with equal probability. */
  Node randomTerminal(List<String> variables, RandomGenerator random);
}
