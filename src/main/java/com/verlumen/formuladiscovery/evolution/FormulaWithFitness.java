package com.verlumen.formuladiscovery.evolution;

import static com.google.common.base.Preconditions.checkNotNull;

import com.verlumen.formuladiscovery.formula.Node;

/** A population member: a formula, its fitness (lower is better) and its node count. */
public record FormulaWithFitness(Node formula, double fitness, int complexity) {
  public FormulaWithFitness {
    checkNotNull(formula, "Formula cannot be null");
  }

  /** Returns a member with a deep copy of this formula and the same scores. */
  public FormulaWithFitness copy() {
    return new FormulaWithFitness(formula.copy(), fitness, complexity);
  }
}
