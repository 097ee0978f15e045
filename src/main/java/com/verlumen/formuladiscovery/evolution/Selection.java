package com.verlumen.formuladiscovery.evolution;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.random.RandomGenerator;

/** Parent and survivor selection. */
public interface Selection {
  /**
   * Runs {@code selections} independent tournaments. Each samples {@code tournamentSize} members
   * with replacement and keeps the one with the lowest fitness, the earliest drawn on ties.
   */
  ImmutableList<FormulaWithFitness> tournament(
      List<FormulaWithFitness> population,
      int tournamentSize,
      int selections,
      RandomGenerator random);

  /** The {@code count} fittest members, best first. The population is not reordered. */
  ImmutableList<FormulaWithFitness> elite(List<FormulaWithFitness> population, int count);
}
