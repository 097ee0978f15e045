package com.verlumen.formuladiscovery.evolution;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/** Summary statistics over a population. */
public final class PopulationStatistics {
  /** Ascending fitness; NaN sorts after every number. */
  public static final Comparator<FormulaWithFitness> BY_FITNESS =
      Comparator.comparingDouble(FormulaWithFitness::fitness);

  /** The member with the lowest fitness, the earliest on ties. */
  public static Optional<FormulaWithFitness> best(List<FormulaWithFitness> population) {
    FormulaWithFitness best = null;
    for (FormulaWithFitness member : population) {
      if (best == null || BY_FITNESS.compare(member, best) < 0) {
        best = member;
      }
    }
    return Optional.ofNullable(best);
  }

  /** Mean fitness; {@link Double#MAX_VALUE} for an empty population. */
  public static double averageFitness(List<FormulaWithFitness> population) {
    if (population.isEmpty()) {
      return Double.MAX_VALUE;
    }
    double sum = 0.0;
    for (FormulaWithFitness member : population) {
      sum += member.fitness();
    }
    return sum / population.size();
  }

  /** Population standard deviation of fitness; {@code 0} below two members. */
  public static double diversity(List<FormulaWithFitness> population) {
    if (population.size() < 2) {
      return 0.0;
    }
    double average = averageFitness(population);
    double sumSquares = 0.0;
    for (FormulaWithFitness member : population) {
      double diff = member.fitness() - average;
      sumSquares += diff * diff;
    }
    return Math.sqrt(sumSquares / population.size());
  }

  private PopulationStatistics() {}
}
