package com.verlumen.formuladiscovery.evolution;

import com.verlumen.formuladiscovery.features.TrainingExample;
import com.verlumen.formuladiscovery.formula.Node;
import java.util.List;

/** Scores formulas against training examples. Lower fitness is better. */
public interface FitnessCalculator {
  /** Fitness reported for an empty example set. */
  double WORST_FITNESS = Double.MAX_VALUE;

  /**
   * Calculates the raw fitness of a formula.
   *
   * @param formula the formula to score
   * @param examples the examples to predict; an empty list yields {@link #WORST_FITNESS}
   * @param fitnessType the error measure
   * @return the fitness, lower is better
   */
  double calculateFitness(Node formula, List<TrainingExample> examples, FitnessType fitnessType);

  /** Raw fitness plus {@code complexityWeight} per node of the formula. */
  double calculateAdjustedFitness(
      Node formula,
      List<TrainingExample> examples,
      FitnessType fitnessType,
      double complexityWeight);
}
