package com.verlumen.formuladiscovery.evolution;

import com.google.inject.Inject;
import com.verlumen.formuladiscovery.features.TrainingExample;
import com.verlumen.formuladiscovery.formula.FormulaFunction;
import com.verlumen.formuladiscovery.formula.Formulas;
import com.verlumen.formuladiscovery.formula.Node;
import java.util.List;

/**
 * Implementation of the FitnessCalculator interface which evaluates a formula once per example
 * through its feature-bound {@link FormulaFunction}.
 */
final class FitnessCalculatorImpl implements FitnessCalculator {
  @Inject
  FitnessCalculatorImpl() {}

  @Override
  public double calculateFitness(
      Node formula, List<TrainingExample> examples, FitnessType fitnessType) {
    if (examples.isEmpty()) {
      return WORST_FITNESS;
    }

    FormulaFunction function = Formulas.toFunction(formula);
    switch (fitnessType) {
      case MAE:
        return meanAbsoluteError(function, examples);
      case RMSE:
        return rootMeanSquaredError(function, examples);
      case SPEARMAN:
        return spearmanFitness(function, examples);
    }
    return WORST_FITNESS;
  }

  @Override
  public double calculateAdjustedFitness(
      Node formula,
      List<TrainingExample> examples,
      FitnessType fitnessType,
      double complexityWeight) {
    return calculateFitness(formula, examples, fitnessType)
        + complexityWeight * Formulas.complexity(formula);
  }

  private static double meanAbsoluteError(
      FormulaFunction function, List<TrainingExample> examples) {
    double sum = 0.0;
    for (TrainingExample example : examples) {
      sum += Math.abs(function.apply(example.inputs()) - example.targetReturn());
    }
    return sum / examples.size();
  }

  private static double rootMeanSquaredError(
      FormulaFunction function, List<TrainingExample> examples) {
    double sum = 0.0;
    for (TrainingExample example : examples) {
      double diff = function.apply(example.inputs()) - example.targetReturn();
      sum += diff * diff;
    }
    return Math.sqrt(sum / examples.size());
  }

  /** {@code 1 - correlation}, so a perfect positive rank correlation scores {@code 0}. */
  private static double spearmanFitness(FormulaFunction function, List<TrainingExample> examples) {
    if (examples.size() < 2) {
      return 1.0;
    }
    double[] predicted = new double[examples.size()];
    double[] actual = new double[examples.size()];
    for (int i = 0; i < examples.size(); i++) {
      predicted[i] = function.apply(examples.get(i).inputs());
      actual[i] = examples.get(i).targetReturn();
    }
    return 1.0 - RankStatistics.spearmanCorrelation(predicted, actual);
  }
}
