package com.verlumen.formuladiscovery.evolution;

import com.google.common.collect.ImmutableList;
import com.verlumen.formuladiscovery.features.TrainingExample;
import java.util.List;
import java.util.random.RandomGenerator;

/**
 * Runs a genetic programming search for the formula that best predicts the target returns of a
 * set of training examples.
 *
 * <p>Implementations are synchronous and hold no per-run state. Concurrent runs are safe as long
 * as each one is given its own {@link RandomGenerator}.
 */
public interface EvolutionEngine {
  /**
   * Evolves a population for {@link EvolutionConfig#maxGenerations()} generations.
   *
   * @param variables names formula terminals may reference
   * @param examples the examples fitness is measured against
   * @param config population and operator settings
   * @param random the source of randomness for the whole run
   * @return the member with the lowest complexity-adjusted fitness in the final generation
   */
  FormulaWithFitness runEvolution(
      List<String> variables,
      List<TrainingExample> examples,
      EvolutionConfig config,
      RandomGenerator random);

  /** Runs with the calling thread's Jenetics {@code RandomRegistry} generator. */
  FormulaWithFitness runEvolution(
      List<String> variables, List<TrainingExample> examples, EvolutionConfig config);

  /** Creates generation zero, scored and sorted best first. */
  ImmutableList<FormulaWithFitness> initializePopulation(
      List<String> variables,
      List<TrainingExample> examples,
      EvolutionConfig config,
      RandomGenerator random);

  /**
   * Breeds the next generation: clones of the elites, then offspring of tournament-selected
   * parents, every one mutated. Returned scored and sorted best first, with the same size as
   * {@code population}.
   */
  ImmutableList<FormulaWithFitness> evolveGeneration(
      List<FormulaWithFitness> population,
      List<String> variables,
      List<TrainingExample> examples,
      EvolutionConfig config,
      RandomGenerator random);
}
