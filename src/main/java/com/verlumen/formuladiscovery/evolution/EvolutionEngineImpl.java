package com.verlumen.formuladiscovery.evolution;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.verlumen.formuladiscovery.features.TrainingExample;
import com.verlumen.formuladiscovery.formula.Formulas;
import com.verlumen.formuladiscovery.formula.Node;
import io.jenetics.util.RandomRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.random.RandomGenerator;

/**
 * Implementation of the EvolutionEngine interface. This class drives the generational loop but
 * delegates generation, variation, scoring and selection to specialized collaborators.
 */
final class EvolutionEngineImpl implements EvolutionEngine {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final FitnessCalculator fitnessCalculator;
  private final FormulaGenerator generator;
  private final GeneticOperators operators;
  private final Selection selection;

  @Inject
  EvolutionEngineImpl(
      FitnessCalculator fitnessCalculator,
      FormulaGenerator generator,
      GeneticOperators operators,
      Selection selection) {
    this.fitnessCalculator = fitnessCalculator;
    this.generator = generator;
    this.operators = operators;
    this.selection = selection;
  }

  @Override
  public FormulaWithFitness runEvolution(
      List<String> variables, List<TrainingExample> examples, EvolutionConfig config) {
    return runEvolution(variables, examples, config, RandomRegistry.random());
  }

  @Override
  public FormulaWithFitness runEvolution(
      List<String> variables,
      List<TrainingExample> examples,
      EvolutionConfig config,
      RandomGenerator random) {
    checkNotNull(config, "Evolution config cannot be null");
    checkNotNull(random, "Random generator cannot be null");

    ImmutableList<FormulaWithFitness> population =
        initializePopulation(variables, examples, config, random);
    logProgress(0, population);

    for (int generation = 1; generation <= config.maxGenerations(); generation++) {
      population = evolveGeneration(population, variables, examples, config, random);
      logProgress(generation, population);
    }

    FormulaWithFitness best = population.get(0);
    logger.atFine().log(
        "Evolution finished after %d generations: %s (fitness=%.6f, complexity=%d)",
        config.maxGenerations(), best.formula(), best.fitness(), best.complexity());
    return best;
  }

  @Override
  public ImmutableList<FormulaWithFitness> initializePopulation(
      List<String> variables,
      List<TrainingExample> examples,
      EvolutionConfig config,
      RandomGenerator random) {
    checkArgument(
        config.populationSize() > 0,
        "Population size must be positive: %s",
        config.populationSize());

    List<FormulaWithFitness> population = new ArrayList<>(config.populationSize());
    for (int i = 0; i < config.populationSize(); i++) {
      Node formula =
          generator.randomFormula(variables, config.maxDepth(), config.maxNodes(), random);
      population.add(score(formula, examples, config));
    }
    return sorted(population);
  }

  @Override
  public ImmutableList<FormulaWithFitness> evolveGeneration(
      List<FormulaWithFitness> population,
      List<String> variables,
      List<TrainingExample> examples,
      EvolutionConfig config,
      RandomGenerator random) {
    checkArgument(!population.isEmpty(), "Population cannot be empty");

    List<FormulaWithFitness> next = new ArrayList<>(population.size());
    for (FormulaWithFitness elite : selection.elite(population, config.elitismCount())) {
      next.add(score(elite.formula().copy(), examples, config));
    }

    while (next.size() < population.size()) {
      Node child;
      if (random.nextDouble() < config.crossoverRate()) {
        FormulaWithFitness first =
            selection.tournament(population, config.tournamentSize(), 1, random).get(0);
        FormulaWithFitness second =
            selection.tournament(population, config.tournamentSize(), 1, random).get(0);
        GeneticOperators.Offspring offspring =
            operators.crossover(first.formula(), second.formula(), random);
        child = random.nextDouble() < 0.5 ? offspring.first() : offspring.second();
      } else {
        FormulaWithFitness parent =
            selection.tournament(population, config.tournamentSize(), 1, random).get(0);
        child = parent.formula().copy();
      }

      child =
          operators.mutate(
              child, variables, config.mutationRate(), config.symmetricMutation(), random);
      next.add(score(child, examples, config));
    }
    return sorted(next);
  }

  private FormulaWithFitness score(
      Node formula, List<TrainingExample> examples, EvolutionConfig config) {
    int complexity = Formulas.complexity(formula);
    double fitness =
        fitnessCalculator.calculateAdjustedFitness(
            formula, examples, config.fitnessType(), config.complexityWeight());
    return new FormulaWithFitness(formula, fitness, complexity);
  }

  private static ImmutableList<FormulaWithFitness> sorted(List<FormulaWithFitness> population) {
    return ImmutableList.sortedCopyOf(PopulationStatistics.BY_FITNESS, population);
  }

  private static void logProgress(int generation, List<FormulaWithFitness> population) {
    logger.atFine().log(
        "Generation %d: best=%.6f average=%.6f diversity=%.6f",
        generation,
        population.get(0).fitness(),
        PopulationStatistics.averageFitness(population),
        PopulationStatistics.diversity(population));
  }
}
