package com.verlumen.formuladiscovery.evolution;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;

/** Settings for one evolution run. Bounds are checked when the config is built. */
@AutoValue
public abstract class EvolutionConfig {
  public abstract int populationSize();

  public abstract int maxGenerations();

  /** Depth bound for randomly generated formulas. */
  public abstract int maxDepth();

  /** Node-count bound for randomly generated formulas. */
  public abstract int maxNodes();

  public abstract double mutationRate();

  public abstract double crossoverRate();

  public abstract int tournamentSize();

  public abstract int elitismCount();

  public abstract FitnessType fitnessType();

  /** Added to raw fitness once per node; {@code 0} disables the complexity penalty. */
  public abstract double complexityWeight();

  /**
   * When set, mutation visits both children of a node it leaves in place. By default only the
   * left child is visited and the right subtree is carried over unchanged.
   */
  public abstract boolean symmetricMutation();

  public abstract Builder toBuilder();

  /** A builder preloaded with the {@link GPConstants} defaults. */
  public static Builder builder() {
    return new AutoValue_EvolutionConfig.Builder()
        .setPopulationSize(GPConstants.DEFAULT_POPULATION_SIZE)
        .setMaxGenerations(GPConstants.DEFAULT_MAX_GENERATIONS)
        .setMaxDepth(GPConstants.DEFAULT_MAX_DEPTH)
        .setMaxNodes(GPConstants.DEFAULT_MAX_NODES)
        .setMutationRate(GPConstants.DEFAULT_MUTATION_RATE)
        .setCrossoverRate(GPConstants.DEFAULT_CROSSOVER_RATE)
        .setTournamentSize(GPConstants.DEFAULT_TOURNAMENT_SIZE)
        .setElitismCount(GPConstants.DEFAULT_ELITISM_COUNT)
        .setFitnessType(FitnessType.MAE)
        .setComplexityWeight(GPConstants.DEFAULT_COMPLEXITY_WEIGHT)
        .setSymmetricMutation(false);
  }

  public static EvolutionConfig defaults() {
    return builder().build();
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setPopulationSize(int populationSize);

    public abstract Builder setMaxGenerations(int maxGenerations);

    public abstract Builder setMaxDepth(int maxDepth);

    public abstract Builder setMaxNodes(int maxNodes);

    public abstract Builder setMutationRate(double mutationRate);

    public abstract Builder setCrossoverRate(double crossoverRate);

    public abstract Builder setTournamentSize(int tournamentSize);

    public abstract Builder setElitismCount(int elitismCount);

    public abstract Builder setFitnessType(FitnessType fitnessType);

    public abstract Builder setComplexityWeight(double complexityWeight);

    public abstract Builder setSymmetricMutation(boolean symmetricMutation);

    abstract EvolutionConfig autoBuild();

    public EvolutionConfig build() {
      EvolutionConfig config = autoBuild();
      checkArgument(
          config.populationSize() > 0,
          "Population size must be positive: %s",
          config.populationSize());
      checkArgument(
          config.maxGenerations() >= 0,
          "Max generations cannot be negative: %s",
          config.maxGenerations());
      checkArgument(config.maxDepth() >= 0, "Max depth cannot be negative: %s", config.maxDepth());
      checkArgument(config.maxNodes() >= 1, "Max nodes must be positive: %s", config.maxNodes());
      checkArgument(
          isProbability(config.mutationRate()),
          "Mutation rate must be in [0, 1]: %s",
          config.mutationRate());
      checkArgument(
          isProbability(config.crossoverRate()),
          "Crossover rate must be in [0, 1]: %s",
          config.crossoverRate());
      checkArgument(
          config.tournamentSize() >= 1,
          "Tournament size must be positive: %s",
          config.tournamentSize());
      checkArgument(
          config.elitismCount() >= 0,
          "Elitism count cannot be negative: %s",
          config.elitismCount());
      checkArgument(
          config.complexityWeight() >= 0,
          "Complexity weight cannot be negative: %s",
          config.complexityWeight());
      return config;
    }

    private static boolean isProbability(double value) {
      return value >= 0.0 && value <= 1.0;
    }
  }
}
