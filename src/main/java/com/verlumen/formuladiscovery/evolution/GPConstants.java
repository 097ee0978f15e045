package com.verlumen.formuladiscovery.evolution;

/**
 * Constants used throughout formula evolution. Extracted to a separate class to avoid duplication
 * and facilitate changes.
 */
public final class GPConstants {
  public static final int DEFAULT_POPULATION_SIZE = 100;
  public static final int DEFAULT_MAX_GENERATIONS = 50;
  public static final int DEFAULT_MAX_DEPTH = 4;
  public static final int DEFAULT_MAX_NODES = 15;
  public static final double DEFAULT_MUTATION_RATE = 0.15;
  public static final double DEFAULT_CROSSOVER_RATE = 0.7;
  public static final int DEFAULT_TOURNAMENT_SIZE = 3;
  public static final int DEFAULT_ELITISM_COUNT = 2;
  public static final double DEFAULT_COMPLEXITY_WEIGHT = 0.01;

  /** Terminal probability at depth 0, raised by {@link #TERMINAL_PROBABILITY_STEP} per level. */
  static final double BASE_TERMINAL_PROBABILITY = 0.3;

  static final double TERMINAL_PROBABILITY_STEP = 0.1;

  /** Largest change applied to a constant by a perturbation mutation. */
  static final double CONSTANT_PERTURBATION = 0.1;

  /** Bounds of the subtree grown by a regrow mutation. */
  static final int REGROW_MAX_DEPTH = 2;

  static final int REGROW_MAX_NODES = 5;

  /** Smallest regime bucket a formula is discovered for. */
  public static final int MIN_DISCOVERY_EXAMPLES = 10;

  /** Share of the most recent examples held out for validation. */
  public static final double DEFAULT_VALIDATION_FRACTION = 0.2;

  private GPConstants() {}
}
