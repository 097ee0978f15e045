package com.verlumen.formuladiscovery.discovery;

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.google.inject.Provider;
import com.verlumen.formuladiscovery.evolution.EvolutionEngine;
import com.verlumen.formuladiscovery.evolution.FitnessCalculator;
import com.verlumen.formuladiscovery.evolution.FitnessType;
import com.verlumen.formuladiscovery.evolution.FormulaWithFitness;
import com.verlumen.formuladiscovery.evolution.GPConstants;
import com.verlumen.formuladiscovery.evolution.RankStatistics;
import com.verlumen.formuladiscovery.features.FeatureNormalizer;
import com.verlumen.formuladiscovery.features.TrainingExample;
import com.verlumen.formuladiscovery.formula.FormulaFunction;
import com.verlumen.formuladiscovery.formula.Formulas;
import com.verlumen.formuladiscovery.formula.Node;
import com.verlumen.formuladiscovery.regime.RegimeRange;
import com.verlumen.formuladiscovery.regime.RegimeSplitter;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.random.RandomGenerator;

final class FormulaDiscoveryServiceImpl implements FormulaDiscoveryService {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final EvolutionEngine evolutionEngine;
  private final FitnessCalculator fitnessCalculator;
  private final Provider<RandomGenerator> randomProvider;

  @Inject
  FormulaDiscoveryServiceImpl(
      EvolutionEngine evolutionEngine,
      FitnessCalculator fitnessCalculator,
      Provider<RandomGenerator> randomProvider) {
    this.evolutionEngine = evolutionEngine;
    this.fitnessCalculator = fitnessCalculator;
    this.randomProvider = randomProvider;
  }

  @Override
  public ImmutableList<DiscoveredFormula> discover(DiscoveryRequest request) {
    ImmutableList<TrainingExample> examples =
        request.normalize()
            ? FeatureNormalizer.normalize(request.examples())
            : request.examples();
    logger.atInfo().log(
        "Discovering %s formulas for %s from %d examples",
        request.formulaType().wireName(), request.securityType().wireName(), examples.size());

    if (request.regimeRanges().isEmpty()) {
      return discoverBucket(request, examples, Optional.empty())
          .map(ImmutableList::of)
          .orElse(ImmutableList.of());
    }

    ImmutableList.Builder<DiscoveredFormula> discovered = ImmutableList.builder();
    ImmutableMap<RegimeRange, ImmutableList<TrainingExample>> buckets =
        RegimeSplitter.splitByRegime(examples, request.regimeRanges());
    for (Map.Entry<RegimeRange, ImmutableList<TrainingExample>> bucket : buckets.entrySet()) {
      discoverBucket(request, bucket.getValue(), Optional.of(bucket.getKey()))
          .ifPresent(discovered::add);
    }
    return discovered.build();
  }

  private Optional<DiscoveredFormula> discoverBucket(
      DiscoveryRequest request, List<TrainingExample> examples, Optional<RegimeRange> range) {
    String label = range.map(RegimeRange::toString).orElse("all regimes");
    if (examples.size() < GPConstants.MIN_DISCOVERY_EXAMPLES) {
      logger.atWarning().log(
          "Skipping %s: %d examples, need at least %d",
          label, examples.size(), GPConstants.MIN_DISCOVERY_EXAMPLES);
      return Optional.empty();
    }

    ImmutableList<TrainingExample> ordered =
        examples.stream()
            .sorted(Comparator.comparing(TrainingExample::date))
            .collect(toImmutableList());
    int trainingCount = trainingCount(ordered.size(), request.validationFraction());
    ImmutableList<TrainingExample> training = ordered.subList(0, trainingCount);
    ImmutableList<TrainingExample> validation = ordered.subList(trainingCount, ordered.size());

    FormulaWithFitness best =
        evolutionEngine.runEvolution(
            request.effectiveVariables(),
            training,
            request.evolutionConfig(),
            randomProvider.get());
    ValidationMetrics metrics = validate(best.formula(), training.size(), validation);
    logger.atInfo().log(
        "Discovered formula for %s: %s (fitness=%.6f, validation MAE=%.6f)",
        label, best.formula(), best.fitness(), metrics.meanAbsoluteError());

    return Optional.of(
        new DiscoveredFormula(
            request.formulaType(),
            request.securityType(),
            best.formula().toString(),
            range,
            best.fitness(),
            best.complexity(),
            metrics));
  }

  private ValidationMetrics validate(
      Node formula, int trainingCount, List<TrainingExample> validation) {
    FormulaFunction function = Formulas.toFunction(formula);
    double[] predicted = new double[validation.size()];
    double[] actual = new double[validation.size()];
    for (int i = 0; i < validation.size(); i++) {
      predicted[i] = function.apply(validation.get(i).inputs());
      actual[i] = validation.get(i).targetReturn();
    }
    return new ValidationMetrics(
        fitnessCalculator.calculateFitness(formula, validation, FitnessType.MAE),
        fitnessCalculator.calculateFitness(formula, validation, FitnessType.RMSE),
        RankStatistics.spearmanCorrelation(predicted, actual),
        trainingCount,
        validation.size());
  }

  /** Oldest {@code 1 - validationFraction} of the bucket, leaving at least one on each side. */
  static int trainingCount(int size, double validationFraction) {
    int count = (int) Math.floor(size * (1.0 - validationFraction));
    return Math.max(1, Math.min(size - 1, count));
  }
}
