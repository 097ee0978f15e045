package com.verlumen.formuladiscovery.evolution;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import java.util.List;
import java.util.random.RandomGenerator;

final class SelectionImpl implements Selection {
  @Inject
  SelectionImpl() {}

  @Override
  public ImmutableList<FormulaWithFitness> tournament(
      List<FormulaWithFitness> population,
      int tournamentSize,
      int selections,
      RandomGenerator random) {
    checkArgument(!population.isEmpty(), "Cannot select from an empty population");
    checkArgument(tournamentSize > 0, "Tournament size must be positive: %s", tournamentSize);

    ImmutableList.Builder<FormulaWithFitness> selected = ImmutableList.builder();
    for (int i = 0; i < selections; i++) {
      FormulaWithFitness best = population.get(random.nextInt(population.size()));
      for (int j = 1; j < tournamentSize; j++) {
        FormulaWithFitness participant = population.get(random.nextInt(population.size()));
        if (Double.compare(participant.fitness(), best.fitness()) < 0) {
          best = participant;
        }
      }
      selected.add(best);
    }
    return selected.build();
  }

  @Override
  public ImmutableList<FormulaWithFitness> elite(List<FormulaWithFitness> population, int count) {
    return population.stream()
        .sorted(PopulationStatistics.BY_FITNESS)
        .limit(Math.max(0, count))
        .collect(toImmutableList());
  }
}
