package com.verlumen.formuladiscovery.evolution;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.verlumen.formuladiscovery.formula.Constant;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class PopulationStatisticsTest {
  @Test
  public void best_returnsLowestFitness() {
    FormulaWithFitness best = member(0.1);

    assertThat(PopulationStatistics.best(ImmutableList.of(member(0.4), best, member(0.2))))
        .hasValue(best);
    assertThat(PopulationStatistics.best(ImmutableList.of())).isEmpty();
  }

  @Test
  public void best_nanFitness_ranksLast() {
    FormulaWithFitness finite = member(5.0);

    assertThat(PopulationStatistics.best(ImmutableList.of(member(Double.NaN), finite)))
        .hasValue(finite);
  }

  @Test
  public void averageFitness_emptyPopulation_returnsMaxValue() {
    assertThat(PopulationStatistics.averageFitness(ImmutableList.of()))
        .isEqualTo(Double.MAX_VALUE);
    assertThat(PopulationStatistics.averageFitness(ImmutableList.of(member(1.0), member(3.0))))
        .isEqualTo(2.0);
  }

  @Test
  public void diversity_returnsPopulationStandardDeviation() {
    assertThat(PopulationStatistics.diversity(ImmutableList.of(member(1.0), member(3.0))))
        .isWithin(1e-12)
        .of(1.0);
    assertThat(PopulationStatistics.diversity(ImmutableList.of(member(1.0)))).isEqualTo(0.0);
  }

  private static FormulaWithFitness member(double fitness) {
    return new FormulaWithFitness(Constant.of(fitness), fitness, 1);
  }
}
