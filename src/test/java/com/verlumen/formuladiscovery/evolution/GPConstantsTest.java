package com.verlumen.formuladiscovery.evolution;

import static com.google.common.truth.Truth.assertThat;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class GPConstantsTest {
  @Test
  public void defaults_matchDocumentedValues() {
    assertThat(GPConstants.DEFAULT_POPULATION_SIZE).isEqualTo(100);
    assertThat(GPConstants.DEFAULT_MAX_GENERATIONS).isEqualTo(50);
    assertThat(GPConstants.DEFAULT_MAX_DEPTH).isEqualTo(4);
    assertThat(GPConstants.DEFAULT_MAX_NODES).isEqualTo(15);
    assertThat(GPConstants.DEFAULT_MUTATION_RATE).isEqualTo(0.15);
    assertThat(GPConstants.DEFAULT_CROSSOVER_RATE).isEqualTo(0.7);
    assertThat(GPConstants.DEFAULT_TOURNAMENT_SIZE).isEqualTo(3);
    assertThat(GPConstants.DEFAULT_ELITISM_COUNT).isEqualTo(2);
    assertThat(GPConstants.DEFAULT_COMPLEXITY_WEIGHT).isEqualTo(0.01);
  }

  @Test
  public void eliteCount_isSmallerThanPopulation() {
    assertThat(GPConstants.DEFAULT_ELITISM_COUNT).isLessThan(GPConstants.DEFAULT_POPULATION_SIZE);
  }

  @Test
  public void validationFraction_isProperFraction() {
    assertThat(GPConstants.DEFAULT_VALIDATION_FRACTION).isGreaterThan(0.0);
    assertThat(GPConstants.DEFAULT_VALIDATION_FRACTION).isLessThan(1.0);
  }
}
