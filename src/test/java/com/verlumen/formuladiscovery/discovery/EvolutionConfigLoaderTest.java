package com.verlumen.formuladiscovery.discovery;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.verlumen.formuladiscovery.evolution.EvolutionConfig;
import com.verlumen.formuladiscovery.evolution.FitnessType;
import com.verlumen.formuladiscovery.evolution.GPConstants;
import java.io.UncheckedIOException;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class EvolutionConfigLoaderTest {
  @Test
  public void loadResource_yaml_overridesGivenKeys() {
    // Act
    EvolutionConfig config = EvolutionConfigLoader.loadResource("evolution-test.yaml");

    // Assert
    assertThat(config.populationSize()).isEqualTo(40);
    assertThat(config.maxGenerations()).isEqualTo(10);
    assertThat(config.maxDepth()).isEqualTo(3);
    assertThat(config.mutationRate()).isEqualTo(0.2);
    assertThat(config.fitnessType()).isEqualTo(FitnessType.SPEARMAN);
    assertThat(config.symmetricMutation()).isTrue();
    assertThat(config.maxNodes()).isEqualTo(GPConstants.DEFAULT_MAX_NODES);
    assertThat(config.tournamentSize()).isEqualTo(GPConstants.DEFAULT_TOURNAMENT_SIZE);
  }

  @Test
  public void loadResource_json_overridesGivenKeys() {
    EvolutionConfig config = EvolutionConfigLoader.loadResource("/evolution-test.json");

    assertThat(config.populationSize()).isEqualTo(60);
    assertThat(config.crossoverRate()).isEqualTo(0.8);
    assertThat(config.elitismCount()).isEqualTo(4);
    assertThat(config.complexityWeight()).isEqualTo(0.005);
    assertThat(config.fitnessType()).isEqualTo(FitnessType.MAE);
  }

  @Test
  public void parseYaml_emptyDocument_returnsDefaults() {
    assertThat(EvolutionConfigLoader.parseYaml("")).isEqualTo(EvolutionConfig.defaults());
  }

  @Test
  public void parseJson_unknownKey_throwsIllegalArgumentException() {
    IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () -> EvolutionConfigLoader.parseJson("{\"population\": 10}"));

    assertThat(e).hasMessageThat().contains("population");
  }

  @Test
  public void parseYaml_valueOutOfBounds_throwsIllegalArgumentException() {
    assertThrows(
        IllegalArgumentException.class, () -> EvolutionConfigLoader.parseYaml("mutation_rate: 2"));
  }

  @Test
  public void parseYaml_nonNumericValue_throwsIllegalArgumentException() {
    assertThrows(
        IllegalArgumentException.class,
        () -> EvolutionConfigLoader.parseYaml("population_size: lots"));
  }

  @Test
  public void parseYaml_fractionalInteger_throwsIllegalArgumentException() {
    IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () -> EvolutionConfigLoader.parseYaml("population_size: 1.5"));

    assertThat(e).hasMessageThat().contains("population_size");
  }

  @Test
  public void parseJson_wholeNumberWithDecimalPoint_isAccepted() {
    EvolutionConfig config = EvolutionConfigLoader.parseJson("{\"elitism_count\": 3.0}");

    assertThat(config.elitismCount()).isEqualTo(3);
  }

  @Test
  public void parseJson_notAnObject_throwsIllegalArgumentException() {
    assertThrows(IllegalArgumentException.class, () -> EvolutionConfigLoader.parseJson("[1, 2]"));
  }

  @Test
  public void loadResource_missingResource_throwsIllegalArgumentException() {
    assertThrows(
        IllegalArgumentException.class,
        () -> EvolutionConfigLoader.loadResource("evolution-test.txt"));
  }

  @Test
  public void load_missingFile_throwsUncheckedIOException() {
    assertThrows(
        UncheckedIOException.class, () -> EvolutionConfigLoader.load("/nonexistent/config.yaml"));
  }
}
