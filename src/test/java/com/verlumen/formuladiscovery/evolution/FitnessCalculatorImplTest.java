package com.verlumen.formuladiscovery.evolution;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.google.inject.testing.fieldbinder.BoundFieldModule;
import com.verlumen.formuladiscovery.features.TrainingExample;
import com.verlumen.formuladiscovery.features.TrainingInputs;
import com.verlumen.formuladiscovery.formula.Constant;
import com.verlumen.formuladiscovery.formula.Node;
import com.verlumen.formuladiscovery.formula.Operation;
import com.verlumen.formuladiscovery.formula.Operator;
import com.verlumen.formuladiscovery.formula.Variable;
import java.time.LocalDate;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class FitnessCalculatorImplTest {
  private static final double TOLERANCE = 1e-9;

  @Inject private FitnessCalculatorImpl fitnessCalculator;

  private ImmutableList<TrainingExample> examples;

  @Before
  public void setUp() {
    // Target return equals cagr for every example.
    examples =
        ImmutableList.of(
            example(0.1, 0.1), example(0.2, 0.2), example(0.3, 0.3), example(0.4, 0.4));
    Guice.createInjector(BoundFieldModule.of(this)).injectMembers(this);
  }

  @Test
  public void calculateFitness_exactFormula_returnsZeroMae() {
    double fitness =
        fitnessCalculator.calculateFitness(Variable.of("cagr"), examples, FitnessType.MAE);

    assertThat(fitness).isWithin(TOLERANCE).of(0.0);
  }

  @Test
  public void calculateFitness_mae_ranksCloserFormulaFirst() {
    // Arrange
    Node close = Operation.binary(Operator.MULTIPLY, Variable.of("cagr"), Constant.of(0.9));
    Node far = Constant.of(1.0);

    // Act
    double closeFitness = fitnessCalculator.calculateFitness(close, examples, FitnessType.MAE);
    double farFitness = fitnessCalculator.calculateFitness(far, examples, FitnessType.MAE);

    // Assert
    assertThat(closeFitness).isWithin(TOLERANCE).of(0.025);
    assertThat(farFitness).isWithin(TOLERANCE).of(0.75);
    assertThat(closeFitness).isLessThan(farFitness);
  }

  @Test
  public void calculateFitness_rmse_squaresErrors() {
    ImmutableList<TrainingExample> twoExamples =
        ImmutableList.of(example(0.0, 1.0), example(0.0, 3.0));

    double fitness =
        fitnessCalculator.calculateFitness(Constant.of(0.0), twoExamples, FitnessType.RMSE);

    assertThat(fitness).isWithin(TOLERANCE).of(Math.sqrt(5.0));
  }

  @Test
  public void calculateFitness_spearman_rewardsMonotonicFormula() {
    Node scaled = Operation.binary(Operator.MULTIPLY, Variable.of("cagr"), Constant.of(100.0));
    Node reversed = Operation.unary(Operator.NEGATE, Variable.of("cagr"));

    assertThat(fitnessCalculator.calculateFitness(scaled, examples, FitnessType.SPEARMAN))
        .isWithin(TOLERANCE)
        .of(0.0);
    assertThat(fitnessCalculator.calculateFitness(reversed, examples, FitnessType.SPEARMAN))
        .isWithin(TOLERANCE)
        .of(2.0);
  }

  @Test
  public void calculateFitness_spearmanWithSingleExample_returnsOne() {
    double fitness =
        fitnessCalculator.calculateFitness(
            Variable.of("cagr"), ImmutableList.of(example(0.1, 0.1)), FitnessType.SPEARMAN);

    assertThat(fitness).isEqualTo(1.0);
  }

  @Test
  public void calculateFitness_spearmanWithZeroProductOfAbsentMetric_returnsOne() {
    // Arrange
    // sharpe is absent and reads as 0.0, so the product is -0.0 for negative cagr.
    Node product = Operation.binary(Operator.MULTIPLY, Variable.of("cagr"), Variable.of("sharpe"));
    ImmutableList<TrainingExample> mixedSigns =
        ImmutableList.of(
            example(-0.2, 0.1), example(0.3, 0.2), example(-0.1, 0.3), example(0.4, 0.4));

    // Act
    double fitness =
        fitnessCalculator.calculateFitness(product, mixedSigns, FitnessType.SPEARMAN);

    // Assert
    assertThat(fitness).isWithin(TOLERANCE).of(1.0);
  }

  @Test
  public void calculateFitness_noExamples_returnsWorstFitness() {
    double fitness =
        fitnessCalculator.calculateFitness(
            Variable.of("cagr"), ImmutableList.of(), FitnessType.MAE);

    assertThat(fitness).isEqualTo(Double.MAX_VALUE);
  }

  @Test
  public void calculateAdjustedFitness_addsWeightPerNode() {
    Node formula = Operation.binary(Operator.ADD, Variable.of("cagr"), Constant.of(0.0));

    double adjusted =
        fitnessCalculator.calculateAdjustedFitness(formula, examples, FitnessType.MAE, 0.01);

    assertThat(adjusted).isWithin(TOLERANCE).of(0.03);
  }

  private static TrainingExample example(double cagr, double targetReturn) {
    return TrainingExample.create(
        "AAPL",
        LocalDate.of(2023, 1, 31),
        LocalDate.of(2023, 7, 31),
        TrainingInputs.builder().setCagr(cagr).build(),
        targetReturn);
  }
}
