package com.verlumen.formuladiscovery.features;

import com.google.auto.value.AutoValue;
import java.util.OptionalDouble;

/**
 * The fixed feature set of one security at one point in time: score groups, metrics, optional
 * risk metrics and the market regime score.
 *
 * <p>Optional metrics may be absent; formulas read an absent metric as {@code 0.0}.
 */
@AutoValue
public abstract class TrainingInputs {
  public abstract double longTermScore();

  public abstract double fundamentalsScore();

  public abstract double dividendsScore();

  public abstract double opportunityScore();

  public abstract double shortTermScore();

  public abstract double technicalsScore();

  public abstract double opinionScore();

  public abstract double diversificationScore();

  public abstract double totalScore();

  public abstract double cagr();

  public abstract double dividendYield();

  public abstract double volatility();

  /** Continuous market regime score in [-1, 1]. */
  public abstract double regimeScore();

  public abstract OptionalDouble sharpeRatio();

  public abstract OptionalDouble sortinoRatio();

  public abstract OptionalDouble rsi();

  public abstract OptionalDouble maxDrawdown();

  public abstract Builder toBuilder();

  /** Returns a builder with every score and metric set to {@code 0.0} and no optional metrics. */
  public static Builder builder() {
    return new AutoValue_TrainingInputs.Builder()
        .setLongTermScore(0.0)
        .setFundamentalsScore(0.0)
        .setDividendsScore(0.0)
        .setOpportunityScore(0.0)
        .setShortTermScore(0.0)
        .setTechnicalsScore(0.0)
        .setOpinionScore(0.0)
        .setDiversificationScore(0.0)
        .setTotalScore(0.0)
        .setCagr(0.0)
        .setDividendYield(0.0)
        .setVolatility(0.0)
        .setRegimeScore(0.0);
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setLongTermScore(double value);

    public abstract Builder setFundamentalsScore(double value);

    public abstract Builder setDividendsScore(double value);

    public abstract Builder setOpportunityScore(double value);

    public abstract Builder setShortTermScore(double value);

    public abstract Builder setTechnicalsScore(double value);

    public abstract Builder setOpinionScore(double value);

    public abstract Builder setDiversificationScore(double value);

    public abstract Builder setTotalScore(double value);

    public abstract Builder setCagr(double value);

    public abstract Builder setDividendYield(double value);

    public abstract Builder setVolatility(double value);

    public abstract Builder setRegimeScore(double value);

    public abstract Builder setSharpeRatio(double value);

    public abstract Builder setSortinoRatio(double value);

    public abstract Builder setRsi(double value);

    public abstract Builder setMaxDrawdown(double value);

    public abstract TrainingInputs build();
  }
}
