package com.verlumen.formuladiscovery.features;

import static com.google.common.collect.ImmutableList.toImmutableList;
import static com.google.common.collect.ImmutableMap.toImmutableMap;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.function.Function;
import java.util.stream.Stream;

/** The variables a formula may reference, each bound to a field of {@link TrainingInputs}. */
public enum Feature {
  LONG_TERM("long_term", Kind.SCORE),
  FUNDAMENTALS("fundamentals", Kind.SCORE),
  DIVIDENDS("dividends", Kind.SCORE),
  OPPORTUNITY("opportunity", Kind.SCORE),
  SHORT_TERM("short_term", Kind.SCORE),
  TECHNICALS("technicals", Kind.SCORE),
  OPINION("opinion", Kind.SCORE),
  DIVERSIFICATION("diversification", Kind.SCORE),
  TOTAL_SCORE("total_score", Kind.SCORE),
  CAGR("cagr", Kind.METRIC),
  DIVIDEND_YIELD("dividend_yield", Kind.METRIC),
  VOLATILITY("volatility", Kind.METRIC),
  REGIME("regime", Kind.REGIME),
  SHARPE("sharpe", Kind.OPTIONAL_METRIC),
  SORTINO("sortino", Kind.OPTIONAL_METRIC),
  RSI("rsi", Kind.OPTIONAL_METRIC),
  MAX_DRAWDOWN("max_drawdown", Kind.OPTIONAL_METRIC);

  enum Kind {
    SCORE,
    METRIC,
    OPTIONAL_METRIC,
    REGIME
  }

  private static final ImmutableMap<String, Feature> BY_VARIABLE_NAME =
      Stream.of(values()).collect(toImmutableMap(Feature::variableName, Function.identity()));

  private final String variableName;
  private final Kind kind;

  Feature(String variableName, Kind kind) {
    this.variableName = variableName;
    this.kind = kind;
  }

  /** The identifier used for this feature in formula text. */
  public String variableName() {
    return variableName;
  }

  /** True for metrics that may be absent from an input set. */
  public boolean isOptional() {
    return kind == Kind.OPTIONAL_METRIC;
  }

  /** True for the score groups (long term through total score). */
  public boolean isScore() {
    return kind == Kind.SCORE;
  }

  /** The regime score is the only feature left out of min-max normalization. */
  public boolean isNormalized() {
    return kind != Kind.REGIME;
  }

  public static Optional<Feature> fromVariableName(String variableName) {
    return Optional.ofNullable(BY_VARIABLE_NAME.get(variableName));
  }

  /** Variable names of all features, in declaration order. */
  public static ImmutableList<String> allVariableNames() {
    return Stream.of(values()).map(Feature::variableName).collect(toImmutableList());
  }

  /**
   * Variable names of the features observed in {@code inputs}: every required feature, plus the
   * optional metrics that are present.
   */
  public static ImmutableList<String> availableVariableNames(TrainingInputs inputs) {
    return Stream.of(values())
        .filter(feature -> !feature.isOptional() || feature.observedValue(inputs).isPresent())
        .map(Feature::variableName)
        .collect(toImmutableList());
  }

  /** The value of this feature; an absent optional metric reads as {@code 0.0}. */
  public double valueOf(TrainingInputs inputs) {
    switch (this) {
      case LONG_TERM:
        return inputs.longTermScore();
      case FUNDAMENTALS:
        return inputs.fundamentalsScore();
      case DIVIDENDS:
        return inputs.dividendsScore();
      case OPPORTUNITY:
        return inputs.opportunityScore();
      case SHORT_TERM:
        return inputs.shortTermScore();
      case TECHNICALS:
        return inputs.technicalsScore();
      case OPINION:
        return inputs.opinionScore();
      case DIVERSIFICATION:
        return inputs.diversificationScore();
      case TOTAL_SCORE:
        return inputs.totalScore();
      case CAGR:
        return inputs.cagr();
      case DIVIDEND_YIELD:
        return inputs.dividendYield();
      case VOLATILITY:
        return inputs.volatility();
      case REGIME:
        return inputs.regimeScore();
      case SHARPE:
      case SORTINO:
      case RSI:
      case MAX_DRAWDOWN:
        return observedValue(inputs).orElse(0.0);
    }
    throw new AssertionError("Unhandled feature: " + this);
  }

  /** The value of this feature, empty only for an absent optional metric. */
  public OptionalDouble observedValue(TrainingInputs inputs) {
    switch (this) {
      case SHARPE:
        return inputs.sharpeRatio();
      case SORTINO:
        return inputs.sortinoRatio();
      case RSI:
        return inputs.rsi();
      case MAX_DRAWDOWN:
        return inputs.maxDrawdown();
      default:
        return OptionalDouble.of(valueOf(inputs));
    }
  }

  /** Sets this feature on {@code builder}. */
  public TrainingInputs.Builder set(TrainingInputs.Builder builder, double value) {
    switch (this) {
      case LONG_TERM:
        return builder.setLongTermScore(value);
      case FUNDAMENTALS:
        return builder.setFundamentalsScore(value);
      case DIVIDENDS:
        return builder.setDividendsScore(value);
      case OPPORTUNITY:
        return builder.setOpportunityScore(value);
      case SHORT_TERM:
        return builder.setShortTermScore(value);
      case TECHNICALS:
        return builder.setTechnicalsScore(value);
      case OPINION:
        return builder.setOpinionScore(value);
      case DIVERSIFICATION:
        return builder.setDiversificationScore(value);
      case TOTAL_SCORE:
        return builder.setTotalScore(value);
      case CAGR:
        return builder.setCagr(value);
      case DIVIDEND_YIELD:
        return builder.setDividendYield(value);
      case VOLATILITY:
        return builder.setVolatility(value);
      case REGIME:
        return builder.setRegimeScore(value);
      case SHARPE:
        return builder.setSharpeRatio(value);
      case SORTINO:
        return builder.setSortinoRatio(value);
      case RSI:
        return builder.setRsi(value);
      case MAX_DRAWDOWN:
        return builder.setMaxDrawdown(value);
    }
    throw new AssertionError("Unhandled feature: " + this);
  }
}
