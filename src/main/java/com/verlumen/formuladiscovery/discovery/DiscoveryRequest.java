package com.verlumen.formuladiscovery.discovery;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.verlumen.formuladiscovery.evolution.EvolutionConfig;
import com.verlumen.formuladiscovery.evolution.GPConstants;
import com.verlumen.formuladiscovery.features.TrainingExample;
import com.verlumen.formuladiscovery.regime.RegimeRange;
import java.util.List;
import java.util.Optional;

/** Everything needed for one discovery: the data, how to partition it and how to search it. */
@AutoValue
public abstract class DiscoveryRequest {
  public abstract FormulaType formulaType();

  public abstract SecurityType securityType();

  public abstract ImmutableList<TrainingExample> examples();

  /** Ranges to discover a formula for; empty means a single run over all examples. */
  public abstract ImmutableList<RegimeRange> regimeRanges();

  public abstract EvolutionConfig evolutionConfig();

  /** Whether to min-max normalize inputs before evolving. */
  public abstract boolean normalize();

  /** Share of each bucket, latest examples first, held back for validation. */
  public abstract double validationFraction();

  public abstract Optional<ImmutableList<String>> variables();

  /** The requested variables, or the formula type's defaults. */
  public ImmutableList<String> effectiveVariables() {
    return variables().orElseGet(formulaType()::defaultVariables);
  }

  public static Builder builder() {
    return new AutoValue_DiscoveryRequest.Builder()
        .setFormulaType(FormulaType.EXPECTED_RETURN)
        .setSecurityType(SecurityType.STOCK)
        .setRegimeRanges(ImmutableList.of())
        .setEvolutionConfig(EvolutionConfig.defaults())
        .setNormalize(false)
        .setValidationFraction(GPConstants.DEFAULT_VALIDATION_FRACTION);
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setFormulaType(FormulaType formulaType);

    public abstract Builder setSecurityType(SecurityType securityType);

    public abstract Builder setExamples(List<TrainingExample> examples);

    public abstract Builder setRegimeRanges(List<RegimeRange> regimeRanges);

    public abstract Builder setEvolutionConfig(EvolutionConfig evolutionConfig);

    public abstract Builder setNormalize(boolean normalize);

    public abstract Builder setValidationFraction(double validationFraction);

    public abstract Builder setVariables(ImmutableList<String> variables);

    abstract DiscoveryRequest autoBuild();

    public DiscoveryRequest build() {
      DiscoveryRequest request = autoBuild();
      checkArgument(
          request.validationFraction() > 0.0 && request.validationFraction() < 1.0,
          "Validation fraction must be in (0, 1): %s",
          request.validationFraction());
      return request;
    }
  }
}
