package com.verlumen.formuladiscovery.discovery;

import com.verlumen.formuladiscovery.regime.RegimeRange;
import java.util.Optional;

/**
 * A formula found by one discovery run, ready to be persisted. {@code regimeRange} is empty when
 * the run covered all examples regardless of regime.
 */
public record DiscoveredFormula(
    FormulaType formulaType,
    SecurityType securityType,
    String expression,
    Optional<RegimeRange> regimeRange,
    double trainingFitness,
    int complexity,
    ValidationMetrics validation) {}
