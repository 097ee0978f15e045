package com.verlumen.formuladiscovery.discovery;

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import com.verlumen.formuladiscovery.features.Feature;
import java.util.Locale;
import java.util.stream.Stream;

/** What a discovered formula is used for downstream. */
public enum FormulaType {
  /** Predicts the forward return of a security directly. */
  EXPECTED_RETURN,
  /** Combines score groups into a single ranking score. */
  SCORING;

  /** The score groups followed by the regime score. */
  private static final ImmutableList<String> SCORING_VARIABLES =
      Stream.concat(
              Stream.of(Feature.values()).filter(Feature::isScore), Stream.of(Feature.REGIME))
          .map(Feature::variableName)
          .collect(toImmutableList());

  /** Variables searched when a request does not name its own. */
  public ImmutableList<String> defaultVariables() {
    return this == SCORING ? SCORING_VARIABLES : Feature.allVariableNames();
  }

  /** Lower-case name used in CLI flags and output, e.g. {@code expected_return}. */
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static FormulaType fromString(String name) {
    return FormulaType.valueOf(name.trim().toUpperCase(Locale.ROOT));
  }
}
