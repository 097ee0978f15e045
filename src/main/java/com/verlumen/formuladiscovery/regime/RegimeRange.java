package com.verlumen.formuladiscovery.regime;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Locale;

/**
 * A band of regime scores with a name, e.g. {@code bull [0.3, 1.0]}. Used both as a partition
 * boundary and as a map key.
 */
public record RegimeRange(double min, double max, String name) {
  public RegimeRange {
    checkNotNull(name, "Regime range name cannot be null");
    checkArgument(min < max, "Regime range %s must have min < max: [%s, %s]", name, min, max);
  }

  public static RegimeRange create(double min, double max, String name) {
    return new RegimeRange(min, max, name);
  }

  /** True if {@code score} lies in the closed interval [min, max]. */
  public boolean containsClosed(double score) {
    return score >= min && score <= max;
  }

  /** True if {@code score} lies in the half-open interval [min, max). */
  public boolean containsHalfOpen(double score) {
    return score >= min && score < max;
  }

  @Override
  public String toString() {
    return String.format(Locale.ROOT, "%s[%.2f, %.2f]", name, min, max);
  }
}
