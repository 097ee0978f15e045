package com.verlumen.formuladiscovery.evolution;

import java.util.Locale;

/** How well a formula's predictions match the target returns. Lower is always better. */
public enum FitnessType {
  /** Mean absolute error; suited to expected-return formulas. */
  MAE,
  /** Root mean squared error. */
  RMSE,
  /** One minus the Spearman rank correlation; suited to scoring formulas that only rank. */
  SPEARMAN;

  public static FitnessType fromString(String name) {
    return FitnessType.valueOf(name.trim().toUpperCase(Locale.ROOT));
  }
}
