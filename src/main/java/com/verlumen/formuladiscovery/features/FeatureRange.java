package com.verlumen.formuladiscovery.features;

/** Observed bounds of a feature, used for min-max normalization. */
public record FeatureRange(double min, double max) {
  /** Range assumed for a feature that never appears in the data. */
  static final FeatureRange DEFAULT = new FeatureRange(0.0, 1.0);

  /** Width added to a degenerate range so normalization never divides by zero. */
  static final double DEGENERATE_WIDTH = 0.001;

  /**
   * Maps {@code value} into [0, 1]. Non-finite values map to {@code 0}, a zero-width range maps
   * everything to {@code 0.5}, and values outside the range are clamped.
   */
  public double normalize(double value) {
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      return 0.0;
    }
    if (max == min) {
      return 0.5;
    }
    double normalized = (value - min) / (max - min);
    if (normalized < 0) {
      return 0.0;
    }
    if (normalized > 1) {
      return 1.0;
    }
    return normalized;
  }
}
