package com.verlumen.formuladiscovery.features;

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Min-max normalization of training inputs to [0, 1], computed per feature across a data set.
 *
 * <p>The regime score is never normalized. Absent optional metrics stay absent, unlike formula
 * evaluation, which reads them as {@code 0.0}.
 */
public final class FeatureNormalizer {
  /** Value substituted for a long-term or fundamentals score that reads as missing. */
  static final double MISSING_SCORE = 0.5;

  /**
   * Returns the examples with every normalized feature mapped into [0, 1] using ranges computed
   * over {@code examples}.
   */
  public static ImmutableList<TrainingExample> normalize(List<TrainingExample> examples) {
    if (examples.isEmpty()) {
      return ImmutableList.copyOf(examples);
    }
    ImmutableMap<Feature, FeatureRange> ranges = computeRanges(examples);
    return examples.stream()
        .map(example -> example.withInputs(normalizeInputs(example.inputs(), ranges)))
        .collect(toImmutableList());
  }

  /**
   * Computes the range of every normalized feature, ignoring NaN and infinite values. A feature
   * never observed gets [0, 1]; a feature with a single value gets a range of width 0.001.
   */
  public static ImmutableMap<Feature, FeatureRange> computeRanges(List<TrainingExample> examples) {
    Map<Feature, double[]> bounds = new EnumMap<>(Feature.class);
    for (TrainingExample example : examples) {
      for (Feature feature : Feature.values()) {
        if (!feature.isNormalized()) {
          continue;
        }
        OptionalDouble value = feature.observedValue(example.inputs());
        if (value.isEmpty() || !Double.isFinite(value.getAsDouble())) {
          continue;
        }
        double[] minMax =
            bounds.computeIfAbsent(
                feature, unused -> new double[] {Double.MAX_VALUE, -Double.MAX_VALUE});
        minMax[0] = Math.min(minMax[0], value.getAsDouble());
        minMax[1] = Math.max(minMax[1], value.getAsDouble());
      }
    }

    ImmutableMap.Builder<Feature, FeatureRange> ranges = ImmutableMap.builder();
    for (Feature feature : Feature.values()) {
      if (!feature.isNormalized()) {
        continue;
      }
      double[] minMax = bounds.get(feature);
      FeatureRange range =
          minMax == null ? FeatureRange.DEFAULT : new FeatureRange(minMax[0], minMax[1]);
      if (range.min() == range.max()) {
        range = new FeatureRange(range.min(), range.min() + FeatureRange.DEGENERATE_WIDTH);
      }
      ranges.put(feature, range);
    }
    return ranges.buildOrThrow();
  }

  /** Normalizes one input set against precomputed ranges. */
  public static TrainingInputs normalizeInputs(
      TrainingInputs inputs, Map<Feature, FeatureRange> ranges) {
    TrainingInputs.Builder builder = inputs.toBuilder();
    for (Feature feature : Feature.values()) {
      if (!feature.isNormalized()) {
        continue;
      }
      OptionalDouble raw = feature.observedValue(inputs);
      if (raw.isEmpty()) {
        continue;
      }
      FeatureRange range = ranges.getOrDefault(feature, FeatureRange.DEFAULT);
      double normalized = range.normalize(raw.getAsDouble());
      if ((feature == Feature.LONG_TERM || feature == Feature.FUNDAMENTALS)
          && normalized == 0.0
          && raw.getAsDouble() == 0.0) {
        normalized = MISSING_SCORE;
      }
      feature.set(builder, normalized);
    }
    return builder.build();
  }

  private FeatureNormalizer() {}
}
