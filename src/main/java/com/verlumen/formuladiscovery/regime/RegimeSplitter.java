package com.verlumen.formuladiscovery.regime;

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.FluentLogger;
import com.verlumen.formuladiscovery.features.TrainingExample;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Partitions training examples by market regime.
 *
 * <p>Ranges passed to {@link #splitByRegime} and {@link #classify} must be ordered ascending and
 * non-overlapping. Each range is half-open, [min, max), except the last one, which also accepts a
 * score equal to its max.
 */
public final class RegimeSplitter {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private static final ImmutableList<RegimeRange> DEFAULT_REGIME_RANGES =
      ImmutableList.of(
          RegimeRange.create(-1.0, -0.3, "bear"),
          RegimeRange.create(-0.3, 0.3, "neutral"),
          RegimeRange.create(0.3, 1.0, "bull"));

  /** bear [-1.0, -0.3), neutral [-0.3, 0.3), bull [0.3, 1.0]. */
  public static ImmutableList<RegimeRange> defaultRegimeRanges() {
    return DEFAULT_REGIME_RANGES;
  }

  /**
   * Assigns every example to the first range containing its regime score. The result has an
   * entry for every range, in the given order, possibly with no examples. Examples outside all
   * ranges are dropped.
   */
  public static ImmutableMap<RegimeRange, ImmutableList<TrainingExample>> splitByRegime(
      List<TrainingExample> examples, List<RegimeRange> ranges) {
    Map<RegimeRange, List<TrainingExample>> buckets = new LinkedHashMap<>();
    for (RegimeRange range : ranges) {
      buckets.put(range, new ArrayList<>());
    }

    int unassigned = 0;
    for (TrainingExample example : examples) {
      Optional<RegimeRange> range = classify(example.inputs().regimeScore(), ranges);
      if (range.isPresent()) {
        buckets.get(range.get()).add(example);
      } else {
        unassigned++;
      }
    }
    if (unassigned > 0) {
      logger.atFine().log("%d examples fell outside every regime range", unassigned);
    }

    ImmutableMap.Builder<RegimeRange, ImmutableList<TrainingExample>> result =
        ImmutableMap.builder();
    buckets.forEach((range, bucket) -> result.put(range, ImmutableList.copyOf(bucket)));
    return result.buildOrThrow();
  }

  /** Returns the range a regime score belongs to, using the same rule as {@link #splitByRegime}. */
  public static Optional<RegimeRange> classify(double regimeScore, List<RegimeRange> ranges) {
    for (int i = 0; i < ranges.size(); i++) {
      RegimeRange range = ranges.get(i);
      boolean last = i == ranges.size() - 1;
      if (range.containsHalfOpen(regimeScore) || (last && regimeScore == range.max())) {
        return Optional.of(range);
      }
    }
    return Optional.empty();
  }

  /** Keeps the examples whose regime score lies in the closed interval [min, max]. */
  public static ImmutableList<TrainingExample> filterByRegimeRange(
      List<TrainingExample> examples, double min, double max) {
    return examples.stream()
        .filter(
            example ->
                example.inputs().regimeScore() >= min && example.inputs().regimeScore() <= max)
        .collect(toImmutableList());
  }

  private RegimeSplitter() {}
}
