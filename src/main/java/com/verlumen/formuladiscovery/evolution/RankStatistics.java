package com.verlumen.formuladiscovery.evolution;

import java.util.Arrays;
import java.util.Comparator;

/** Rank-based statistics used by the Spearman fitness. */
public final class RankStatistics {

  /**
   * Assigns 1-based ranks in ascending order of value. Tied values share the average of the ranks
   * they span, e.g. {@code [10, 20, 20, 30]} ranks as {@code [1, 2.5, 2.5, 4]}. Values tie when
   * they are numerically equal, so {@code -0.0} and {@code 0.0} share a rank.
   */
  public static double[] rank(double[] values) {
    Integer[] order = new Integer[values.length];
    for (int i = 0; i < order.length; i++) {
      order[i] = i;
    }
    // Adding 0.0 turns -0.0 into 0.0 so both zeros sort together.
    Arrays.sort(order, Comparator.comparingDouble(i -> values[i] + 0.0));

    double[] ranks = new double[values.length];
    int i = 0;
    while (i < order.length) {
      int tieEnd = i + 1;
      while (tieEnd < order.length && values[order[tieEnd]] == values[order[i]]) {
        tieEnd++;
      }
      // Positions i..tieEnd-1 hold ranks i+1..tieEnd.
      double averageRank = (i + 1 + tieEnd) / 2.0;
      for (int j = i; j < tieEnd; j++) {
        ranks[order[j]] = averageRank;
      }
      i = tieEnd;
    }
    return ranks;
  }

  /**
   * Pearson correlation coefficient. Returns {@code 0} for mismatched lengths, fewer than two
   * values, or zero variance in either series.
   */
  public static double pearsonCorrelation(double[] x, double[] y) {
    if (x.length != y.length || x.length < 2) {
      return 0.0;
    }
    double meanX = 0.0;
    double meanY = 0.0;
    for (int i = 0; i < x.length; i++) {
      meanX += x[i];
      meanY += y[i];
    }
    meanX /= x.length;
    meanY /= x.length;

    double covariance = 0.0;
    double varianceX = 0.0;
    double varianceY = 0.0;
    for (int i = 0; i < x.length; i++) {
      double dx = x[i] - meanX;
      double dy = y[i] - meanY;
      covariance += dx * dy;
      varianceX += dx * dx;
      varianceY += dy * dy;
    }
    if (varianceX == 0 || varianceY == 0) {
      return 0.0;
    }
    return covariance / Math.sqrt(varianceX * varianceY);
  }

  /** Spearman rank correlation: the Pearson correlation of the ranks. */
  public static double spearmanCorrelation(double[] x, double[] y) {
    if (x.length != y.length || x.length < 2) {
      return 0.0;
    }
    return pearsonCorrelation(rank(x), rank(y));
  }

  private RankStatistics() {}
}
