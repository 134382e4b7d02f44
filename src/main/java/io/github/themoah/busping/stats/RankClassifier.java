package io.github.themoah.busping.stats;

import io.github.themoah.busping.model.Percentiles;

/**
 * Maps a sample value to a coarse percentile rank against a window's breakpoints.
 *
 * <p>The rank is the label of the smallest breakpoint strictly greater than the value.
 * A value equal to a breakpoint therefore lands in the next band up. Values at or above
 * p99.9 rank 100.
 *
 * <p>Labels above the 99th percentile are compressed: both p99 and p99.5 carry label 99,
 * and only the band between p99.5 and p99.9 (and everything beyond p99.9) maps to 100.
 * Stored ranks and the rank-keyed anomaly index depend on exactly this mapping.
 */
public final class RankClassifier {

  /** Label per breakpoint, ordered like {@link Percentiles#FRACTIONS}. */
  static final int[] LABELS = {0, 25, 50, 75, 80, 85, 90, 95, 98, 99, 99, 100};

  public static final int TOP_RANK = 100;

  private RankClassifier() {}

  /**
   * Classifies {@code value} against {@code percentiles}.
   *
   * @param percentiles window breakpoints
   * @param value sample value in seconds
   * @return one of 0, 25, 50, 75, 80, 85, 90, 95, 98, 99, 100
   */
  public static int rank(Percentiles percentiles, double value) {
    double[] breakpoints = percentiles.breakpoints();
    for (int i = 0; i < breakpoints.length; i++) {
      if (value < breakpoints[i]) {
        return LABELS[i];
      }
    }
    return TOP_RANK;
  }
}
