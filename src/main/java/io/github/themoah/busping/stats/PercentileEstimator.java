package io.github.themoah.busping.stats;

import io.github.themoah.busping.model.Percentiles;
import java.util.Arrays;
import java.util.Collection;

/**
 * Computes the fixed set of distribution breakpoints for one window of samples.
 *
 * <p>Uses nearest-rank selection on the sorted samples: for a fraction {@code p}
 * the breakpoint is the element at zero-based index {@code round((n - 1) * p)}.
 * Each window is estimated independently; nothing carries over between calls.
 */
public final class PercentileEstimator {

  private PercentileEstimator() {}

  /**
   * Estimates percentiles for the given samples.
   *
   * @param samples sample values in seconds
   * @return percentiles, all zero when {@code samples} is empty
   */
  public static Percentiles estimate(Collection<Integer> samples) {
    if (samples == null || samples.isEmpty()) {
      return Percentiles.ZERO;
    }

    int[] sorted = new int[samples.size()];
    int i = 0;
    for (Integer sample : samples) {
      sorted[i++] = sample;
    }
    Arrays.sort(sorted);

    double[] breakpoints = new double[Percentiles.FRACTIONS.length];
    for (int k = 0; k < breakpoints.length; k++) {
      breakpoints[k] = sorted[nearestRankIndex(sorted.length, Percentiles.FRACTIONS[k])];
    }
    return Percentiles.fromBreakpoints(breakpoints);
  }

  /**
   * Zero-based nearest-rank index for fraction {@code p} over {@code n} sorted values.
   */
  static int nearestRankIndex(int n, double p) {
    return (int) Math.round((n - 1) * p);
  }
}
