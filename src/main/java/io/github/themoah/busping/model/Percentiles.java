package io.github.themoah.busping.model;

import io.vertx.core.json.JsonObject;

/**
 * Distribution breakpoints for one window, in seconds.
 */
public record Percentiles(
  double p0,
  double p25,
  double p50,
  double p75,
  double p80,
  double p85,
  double p90,
  double p95,
  double p98,
  double p99,
  double p99_5,
  double p99_9
) {

  /** Fractions matching the record components, in order. */
  public static final double[] FRACTIONS = {
    0.0, 0.25, 0.50, 0.75, 0.80, 0.85, 0.90, 0.95, 0.98, 0.99, 0.995, 0.999
  };

  private static final String[] JSON_KEYS = {
    "p0", "p25", "p50", "p75", "p80", "p85", "p90", "p95", "p98", "p99", "p99_5", "p99_9"
  };

  public static final Percentiles ZERO = fromBreakpoints(new double[FRACTIONS.length]);

  /**
   * Builds percentiles from breakpoints ordered like {@link #FRACTIONS}.
   */
  public static Percentiles fromBreakpoints(double[] values) {
    if (values.length != FRACTIONS.length) {
      throw new IllegalArgumentException(
        "Expected " + FRACTIONS.length + " breakpoints, got " + values.length);
    }
    return new Percentiles(
      values[0], values[1], values[2], values[3], values[4], values[5],
      values[6], values[7], values[8], values[9], values[10], values[11]
    );
  }

  /**
   * Returns breakpoints ordered like {@link #FRACTIONS}.
   */
  public double[] breakpoints() {
    return new double[] {p0, p25, p50, p75, p80, p85, p90, p95, p98, p99, p99_5, p99_9};
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject();
    double[] values = breakpoints();
    for (int i = 0; i < values.length; i++) {
      json.put(JSON_KEYS[i], values[i]);
    }
    return json;
  }
}
