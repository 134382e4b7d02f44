package io.github.themoah.busping.model;

import io.vertx.core.json.JsonObject;
import java.util.Objects;

/**
 * Feed-wide statistics for one closed aggregation window.
 *
 * @param timestamp unix seconds at which the window closed
 * @param intervalStats distribution of update intervals in the window
 * @param latencyStats distribution of feed latencies in the window
 * @param sampleCount number of interval samples (unsigned 32-bit)
 */
public record SystemStats(
  long timestamp,
  Percentiles intervalStats,
  Percentiles latencyStats,
  long sampleCount
) {

  public static final long MAX_SAMPLE_COUNT = 0xFFFF_FFFFL;

  public SystemStats {
    Objects.requireNonNull(intervalStats, "intervalStats cannot be null");
    Objects.requireNonNull(latencyStats, "latencyStats cannot be null");
    if (sampleCount < 0 || sampleCount > MAX_SAMPLE_COUNT) {
      throw new IllegalArgumentException("sampleCount out of u32 range: " + sampleCount);
    }
  }

  public JsonObject toJson() {
    return new JsonObject()
      .put("timestamp", timestamp)
      .put("interval_stats", intervalStats.toJson())
      .put("latency_stats", latencyStats.toJson())
      .put("sample_count", sampleCount);
  }
}
