package io.github.themoah.busping.model;

import io.vertx.core.json.JsonObject;

/**
 * One accepted update for one vehicle within one aggregation window.
 *
 * <p>Interval and latency are stored in seconds and saturate at {@link #MAX_SECONDS}
 * (unsigned 16-bit, about 18.2 hours). Rank is the percentile label assigned against
 * the window's interval distribution.
 *
 * @param interval seconds since the previous update of the same vehicle
 * @param endOfInterval unix seconds of the update that closed the interval
 * @param latency seconds between the vehicle timestamp and the feed publish timestamp
 * @param rank percentile label, 0-100
 */
public record VehicleRecord(
  int interval,
  long endOfInterval,
  int latency,
  int rank
) {

  public static final int MAX_SECONDS = 0xFFFF;
  public static final int MAX_RANK = 100;

  public VehicleRecord {
    if (interval < 0 || interval > MAX_SECONDS) {
      throw new IllegalArgumentException("interval out of u16 range: " + interval);
    }
    if (latency < 0 || latency > MAX_SECONDS) {
      throw new IllegalArgumentException("latency out of u16 range: " + latency);
    }
    if (rank < 0 || rank > MAX_RANK) {
      throw new IllegalArgumentException("rank must be within 0-100: " + rank);
    }
  }

  /**
   * Creates a record from raw second counts, clamping both durations to the u16 range.
   */
  public static VehicleRecord of(long intervalSeconds, long endOfInterval, long latencySeconds, int rank) {
    return new VehicleRecord(saturate(intervalSeconds), endOfInterval, saturate(latencySeconds), rank);
  }

  /**
   * Clamps a duration in seconds to {@code [0, MAX_SECONDS]}.
   */
  public static int saturate(long seconds) {
    if (seconds <= 0) {
      return 0;
    }
    return (int) Math.min(seconds, MAX_SECONDS);
  }

  public VehicleRecord withRank(int newRank) {
    return new VehicleRecord(interval, endOfInterval, latency, newRank);
  }

  public JsonObject toJson() {
    return new JsonObject()
      .put("interval", interval)
      .put("end_of_interval", endOfInterval)
      .put("latency", latency)
      .put("rank", rank);
  }
}
