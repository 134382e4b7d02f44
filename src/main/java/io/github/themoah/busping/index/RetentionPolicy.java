package io.github.themoah.busping.index;

import java.time.Duration;

/**
 * Rolling retention window shared by chunk storage and the live index, so both compute
 * the same cutoff.
 *
 * @param span how long data is kept
 */
public record RetentionPolicy(Duration span) {

  public static final Duration DEFAULT_SPAN = Duration.ofHours(48);

  public RetentionPolicy {
    if (span == null || span.isNegative() || span.isZero()) {
      throw new IllegalArgumentException("retention span must be positive: " + span);
    }
  }

  /**
   * Returns the oldest unix second still retained at {@code nowSeconds}.
   */
  public long cutoff(long nowSeconds) {
    return Math.max(0, nowSeconds - span.toSeconds());
  }
}
