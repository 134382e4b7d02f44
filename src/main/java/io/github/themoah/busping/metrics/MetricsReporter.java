package io.github.themoah.busping.metrics;

import io.vertx.core.Future;

/**
 * Interface for reporting pipeline metrics to external systems.
 * Every event has a no-op default so components can run without a backend.
 */
public interface MetricsReporter {

  /** Reporter that drops everything. */
  MetricsReporter NOOP = new MetricsReporter() {};

  /**
   * Records a successful feed poll.
   *
   * @param vehicles number of vehicle sightings in the snapshot
   */
  default void feedFetched(int vehicles) {}

  default void feedFetchFailed() {}

  /**
   * Records a closed aggregation window.
   *
   * @param samples interval samples in the window
   * @param records records in the emitted chunk
   */
  default void windowClosed(long samples, int records) {}

  default void chunkWritten() {}

  default void chunkWriteFailed() {}

  default void chunksPurged(int count) {}

  /**
   * Records a chunk merged into the live index.
   *
   * @param records number of records merged
   */
  default void chunkMerged(int records) {}

  default void chunkDecodeFailed() {}

  default void chunkQuarantined() {}

  /**
   * Reports live index sizes after a maintenance pass.
   */
  default void indexSize(int vehicles, int statsEntries, int anomalyEntries, long watermark) {}

  /**
   * Starts the reporter.
   *
   * @return Future that completes when started
   */
  default Future<Void> start() {
    return Future.succeededFuture();
  }

  /**
   * Closes the reporter and releases resources.
   *
   * @return Future that completes when closed
   */
  default Future<Void> close() {
    return Future.succeededFuture();
  }
}
