package io.github.themoah.busping.ingest;

import io.github.themoah.busping.model.FeedSnapshot;
import io.vertx.core.Future;

/**
 * Source of vehicle-position snapshots.
 * All methods return Vert.x Futures for async, non-blocking execution.
 */
public interface FeedClient {

  /**
   * Fetches and parses the current feed.
   *
   * @return Future containing the snapshot, failed on transport or parse errors
   */
  Future<FeedSnapshot> fetch();

  /**
   * Releases the underlying HTTP client.
   *
   * @return Future that completes when the client is closed
   */
  Future<Void> close();
}
