package io.github.themoah.busping.ingest;

import io.github.themoah.busping.health.ReadinessCheck;
import io.github.themoah.busping.index.RetentionPolicy;
import io.github.themoah.busping.metrics.MetricsReporter;
import io.github.themoah.busping.model.Chunk;
import io.github.themoah.busping.store.ChunkKey;
import io.github.themoah.busping.store.ChunkStore;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.LongSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Polls the vehicle feed into a {@link WindowAggregator} and persists one chunk per window.
 *
 * <p>Two independent periodic timers drive the loop: a poll timer (a tick is skipped while
 * the previous fetch is still in flight) and a fixed-period flush timer, so window length
 * does not drift with fetch latency. A failed fetch is logged and its tick is lost; there is
 * no retry. After each flush, chunks older than the retention cutoff are purged. Stopping
 * flushes the in-flight window if it holds any samples.
 *
 * <p>All state is confined to the event loop of the deploying verticle.
 */
public class IngestLoop implements ReadinessCheck {

  private static final Logger log = LoggerFactory.getLogger(IngestLoop.class);

  private final Vertx vertx;
  private final FeedClient feed;
  private final ChunkStore store;
  private final RetentionPolicy retention;
  private final MetricsReporter reporter;
  private final long fetchIntervalMs;
  private final long windowDurationMs;
  private final LongSupplier clock;
  private final WindowAggregator aggregator = new WindowAggregator();
  private final AtomicBoolean feedConnected = new AtomicBoolean(false);

  private boolean fetchInFlight = false;
  private Long fetchTimerId;
  private Long flushTimerId;

  public IngestLoop(
    Vertx vertx,
    FeedClient feed,
    ChunkStore store,
    RetentionPolicy retention,
    MetricsReporter reporter,
    long fetchIntervalMs,
    long windowDurationMs
  ) {
    this(vertx, feed, store, retention, reporter, fetchIntervalMs, windowDurationMs,
      () -> System.currentTimeMillis() / 1000);
  }

  /**
   * Constructor for testing with an injectable clock (unix seconds).
   */
  IngestLoop(
    Vertx vertx,
    FeedClient feed,
    ChunkStore store,
    RetentionPolicy retention,
    MetricsReporter reporter,
    long fetchIntervalMs,
    long windowDurationMs,
    LongSupplier clock
  ) {
    this.vertx = vertx;
    this.feed = feed;
    this.store = store;
    this.retention = retention;
    this.reporter = reporter;
    this.fetchIntervalMs = fetchIntervalMs;
    this.windowDurationMs = windowDurationMs;
    this.clock = clock;
  }

  public Future<Void> start() {
    log.info("Starting ingest loop: fetch every {}ms, window {}ms", fetchIntervalMs, windowDurationMs);
    fetchTimerId = vertx.setPeriodic(fetchIntervalMs, id -> poll());
    flushTimerId = vertx.setPeriodic(windowDurationMs, id -> flush());
    return Future.succeededFuture();
  }

  /**
   * Cancels both timers, flushes a non-empty window and closes the feed client.
   */
  public Future<Void> stop() {
    log.info("Stopping ingest loop");
    if (fetchTimerId != null) {
      vertx.cancelTimer(fetchTimerId);
      fetchTimerId = null;
    }
    if (flushTimerId != null) {
      vertx.cancelTimer(flushTimerId);
      flushTimerId = null;
    }

    Future<Void> finalFlush = Future.succeededFuture();
    if (aggregator.hasPendingSamples()) {
      log.info("Flushing in-flight window with {} samples before shutdown", aggregator.pendingSampleCount());
      finalFlush = flush().<Void>mapEmpty().otherwiseEmpty();
    }
    return finalFlush.compose(v -> feed.close());
  }

  /**
   * Fetches the feed once and adds the snapshot to the current window.
   *
   * @return Future that always succeeds; fetch failures are logged and counted
   */
  Future<Void> poll() {
    if (fetchInFlight) {
      log.debug("Previous feed fetch still in flight, skipping tick");
      return Future.succeededFuture();
    }
    fetchInFlight = true;

    return feed.fetch()
      .onSuccess(snapshot -> {
        int produced = aggregator.observe(snapshot);
        reporter.feedFetched(snapshot.vehicles().size());
        if (!feedConnected.getAndSet(true)) {
          log.info("Feed reachable, dataset timestamp {}", snapshot.datasetTimestamp());
        }
        log.debug("Fetched {} vehicles, {} new records", snapshot.vehicles().size(), produced);
      })
      .onFailure(err -> {
        reporter.feedFetchFailed();
        if (feedConnected.getAndSet(false)) {
          log.warn("Feed unreachable: {}", err.getMessage());
        } else {
          log.debug("Feed fetch failed: {}", err.getMessage());
        }
      })
      .onComplete(ar -> fetchInFlight = false)
      .<Void>mapEmpty()
      .otherwiseEmpty();
  }

  /**
   * Closes the current window, persists its chunk and purges expired chunks. The purge
   * runs whether or not the write succeeded.
   *
   * @return Future containing the written key once the purge has finished, failed if the
   *     chunk could not be written
   */
  Future<ChunkKey> flush() {
    long now = clock.getAsLong();
    Chunk chunk = aggregator.close(now);
    reporter.windowClosed(chunk.stats().sampleCount(), chunk.recordCount());

    Future<ChunkKey> written = store.put(chunk)
      .onSuccess(key -> {
        reporter.chunkWritten();
        log.info("Flushed chunk {} ({} records, {} vehicles)",
          key.fileName(), chunk.recordCount(), chunk.records().size());
      })
      .onFailure(err -> {
        reporter.chunkWriteFailed();
        log.error("Failed to write chunk {}: window data lost ({} records)",
          chunk.timestamp(), chunk.recordCount(), err);
      });

    return written
      .transform(ar -> purgeExpired(now))
      .compose(v -> written);
  }

  private Future<Void> purgeExpired(long now) {
    return store.purgeOlderThan(retention.cutoff(now))
      .onSuccess(reporter::chunksPurged)
      .onFailure(err -> log.warn("Failed to purge expired chunks: {}", err.getMessage()))
      .<Void>mapEmpty()
      .otherwiseEmpty();
  }

  WindowAggregator aggregator() {
    return aggregator;
  }

  @Override
  public String name() {
    return "feed";
  }

  @Override
  public boolean isReady() {
    return feedConnected.get();
  }

  @Override
  public String detail() {
    return feedConnected.get() ? "connected" : "disconnected";
  }
}
