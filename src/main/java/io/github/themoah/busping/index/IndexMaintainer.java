package io.github.themoah.busping.index;

import io.github.themoah.busping.health.ReadinessCheck;
import io.github.themoah.busping.metrics.MetricsReporter;
import io.github.themoah.busping.model.Chunk;
import io.github.themoah.busping.store.ChunkDecodeException;
import io.github.themoah.busping.store.ChunkKey;
import io.github.themoah.busping.store.ChunkStore;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.function.LongSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps the {@link LiveIndex} in step with the chunk store.
 *
 * <p>Each pass discovers chunks newer than the index watermark, merges them in ascending
 * order, then prunes the index against the retention cutoff. Passes never overlap; this
 * is the only writer of the index.
 *
 * <p>A chunk that fails to decode is skipped for the current pass and later chunks still
 * merge. The failed key is retried on every following pass until it decodes or, after
 * {@code maxDecodeAttempts} failures, is quarantined. A limit of 0 disables quarantine.
 * A retried chunk that decodes once newer chunks are merged is behind the watermark and is
 * dropped, since the index only appends in timestamp order.
 */
public class IndexMaintainer implements ReadinessCheck {

  private static final Logger log = LoggerFactory.getLogger(IndexMaintainer.class);

  private final Vertx vertx;
  private final ChunkStore store;
  private final LiveIndex index;
  private final RetentionPolicy retention;
  private final MetricsReporter reporter;
  private final long intervalMs;
  private final int maxDecodeAttempts;
  private final LongSupplier clock;

  private final Map<ChunkKey, Integer> decodeFailures = new HashMap<>();
  private boolean passRunning = false;
  private volatile boolean initialLoadComplete = false;
  private Long timerId;

  public IndexMaintainer(
    Vertx vertx,
    ChunkStore store,
    LiveIndex index,
    RetentionPolicy retention,
    MetricsReporter reporter,
    long intervalMs,
    int maxDecodeAttempts
  ) {
    this(vertx, store, index, retention, reporter, intervalMs, maxDecodeAttempts,
      () -> System.currentTimeMillis() / 1000);
  }

  /**
   * Constructor for testing with an injectable clock (unix seconds).
   */
  IndexMaintainer(
    Vertx vertx,
    ChunkStore store,
    LiveIndex index,
    RetentionPolicy retention,
    MetricsReporter reporter,
    long intervalMs,
    int maxDecodeAttempts,
    LongSupplier clock
  ) {
    this.vertx = vertx;
    this.store = store;
    this.index = index;
    this.retention = retention;
    this.reporter = reporter;
    this.intervalMs = intervalMs;
    this.maxDecodeAttempts = maxDecodeAttempts;
    this.clock = clock;
  }

  /**
   * Runs the initial load, then schedules periodic passes.
   *
   * @return Future that completes when the initial load finishes
   */
  public Future<Void> start() {
    log.info("Starting index maintainer with interval: {}ms, retention: {}",
      intervalMs, retention.span());

    return runPass()
      .onComplete(ar -> {
        timerId = vertx.setPeriodic(intervalMs, id -> runPass());
        log.info("Index maintainer started, timer ID: {}, watermark: {}", timerId, index.watermark());
      })
      .mapEmpty();
  }

  public Future<Void> stop() {
    log.info("Stopping index maintainer");
    if (timerId != null) {
      vertx.cancelTimer(timerId);
      timerId = null;
    }
    return Future.succeededFuture();
  }

  /**
   * Returns true once a pass has completed successfully.
   */
  public boolean isInitialLoadComplete() {
    return initialLoadComplete;
  }

  /**
   * Runs one discover-merge-prune pass unless one is already running.
   *
   * @return Future containing the number of chunks merged by this pass
   */
  public Future<Integer> runPass() {
    if (passRunning) {
      log.debug("Previous index pass still running, skipping");
      return Future.succeededFuture(0);
    }
    passRunning = true;

    long cutoff = retention.cutoff(clock.getAsLong());
    return mergeNewChunks(cutoff)
      .map(merged -> {
        prune(cutoff);
        initialLoadComplete = true;
        return merged;
      })
      .onFailure(err -> log.error("Index maintenance pass failed", err))
      .onComplete(ar -> passRunning = false);
  }

  private Future<Integer> mergeNewChunks(long cutoff) {
    return store.listSince(index.watermark())
      .compose(keys -> {
        if (!keys.isEmpty()) {
          log.debug("Discovered {} new chunks after watermark {}", keys.size(), index.watermark());
        }
        return mergeSequentially(withRetries(keys, cutoff), 0, 0);
      });
  }

  /**
   * Adds previously undecodable keys to the discovered ones, ascending.
   * Keys older than the retention cutoff are forgotten.
   */
  private List<ChunkKey> withRetries(List<ChunkKey> discovered, long cutoff) {
    decodeFailures.keySet().removeIf(key -> key.timestamp() < cutoff);
    if (decodeFailures.isEmpty()) {
      return discovered;
    }
    TreeSet<ChunkKey> keys = new TreeSet<>(discovered);
    keys.addAll(decodeFailures.keySet());
    return List.copyOf(keys);
  }

  private Future<Integer> mergeSequentially(List<ChunkKey> keys, int position, int merged) {
    if (position >= keys.size()) {
      return Future.succeededFuture(merged);
    }
    ChunkKey key = keys.get(position);

    return store.get(key).transform(ar -> {
      boolean retried = decodeFailures.containsKey(key);
      if (ar.succeeded()) {
        decodeFailures.remove(key);
        Chunk chunk = ar.result();
        if (index.mergeFrom(chunk)) {
          reporter.chunkMerged(chunk.recordCount());
          log.info("Merged chunk {} ({} records, {} vehicles)",
            key.timestamp(), chunk.recordCount(), chunk.records().size());
          return mergeSequentially(keys, position + 1, merged + 1);
        }
        if (retried) {
          log.warn("Chunk {} decoded after newer chunks were merged (watermark {}), dropping it",
            key.fileName(), index.watermark());
        }
        return mergeSequentially(keys, position + 1, merged);
      }

      if (ar.cause() instanceof ChunkDecodeException decodeError) {
        return handleDecodeFailure(key, decodeError)
          .compose(v -> mergeSequentially(keys, position + 1, merged));
      }

      if (retried) {
        decodeFailures.remove(key);
        log.warn("Chunk {} no longer readable, giving up on it: {}", key.fileName(), ar.cause().getMessage());
        return mergeSequentially(keys, position + 1, merged);
      }

      log.warn("Failed to read chunk {}, retrying next pass: {}", key.fileName(), ar.cause().getMessage());
      return Future.succeededFuture(merged);
    });
  }

  /**
   * Records a decode failure and quarantines the chunk once the attempt limit is reached.
   * The returned Future never fails; an unquarantined key stays tracked for retry.
   */
  private Future<Void> handleDecodeFailure(ChunkKey key, ChunkDecodeException error) {
    reporter.chunkDecodeFailed();
    int attempts = decodeFailures.merge(key, 1, Integer::sum);

    if (maxDecodeAttempts <= 0 || attempts < maxDecodeAttempts) {
      log.warn("Failed to decode chunk {} (attempt {}), skipping it this pass: {}",
        key.fileName(), attempts, error.getMessage());
      return Future.succeededFuture();
    }

    log.error("Chunk {} undecodable after {} attempts, quarantining: {}",
      key.fileName(), attempts, error.getMessage());
    return store.quarantine(key)
      .onSuccess(v -> {
        decodeFailures.remove(key);
        reporter.chunkQuarantined();
      })
      .otherwise(err -> {
        log.error("Failed to quarantine chunk {}", key.fileName(), err);
        return null;
      });
  }

  @Override
  public String name() {
    return "index";
  }

  @Override
  public boolean isReady() {
    return initialLoadComplete;
  }

  @Override
  public String detail() {
    return initialLoadComplete ? "watermark " + index.watermark() : "loading";
  }

  private void prune(long cutoff) {
    PruneResult result = index.prune(cutoff);
    if (!result.isEmpty()) {
      log.debug("Pruned index before {}: {} records, {} vehicles, {} stats, {} anomaly entries",
        cutoff, result.records(), result.vehiclesDropped(), result.stats(), result.anomalyEntries());
    }
    reporter.indexSize(index.vehicleCount(), index.statsCount(), index.anomalyEntryCount(), index.watermark());
  }
}
