package io.github.themoah.busping.index;

import static io.github.themoah.busping.index.LiveIndexTest.chunk;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.busping.metrics.MetricsReporter;
import io.github.themoah.busping.model.Chunk;
import io.github.themoah.busping.model.VehicleRecord;
import io.github.themoah.busping.store.ChunkDecodeException;
import io.github.themoah.busping.store.ChunkKey;
import io.github.themoah.busping.store.ChunkStore;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Tests for IndexMaintainer merge, retry and quarantine behavior.
 */
@ExtendWith(VertxExtension.class)
public class IndexMaintainerTest {

  private static final RetentionPolicy ONE_HOUR = new RetentionPolicy(Duration.ofHours(1));

  private final LiveIndex index = new LiveIndex();
  private final InMemoryChunkStore store = new InMemoryChunkStore();
  private final AtomicLong clock = new AtomicLong(1_000);

  private IndexMaintainer maintainer(Vertx vertx, int maxDecodeAttempts, MetricsReporter reporter) {
    return new IndexMaintainer(vertx, store, index, ONE_HOUR, reporter, 60_000, maxDecodeAttempts, clock::get);
  }

  private static Chunk vehicleChunk(long timestamp, String vehicleId) {
    return chunk(timestamp, Map.of(vehicleId, List.of(new VehicleRecord(10, timestamp - 1, 0, 95))));
  }

  @Test
  void runPass_mergesChunksInOrder(Vertx vertx, VertxTestContext ctx) throws Exception {
    store.add(vehicleChunk(300, "c"));
    store.add(vehicleChunk(100, "a"));
    store.add(vehicleChunk(200, "b"));
    IndexMaintainer maintainer = maintainer(vertx, 3, MetricsReporter.NOOP);
    assertFalse(maintainer.isReady());

    maintainer.runPass()
      .onComplete(ctx.succeeding(merged -> ctx.verify(() -> {
        assertEquals(3, merged);
        assertEquals(300, index.watermark());
        assertEquals(List.of(100L, 200L, 300L),
          index.stats().stream().map(s -> s.timestamp()).toList());
        assertTrue(maintainer.isInitialLoadComplete());
        assertTrue(maintainer.isReady());
        ctx.completeNow();
      })));

    assertTrue(ctx.awaitCompletion(5, TimeUnit.SECONDS));
  }

  @Test
  void runPass_onlyMergesChunksAfterWatermark(Vertx vertx, VertxTestContext ctx) throws Exception {
    store.add(vehicleChunk(100, "a"));
    IndexMaintainer maintainer = maintainer(vertx, 3, MetricsReporter.NOOP);

    maintainer.runPass()
      .compose(first -> {
        store.add(vehicleChunk(200, "b"));
        return maintainer.runPass();
      })
      .onComplete(ctx.succeeding(second -> ctx.verify(() -> {
        assertEquals(1, second);
        assertEquals(1, index.history("a").size());
        assertEquals(200, index.watermark());
        ctx.completeNow();
      })));

    assertTrue(ctx.awaitCompletion(5, TimeUnit.SECONDS));
  }

  @Test
  void decodeFailure_skipsChunkThenQuarantines(Vertx vertx, VertxTestContext ctx) throws Exception {
    store.add(vehicleChunk(100, "a"));
    store.addCorrupt(200);
    store.add(vehicleChunk(300, "c"));
    AtomicInteger decodeFailures = new AtomicInteger();
    AtomicInteger quarantined = new AtomicInteger();
    MetricsReporter reporter = new MetricsReporter() {
      @Override
      public void chunkDecodeFailed() {
        decodeFailures.incrementAndGet();
      }

      @Override
      public void chunkQuarantined() {
        quarantined.incrementAndGet();
      }
    };
    IndexMaintainer maintainer = maintainer(vertx, 3, reporter);

    maintainer.runPass()
      .compose(first -> {
        ctx.verify(() -> {
          assertEquals(2, first);
          assertEquals(300, index.watermark());
          assertEquals(1, index.history("c").size());
          assertEquals(1, decodeFailures.get());
        });
        return maintainer.runPass();
      })
      .compose(second -> {
        ctx.verify(() -> {
          assertEquals(0, second);
          assertEquals(2, decodeFailures.get());
          assertTrue(store.quarantined.isEmpty());
        });
        return maintainer.runPass();
      })
      .compose(third -> {
        ctx.verify(() -> {
          assertEquals(Set.of(new ChunkKey(200)), store.quarantined);
          assertEquals(3, decodeFailures.get());
          assertEquals(1, quarantined.get());
        });
        return maintainer.runPass();
      })
      .onComplete(ctx.succeeding(fourth -> ctx.verify(() -> {
        assertEquals(0, fourth);
        assertEquals(3, decodeFailures.get());
        ctx.completeNow();
      })));

    assertTrue(ctx.awaitCompletion(5, TimeUnit.SECONDS));
  }

  @Test
  void decodeFailure_withZeroLimit_laterChunksStillMerge(Vertx vertx, VertxTestContext ctx) throws Exception {
    store.addCorrupt(200);
    store.add(vehicleChunk(300, "c"));
    AtomicInteger decodeFailures = new AtomicInteger();
    MetricsReporter reporter = new MetricsReporter() {
      @Override
      public void chunkDecodeFailed() {
        decodeFailures.incrementAndGet();
      }
    };
    IndexMaintainer maintainer = maintainer(vertx, 0, reporter);

    Future<Integer> passes = maintainer.runPass();
    for (int i = 0; i < 9; i++) {
      passes = passes.compose(n -> maintainer.runPass());
    }

    passes.onComplete(ctx.succeeding(last -> ctx.verify(() -> {
      assertEquals(0, last);
      assertEquals(300, index.watermark());
      assertEquals(1, index.history("c").size());
      assertEquals(10, decodeFailures.get());
      assertTrue(store.quarantined.isEmpty());
      ctx.completeNow();
    })));

    assertTrue(ctx.awaitCompletion(5, TimeUnit.SECONDS));
  }

  @Test
  void decodeFailure_repairedChunkBehindWatermarkIsDropped(Vertx vertx, VertxTestContext ctx) throws Exception {
    store.addCorrupt(200);
    store.add(vehicleChunk(300, "c"));
    AtomicInteger decodeFailures = new AtomicInteger();
    MetricsReporter reporter = new MetricsReporter() {
      @Override
      public void chunkDecodeFailed() {
        decodeFailures.incrementAndGet();
      }
    };
    IndexMaintainer maintainer = maintainer(vertx, 3, reporter);

    maintainer.runPass()
      .compose(first -> {
        store.add(vehicleChunk(200, "b"));
        return maintainer.runPass();
      })
      .compose(second -> {
        ctx.verify(() -> assertEquals(0, second));
        return maintainer.runPass();
      })
      .onComplete(ctx.succeeding(third -> ctx.verify(() -> {
        assertEquals(0, third);
        assertEquals(300, index.watermark());
        assertTrue(index.history("b").isEmpty());
        assertEquals(1, decodeFailures.get());
        assertTrue(store.quarantined.isEmpty());
        ctx.completeNow();
      })));

    assertTrue(ctx.awaitCompletion(5, TimeUnit.SECONDS));
  }

  @Test
  void decodeFailure_expiredChunkIsNoLongerRetried(Vertx vertx, VertxTestContext ctx) throws Exception {
    store.addCorrupt(200);
    store.add(vehicleChunk(300, "c"));
    AtomicInteger decodeFailures = new AtomicInteger();
    MetricsReporter reporter = new MetricsReporter() {
      @Override
      public void chunkDecodeFailed() {
        decodeFailures.incrementAndGet();
      }
    };
    IndexMaintainer maintainer = maintainer(vertx, 0, reporter);

    maintainer.runPass()
      .compose(first -> {
        // cutoff = 3850 - 3600 = 250
        clock.set(3_850);
        return maintainer.runPass();
      })
      .onComplete(ctx.succeeding(second -> ctx.verify(() -> {
        assertEquals(1, decodeFailures.get());
        assertEquals(1, index.history("c").size());
        ctx.completeNow();
      })));

    assertTrue(ctx.awaitCompletion(5, TimeUnit.SECONDS));
  }

  @Test
  void decodeFailure_repairedChunkMergesOnRetry(Vertx vertx, VertxTestContext ctx) throws Exception {
    store.addCorrupt(200);
    IndexMaintainer maintainer = maintainer(vertx, 3, MetricsReporter.NOOP);

    maintainer.runPass()
      .compose(first -> {
        store.add(vehicleChunk(200, "b"));
        return maintainer.runPass();
      })
      .onComplete(ctx.succeeding(second -> ctx.verify(() -> {
        assertEquals(1, second);
        assertEquals(200, index.watermark());
        assertTrue(store.quarantined.isEmpty());
        ctx.completeNow();
      })));

    assertTrue(ctx.awaitCompletion(5, TimeUnit.SECONDS));
  }

  @Test
  void runPass_prunesAgainstRetentionCutoff(Vertx vertx, VertxTestContext ctx) throws Exception {
    store.add(vehicleChunk(100, "old"));
    store.add(vehicleChunk(5_000, "new"));
    clock.set(5_000);
    IndexMaintainer maintainer = maintainer(vertx, 3, MetricsReporter.NOOP);

    maintainer.runPass()
      .onComplete(ctx.succeeding(merged -> ctx.verify(() -> {
        // cutoff = 5000 - 3600 = 1400
        assertTrue(index.history("old").isEmpty());
        assertEquals(1, index.history("new").size());
        assertEquals(1, index.statsCount());
        assertEquals(5_000, index.watermark());
        ctx.completeNow();
      })));

    assertTrue(ctx.awaitCompletion(5, TimeUnit.SECONDS));
  }

  @Test
  void start_runsInitialLoad(Vertx vertx, VertxTestContext ctx) throws Exception {
    store.add(vehicleChunk(100, "a"));
    IndexMaintainer maintainer = maintainer(vertx, 3, MetricsReporter.NOOP);

    maintainer.start()
      .compose(v -> {
        ctx.verify(() -> {
          assertTrue(maintainer.isInitialLoadComplete());
          assertEquals(100, index.watermark());
        });
        return maintainer.stop();
      })
      .onComplete(ctx.succeedingThenComplete());

    assertTrue(ctx.awaitCompletion(5, TimeUnit.SECONDS));
  }

  /**
   * Chunk store whose chunks can be marked undecodable.
   */
  static class InMemoryChunkStore implements ChunkStore {
    final TreeMap<ChunkKey, Chunk> chunks = new TreeMap<>();
    final Set<ChunkKey> corrupt = new HashSet<>();
    final Set<ChunkKey> quarantined = new HashSet<>();

    void add(Chunk chunk) {
      ChunkKey key = new ChunkKey(chunk.timestamp());
      corrupt.remove(key);
      chunks.put(key, chunk);
    }

    void addCorrupt(long timestamp) {
      ChunkKey key = new ChunkKey(timestamp);
      corrupt.add(key);
      chunks.put(key, null);
    }

    @Override
    public Future<Void> open() {
      return Future.succeededFuture();
    }

    @Override
    public Future<ChunkKey> put(Chunk chunk) {
      add(chunk);
      return Future.succeededFuture(new ChunkKey(chunk.timestamp()));
    }

    @Override
    public Future<List<ChunkKey>> listSince(long watermark) {
      return Future.succeededFuture(new ArrayList<>(chunks.tailMap(new ChunkKey(watermark), false).keySet()));
    }

    @Override
    public Future<Chunk> get(ChunkKey key) {
      if (corrupt.contains(key)) {
        return Future.failedFuture(new ChunkDecodeException(key, "corrupt", null));
      }
      return Future.succeededFuture(chunks.get(key));
    }

    @Override
    public Future<Integer> purgeOlderThan(long cutoff) {
      Map<ChunkKey, Chunk> expired = chunks.headMap(new ChunkKey(cutoff), false);
      int count = expired.size();
      expired.clear();
      return Future.succeededFuture(count);
    }

    @Override
    public Future<Void> quarantine(ChunkKey key) {
      chunks.remove(key);
      corrupt.remove(key);
      quarantined.add(key);
      return Future.succeededFuture();
    }
  }
}
