package io.github.themoah.busping.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.vertx.core.Future;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reports pipeline metrics using Micrometer MeterRegistry.
 * Works with any Micrometer-supported backend (Prometheus, Datadog, OTLP).
 */
public class MicrometerReporter implements MetricsReporter {

  private static final Logger log = LoggerFactory.getLogger(MicrometerReporter.class);

  private final MeterRegistry registry;

  private final Counter feedFetches;
  private final Counter feedFetchFailures;
  private final DistributionSummary feedVehicles;
  private final DistributionSummary windowSamples;
  private final DistributionSummary windowRecords;
  private final Counter chunksWritten;
  private final Counter chunkWriteFailures;
  private final Counter chunksPurged;
  private final Counter chunksMerged;
  private final Counter recordsMerged;
  private final Counter chunkDecodeFailures;
  private final Counter chunksQuarantined;

  private final AtomicLong indexVehicles = new AtomicLong();
  private final AtomicLong indexStatsEntries = new AtomicLong();
  private final AtomicLong indexAnomalyEntries = new AtomicLong();
  private final AtomicLong indexWatermark = new AtomicLong();

  public MicrometerReporter(MeterRegistry registry) {
    this.registry = registry;

    this.feedFetches = Counter.builder("busping.feed.fetches")
      .description("Successful feed polls").register(registry);
    this.feedFetchFailures = Counter.builder("busping.feed.fetch.failures")
      .description("Failed feed polls").register(registry);
    this.feedVehicles = DistributionSummary.builder("busping.feed.vehicles")
      .description("Vehicle sightings per feed poll").register(registry);
    this.windowSamples = DistributionSummary.builder("busping.window.samples")
      .description("Interval samples per closed window").register(registry);
    this.windowRecords = DistributionSummary.builder("busping.window.records")
      .description("Ranked records per closed window").register(registry);
    this.chunksWritten = Counter.builder("busping.chunks.written").register(registry);
    this.chunkWriteFailures = Counter.builder("busping.chunks.write.failures")
      .description("Windows lost because their chunk could not be written").register(registry);
    this.chunksPurged = Counter.builder("busping.chunks.purged").register(registry);
    this.chunksMerged = Counter.builder("busping.chunks.merged").register(registry);
    this.recordsMerged = Counter.builder("busping.records.merged").register(registry);
    this.chunkDecodeFailures = Counter.builder("busping.chunks.decode.failures").register(registry);
    this.chunksQuarantined = Counter.builder("busping.chunks.quarantined").register(registry);

    Gauge.builder("busping.index.vehicles", indexVehicles, AtomicLong::get).register(registry);
    Gauge.builder("busping.index.stats_entries", indexStatsEntries, AtomicLong::get).register(registry);
    Gauge.builder("busping.index.anomaly_entries", indexAnomalyEntries, AtomicLong::get).register(registry);
    Gauge.builder("busping.index.watermark", indexWatermark, AtomicLong::get)
      .description("Window-close timestamp of the newest merged chunk").register(registry);
  }

  @Override
  public void feedFetched(int vehicles) {
    feedFetches.increment();
    feedVehicles.record(vehicles);
  }

  @Override
  public void feedFetchFailed() {
    feedFetchFailures.increment();
  }

  @Override
  public void windowClosed(long samples, int records) {
    windowSamples.record(samples);
    windowRecords.record(records);
  }

  @Override
  public void chunkWritten() {
    chunksWritten.increment();
  }

  @Override
  public void chunkWriteFailed() {
    chunkWriteFailures.increment();
  }

  @Override
  public void chunksPurged(int count) {
    chunksPurged.increment(count);
  }

  @Override
  public void chunkMerged(int records) {
    chunksMerged.increment();
    recordsMerged.increment(records);
  }

  @Override
  public void chunkDecodeFailed() {
    chunkDecodeFailures.increment();
  }

  @Override
  public void chunkQuarantined() {
    chunksQuarantined.increment();
  }

  @Override
  public void indexSize(int vehicles, int statsEntries, int anomalyEntries, long watermark) {
    indexVehicles.set(vehicles);
    indexStatsEntries.set(statsEntries);
    indexAnomalyEntries.set(anomalyEntries);
    indexWatermark.set(watermark);
  }

  @Override
  public Future<Void> close() {
    log.info("Closing meter registry");
    registry.close();
    return Future.succeededFuture();
  }
}
