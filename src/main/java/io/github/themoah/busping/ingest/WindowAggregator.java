package io.github.themoah.busping.ingest;

import io.github.themoah.busping.model.Chunk;
import io.github.themoah.busping.model.FeedSnapshot;
import io.github.themoah.busping.model.Percentiles;
import io.github.themoah.busping.model.SystemStats;
import io.github.themoah.busping.model.VehiclePosition;
import io.github.themoah.busping.model.VehicleRecord;
import io.github.themoah.busping.stats.PercentileEstimator;
import io.github.themoah.busping.stats.RankClassifier;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Accumulates per-vehicle update intervals for one aggregation window and turns them
 * into a ranked {@link Chunk} when the window closes.
 *
 * <p>Last-seen timestamps survive window boundaries; everything else is reset on close.
 * Not thread-safe: owned by the ingestion verticle's event loop.
 */
public class WindowAggregator {

  private static final Logger log = LoggerFactory.getLogger(WindowAggregator.class);

  private final Map<String, Long> lastSeen = new HashMap<>();
  private Map<String, List<VehicleRecord>> pending = new LinkedHashMap<>();
  private List<Integer> intervalSamples = new ArrayList<>();
  private List<Integer> latencySamples = new ArrayList<>();
  private long lastCloseTimestamp = 0;

  /**
   * Feeds every vehicle sighting of one poll into the current window.
   *
   * @return number of records produced by this snapshot
   */
  public int observe(FeedSnapshot snapshot) {
    int produced = 0;
    for (VehiclePosition vehicle : snapshot.vehicles()) {
      if (observe(vehicle.vehicleId(), vehicle.timestamp(), snapshot.datasetTimestamp())) {
        produced++;
      }
    }
    return produced;
  }

  /**
   * Feeds a single sighting into the current window.
   *
   * <p>The first sighting of a vehicle only seeds its last-seen timestamp. A sighting
   * that is not newer than the stored timestamp is dropped without touching any state.
   *
   * @param vehicleId feed entity id
   * @param timestamp unix seconds reported by the vehicle
   * @param datasetTimestamp unix seconds at which the feed was published
   * @return true if a record was produced
   */
  public boolean observe(String vehicleId, long timestamp, long datasetTimestamp) {
    Long previous = lastSeen.get(vehicleId);
    if (previous == null) {
      lastSeen.put(vehicleId, timestamp);
      return false;
    }
    if (timestamp <= previous) {
      return false;
    }

    long latencyRaw = Math.max(0, datasetTimestamp - timestamp);
    VehicleRecord record = VehicleRecord.of(timestamp - previous, timestamp, latencyRaw, 0);

    pending.computeIfAbsent(vehicleId, k -> new ArrayList<>()).add(record);
    intervalSamples.add(record.interval());
    latencySamples.add(record.latency());
    lastSeen.put(vehicleId, timestamp);
    return true;
  }

  /**
   * Closes the window: estimates both distributions, ranks every pending record by its
   * interval and resets per-window state.
   *
   * <p>Close timestamps are strictly increasing; a close requested at or before the
   * previous one is moved one second past it so chunk keys never collide.
   *
   * @param closeTimestamp unix seconds at which the window closes
   * @return the completed chunk
   */
  public Chunk close(long closeTimestamp) {
    long timestamp = Math.max(closeTimestamp, lastCloseTimestamp + 1);
    if (timestamp != closeTimestamp) {
      log.debug("Window close moved from {} to {} to keep chunk keys unique", closeTimestamp, timestamp);
    }

    Percentiles intervalStats = PercentileEstimator.estimate(intervalSamples);
    Percentiles latencyStats = PercentileEstimator.estimate(latencySamples);
    SystemStats stats = new SystemStats(timestamp, intervalStats, latencyStats, intervalSamples.size());

    Map<String, List<VehicleRecord>> ranked = new LinkedHashMap<>();
    for (Map.Entry<String, List<VehicleRecord>> entry : pending.entrySet()) {
      List<VehicleRecord> records = new ArrayList<>(entry.getValue().size());
      for (VehicleRecord record : entry.getValue()) {
        records.add(record.withRank(RankClassifier.rank(intervalStats, record.interval())));
      }
      ranked.put(entry.getKey(), records);
    }

    Chunk chunk = new Chunk(stats, ranked);

    pending = new LinkedHashMap<>();
    intervalSamples = new ArrayList<>();
    latencySamples = new ArrayList<>();
    lastCloseTimestamp = timestamp;

    return chunk;
  }

  /**
   * Returns true if the current window holds any samples.
   */
  public boolean hasPendingSamples() {
    return !intervalSamples.isEmpty();
  }

  public int pendingSampleCount() {
    return intervalSamples.size();
  }

  public int trackedVehicleCount() {
    return lastSeen.size();
  }
}
