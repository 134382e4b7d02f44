package io.github.themoah.busping.index;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.busping.model.Chunk;
import io.github.themoah.busping.model.Percentiles;
import io.github.themoah.busping.model.SystemStats;
import io.github.themoah.busping.model.VehicleRecord;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for LiveIndex.
 */
public class LiveIndexTest {

  private LiveIndex index;

  @BeforeEach
  void setUp() {
    index = new LiveIndex();
  }

  static Chunk chunk(long timestamp, Map<String, List<VehicleRecord>> records) {
    long samples = records.values().stream().mapToLong(List::size).sum();
    return new Chunk(new SystemStats(timestamp, Percentiles.ZERO, Percentiles.ZERO, samples), records);
  }

  @Test
  void newIndex_isEmpty() {
    assertEquals(0, index.watermark());
    assertTrue(index.history("4012").isEmpty());
    assertTrue(index.stats().isEmpty());
    assertEquals(0, index.anomalyEntryCount());
  }

  @Test
  void mergeFrom_populatesAllStructures() {
    Map<String, List<VehicleRecord>> records = new LinkedHashMap<>();
    records.put("a", List.of(new VehicleRecord(10, 100, 1, 95), new VehicleRecord(20, 120, 1, 60)));
    records.put("b", List.of(new VehicleRecord(30, 110, 0, 95)));

    assertTrue(index.mergeFrom(chunk(160, records)));

    assertEquals(160, index.watermark());
    assertEquals(records.get("a"), index.history("a"));
    assertEquals(1, index.stats().size());
    assertEquals(2, index.anomalyEntryCount(95));
    assertEquals(1, index.anomalyEntryCount(60));
    assertEquals(3, index.anomalyEntryCount());
    assertEquals(2, index.vehicleCount());
  }

  @Test
  void mergeFrom_sameTimestampTwice_contributesOnce() {
    Map<String, List<VehicleRecord>> records = Map.of("a", List.of(new VehicleRecord(10, 100, 1, 95)));

    assertTrue(index.mergeFrom(chunk(160, records)));
    assertFalse(index.mergeFrom(chunk(160, records)));

    assertEquals(1, index.history("a").size());
    assertEquals(1, index.stats().size());
    assertEquals(1, index.anomalyEntryCount());
  }

  @Test
  void mergeFrom_olderThanWatermark_ignored() {
    index.mergeFrom(chunk(200, Map.of()));

    assertFalse(index.mergeFrom(chunk(100, Map.of("a", List.of(new VehicleRecord(10, 90, 1, 95))))));
    assertEquals(200, index.watermark());
    assertTrue(index.history("a").isEmpty());
  }

  @Test
  void mergeFrom_appendsHistoryAcrossChunks() {
    index.mergeFrom(chunk(160, Map.of("a", List.of(new VehicleRecord(10, 100, 1, 50)))));
    index.mergeFrom(chunk(220, Map.of("a", List.of(new VehicleRecord(90, 190, 1, 99)))));

    List<VehicleRecord> history = index.history("a");
    assertEquals(2, history.size());
    assertEquals(100, history.get(0).endOfInterval());
    assertEquals(190, history.get(1).endOfInterval());
    assertEquals(List.of(160L, 220L), index.stats().stream().map(SystemStats::timestamp).toList());
  }

  @Test
  void prune_removesExpiredAndDropsEmptyVehicles() {
    index.mergeFrom(chunk(160, Map.of(
      "a", List.of(new VehicleRecord(10, 100, 1, 95)),
      "b", List.of(new VehicleRecord(10, 150, 1, 25)))));
    index.mergeFrom(chunk(260, Map.of(
      "b", List.of(new VehicleRecord(100, 250, 1, 100)))));

    PruneResult result = index.prune(200);

    assertEquals(2, result.records());
    assertEquals(1, result.vehiclesDropped());
    assertEquals(1, result.stats());
    assertEquals(2, result.anomalyEntries());
    assertTrue(index.history("a").isEmpty());
    assertEquals(1, index.history("b").size());
    assertEquals(1, index.vehicleCount());
    assertEquals(250, index.history("b").get(0).endOfInterval());
    assertEquals(List.of(260L), index.stats().stream().map(SystemStats::timestamp).toList());
    assertEquals(0, index.anomalyEntryCount(95));
    assertEquals(0, index.anomalyEntryCount(25));
    assertEquals(1, index.anomalyEntryCount(100));
    assertEquals(1, index.anomalyEntryCount());
  }

  @Test
  void prune_everythingExpired_leavesEmptyIndexButKeepsWatermark() {
    index.mergeFrom(chunk(160, Map.of("a", List.of(new VehicleRecord(10, 100, 1, 95)))));

    index.prune(1_000);

    assertEquals(0, index.vehicleCount());
    assertEquals(0, index.statsCount());
    assertEquals(0, index.anomalyEntryCount());
    assertEquals(160, index.watermark());
  }

  @Test
  void prune_nothingExpired_isEmptyResult() {
    index.mergeFrom(chunk(160, Map.of("a", List.of(new VehicleRecord(10, 100, 1, 95)))));

    assertTrue(index.prune(50).isEmpty());
  }

  @Test
  void history_returnsSnapshot() {
    index.mergeFrom(chunk(160, Map.of("a", List.of(new VehicleRecord(10, 100, 1, 95)))));
    List<VehicleRecord> before = index.history("a");

    index.mergeFrom(chunk(220, Map.of("a", List.of(new VehicleRecord(10, 200, 1, 95)))));

    assertEquals(1, before.size());
  }

  @Test
  void vehiclesRankedAtLeast_scansUpperBuckets() {
    index.mergeFrom(chunk(160, Map.of(
      "a", List.of(new VehicleRecord(10, 100, 1, 95)),
      "b", List.of(new VehicleRecord(10, 100, 1, 85)),
      "c", List.of(new VehicleRecord(10, 100, 1, 100)))));

    assertEquals(Set.of("a", "c"), index.vehiclesRankedAtLeast(90));
    assertEquals(Set.of("c"), index.vehiclesRankedAtLeast(100));
  }
}
