package io.github.themoah.busping.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable result of one aggregation window: window statistics plus the ranked
 * records of every vehicle that produced an interval during the window.
 * Uniquely identified by {@code stats.timestamp()}.
 */
public record Chunk(
  SystemStats stats,
  Map<String, List<VehicleRecord>> records
) {

  public Chunk {
    Objects.requireNonNull(stats, "stats cannot be null");
    Objects.requireNonNull(records, "records cannot be null");
    Map<String, List<VehicleRecord>> copy = new LinkedHashMap<>();
    records.forEach((vehicleId, list) -> copy.put(vehicleId, List.copyOf(list)));
    records = Collections.unmodifiableMap(copy);
  }

  public long timestamp() {
    return stats.timestamp();
  }

  public int recordCount() {
    return records.values().stream().mapToInt(List::size).sum();
  }
}
