package io.github.themoah.busping.index;

import io.github.themoah.busping.model.ScoredVehicle;
import io.github.themoah.busping.model.VehicleRecord;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Ranks vehicles by how much update-interval time they spent in high percentile bands.
 *
 * <p>Candidates come from the anomaly index buckets {@code [minRank, 100]}. Each candidate
 * is scored by summing the interval of every retained record with rank {@code >= minRank}.
 * Scores are raw seconds with no normalisation for how long a vehicle has been observed.
 * Results are ordered by score descending, then vehicle id ascending.
 */
public class AnomalyQueryEngine {

  public static final int DEFAULT_MIN_RANK = 90;
  /** Largest accepted min rank; anything above the highest rank matches nothing. */
  public static final int MAX_MIN_RANK = 255;
  public static final int DEFAULT_LIMIT = 50;

  private static final Comparator<ScoredVehicle> ORDER =
    Comparator.comparingLong(ScoredVehicle::score).reversed()
      .thenComparing(ScoredVehicle::vehicleId);

  private final LiveIndex index;
  private final int limit;

  public AnomalyQueryEngine(LiveIndex index) {
    this(index, DEFAULT_LIMIT);
  }

  public AnomalyQueryEngine(LiveIndex index, int limit) {
    this.index = Objects.requireNonNull(index, "index cannot be null");
    if (limit < 1) {
      throw new IllegalArgumentException("limit must be positive: " + limit);
    }
    this.limit = limit;
  }

  /**
   * Returns the top-scoring vehicles with their full retained history.
   *
   * @param minRank lowest rank that counts towards the score, 0-255
   * @return at most {@code limit} vehicles, best first; empty when nothing matches
   * @throws IllegalArgumentException if {@code minRank} is outside 0-255
   */
  public List<ScoredVehicle> query(int minRank) {
    if (minRank < 0 || minRank > MAX_MIN_RANK) {
      throw new IllegalArgumentException("minRank must be within 0-" + MAX_MIN_RANK + ": " + minRank);
    }
    if (minRank > VehicleRecord.MAX_RANK) {
      return List.of();
    }

    Set<String> candidates = index.vehiclesRankedAtLeast(minRank);
    if (candidates.isEmpty()) {
      return List.of();
    }

    Map<String, List<VehicleRecord>> histories = index.histories(candidates);
    List<ScoredVehicle> scored = new ArrayList<>();
    for (Map.Entry<String, List<VehicleRecord>> entry : histories.entrySet()) {
      long score = score(entry.getValue(), minRank);
      if (score > 0) {
        scored.add(new ScoredVehicle(entry.getKey(), score, entry.getValue()));
      }
    }

    scored.sort(ORDER);
    return scored.size() > limit ? List.copyOf(scored.subList(0, limit)) : scored;
  }

  static long score(List<VehicleRecord> records, int minRank) {
    long score = 0;
    for (VehicleRecord record : records) {
      if (record.rank() >= minRank) {
        score += record.interval();
      }
    }
    return score;
  }
}
