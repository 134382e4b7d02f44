package io.github.themoah.busping.index;

/**
 * Number of elements removed from each structure by one prune.
 */
public record PruneResult(
  int records,
  int vehiclesDropped,
  int stats,
  int anomalyEntries
) {

  public boolean isEmpty() {
    return records == 0 && vehiclesDropped == 0 && stats == 0 && anomalyEntries == 0;
  }
}
