package io.github.themoah.busping.index;

import io.github.themoah.busping.model.Chunk;
import io.github.themoah.busping.model.SystemStats;
import io.github.themoah.busping.model.VehicleRecord;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory, query-serving view of the retained window.
 *
 * <p>Holds three time-ordered structures fed from merged chunks:
 * <ul>
 *   <li>per-vehicle record history</li>
 *   <li>feed-wide stats history, one entry per chunk</li>
 *   <li>anomaly index: rank (0-100) to {@code (endOfInterval, vehicleId)} entries</li>
 * </ul>
 * and a watermark, the timestamp of the newest merged chunk.
 *
 * <p>Each structure has its own read/write lock. A reader may observe one structure
 * already reflecting a chunk that another does not yet show. The watermark is advanced
 * only after a chunk has been merged into every structure.
 *
 * <p>Expected use: a single writer calls {@link #mergeFrom(Chunk)} with chunks in
 * ascending timestamp order and {@link #prune(long)} in between; any number of threads read.
 */
public class LiveIndex {

  private static final Logger log = LoggerFactory.getLogger(LiveIndex.class);

  private static final int RANK_BUCKETS = VehicleRecord.MAX_RANK + 1;

  private final Map<String, TimeOrderedLog<VehicleRecord>> history = new HashMap<>();
  private final TimeOrderedLog<SystemStats> statsHistory = new TimeOrderedLog<>(SystemStats::timestamp);
  private final List<TimeOrderedLog<AnomalyEntry>> anomalyIndex = new ArrayList<>(RANK_BUCKETS);

  private final ReentrantReadWriteLock historyLock = new ReentrantReadWriteLock();
  private final ReentrantReadWriteLock statsLock = new ReentrantReadWriteLock();
  private final ReentrantReadWriteLock anomalyLock = new ReentrantReadWriteLock();
  private final AtomicLong watermark = new AtomicLong(0);

  public LiveIndex() {
    for (int rank = 0; rank < RANK_BUCKETS; rank++) {
      anomalyIndex.add(new TimeOrderedLog<>(AnomalyEntry::timestamp));
    }
  }

  /**
   * Merges a chunk into all three structures and advances the watermark.
   *
   * <p>A chunk whose timestamp is not newer than the watermark is ignored, so a chunk
   * contributes at most once.
   *
   * @param chunk the chunk to merge
   * @return true if merged, false if the chunk was at or below the watermark
   */
  public boolean mergeFrom(Chunk chunk) {
    long timestamp = chunk.timestamp();
    if (timestamp <= watermark.get()) {
      log.debug("Skipping chunk {}: not newer than watermark {}", timestamp, watermark.get());
      return false;
    }

    List<IndexedEntry> entries = new ArrayList<>(chunk.recordCount());
    for (Map.Entry<String, List<VehicleRecord>> entry : chunk.records().entrySet()) {
      for (VehicleRecord record : entry.getValue()) {
        entries.add(new IndexedEntry(record.rank(), new AnomalyEntry(record.endOfInterval(), entry.getKey())));
      }
    }
    // stable: per-vehicle order is kept for equal timestamps
    entries.sort(Comparator.comparingLong(e -> e.entry().timestamp()));

    historyLock.writeLock().lock();
    try {
      anomalyLock.writeLock().lock();
      try {
        for (Map.Entry<String, List<VehicleRecord>> entry : chunk.records().entrySet()) {
          TimeOrderedLog<VehicleRecord> records = history.computeIfAbsent(
            entry.getKey(), k -> new TimeOrderedLog<>(VehicleRecord::endOfInterval));
          entry.getValue().forEach(records::append);
        }
        for (IndexedEntry indexed : entries) {
          anomalyIndex.get(indexed.rank()).append(indexed.entry());
        }
      } finally {
        anomalyLock.writeLock().unlock();
      }
    } finally {
      historyLock.writeLock().unlock();
    }

    statsLock.writeLock().lock();
    try {
      statsHistory.append(chunk.stats());
    } finally {
      statsLock.writeLock().unlock();
    }

    watermark.accumulateAndGet(timestamp, Math::max);
    return true;
  }

  /**
   * Removes every element older than {@code cutoff} from the front of each structure and
   * drops vehicles whose history becomes empty.
   *
   * @param cutoff unix seconds; elements with a smaller timestamp are removed
   * @return counts of removed elements
   */
  public PruneResult prune(long cutoff) {
    int statsRemoved;
    statsLock.writeLock().lock();
    try {
      statsRemoved = statsHistory.pruneBefore(cutoff);
    } finally {
      statsLock.writeLock().unlock();
    }

    int recordsRemoved = 0;
    int vehiclesDropped = 0;
    historyLock.writeLock().lock();
    try {
      Iterator<TimeOrderedLog<VehicleRecord>> it = history.values().iterator();
      while (it.hasNext()) {
        TimeOrderedLog<VehicleRecord> records = it.next();
        recordsRemoved += records.pruneBefore(cutoff);
        if (records.isEmpty()) {
          it.remove();
          vehiclesDropped++;
        }
      }
    } finally {
      historyLock.writeLock().unlock();
    }

    int anomalyRemoved = 0;
    anomalyLock.writeLock().lock();
    try {
      for (TimeOrderedLog<AnomalyEntry> bucket : anomalyIndex) {
        anomalyRemoved += bucket.pruneBefore(cutoff);
      }
    } finally {
      anomalyLock.writeLock().unlock();
    }

    return new PruneResult(recordsRemoved, vehiclesDropped, statsRemoved, anomalyRemoved);
  }

  /**
   * Returns the retained records of a vehicle, oldest first; empty for unknown vehicles.
   */
  public List<VehicleRecord> history(String vehicleId) {
    historyLock.readLock().lock();
    try {
      TimeOrderedLog<VehicleRecord> records = history.get(vehicleId);
      return records == null ? List.of() : records.snapshot();
    } finally {
      historyLock.readLock().unlock();
    }
  }

  /**
   * Returns the retained stats history, oldest first.
   */
  public List<SystemStats> stats() {
    statsLock.readLock().lock();
    try {
      return statsHistory.snapshot();
    } finally {
      statsLock.readLock().unlock();
    }
  }

  public long watermark() {
    return watermark.get();
  }

  public int vehicleCount() {
    historyLock.readLock().lock();
    try {
      return history.size();
    } finally {
      historyLock.readLock().unlock();
    }
  }

  public int statsCount() {
    statsLock.readLock().lock();
    try {
      return statsHistory.size();
    } finally {
      statsLock.readLock().unlock();
    }
  }

  public int anomalyEntryCount() {
    anomalyLock.readLock().lock();
    try {
      int total = 0;
      for (TimeOrderedLog<AnomalyEntry> bucket : anomalyIndex) {
        total += bucket.size();
      }
      return total;
    } finally {
      anomalyLock.readLock().unlock();
    }
  }

  /**
   * Returns the number of anomaly index entries for a single rank.
   */
  int anomalyEntryCount(int rank) {
    anomalyLock.readLock().lock();
    try {
      return anomalyIndex.get(rank).size();
    } finally {
      anomalyLock.readLock().unlock();
    }
  }

  /**
   * Collects vehicles that have at least one anomaly entry with rank {@code >= minRank}.
   */
  Set<String> vehiclesRankedAtLeast(int minRank) {
    Set<String> vehicles = new HashSet<>();
    anomalyLock.readLock().lock();
    try {
      for (int rank = minRank; rank < RANK_BUCKETS; rank++) {
        anomalyIndex.get(rank).forEach(e -> vehicles.add(e.vehicleId()));
      }
    } finally {
      anomalyLock.readLock().unlock();
    }
    return vehicles;
  }

  /**
   * Snapshots the histories of the given vehicles under a single read lock. Vehicles
   * without retained history are omitted.
   */
  Map<String, List<VehicleRecord>> histories(Collection<String> vehicleIds) {
    Map<String, List<VehicleRecord>> result = new LinkedHashMap<>();
    historyLock.readLock().lock();
    try {
      for (String vehicleId : vehicleIds) {
        TimeOrderedLog<VehicleRecord> records = history.get(vehicleId);
        if (records != null) {
          result.put(vehicleId, records.snapshot());
        }
      }
    } finally {
      historyLock.readLock().unlock();
    }
    return result;
  }

  private record IndexedEntry(int rank, AnomalyEntry entry) {}
}
