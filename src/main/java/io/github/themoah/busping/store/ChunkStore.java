package io.github.themoah.busping.store;

import io.github.themoah.busping.model.Chunk;
import io.vertx.core.Future;
import java.util.List;

/**
 * Append-only persistence of chunks keyed by window-close timestamp.
 * All methods return Vert.x Futures for async, non-blocking execution.
 */
public interface ChunkStore {

  /**
   * Prepares the store for use (creates directories).
   *
   * @return Future that completes when the store is ready
   */
  Future<Void> open();

  /**
   * Persists a chunk under the key derived from its timestamp. A chunk only becomes
   * visible to {@link #listSince(long)} once it is completely written. Keys are immutable:
   * writing an existing key fails.
   *
   * @param chunk the chunk to persist
   * @return Future containing the key the chunk was written under
   */
  Future<ChunkKey> put(Chunk chunk);

  /**
   * Lists keys with timestamp strictly greater than {@code watermark}, oldest first.
   * Chunk contents are not read.
   *
   * @param watermark exclusive lower bound, unix seconds
   * @return Future containing the ordered keys
   */
  Future<List<ChunkKey>> listSince(long watermark);

  /**
   * Reads and decodes a chunk.
   *
   * @param key the chunk key
   * @return Future containing the chunk, failed with {@link ChunkDecodeException} when the
   *     stored bytes cannot be decoded
   */
  Future<Chunk> get(ChunkKey key);

  /**
   * Deletes every chunk with timestamp below {@code cutoff}. Best-effort: a failed
   * deletion is logged and does not abort the batch.
   *
   * @param cutoff exclusive upper bound, unix seconds
   * @return Future containing the number of chunks deleted
   */
  Future<Integer> purgeOlderThan(long cutoff);

  /**
   * Moves an undecodable chunk out of discovery.
   *
   * @param key the chunk key
   * @return Future that completes when the chunk is no longer listed
   */
  Future<Void> quarantine(ChunkKey key);
}
