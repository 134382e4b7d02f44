package io.github.themoah.busping.store;

/**
 * Raised when a persisted chunk cannot be decoded (corrupt or incompatible encoding).
 * Callers skip the chunk for the current pass; it is never fatal.
 */
public class ChunkDecodeException extends RuntimeException {

  private final ChunkKey key;

  public ChunkDecodeException(String message) {
    this(null, message, null);
  }

  public ChunkDecodeException(ChunkKey key, String message, Throwable cause) {
    super(key == null ? message : key.fileName() + ": " + message, cause);
    this.key = key;
  }

  /**
   * Returns the key of the undecodable chunk, or null when decoding a detached buffer.
   */
  public ChunkKey key() {
    return key;
  }
}
