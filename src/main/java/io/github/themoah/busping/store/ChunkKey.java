package io.github.themoah.busping.store;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Identity of a persisted chunk: its window-close timestamp.
 *
 * <p>File names zero-pad the timestamp to 20 digits (the width of the largest unsigned
 * 64-bit value), so lexicographic and numeric ordering agree.
 *
 * @param timestamp window-close unix seconds
 */
public record ChunkKey(long timestamp) implements Comparable<ChunkKey> {

  static final String PREFIX = "chunk_";
  static final String SUFFIX = ".bin";

  private static final Pattern FILE_NAME = Pattern.compile("^chunk_(\\d{20})\\.bin$");

  public ChunkKey {
    if (timestamp < 0) {
      throw new IllegalArgumentException("timestamp cannot be negative: " + timestamp);
    }
  }

  public String fileName() {
    return String.format("%s%020d%s", PREFIX, timestamp, SUFFIX);
  }

  /**
   * Parses a chunk file name (without directory).
   *
   * @return the key, or empty if the name is not a chunk file
   */
  public static Optional<ChunkKey> parse(String fileName) {
    Matcher matcher = FILE_NAME.matcher(fileName);
    if (!matcher.matches()) {
      return Optional.empty();
    }
    try {
      return Optional.of(new ChunkKey(Long.parseLong(matcher.group(1))));
    } catch (NumberFormatException e) {
      // beyond signed 64-bit
      return Optional.empty();
    }
  }

  @Override
  public int compareTo(ChunkKey other) {
    return Long.compare(timestamp, other.timestamp);
  }
}
