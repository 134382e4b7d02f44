package io.github.themoah.busping.store;

import io.github.themoah.busping.model.Chunk;
import io.github.themoah.busping.model.Percentiles;
import io.github.themoah.busping.model.SystemStats;
import io.github.themoah.busping.model.VehicleRecord;
import io.vertx.core.buffer.Buffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Binary encoding of a {@link Chunk}.
 *
 * <p>Layout (big-endian):
 * <pre>
 *   magic "BPCK" | version u8
 *   stats:   timestamp i64 | 12 x f64 interval | 12 x f64 latency | sampleCount u32
 *   vehicles: count i32, then per vehicle:
 *     id length u16 | id UTF-8 | record count i32
 *     per record: interval u16 | endOfInterval i64 | latency u16 | rank u8
 * </pre>
 */
public final class ChunkCodec {

  static final byte[] MAGIC = {'B', 'P', 'C', 'K'};
  static final int VERSION = 1;

  private static final int RECORD_SIZE = 2 + 8 + 2 + 1;
  private static final int MIN_VEHICLE_SIZE = 2 + 4;
  private static final int MAX_ID_BYTES = 0xFFFF;

  private ChunkCodec() {}

  public static Buffer encode(Chunk chunk) {
    Buffer buffer = Buffer.buffer();
    buffer.appendBytes(MAGIC);
    buffer.appendByte((byte) VERSION);

    SystemStats stats = chunk.stats();
    buffer.appendLong(stats.timestamp());
    appendPercentiles(buffer, stats.intervalStats());
    appendPercentiles(buffer, stats.latencyStats());
    buffer.appendUnsignedInt(stats.sampleCount());

    buffer.appendInt(chunk.records().size());
    for (Map.Entry<String, List<VehicleRecord>> entry : chunk.records().entrySet()) {
      byte[] id = entry.getKey().getBytes(StandardCharsets.UTF_8);
      if (id.length > MAX_ID_BYTES) {
        throw new IllegalArgumentException("Vehicle id too long: " + id.length + " bytes");
      }
      buffer.appendUnsignedShort(id.length);
      buffer.appendBytes(id);

      buffer.appendInt(entry.getValue().size());
      for (VehicleRecord record : entry.getValue()) {
        buffer.appendUnsignedShort(record.interval());
        buffer.appendLong(record.endOfInterval());
        buffer.appendUnsignedShort(record.latency());
        buffer.appendUnsignedByte((short) record.rank());
      }
    }
    return buffer;
  }

  /**
   * Decodes a chunk.
   *
   * @throws ChunkDecodeException if the buffer is truncated, has trailing bytes, an unknown
   *     magic or version, or carries out-of-range values
   */
  public static Chunk decode(Buffer buffer) {
    try {
      return new Reader(buffer).readChunk();
    } catch (IndexOutOfBoundsException e) {
      throw new ChunkDecodeException(null, "truncated chunk (" + buffer.length() + " bytes)", e);
    } catch (IllegalArgumentException e) {
      throw new ChunkDecodeException(null, "invalid chunk content: " + e.getMessage(), e);
    }
  }

  private static void appendPercentiles(Buffer buffer, Percentiles percentiles) {
    for (double value : percentiles.breakpoints()) {
      buffer.appendDouble(value);
    }
  }

  private static final class Reader {
    private final Buffer buffer;
    private int pos;

    Reader(Buffer buffer) {
      this.buffer = buffer;
    }

    Chunk readChunk() {
      byte[] magic = buffer.getBytes(0, MAGIC.length);
      for (int i = 0; i < MAGIC.length; i++) {
        if (magic[i] != MAGIC[i]) {
          throw new ChunkDecodeException("not a chunk file (bad magic)");
        }
      }
      pos = MAGIC.length;

      int version = buffer.getUnsignedByte(pos);
      pos += 1;
      if (version != VERSION) {
        throw new ChunkDecodeException("unsupported chunk format version " + version);
      }

      long timestamp = readLong();
      Percentiles intervalStats = readPercentiles();
      Percentiles latencyStats = readPercentiles();
      long sampleCount = buffer.getUnsignedInt(pos);
      pos += 4;
      SystemStats stats = new SystemStats(timestamp, intervalStats, latencyStats, sampleCount);

      int vehicleCount = readCount(MIN_VEHICLE_SIZE);
      Map<String, List<VehicleRecord>> records = new LinkedHashMap<>();
      for (int v = 0; v < vehicleCount; v++) {
        int idLength = buffer.getUnsignedShort(pos);
        pos += 2;
        String id = new String(buffer.getBytes(pos, pos + idLength), StandardCharsets.UTF_8);
        pos += idLength;

        int recordCount = readCount(RECORD_SIZE);
        List<VehicleRecord> list = new ArrayList<>(recordCount);
        for (int r = 0; r < recordCount; r++) {
          int interval = buffer.getUnsignedShort(pos);
          long endOfInterval = buffer.getLong(pos + 2);
          int latency = buffer.getUnsignedShort(pos + 10);
          int rank = buffer.getUnsignedByte(pos + 12);
          pos += RECORD_SIZE;
          list.add(new VehicleRecord(interval, endOfInterval, latency, rank));
        }
        if (records.put(id, list) != null) {
          throw new ChunkDecodeException("duplicate vehicle id " + id);
        }
      }

      if (pos != buffer.length()) {
        throw new ChunkDecodeException((buffer.length() - pos) + " trailing bytes");
      }
      return new Chunk(stats, records);
    }

    private long readLong() {
      long value = buffer.getLong(pos);
      pos += 8;
      return value;
    }

    private Percentiles readPercentiles() {
      double[] values = new double[Percentiles.FRACTIONS.length];
      for (int i = 0; i < values.length; i++) {
        values[i] = buffer.getDouble(pos);
        pos += 8;
      }
      return Percentiles.fromBreakpoints(values);
    }

    /**
     * Reads an element count and rejects counts the remaining bytes cannot hold.
     */
    private int readCount(int minElementSize) {
      int count = buffer.getInt(pos);
      pos += 4;
      if (count < 0 || (long) count * minElementSize > buffer.length() - pos) {
        throw new ChunkDecodeException("implausible element count " + count + " at offset " + (pos - 4));
      }
      return count;
    }
  }
}
