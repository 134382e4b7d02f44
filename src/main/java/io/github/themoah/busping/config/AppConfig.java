package io.github.themoah.busping.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Application configuration loaded from environment variables.
 *
 * @param mode which loops this process runs
 * @param httpPort HTTP server port of the query API
 * @param dataDir directory holding chunk files, shared by both loops
 * @param feedUrl vehicle-position feed URL (GTFS-realtime as JSON)
 * @param fetchIntervalMs feed poll period in milliseconds
 * @param fetchTimeoutMs feed request timeout in milliseconds
 * @param windowDurationMs aggregation window length in milliseconds
 * @param indexRefreshIntervalMs period of the index merge-and-prune pass in milliseconds
 * @param retention how long chunks and index entries are kept
 * @param maxDecodeAttempts failed decodes before a chunk is quarantined (0 = never)
 */
public record AppConfig(
  Mode mode,
  int httpPort,
  Path dataDir,
  String feedUrl,
  long fetchIntervalMs,
  long fetchTimeoutMs,
  long windowDurationMs,
  long indexRefreshIntervalMs,
  Duration retention,
  int maxDecodeAttempts
) {
  private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

  static final String DEFAULT_FEED_URL =
    "https://birch.catenarymaps.org/gtfs_rt?feed_id=f-metro~losangeles~bus~rt&feed_type=vehicle&format=json";

  private static final Mode DEFAULT_MODE = Mode.ALL;
  private static final int DEFAULT_HTTP_PORT = 3000;
  private static final String DEFAULT_DATA_DIR = "./data";
  private static final long DEFAULT_FETCH_INTERVAL_MS = 1_000L;
  private static final long DEFAULT_FETCH_TIMEOUT_MS = 10_000L;
  private static final long DEFAULT_WINDOW_DURATION_MS = 60_000L;
  private static final long DEFAULT_INDEX_REFRESH_INTERVAL_MS = 10_000L;
  private static final long DEFAULT_RETENTION_HOURS = 48;
  private static final int DEFAULT_MAX_DECODE_ATTEMPTS = 3;

  /**
   * Which loops to deploy.
   */
  public enum Mode {
    INGEST,
    SERVE,
    ALL;

    public boolean runsIngest() {
      return this == INGEST || this == ALL;
    }

    public boolean runsServe() {
      return this == SERVE || this == ALL;
    }
  }

  /**
   * Loads configuration from environment variables with defaults.
   *
   * @return AppConfig instance
   */
  public static AppConfig fromEnvironment() {
    return fromMap(System.getenv());
  }

  /**
   * Loads configuration from a variable map with defaults. Invalid values are logged and
   * replaced by their default.
   *
   * @param env variable name to value
   * @return AppConfig instance
   */
  public static AppConfig fromMap(Map<String, String> env) {
    Mode mode = getMode(env, "BUSPING_MODE", DEFAULT_MODE);
    int port = getInt(env, "HTTP_PORT", DEFAULT_HTTP_PORT);
    Path dataDir = Path.of(getString(env, "BUSPING_DATA_DIR", DEFAULT_DATA_DIR));
    String feedUrl = getString(env, "FEED_URL", DEFAULT_FEED_URL);
    long fetchInterval = getPositiveLong(env, "FEED_FETCH_INTERVAL_MS", DEFAULT_FETCH_INTERVAL_MS);
    long fetchTimeout = getPositiveLong(env, "FEED_FETCH_TIMEOUT_MS", DEFAULT_FETCH_TIMEOUT_MS);
    long window = getPositiveLong(env, "WINDOW_DURATION_MS", DEFAULT_WINDOW_DURATION_MS);
    long refresh = getPositiveLong(env, "INDEX_REFRESH_INTERVAL_MS", DEFAULT_INDEX_REFRESH_INTERVAL_MS);
    long retentionHours = getPositiveLong(env, "RETENTION_HOURS", DEFAULT_RETENTION_HOURS);
    int maxDecodeAttempts = getInt(env, "CHUNK_MAX_DECODE_ATTEMPTS", DEFAULT_MAX_DECODE_ATTEMPTS);

    AppConfig config = new AppConfig(mode, port, dataDir, feedUrl, fetchInterval, fetchTimeout,
      window, refresh, Duration.ofHours(retentionHours), maxDecodeAttempts);
    log.info("AppConfig loaded: mode={}, httpPort={}, dataDir={}, windowDurationMs={}, retention={}",
      mode, port, dataDir, window, config.retention());
    return config;
  }

  private static String getString(Map<String, String> env, String name, String defaultValue) {
    String value = env.get(name);
    return (value == null || value.isBlank()) ? defaultValue : value.trim();
  }

  private static Mode getMode(Map<String, String> env, String name, Mode defaultValue) {
    String value = env.get(name);
    if (value != null && !value.isBlank()) {
      try {
        return Mode.valueOf(value.trim().toUpperCase(Locale.ROOT));
      } catch (IllegalArgumentException e) {
        log.warn("Invalid mode for {}: {}, using default: {}", name, value, defaultValue);
      }
    }
    return defaultValue;
  }

  private static int getInt(Map<String, String> env, String name, int defaultValue) {
    String value = env.get(name);
    if (value != null && !value.isBlank()) {
      try {
        return Integer.parseInt(value.trim());
      } catch (NumberFormatException e) {
        log.warn("Invalid integer for {}: {}, using default: {}", name, value, defaultValue);
      }
    }
    return defaultValue;
  }

  private static long getPositiveLong(Map<String, String> env, String name, long defaultValue) {
    String value = env.get(name);
    if (value != null && !value.isBlank()) {
      try {
        long parsed = Long.parseLong(value.trim());
        if (parsed > 0) {
          return parsed;
        }
        log.warn("{} must be positive, got {}, using default: {}", name, parsed, defaultValue);
      } catch (NumberFormatException e) {
        log.warn("Invalid long for {}: {}, using default: {}", name, value, defaultValue);
      }
    }
    return defaultValue;
  }
}
