package io.github.themoah.busping.metrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration for metrics reporting.
 *
 * @param enabled whether pipeline metrics are reported
 * @param reporterType backend type: "prometheus", "datadog" or "otlp"
 * @param jvmMetricsEnabled whether JVM memory, GC, thread and CPU metrics are bound
 */
public record MetricsConfig(
  boolean enabled,
  String reporterType,
  boolean jvmMetricsEnabled
) {

  private static final Logger log = LoggerFactory.getLogger(MetricsConfig.class);

  private static final boolean DEFAULT_ENABLED = true;
  private static final String DEFAULT_REPORTER_TYPE = "prometheus";
  private static final boolean DEFAULT_JVM_METRICS_ENABLED = true;

  public boolean isEnabled() {
    return enabled;
  }

  /**
   * Loads configuration from environment variables.
   *
   * <p>Supported environment variables:
   * <ul>
   *   <li>METRICS_ENABLED - Enable/disable metrics (default: true)</li>
   *   <li>METRICS_REPORTER - prometheus, datadog or otlp (default: prometheus)</li>
   *   <li>METRICS_JVM_ENABLED - Bind JVM metrics (default: true)</li>
   * </ul>
   */
  public static MetricsConfig fromEnvironment() {
    boolean enabled = parseBoolean("METRICS_ENABLED", DEFAULT_ENABLED);
    String reporterType = System.getenv().getOrDefault("METRICS_REPORTER", DEFAULT_REPORTER_TYPE);
    boolean jvmMetrics = parseBoolean("METRICS_JVM_ENABLED", DEFAULT_JVM_METRICS_ENABLED);

    MetricsConfig config = new MetricsConfig(enabled, reporterType, jvmMetrics);
    log.info("Metrics config: enabled={}, reporter={}, jvmMetrics={}", enabled, reporterType, jvmMetrics);
    return config;
  }

  private static boolean parseBoolean(String envVar, boolean defaultValue) {
    String value = System.getenv(envVar);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value);
  }
}
