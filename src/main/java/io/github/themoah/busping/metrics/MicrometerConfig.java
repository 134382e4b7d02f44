package io.github.themoah.busping.metrics;

import io.micrometer.core.instrument.Clock;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.datadog.DatadogConfig;
import io.micrometer.datadog.DatadogMeterRegistry;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.micrometer.registry.otlp.AggregationTemporality;
import io.micrometer.registry.otlp.OtlpConfig;
import io.micrometer.registry.otlp.OtlpMeterRegistry;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory for creating Micrometer registries.
 */
public final class MicrometerConfig {

  private static final Logger log = LoggerFactory.getLogger(MicrometerConfig.class);

  private static final String SERVICE_NAME = "busping";
  private static final String DEFAULT_OTLP_URL = "http://localhost:4318/v1/metrics";
  private static final Duration DEFAULT_STEP = Duration.ofSeconds(60);

  private MicrometerConfig() {}

  /**
   * Creates a meter registry based on the reporter type.
   *
   * @param reporterType "prometheus", "datadog" or "otlp"
   * @return the configured MeterRegistry, or null if type is unknown
   */
  public static MeterRegistry createRegistry(String reporterType) {
    if (reporterType == null) {
      return null;
    }

    return switch (reporterType.trim().toLowerCase()) {
      case "prometheus" -> createPrometheusRegistry();
      case "datadog" -> createDatadogRegistry();
      case "otlp" -> createOtlpRegistry();
      default -> {
        log.warn("Unknown reporter type: {}", reporterType);
        yield null;
      }
    };
  }

  public static PrometheusMeterRegistry createPrometheusRegistry() {
    log.info("Creating Prometheus meter registry");
    return new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
  }

  /**
   * Creates a Datadog meter registry from DD_API_KEY, DD_APP_KEY, DD_SITE and DD_STEP_MS.
   */
  public static MeterRegistry createDatadogRegistry() {
    log.info("Creating Datadog meter registry");

    Map<String, String> properties = new HashMap<>();
    properties.put("datadog.apiKey", System.getenv("DD_API_KEY"));
    properties.put("datadog.applicationKey", System.getenv("DD_APP_KEY"));
    properties.put("datadog.uri", "https://api." + System.getenv().getOrDefault("DD_SITE", "datadoghq.com"));
    properties.put("datadog.step", stepFromEnvironment("DD_STEP_MS").toMillis() + "ms");
    DatadogConfig config = properties::get;

    return new DatadogMeterRegistry(config, Clock.SYSTEM);
  }

  /**
   * Creates an OTLP (HTTP, cumulative) meter registry.
   *
   * <p>Endpoint: OTLP_ENDPOINT, else OTEL_EXPORTER_OTLP_METRICS_ENDPOINT, else
   * OTEL_EXPORTER_OTLP_ENDPOINT with {@code /v1/metrics} appended. Headers come from
   * OTLP_HEADERS or OTEL_EXPORTER_OTLP_HEADERS ({@code k=v,k=v}); resource attributes from
   * OTEL_RESOURCE_ATTRIBUTES, with service.name defaulting to busping.
   */
  public static MeterRegistry createOtlpRegistry() {
    log.info("Creating OTLP meter registry");

    OtlpConfig config = new OtlpConfig() {
      @Override
      public String url() {
        String url = firstNonBlank("OTLP_ENDPOINT", "OTEL_EXPORTER_OTLP_METRICS_ENDPOINT");
        if (url != null) {
          return url;
        }
        String base = firstNonBlank("OTEL_EXPORTER_OTLP_ENDPOINT");
        if (base != null) {
          return base.endsWith("/v1/metrics") ? base : base + "/v1/metrics";
        }
        return DEFAULT_OTLP_URL;
      }

      @Override
      public AggregationTemporality aggregationTemporality() {
        return AggregationTemporality.CUMULATIVE;
      }

      @Override
      public Duration step() {
        return stepFromEnvironment("OTLP_STEP_MS");
      }

      @Override
      public Map<String, String> headers() {
        return parsePairs(firstNonBlank("OTLP_HEADERS", "OTEL_EXPORTER_OTLP_HEADERS"));
      }

      @Override
      public Map<String, String> resourceAttributes() {
        Map<String, String> attributes = parsePairs(firstNonBlank("OTEL_RESOURCE_ATTRIBUTES"));
        String serviceName = firstNonBlank("OTEL_SERVICE_NAME");
        attributes.put("service.name", serviceName != null
          ? serviceName
          : attributes.getOrDefault("service.name", SERVICE_NAME));
        return attributes;
      }

      @Override
      public String get(String key) {
        return null;
      }
    };

    OtlpMeterRegistry registry = new OtlpMeterRegistry(config, Clock.SYSTEM);
    log.info("OTLP registry created - endpoint: {}", config.url());
    return registry;
  }

  /**
   * Binds JVM metrics (memory, GC, threads, CPU) to the given registry.
   */
  public static void bindJvmMetrics(MeterRegistry registry) {
    log.info("Binding JVM metrics to registry");
    new JvmMemoryMetrics().bindTo(registry);
    new JvmGcMetrics().bindTo(registry);
    new JvmThreadMetrics().bindTo(registry);
    new ProcessorMetrics().bindTo(registry);
  }

  private static Duration stepFromEnvironment(String envVar) {
    String value = System.getenv(envVar);
    if (value == null || value.isBlank()) {
      return DEFAULT_STEP;
    }
    try {
      return Duration.ofMillis(Long.parseLong(value.trim()));
    } catch (NumberFormatException e) {
      log.warn("Invalid {}: {}, using default {}", envVar, value, DEFAULT_STEP);
      return DEFAULT_STEP;
    }
  }

  private static String firstNonBlank(String... envVars) {
    for (String envVar : envVars) {
      String value = System.getenv(envVar);
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return null;
  }

  /**
   * Parses {@code key1=value1,key2=value2}; malformed pairs are logged and skipped.
   */
  static Map<String, String> parsePairs(String text) {
    Map<String, String> pairs = new HashMap<>();
    if (text == null || text.isBlank()) {
      return pairs;
    }
    for (String pair : text.split(",")) {
      String[] parts = pair.trim().split("=", 2);
      if (parts.length == 2 && !parts[0].isBlank()) {
        pairs.put(parts[0].trim(), parts[1].trim());
      } else if (!pair.isBlank()) {
        log.warn("Invalid key=value pair: {}", pair);
      }
    }
    return pairs;
  }
}
