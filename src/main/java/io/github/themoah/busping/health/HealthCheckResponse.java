package io.github.themoah.busping.health;

import io.vertx.core.json.JsonObject;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable health check response.
 *
 * @param status overall health status
 * @param checks component name to detail (empty for liveness)
 */
public record HealthCheckResponse(
  Status status,
  Map<String, String> checks
) {

  /**
   * Health status of the process or a component.
   */
  public enum Status {
    UP,
    DOWN
  }

  public HealthCheckResponse {
    checks = Map.copyOf(checks);
  }

  /**
   * Creates a liveness response (HTTP server only).
   */
  public static HealthCheckResponse liveness() {
    return new HealthCheckResponse(Status.UP, Map.of());
  }

  /**
   * Creates a readiness response: UP only if every check is ready.
   */
  public static HealthCheckResponse readiness(List<ReadinessCheck> readinessChecks) {
    boolean ready = true;
    Map<String, String> details = new LinkedHashMap<>();
    for (ReadinessCheck check : readinessChecks) {
      ready &= check.isReady();
      details.put(check.name(), check.detail());
    }
    return new HealthCheckResponse(ready ? Status.UP : Status.DOWN, details);
  }

  public boolean isUp() {
    return status == Status.UP;
  }

  /**
   * Converts to JSON for HTTP response.
   */
  public JsonObject toJson() {
    JsonObject json = new JsonObject().put("status", status.name());
    if (!checks.isEmpty()) {
      JsonObject details = new JsonObject();
      checks.keySet().stream().sorted().forEach(name -> details.put(name, checks.get(name)));
      json.put("checks", details);
    }
    return json;
  }
}
