package io.github.themoah.busping.health;

import io.vertx.core.http.HttpHeaders;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP handler for health check endpoints.
 */
public class HealthCheckHandler {

  private static final Logger log = LoggerFactory.getLogger(HealthCheckHandler.class);
  private static final String CONTENT_TYPE_JSON = "application/json";

  private final List<ReadinessCheck> checks;

  public HealthCheckHandler(List<ReadinessCheck> checks) {
    this.checks = List.copyOf(checks);
  }

  /**
   * Registers /healthz and /readyz on the router.
   */
  public void registerRoutes(Router router) {
    router.get("/healthz").handler(this::handleLiveness);
    router.get("/readyz").handler(this::handleReadiness);
    log.info("Health check routes registered: /healthz, /readyz ({} readiness checks)", checks.size());
  }

  private void handleLiveness(RoutingContext ctx) {
    respond(ctx, HealthCheckResponse.liveness());
  }

  /**
   * Returns 200 if every component is ready, 503 otherwise.
   */
  private void handleReadiness(RoutingContext ctx) {
    respond(ctx, HealthCheckResponse.readiness(checks));
  }

  private void respond(RoutingContext ctx, HealthCheckResponse response) {
    ctx.response()
      .putHeader(HttpHeaders.CONTENT_TYPE, CONTENT_TYPE_JSON)
      .setStatusCode(response.isUp() ? 200 : 503)
      .end(response.toJson().encode());
  }
}
