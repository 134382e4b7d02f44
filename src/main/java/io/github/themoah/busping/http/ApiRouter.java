package io.github.themoah.busping.http;

import io.github.themoah.busping.health.HealthCheckHandler;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpMethod;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.handler.CorsHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assembles the HTTP router: permissive CORS, query and health routes, the Prometheus
 * scrape endpoint when a Prometheus registry is in use, and a JSON 404 fallback.
 */
public final class ApiRouter {

  private static final Logger log = LoggerFactory.getLogger(ApiRouter.class);
  private static final String PROMETHEUS_CONTENT_TYPE = "text/plain; version=0.0.4; charset=utf-8";

  private ApiRouter() {}

  /**
   * Builds the router.
   *
   * @param vertx the Vert.x instance
   * @param queries query handler, or null when this process does not serve queries
   * @param health health handler
   * @param registry meter registry, or null when metrics are disabled
   * @return the router
   */
  public static Router create(Vertx vertx, QueryHandler queries, HealthCheckHandler health, MeterRegistry registry) {
    Router router = Router.router(vertx);

    router.route().handler(CorsHandler.create()
      .allowedMethod(HttpMethod.GET)
      .allowedMethod(HttpMethod.OPTIONS));

    health.registerRoutes(router);
    if (queries != null) {
      queries.registerRoutes(router);
    }

    if (registry instanceof PrometheusMeterRegistry prometheusRegistry) {
      router.get("/metrics").handler(ctx -> ctx.response()
        .putHeader("content-type", PROMETHEUS_CONTENT_TYPE)
        .end(prometheusRegistry.scrape()));
      log.info("Registered Prometheus metrics endpoint at /metrics");
    }

    router.route().handler(ctx -> ctx.response()
      .setStatusCode(404)
      .putHeader("content-type", "application/json")
      .end("{\"error\": \"Not Found\"}"));

    return router;
  }
}
