package io.github.themoah.busping.http;

import io.github.themoah.busping.index.AnomalyQueryEngine;
import io.github.themoah.busping.index.LiveIndex;
import io.github.themoah.busping.model.VehicleRecord;
import io.vertx.core.http.HttpHeaders;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP handlers for the query API over the live index.
 *
 * <ul>
 *   <li>{@code GET /history/:vehicleId} - retained records of one vehicle</li>
 *   <li>{@code GET /stats} - retained per-window stats</li>
 *   <li>{@code GET /anomalies?min_rank=N} - top vehicles by anomaly score (default rank 90)</li>
 * </ul>
 */
public class QueryHandler {

  private static final Logger log = LoggerFactory.getLogger(QueryHandler.class);
  private static final String CONTENT_TYPE_JSON = "application/json";

  private final LiveIndex index;
  private final AnomalyQueryEngine anomalies;

  public QueryHandler(LiveIndex index, AnomalyQueryEngine anomalies) {
    this.index = index;
    this.anomalies = anomalies;
  }

  public void registerRoutes(Router router) {
    router.get("/history/:vehicleId").handler(this::handleHistory);
    router.get("/stats").handler(this::handleStats);
    router.get("/anomalies").handler(this::handleAnomalies);
    log.info("Query routes registered: /history/:vehicleId, /stats, /anomalies");
  }

  private void handleHistory(RoutingContext ctx) {
    String vehicleId = ctx.pathParam("vehicleId");
    List<VehicleRecord> records = index.history(vehicleId);
    JsonArray body = new JsonArray();
    records.forEach(r -> body.add(r.toJson()));
    respond(ctx, 200, body.encode());
  }

  private void handleStats(RoutingContext ctx) {
    JsonArray body = new JsonArray();
    index.stats().forEach(s -> body.add(s.toJson()));
    respond(ctx, 200, body.encode());
  }

  private void handleAnomalies(RoutingContext ctx) {
    int minRank;
    try {
      minRank = parseMinRank(ctx.queryParam("min_rank"));
    } catch (IllegalArgumentException e) {
      respond(ctx, 400, new JsonObject().put("error", e.getMessage()).encode());
      return;
    }

    JsonArray body = new JsonArray();
    anomalies.query(minRank).forEach(v -> body.add(v.toJson()));
    respond(ctx, 200, body.encode());
  }

  /**
   * Parses the optional min_rank parameter.
   *
   * @throws IllegalArgumentException if the value is not an integer within 0-255
   */
  static int parseMinRank(List<String> values) {
    if (values == null || values.isEmpty() || values.get(0).isBlank()) {
      return AnomalyQueryEngine.DEFAULT_MIN_RANK;
    }
    String value = values.get(0).trim();
    int minRank;
    try {
      minRank = Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("min_rank must be an integer: " + value);
    }
    if (minRank < 0 || minRank > AnomalyQueryEngine.MAX_MIN_RANK) {
      throw new IllegalArgumentException("min_rank must be within 0-" + AnomalyQueryEngine.MAX_MIN_RANK + ": " + minRank);
    }
    return minRank;
  }

  private void respond(RoutingContext ctx, int statusCode, String body) {
    ctx.response()
      .putHeader(HttpHeaders.CONTENT_TYPE, CONTENT_TYPE_JSON)
      .setStatusCode(statusCode)
      .end(body);
  }
}
