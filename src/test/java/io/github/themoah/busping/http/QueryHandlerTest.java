package io.github.themoah.busping.http;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.busping.health.HealthCheckHandler;
import io.github.themoah.busping.index.AnomalyQueryEngine;
import io.github.themoah.busping.index.LiveIndex;
import io.github.themoah.busping.model.Chunk;
import io.github.themoah.busping.model.Percentiles;
import io.github.themoah.busping.model.SystemStats;
import io.github.themoah.busping.model.VehicleRecord;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpServer;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.WebClient;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Tests for the query API routes, served by a real HTTP server on a random port.
 */
@ExtendWith(VertxExtension.class)
public class QueryHandlerTest {

  private LiveIndex index;
  private PrometheusMeterRegistry registry;
  private WebClient client;
  private int port;

  @BeforeEach
  void setUp(Vertx vertx) throws Exception {
    index = new LiveIndex();
    Map<String, List<VehicleRecord>> records = new LinkedHashMap<>();
    records.put("A", List.of(
      new VehicleRecord(10, 100, 1, 95),
      new VehicleRecord(20, 120, 2, 60),
      new VehicleRecord(30, 150, 3, 98)));
    records.put("B", List.of(new VehicleRecord(5, 110, 0, 80)));
    index.mergeFrom(new Chunk(new SystemStats(160, Percentiles.ZERO, Percentiles.ZERO, 4), records));

    registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
    registry.counter("busping.test.counter").increment();

    QueryHandler queries = new QueryHandler(index, new AnomalyQueryEngine(index));
    HttpServer server = vertx.createHttpServer()
      .requestHandler(ApiRouter.create(vertx, queries, new HealthCheckHandler(List.of()), registry))
      .listen(0)
      .toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
    port = server.actualPort();
    client = WebClient.create(vertx);
  }

  @Test
  void history_returnsRecords(VertxTestContext ctx) throws Exception {
    client.get(port, "localhost", "/history/A").send()
      .onComplete(ctx.succeeding(response -> ctx.verify(() -> {
        assertEquals(200, response.statusCode());
        assertEquals("application/json", response.getHeader("content-type"));
        JsonArray body = response.bodyAsJsonArray();
        assertEquals(3, body.size());
        JsonObject first = body.getJsonObject(0);
        assertEquals(10, first.getInteger("interval"));
        assertEquals(100L, first.getLong("end_of_interval"));
        assertEquals(1, first.getInteger("latency"));
        assertEquals(95, first.getInteger("rank"));
        ctx.completeNow();
      })));

    assertTrue(ctx.awaitCompletion(5, TimeUnit.SECONDS));
  }

  @Test
  void history_unknownVehicle_isEmptyArray(VertxTestContext ctx) throws Exception {
    client.get(port, "localhost", "/history/nope").send()
      .onComplete(ctx.succeeding(response -> ctx.verify(() -> {
        assertEquals(200, response.statusCode());
        assertEquals("[]", response.bodyAsString());
        ctx.completeNow();
      })));

    assertTrue(ctx.awaitCompletion(5, TimeUnit.SECONDS));
  }

  @Test
  void stats_returnsWindowStats(VertxTestContext ctx) throws Exception {
    client.get(port, "localhost", "/stats").send()
      .onComplete(ctx.succeeding(response -> ctx.verify(() -> {
        assertEquals(200, response.statusCode());
        JsonArray body = response.bodyAsJsonArray();
        assertEquals(1, body.size());
        assertEquals(160L, body.getJsonObject(0).getLong("timestamp"));
        assertEquals(4L, body.getJsonObject(0).getLong("sample_count"));
        assertTrue(body.getJsonObject(0).getJsonObject("interval_stats").containsKey("p99_9"));
        ctx.completeNow();
      })));

    assertTrue(ctx.awaitCompletion(5, TimeUnit.SECONDS));
  }

  @Test
  void anomalies_defaultMinRank(VertxTestContext ctx) throws Exception {
    client.get(port, "localhost", "/anomalies").send()
      .onComplete(ctx.succeeding(response -> ctx.verify(() -> {
        assertEquals(200, response.statusCode());
        JsonArray body = response.bodyAsJsonArray();
        assertEquals(1, body.size());
        assertEquals("A", body.getJsonObject(0).getString("bus_id"));
        assertEquals(40L, body.getJsonObject(0).getLong("score"));
        assertEquals(3, body.getJsonObject(0).getJsonArray("history").size());
        ctx.completeNow();
      })));

    assertTrue(ctx.awaitCompletion(5, TimeUnit.SECONDS));
  }

  @Test
  void anomalies_explicitMinRank(VertxTestContext ctx) throws Exception {
    client.get(port, "localhost", "/anomalies?min_rank=0").send()
      .onComplete(ctx.succeeding(response -> ctx.verify(() -> {
        JsonArray body = response.bodyAsJsonArray();
        assertEquals(2, body.size());
        assertEquals(60L, body.getJsonObject(0).getLong("score"));
        assertEquals("B", body.getJsonObject(1).getString("bus_id"));
        ctx.completeNow();
      })));

    assertTrue(ctx.awaitCompletion(5, TimeUnit.SECONDS));
  }

  @Test
  void anomalies_invalidMinRank_isBadRequest(VertxTestContext ctx) throws Exception {
    client.get(port, "localhost", "/anomalies?min_rank=high").send()
      .onComplete(ctx.succeeding(response -> ctx.verify(() -> {
        assertEquals(400, response.statusCode());
        assertTrue(response.bodyAsJsonObject().getString("error").contains("min_rank"));
        ctx.completeNow();
      })));

    assertTrue(ctx.awaitCompletion(5, TimeUnit.SECONDS));
  }

  @Test
  void anomalies_minRankAboveHighestRank_isEmpty(VertxTestContext ctx) throws Exception {
    client.get(port, "localhost", "/anomalies?min_rank=150").send()
      .onComplete(ctx.succeeding(response -> ctx.verify(() -> {
        assertEquals(200, response.statusCode());
        assertTrue(response.bodyAsJsonArray().isEmpty());
        ctx.completeNow();
      })));

    assertTrue(ctx.awaitCompletion(5, TimeUnit.SECONDS));
  }

  @Test
  void unknownRoute_isJson404(VertxTestContext ctx) throws Exception {
    client.get(port, "localhost", "/buses").send()
      .onComplete(ctx.succeeding(response -> ctx.verify(() -> {
        assertEquals(404, response.statusCode());
        assertEquals("Not Found", response.bodyAsJsonObject().getString("error"));
        ctx.completeNow();
      })));

    assertTrue(ctx.awaitCompletion(5, TimeUnit.SECONDS));
  }

  @Test
  void health_andMetricsRoutesRegistered(VertxTestContext ctx) throws Exception {
    client.get(port, "localhost", "/readyz").send()
      .compose(ready -> {
        ctx.verify(() -> assertEquals(200, ready.statusCode()));
        return client.get(port, "localhost", "/metrics").send();
      })
      .onComplete(ctx.succeeding(metrics -> ctx.verify(() -> {
        assertEquals(200, metrics.statusCode());
        assertTrue(metrics.bodyAsString().contains("busping_test_counter_total"));
        ctx.completeNow();
      })));

    assertTrue(ctx.awaitCompletion(5, TimeUnit.SECONDS));
  }

  @Test
  void parseMinRank_defaultsAndBounds() {
    assertEquals(90, QueryHandler.parseMinRank(null));
    assertEquals(90, QueryHandler.parseMinRank(List.of()));
    assertEquals(90, QueryHandler.parseMinRank(List.of(" ")));
    assertEquals(0, QueryHandler.parseMinRank(List.of("0")));
    assertEquals(100, QueryHandler.parseMinRank(List.of(" 100 ")));
    assertEquals(150, QueryHandler.parseMinRank(List.of("150")));
    assertEquals(255, QueryHandler.parseMinRank(List.of("255")));
    assertThrows(IllegalArgumentException.class, () -> QueryHandler.parseMinRank(List.of("256")));
    assertThrows(IllegalArgumentException.class, () -> QueryHandler.parseMinRank(List.of("-1")));
    assertThrows(IllegalArgumentException.class, () -> QueryHandler.parseMinRank(List.of("9.5")));
  }
}
