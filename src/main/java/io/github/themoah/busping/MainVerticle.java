package io.github.themoah.busping;

import io.github.themoah.busping.config.AppConfig;
import io.github.themoah.busping.health.HealthCheckHandler;
import io.github.themoah.busping.health.ReadinessCheck;
import io.github.themoah.busping.http.ApiRouter;
import io.github.themoah.busping.http.QueryHandler;
import io.github.themoah.busping.index.AnomalyQueryEngine;
import io.github.themoah.busping.index.IndexMaintainer;
import io.github.themoah.busping.index.LiveIndex;
import io.github.themoah.busping.index.RetentionPolicy;
import io.github.themoah.busping.ingest.GtfsFeedClient;
import io.github.themoah.busping.ingest.IngestLoop;
import io.github.themoah.busping.metrics.MetricsConfig;
import io.github.themoah.busping.metrics.MetricsReporter;
import io.github.themoah.busping.metrics.MicrometerConfig;
import io.github.themoah.busping.metrics.MicrometerReporter;
import io.github.themoah.busping.store.ChunkStore;
import io.github.themoah.busping.store.FileChunkStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.http.HttpServer;
import io.vertx.ext.web.Router;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main verticle for busping.
 * Wires the chunk store, the ingestion loop and/or the index maintainer (per mode),
 * metrics and the HTTP server. The two loops share nothing but the chunk store.
 */
public class MainVerticle extends AbstractVerticle {

  private static final Logger log = LoggerFactory.getLogger(MainVerticle.class);

  private final AppConfig appConfig;
  private final MetricsConfig metricsConfig;

  private MetricsReporter reporter = MetricsReporter.NOOP;
  private IngestLoop ingestLoop;
  private IndexMaintainer indexMaintainer;
  private HttpServer httpServer;

  public MainVerticle() {
    this(null, null);
  }

  /**
   * Constructor for testing with explicit configuration; null values load from the environment.
   */
  MainVerticle(AppConfig appConfig, MetricsConfig metricsConfig) {
    this.appConfig = appConfig;
    this.metricsConfig = metricsConfig;
  }

  @Override
  public void start(Promise<Void> startPromise) {
    log.info("Starting busping MainVerticle");

    AppConfig config = appConfig != null ? appConfig : AppConfig.fromEnvironment();
    MetricsConfig metrics = metricsConfig != null ? metricsConfig : MetricsConfig.fromEnvironment();

    MeterRegistry registry = createRegistry(metrics);
    if (registry != null) {
      reporter = new MicrometerReporter(registry);
    }

    ChunkStore store = new FileChunkStore(vertx, config.dataDir());
    RetentionPolicy retention = new RetentionPolicy(config.retention());
    List<ReadinessCheck> checks = new ArrayList<>();
    QueryHandler queries = null;

    if (config.mode().runsIngest()) {
      ingestLoop = new IngestLoop(
        vertx,
        new GtfsFeedClient(vertx, config.feedUrl(), config.fetchTimeoutMs()),
        store,
        retention,
        reporter,
        config.fetchIntervalMs(),
        config.windowDurationMs()
      );
      checks.add(ingestLoop);
    }

    if (config.mode().runsServe()) {
      LiveIndex index = new LiveIndex();
      indexMaintainer = new IndexMaintainer(
        vertx,
        store,
        index,
        retention,
        reporter,
        config.indexRefreshIntervalMs(),
        config.maxDecodeAttempts()
      );
      checks.add(indexMaintainer);
      queries = new QueryHandler(index, new AnomalyQueryEngine(index));
    }

    Router router = ApiRouter.create(vertx, queries, new HealthCheckHandler(checks), registry);

    store.open()
      .compose(v -> reporter.start())
      .compose(v -> startHttpServer(router, config.httpPort()))
      .compose(server -> {
        httpServer = server;
        return startIngestLoop();
      })
      .compose(v -> startIndexMaintainer())
      .onSuccess(v -> {
        log.info("busping started in {} mode on port {}, data dir {}",
          config.mode(), httpServer.actualPort(), config.dataDir());
        startPromise.complete();
      })
      .onFailure(err -> {
        log.error("Failed to start busping", err);
        startPromise.fail(err);
      });
  }

  /**
   * Stops the ingestion loop first so its final window is flushed while the store is
   * still in use, then the maintainer, the HTTP server and the metrics backend.
   */
  @Override
  public void stop(Promise<Void> stopPromise) {
    log.info("Stopping busping MainVerticle");

    Future<Void> stopIngest = (ingestLoop != null)
      ? ingestLoop.stop()
      : Future.succeededFuture();

    stopIngest
      .compose(v -> indexMaintainer != null ? indexMaintainer.stop() : Future.<Void>succeededFuture())
      .compose(v -> httpServer != null ? httpServer.close() : Future.<Void>succeededFuture())
      .compose(v -> reporter.close())
      .onSuccess(v -> {
        log.info("busping stopped successfully");
        stopPromise.complete();
      })
      .onFailure(err -> {
        log.error("Error during busping shutdown", err);
        stopPromise.fail(err);
      });
  }

  /**
   * Port the HTTP server is bound to, or -1 before start.
   */
  int actualPort() {
    return httpServer != null ? httpServer.actualPort() : -1;
  }

  private Future<HttpServer> startHttpServer(Router router, int port) {
    return vertx.createHttpServer()
      .requestHandler(router)
      .listen(port)
      .onSuccess(server -> log.info("HTTP server started on port {}", server.actualPort()))
      .onFailure(err -> log.error("Failed to start HTTP server", err));
  }

  private Future<Void> startIngestLoop() {
    if (ingestLoop == null) {
      return Future.succeededFuture();
    }
    return ingestLoop.start();
  }

  private Future<Void> startIndexMaintainer() {
    if (indexMaintainer == null) {
      return Future.succeededFuture();
    }
    return indexMaintainer.start();
  }

  private MeterRegistry createRegistry(MetricsConfig config) {
    if (!config.isEnabled()) {
      log.info("Metrics reporting is disabled");
      return null;
    }

    MeterRegistry registry = MicrometerConfig.createRegistry(config.reporterType());
    if (registry == null) {
      log.warn("Failed to create meter registry for type: {}", config.reporterType());
      return null;
    }

    if (config.jvmMetricsEnabled()) {
      MicrometerConfig.bindJvmMetrics(registry);
      log.info("JVM metrics enabled");
    }
    return registry;
  }
}
