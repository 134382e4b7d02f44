package io.github.themoah.busping;

import io.github.themoah.busping.config.VertxConfig;
import io.vertx.core.DeploymentOptions;
import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point. Deploys {@link MainVerticle} and closes Vert.x on JVM shutdown so the
 * in-flight window is flushed.
 */
public class BuspingLauncher {

  private static final Logger log = LoggerFactory.getLogger(BuspingLauncher.class);
  private static final long SHUTDOWN_TIMEOUT_SECONDS = 30;

  public static void main(String[] args) {
    VertxOptions vertxOptions = VertxConfig.createVertxOptions();
    Vertx vertx = Vertx.vertx(vertxOptions);

    DeploymentOptions deploymentOptions = VertxConfig.createDeploymentOptions("MainVerticle");

    Runtime.getRuntime().addShutdownHook(new Thread(() -> closeQuietly(vertx), "busping-shutdown"));

    vertx.deployVerticle(new MainVerticle(), deploymentOptions)
      .onSuccess(id -> log.info("MainVerticle deployed with ID: {}", id))
      .onFailure(err -> {
        log.error("Failed to deploy MainVerticle", err);
        vertx.close().onComplete(ar -> System.exit(1));
      });
  }

  private static void closeQuietly(Vertx vertx) {
    log.info("Shutdown signal received, closing Vert.x");
    try {
      vertx.close().toCompletionStage().toCompletableFuture()
        .get(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while closing Vert.x");
    } catch (ExecutionException | TimeoutException e) {
      log.error("Vert.x did not close cleanly", e);
    }
  }
}
