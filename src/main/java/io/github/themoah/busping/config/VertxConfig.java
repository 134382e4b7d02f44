package io.github.themoah.busping.config;

import io.vertx.core.DeploymentOptions;
import io.vertx.core.VertxOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Vert.x instance and deployment options.
 *
 * <p>Both verticles are single-instance: the ingestion loop owns the window state and the
 * serving loop is the only writer of the live index.
 */
public class VertxConfig {

  private static final Logger log = LoggerFactory.getLogger(VertxConfig.class);
  private static final String ENV_PREFER_NATIVE_TRANSPORT = "VERTX_PREFER_NATIVE_TRANSPORT";

  public static VertxOptions createVertxOptions() {
    VertxOptions options = new VertxOptions();
    options.setPreferNativeTransport(isNativeTransportPreferred());
    return options;
  }

  public static DeploymentOptions createDeploymentOptions(String verticleName) {
    log.info("Deploying {} as a single event-loop instance", verticleName);
    return new DeploymentOptions().setInstances(1);
  }

  public static boolean isNativeTransportPreferred() {
    String value = System.getenv(ENV_PREFER_NATIVE_TRANSPORT);
    return value == null || !"false".equalsIgnoreCase(value);
  }
}
