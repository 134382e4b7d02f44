package io.github.themoah.busping.health;

/**
 * A component that reports whether it is ready to serve.
 */
public interface ReadinessCheck {

  /**
   * Name used as the key in the readiness response.
   */
  String name();

  boolean isReady();

  /**
   * Short human-readable state, e.g. "connected" or "loading".
   */
  String detail();
}
