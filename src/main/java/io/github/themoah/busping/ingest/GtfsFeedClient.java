package io.github.themoah.busping.ingest;

import io.github.themoah.busping.model.FeedSnapshot;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.ext.web.client.WebClient;
import io.vertx.ext.web.client.WebClientOptions;
import io.vertx.ext.web.codec.BodyCodec;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fetches the GTFS-realtime vehicle feed over HTTP using the Vert.x WebClient.
 */
public class GtfsFeedClient implements FeedClient {

  private static final Logger log = LoggerFactory.getLogger(GtfsFeedClient.class);

  private final WebClient webClient;
  private final String feedUrl;
  private final long timeoutMs;

  public GtfsFeedClient(Vertx vertx, String feedUrl, long timeoutMs) {
    Objects.requireNonNull(vertx, "vertx cannot be null");
    this.feedUrl = Objects.requireNonNull(feedUrl, "feedUrl cannot be null");
    this.timeoutMs = timeoutMs;
    this.webClient = WebClient.create(vertx, new WebClientOptions()
      .setUserAgent("busping")
      .setFollowRedirects(true));
    log.info("Created feed client for {} with timeout {}ms", feedUrl, timeoutMs);
  }

  @Override
  public Future<FeedSnapshot> fetch() {
    return webClient.getAbs(feedUrl)
      .timeout(timeoutMs)
      .as(BodyCodec.jsonObject())
      .send()
      .map(response -> {
        if (response.statusCode() != 200) {
          throw new IllegalStateException("Feed returned HTTP " + response.statusCode());
        }
        if (response.body() == null) {
          throw new IllegalStateException("Feed returned an empty body");
        }
        return GtfsFeedParser.parse(response.body());
      });
  }

  @Override
  public Future<Void> close() {
    webClient.close();
    return Future.succeededFuture();
  }
}
