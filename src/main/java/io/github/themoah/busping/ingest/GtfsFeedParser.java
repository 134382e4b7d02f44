package io.github.themoah.busping.ingest;

import io.github.themoah.busping.model.FeedSnapshot;
import io.github.themoah.busping.model.VehiclePosition;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses a GTFS-realtime vehicle-position feed rendered as JSON.
 *
 * <p>Only the fields the aggregator needs are read: {@code header.timestamp} and, per
 * entity, {@code id} and {@code vehicle.timestamp}. Protobuf-to-JSON encoders emit 64-bit
 * integers as strings, so timestamps are accepted as numbers or numeric strings.
 */
public final class GtfsFeedParser {

  private GtfsFeedParser() {}

  /**
   * Parses a feed document.
   *
   * @param feed the decoded JSON body
   * @return the snapshot
   * @throws IllegalArgumentException if the header timestamp is missing or malformed
   */
  public static FeedSnapshot parse(JsonObject feed) {
    JsonObject header = feed.getJsonObject("header");
    if (header == null) {
      throw new IllegalArgumentException("Feed has no header");
    }
    Long datasetTimestamp = readTimestamp(header, "timestamp");
    if (datasetTimestamp == null) {
      throw new IllegalArgumentException("Feed header has no timestamp");
    }

    List<VehiclePosition> vehicles = new ArrayList<>();
    JsonArray entities = feed.getJsonArray("entity");
    if (entities != null) {
      for (int i = 0; i < entities.size(); i++) {
        Object item = entities.getValue(i);
        if (!(item instanceof JsonObject entity)) {
          continue;
        }
        String id = entity.getString("id");
        JsonObject vehicle = entity.getJsonObject("vehicle");
        if (id == null || vehicle == null) {
          continue;
        }
        Long timestamp = readTimestamp(vehicle, "timestamp");
        if (timestamp != null) {
          vehicles.add(new VehiclePosition(id, timestamp));
        }
      }
    }

    return new FeedSnapshot(datasetTimestamp, vehicles);
  }

  private static Long readTimestamp(JsonObject json, String field) {
    Object value = json.getValue(field);
    if (value instanceof Number number) {
      return number.longValue();
    }
    if (value instanceof String text && !text.isBlank()) {
      try {
        return Long.parseLong(text.trim());
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Malformed " + field + ": " + text, e);
      }
    }
    return null;
  }
}
