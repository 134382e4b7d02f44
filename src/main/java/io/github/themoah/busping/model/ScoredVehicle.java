package io.github.themoah.busping.model;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.util.List;

/**
 * Anomaly query result for a single vehicle.
 *
 * @param vehicleId the vehicle (feed entity) id
 * @param score summed interval seconds over records at or above the requested rank
 * @param history every retained record of the vehicle, oldest first
 */
public record ScoredVehicle(
  String vehicleId,
  long score,
  List<VehicleRecord> history
) {

  public ScoredVehicle {
    history = List.copyOf(history);
  }

  public JsonObject toJson() {
    JsonArray records = new JsonArray();
    history.forEach(r -> records.add(r.toJson()));
    return new JsonObject()
      .put("bus_id", vehicleId)
      .put("score", score)
      .put("history", records);
  }
}
