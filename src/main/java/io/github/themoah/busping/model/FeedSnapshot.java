package io.github.themoah.busping.model;

import java.util.List;

/**
 * Parsed vehicle-position feed response.
 *
 * @param datasetTimestamp unix seconds at which the feed was published
 * @param vehicles vehicle sightings in feed order
 */
public record FeedSnapshot(
  long datasetTimestamp,
  List<VehiclePosition> vehicles
) {

  public FeedSnapshot {
    vehicles = List.copyOf(vehicles);
  }
}
