package io.github.themoah.busping.model;

/**
 * A vehicle sighting from one feed poll.
 *
 * @param vehicleId feed entity id
 * @param timestamp unix seconds reported by the vehicle
 */
public record VehiclePosition(
  String vehicleId,
  long timestamp
) {}
