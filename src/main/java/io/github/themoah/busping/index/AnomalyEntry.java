package io.github.themoah.busping.index;

/**
 * Entry of the rank-bucketed anomaly index.
 */
record AnomalyEntry(long timestamp, String vehicleId) {}
