package com.shelfedge.detector.detection;

import java.time.Instant;

/**
 * Reported size of a rampart-moat structure.
 *
 * @param dh rampart height minus moat height, in metres
 * @param dx rampart along-track distance minus moat along-track distance, in metres (signed)
 * @param centerTime acquisition time halfway between the rampart and moat samples
 */
public record FeatureMetrics(double dh, double dx, Instant centerTime) {}
