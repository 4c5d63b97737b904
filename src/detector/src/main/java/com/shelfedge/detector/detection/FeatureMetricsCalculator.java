package com.shelfedge.detector.detection;

import com.shelfedge.detector.correction.CorrectedSample;
import java.util.Optional;

/** Derives dh, dx and center time from a detected rampart-moat pair. */
public class FeatureMetricsCalculator {
  private final AcquisitionClock clock;

  public FeatureMetricsCalculator(AcquisitionClock clock) {
    this.clock = clock;
  }

  /**
   * Computes the metrics of a feature.
   *
   * @param feature rampart-moat detection result
   * @return metrics, empty when no moat was found
   * @throws IllegalStateException when the rampart lies below the moat
   */
  public Optional<FeatureMetrics> calculate(RampartMoatFeature feature) {
    if (!feature.rmFlag()) {
      return Optional.empty();
    }
    CorrectedSample rampart = feature.rampart();
    CorrectedSample moat = feature.moat();
    double dh = rampart.validHeight() - moat.validHeight();
    if (dh < 0) {
      throw new IllegalStateException("rampart at index " + rampart.index() + " lies " + (-dh)
          + " m below moat at index " + moat.index());
    }
    double dx = rampart.alongTrackDistance() - moat.alongTrackDistance();
    double meanDeltaTime = (rampart.sample().deltaTime() + moat.sample().deltaTime()) / 2.0;
    return Optional.of(new FeatureMetrics(dh, dx, clock.at(meanDeltaTime)));
  }
}
