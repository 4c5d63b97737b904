package com.shelfedge.detector.detection;

import java.time.Instant;

/** Converts {@code delta_time} offsets (seconds since the reference epoch) to instants. */
public final class AcquisitionClock {
  private static final double NANOS_PER_SECOND = 1_000_000_000.0;

  private final Instant referenceEpoch;

  public AcquisitionClock(Instant referenceEpoch) {
    this.referenceEpoch = referenceEpoch;
  }

  public Instant referenceEpoch() {
    return referenceEpoch;
  }

  public Instant at(double deltaTimeSeconds) {
    if (!Double.isFinite(deltaTimeSeconds)) {
      throw new IllegalArgumentException("delta_time must be finite: " + deltaTimeSeconds);
    }
    long seconds = (long) Math.floor(deltaTimeSeconds);
    long nanos = Math.round((deltaTimeSeconds - seconds) * NANOS_PER_SECOND);
    return referenceEpoch.plusSeconds(seconds).plusNanos(nanos);
  }
}
