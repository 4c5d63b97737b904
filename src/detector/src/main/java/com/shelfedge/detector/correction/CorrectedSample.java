package com.shelfedge.detector.correction;

import com.shelfedge.detector.model.Sample;

/**
 * A sample with its height above the instantaneous sea surface.
 *
 * <p>{@code height} is {@code null} whenever {@code status} is not {@link HeightStatus#VALID}.
 * {@code alongTrackDistance} is positional and is kept for invalid samples too.
 *
 * @param index physical index of the sample inside its profile
 * @param sample the underlying measurement
 * @param alongTrackDistance {@code x_atc} minus the first sample's {@code x_atc}
 * @param height corrected height, or {@code null}
 * @param status validity of {@code height}
 */
public record CorrectedSample(
    int index,
    Sample sample,
    double alongTrackDistance,
    Double height,
    HeightStatus status) {

  public CorrectedSample {
    if (status.isValid() != (height != null)) {
      throw new IllegalArgumentException("height must be present exactly when status is VALID");
    }
  }

  public boolean isValid() {
    return status.isValid();
  }

  /**
   * Returns the corrected height of a valid sample.
   *
   * @return height in metres
   * @throws IllegalStateException when the sample is invalid
   */
  public double validHeight() {
    if (height == null) {
      throw new IllegalStateException("sample " + index + " has no valid height (" + status + ")");
    }
    return height;
  }
}
