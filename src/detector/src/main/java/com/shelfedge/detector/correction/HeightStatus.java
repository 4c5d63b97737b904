package com.shelfedge.detector.correction;

/** Why a sample's height is, or is not, usable by the detectors. */
public enum HeightStatus {
  VALID,
  /** Segment lies over grounded ice according to the background mask. */
  GROUNDED_ICE,
  /** Quality summary flags a potential data-quality problem. */
  LOW_QUALITY,
  /** Elevation or one of its correction inputs is absent or not finite. */
  MISSING,
  /** Corrected height falls outside the configured sea-surface interval. */
  OUT_OF_RANGE;

  public boolean isValid() {
    return this == VALID;
  }
}
