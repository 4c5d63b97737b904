package com.shelfedge.detector.detection;

import com.shelfedge.detector.correction.CorrectedSample;

/**
 * Moat minimum and rampart maximum selected near a front crossing.
 *
 * @param rmFlag whether a moat was found; both samples are {@code null} otherwise
 * @param moat lowest point of the first depression landward of point B
 * @param rampart highest point within the rampart window, point B by default
 */
public record RampartMoatFeature(boolean rmFlag, CorrectedSample moat, CorrectedSample rampart) {
  private static final RampartMoatFeature ABSENT = new RampartMoatFeature(false, null, null);

  public RampartMoatFeature {
    if (rmFlag && (moat == null || rampart == null)) {
      throw new IllegalArgumentException("a detected feature needs both a moat and a rampart");
    }
  }

  public static RampartMoatFeature absent() {
    return ABSENT;
  }
}
