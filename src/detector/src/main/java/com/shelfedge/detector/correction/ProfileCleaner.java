package com.shelfedge.detector.correction;

import com.shelfedge.detector.model.GroundTrackProfile;
import com.shelfedge.detector.model.Sample;
import com.shelfedge.detector.model.SurfaceMask;
import java.util.ArrayList;
import java.util.List;

/**
 * Invalidates elevations over grounded ice and elevations with a quality warning.
 *
 * <p>No sample is removed: later phases step through the profile by physical index, so count and
 * order must stay exactly as recorded.
 */
public class ProfileCleaner {

  /**
   * Classifies every sample of the profile.
   *
   * @param profile raw profile
   * @return the same profile with one status per sample
   */
  public CleanedProfile clean(GroundTrackProfile profile) {
    List<HeightStatus> statuses = new ArrayList<>(profile.size());
    for (Sample sample : profile.samples()) {
      statuses.add(classify(sample));
    }
    return new CleanedProfile(profile, statuses);
  }

  private static HeightStatus classify(Sample sample) {
    if (sample.mask() == SurfaceMask.GROUNDED_ICE) {
      return HeightStatus.GROUNDED_ICE;
    }
    if (sample.hasQualityProblem()) {
      return HeightStatus.LOW_QUALITY;
    }
    if (sample.hLi() == null || !Double.isFinite(sample.hLi())) {
      return HeightStatus.MISSING;
    }
    return HeightStatus.VALID;
  }
}
