package com.shelfedge.detector.correction;

import com.shelfedge.detector.model.GroundTrackProfile;
import com.shelfedge.detector.model.TrackDirection;
import java.util.List;

/** Corrected samples of one profile, index-aligned with the raw samples. */
public record CorrectedProfile(GroundTrackProfile profile, List<CorrectedSample> samples) {
  public CorrectedProfile {
    samples = List.copyOf(samples);
  }

  public TrackDirection direction() {
    return profile.direction();
  }

  public int size() {
    return samples.size();
  }

  public boolean contains(int index) {
    return index >= 0 && index < samples.size();
  }

  public CorrectedSample sample(int index) {
    return samples.get(index);
  }

  public long validCount() {
    return samples.stream().filter(CorrectedSample::isValid).count();
  }
}
