package com.shelfedge.detector.correction;

import com.shelfedge.detector.model.GroundTrackProfile;
import java.util.List;

/**
 * A profile paired with the per-sample elevation status decided by {@link ProfileCleaner}.
 *
 * <p>{@code statuses} is index-aligned with {@code profile.samples()}.
 */
public record CleanedProfile(GroundTrackProfile profile, List<HeightStatus> statuses) {
  public CleanedProfile {
    statuses = List.copyOf(statuses);
    if (statuses.size() != profile.size()) {
      throw new IllegalArgumentException(
          "status count " + statuses.size() + " does not match sample count " + profile.size());
    }
  }

  public HeightStatus status(int index) {
    return statuses.get(index);
  }
}
