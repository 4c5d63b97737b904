package com.shelfedge.detector.detection;

import com.shelfedge.detector.correction.CorrectedProfile;
import com.shelfedge.detector.correction.CorrectedSample;
import com.shelfedge.detector.model.TrackDirection;
import java.util.OptionalInt;

/**
 * Seaward-to-landward view over the valid samples of a corrected profile.
 *
 * <p>Logical position 0 is the most seaward valid sample whatever the recording direction.
 * Ascending passes are read back to front, descending passes front to back. Physical stepping
 * from an anchor sample goes through {@link #landwardOf(int, int)} and {@link #seawardOf(int, int)},
 * which report the end of the profile as an empty result.
 */
public final class DirectionalView {
  private final CorrectedProfile profile;
  private final int landwardStep;
  private final int[] physicalIndices;

  private DirectionalView(CorrectedProfile profile, int landwardStep, int[] physicalIndices) {
    this.profile = profile;
    this.landwardStep = landwardStep;
    this.physicalIndices = physicalIndices;
  }

  /**
   * Builds the view for a profile with a known direction.
   *
   * @param profile corrected profile
   * @return view over its valid samples
   * @throws IllegalArgumentException when the profile direction is unknown
   */
  public static DirectionalView of(CorrectedProfile profile) {
    TrackDirection direction = profile.direction();
    if (!direction.isKnown()) {
      throw new IllegalArgumentException("cannot orient profile " + profile.profile().describe()
          + " without a track direction");
    }
    int step = direction.landwardStep();
    int[] indices = new int[(int) profile.validCount()];
    int next = 0;
    int start = step > 0 ? 0 : profile.size() - 1;
    for (int i = start; profile.contains(i); i += step) {
      if (profile.sample(i).isValid()) {
        indices[next++] = i;
      }
    }
    return new DirectionalView(profile, step, indices);
  }

  public CorrectedProfile profile() {
    return profile;
  }

  /** Number of valid samples. */
  public int size() {
    return physicalIndices.length;
  }

  public int physicalIndex(int logical) {
    return physicalIndices[logical];
  }

  public CorrectedSample sample(int logical) {
    return profile.sample(physicalIndices[logical]);
  }

  public double height(int logical) {
    return sample(logical).validHeight();
  }

  /** Physical index increment for one step toward the ice shelf. */
  public int landwardStep() {
    return landwardStep;
  }

  /**
   * Physical index {@code steps} samples landward of {@code anchor}, valid or not.
   *
   * @param anchor physical index to start from
   * @param steps number of physical steps
   * @return the index, or empty once the walk leaves the profile
   */
  public OptionalInt landwardOf(int anchor, int steps) {
    return offset(anchor, steps * landwardStep);
  }

  /** Seaward counterpart of {@link #landwardOf(int, int)}. */
  public OptionalInt seawardOf(int anchor, int steps) {
    return offset(anchor, -steps * landwardStep);
  }

  private OptionalInt offset(int anchor, int delta) {
    int index = anchor + delta;
    return profile.contains(index) ? OptionalInt.of(index) : OptionalInt.empty();
  }
}
