package com.shelfedge.detector.correction;

import com.shelfedge.detector.model.GroundTrackProfile;
import com.shelfedge.detector.model.Sample;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts cleaned elevations to height above the instantaneous sea surface.
 *
 * <p>{@code h_ss = h_li - geoid_h - tide_ocean - dac - mdt}, then values outside
 * {@code [low, high]} are rejected as outliers.
 */
public class HeightCorrector {
  private final double meanDynamicTopography;
  private final double low;
  private final double high;

  /**
   * @param meanDynamicTopography constant MDT offset in metres
   * @param low lowest accepted corrected height (inclusive)
   * @param high highest accepted corrected height (inclusive)
   */
  public HeightCorrector(double meanDynamicTopography, double low, double high) {
    if (low > high) {
      throw new IllegalArgumentException("h_ss interval is inverted: [" + low + ", " + high + "]");
    }
    this.meanDynamicTopography = meanDynamicTopography;
    this.low = low;
    this.high = high;
  }

  public CorrectedProfile correct(CleanedProfile cleaned) {
    GroundTrackProfile profile = cleaned.profile();
    List<Sample> samples = profile.samples();
    List<CorrectedSample> corrected = new ArrayList<>(samples.size());
    double origin = samples.isEmpty() ? 0.0 : samples.get(0).xAtc();
    for (int i = 0; i < samples.size(); i++) {
      Sample sample = samples.get(i);
      double distance = sample.xAtc() - origin;
      HeightStatus status = cleaned.status(i);
      Double height = null;
      if (status.isValid()) {
        Double value = seaSurfaceHeight(sample);
        if (value == null) {
          status = HeightStatus.MISSING;
        } else if (value < low || value > high) {
          status = HeightStatus.OUT_OF_RANGE;
        } else {
          height = value;
        }
      }
      corrected.add(new CorrectedSample(i, sample, distance, height, status));
    }
    return new CorrectedProfile(profile, corrected);
  }

  private Double seaSurfaceHeight(Sample sample) {
    if (sample.geoidH() == null || sample.tideOcean() == null || sample.dac() == null) {
      return null;
    }
    double value = sample.hLi() - sample.geoidH() - sample.tideOcean() - sample.dac() - meanDynamicTopography;
    return Double.isFinite(value) ? value : null;
  }
}
