package com.shelfedge.detector.detection;

import com.shelfedge.detector.correction.CorrectedSample;

/**
 * Ocean-to-ice-shelf jump located on a profile.
 *
 * <p>When {@code found} is false every other component is {@code null}, except
 * {@code alongTrackGap} for a scan stopped on a too-wide jump.
 *
 * @param found whether a crossing was located
 * @param pointA seaward (ocean) sample of the jump
 * @param pointB landward (ice-shelf) sample of the jump
 * @param heightJump absolute height difference between B and A
 * @param alongTrackGap absolute {@code x_atc} difference between B and A
 */
public record FrontCrossing(
    boolean found,
    CorrectedSample pointA,
    CorrectedSample pointB,
    Double heightJump,
    Double alongTrackGap) {

  private static final FrontCrossing NOT_FOUND = new FrontCrossing(false, null, null, null, null);

  public static FrontCrossing notFound() {
    return NOT_FOUND;
  }

  static FrontCrossing rejectedGap(double gap) {
    return new FrontCrossing(false, null, null, null, gap);
  }

  static FrontCrossing at(CorrectedSample pointA, CorrectedSample pointB, double heightJump, double gap) {
    return new FrontCrossing(true, pointA, pointB, heightJump, gap);
  }
}
