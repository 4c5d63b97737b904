package com.shelfedge.detector.detection;

/**
 * Thresholds a pair of adjacent valid samples must meet to count as the ice-front jump.
 *
 * @param oceanHeightUpperLimit seaward sample must be strictly below this height
 * @param heightJumpLowerLimit jump must be strictly greater than this
 * @param heightJumpUpperLimit jump must be strictly smaller than this
 * @param gapUpperLimit along-track gap between the two samples must be strictly smaller than this
 * @param stopOnRejectedGap end the scan at the first pair meeting the height criteria even when
 *     its gap is too wide
 */
public record FrontCriteria(
    double oceanHeightUpperLimit,
    double heightJumpLowerLimit,
    double heightJumpUpperLimit,
    double gapUpperLimit,
    boolean stopOnRejectedGap) {

  public FrontCriteria {
    if (heightJumpLowerLimit >= heightJumpUpperLimit) {
      throw new IllegalArgumentException("h_diff limits are inverted: ("
          + heightJumpLowerLimit + ", " + heightJumpUpperLimit + ")");
    }
    if (gapUpperLimit <= 0) {
      throw new IllegalArgumentException("jump_x_dist_upper_limit must be > 0");
    }
  }

  public static FrontCriteria defaults() {
    return new FrontCriteria(2.0, 10.0, 100.0, 80.0, false);
  }
}
