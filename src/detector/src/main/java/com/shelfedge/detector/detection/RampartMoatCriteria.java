package com.shelfedge.detector.detection;

/**
 * Window sizes and floor of the rampart-moat search.
 *
 * @param moatHeightLowerLimit moat candidates must be strictly above this height
 * @param moatSearchDistance along-track extent of the moat window from point B, in metres
 * @param rampartSearchDistance along-track extent of the rampart window from point B, in metres
 * @param stepSize uniform along-track sample spacing, in metres
 * @param rampartDirection side of point B the rampart window extends to
 */
public record RampartMoatCriteria(
    double moatHeightLowerLimit,
    double moatSearchDistance,
    double rampartSearchDistance,
    double stepSize,
    RampartSearchDirection rampartDirection) {

  public RampartMoatCriteria {
    if (stepSize <= 0) {
      throw new IllegalArgumentException("step size must be > 0");
    }
    if (moatSearchDistance <= 0 || rampartSearchDistance <= 0) {
      throw new IllegalArgumentException("search distances must be > 0");
    }
    if (rampartDirection == null) {
      rampartDirection = RampartSearchDirection.SEAWARD;
    }
  }

  public static RampartMoatCriteria defaults() {
    return new RampartMoatCriteria(2.0, 2000.0, 100.0, 20.0, RampartSearchDirection.SEAWARD);
  }

  /** Physical steps in the moat window. */
  public int moatWindowSteps() {
    return windowSteps(moatSearchDistance);
  }

  /** Physical steps in the rampart window. */
  public int rampartWindowSteps() {
    return windowSteps(rampartSearchDistance);
  }

  private int windowSteps(double distance) {
    return (int) Math.floor(distance / stepSize) + 1;
  }
}
