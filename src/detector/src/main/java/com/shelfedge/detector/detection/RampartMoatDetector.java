package com.shelfedge.detector.detection;

import com.shelfedge.detector.correction.CorrectedProfile;
import com.shelfedge.detector.correction.CorrectedSample;
import java.util.OptionalInt;
import java.util.function.IntFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Searches the neighbourhood of a front crossing for a rampart-moat structure.
 *
 * <p>Both phases start at point B and walk the physical sample order:
 * <ul>
 *   <li>moat: landward while each valid sample is a new strict minimum above the floor; the first
 *       sample that is not ends the phase, so only the first depression is measured even if a
 *       deeper one follows after a rise</li>
 *   <li>rampart: the whole rampart window, keeping the highest valid sample; B itself is the
 *       default</li>
 * </ul>
 * A step is only evaluated while its along-track distance from B is below the window distance.
 * Leaving the profile ends a phase as if its window were exhausted.
 */
public class RampartMoatDetector {
  private static final Logger log = LoggerFactory.getLogger(RampartMoatDetector.class);

  private final RampartMoatCriteria criteria;

  public RampartMoatDetector(RampartMoatCriteria criteria) {
    this.criteria = criteria;
  }

  public RampartMoatFeature detect(CorrectedProfile profile, FrontCrossing crossing) {
    if (!crossing.found() || !profile.direction().isKnown()) {
      return RampartMoatFeature.absent();
    }
    DirectionalView view = DirectionalView.of(profile);
    CorrectedSample pointB = crossing.pointB();

    CorrectedSample moat = findMoat(view, pointB);
    if (moat == null) {
      return RampartMoatFeature.absent();
    }

    IntFunction<OptionalInt> rampartWalk = criteria.rampartDirection() == RampartSearchDirection.SEAWARD
        ? steps -> view.seawardOf(pointB.index(), steps)
        : steps -> view.landwardOf(pointB.index(), steps);
    CorrectedSample rampart = findRampart(view, pointB, rampartWalk);
    return new RampartMoatFeature(true, moat, rampart);
  }

  private CorrectedSample findMoat(DirectionalView view, CorrectedSample pointB) {
    CorrectedSample lowest = pointB;
    for (int j = 1; j <= criteria.moatWindowSteps(); j++) {
      OptionalInt index = view.landwardOf(pointB.index(), j);
      if (index.isEmpty()) {
        log.debug("Short beam: moat window left profile {} after {} steps",
            view.profile().profile().describe(), j - 1);
        break;
      }
      CorrectedSample candidate = view.profile().sample(index.getAsInt());
      if (!withinWindow(pointB, candidate, criteria.moatSearchDistance()) || !candidate.isValid()) {
        continue;
      }
      double height = candidate.validHeight();
      if (height < lowest.validHeight() && height > criteria.moatHeightLowerLimit()) {
        lowest = candidate;
      } else {
        break;
      }
    }
    return lowest == pointB ? null : lowest;
  }

  private CorrectedSample findRampart(
      DirectionalView view, CorrectedSample pointB, IntFunction<OptionalInt> walk) {
    CorrectedSample highest = pointB;
    for (int j = 1; j <= criteria.rampartWindowSteps(); j++) {
      OptionalInt index = walk.apply(j);
      if (index.isEmpty()) {
        break;
      }
      CorrectedSample candidate = view.profile().sample(index.getAsInt());
      if (!withinWindow(pointB, candidate, criteria.rampartSearchDistance()) || !candidate.isValid()) {
        continue;
      }
      if (candidate.validHeight() > highest.validHeight()) {
        highest = candidate;
      }
    }
    return highest;
  }

  private static boolean withinWindow(CorrectedSample anchor, CorrectedSample candidate, double distance) {
    return Math.abs(anchor.alongTrackDistance() - candidate.alongTrackDistance()) < distance;
  }
}
