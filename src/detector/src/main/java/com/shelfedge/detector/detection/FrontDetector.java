package com.shelfedge.detector.detection;

import com.shelfedge.detector.correction.CorrectedProfile;
import com.shelfedge.detector.correction.CorrectedSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds where a profile steps up from open ocean onto the ice shelf.
 *
 * <p>Adjacent valid samples are scanned from the seaward end. The first pair whose seaward height
 * is low, whose height jump lies inside the configured bounds and whose along-track gap is short
 * is the crossing; later pairs are never considered.
 */
public class FrontDetector {
  private static final Logger log = LoggerFactory.getLogger(FrontDetector.class);

  private final FrontCriteria criteria;

  public FrontDetector(FrontCriteria criteria) {
    this.criteria = criteria;
  }

  public FrontCrossing detect(CorrectedProfile profile) {
    if (!profile.direction().isKnown()) {
      log.debug("Skipping front detection for {}: unknown direction", profile.profile().describe());
      return FrontCrossing.notFound();
    }
    DirectionalView view = DirectionalView.of(profile);
    if (view.size() < 2) {
      log.debug("Skipping front detection for {}: {} valid samples", profile.profile().describe(), view.size());
      return FrontCrossing.notFound();
    }

    for (int j = 0; j < view.size() - 1; j++) {
      double oceanHeight = view.height(j);
      double jump = Math.abs(view.height(j + 1) - oceanHeight);
      if (oceanHeight >= criteria.oceanHeightUpperLimit()
          || jump <= criteria.heightJumpLowerLimit()
          || jump >= criteria.heightJumpUpperLimit()) {
        continue;
      }

      CorrectedSample ocean = view.sample(j);
      CorrectedSample shelf = view.sample(j + 1);
      double gap = Math.abs(shelf.sample().xAtc() - ocean.sample().xAtc());
      if (gap < criteria.gapUpperLimit()) {
        return FrontCrossing.at(ocean, shelf, jump, gap);
      }
      if (criteria.stopOnRejectedGap()) {
        log.debug("Front jump at index {} rejected: gap {} m", ocean.index(), gap);
        return FrontCrossing.rejectedGap(gap);
      }
    }
    return FrontCrossing.notFound();
  }
}
