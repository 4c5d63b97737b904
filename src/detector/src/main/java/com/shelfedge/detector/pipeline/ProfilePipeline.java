package com.shelfedge.detector.pipeline;

import com.shelfedge.detector.correction.CorrectedProfile;
import com.shelfedge.detector.correction.HeightCorrector;
import com.shelfedge.detector.correction.ProfileCleaner;
import com.shelfedge.detector.detection.AcquisitionClock;
import com.shelfedge.detector.detection.FeatureMetrics;
import com.shelfedge.detector.detection.FeatureMetricsCalculator;
import com.shelfedge.detector.detection.FrontCrossing;
import com.shelfedge.detector.detection.FrontDetector;
import com.shelfedge.detector.detection.RampartMoatDetector;
import com.shelfedge.detector.detection.RampartMoatFeature;
import com.shelfedge.detector.model.GroundTrackProfile;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs every detection phase over a single profile.
 *
 * <p>Stateless: one instance may process any number of profiles concurrently.
 */
public class ProfilePipeline {
  private static final Logger log = LoggerFactory.getLogger(ProfilePipeline.class);

  private final ProfileCleaner cleaner;
  private final HeightCorrector corrector;
  private final FrontDetector frontDetector;
  private final RampartMoatDetector rampartMoatDetector;
  private final FeatureMetricsCalculator metricsCalculator;
  private final AcquisitionClock clock;

  public ProfilePipeline(
      ProfileCleaner cleaner,
      HeightCorrector corrector,
      FrontDetector frontDetector,
      RampartMoatDetector rampartMoatDetector,
      FeatureMetricsCalculator metricsCalculator,
      AcquisitionClock clock) {
    this.cleaner = cleaner;
    this.corrector = corrector;
    this.frontDetector = frontDetector;
    this.rampartMoatDetector = rampartMoatDetector;
    this.metricsCalculator = metricsCalculator;
    this.clock = clock;
  }

  public ProfileResult process(GroundTrackProfile profile) {
    CorrectedProfile corrected = corrector.correct(cleaner.clean(profile));
    FrontCrossing crossing = frontDetector.detect(corrected);
    RampartMoatFeature feature = rampartMoatDetector.detect(corrected, crossing);
    Optional<FeatureMetrics> metrics = metricsCalculator.calculate(feature);

    log.debug("Profile {}: {} valid of {} samples, front={}, rm={}",
        profile.describe(), corrected.validCount(), corrected.size(), crossing.found(), feature.rmFlag());

    return new ProfileResult(
        profile.file(),
        profile.beam(),
        profile.beamType(),
        profile.cycle(),
        profile.track(),
        profile.region(),
        profile.direction().trackNode(),
        crossing.found(),
        crossing.heightJump(),
        crossing.alongTrackGap(),
        PointRecord.of(crossing.pointA(), clock),
        PointRecord.of(crossing.pointB(), clock),
        feature.rmFlag(),
        PointRecord.of(feature.moat(), clock),
        PointRecord.of(feature.rampart(), clock),
        metrics.map(FeatureMetrics::dh).orElse(null),
        metrics.map(FeatureMetrics::dx).orElse(null),
        metrics.map(m -> m.centerTime().toString()).orElse(null),
        null);
  }
}
