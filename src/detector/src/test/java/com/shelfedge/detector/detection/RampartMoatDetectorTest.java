package com.shelfedge.detector.detection;

import static org.assertj.core.api.Assertions.assertThat;

import com.shelfedge.detector.ProfileFixtures;
import com.shelfedge.detector.correction.CorrectedProfile;
import com.shelfedge.detector.model.Sample;
import com.shelfedge.detector.model.TrackDirection;
import java.util.List;
import org.junit.jupiter.api.Test;

class RampartMoatDetectorTest {
  private final FrontDetector frontDetector = new FrontDetector(FrontCriteria.defaults());
  private final RampartMoatDetector detector = new RampartMoatDetector(RampartMoatCriteria.defaults());

  private RampartMoatFeature detect(RampartMoatDetector rmDetector, CorrectedProfile profile) {
    FrontCrossing crossing = frontDetector.detect(profile);
    assertThat(crossing.found()).isTrue();
    return rmDetector.detect(profile, crossing);
  }

  @Test
  void defaultWindowsCoverExpectedStepCounts() {
    RampartMoatCriteria criteria = RampartMoatCriteria.defaults();

    assertThat(criteria.moatWindowSteps()).isEqualTo(101);
    assertThat(criteria.rampartWindowSteps()).isEqualTo(6);
  }

  @Test
  void moatIsFirstDepressionAndRampartDefaultsToPointB() {
    CorrectedProfile profile = ProfileFixtures.corrected(
        TrackDirection.DESCENDING, 0.3, 0.5, 50.5, 45.0, 30.0, 10.0, 35.0, 36.0);

    RampartMoatFeature feature = detect(detector, profile);

    assertThat(feature.rmFlag()).isTrue();
    assertThat(feature.moat().index()).isEqualTo(5);
    assertThat(feature.moat().validHeight()).isEqualTo(10.0);
    assertThat(feature.rampart().index()).isEqualTo(2);
    assertThat(feature.rampart().validHeight()).isEqualTo(50.5);
  }

  @Test
  void moatSearchStopsAtFirstRiseEvenIfDeeperPointFollows() {
    RampartMoatFeature feature = detect(detector,
        ProfileFixtures.corrected(TrackDirection.DESCENDING, 0.5, 50.5, 40.0, 45.0, 5.0));

    assertThat(feature.moat().index()).isEqualTo(2);
    assertThat(feature.moat().validHeight()).isEqualTo(40.0);
  }

  @Test
  void moatNeverAdoptsHeightAtOrBelowFloor() {
    RampartMoatFeature atFloor = detect(detector,
        ProfileFixtures.corrected(TrackDirection.DESCENDING, 0.5, 50.5, 2.0, 1.0));
    RampartMoatFeature belowFloor = detect(detector,
        ProfileFixtures.corrected(TrackDirection.DESCENDING, 0.5, 50.5, 30.0, 1.5, 0.8));

    assertThat(atFloor.rmFlag()).isFalse();
    assertThat(belowFloor.rmFlag()).isTrue();
    assertThat(belowFloor.moat().validHeight()).isEqualTo(30.0);
  }

  @Test
  void noMoatWhenFirstLandwardStepDoesNotDrop() {
    RampartMoatFeature feature = detect(detector,
        ProfileFixtures.corrected(TrackDirection.DESCENDING, 0.5, 50.5, 50.5, 20.0));

    assertThat(feature).isEqualTo(RampartMoatFeature.absent());
    assertThat(feature.moat()).isNull();
    assertThat(feature.rampart()).isNull();
  }

  @Test
  void shortBeamEndsMoatSearchWithAvailableSamples() {
    RampartMoatFeature feature = detect(detector,
        ProfileFixtures.corrected(TrackDirection.DESCENDING, 0.5, 50.5, 40.0, 30.0));

    assertThat(feature.rmFlag()).isTrue();
    assertThat(feature.moat().index()).isEqualTo(3);
  }

  @Test
  void pointBAtProfileEndGivesNoMoat() {
    RampartMoatFeature feature = detect(detector,
        ProfileFixtures.corrected(TrackDirection.DESCENDING, 0.2, 0.5, 50.5));

    assertThat(feature.rmFlag()).isFalse();
  }

  @Test
  void invalidSamplesInsideMoatWindowAreSkipped() {
    RampartMoatFeature feature = detect(detector,
        ProfileFixtures.corrected(TrackDirection.DESCENDING, 0.5, 50.5, Double.NaN, 40.0, 41.0));

    assertThat(feature.moat().index()).isEqualTo(3);
  }

  @Test
  void ascendingProfileSearchesTowardLowerIndices() {
    RampartMoatFeature feature = detect(detector,
        ProfileFixtures.corrected(TrackDirection.ASCENDING, 36.0, 35.0, 10.0, 30.0, 45.0, 50.5, 0.5, 0.3));

    assertThat(feature.rmFlag()).isTrue();
    assertThat(feature.moat().index()).isEqualTo(2);
    assertThat(feature.rampart().index()).isEqualTo(5);
  }

  @Test
  void seawardRampartSearchAdoptsHigherSampleBeyondPointA() {
    RampartMoatFeature feature = detect(detector,
        ProfileFixtures.corrected(TrackDirection.DESCENDING, 60.0, 0.5, 50.5, 40.0, 30.0, 35.0));

    assertThat(feature.moat().index()).isEqualTo(4);
    assertThat(feature.rampart().index()).isZero();
    assertThat(feature.rampart().validHeight()).isEqualTo(60.0);
  }

  @Test
  void landwardRampartSearchFindsHigherPointAfterTheDip() {
    RampartMoatDetector landward = new RampartMoatDetector(
        new RampartMoatCriteria(2.0, 2000.0, 100.0, 20.0, RampartSearchDirection.LANDWARD));

    RampartMoatFeature feature = detect(landward,
        ProfileFixtures.corrected(TrackDirection.DESCENDING, 0.5, 50.5, 45.0, 48.0, 55.0, 20.0));

    assertThat(feature.moat().index()).isEqualTo(2);
    assertThat(feature.moat().validHeight()).isEqualTo(45.0);
    assertThat(feature.rampart().index()).isEqualTo(4);
    assertThat(feature.rampart().validHeight()).isEqualTo(55.0);
  }

  @Test
  void rampartWindowExcludesSamplesAtOrBeyondSearchDistance() {
    RampartMoatDetector landward = new RampartMoatDetector(
        new RampartMoatCriteria(2.0, 2000.0, 100.0, 20.0, RampartSearchDirection.LANDWARD));

    // 70.0 sits exactly 100 m landward of point B.
    RampartMoatFeature feature = detect(landward,
        ProfileFixtures.corrected(TrackDirection.DESCENDING, 0.5, 50.5, 45.0, 48.0, 49.0, 50.0, 70.0));

    assertThat(feature.rampart().index()).isEqualTo(1);
  }

  @Test
  void moatWindowSkipsStepsBeyondSearchDistance() {
    RampartMoatDetector narrow = new RampartMoatDetector(
        new RampartMoatCriteria(2.0, 60.0, 100.0, 20.0, RampartSearchDirection.SEAWARD));
    List<Sample> samples = List.of(
        ProfileFixtures.sample(1000, 0.5, 1),
        ProfileFixtures.sample(1020, 50.5, 2),
        ProfileFixtures.sample(1040, 45.0, 3),
        ProfileFixtures.sample(1100, 30.0, 4),
        ProfileFixtures.sample(1060, 40.0, 5));

    RampartMoatFeature feature = detect(narrow,
        ProfileFixtures.correct(ProfileFixtures.profile(TrackDirection.DESCENDING, samples)));

    // 30.0 lies 80 m from B and is skipped; 40.0 continues the descent.
    assertThat(feature.moat().index()).isEqualTo(4);
    assertThat(feature.moat().validHeight()).isEqualTo(40.0);
  }

  @Test
  void notFoundCrossingYieldsAbsentFeature() {
    CorrectedProfile profile = ProfileFixtures.corrected(TrackDirection.DESCENDING, 10.0, 11.0);

    assertThat(detector.detect(profile, FrontCrossing.notFound())).isEqualTo(RampartMoatFeature.absent());
  }
}
