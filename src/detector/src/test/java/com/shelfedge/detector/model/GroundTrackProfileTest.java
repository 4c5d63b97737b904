package com.shelfedge.detector.model;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class GroundTrackProfileTest {
  private final ObjectMapper objectMapper = new ObjectMapper();

  @Test
  void parsesSnakeCasePayloadAndIgnoresUnknownFields() throws Exception {
    String payload = """
        {
          "file": "ATL06_20190315_11830211_003_01.h5",
          "beam": "gt2r",
          "beam_type": "weak",
          "cycle": 2,
          "track": "1183",
          "region": "11",
          "direction": "A",
          "product": "ATL06",
          "samples": [
            {
              "x": -231000.5,
              "y": -1245000.25,
              "lat": -78.41,
              "lon": -172.3,
              "x_atc": 27345671.2,
              "h_li": -48.7,
              "geoid_h": -55.1,
              "tide_ocean": 0.35,
              "dac": -0.02,
              "mask": 0,
              "atl06_quality_summary": 0,
              "delta_time": 37895123.5,
              "y_atc": 3200.1
            },
            {
              "x_atc": 27345691.2,
              "h_li": null,
              "mask": 2,
              "atl06_quality_summary": 1,
              "delta_time": 37895123.503
            }
          ]
        }
        """;

    GroundTrackProfile profile = objectMapper.readValue(payload, GroundTrackProfile.class);

    assertThat(profile.beam()).isEqualTo("gt2r");
    assertThat(profile.beamType()).isEqualTo(BeamStrength.WEAK);
    assertThat(profile.cycle()).isEqualTo(2);
    assertThat(profile.direction()).isEqualTo(TrackDirection.ASCENDING);
    assertThat(profile.size()).isEqualTo(2);

    Sample first = profile.samples().get(0);
    assertThat(first.xAtc()).isEqualTo(27345671.2);
    assertThat(first.hLi()).isEqualTo(-48.7);
    assertThat(first.geoidH()).isEqualTo(-55.1);
    assertThat(first.mask()).isEqualTo(SurfaceMask.OCEAN);
    assertThat(first.hasQualityProblem()).isFalse();

    Sample second = profile.samples().get(1);
    assertThat(second.hLi()).isNull();
    assertThat(second.geoidH()).isNull();
    assertThat(second.mask()).isEqualTo(SurfaceMask.ICE_SHELF);
    assertThat(second.hasQualityProblem()).isTrue();
  }

  @Test
  void unrecognizedDirectionAndMaskFallBackToUnknown() throws Exception {
    String payload = """
        {"beam": "gt1l", "direction": "X", "samples": [{"x_atc": 1.0, "mask": 7}]}
        """;

    GroundTrackProfile profile = objectMapper.readValue(payload, GroundTrackProfile.class);

    assertThat(profile.direction()).isEqualTo(TrackDirection.UNKNOWN);
    assertThat(profile.direction().trackNode()).isZero();
    assertThat(profile.samples().get(0).mask()).isEqualTo(SurfaceMask.UNKNOWN);
  }

  @Test
  void missingDirectionAndSamplesDefaultToEmptyUnknownProfile() throws Exception {
    GroundTrackProfile profile = objectMapper.readValue("{\"beam\": \"gt3r\"}", GroundTrackProfile.class);

    assertThat(profile.direction()).isEqualTo(TrackDirection.UNKNOWN);
    assertThat(profile.samples()).isEmpty();
    assertThat(profile.describe()).isEqualTo("?/gt3r/c?");
  }

  @Test
  void transitionBeamTypeIsKeptCaseInsensitively() throws Exception {
    String payload = """
        {"beam": "gt1r", "beam_type": "Transition", "direction": "D", "samples": []}
        """;

    GroundTrackProfile profile = objectMapper.readValue(payload, GroundTrackProfile.class);

    assertThat(profile.beamType()).isEqualTo(BeamStrength.TRANSITION);
    assertThat(objectMapper.writeValueAsString(profile.beamType())).isEqualTo("\"transition\"");
  }
}
