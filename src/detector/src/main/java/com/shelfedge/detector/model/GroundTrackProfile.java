package com.shelfedge.detector.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Samples of one beam for one satellite pass, in acquisition order, plus pass metadata.
 *
 * <p>The direction is fixed for the whole profile and decides which end of {@link #samples()} is
 * seaward.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GroundTrackProfile(
  @JsonProperty("file") String file,
  @JsonProperty("beam") String beam,
  @JsonProperty("beam_type") BeamStrength beamType,
  @JsonProperty("cycle") Integer cycle,
  @JsonProperty("track") String track,
  @JsonProperty("region") String region,
  @JsonProperty("direction") TrackDirection direction,
  @JsonProperty("samples") List<Sample> samples
) {
  public GroundTrackProfile {
    beamType = beamType == null ? BeamStrength.UNKNOWN : beamType;
    direction = direction == null ? TrackDirection.UNKNOWN : direction;
    samples = samples == null ? List.of() : List.copyOf(samples);
  }

  public int size() {
    return samples.size();
  }

  /**
   * Short identity used in log lines and error reports.
   *
   * @return {@code file/beam/cycle}
   */
  public String describe() {
    return (file == null ? "?" : file) + "/" + (beam == null ? "?" : beam) + "/c" + (cycle == null ? "?" : cycle);
  }
}
