package com.shelfedge.detector.pipeline;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.shelfedge.detector.model.BeamStrength;
import com.shelfedge.detector.model.GroundTrackProfile;

/**
 * Output record for one ground-track profile.
 *
 * <p>Absent values are omitted from the JSON form. {@code error} is only set when processing of
 * the profile failed; detection fields are then absent.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({
  "file", "beam", "beam_type", "cycle_number", "track", "region", "track_node",
  "found", "h_diff", "x_gap", "point_a", "point_b",
  "rm_flag", "moat", "rampart", "dh_rm", "dx_rm", "time_rm", "error"
})
public record ProfileResult(
  @JsonProperty("file") String file,
  @JsonProperty("beam") String beam,
  @JsonProperty("beam_type") BeamStrength beamType,
  @JsonProperty("cycle_number") Integer cycleNumber,
  @JsonProperty("track") String track,
  @JsonProperty("region") String region,
  @JsonProperty("track_node") int trackNode,
  @JsonProperty("found") boolean found,
  @JsonProperty("h_diff") Double hDiff,
  @JsonProperty("x_gap") Double xGap,
  @JsonProperty("point_a") PointRecord pointA,
  @JsonProperty("point_b") PointRecord pointB,
  @JsonProperty("rm_flag") boolean rmFlag,
  @JsonProperty("moat") PointRecord moat,
  @JsonProperty("rampart") PointRecord rampart,
  @JsonProperty("dh_rm") Double dhRm,
  @JsonProperty("dx_rm") Double dxRm,
  @JsonProperty("time_rm") String timeRm,
  @JsonProperty("error") String error
) {
  /**
   * Builds the record reported for a profile whose processing threw.
   *
   * @param profile failed profile
   * @param error failure description
   * @return record carrying only identity and error
   */
  public static ProfileResult failed(GroundTrackProfile profile, String error) {
    return new ProfileResult(
        profile.file(),
        profile.beam(),
        profile.beamType(),
        profile.cycle(),
        profile.track(),
        profile.region(),
        profile.direction().trackNode(),
        false,
        null,
        null,
        null,
        null,
        false,
        null,
        null,
        null,
        null,
        null,
        error == null ? "unknown error" : error);
  }

  public boolean hasError() {
    return error != null;
  }
}
