package com.shelfedge.detector.pipeline;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.shelfedge.detector.correction.CorrectedSample;
import com.shelfedge.detector.detection.AcquisitionClock;
import com.shelfedge.detector.model.Sample;

/** Output view of one referenced sample (front point, moat or rampart). */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PointRecord(
  @JsonProperty("index") int index,
  @JsonProperty("h") Double h,
  @JsonProperty("x_dist") double xDist,
  @JsonProperty("x_atc") double xAtc,
  @JsonProperty("x") double x,
  @JsonProperty("y") double y,
  @JsonProperty("lat") double lat,
  @JsonProperty("lon") double lon,
  @JsonProperty("delta_time") double deltaTime,
  @JsonProperty("time") String time
) {
  static PointRecord of(CorrectedSample corrected, AcquisitionClock clock) {
    if (corrected == null) {
      return null;
    }
    Sample sample = corrected.sample();
    return new PointRecord(
        corrected.index(),
        corrected.height(),
        corrected.alongTrackDistance(),
        sample.xAtc(),
        sample.x(),
        sample.y(),
        sample.lat(),
        sample.lon(),
        sample.deltaTime(),
        clock.at(sample.deltaTime()).toString());
  }
}
