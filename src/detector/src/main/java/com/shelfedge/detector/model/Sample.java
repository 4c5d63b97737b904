package com.shelfedge.detector.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One along-track land-ice segment as delivered by the upstream parsing stage.
 *
 * <p>Elevation and correction inputs are nullable: the upstream product carries fill values for
 * segments without a usable measurement. Unknown JSON attributes are ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Sample(
  @JsonProperty("x") double x,
  @JsonProperty("y") double y,
  @JsonProperty("lat") double lat,
  @JsonProperty("lon") double lon,
  @JsonProperty("x_atc") double xAtc,
  @JsonProperty("h_li") Double hLi,
  @JsonProperty("geoid_h") Double geoidH,
  @JsonProperty("tide_ocean") Double tideOcean,
  @JsonProperty("dac") Double dac,
  @JsonProperty("mask") SurfaceMask mask,
  @JsonProperty("atl06_quality_summary") int qualitySummary,
  @JsonProperty("delta_time") double deltaTime
) {
  /** Quality-summary value that marks a potential data-quality problem. */
  public static final int QUALITY_PROBLEM = 1;

  public Sample {
    if (mask == null) {
      mask = SurfaceMask.UNKNOWN;
    }
  }

  public boolean hasQualityProblem() {
    return qualitySummary == QUALITY_PROBLEM;
  }
}
