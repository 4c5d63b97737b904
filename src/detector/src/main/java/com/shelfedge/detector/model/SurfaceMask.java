package com.shelfedge.detector.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Background-mask classification attached to each sample by the upstream mask lookup.
 *
 * <p>Serialized as its integer code (ocean=0, grounded ice=1, ice shelf=2).
 */
public enum SurfaceMask {
  OCEAN(0),
  GROUNDED_ICE(1),
  ICE_SHELF(2),
  UNKNOWN(-1);

  private final int code;

  SurfaceMask(int code) {
    this.code = code;
  }

  @JsonValue
  public int code() {
    return code;
  }

  /**
   * Resolves a mask code, mapping anything unrecognized to {@link #UNKNOWN}.
   *
   * @param code integer mask value
   * @return matching classification
   */
  @JsonCreator
  public static SurfaceMask fromCode(Integer code) {
    if (code == null) {
      return UNKNOWN;
    }
    for (SurfaceMask mask : values()) {
      if (mask.code == code) {
        return mask;
      }
    }
    return UNKNOWN;
  }
}
