package com.shelfedge.detector.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Strong/weak classification of the beam a profile was recorded with. Granules acquired while the
 * spacecraft was changing orientation are labelled transition.
 */
public enum BeamStrength {
  STRONG("strong"),
  WEAK("weak"),
  TRANSITION("transition"),
  UNKNOWN("unknown");

  private final String label;

  BeamStrength(String label) {
    this.label = label;
  }

  @JsonValue
  public String label() {
    return label;
  }

  @JsonCreator
  public static BeamStrength fromLabel(String raw) {
    if (raw == null || raw.isBlank()) {
      return UNKNOWN;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "strong" -> STRONG;
      case "weak" -> WEAK;
      case "transition" -> TRANSITION;
      default -> UNKNOWN;
    };
  }
}
