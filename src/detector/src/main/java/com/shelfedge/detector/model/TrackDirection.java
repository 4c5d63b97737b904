package com.shelfedge.detector.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Acquisition direction of a ground-track profile.
 *
 * <p>Tracks cross the shelf edge from the ocean. Descending passes record the seaward end first,
 * ascending passes record it last, so the direction decides which way "landward" points in the
 * physical sample order.
 */
public enum TrackDirection {
  ASCENDING("A", 1),
  DESCENDING("D", 2),
  UNKNOWN("", 0);

  private final String code;
  private final int trackNode;

  TrackDirection(String code, int trackNode) {
    this.code = code;
    this.trackNode = trackNode;
  }

  @JsonValue
  public String code() {
    return code;
  }

  /** Numeric classifier used for aggregation: 1 ascending, 2 descending, 0 unknown. */
  public int trackNode() {
    return trackNode;
  }

  public boolean isKnown() {
    return this != UNKNOWN;
  }

  /**
   * Physical index increment that moves one sample landward.
   *
   * @return {@code +1} for descending, {@code -1} for ascending
   * @throws IllegalStateException for {@link #UNKNOWN}
   */
  public int landwardStep() {
    return switch (this) {
      case DESCENDING -> 1;
      case ASCENDING -> -1;
      default -> throw new IllegalStateException("No landward step for an unknown track direction");
    };
  }

  /**
   * Parses the direction code of the upstream product ({@code A}/{@code D}, case-insensitive).
   *
   * @param raw raw direction value
   * @return parsed direction, {@link #UNKNOWN} when blank or unrecognized
   */
  @JsonCreator
  public static TrackDirection fromCode(String raw) {
    if (raw == null || raw.isBlank()) {
      return UNKNOWN;
    }
    return switch (raw.trim().toUpperCase(Locale.ROOT)) {
      case "A", "ASCENDING" -> ASCENDING;
      case "D", "DESCENDING" -> DESCENDING;
      default -> UNKNOWN;
    };
  }
}
