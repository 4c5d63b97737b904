package com.shelfedge.detector.detection;

/** Side of point B on which the rampart maximum is searched for. */
public enum RampartSearchDirection {
  /** Toward the ocean, opposite to the moat search. */
  SEAWARD,
  /** Toward the ice shelf, the same side as the moat search. */
  LANDWARD
}
