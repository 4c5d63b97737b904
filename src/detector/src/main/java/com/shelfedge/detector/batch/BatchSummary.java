package com.shelfedge.detector.batch;

import com.shelfedge.detector.pipeline.ProfileResult;
import java.util.List;

/** Per-run counts reported once a batch completes. */
public record BatchSummary(int profiles, int frontsFound, int featuresFound, int failed) {

  public static BatchSummary of(List<ProfileResult> results) {
    int fronts = 0;
    int features = 0;
    int failed = 0;
    for (ProfileResult result : results) {
      if (result.hasError()) {
        failed++;
      }
      if (result.found()) {
        fronts++;
      }
      if (result.rmFlag()) {
        features++;
      }
    }
    return new BatchSummary(results.size(), fronts, features, failed);
  }
}
