package com.shelfedge.detector.config;

import com.shelfedge.detector.detection.RampartSearchDirection;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Typed configuration for the detector service.
 *
 * <p>Values are bound from {@code application.yml} and environment variables under the
 * {@code detector.*} prefix. Defaults are the thresholds assessed for the Ross Ice Shelf.
 */
@ConfigurationProperties(prefix = "detector")
public class DetectorProperties {
  private final Correction correction = new Correction();
  private final Front front = new Front();
  private final RampartMoat rampartMoat = new RampartMoat();
  private final Batch batch = new Batch();
  private double stepSize = 20.0;
  private String refTime = "2018-01-01T00:00:00Z";

  public Correction getCorrection() {
    return correction;
  }

  public Front getFront() {
    return front;
  }

  public RampartMoat getRampartMoat() {
    return rampartMoat;
  }

  public Batch getBatch() {
    return batch;
  }

  public double getStepSize() {
    return stepSize;
  }

  public void setStepSize(double stepSize) {
    this.stepSize = stepSize;
  }

  public String getRefTime() {
    return refTime;
  }

  public void setRefTime(String refTime) {
    this.refTime = refTime;
  }

  /** Sea-surface height corrections and outlier bounds. */
  public static class Correction {
    private double mdt = -1.4;
    private double hSsLow = -5.0;
    private double hSsHigh = 100.0;

    public double getMdt() {
      return mdt;
    }

    public void setMdt(double mdt) {
      this.mdt = mdt;
    }

    public double getHSsLow() {
      return hSsLow;
    }

    public void setHSsLow(double hSsLow) {
      this.hSsLow = hSsLow;
    }

    public double getHSsHigh() {
      return hSsHigh;
    }

    public void setHSsHigh(double hSsHigh) {
      this.hSsHigh = hSsHigh;
    }
  }

  /** Criteria a jump must satisfy to be taken as the ice front. */
  public static class Front {
    private double hAUpperLimit = 2.0;
    private double hDiffLowerLimit = 10.0;
    private double hDiffUpperLimit = 100.0;
    private double jumpXDistUpperLimit = 80.0;
    private boolean stopOnRejectedGap = false;

    public double getHAUpperLimit() {
      return hAUpperLimit;
    }

    public void setHAUpperLimit(double hAUpperLimit) {
      this.hAUpperLimit = hAUpperLimit;
    }

    public double getHDiffLowerLimit() {
      return hDiffLowerLimit;
    }

    public void setHDiffLowerLimit(double hDiffLowerLimit) {
      this.hDiffLowerLimit = hDiffLowerLimit;
    }

    public double getHDiffUpperLimit() {
      return hDiffUpperLimit;
    }

    public void setHDiffUpperLimit(double hDiffUpperLimit) {
      this.hDiffUpperLimit = hDiffUpperLimit;
    }

    public double getJumpXDistUpperLimit() {
      return jumpXDistUpperLimit;
    }

    public void setJumpXDistUpperLimit(double jumpXDistUpperLimit) {
      this.jumpXDistUpperLimit = jumpXDistUpperLimit;
    }

    public boolean isStopOnRejectedGap() {
      return stopOnRejectedGap;
    }

    public void setStopOnRejectedGap(boolean stopOnRejectedGap) {
      this.stopOnRejectedGap = stopOnRejectedGap;
    }
  }

  /** Window sizes and floor of the rampart-moat search. */
  public static class RampartMoat {
    private double moatHLowerLimit = 2.0;
    private double moatSearchDist = 2000.0;
    private double rampartMaxSearchDist = 100.0;
    private RampartSearchDirection rampartSearchDirection = RampartSearchDirection.SEAWARD;

    public double getMoatHLowerLimit() {
      return moatHLowerLimit;
    }

    public void setMoatHLowerLimit(double moatHLowerLimit) {
      this.moatHLowerLimit = moatHLowerLimit;
    }

    public double getMoatSearchDist() {
      return moatSearchDist;
    }

    public void setMoatSearchDist(double moatSearchDist) {
      this.moatSearchDist = moatSearchDist;
    }

    public double getRampartMaxSearchDist() {
      return rampartMaxSearchDist;
    }

    public void setRampartMaxSearchDist(double rampartMaxSearchDist) {
      this.rampartMaxSearchDist = rampartMaxSearchDist;
    }

    public RampartSearchDirection getRampartSearchDirection() {
      return rampartSearchDirection;
    }

    public void setRampartSearchDirection(RampartSearchDirection rampartSearchDirection) {
      this.rampartSearchDirection = rampartSearchDirection;
    }
  }

  /** Input/output locations and worker pool of the batch run. */
  public static class Batch {
    private boolean enabled = true;
    private String input = "";
    private String output = "";
    private int parallelism = 0;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getInput() {
      return input;
    }

    public void setInput(String input) {
      this.input = input;
    }

    public String getOutput() {
      return output;
    }

    public void setOutput(String output) {
      this.output = output;
    }

    public int getParallelism() {
      return parallelism;
    }

    public void setParallelism(int parallelism) {
      this.parallelism = parallelism;
    }
  }
}
